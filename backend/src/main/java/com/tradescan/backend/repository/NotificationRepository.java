package com.tradescan.backend.repository;

import com.tradescan.backend.model.Notification;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface NotificationRepository extends JpaRepository<Notification, Long> {

    List<Notification> findByReadFalseOrderByCreatedAtDesc(Pageable pageable);

    List<Notification> findAllByOrderByCreatedAtDesc(Pageable pageable);
}
