package com.tradescan.backend.service;

import com.tradescan.backend.exception.NotFoundException;
import com.tradescan.backend.model.Notification;
import com.tradescan.backend.model.NotificationType;
import com.tradescan.backend.repository.NotificationRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.List;

@Service
@Slf4j
@RequiredArgsConstructor
public class NotificationService {

    private final NotificationRepository notificationRepository;
    private final Clock clock;

    /**
     * Best effort: a failed notification never fails the operation that raised it.
     */
    public void notify(NotificationType type, String title, String message, Long profileId, String symbol) {
        try {
            notificationRepository.save(Notification.builder()
                    .type(type)
                    .title(title)
                    .message(message)
                    .profileId(profileId)
                    .symbol(symbol)
                    .createdAt(clock.instant())
                    .build());
        } catch (Exception e) {
            log.warn("Failed to record notification {} '{}': {}", type, title, e.getMessage());
        }
    }

    @Transactional(readOnly = true)
    public List<Notification> list(boolean unreadOnly, int limit) {
        PageRequest page = PageRequest.of(0, Math.max(1, Math.min(limit, 500)));
        return unreadOnly
                ? notificationRepository.findByReadFalseOrderByCreatedAtDesc(page)
                : notificationRepository.findAllByOrderByCreatedAtDesc(page);
    }

    @Transactional
    public Notification markRead(Long id) {
        Notification notification = notificationRepository.findById(id)
                .orElseThrow(() -> new NotFoundException("Notification not found: " + id));
        notification.setRead(true);
        return notificationRepository.save(notification);
    }
}
