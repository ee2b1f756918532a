package com.tradescan.backend.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Entity
@Table(name = "market_data_cache", uniqueConstraints = {
        @UniqueConstraint(name = "uk_market_data_cache", columnNames = {"symbol", "data_type"})
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MarketDataCacheEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 32)
    private String symbol;

    @Enumerated(EnumType.STRING)
    @Column(name = "data_type", nullable = false, length = 16)
    private DataType dataType;

    @Column(nullable = false, length = 8000)
    private String payload;

    @Column(nullable = false)
    private Instant cachedAt;

    @Column(nullable = false)
    private Instant expiresAt;

    public enum DataType {
        FUNDAMENTALS,
        TECHNICALS
    }
}
