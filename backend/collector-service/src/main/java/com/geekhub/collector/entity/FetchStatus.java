package com.geekhub.collector.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Latest fetch state of a feed, one row per feed, upserted after every attempt.
 */
@Entity
@Table(name = "fetch_status", indexes = {
    @Index(name = "idx_fetch_status_next_fetch_at", columnList = "next_fetch_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FetchStatus {

    @Id
    @Column(name = "feed_id")
    private Long feedId;

    @Column(name = "last_fetch_at")
    private LocalDateTime lastFetchAt;

    @Column(name = "last_success_at")
    private LocalDateTime lastSuccessAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "last_fetch_status", length = 20)
    private FetchOutcome lastFetchStatus;

    @Column(name = "last_fetch_error", columnDefinition = "TEXT")
    private String lastFetchError;

    @Column(name = "last_fetch_duration_ms")
    private Long lastFetchDurationMs;

    @Column(name = "total_articles")
    @Builder.Default
    private Long totalArticles = 0L;

    @Column(name = "next_fetch_at")
    private LocalDateTime nextFetchAt;

    public boolean isDue(LocalDateTime now) {
        return nextFetchAt == null || !nextFetchAt.isAfter(now);
    }
}
