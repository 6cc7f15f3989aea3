package com.geekhub.collector.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Append-only record of one fetch attempt.
 */
@Entity
@Table(name = "fetch_history", indexes = {
    @Index(name = "idx_fetch_history_feed_fetched", columnList = "feed_id, fetched_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FetchHistory {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "feed_id", nullable = false)
    private Long feedId;

    @Column(name = "fetched_at", nullable = false)
    private LocalDateTime fetchedAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private FetchOutcome status;

    @Column(name = "duration_ms")
    private Long durationMs;

    @Column(name = "articles_found")
    private Integer articlesFound;

    @Column(name = "articles_new")
    private Integer articlesNew;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;
}
