package com.geekhub.collector.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Structured feed log line shown in the crawler console of the UI.
 */
@Entity
@Table(name = "fetch_logs", indexes = {
    @Index(name = "idx_fetch_logs_feed_ts", columnList = "feed_id, logged_at"),
    @Index(name = "idx_fetch_logs_url_hash", columnList = "url_hash")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FetchLogEntry {

    private static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "feed_id", nullable = false)
    private Long feedId;

    @Column(name = "url_hash", length = 12)
    private String urlHash;

    @Column(name = "logged_at", nullable = false)
    private LocalDateTime timestamp;

    @Enumerated(EnumType.STRING)
    @Column(name = "level", nullable = false, length = 10)
    private LogLevel level;

    @Column(name = "status")
    private Integer status;

    @Column(name = "action", nullable = false, length = 20)
    private String action;

    @Column(name = "url", columnDefinition = "TEXT")
    private String url;

    @Column(name = "duration_ms")
    private Long durationMs;

    @Column(name = "message", columnDefinition = "TEXT")
    private String message;

    /**
     * {@code [timestamp] LEVEL [status] ACTION url (duration) - message}; absent parts are omitted.
     */
    public String format() {
        StringBuilder sb = new StringBuilder();
        sb.append('[').append(timestamp != null ? TIMESTAMP_FORMAT.format(timestamp) : "").append("] ");
        sb.append(level);
        if (status != null) {
            sb.append(" [").append(status).append(']');
        }
        sb.append(' ').append(action);
        if (url != null && !url.isBlank()) {
            sb.append(' ').append(url);
        }
        if (durationMs != null) {
            sb.append(" (").append(durationMs).append("ms)");
        }
        if (message != null && !message.isBlank()) {
            sb.append(" - ").append(message);
        }
        return sb.toString();
    }
}
