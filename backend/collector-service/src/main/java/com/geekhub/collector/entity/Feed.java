package com.geekhub.collector.entity;

import com.geekhub.collector.util.HashUtils;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDateTime;

/**
 * A subscription. Owned by the settings/UI layer; the pipeline only reads it.
 */
@Entity
@Table(name = "feeds", indexes = {
    @Index(name = "idx_feeds_url_hash", columnList = "url_hash"),
    @Index(name = "idx_feeds_is_active", columnList = "is_active")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Feed {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "title", nullable = false, length = 255)
    private String title;

    /**
     * Address as entered: rsshub://, a gateway https URL, namespace/route or any feed URL.
     */
    @Column(name = "url", nullable = false, columnDefinition = "TEXT")
    private String url;

    @Column(name = "url_hash", nullable = false, length = 12)
    private String urlHash;

    @Column(name = "description", columnDefinition = "TEXT")
    private String description;

    @Column(name = "site_url", columnDefinition = "TEXT")
    private String siteUrl;

    @Column(name = "favicon_url", columnDefinition = "TEXT")
    private String faviconUrl;

    @Column(name = "fetch_interval_minutes", nullable = false)
    @Builder.Default
    private Integer fetchIntervalMinutes = 60;

    @Column(name = "is_active", nullable = false)
    @Builder.Default
    private Boolean active = true;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    @PrePersist
    @PreUpdate
    void fillUrlHash() {
        if (urlHash == null || urlHash.isBlank()) {
            urlHash = HashUtils.urlHash(url);
        }
    }
}
