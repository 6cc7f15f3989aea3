package com.geekhub.collector.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * A feed item, identified within its feed by a content-addressed hash.
 *
 * The ingestion fields are written once. Full-text extraction and translation
 * only fill their own columns.
 */
@Entity
@Table(name = "articles",
    uniqueConstraints = @UniqueConstraint(name = "uk_articles_feed_hash", columnNames = {"feed_id", "hash"}),
    indexes = {
        @Index(name = "idx_articles_feed_id", columnList = "feed_id"),
        @Index(name = "idx_articles_published_at", columnList = "published_at")
    })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Article {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "feed_id", nullable = false)
    private Long feedId;

    @Column(name = "hash", nullable = false, length = 32)
    private String hash;

    @Column(name = "title", columnDefinition = "TEXT")
    private String title;

    @Column(name = "url", columnDefinition = "TEXT")
    private String url;

    @Column(name = "link", columnDefinition = "TEXT")
    private String link;

    @Column(name = "author", length = 255)
    private String author;

    @Column(name = "published_at")
    private LocalDateTime publishedAt;

    @Column(name = "content", columnDefinition = "TEXT")
    private String content;

    @Column(name = "content_text", columnDefinition = "TEXT")
    private String contentText;

    @Column(name = "summary", columnDefinition = "TEXT")
    private String summary;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "categories", columnDefinition = "jsonb")
    @Builder.Default
    private List<String> categories = new ArrayList<>();

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "tags", columnDefinition = "jsonb")
    @Builder.Default
    private List<String> tags = new ArrayList<>();

    @Column(name = "fetched_at", nullable = false)
    private LocalDateTime fetchedAt;

    // Full text recovered from the source page
    @Column(name = "full_content", columnDefinition = "TEXT")
    private String fullContent;

    @Column(name = "full_content_fetched_at")
    private LocalDateTime fullContentFetchedAt;

    // Translation
    @Column(name = "translated_title", columnDefinition = "TEXT")
    private String translatedTitle;

    @Column(name = "translated_summary", columnDefinition = "TEXT")
    private String translatedSummary;

    @Column(name = "translated_at")
    private LocalDateTime translatedAt;

    @Column(name = "translated_content", columnDefinition = "TEXT")
    private String translatedContent;

    @Column(name = "translated_content_at")
    private LocalDateTime translatedContentAt;

    /**
     * Page to extract full text from: the entry link, else its url (link or guid).
     */
    public String getSourceUrl() {
        return link != null && !link.isBlank() ? link : url;
    }
}
