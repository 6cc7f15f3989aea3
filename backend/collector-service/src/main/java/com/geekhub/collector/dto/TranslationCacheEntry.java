package com.geekhub.collector.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Duration;
import java.time.Instant;

/**
 * Cached translation of one article, keyed by article id.
 */
public record TranslationCacheEntry(
        Long articleId,
        String originalTitle,
        String originalDescription,
        String translatedTitle,
        String translatedDescription,
        Instant cachedAt
) {
    @JsonIgnore
    public boolean isExpired(Instant now, Duration ttl) {
        return cachedAt == null || !cachedAt.plus(ttl).isAfter(now);
    }

    public TranslationResult toResult() {
        return new TranslationResult(translatedTitle, translatedDescription);
    }
}
