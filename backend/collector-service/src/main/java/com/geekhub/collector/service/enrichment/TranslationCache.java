package com.geekhub.collector.service.enrichment;

import com.geekhub.collector.dto.TranslationCacheEntry;

import java.util.Optional;

/**
 * Durable translation store keyed by article id.
 */
public interface TranslationCache {

    /**
     * @return the entry if present and not older than the cache horizon
     */
    Optional<TranslationCacheEntry> get(Long articleId);

    void put(TranslationCacheEntry entry);

    void evict(Long articleId);
}
