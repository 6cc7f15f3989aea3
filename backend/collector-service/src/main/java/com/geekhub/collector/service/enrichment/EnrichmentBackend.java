package com.geekhub.collector.service.enrichment;

import com.geekhub.collector.dto.AiSettings;
import com.geekhub.collector.dto.TranslationResult;

/**
 * Provider-agnostic translation and summarization.
 * Implementations throw {@link com.geekhub.collector.exception.EnrichmentException} on any failure.
 */
public interface EnrichmentBackend {

    TranslationResult translate(Long articleId, String title, String description, AiSettings settings);

    /**
     * Translates article markup, keeping its HTML structure. Over-long input is truncated first.
     */
    String translateContent(Long articleId, String html, AiSettings settings);

    String summarize(String title, String content, AiSettings settings);

    /**
     * Provider settings from configuration, used when a request carries none.
     */
    AiSettings defaultSettings();
}
