package com.geekhub.collector.service.enrichment;

import com.geekhub.collector.dto.AiSettings;
import com.geekhub.collector.dto.TranslationResult;

import java.util.function.BiConsumer;

/**
 * Translation request for one article.
 *
 * @param content   article markup, set only for {@link Kind#CONTENT} jobs
 * @param onSuccess called with the article id and result after it has been applied; may be {@code null}
 */
public record EnrichmentJob(
        Long articleId,
        Kind kind,
        String title,
        String description,
        String content,
        AiSettings settings,
        BiConsumer<Long, TranslationResult> onSuccess
) {
    public enum Kind {
        TITLE_AND_SUMMARY,
        CONTENT
    }

    public EnrichmentJob(Long articleId, String title, String description, AiSettings settings,
                         BiConsumer<Long, TranslationResult> onSuccess) {
        this(articleId, Kind.TITLE_AND_SUMMARY, title, description, null, settings, onSuccess);
    }

    public EnrichmentJob(Long articleId, String title, String description, AiSettings settings) {
        this(articleId, title, description, settings, null);
    }

    public static EnrichmentJob content(Long articleId, String html, AiSettings settings) {
        return new EnrichmentJob(articleId, Kind.CONTENT, null, null, html, settings, null);
    }
}
