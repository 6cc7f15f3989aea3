package com.geekhub.collector.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.geekhub.collector.entity.Article;

import java.time.LocalDateTime;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ContentTranslationStatus(
        Long articleId,
        TranslationStatus.State state,
        String translatedContent,
        LocalDateTime translatedAt
) {
    public static ContentTranslationStatus of(Article article, boolean queued) {
        if (article.getTranslatedContent() != null) {
            return new ContentTranslationStatus(article.getId(), TranslationStatus.State.TRANSLATED,
                    article.getTranslatedContent(), article.getTranslatedContentAt());
        }
        return new ContentTranslationStatus(article.getId(),
                queued ? TranslationStatus.State.QUEUED : TranslationStatus.State.NONE, null, null);
    }
}
