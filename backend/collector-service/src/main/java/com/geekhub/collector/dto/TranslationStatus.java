package com.geekhub.collector.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.geekhub.collector.entity.Article;

import java.time.LocalDateTime;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record TranslationStatus(
        Long articleId,
        State state,
        String translatedTitle,
        String translatedSummary,
        LocalDateTime translatedAt
) {
    public enum State {
        NONE,
        QUEUED,
        TRANSLATED
    }

    public static TranslationStatus of(Article article, boolean queued) {
        if (article.getTranslatedTitle() != null || article.getTranslatedSummary() != null) {
            return new TranslationStatus(article.getId(), State.TRANSLATED,
                    article.getTranslatedTitle(), article.getTranslatedSummary(), article.getTranslatedAt());
        }
        return new TranslationStatus(article.getId(), queued ? State.QUEUED : State.NONE, null, null, null);
    }
}
