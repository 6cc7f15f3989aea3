package com.geekhub.collector.service.enrichment;

import com.geekhub.collector.dto.AiSettings;
import com.geekhub.collector.dto.ContentTranslationStatus;
import com.geekhub.collector.dto.TranslationStatus;
import com.geekhub.collector.entity.Article;
import com.geekhub.collector.exception.ArticleNotFoundException;
import com.geekhub.collector.repository.ArticleRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Article-level entry point to the enrichment queue.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TranslationService {

    private final ArticleRepository articleRepository;
    private final EnrichmentQueue enrichmentQueue;
    private final EnrichmentBackend enrichmentBackend;

    /**
     * Validates the provider settings, then queues the article's title and summary.
     *
     * @param requested settings sent with the request, or {@code null} for the configured provider
     * @throws com.geekhub.collector.exception.EnrichmentException if the settings cannot be used
     */
    public TranslationStatus requestTranslation(Long articleId, AiSettings requested) {
        AiSettings settings = requested != null ? requested : enrichmentBackend.defaultSettings();
        settings.validate();

        Article article = findArticle(articleId);
        enrichmentQueue.enqueue(new EnrichmentJob(
                article.getId(),
                article.getTitle(),
                article.getSummary() != null ? article.getSummary() : article.getContentText(),
                settings));

        // a cache hit was applied synchronously; reload to report it
        return getTranslation(articleId);
    }

    /**
     * Validates the provider settings, then queues the article's markup for translation:
     * the extracted page when one was fetched, otherwise the feed content.
     *
     * @throws IllegalArgumentException if the article has no content at all
     */
    public ContentTranslationStatus requestContentTranslation(Long articleId, AiSettings requested) {
        AiSettings settings = requested != null ? requested : enrichmentBackend.defaultSettings();
        settings.validate();

        Article article = findArticle(articleId);
        String html = hasText(article.getFullContent()) ? article.getFullContent() : article.getContent();
        if (!hasText(html)) {
            throw new IllegalArgumentException("Article " + articleId + " has no content to translate");
        }
        enrichmentQueue.enqueue(EnrichmentJob.content(article.getId(), html, settings));
        return getContentTranslation(articleId);
    }

    public ContentTranslationStatus getContentTranslation(Long articleId) {
        Article article = findArticle(articleId);
        return ContentTranslationStatus.of(article, enrichmentQueue.isInQueue(articleId, EnrichmentJob.Kind.CONTENT));
    }

    public TranslationStatus getTranslation(Long articleId) {
        Article article = findArticle(articleId);
        return TranslationStatus.of(article, enrichmentQueue.isInQueue(articleId));
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }

    private Article findArticle(Long articleId) {
        return articleRepository.findById(articleId)
                .orElseThrow(() -> new ArticleNotFoundException(articleId));
    }
}
