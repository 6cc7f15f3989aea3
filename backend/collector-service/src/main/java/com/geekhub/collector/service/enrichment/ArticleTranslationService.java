package com.geekhub.collector.service.enrichment;

import com.geekhub.collector.dto.TranslationResult;
import com.geekhub.collector.entity.Article;
import com.geekhub.collector.repository.ArticleRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Writes translations onto articles. Original title, summary and content stay untouched.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ArticleTranslationService {

    private final ArticleRepository articleRepository;
    private final Clock clock;

    /**
     * @return {@code false} if the article no longer exists
     */
    public boolean apply(Long articleId, TranslationResult result) {
        Optional<Article> found = articleRepository.findById(articleId);
        if (found.isEmpty()) {
            log.warn("Cannot apply translation: article {} not found", articleId);
            return false;
        }
        Article article = found.get();
        article.setTranslatedTitle(result.translatedTitle());
        article.setTranslatedSummary(result.translatedDescription());
        article.setTranslatedAt(LocalDateTime.now(clock));
        articleRepository.save(article);
        return true;
    }

    /**
     * @return {@code false} if the article no longer exists
     */
    public boolean applyContent(Long articleId, String translatedContent) {
        Optional<Article> found = articleRepository.findById(articleId);
        if (found.isEmpty()) {
            log.warn("Cannot apply content translation: article {} not found", articleId);
            return false;
        }
        Article article = found.get();
        article.setTranslatedContent(translatedContent);
        article.setTranslatedContentAt(LocalDateTime.now(clock));
        articleRepository.save(article);
        return true;
    }
}
