package com.geekhub.collector.service.extract;

import com.geekhub.collector.dto.ExtractedContent;
import com.geekhub.collector.entity.Article;
import com.geekhub.collector.exception.ArticleNotFoundException;
import com.geekhub.collector.exception.ContentExtractionException;
import com.geekhub.collector.repository.ArticleRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * Fills {@code Article.fullContent} from the article's source page.
 * The feed-provided content is never overwritten.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ArticleContentService {

    private final ArticleRepository articleRepository;
    private final ContentExtractor contentExtractor;
    private final Clock clock;

    /**
     * @param overrideUrl page to extract instead of the article link, may be {@code null}
     */
    public ExtractedContent fetchFull(Long articleId, String overrideUrl) {
        Article article = articleRepository.findById(articleId)
                .orElseThrow(() -> new ArticleNotFoundException(articleId));

        String url = overrideUrl != null && !overrideUrl.isBlank() ? overrideUrl : article.getSourceUrl();
        if (url == null || url.isBlank()) {
            throw new ContentExtractionException("Article " + articleId + " has no source URL");
        }

        log.info("[FetchFull] Fetching full content for article {} from {}", articleId, url);
        ExtractedContent extracted = contentExtractor.extract(url);

        if (extracted.content() != null && !extracted.content().isBlank()) {
            article.setFullContent(extracted.content());
            article.setFullContentFetchedAt(LocalDateTime.now(clock));
            articleRepository.save(article);
        } else {
            log.warn("[FetchFull] No content extracted for article {} from {}", articleId, url);
        }
        return extracted;
    }
}
