package com.geekhub.collector.service.enrichment;

import com.geekhub.collector.dto.TranslationResult;
import com.geekhub.collector.entity.Article;
import com.geekhub.collector.repository.ArticleRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ArticleTranslationServiceTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2024, 5, 1, 8, 0);

    @Mock
    private ArticleRepository articleRepository;

    private ArticleTranslationService service;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2024-05-01T08:00:00Z"), ZoneOffset.UTC);
        service = new ArticleTranslationService(articleRepository, clock);
    }

    @Test
    @DisplayName("title and summary translations are stored next to the originals")
    void appliesTitleAndSummary() {
        Article article = Article.builder().id(1L).title("Hello").summary("World").build();
        when(articleRepository.findById(1L)).thenReturn(Optional.of(article));

        assertThat(service.apply(1L, new TranslationResult("你好", "世界"))).isTrue();

        assertThat(article.getTitle()).isEqualTo("Hello");
        assertThat(article.getTranslatedTitle()).isEqualTo("你好");
        assertThat(article.getTranslatedSummary()).isEqualTo("世界");
        assertThat(article.getTranslatedAt()).isEqualTo(NOW);
        verify(articleRepository).save(article);
    }

    @Test
    @DisplayName("content translation leaves title and summary translations alone")
    void appliesContent() {
        Article article = Article.builder().id(1L).content("<p>Hi</p>").translatedTitle("你好").build();
        when(articleRepository.findById(1L)).thenReturn(Optional.of(article));

        assertThat(service.applyContent(1L, "<p>嗨</p>")).isTrue();

        assertThat(article.getContent()).isEqualTo("<p>Hi</p>");
        assertThat(article.getTranslatedContent()).isEqualTo("<p>嗨</p>");
        assertThat(article.getTranslatedContentAt()).isEqualTo(NOW);
        assertThat(article.getTranslatedTitle()).isEqualTo("你好");
        verify(articleRepository).save(article);
    }

    @Test
    @DisplayName("a deleted article is skipped")
    void missingArticle() {
        when(articleRepository.findById(2L)).thenReturn(Optional.empty());

        assertThat(service.applyContent(2L, "<p>嗨</p>")).isFalse();
        verify(articleRepository, never()).save(any());
    }
}
