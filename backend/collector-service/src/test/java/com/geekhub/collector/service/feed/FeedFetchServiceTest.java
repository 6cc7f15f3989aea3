package com.geekhub.collector.service.feed;

import com.geekhub.collector.client.OutboundHttpClient;
import com.geekhub.collector.dto.FeedInfo;
import com.geekhub.collector.dto.FetchResult;
import com.geekhub.collector.entity.Article;
import com.geekhub.collector.exception.HttpFetchException;
import com.geekhub.collector.repository.ArticleRepository;
import com.geekhub.collector.service.rsshub.FeedUriResolver;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class FeedFetchServiceTest {

    private static final String FEED_URL = "https://blog.example.com/feed.xml";

    private static final String RSS = """
            <?xml version="1.0" encoding="UTF-8"?>
            <rss version="2.0">
              <channel>
                <title>Example</title>
                <link>https://blog.example.com</link>
                <description>Posts</description>
                <item>
                  <title>Weekly</title>
                  <link>https://blog.example.com/weekly-1</link>
                  <description>One</description>
                </item>
                <item>
                  <title>Weekly</title>
                  <link>https://blog.example.com/weekly-2</link>
                  <description>Two</description>
                </item>
                <item>
                  <title>Release notes</title>
                  <link>https://blog.example.com/weekly-1</link>
                  <description>Three</description>
                </item>
                <item>
                  <description>No title and no link</description>
                </item>
              </channel>
            </rss>
            """;

    @Mock
    private OutboundHttpClient httpClient;

    @Mock
    private ArticleRepository articleRepository;

    @Mock
    private FetchStatusService fetchStatusService;

    @Mock
    private FeedLogService feedLogService;

    private FeedFetchService feedFetchService;

    private final FeedInfo feed = new FeedInfo(1L, FEED_URL, "abcdef123456", "Example", null, null, 60);

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2024-05-01T08:00:00Z"), ZoneOffset.UTC);
        feedFetchService = new FeedFetchService(
                httpClient,
                new FeedUriResolver(false, ""),
                new FeedDocumentParser(),
                articleRepository,
                fetchStatusService,
                feedLogService,
                new SimpleMeterRegistry(),
                clock,
                "TestAgent/1.0",
                10000);
    }

    private static OutboundHttpClient.RawResponse xml(String document) {
        return new OutboundHttpClient.RawResponse(document.getBytes(StandardCharsets.UTF_8), "application/rss+xml");
    }

    /**
     * Backs the article repository with an in-memory set of hashes.
     */
    private Set<String> inMemoryStore() {
        Set<String> stored = new HashSet<>();
        when(articleRepository.existsByFeedIdAndHash(eq(1L), anyString()))
                .thenAnswer(invocation -> stored.contains(invocation.<String>getArgument(1)));
        when(articleRepository.save(any(Article.class))).thenAnswer(invocation -> {
            Article article = invocation.getArgument(0);
            stored.add(article.getHash());
            return article;
        });
        return stored;
    }

    @Test
    @DisplayName("new entries are inserted and counted")
    void insertsNewEntries() {
        // given
        when(httpClient.getBytes(eq(FEED_URL), anyMap(), any(Duration.class))).thenReturn(xml(RSS));
        inMemoryStore();

        // when
        FetchResult result = feedFetchService.fetch(feed);

        // then
        assertThat(result.success()).isTrue();
        assertThat(result.articlesFound()).isEqualTo(4);
        assertThat(result.articlesNew()).isEqualTo(3);
        assertThat(result.articlesUpdated()).isZero();
        assertThat(result.error()).isNull();

        ArgumentCaptor<Article> captor = ArgumentCaptor.forClass(Article.class);
        verify(articleRepository, times(3)).save(captor.capture());
        Article first = captor.getAllValues().get(0);
        assertThat(first.getFeedId()).isEqualTo(1L);
        assertThat(first.getTitle()).isEqualTo("Weekly");
        assertThat(first.getUrl()).isEqualTo("https://blog.example.com/weekly-1");
        assertThat(first.getSummary()).isEqualTo("One");
        assertThat(first.getFetchedAt()).isEqualTo("2024-05-01T08:00:00");
    }

    @Test
    @DisplayName("fetching the same document twice inserts each entry once")
    void idempotentIngestion() {
        // given
        when(httpClient.getBytes(eq(FEED_URL), anyMap(), any(Duration.class))).thenReturn(xml(RSS));
        Set<String> stored = inMemoryStore();

        // when
        FetchResult first = feedFetchService.fetch(feed);
        FetchResult second = feedFetchService.fetch(feed);

        // then
        assertThat(first.articlesNew()).isEqualTo(3);
        assertThat(second.success()).isTrue();
        assertThat(second.articlesFound()).isEqualTo(4);
        assertThat(second.articlesNew()).isZero();
        assertThat(stored).hasSize(3);
        verify(articleRepository, times(3)).save(any(Article.class));
    }

    @Test
    @DisplayName("browser-like headers are sent")
    void sendsBrowserHeaders() {
        // given
        when(httpClient.getBytes(eq(FEED_URL), anyMap(), any(Duration.class))).thenReturn(xml(RSS));
        inMemoryStore();

        // when
        feedFetchService.fetch(feed);

        // then
        @SuppressWarnings("unchecked")
        ArgumentCaptor<Map<String, String>> headers = ArgumentCaptor.forClass(Map.class);
        verify(httpClient).getBytes(eq(FEED_URL), headers.capture(), eq(Duration.ofSeconds(10)));
        assertThat(headers.getValue())
                .containsEntry("User-Agent", "TestAgent/1.0")
                .containsKeys("Accept", "Accept-Language");
    }

    @Test
    @DisplayName("one failing insert does not stop its siblings")
    void partialFailureIsolation() {
        // given
        when(httpClient.getBytes(eq(FEED_URL), anyMap(), any(Duration.class))).thenReturn(xml(RSS));
        when(articleRepository.existsByFeedIdAndHash(eq(1L), anyString())).thenReturn(false);
        when(articleRepository.save(any(Article.class)))
                .thenAnswer(invocation -> invocation.getArgument(0))
                .thenThrow(new IllegalStateException("duplicate key"))
                .thenAnswer(invocation -> invocation.getArgument(0));

        // when
        FetchResult result = feedFetchService.fetch(feed);

        // then
        assertThat(result.success()).isTrue();
        assertThat(result.articlesNew()).isEqualTo(2);
        verify(articleRepository, times(3)).save(any(Article.class));
        verify(feedLogService).warning(eq(feed), eq("SAVE"), eq("https://blog.example.com/weekly-2"),
                contains("duplicate key"));
    }

    @Test
    @DisplayName("HTTP error is returned, not thrown, and status is still recorded")
    void httpErrorRecorded() {
        // given
        when(httpClient.getBytes(eq(FEED_URL), anyMap(), any(Duration.class)))
                .thenThrow(new HttpFetchException(503, "Service Unavailable"));

        // when
        FetchResult result = feedFetchService.fetch(feed);

        // then
        assertThat(result.success()).isFalse();
        assertThat(result.error()).isEqualTo("HTTP 503: Service Unavailable");
        assertThat(result.articlesFound()).isZero();
        verify(fetchStatusService).record(feed, result);
        verify(feedLogService).error(feed, "FETCH", FEED_URL, "HTTP 503: Service Unavailable");
        verifyNoInteractions(articleRepository);
    }

    @Test
    @DisplayName("unparseable body is an error and status is still recorded")
    void parseErrorRecorded() {
        // given
        when(httpClient.getBytes(eq(FEED_URL), anyMap(), any(Duration.class)))
                .thenReturn(new OutboundHttpClient.RawResponse(
                        "<html><body>Login required</body></html>".getBytes(StandardCharsets.UTF_8), "text/html"));

        // when
        FetchResult result = feedFetchService.fetch(feed);

        // then
        assertThat(result.success()).isFalse();
        assertThat(result.error()).startsWith("Failed to parse feed");
        verify(fetchStatusService).record(feed, result);
    }

    @Test
    @DisplayName("GBK-encoded feed keeps its Chinese titles")
    void decodesDeclaredCharset() {
        // given
        String gbkFeed = """
                <?xml version="1.0" encoding="GBK"?>
                <rss version="2.0">
                  <channel>
                    <title>新闻</title>
                    <link>https://news.example.cn</link>
                    <description>频道</description>
                    <item>
                      <title>中文标题</title>
                      <link>https://news.example.cn/1</link>
                      <description>正文摘要</description>
                    </item>
                  </channel>
                </rss>
                """;
        when(httpClient.getBytes(eq(FEED_URL), anyMap(), any(Duration.class)))
                .thenReturn(new OutboundHttpClient.RawResponse(gbkFeed.getBytes(Charset.forName("GBK")), "text/xml"));
        inMemoryStore();

        // when
        FetchResult result = feedFetchService.fetch(feed);

        // then
        assertThat(result.articlesNew()).isEqualTo(1);
        ArgumentCaptor<Article> captor = ArgumentCaptor.forClass(Article.class);
        verify(articleRepository).save(captor.capture());
        assertThat(captor.getValue().getTitle()).isEqualTo("中文标题");
        assertThat(captor.getValue().getSummary()).isEqualTo("正文摘要");
    }

    @Test
    @DisplayName("gateway addresses are fetched through their HTTPS form")
    void resolvesGatewayAddress() {
        // given
        FeedInfo gatewayFeed = new FeedInfo(2L, "rsshub://sspai/index", null, "SSPAI", null, null, 30);
        when(httpClient.getBytes(eq("https://rsshub.app/sspai/index"), anyMap(), any(Duration.class)))
                .thenReturn(xml(RSS.replace("<item>", "<!--").replace("</item>", "-->")));

        // when
        FetchResult result = feedFetchService.fetch(gatewayFeed);

        // then
        assertThat(result.success()).isTrue();
        assertThat(result.articlesFound()).isZero();
    }

    @Test
    @DisplayName("structured log lines cover start, parse, new items and completion")
    void logsLifecycle() {
        // given
        when(httpClient.getBytes(eq(FEED_URL), anyMap(), any(Duration.class))).thenReturn(xml(RSS));
        inMemoryStore();

        // when
        feedFetchService.fetch(feed);

        // then
        verify(feedLogService).info(eq(feed), eq("FETCH"), eq(FEED_URL), anyString());
        verify(feedLogService).success(feed, 200, "PARSE", "4 items", 0L, "Parsed RSS feed");
        verify(feedLogService, times(3)).success(eq(feed), eq(200), eq("NEW"), anyString(), eq(0L), anyString());
        verify(feedLogService).success(feed, 200, "DONE", FEED_URL, 0L, "Found: 4, New: 3");
    }

    @Test
    @DisplayName("plain URLs are used as typed")
    void literalUrl() {
        assertThat(feedFetchService.resolveUrl(FEED_URL)).isEqualTo(FEED_URL);
        assertThat(feedFetchService.resolveUrl("rsshub://my.host.io/a/b")).isEqualTo("https://my.host.io/a/b");
        assertThat(feedFetchService.resolveUrl("not a url")).isEqualTo("not a url");
    }
}
