package com.geekhub.collector.service.feed;

import com.geekhub.collector.client.BrowserHeaders;
import com.geekhub.collector.client.OutboundHttpClient;
import com.geekhub.collector.dto.FeedEntry;
import com.geekhub.collector.dto.FeedInfo;
import com.geekhub.collector.dto.FeedUriParseResult;
import com.geekhub.collector.dto.FetchResult;
import com.geekhub.collector.entity.Article;
import com.geekhub.collector.repository.ArticleRepository;
import com.geekhub.collector.service.rsshub.FeedUriResolver;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Runs one ingestion cycle for a feed: resolve the address, download, parse,
 * insert entries that are not stored yet, then record status and history.
 *
 * {@link #fetch(FeedInfo)} never throws for network or parse failures; they end up
 * in the returned {@link FetchResult}. Cycles for different feeds are independent
 * and may run concurrently.
 */
@Service
@Slf4j
public class FeedFetchService {

    static final String ACTION_FETCH = "FETCH";
    static final String ACTION_PARSE = "PARSE";
    static final String ACTION_NEW = "NEW";
    static final String ACTION_SAVE = "SAVE";
    static final String ACTION_DONE = "DONE";

    private static final String UNTITLED = "Untitled";

    private final OutboundHttpClient httpClient;
    private final FeedUriResolver feedUriResolver;
    private final FeedDocumentParser feedDocumentParser;
    private final ArticleRepository articleRepository;
    private final FetchStatusService fetchStatusService;
    private final FeedLogService feedLogService;
    private final MeterRegistry meterRegistry;
    private final Clock clock;
    private final String userAgent;
    private final Duration timeout;

    public FeedFetchService(
            OutboundHttpClient httpClient,
            FeedUriResolver feedUriResolver,
            FeedDocumentParser feedDocumentParser,
            ArticleRepository articleRepository,
            FetchStatusService fetchStatusService,
            FeedLogService feedLogService,
            MeterRegistry meterRegistry,
            Clock clock,
            @Value("${collector.http.user-agent:" + OutboundHttpClient.DEFAULT_USER_AGENT + "}") String userAgent,
            @Value("${collector.http.timeout.fetch:10000}") long timeoutMs) {
        this.httpClient = httpClient;
        this.feedUriResolver = feedUriResolver;
        this.feedDocumentParser = feedDocumentParser;
        this.articleRepository = articleRepository;
        this.fetchStatusService = fetchStatusService;
        this.feedLogService = feedLogService;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
        this.userAgent = userAgent;
        this.timeout = Duration.ofMillis(timeoutMs);
    }

    public FetchResult fetch(FeedInfo feed) {
        long startTime = clock.millis();
        FetchResult result;

        try {
            feedLogService.info(feed, ACTION_FETCH, feed.url(), "Starting fetch for \"" + feed.title() + "\"");

            String feedUrl = resolveUrl(feed.url());
            OutboundHttpClient.RawResponse response = httpClient.getBytes(feedUrl, BrowserHeaders.of(userAgent), timeout);
            List<FeedEntry> entries = feedDocumentParser.parse(response.body(), response.contentType());

            feedLogService.success(feed, 200, ACTION_PARSE, entries.size() + " items", 0L, "Parsed RSS feed");

            int articlesNew = persistNewEntries(feed, entries);
            long duration = clock.millis() - startTime;

            feedLogService.success(feed, 200, ACTION_DONE, feed.url(), duration,
                    "Found: " + entries.size() + ", New: " + articlesNew);
            log.info("Fetched feed {} ({}): found={}, new={}, {}ms",
                    feed.id(), feedUrl, entries.size(), articlesNew, duration);

            result = FetchResult.success(entries.size(), articlesNew, duration);
        } catch (Exception e) {
            long duration = clock.millis() - startTime;
            String message = Objects.requireNonNullElse(e.getMessage(), e.getClass().getSimpleName());
            feedLogService.error(feed, ACTION_FETCH, feed.url(), message);
            log.warn("Fetch failed for feed {} ({}): {}", feed.id(), feed.url(), message);
            result = FetchResult.failure(duration, message);
        }

        fetchStatusService.record(feed, result);
        meterRegistry.counter("collector.fetch", "outcome", result.success() ? "success" : "error").increment();
        return result;
    }

    /**
     * Gateway addresses become their HTTPS form; anything else is used as typed.
     */
    String resolveUrl(String address) {
        FeedUriParseResult parsed = feedUriResolver.parse(address);
        if (parsed.valid() && parsed.feedUrl() != null) {
            return parsed.feedUrl();
        }
        log.debug("Using {} as a plain URL: {}", address, parsed.error());
        return address;
    }

    private int persistNewEntries(FeedInfo feed, List<FeedEntry> entries) {
        int articlesNew = 0;
        for (FeedEntry entry : entries) {
            if (!entry.hasTitleOrLink()) {
                continue;
            }
            String hash = ArticleHasher.hash(entry);
            try {
                if (articleRepository.existsByFeedIdAndHash(feed.id(), hash)) {
                    continue;
                }
                articleRepository.save(toArticle(feed, entry, hash));
                articlesNew++;
                feedLogService.success(feed, 200, ACTION_NEW,
                        entry.title() != null ? entry.title() : UNTITLED, 0L,
                        "Hash: " + hash.substring(0, 8) + "...");
            } catch (Exception e) {
                feedLogService.warning(feed, ACTION_SAVE, entry.link(), "Failed to save article: " + e.getMessage());
                log.warn("Failed to save article {} of feed {}: {}", hash, feed.id(), e.getMessage());
            }
        }
        return articlesNew;
    }

    private Article toArticle(FeedInfo feed, FeedEntry entry, String hash) {
        List<String> categories = new ArrayList<>(entry.categories());
        return Article.builder()
                .feedId(feed.id())
                .hash(hash)
                .title(entry.title() != null ? entry.title() : UNTITLED)
                .url(entry.link() != null ? entry.link() : Objects.requireNonNullElse(entry.guid(), ""))
                .link(entry.link())
                .author(entry.author())
                .publishedAt(entry.publishedAt())
                .content(entry.content())
                .contentText(entry.contentText())
                .summary(entry.contentText())
                .categories(categories)
                .tags(new ArrayList<>(categories))
                .fetchedAt(LocalDateTime.now(clock))
                .build();
    }
}
