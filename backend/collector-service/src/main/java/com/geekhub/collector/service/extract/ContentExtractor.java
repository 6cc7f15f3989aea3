package com.geekhub.collector.service.extract;

import com.geekhub.collector.client.BrowserHeaders;
import com.geekhub.collector.client.OutboundHttpClient;
import com.geekhub.collector.dto.ExtractedContent;
import com.geekhub.collector.exception.ContentExtractionException;
import com.geekhub.collector.exception.HttpFetchException;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.Charset;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Recovers the full article markup of a web page.
 *
 * Strategies run in a fixed order and the first one that produces content wins:
 * site rules, semantic containers, block density, then the body as a last resort.
 * Only an unreachable page is an error.
 */
@Service
@Slf4j
public class ContentExtractor {

    static final String NON_CONTENT_SELECTOR =
            "script, style, noscript, iframe, nav, aside, footer, form, "
                    + ".comments, .share-buttons, .advertisement, .ads, [class~=(^|\\s)ad-]";

    private final OutboundHttpClient httpClient;
    private final List<ExtractionStrategy> strategies;
    private final String userAgent;
    private final Duration timeout;

    public ContentExtractor(
            OutboundHttpClient httpClient,
            @Value("${collector.http.user-agent:" + OutboundHttpClient.DEFAULT_USER_AGENT + "}") String userAgent,
            @Value("${collector.http.timeout.extract:10000}") long timeoutMs) {
        this.httpClient = httpClient;
        this.userAgent = userAgent;
        this.timeout = Duration.ofMillis(timeoutMs);
        this.strategies = List.of(
                new SiteRuleStrategy(),
                new SemanticSelectorStrategy(),
                new BlockDensityStrategy(),
                new BodyFallbackStrategy()
        );
    }

    /**
     * @throws ContentExtractionException if the page cannot be downloaded
     */
    public ExtractedContent extract(String url) {
        Document document;
        try {
            OutboundHttpClient.RawResponse response = httpClient.getBytes(url, BrowserHeaders.of(userAgent), timeout);
            document = Jsoup.parse(new ByteArrayInputStream(response.body()), charsetOf(response.contentType()), url);
        } catch (HttpFetchException | IOException e) {
            throw new ContentExtractionException(url, e);
        }
        ExtractedContent content = extract(document, url);
        log.info("Extracted {} characters from {} using {}", content.content().length(), url, content.strategy());
        return content;
    }

    /**
     * Runs the strategies over an already parsed page.
     */
    public ExtractedContent extract(Document document, String url) {
        Document cleaned = null;
        for (ExtractionStrategy strategy : strategies) {
            Document target = document;
            if (strategy.requiresCleanDocument()) {
                if (cleaned == null) {
                    cleaned = document.clone();
                    cleaned.select(NON_CONTENT_SELECTOR).remove();
                }
                target = cleaned;
            }
            Optional<ExtractedContent> result = strategy.apply(target, url);
            if (result.isPresent()) {
                ExtractedContent content = result.get();
                return content.hasTitle() ? content : content.withTitle(pageTitle(document));
            }
        }
        throw new IllegalStateException("No extraction strategy produced content for " + url);
    }

    /**
     * Charset named by the {@code Content-Type} header; {@code null} lets Jsoup read it
     * from the byte order mark or the {@code <meta charset>} tag.
     */
    static String charsetOf(String contentType) {
        if (contentType == null || contentType.isBlank()) {
            return null;
        }
        try {
            Charset charset = MediaType.parseMediaType(contentType).getCharset();
            return charset != null ? charset.name() : null;
        } catch (IllegalArgumentException e) {
            log.debug("Ignoring unusable Content-Type '{}': {}", contentType, e.getMessage());
            return null;
        }
    }

    static String pageTitle(Document document) {
        String ogTitle = document.select("meta[property=og:title]").attr("content").trim();
        if (!ogTitle.isEmpty()) {
            return ogTitle;
        }
        String title = document.title().trim();
        return title.isEmpty() ? null : title;
    }
}
