package com.geekhub.collector.service.extract;

import com.geekhub.collector.dto.ExtractedContent;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.net.URI;
import java.util.Optional;

/**
 * Fixed selectors for platforms whose markup defeats the generic heuristics.
 * Currently WeChat official-account articles.
 */
public class SiteRuleStrategy implements ExtractionStrategy {

    static final String NAME = "site-rule";
    static final String WECHAT_HOST = "mp.weixin.qq.com";

    @Override
    public Optional<ExtractedContent> apply(Document document, String url) {
        if (!WECHAT_HOST.equals(host(url))) {
            return Optional.empty();
        }
        Element content = document.getElementById("js_content");
        if (content == null || content.html().isBlank()) {
            return Optional.empty();
        }
        Element heading = document.getElementById("activity-name");
        String title = heading != null ? heading.text().trim() : "";
        if (title.isEmpty()) {
            title = document.select("meta[property=og:title]").attr("content").trim();
        }
        return Optional.of(new ExtractedContent(content.html().trim(), title.isEmpty() ? null : title, NAME));
    }

    @Override
    public boolean requiresCleanDocument() {
        return false;
    }

    private static String host(String url) {
        try {
            String host = URI.create(url).getHost();
            return host != null ? host.toLowerCase() : "";
        } catch (IllegalArgumentException e) {
            return "";
        }
    }
}
