package com.geekhub.collector.service.feed;

import com.geekhub.collector.dto.FeedEntry;
import com.geekhub.collector.util.HashUtils;

import java.time.format.DateTimeFormatter;

/**
 * Content-addressed identity of a feed entry.
 */
public final class ArticleHasher {

    private ArticleHasher() {
    }

    /**
     * MD5 of {@code link-or-guid|title|publishDate}. The body is deliberately left out,
     * so an edited body with unchanged link, title and date keeps its identity.
     */
    public static String hash(FeedEntry entry) {
        String identity = firstNonEmpty(entry.link(), entry.guid())
                + "|" + nullToEmpty(entry.title())
                + "|" + (entry.publishedAt() != null ? DateTimeFormatter.ISO_LOCAL_DATE_TIME.format(entry.publishedAt()) : "");
        return HashUtils.md5Hex(identity);
    }

    private static String firstNonEmpty(String first, String second) {
        if (first != null && !first.isEmpty()) {
            return first;
        }
        return nullToEmpty(second);
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }
}
