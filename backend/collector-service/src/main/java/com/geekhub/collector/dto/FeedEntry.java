package com.geekhub.collector.dto;

import java.time.LocalDateTime;
import java.util.List;

/**
 * One item of a parsed RSS/Atom document, independent of the syndication format.
 */
public record FeedEntry(
        String title,
        String link,
        String guid,
        String author,
        LocalDateTime publishedAt,
        String content,
        String contentText,
        List<String> categories
) {
    public FeedEntry {
        categories = categories == null ? List.of() : List.copyOf(categories);
    }

    public boolean hasTitleOrLink() {
        return (title != null && !title.isBlank()) || (link != null && !link.isBlank());
    }
}
