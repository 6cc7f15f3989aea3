package com.geekhub.collector.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Full article markup recovered from a page, plus the title when one was found.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ExtractedContent(String content, String title, String strategy) {

    public static ExtractedContent of(String content, String strategy) {
        return new ExtractedContent(content, null, strategy);
    }

    public ExtractedContent withTitle(String newTitle) {
        return new ExtractedContent(content, newTitle, strategy);
    }

    public boolean hasTitle() {
        return title != null && !title.isBlank();
    }
}
