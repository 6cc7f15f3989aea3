package com.geekhub.collector.service.extract;

import com.geekhub.collector.dto.ExtractedContent;
import org.jsoup.nodes.Document;

import java.util.Optional;

/**
 * One heuristic for locating the main content of a page.
 * Implementations must not modify the document they are given.
 */
public interface ExtractionStrategy {

    Optional<ExtractedContent> apply(Document document, String url);

    /**
     * Whether the strategy expects scripts, navigation, ads and similar chrome to be stripped already.
     */
    default boolean requiresCleanDocument() {
        return true;
    }
}
