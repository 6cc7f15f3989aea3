package com.geekhub.collector.service.extract;

import com.geekhub.collector.dto.ExtractedContent;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.List;
import java.util.Optional;

/**
 * Tries common article containers in priority order.
 */
public class SemanticSelectorStrategy implements ExtractionStrategy {

    static final String NAME = "semantic";

    static final List<String> SELECTORS = List.of(
            "article",
            "[role=article]",
            ".post-content",
            ".entry-content",
            ".article-content",
            ".post-body",
            ".content",
            "#content",
            "main"
    );

    static final int MIN_TEXT_LENGTH = 200;
    static final double MAX_LINK_DENSITY = 0.5;

    @Override
    public Optional<ExtractedContent> apply(Document document, String url) {
        for (String selector : SELECTORS) {
            for (Element element : document.select(selector)) {
                String text = element.text();
                if (text.length() > MIN_TEXT_LENGTH && linkDensity(element, text) <= MAX_LINK_DENSITY) {
                    return Optional.of(ExtractedContent.of(element.html(), NAME));
                }
            }
        }
        return Optional.empty();
    }

    /**
     * Share of the visible text that sits inside links; navigation skeletons score close to 1.
     */
    static double linkDensity(Element element, String text) {
        if (text.isEmpty()) {
            return 1.0;
        }
        int linkText = 0;
        for (Element anchor : element.select("a")) {
            linkText += anchor.text().length();
        }
        return (double) linkText / text.length();
    }
}
