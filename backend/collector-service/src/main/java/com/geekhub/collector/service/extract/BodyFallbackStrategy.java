package com.geekhub.collector.service.extract;

import com.geekhub.collector.dto.ExtractedContent;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.Optional;

/**
 * Last resort: the whole body without its header.
 */
public class BodyFallbackStrategy implements ExtractionStrategy {

    static final String NAME = "body";

    @Override
    public Optional<ExtractedContent> apply(Document document, String url) {
        Element body = document.body();
        if (body == null) {
            return Optional.of(ExtractedContent.of("", NAME));
        }
        Element copy = body.clone();
        copy.select("header").remove();
        return Optional.of(ExtractedContent.of(copy.html(), NAME));
    }
}
