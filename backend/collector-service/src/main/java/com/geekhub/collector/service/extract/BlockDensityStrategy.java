package com.geekhub.collector.service.extract;

import com.geekhub.collector.dto.ExtractedContent;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.Optional;

/**
 * Picks the block with the most text, skipping link farms.
 */
public class BlockDensityStrategy implements ExtractionStrategy {

    static final String NAME = "block-density";
    static final int MIN_TEXT_LENGTH = 300;
    static final int MAX_ANCHORS = 20;

    @Override
    public Optional<ExtractedContent> apply(Document document, String url) {
        Element best = null;
        int bestLength = MIN_TEXT_LENGTH;
        for (Element block : document.select("div, section, td")) {
            if (block.select("a").size() > MAX_ANCHORS) {
                continue;
            }
            int length = block.text().length();
            if (length > bestLength) {
                best = block;
                bestLength = length;
            }
        }
        return Optional.ofNullable(best).map(element -> ExtractedContent.of(element.html(), NAME));
    }
}
