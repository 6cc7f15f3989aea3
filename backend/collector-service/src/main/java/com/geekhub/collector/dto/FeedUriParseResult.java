package com.geekhub.collector.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record FeedUriParseResult(
        boolean valid,
        String feedUrl,
        String baseUrl,
        String error
) {
    public static FeedUriParseResult of(String feedUrl, String baseUrl) {
        return new FeedUriParseResult(true, feedUrl, baseUrl, null);
    }

    public static FeedUriParseResult invalid(String error) {
        return new FeedUriParseResult(false, null, null, error);
    }
}
