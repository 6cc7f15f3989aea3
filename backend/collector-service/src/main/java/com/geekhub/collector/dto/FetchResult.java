package com.geekhub.collector.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Outcome of one ingestion cycle for a single feed.
 *
 * A failed cycle is reported with {@code success=false} and an error message,
 * never as an exception, so callers can always record the attempt.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record FetchResult(
        boolean success,
        int articlesFound,
        int articlesNew,
        int articlesUpdated,
        @JsonIgnore long durationMs,
        String error
) {
    public static FetchResult success(int articlesFound, int articlesNew, long durationMs) {
        return new FetchResult(true, articlesFound, articlesNew, 0, durationMs, null);
    }

    public static FetchResult failure(long durationMs, String error) {
        return new FetchResult(false, 0, 0, 0, durationMs, error);
    }

    @JsonProperty("duration")
    public String duration() {
        return durationMs + "ms";
    }
}
