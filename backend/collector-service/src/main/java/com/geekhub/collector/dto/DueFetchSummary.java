package com.geekhub.collector.dto;

/**
 * Totals of one pass over the feeds that were due.
 */
public record DueFetchSummary(boolean skipped, int activeFeeds, int dueFeeds, int succeeded, int failed, int articlesNew) {

    public static DueFetchSummary alreadyRunning() {
        return new DueFetchSummary(true, 0, 0, 0, 0, 0);
    }
}
