package com.geekhub.collector.dto;

import com.geekhub.collector.entity.Feed;

/**
 * Read-only snapshot of a subscription, taken once per fetch cycle.
 */
public record FeedInfo(
        Long id,
        String url,
        String urlHash,
        String title,
        String siteUrl,
        String faviconUrl,
        int fetchIntervalMinutes
) {
    public static final int DEFAULT_FETCH_INTERVAL_MINUTES = 60;

    public static FeedInfo from(Feed feed) {
        Integer interval = feed.getFetchIntervalMinutes();
        return new FeedInfo(
                feed.getId(),
                feed.getUrl(),
                feed.getUrlHash(),
                feed.getTitle(),
                feed.getSiteUrl(),
                feed.getFaviconUrl(),
                interval != null && interval > 0 ? interval : DEFAULT_FETCH_INTERVAL_MINUTES
        );
    }
}
