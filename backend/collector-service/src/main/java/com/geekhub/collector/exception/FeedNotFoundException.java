package com.geekhub.collector.exception;

public class FeedNotFoundException extends CollectorException {

    public FeedNotFoundException(Long feedId) {
        super("FEED_NOT_FOUND", "Feed not found: " + feedId);
    }
}
