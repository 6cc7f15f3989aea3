package com.geekhub.collector.exception;

/**
 * Response body is not a readable RSS/Atom document.
 */
public class FeedParseException extends CollectorException {

    public FeedParseException(String message) {
        super("FEED_PARSE_ERROR", message);
    }

    public FeedParseException(String message, Throwable cause) {
        super("FEED_PARSE_ERROR", message, cause);
    }
}
