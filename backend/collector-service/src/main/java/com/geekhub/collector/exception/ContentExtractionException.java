package com.geekhub.collector.exception;

/**
 * Source page of an article could not be fetched.
 */
public class ContentExtractionException extends CollectorException {

    public ContentExtractionException(String message) {
        super("EXTRACTION_ERROR", message);
    }

    public ContentExtractionException(String url, Throwable cause) {
        super("EXTRACTION_ERROR", "Failed to fetch " + url + ": " + cause.getMessage(), cause);
    }
}
