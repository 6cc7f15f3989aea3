package com.geekhub.collector.exception;

/**
 * Base class of collector exceptions.
 */
public class CollectorException extends RuntimeException {

    private final String errorCode;

    public CollectorException(String message) {
        super(message);
        this.errorCode = "COLLECTOR_ERROR";
    }

    public CollectorException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public CollectorException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
