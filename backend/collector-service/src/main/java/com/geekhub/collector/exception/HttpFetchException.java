package com.geekhub.collector.exception;

/**
 * Outbound request failed: unreachable host, timeout or a non-2xx response.
 */
public class HttpFetchException extends CollectorException {

    private final Integer statusCode;

    public HttpFetchException(String message, Throwable cause) {
        super("HTTP_FETCH_ERROR", message, cause);
        this.statusCode = null;
    }

    public HttpFetchException(int statusCode, String reason) {
        super("HTTP_FETCH_ERROR", "HTTP " + statusCode + ": " + reason);
        this.statusCode = statusCode;
    }

    /**
     * @return response status, or {@code null} if no response was received
     */
    public Integer getStatusCode() {
        return statusCode;
    }
}
