package com.geekhub.collector.exception;

/**
 * Translation or summarization failed.
 */
public class EnrichmentException extends CollectorException {

    public EnrichmentException(String message) {
        super("ENRICHMENT_ERROR", message);
    }

    public EnrichmentException(String message, Throwable cause) {
        super("ENRICHMENT_ERROR", message, cause);
    }

    protected EnrichmentException(String errorCode, String message) {
        super(errorCode, message);
    }

    /**
     * Provider settings are incomplete.
     */
    public static EnrichmentException invalidSettings(String message) {
        return new EnrichmentException("AI_SETTINGS_INVALID", message);
    }

    /**
     * Provider answered but the reply could not be used.
     */
    public static EnrichmentException emptyResponse() {
        return new EnrichmentException("AI returned an empty result");
    }
}
