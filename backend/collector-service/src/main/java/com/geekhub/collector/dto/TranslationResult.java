package com.geekhub.collector.dto;

/**
 * Output of one translation job. Title and summary jobs fill the first two fields,
 * full-content jobs only {@code translatedContent}.
 */
public record TranslationResult(String translatedTitle, String translatedDescription, String translatedContent) {

    public TranslationResult(String translatedTitle, String translatedDescription) {
        this(translatedTitle, translatedDescription, null);
    }

    public static TranslationResult content(String translatedContent) {
        return new TranslationResult(null, null, translatedContent);
    }
}
