package com.geekhub.collector.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.geekhub.collector.dto.AiSettings;
import com.geekhub.collector.dto.TranslationResult;
import com.geekhub.collector.exception.EnrichmentException;
import com.geekhub.collector.exception.HttpFetchException;
import com.geekhub.collector.service.enrichment.EnrichmentBackend;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Chat-completions client for OpenAI-compatible providers (OpenAI, OpenRouter, Ollama, custom endpoints).
 * Requests go through {@link OutboundHttpClient}, so they honour the resolved proxy.
 */
@Component
@Slf4j
public class OpenAiCompatibleClient implements EnrichmentBackend {

    private static final int TRANSLATE_MAX_TOKENS = 2000;
    private static final int SUMMARY_MAX_TOKENS = 4000;
    private static final int CONTENT_MAX_TOKENS = 16000;

    static final int MAX_CONTENT_LENGTH = 100_000;
    static final String TRUNCATION_MARKER = "\n\n[Content truncated]";

    private final OutboundHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final AiSettings defaults;
    private final String targetLanguage;
    private final Duration timeout;

    public OpenAiCompatibleClient(
            OutboundHttpClient httpClient,
            ObjectMapper objectMapper,
            @Value("${collector.ai.enabled:false}") boolean enabled,
            @Value("${collector.ai.provider:openai}") String provider,
            @Value("${collector.ai.base-url:https://api.openai.com/v1}") String baseUrl,
            @Value("${collector.ai.model:" + AiSettings.DEFAULT_MODEL + "}") String model,
            @Value("${collector.ai.api-key:${OPENAI_API_KEY:}}") String apiKey,
            @Value("${collector.ai.temperature:0.3}") double temperature,
            @Value("${collector.ai.target-language:Simplified Chinese}") String targetLanguage,
            @Value("${collector.ai.timeout-seconds:120}") int timeoutSeconds) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.defaults = AiSettings.builder()
                .enabled(enabled)
                .provider(provider)
                .baseUrl(baseUrl)
                .model(model)
                .apiKey(apiKey)
                .temperature(temperature)
                .build();
        this.targetLanguage = targetLanguage;
        this.timeout = Duration.ofSeconds(timeoutSeconds);
    }

    @Override
    public AiSettings defaultSettings() {
        return defaults;
    }

    @Override
    public TranslationResult translate(Long articleId, String title, String description, AiSettings settings) {
        settings.validate();

        String id = String.valueOf(articleId);
        String prompt = """
                Translate the title and description of the following article into %s.
                Requirements:
                1. Keep the meaning and formatting of the original
                2. Keep the title short and punchy
                3. Return a JSON object with a "translations" array
                4. Each element has the fields id, translatedTitle and translatedDescription
                5. Do not add any other text

                Article ID: %s
                Title: %s
                Description: %s

                Example reply:
                {"translations": [{"id": "%s", "translatedTitle": "...", "translatedDescription": "..."}]}
                """.formatted(targetLanguage, id, nullToEmpty(title), nullToEmpty(description), id);

        String reply = complete(settings,
                "You are a professional translator. Whatever the source language, translate into "
                        + targetLanguage + ". Reply with JSON only.",
                prompt, TRANSLATE_MAX_TOKENS);

        return parseTranslation(id, reply);
    }

    @Override
    public String translateContent(Long articleId, String html, AiSettings settings) {
        settings.validate();

        String prompt = """
                Translate the following article content into %s. Requirements:
                1. Keep the HTML structure and formatting of the original
                2. Translate text only; leave HTML tags, attributes and code blocks as they are
                3. Keep images and links unchanged
                4. Make the translation read naturally
                5. Return only the translated HTML, with no explanation

                Content:
                %s
                """.formatted(targetLanguage, truncateContent(nullToEmpty(html)));

        String translated = complete(settings,
                "You are a professional article translator. Translate into " + targetLanguage
                        + " and keep the HTML structure and formatting unchanged.",
                prompt, CONTENT_MAX_TOKENS);
        log.debug("Translated content of article {}: {} -> {} characters",
                articleId, nullToEmpty(html).length(), translated.length());
        return stripCodeFence(translated);
    }

    /**
     * Cuts content longer than {@link #MAX_CONTENT_LENGTH} and marks the cut.
     */
    static String truncateContent(String content) {
        if (content.length() <= MAX_CONTENT_LENGTH) {
            return content;
        }
        return content.substring(0, MAX_CONTENT_LENGTH) + TRUNCATION_MARKER;
    }

    @Override
    public String summarize(String title, String content, AiSettings settings) {
        settings.validate();

        String prompt = """
                Summarize the following article. Requirements:
                1. Write the summary in %s
                2. Cover the main points and key facts
                3. Keep it between 200 and 300 words
                4. Stay objective and neutral

                Title: %s

                Content:
                %s
                """.formatted(targetLanguage, title, content);

        String summary = complete(settings,
                "You are a professional article summarizer. Always answer in " + targetLanguage + ".",
                prompt, SUMMARY_MAX_TOKENS);
        return summary.trim();
    }

    /**
     * Sends one chat-completions request and returns the first choice's message content.
     */
    String complete(AiSettings settings, String systemPrompt, String userPrompt, int maxTokens) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", settings.getModelOrDefault());
        body.put("messages", List.of(
                Map.of("role", "system", "content", systemPrompt),
                Map.of("role", "user", "content", userPrompt)
        ));
        body.put("max_tokens", maxTokens);
        body.put("temperature", settings.getTemperatureOrDefault());

        String url = trimTrailingSlash(settings.getBaseUrl()) + "/chat/completions";
        String response;
        try {
            response = httpClient.postJson(url,
                    Map.of(HttpHeaders.AUTHORIZATION, "Bearer " + settings.getApiKey()),
                    body, timeout);
        } catch (HttpFetchException e) {
            log.error("AI request to {} failed: {}", url, e.getMessage());
            throw new EnrichmentException("Connection error: cannot reach " + settings.getBaseUrl()
                    + " (" + e.getMessage() + ")", e);
        }

        try {
            JsonNode content = objectMapper.readTree(response)
                    .path("choices").path(0).path("message").path("content");
            if (content.isMissingNode() || content.isNull() || content.asText().isBlank()) {
                log.warn("AI provider {} returned an empty completion", settings.getProvider());
                throw EnrichmentException.emptyResponse();
            }
            return content.asText();
        } catch (JsonProcessingException e) {
            throw new EnrichmentException("AI provider returned an unreadable response", e);
        }
    }

    TranslationResult parseTranslation(String articleId, String reply) {
        JsonNode root;
        try {
            root = objectMapper.readTree(stripCodeFence(reply));
        } catch (JsonProcessingException e) {
            log.warn("AI translation reply is not valid JSON: {}", abbreviate(reply));
            throw new EnrichmentException("AI reply is not valid JSON", e);
        }

        JsonNode translations = root.path("translations");
        if (!translations.isArray() || translations.isEmpty()) {
            throw new EnrichmentException("AI reply is missing the translations array");
        }

        JsonNode match = translations.get(0);
        for (JsonNode candidate : translations) {
            if (articleId.equals(candidate.path("id").asText())) {
                match = candidate;
                break;
            }
        }

        String translatedTitle = match.path("translatedTitle").asText(null);
        String translatedDescription = match.path("translatedDescription").asText(null);
        if (translatedTitle == null && translatedDescription == null) {
            throw EnrichmentException.emptyResponse();
        }
        return new TranslationResult(translatedTitle, translatedDescription);
    }

    // Models often wrap JSON or HTML in ``` fences despite instructions
    static String stripCodeFence(String reply) {
        String trimmed = reply.trim();
        if (!trimmed.startsWith("```")) {
            return trimmed;
        }
        int firstNewline = trimmed.indexOf('\n');
        int closing = trimmed.lastIndexOf("```");
        if (firstNewline < 0 || closing <= firstNewline) {
            return trimmed;
        }
        return trimmed.substring(firstNewline + 1, closing).trim();
    }

    private static String trimTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    private static String abbreviate(String text) {
        return text.length() > 500 ? text.substring(0, 500) + "..." : text;
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }
}
