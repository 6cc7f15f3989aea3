package com.geekhub.collector.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.geekhub.collector.dto.AiSettings;
import com.geekhub.collector.dto.TranslationResult;
import com.geekhub.collector.exception.EnrichmentException;
import com.geekhub.collector.exception.HttpFetchException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class OpenAiCompatibleClientTest {

    private static final AiSettings SETTINGS = AiSettings.builder()
            .enabled(true)
            .provider("openrouter")
            .baseUrl("https://openrouter.example/api/v1/")
            .model("test-model")
            .apiKey("sk-test")
            .build();

    @Mock
    private OutboundHttpClient httpClient;

    private final ObjectMapper objectMapper = new ObjectMapper();

    private OpenAiCompatibleClient client;

    @BeforeEach
    void setUp() {
        client = new OpenAiCompatibleClient(httpClient, objectMapper, false, "openai",
                "https://api.openai.com/v1", "gpt-4o-mini", "", 0.3, "Simplified Chinese", 120);
    }

    private static String completion(String content) throws Exception {
        return new ObjectMapper().writeValueAsString(Map.of(
                "choices", List.of(Map.of("message", Map.of("role", "assistant", "content", content)))));
    }

    @Nested
    @DisplayName("translate")
    class Translate {

        @Test
        @DisplayName("posts a chat completion and parses the fenced JSON reply")
        @SuppressWarnings("unchecked")
        void parsesFencedReply() throws Exception {
            // given
            String reply = """
                    ```json
                    {"translations": [{"id": "12", "translatedTitle": "标题", "translatedDescription": "描述"}]}
                    ```
                    """;
            when(httpClient.postJson(anyString(), anyMap(), any(), any(Duration.class))).thenReturn(completion(reply));

            // when
            TranslationResult result = client.translate(12L, "Title", "Description", SETTINGS);

            // then
            assertThat(result).isEqualTo(new TranslationResult("标题", "描述"));

            ArgumentCaptor<Object> body = ArgumentCaptor.forClass(Object.class);
            verify(httpClient).postJson(eq("https://openrouter.example/api/v1/chat/completions"),
                    eq(Map.of("Authorization", "Bearer sk-test")), body.capture(), eq(Duration.ofSeconds(120)));
            Map<String, Object> sent = (Map<String, Object>) body.getValue();
            assertThat(sent).containsEntry("model", "test-model")
                    .containsEntry("max_tokens", 2000)
                    .containsEntry("temperature", 0.3);
            assertThat((List<?>) sent.get("messages")).hasSize(2);
        }

        @Test
        @DisplayName("picks the element whose id matches the article")
        void matchesById() throws Exception {
            String reply = """
                    {"translations": [
                      {"id": "1", "translatedTitle": "一", "translatedDescription": "一"},
                      {"id": "2", "translatedTitle": "二", "translatedDescription": "二"}
                    ]}
                    """;
            when(httpClient.postJson(anyString(), anyMap(), any(), any(Duration.class))).thenReturn(completion(reply));

            assertThat(client.translate(2L, "Two", "Two", SETTINGS).translatedTitle()).isEqualTo("二");
        }

        @Test
        @DisplayName("invalid settings fail without a request")
        void invalidSettings() {
            AiSettings noKey = SETTINGS.toBuilder().apiKey(" ").build();

            assertThatThrownBy(() -> client.translate(1L, "T", "D", noKey))
                    .isInstanceOf(EnrichmentException.class)
                    .hasMessage("API key is not configured");
            verifyNoInteractions(httpClient);
        }

        @Test
        @DisplayName("empty completion is an enrichment error")
        void emptyCompletion() throws Exception {
            when(httpClient.postJson(anyString(), anyMap(), any(), any(Duration.class))).thenReturn(completion(" "));

            assertThatThrownBy(() -> client.translate(1L, "T", "D", SETTINGS))
                    .isInstanceOf(EnrichmentException.class)
                    .hasMessage("AI returned an empty result");
        }

        @Test
        @DisplayName("reply without translations is rejected")
        void missingTranslations() throws Exception {
            when(httpClient.postJson(anyString(), anyMap(), any(), any(Duration.class)))
                    .thenReturn(completion("{\"title\": \"标题\"}"));

            assertThatThrownBy(() -> client.translate(1L, "T", "D", SETTINGS))
                    .isInstanceOf(EnrichmentException.class)
                    .hasMessageContaining("translations");
        }

        @Test
        @DisplayName("unreachable provider is reported as a connection error")
        void connectionError() {
            when(httpClient.postJson(anyString(), anyMap(), any(), any(Duration.class)))
                    .thenThrow(new HttpFetchException("Connection refused", null));

            assertThatThrownBy(() -> client.translate(1L, "T", "D", SETTINGS))
                    .isInstanceOf(EnrichmentException.class)
                    .hasMessageStartingWith("Connection error: cannot reach https://openrouter.example/api/v1/");
        }
    }

    @Nested
    @DisplayName("translateContent")
    class TranslateContent {

        @SuppressWarnings("unchecked")
        private String sentUserPrompt() {
            ArgumentCaptor<Object> body = ArgumentCaptor.forClass(Object.class);
            verify(httpClient).postJson(anyString(), anyMap(), body.capture(), any(Duration.class));
            Map<String, Object> sent = (Map<String, Object>) body.getValue();
            assertThat(sent).containsEntry("max_tokens", 16000);
            List<Map<String, String>> messages = (List<Map<String, String>>) sent.get("messages");
            assertThat(messages.get(0).get("content")).contains("keep the HTML structure");
            return messages.get(1).get("content");
        }

        @Test
        @DisplayName("returns the translated markup without code fences")
        void translatesMarkup() throws Exception {
            // given
            when(httpClient.postJson(anyString(), anyMap(), any(), any(Duration.class)))
                    .thenReturn(completion("```html\n<p>你好，<a href=\"/x\">世界</a></p>\n```"));

            // when
            String translated = client.translateContent(3L, "<p>Hello, <a href=\"/x\">world</a></p>", SETTINGS);

            // then
            assertThat(translated).isEqualTo("<p>你好，<a href=\"/x\">世界</a></p>");
            assertThat(sentUserPrompt())
                    .contains("<p>Hello, <a href=\"/x\">world</a></p>")
                    .contains("Simplified Chinese")
                    .doesNotContain(OpenAiCompatibleClient.TRUNCATION_MARKER);
        }

        @Test
        @DisplayName("over-long content is cut and marked before sending")
        void truncatesLongContent() throws Exception {
            // given
            String html = "<p>" + "x".repeat(OpenAiCompatibleClient.MAX_CONTENT_LENGTH) + "</p>";
            when(httpClient.postJson(anyString(), anyMap(), any(), any(Duration.class)))
                    .thenReturn(completion("<p>译文</p>"));

            // when
            client.translateContent(3L, html, SETTINGS);

            // then
            assertThat(sentUserPrompt())
                    .contains(OpenAiCompatibleClient.TRUNCATION_MARKER)
                    .doesNotContain("</p>");
        }

        @Test
        @DisplayName("disabled AI fails without a request")
        void disabled() {
            AiSettings disabled = SETTINGS.toBuilder().enabled(false).build();

            assertThatThrownBy(() -> client.translateContent(3L, "<p>Hi</p>", disabled))
                    .isInstanceOf(EnrichmentException.class)
                    .hasMessage("AI features are disabled");
            verifyNoInteractions(httpClient);
        }

        @Test
        @DisplayName("empty completion is an enrichment error")
        void emptyCompletion() throws Exception {
            when(httpClient.postJson(anyString(), anyMap(), any(), any(Duration.class))).thenReturn(completion(""));

            assertThatThrownBy(() -> client.translateContent(3L, "<p>Hi</p>", SETTINGS))
                    .isInstanceOf(EnrichmentException.class)
                    .hasMessage("AI returned an empty result");
        }
    }

    @Test
    @DisplayName("content up to the limit is kept, longer content is cut at the limit")
    void truncateContent() {
        String atLimit = "a".repeat(OpenAiCompatibleClient.MAX_CONTENT_LENGTH);
        String overLimit = atLimit + "bcd";

        assertThat(OpenAiCompatibleClient.truncateContent(atLimit)).isSameAs(atLimit);
        assertThat(OpenAiCompatibleClient.truncateContent(overLimit))
                .isEqualTo(atLimit + "\n\n[Content truncated]");
    }

    @Test
    @DisplayName("summaries are trimmed plain text")
    void summarize() throws Exception {
        when(httpClient.postJson(anyString(), anyMap(), any(), any(Duration.class)))
                .thenReturn(completion("\n  这是一段摘要。  \n"));

        assertThat(client.summarize("Title", "Long content", SETTINGS)).isEqualTo("这是一段摘要。");
    }

    @Test
    @DisplayName("configured provider settings are the defaults")
    void defaults() {
        AiSettings defaults = client.defaultSettings();

        assertThat(defaults.isEnabled()).isFalse();
        assertThat(defaults.getBaseUrl()).isEqualTo("https://api.openai.com/v1");
        assertThat(defaults.getModelOrDefault()).isEqualTo("gpt-4o-mini");
    }

    @Test
    @DisplayName("code fences are stripped, plain replies pass through")
    void stripCodeFence() {
        assertThat(OpenAiCompatibleClient.stripCodeFence("```json\n{\"a\":1}\n```")).isEqualTo("{\"a\":1}");
        assertThat(OpenAiCompatibleClient.stripCodeFence("```\n{\"a\":1}\n```")).isEqualTo("{\"a\":1}");
        assertThat(OpenAiCompatibleClient.stripCodeFence("  {\"a\":1} ")).isEqualTo("{\"a\":1}");
    }
}
