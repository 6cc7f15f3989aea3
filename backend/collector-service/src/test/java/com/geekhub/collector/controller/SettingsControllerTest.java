package com.geekhub.collector.controller;

import com.geekhub.collector.dto.ProxySettings;
import com.geekhub.collector.dto.ProxyStatus;
import com.geekhub.collector.dto.RssHubSettings;
import com.geekhub.collector.service.proxy.ProxyEndpoint;
import com.geekhub.collector.service.proxy.ProxyMode;
import com.geekhub.collector.service.proxy.ProxyResolver;
import com.geekhub.collector.service.rsshub.FeedUriResolver;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.WebFluxTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.time.LocalDateTime;
import java.util.Map;

import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@WebFluxTest(SettingsController.class)
@Import(FeedUriResolver.class)
@ActiveProfiles("test")
class SettingsControllerTest {

    @Autowired
    private WebTestClient webTestClient;

    @Autowired
    private FeedUriResolver feedUriResolver;

    @MockBean
    private ProxyResolver proxyResolver;

    @Test
    @DisplayName("GET /api/rsshub/resolve - custom scheme resolves against the default gateway")
    void resolveScheme() {
        webTestClient.get()
            .uri(uriBuilder -> uriBuilder.path("/api/rsshub/resolve").queryParam("input", "rsshub://sspai/index").build())
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.result.valid").isEqualTo(true)
            .jsonPath("$.result.feedUrl").isEqualTo("https://rsshub.app/sspai/index")
            .jsonPath("$.route.namespace").isEqualTo("sspai")
            .jsonPath("$.route.route").isEqualTo("index");
    }

    @Test
    @DisplayName("GET /api/rsshub/resolve - ordinary site is not a gateway address")
    void resolveForeignUrl() {
        webTestClient.get()
            .uri(uriBuilder -> uriBuilder.path("/api/rsshub/resolve").queryParam("input", "https://example.com/feed").build())
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.result.valid").isEqualTo(false)
            .jsonPath("$.result.error").isEqualTo("Not a RssHub URL")
            .jsonPath("$.route").doesNotExist();
    }

    @Test
    @DisplayName("PUT /api/settings/rsshub - custom instance is used for later resolution")
    void updateRssHub() {
        try {
            webTestClient.put()
                .uri("/api/settings/rsshub")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("enabled", true, "url", "https://rsshub.example.org/"))
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.enabled").isEqualTo(true);

            webTestClient.get()
                .uri(uriBuilder -> uriBuilder.path("/api/rsshub/resolve").queryParam("input", "rsshub://sspai/index").build())
                .exchange()
                .expectBody()
                .jsonPath("$.result.feedUrl").isEqualTo("https://rsshub.example.org/sspai/index");
        } finally {
            feedUriResolver.updateSettings(new RssHubSettings(false, null));
        }
    }

    @Test
    @DisplayName("PUT /api/settings/proxy - settings are handed to the resolver")
    void updateProxy() {
        ProxySettings settings = new ProxySettings(true, false, "127.0.0.1", "7890");
        when(proxyResolver.getSettings()).thenReturn(settings);

        webTestClient.put()
            .uri("/api/settings/proxy")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(settings)
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.host").isEqualTo("127.0.0.1")
            .jsonPath("$.port").isEqualTo("7890");

        verify(proxyResolver).updateSettings(settings);
    }

    @Test
    @DisplayName("GET /api/settings/proxy/test - re-detects before reporting")
    void testProxy() {
        when(proxyResolver.describe()).thenReturn(ProxyStatus.of(
                new ProxyEndpoint("127.0.0.1", 7890, ProxyMode.AUTO_DETECTED), LocalDateTime.of(2024, 5, 1, 8, 0)));

        webTestClient.get()
            .uri("/api/settings/proxy/test")
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.mode").isEqualTo("AUTO_DETECTED")
            .jsonPath("$.proxyUrl").isEqualTo("http://127.0.0.1:7890");

        InOrder order = inOrder(proxyResolver);
        order.verify(proxyResolver).invalidate();
        order.verify(proxyResolver).describe();
    }
}
