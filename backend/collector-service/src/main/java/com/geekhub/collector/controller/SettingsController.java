package com.geekhub.collector.controller;

import com.geekhub.collector.dto.FeedUriParseResult;
import com.geekhub.collector.dto.GatewayRoute;
import com.geekhub.collector.dto.ProxySettings;
import com.geekhub.collector.dto.ProxyStatus;
import com.geekhub.collector.dto.RssHubSettings;
import com.geekhub.collector.service.proxy.ProxyResolver;
import com.geekhub.collector.service.rsshub.FeedUriResolver;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Runtime proxy and RssHub settings. Changes are held in memory only.
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class SettingsController {

    private final ProxyResolver proxyResolver;
    private final FeedUriResolver feedUriResolver;

    @GetMapping("/settings/proxy")
    public ResponseEntity<ProxySettings> getProxySettings() {
        return ResponseEntity.ok(proxyResolver.getSettings());
    }

    /**
     * PUT /api/settings/proxy - replace proxy settings; the next request re-detects
     */
    @PutMapping("/settings/proxy")
    public ResponseEntity<ProxySettings> updateProxySettings(@RequestBody ProxySettings settings) {
        proxyResolver.updateSettings(settings);
        return ResponseEntity.ok(proxyResolver.getSettings());
    }

    /**
     * GET /api/settings/proxy/test - re-detect and report the active route
     */
    @GetMapping("/settings/proxy/test")
    public Mono<ResponseEntity<ProxyStatus>> testProxy() {
        return Mono.fromCallable(() -> {
                    proxyResolver.invalidate();
                    return ResponseEntity.ok(proxyResolver.describe());
                })
                .subscribeOn(Schedulers.boundedElastic());
    }

    @GetMapping("/settings/rsshub")
    public ResponseEntity<RssHubSettings> getRssHubSettings() {
        return ResponseEntity.ok(feedUriResolver.getSettings());
    }

    @PutMapping("/settings/rsshub")
    public ResponseEntity<RssHubSettings> updateRssHubSettings(@RequestBody RssHubSettings settings) {
        feedUriResolver.updateSettings(settings);
        return ResponseEntity.ok(feedUriResolver.getSettings());
    }

    /**
     * GET /api/rsshub/resolve?input= - preview how a feed address resolves
     */
    @GetMapping("/rsshub/resolve")
    public ResponseEntity<Map<String, Object>> resolve(@RequestParam String input) {
        FeedUriParseResult result = feedUriResolver.parse(input);
        GatewayRoute route = feedUriResolver.extractRoute(input);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("result", result);
        if (!route.isEmpty()) {
            body.put("route", route);
        }
        return ResponseEntity.ok(body);
    }
}
