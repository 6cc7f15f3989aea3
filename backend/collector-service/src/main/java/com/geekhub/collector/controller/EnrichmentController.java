package com.geekhub.collector.controller;

import com.geekhub.collector.dto.AiSettings;
import com.geekhub.collector.dto.EnrichmentQueueStats;
import com.geekhub.collector.dto.SummarizeRequest;
import com.geekhub.collector.dto.SummaryResponse;
import com.geekhub.collector.service.enrichment.EnrichmentBackend;
import com.geekhub.collector.service.enrichment.EnrichmentQueue;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class EnrichmentController {

    private final EnrichmentQueue enrichmentQueue;
    private final EnrichmentBackend enrichmentBackend;

    /**
     * GET /api/enrichment/queue - waiting and running translation jobs
     */
    @GetMapping("/enrichment/queue")
    public ResponseEntity<EnrichmentQueueStats> getQueueStats() {
        return ResponseEntity.ok(enrichmentQueue.stats());
    }

    /**
     * POST /api/ai/summarize - synchronous summary, not queued
     */
    @PostMapping("/ai/summarize")
    public Mono<ResponseEntity<SummaryResponse>> summarize(@Valid @RequestBody SummarizeRequest request) {
        AiSettings settings = request.getAiSettings() != null
                ? request.getAiSettings()
                : enrichmentBackend.defaultSettings();
        return Mono.fromCallable(() -> {
                    String summary = enrichmentBackend.summarize(request.getTitle(), request.getContent(), settings);
                    return ResponseEntity.ok(new SummaryResponse(true, summary, settings.getModelOrDefault()));
                })
                .subscribeOn(Schedulers.boundedElastic());
    }
}
