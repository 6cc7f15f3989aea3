package com.geekhub.collector.dto;

public record EnrichmentQueueStats(int queued, int processing, int concurrency) {
}
