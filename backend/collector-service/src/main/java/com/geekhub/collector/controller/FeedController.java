package com.geekhub.collector.controller;

import com.geekhub.collector.dto.DueFetchSummary;
import com.geekhub.collector.dto.FeedInfo;
import com.geekhub.collector.dto.FetchResult;
import com.geekhub.collector.entity.FetchHistory;
import com.geekhub.collector.entity.FetchStatus;
import com.geekhub.collector.service.feed.DueFeedService;
import com.geekhub.collector.service.feed.FeedLogService;
import com.geekhub.collector.service.feed.FeedService;
import com.geekhub.collector.service.feed.FetchStatusService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/feeds")
@RequiredArgsConstructor
public class FeedController {

    private final FeedService feedService;
    private final DueFeedService dueFeedService;
    private final FetchStatusService fetchStatusService;
    private final FeedLogService feedLogService;

    /**
     * POST /api/feeds/{id}/fetch - fetch one feed now
     */
    @PostMapping("/{id}/fetch")
    public Mono<ResponseEntity<FetchResult>> fetchFeed(@PathVariable Long id) {
        return Mono.fromCallable(() -> ResponseEntity.ok(feedService.fetchNow(id)))
                .subscribeOn(Schedulers.boundedElastic());
    }

    /**
     * POST /api/feeds/fetch-due - fetch every active feed whose next fetch time has passed
     */
    @PostMapping("/fetch-due")
    public Mono<ResponseEntity<DueFetchSummary>> fetchDueFeeds() {
        return Mono.fromCallable(() -> ResponseEntity.ok(dueFeedService.fetchDueFeeds()))
                .subscribeOn(Schedulers.boundedElastic());
    }

    /**
     * GET /api/feeds/{id}/status - latest fetch status; 404 if the feed was never fetched
     */
    @GetMapping("/{id}/status")
    public Mono<ResponseEntity<FetchStatus>> getStatus(@PathVariable Long id) {
        return Mono.fromCallable(() -> {
                    FeedInfo feed = feedService.getFeedInfo(id);
                    return fetchStatusService.findStatus(feed.id())
                            .map(ResponseEntity::ok)
                            .orElse(ResponseEntity.notFound().build());
                })
                .subscribeOn(Schedulers.boundedElastic());
    }

    /**
     * GET /api/feeds/{id}/history - recent fetch attempts, newest first
     */
    @GetMapping("/{id}/history")
    public Mono<ResponseEntity<List<FetchHistory>>> getHistory(
            @PathVariable Long id,
            @RequestParam(defaultValue = "20") int limit) {
        return Mono.fromCallable(() -> {
                    FeedInfo feed = feedService.getFeedInfo(id);
                    return ResponseEntity.ok(fetchStatusService.recentHistory(feed.id(), limit));
                })
                .subscribeOn(Schedulers.boundedElastic());
    }

    /**
     * GET /api/feeds/{id}/logs - formatted feed log lines, oldest first
     */
    @GetMapping("/{id}/logs")
    public Mono<ResponseEntity<Map<String, Object>>> getLogs(
            @PathVariable Long id,
            @RequestParam(defaultValue = "" + FeedLogService.DEFAULT_LINES) int limit) {
        return Mono.fromCallable(() -> {
                    FeedInfo feed = feedService.getFeedInfo(id);
                    List<String> lines = feedLogService.recentLines(feed.id(), limit);
                    return ResponseEntity.ok(Map.<String, Object>of(
                            "feedId", feed.id(),
                            "urlHash", feed.urlHash() != null ? feed.urlHash() : "",
                            "logs", lines
                    ));
                })
                .subscribeOn(Schedulers.boundedElastic());
    }
}
