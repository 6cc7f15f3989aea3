package com.geekhub.collector.service.feed;

import com.geekhub.collector.dto.FeedInfo;
import com.geekhub.collector.entity.FetchLogEntry;
import com.geekhub.collector.entity.LogLevel;
import com.geekhub.collector.repository.FetchLogRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Per-feed structured log, rendered in the crawler console.
 *
 * Writing a log line never fails the caller; storage errors go to the application log.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class FeedLogService {

    public static final int DEFAULT_LINES = 100;
    private static final int MAX_LINES = 1000;

    private final FetchLogRepository fetchLogRepository;
    private final Clock clock;

    public void info(FeedInfo feed, String action, String url, String message) {
        write(feed, LogLevel.INFO, null, action, url, null, message);
    }

    public void success(FeedInfo feed, int status, String action, String url, Long durationMs, String message) {
        write(feed, LogLevel.SUCCESS, status, action, url, durationMs, message);
    }

    public void warning(FeedInfo feed, String action, String url, String message) {
        write(feed, LogLevel.WARNING, null, action, url, null, message);
    }

    public void error(FeedInfo feed, String action, String url, String message) {
        write(feed, LogLevel.ERROR, null, action, url, null, message);
    }

    /**
     * @return the latest {@code limit} lines of the feed, oldest first
     */
    public List<String> recentLines(Long feedId, int limit) {
        int size = limit <= 0 ? DEFAULT_LINES : Math.min(limit, MAX_LINES);
        List<FetchLogEntry> latest = new ArrayList<>(
                fetchLogRepository.findByFeedIdOrderByTimestampDescIdDesc(feedId, PageRequest.of(0, size)));
        Collections.reverse(latest);
        return latest.stream().map(FetchLogEntry::format).toList();
    }

    private void write(FeedInfo feed, LogLevel level, Integer status, String action, String url,
                       Long durationMs, String message) {
        FetchLogEntry entry = FetchLogEntry.builder()
                .feedId(feed.id())
                .urlHash(feed.urlHash())
                .timestamp(LocalDateTime.now(clock))
                .level(level)
                .status(status)
                .action(action)
                .url(url)
                .durationMs(durationMs)
                .message(message)
                .build();
        log.debug("[feed {}] {}", feed.id(), entry.format());
        try {
            fetchLogRepository.save(entry);
        } catch (Exception e) {
            log.warn("Failed to write feed log for feed {}: {}", feed.id(), e.getMessage());
        }
    }
}
