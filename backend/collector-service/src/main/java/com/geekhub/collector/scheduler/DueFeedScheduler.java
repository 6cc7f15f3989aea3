package com.geekhub.collector.scheduler;

import com.geekhub.collector.dto.DueFetchSummary;
import com.geekhub.collector.service.feed.DueFeedService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Optional in-process trigger for the due-feed poll. Off by default; deployments
 * usually call {@code POST /api/feeds/fetch-due} from an external cron instead.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DueFeedScheduler {

    private final DueFeedService dueFeedService;

    @Value("${collector.scheduling.enabled:false}")
    private boolean schedulingEnabled;

    @Scheduled(fixedDelayString = "${collector.scheduling.poll-interval-ms:900000}",
            initialDelayString = "${collector.scheduling.initial-delay-ms:60000}")
    public void pollDueFeeds() {
        if (!schedulingEnabled) {
            log.debug("Scheduled feed polling is disabled");
            return;
        }
        try {
            DueFetchSummary summary = dueFeedService.fetchDueFeeds();
            if (summary.skipped()) {
                log.info("Scheduled poll skipped: previous cycle still running");
            }
        } catch (Exception e) {
            log.error("Scheduled feed polling failed: {}", e.getMessage(), e);
        }
    }
}
