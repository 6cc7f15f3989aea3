package com.geekhub.collector.service.feed;

import com.geekhub.collector.dto.DueFetchSummary;
import com.geekhub.collector.dto.FeedInfo;
import com.geekhub.collector.dto.FetchResult;
import com.geekhub.collector.entity.Feed;
import com.geekhub.collector.entity.FetchStatus;
import com.geekhub.collector.repository.FeedRepository;
import com.geekhub.collector.repository.FetchStatusRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Polls for feeds whose next fetch time has passed and fetches them one by one.
 * Holds no timer itself; a cron caller or {@code DueFeedScheduler} drives it.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DueFeedService {

    private final FeedRepository feedRepository;
    private final FetchStatusRepository fetchStatusRepository;
    private final FeedFetchService feedFetchService;
    private final Clock clock;

    private final AtomicBoolean running = new AtomicBoolean(false);

    /**
     * Active feeds that were never fetched, or whose {@code nextFetchAt} is not after {@code now}.
     */
    public List<FeedInfo> findDueFeeds(List<Feed> activeFeeds, LocalDateTime now) {
        Map<Long, FetchStatus> statuses = fetchStatusRepository.findAllById(
                        activeFeeds.stream().map(Feed::getId).toList())
                .stream()
                .collect(Collectors.toMap(FetchStatus::getFeedId, Function.identity()));

        return activeFeeds.stream()
                .filter(feed -> {
                    FetchStatus status = statuses.get(feed.getId());
                    return status == null || status.isDue(now);
                })
                .map(FeedInfo::from)
                .toList();
    }

    public List<FeedInfo> findDueFeeds(LocalDateTime now) {
        return findDueFeeds(feedRepository.findByActiveTrue(), now);
    }

    /**
     * Fetches every due feed. A call made while another cycle is running returns immediately.
     */
    public DueFetchSummary fetchDueFeeds() {
        if (!running.compareAndSet(false, true)) {
            log.info("Skipping due-feed cycle: previous cycle still running");
            return DueFetchSummary.alreadyRunning();
        }
        try {
            List<Feed> activeFeeds = feedRepository.findByActiveTrue();
            List<FeedInfo> dueFeeds = findDueFeeds(activeFeeds, LocalDateTime.now(clock));
            log.info("Due-feed cycle: {} active, {} due", activeFeeds.size(), dueFeeds.size());

            int succeeded = 0;
            int failed = 0;
            int articlesNew = 0;
            for (FeedInfo feed : dueFeeds) {
                FetchResult result = feedFetchService.fetch(feed);
                if (result.success()) {
                    succeeded++;
                    articlesNew += result.articlesNew();
                } else {
                    failed++;
                }
            }

            log.info("Due-feed cycle done: succeeded={}, failed={}, new articles={}", succeeded, failed, articlesNew);
            return new DueFetchSummary(false, activeFeeds.size(), dueFeeds.size(), succeeded, failed, articlesNew);
        } finally {
            running.set(false);
        }
    }

    public boolean isRunning() {
        return running.get();
    }
}
