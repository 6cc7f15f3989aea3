package com.geekhub.collector.service.feed;

import com.geekhub.collector.dto.FeedInfo;
import com.geekhub.collector.dto.FetchResult;
import com.geekhub.collector.entity.FetchHistory;
import com.geekhub.collector.entity.FetchOutcome;
import com.geekhub.collector.entity.FetchStatus;
import com.geekhub.collector.repository.ArticleRepository;
import com.geekhub.collector.repository.FetchHistoryRepository;
import com.geekhub.collector.repository.FetchStatusRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Records the outcome of every fetch attempt and schedules the next one.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class FetchStatusService {

    private static final int MAX_HISTORY = 100;

    private final FetchStatusRepository fetchStatusRepository;
    private final FetchHistoryRepository fetchHistoryRepository;
    private final ArticleRepository articleRepository;
    private final Clock clock;

    /**
     * Upserts the feed's status row and appends a history row.
     * {@code nextFetchAt} is always {@code lastFetchAt} plus the feed's interval, whatever the outcome.
     * Write failures are logged and swallowed; there is nowhere else to report them.
     */
    public void record(FeedInfo feed, FetchResult result) {
        LocalDateTime now = LocalDateTime.now(clock);
        FetchOutcome outcome = result.success() ? FetchOutcome.SUCCESS : FetchOutcome.ERROR;

        try {
            FetchStatus status = fetchStatusRepository.findById(feed.id())
                    .orElseGet(() -> FetchStatus.builder().feedId(feed.id()).build());
            status.setLastFetchAt(now);
            status.setLastFetchStatus(outcome);
            status.setLastFetchError(result.error());
            status.setLastFetchDurationMs(result.durationMs());
            if (result.success()) {
                status.setLastSuccessAt(now);
            }
            status.setTotalArticles(articleRepository.countByFeedId(feed.id()));
            status.setNextFetchAt(now.plusMinutes(feed.fetchIntervalMinutes()));
            fetchStatusRepository.save(status);
        } catch (Exception e) {
            log.error("Failed to update fetch status for feed {}: {}", feed.id(), e.getMessage(), e);
        }

        try {
            fetchHistoryRepository.save(FetchHistory.builder()
                    .feedId(feed.id())
                    .fetchedAt(now)
                    .status(outcome)
                    .durationMs(result.durationMs())
                    .articlesFound(result.articlesFound())
                    .articlesNew(result.articlesNew())
                    .errorMessage(result.error())
                    .build());
        } catch (Exception e) {
            log.error("Failed to insert fetch history for feed {}: {}", feed.id(), e.getMessage(), e);
        }
    }

    public Optional<FetchStatus> findStatus(Long feedId) {
        return fetchStatusRepository.findById(feedId);
    }

    public List<FetchHistory> recentHistory(Long feedId, int limit) {
        int size = limit <= 0 ? 20 : Math.min(limit, MAX_HISTORY);
        return fetchHistoryRepository.findByFeedIdOrderByFetchedAtDesc(feedId, PageRequest.of(0, size));
    }
}
