package com.geekhub.collector.service.feed;

import com.geekhub.collector.dto.FeedInfo;
import com.geekhub.collector.dto.FetchResult;
import com.geekhub.collector.entity.Feed;
import com.geekhub.collector.exception.FeedNotFoundException;
import com.geekhub.collector.repository.FeedRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Entry point for "fetch now" requests on a single subscription.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class FeedService {

    private final FeedRepository feedRepository;
    private final FeedFetchService feedFetchService;

    public FeedInfo getFeedInfo(Long feedId) {
        Feed feed = feedRepository.findById(feedId)
                .orElseThrow(() -> new FeedNotFoundException(feedId));
        return FeedInfo.from(feed);
    }

    public FetchResult fetchNow(Long feedId) {
        FeedInfo feed = getFeedInfo(feedId);
        log.info("Manual fetch requested for feed {} ({})", feed.id(), feed.url());
        return feedFetchService.fetch(feed);
    }
}
