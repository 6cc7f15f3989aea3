package com.geekhub.collector.service.enrichment;

import com.geekhub.collector.dto.AiSettings;
import com.geekhub.collector.dto.EnrichmentQueueStats;
import com.geekhub.collector.dto.TranslationCacheEntry;
import com.geekhub.collector.dto.TranslationResult;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Background translation of articles.
 *
 * <ul>
 *   <li>an article that is already queued or running for the same {@link EnrichmentJob.Kind} is not enqueued again</li>
 *   <li>a cached title and summary translation is applied immediately, without calling the provider</li>
 *   <li>at most {@code collector.enrichment.concurrency} jobs run at once; the rest wait in FIFO order</li>
 * </ul>
 * Pending and in-flight ids are guarded by one lock. A finished job, failed or not,
 * releases its id so the article can be enqueued again.
 */
@Service
@Slf4j
public class EnrichmentQueue {

    private final EnrichmentBackend backend;
    private final TranslationCache translationCache;
    private final ArticleTranslationService articleTranslationService;
    private final Executor executor;
    private final MeterRegistry meterRegistry;
    private final Clock clock;
    private final int concurrency;

    private final Semaphore permits;
    private final ReentrantLock lock = new ReentrantLock();
    private final Map<JobKey, EnrichmentJob> pending = new LinkedHashMap<>();
    private final Set<JobKey> inFlight = new HashSet<>();

    public EnrichmentQueue(
            EnrichmentBackend backend,
            TranslationCache translationCache,
            ArticleTranslationService articleTranslationService,
            @Qualifier("enrichmentExecutor") Executor executor,
            MeterRegistry meterRegistry,
            Clock clock,
            @Value("${collector.enrichment.concurrency:10}") int concurrency) {
        if (concurrency < 1) {
            throw new IllegalArgumentException("Enrichment concurrency must be at least 1: " + concurrency);
        }
        this.backend = backend;
        this.translationCache = translationCache;
        this.articleTranslationService = articleTranslationService;
        this.executor = executor;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
        this.concurrency = concurrency;
        this.permits = new Semaphore(concurrency);
    }

    /**
     * Schedules a translation and returns immediately. Never throws for job failures.
     */
    public void enqueue(EnrichmentJob job) {
        Long articleId = job.articleId();
        JobKey key = JobKey.of(job);
        if (isInQueue(articleId, job.kind())) {
            log.debug("Article {} already queued for {} translation", articleId, job.kind());
            return;
        }

        Optional<TranslationCacheEntry> cached = job.kind() == EnrichmentJob.Kind.TITLE_AND_SUMMARY
                ? translationCache.get(articleId)
                : Optional.empty();
        if (cached.isPresent()) {
            try {
                complete(job, cached.get().toResult());
                meterRegistry.counter("collector.enrichment", "outcome", "cached").increment();
            } catch (Exception e) {
                log.error("Failed to apply cached translation for article {}: {}", articleId, e.getMessage(), e);
            }
            return;
        }

        lock.lock();
        try {
            if (pending.containsKey(key) || inFlight.contains(key)) {
                return;
            }
            pending.put(key, job);
        } finally {
            lock.unlock();
        }
        dispatch();
    }

    /**
     * @return whether a title and summary translation of the article is waiting or running
     */
    public boolean isInQueue(Long articleId) {
        return isInQueue(articleId, EnrichmentJob.Kind.TITLE_AND_SUMMARY);
    }

    public boolean isInQueue(Long articleId, EnrichmentJob.Kind kind) {
        JobKey key = new JobKey(articleId, kind);
        lock.lock();
        try {
            return pending.containsKey(key) || inFlight.contains(key);
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return jobs waiting for a free slot
     */
    public int getQueueSize() {
        lock.lock();
        try {
            return pending.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return jobs currently running
     */
    public int getProcessingCount() {
        lock.lock();
        try {
            return inFlight.size();
        } finally {
            lock.unlock();
        }
    }

    public EnrichmentQueueStats stats() {
        lock.lock();
        try {
            return new EnrichmentQueueStats(pending.size(), inFlight.size(), concurrency);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Starts waiting jobs while permits are available.
     */
    private void dispatch() {
        while (true) {
            EnrichmentJob next;
            lock.lock();
            try {
                if (pending.isEmpty() || !permits.tryAcquire()) {
                    return;
                }
                Iterator<EnrichmentJob> iterator = pending.values().iterator();
                next = iterator.next();
                iterator.remove();
                inFlight.add(JobKey.of(next));
            } finally {
                lock.unlock();
            }

            try {
                executor.execute(() -> run(next));
            } catch (RejectedExecutionException e) {
                log.warn("Translation of article {} rejected by executor: {}", next.articleId(), e.getMessage());
                release(JobKey.of(next));
                return;
            }
        }
    }

    private void run(EnrichmentJob job) {
        Long articleId = job.articleId();
        try {
            AiSettings settings = job.settings() != null ? job.settings() : backend.defaultSettings();
            TranslationResult result;
            if (job.kind() == EnrichmentJob.Kind.CONTENT) {
                result = TranslationResult.content(backend.translateContent(articleId, job.content(), settings));
            } else {
                result = backend.translate(articleId, job.title(), job.description(), settings);
                translationCache.put(new TranslationCacheEntry(
                        articleId,
                        job.title(),
                        job.description(),
                        result.translatedTitle(),
                        result.translatedDescription(),
                        clock.instant()));
            }
            complete(job, result);

            meterRegistry.counter("collector.enrichment", "outcome", "success").increment();
            log.debug("Translated article {} ({})", articleId, job.kind());
        } catch (Exception e) {
            meterRegistry.counter("collector.enrichment", "outcome", "error").increment();
            log.error("Translation failed for article {} ({}): {}", articleId, job.kind(), e.getMessage(), e);
        } finally {
            release(JobKey.of(job));
            dispatch();
        }
    }

    private void complete(EnrichmentJob job, TranslationResult result) {
        if (job.kind() == EnrichmentJob.Kind.CONTENT) {
            articleTranslationService.applyContent(job.articleId(), result.translatedContent());
        } else {
            articleTranslationService.apply(job.articleId(), result);
        }
        if (job.onSuccess() != null) {
            job.onSuccess().accept(job.articleId(), result);
        }
    }

    private void release(JobKey key) {
        lock.lock();
        try {
            inFlight.remove(key);
        } finally {
            lock.unlock();
        }
        permits.release();
    }

    private record JobKey(Long articleId, EnrichmentJob.Kind kind) {

        static JobKey of(EnrichmentJob job) {
            return new JobKey(job.articleId(), job.kind());
        }
    }
}
