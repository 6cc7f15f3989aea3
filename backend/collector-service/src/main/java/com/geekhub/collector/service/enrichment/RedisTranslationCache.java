package com.geekhub.collector.service.enrichment;

import com.geekhub.collector.dto.TranslationCacheEntry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;

/**
 * Translation cache in Redis with a 7-day horizon by default.
 *
 * Redis errors are logged and treated as misses, so an outage only costs extra provider calls.
 */
@Service
@Slf4j
public class RedisTranslationCache implements TranslationCache {

    private final RedisTemplate<String, TranslationCacheEntry> redisTemplate;
    private final Clock clock;
    private final String keyPrefix;
    private final Duration ttl;

    public RedisTranslationCache(
            RedisTemplate<String, TranslationCacheEntry> translationRedisTemplate,
            Clock clock,
            @Value("${collector.enrichment.cache-key-prefix:geekhub:translation:}") String keyPrefix,
            @Value("${collector.enrichment.cache-ttl-days:7}") long ttlDays) {
        this.redisTemplate = translationRedisTemplate;
        this.clock = clock;
        this.keyPrefix = keyPrefix;
        this.ttl = Duration.ofDays(ttlDays);
    }

    @Override
    public Optional<TranslationCacheEntry> get(Long articleId) {
        try {
            TranslationCacheEntry cached = redisTemplate.opsForValue().get(key(articleId));
            if (cached == null) {
                log.debug("Translation cache MISS for article {}", articleId);
                return Optional.empty();
            }
            // entries written under a longer TTL still age out here
            if (cached.isExpired(clock.instant(), ttl)) {
                log.debug("Translation cache entry expired for article {}", articleId);
                evict(articleId);
                return Optional.empty();
            }
            log.debug("Translation cache HIT for article {}", articleId);
            return Optional.of(cached);
        } catch (Exception e) {
            log.warn("Error reading translation cache for article {}: {}", articleId, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public void put(TranslationCacheEntry entry) {
        try {
            redisTemplate.opsForValue().set(key(entry.articleId()), entry, ttl);
        } catch (Exception e) {
            log.warn("Error caching translation for article {}: {}", entry.articleId(), e.getMessage());
        }
    }

    @Override
    public void evict(Long articleId) {
        try {
            redisTemplate.delete(key(articleId));
        } catch (Exception e) {
            log.warn("Error evicting translation for article {}: {}", articleId, e.getMessage());
        }
    }

    private String key(Long articleId) {
        return keyPrefix + articleId;
    }
}
