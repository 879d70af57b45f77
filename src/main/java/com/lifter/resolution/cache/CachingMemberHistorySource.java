package com.lifter.resolution.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.lifter.resolution.metrics.MetricsService;
import com.lifter.resolution.metrics.NoOpMetricsService;
import com.lifter.resolution.source.HistoryPage;
import com.lifter.resolution.source.MemberHistorySource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Locale;
import java.util.Optional;

/**
 * Caffeine-backed decorator for a {@link MemberHistorySource}.
 *
 * <p>Several candidates of one batch often share a history page, and a tier retried after an
 * INCONCLUSIVE outcome repeats its lookups. Only successful answers are cached; a
 * {@code SourceUnavailableException} passes through and leaves the cache untouched.</p>
 */
public class CachingMemberHistorySource implements MemberHistorySource {
    private static final Logger log = LoggerFactory.getLogger(CachingMemberHistorySource.class);

    private final MemberHistorySource delegate;
    private final MetricsService metricsService;
    private final Cache<PageKey, HistoryPage> pages;
    private final Cache<String, Optional<Long>> searches;

    public CachingMemberHistorySource(MemberHistorySource delegate, long maxSize, Duration ttl) {
        this(delegate, maxSize, ttl, new NoOpMetricsService());
    }

    public CachingMemberHistorySource(MemberHistorySource delegate, long maxSize, Duration ttl,
                                      MetricsService metricsService) {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be > 0");
        }
        this.delegate = delegate;
        this.metricsService = metricsService;
        this.pages = Caffeine.newBuilder()
                .maximumSize(maxSize)
                .expireAfterWrite(ttl)
                .recordStats()
                .build();
        this.searches = Caffeine.newBuilder()
                .maximumSize(maxSize)
                .expireAfterWrite(ttl)
                .recordStats()
                .build();
        log.info("CachingMemberHistorySource initialized: maxSize={}, ttl={}s", maxSize, ttl.toSeconds());
    }

    @Override
    public HistoryPage getHistory(long stableId, int page) {
        PageKey key = new PageKey(stableId, page);
        HistoryPage cached = pages.getIfPresent(key);
        if (cached != null) {
            metricsService.recordCacheHit();
            return cached;
        }
        metricsService.recordCacheMiss();
        HistoryPage fetched = delegate.getHistory(stableId, page);
        pages.put(key, fetched);
        return fetched;
    }

    @Override
    public Optional<Long> searchByName(String name) {
        String key = name.trim().toUpperCase(Locale.ROOT);
        Optional<Long> cached = searches.getIfPresent(key);
        if (cached != null) {
            metricsService.recordCacheHit();
            return cached;
        }
        metricsService.recordCacheMiss();
        Optional<Long> fetched = delegate.searchByName(name);
        searches.put(key, fetched);
        return fetched;
    }

    /**
     * Drops every cached page of one athlete, e.g. after a new result was recorded for them.
     */
    public void invalidate(long stableId) {
        pages.asMap().keySet().removeIf(k -> k.stableId() == stableId);
        log.debug("Invalidated history cache for stableId {}", stableId);
    }

    public void invalidateAll() {
        pages.invalidateAll();
        searches.invalidateAll();
    }

    public long estimatedSize() {
        return pages.estimatedSize() + searches.estimatedSize();
    }

    record PageKey(long stableId, int page) {}
}
