package tech.andrefsramos.meal_scraper.adapters.outbound.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tech.andrefsramos.meal_scraper.core.domain.CacheKey;
import tech.andrefsramos.meal_scraper.core.domain.CacheLookup;
import tech.andrefsramos.meal_scraper.core.domain.MenuKey;
import tech.andrefsramos.meal_scraper.core.domain.MenuSnapshot;
import tech.andrefsramos.meal_scraper.core.ports.MenuCachePort;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.concurrent.TimeUnit;

/*
 * Purpose

 * Read-through store for per-date menu snapshots, backed by a bounded Caffeine cache.
 *  - Capacity: maximumSize, Caffeine's size eviction drops the least useful (recency and frequency) entries.
 *  - Freshness: each entry carries its own expiresAt (write + ttl). Past it the entry is EXPIRED,
 *    never FRESH, but stays in memory until graceUntil (expiresAt + staleGrace) so a failed rebuild
 *    can still serve it as stale. Caffeine physically removes it at graceUntil.
 *  - Time comes from the injected Clock (also used as Caffeine's ticker), so tests drive both windows.
 */
public class CaffeineMenuCache implements MenuCachePort {

    private static final Logger log = LoggerFactory.getLogger(CaffeineMenuCache.class);

    private final Cache<CacheKey, Entry> cache;
    private final Clock clock;
    private final Duration ttl;
    private final Duration staleGrace;

    public CaffeineMenuCache(long maxEntries, Duration ttl, Duration staleGrace, Clock clock) {
        this.clock = clock;
        this.ttl = ttl;
        this.staleGrace = staleGrace == null || staleGrace.isNegative() ? Duration.ZERO : staleGrace;

        Ticker ticker = () -> TimeUnit.MILLISECONDS.toNanos(clock.millis());
        this.cache = Caffeine.newBuilder()
                .maximumSize(Math.max(1, maxEntries))
                .ticker(ticker)
                .executor(Runnable::run)
                .expireAfter(new GraceExpiry(clock))
                .recordStats()
                .build();

        log.info("[Cache] created maxEntries={} ttl={} staleGrace={}", maxEntries, ttl, this.staleGrace);
    }

    @Override
    public CacheLookup get(CacheKey key) {
        Entry e = cache.getIfPresent(key);
        if (e == null) return CacheLookup.miss();

        Instant now = clock.instant();
        if (now.isBefore(e.expiresAt())) {
            return new CacheLookup(CacheLookup.Status.FRESH, e.snapshot(), e.expiresAt(), e.graceUntil());
        }
        if (now.isBefore(e.graceUntil())) {
            return new CacheLookup(CacheLookup.Status.EXPIRED, e.snapshot(), e.expiresAt(), e.graceUntil());
        }
        cache.invalidate(key);
        return CacheLookup.miss();
    }

    @Override
    public void put(CacheKey key, MenuSnapshot snapshot, Duration entryTtl) {
        Instant now = clock.instant();
        Instant expiresAt = now.plus(entryTtl == null ? ttl : entryTtl);
        cache.put(key, new Entry(snapshot, expiresAt, expiresAt.plus(staleGrace)));
        if (log.isDebugEnabled()) {
            log.debug("[Cache] put key={} records={} expiresAt={}", key, snapshot.records().size(), expiresAt);
        }
    }

    @Override
    public void put(CacheKey key, MenuSnapshot snapshot) {
        put(key, snapshot, ttl);
    }

    @Override
    public void invalidate(CacheKey key) {
        cache.invalidate(key);
    }

    @Override
    public void invalidateMenus(Collection<MenuKey> keys) {
        if (keys == null || keys.isEmpty()) return;
        Set<CacheKey> drop = new LinkedHashSet<>();
        for (MenuKey k : keys) {
            drop.add(CacheKey.of(k.providerId(), k.servingDate()));
            drop.add(CacheKey.allProviders(k.servingDate()));
        }
        cache.invalidateAll(drop);
        if (log.isDebugEnabled()) {
            log.debug("[Cache] invalidated {} entries for {} menu keys", drop.size(), keys.size());
        }
    }

    /** Entries currently held, after pending evictions. */
    public long size() {
        cache.cleanUp();
        return cache.estimatedSize();
    }

    record Entry(MenuSnapshot snapshot, Instant expiresAt, Instant graceUntil) {}

    private static final class GraceExpiry implements Expiry<CacheKey, Entry> {

        private final Clock clock;

        private GraceExpiry(Clock clock) {
            this.clock = clock;
        }

        @Override
        public long expireAfterCreate(CacheKey key, Entry value, long currentTime) {
            return untilGraceEnds(value);
        }

        @Override
        public long expireAfterUpdate(CacheKey key, Entry value, long currentTime, long currentDuration) {
            return untilGraceEnds(value);
        }

        @Override
        public long expireAfterRead(CacheKey key, Entry value, long currentTime, long currentDuration) {
            return currentDuration;
        }

        private long untilGraceEnds(Entry value) {
            long nanos = Duration.between(clock.instant(), value.graceUntil()).toNanos();
            return Math.max(0, nanos);
        }
    }
}
