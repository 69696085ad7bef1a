package tech.andrefsramos.meal_scraper.core.application.impl;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tech.andrefsramos.meal_scraper.core.application.ListMenusUseCase;
import tech.andrefsramos.meal_scraper.core.domain.CacheKey;
import tech.andrefsramos.meal_scraper.core.domain.CacheLookup;
import tech.andrefsramos.meal_scraper.core.domain.MealSlot;
import tech.andrefsramos.meal_scraper.core.domain.MenuFilter;
import tech.andrefsramos.meal_scraper.core.domain.MenuKey;
import tech.andrefsramos.meal_scraper.core.domain.MenuPage;
import tech.andrefsramos.meal_scraper.core.domain.MenuRecord;
import tech.andrefsramos.meal_scraper.core.domain.MenuSnapshot;
import tech.andrefsramos.meal_scraper.core.domain.PageToken;
import tech.andrefsramos.meal_scraper.core.domain.exception.InvalidFilterException;
import tech.andrefsramos.meal_scraper.core.domain.exception.MenuStoreUnavailableException;
import tech.andrefsramos.meal_scraper.core.ports.MenuCachePort;
import tech.andrefsramos.meal_scraper.core.ports.MenuRecordRepository;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/*
 * Purpose

 * Read side. Every read goes through one cached snapshot per (provider or all, serving date):
 *  1) Filter resolution: no dates means today in the configured zone; a single date is a
 *     one-day range; a reversed range is swapped; ranges over maxRangeDays are rejected.
 *  2) Keyset pagination: records come out in (servingDate, providerId, mealSlot) order and a page
 *     resumes strictly after the key carried by the token, so records inserted between two page
 *     requests never shift what was already returned.
 *  3) Cache rebuild: an expired or missing snapshot is re-read from the store. If the store fails
 *     and the expired snapshot is still inside its grace window, that snapshot is served and the
 *     page is flagged stale; otherwise the read fails with MenuStoreUnavailableException.
 *  4) Latest per provider: the most recently updated record of every (provider, slot) pair found in the
 *     resolved range, read through the same snapshots.
 * Never blocks on a crawl.
 */
public class ListMenusService implements ListMenusUseCase {

    private static final Logger log = LoggerFactory.getLogger(ListMenusService.class);

    private static final Comparator<MenuRecord> NEWEST_FIRST = Comparator
            .comparing(MenuRecord::lastUpdatedAt, Comparator.nullsLast(Comparator.reverseOrder()))
            .thenComparing(MenuRecord::servingDate, Comparator.reverseOrder());
    private static final Comparator<MenuRecord> BY_PROVIDER_AND_SLOT = Comparator
            .comparing(MenuRecord::providerId)
            .thenComparing(MenuRecord::mealSlot);

    private final MenuRecordRepository repository;
    private final MenuCachePort cache;
    private final Clock clock;
    private final ZoneId zone;
    private final int defaultPageSize;
    private final int maxPageSize;
    private final int maxRangeDays;

    public ListMenusService(MenuRecordRepository repository, MenuCachePort cache, Clock clock, ZoneId zone,
                            int defaultPageSize, int maxPageSize, int maxRangeDays) {
        this.repository = repository;
        this.cache = cache;
        this.clock = clock;
        this.zone = zone != null ? zone : clock.getZone();
        this.maxPageSize = Math.max(1, maxPageSize);
        this.defaultPageSize = Math.min(Math.max(1, defaultPageSize), this.maxPageSize);
        this.maxRangeDays = Math.max(1, maxRangeDays);
    }

    @Override
    public MenuPage list(String providerId, String dateFrom, String dateTo, String mealSlot, String pageToken, Integer size) {
        final long t0 = System.nanoTime();
        final MenuFilter filter = resolveFilter(providerId, dateFrom, dateTo, mealSlot);
        final int pageSize = clampSize(size);

        MenuKey after = null;
        LocalDate day = filter.dateFrom();
        if (pageToken != null && !pageToken.isBlank()) {
            PageToken token = PageToken.decode(pageToken);
            if (!filter.fingerprint().equals(token.fingerprint())) {
                throw new InvalidFilterException("pageToken", "token was issued for a different filter");
            }
            after = token.lastKey();
            if (after.servingDate().isAfter(day)) day = after.servingDate();
        }

        final List<MenuRecord> collected = new ArrayList<>(pageSize + 1);
        boolean stale = false;
        int snapshotsRead = 0;

        while (!day.isAfter(filter.dateTo()) && collected.size() <= pageSize) {
            Served served = snapshot(CacheKey.of(filter.providerId(), day));
            snapshotsRead++;
            stale |= served.stale();

            for (MenuRecord r : served.snapshot().records()) {
                if (!filter.matches(r)) continue;
                if (after != null && MenuKey.READ_ORDER.compare(r.key(), after) <= 0) continue;
                collected.add(r);
                if (collected.size() > pageSize) break;
            }
            day = day.plusDays(1);
        }

        String next = null;
        List<MenuRecord> items = collected;
        if (collected.size() > pageSize) {
            items = collected.subList(0, pageSize);
            next = new PageToken(filter.fingerprint(), items.get(items.size() - 1).key()).encode();
        }

        if (log.isDebugEnabled()) {
            log.debug("[Query] provider={} range={}..{} slot={} size={} -> items={} snapshots={} stale={} hasNext={} ({} ms)",
                    filter.providerId(), filter.dateFrom(), filter.dateTo(), filter.mealSlot(), pageSize,
                    items.size(), snapshotsRead, stale, next != null, durMs(t0, System.nanoTime()));
        }
        return new MenuPage(items, next, stale, filter.dateFrom(), filter.dateTo());
    }

    @Override
    public Optional<MenuRecord> latestForProvider(String providerId, String mealSlot) {
        if (providerId == null || providerId.isBlank()) {
            throw new InvalidFilterException("providerId", "must not be blank");
        }
        MealSlot slot = parseSlot(mealSlot);
        try {
            return repository.findLatestByProvider(providerId.trim(), slot);
        } catch (RuntimeException e) {
            log.error("[Query] latest lookup failed provider={} slot={}: {}", providerId, slot, e.getMessage());
            throw new MenuStoreUnavailableException("menu store unavailable", e);
        }
    }

    @Override
    public MenuPage latestPerProvider(String dateFrom, String dateTo, String mealSlot) {
        final long t0 = System.nanoTime();
        final MenuFilter filter = resolveFilter(null, dateFrom, dateTo, mealSlot);

        Map<String, MenuRecord> newest = new HashMap<>();
        boolean stale = false;
        for (LocalDate day = filter.dateFrom(); !day.isAfter(filter.dateTo()); day = day.plusDays(1)) {
            Served served = snapshot(CacheKey.of(null, day));
            stale |= served.stale();
            for (MenuRecord r : served.snapshot().records()) {
                if (!filter.matches(r)) continue;
                newest.merge(r.providerId() + "|" + r.mealSlot(), r, (a, b) -> NEWEST_FIRST.compare(a, b) <= 0 ? a : b);
            }
        }

        List<MenuRecord> items = newest.values().stream().sorted(BY_PROVIDER_AND_SLOT).toList();
        log.debug("[Query] latest per provider range={}..{} slot={} -> items={} stale={} ({} ms)",
                filter.dateFrom(), filter.dateTo(), filter.mealSlot(), items.size(), stale, durMs(t0, System.nanoTime()));
        return new MenuPage(items, null, stale, filter.dateFrom(), filter.dateTo());
    }

    MenuFilter resolveFilter(String providerId, String dateFrom, String dateTo, String mealSlot) {
        LocalDate from = parseDate("dateFrom", dateFrom);
        LocalDate to = parseDate("dateTo", dateTo);

        if (from == null && to == null) {
            from = LocalDate.now(clock.withZone(zone));
            to = from;
        } else if (from == null) {
            from = to;
        } else if (to == null) {
            to = from;
        }

        if (to.isBefore(from)) {
            log.debug("[Query] reversed range {}..{} swapped", from, to);
            LocalDate tmp = from;
            from = to;
            to = tmp;
        }

        long days = ChronoUnit.DAYS.between(from, to) + 1;
        if (days > maxRangeDays) {
            throw new InvalidFilterException("dateTo", "range of " + days + " days exceeds the maximum of " + maxRangeDays);
        }

        String pid = (providerId == null || providerId.isBlank()) ? null : providerId.trim();
        return new MenuFilter(pid, from, to, parseSlot(mealSlot));
    }

    private Served snapshot(CacheKey key) {
        final Instant now = clock.instant();
        final CacheLookup lookup = cache.get(key);
        if (lookup.isFresh()) {
            return new Served(lookup.snapshot(), false);
        }

        try {
            List<MenuRecord> records = repository.findByServingDate(key.servingDate(), key.providerFilter());
            MenuSnapshot snap = new MenuSnapshot(key, records, now);
            cache.put(key, snap);
            return new Served(snap, false);
        } catch (RuntimeException e) {
            if (lookup.servableAsStale(now)) {
                log.warn("[Query] STALE serve key={} built={} expired={} graceUntil={}: store read failed: {}",
                        key, lookup.snapshot().builtAt(), lookup.expiresAt(), lookup.graceUntil(), e.getMessage());
                return new Served(lookup.snapshot(), true);
            }
            log.error("[Query] store read failed key={} and no snapshot within grace (cache status={}): {}",
                    key, lookup.status(), e.getMessage());
            throw new MenuStoreUnavailableException("menu store unavailable for " + key.servingDate(), e);
        }
    }

    private int clampSize(Integer size) {
        if (size == null) return defaultPageSize;
        return Math.min(Math.max(size, 1), maxPageSize);
    }

    private static LocalDate parseDate(String param, String value) {
        if (value == null || value.isBlank()) return null;
        try {
            return LocalDate.parse(value.trim());
        } catch (DateTimeParseException e) {
            throw new InvalidFilterException(param, "expected yyyy-MM-dd, got '" + value + "'", e);
        }
    }

    private static MealSlot parseSlot(String value) {
        if (value == null || value.isBlank()) return null;
        return MealSlot.parse(value)
                .orElseThrow(() -> new InvalidFilterException("mealSlot", "unknown meal slot '" + value + "'"));
    }

    private static long durMs(long tStart, long tEnd) {
        return TimeUnit.NANOSECONDS.toMillis(Math.max(0, tEnd - tStart));
    }

    private record Served(MenuSnapshot snapshot, boolean stale) {}
}
