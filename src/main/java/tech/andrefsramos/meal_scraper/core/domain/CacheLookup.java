package tech.andrefsramos.meal_scraper.core.domain;

import java.time.Instant;

/**
 * Result of a cache read. FRESH entries can be served as-is; EXPIRED entries must be rebuilt
 * and may only be served (as stale) while {@code graceUntil} has not passed.
 */
public record CacheLookup(Status status, MenuSnapshot snapshot, Instant expiresAt, Instant graceUntil) {

    public enum Status { FRESH, EXPIRED, MISS }

    public static CacheLookup miss() {
        return new CacheLookup(Status.MISS, null, null, null);
    }

    public boolean isFresh() {
        return status == Status.FRESH;
    }

    public boolean servableAsStale(Instant now) {
        return status == Status.EXPIRED && snapshot != null && graceUntil != null && now.isBefore(graceUntil);
    }
}
