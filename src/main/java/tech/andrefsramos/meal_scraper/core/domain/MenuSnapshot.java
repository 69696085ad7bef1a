package tech.andrefsramos.meal_scraper.core.domain;

import java.time.Instant;
import java.util.List;

/**
 * Store read for one {@link CacheKey}, records already in read order.
 */
public record MenuSnapshot(CacheKey key, List<MenuRecord> records, Instant builtAt) {

    public MenuSnapshot {
        records = records == null ? List.of() : records.stream().sorted(MenuRecord.READ_ORDER).toList();
    }
}
