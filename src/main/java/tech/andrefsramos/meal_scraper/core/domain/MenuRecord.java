package tech.andrefsramos.meal_scraper.core.domain;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Comparator;
import java.util.List;

public record MenuRecord(
        Long id,
        String providerId,
        LocalDate servingDate,
        MealSlot mealSlot,
        List<MenuItem> items,
        MenuSource source,
        String contentHash,
        Instant lastUpdatedAt,
        long version
) {
    public static final Comparator<MenuRecord> READ_ORDER =
            Comparator.comparing(MenuRecord::key, MenuKey.READ_ORDER);

    public MenuRecord {
        items = items == null ? List.of() : List.copyOf(items);
    }

    public MenuKey key() {
        return new MenuKey(providerId, servingDate, mealSlot);
    }

    public static MenuRecord firstVersion(MenuDraft d, Instant now) {
        return new MenuRecord(null, d.providerId(), d.servingDate(), d.mealSlot(), d.items(),
                MenuSource.CRAWLED, d.contentHash(), now, 1L);
    }

    public MenuRecord nextVersion(MenuDraft d, Instant now) {
        return new MenuRecord(id, providerId, servingDate, mealSlot, d.items(),
                source, d.contentHash(), now, version + 1);
    }
}
