package tech.andrefsramos.meal_scraper.core.domain;

import java.time.LocalDate;
import java.util.List;

/**
 * One page of menus. {@code nextPageToken} is null on the last page; {@code stale} is true when
 * any part of the page came from an expired cache entry because the store was unreachable.
 */
public record MenuPage(
        List<MenuRecord> items,
        String nextPageToken,
        boolean stale,
        LocalDate dateFrom,
        LocalDate dateTo
) {
    public MenuPage {
        items = items == null ? List.of() : List.copyOf(items);
    }
}
