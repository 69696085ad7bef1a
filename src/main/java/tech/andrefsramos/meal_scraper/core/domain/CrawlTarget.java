package tech.andrefsramos.meal_scraper.core.domain;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/*
 * Purpose

 * One configured source to crawl. {@code type} selects the {@code MenuSourcePort}
 * (html-table, ibook-excel, json-feed); the remaining fields are read by the adapter that
 * supports that type and ignored by the others.
 */
public record CrawlTarget(
        String id,
        String type,
        String url,
        String providerId,
        String fileListUrl,
        String tableSelector,
        List<SheetSection> sections,
        Integer dateRow,
        int dayColumns,
        Map<String, MealSlot> slotLabels,
        List<String> ignoreItems,
        List<String> expectedContentTypes,
        Duration fetchTimeout
) {
    public CrawlTarget {
        sections = sections == null ? List.of() : List.copyOf(sections);
        slotLabels = slotLabels == null ? Map.of() : Map.copyOf(slotLabels);
        ignoreItems = ignoreItems == null ? List.of() : List.copyOf(ignoreItems);
        expectedContentTypes = expectedContentTypes == null ? List.of() : List.copyOf(expectedContentTypes);
    }

    public static CrawlTarget simple(String id, String type, String url, String providerId) {
        return new CrawlTarget(id, type, url, providerId, null, null, List.of(), null, 5,
                Map.of(), List.of(), List.of(), null);
    }
}
