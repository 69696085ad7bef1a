package tech.andrefsramos.meal_scraper.core.domain;

import java.time.LocalDate;
import java.util.List;

/**
 * Normalized output of a parser, not yet reconciled against the store.
 * Built through {@link MenuNormalizer}, which fills {@code contentHash}.
 */
public record MenuDraft(
        String providerId,
        LocalDate servingDate,
        MealSlot mealSlot,
        List<MenuItem> items,
        String contentHash
) {
    public MenuDraft {
        items = items == null ? List.of() : List.copyOf(items);
    }

    public MenuKey key() {
        return new MenuKey(providerId, servingDate, mealSlot);
    }
}
