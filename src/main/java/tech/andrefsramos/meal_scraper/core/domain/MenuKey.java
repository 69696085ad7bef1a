package tech.andrefsramos.meal_scraper.core.domain;

import java.time.LocalDate;
import java.util.Comparator;
import java.util.Objects;

/**
 * Logical identity of a menu: one current record per provider, day and slot.
 */
public record MenuKey(String providerId, LocalDate servingDate, MealSlot mealSlot) {

    /** servingDate asc, providerId asc, mealSlot in declaration order. Total over keys. */
    public static final Comparator<MenuKey> READ_ORDER = Comparator
            .comparing(MenuKey::servingDate)
            .thenComparing(MenuKey::providerId)
            .thenComparing(MenuKey::mealSlot);

    public MenuKey {
        Objects.requireNonNull(providerId, "providerId");
        Objects.requireNonNull(servingDate, "servingDate");
        Objects.requireNonNull(mealSlot, "mealSlot");
    }

    @Override
    public String toString() {
        return providerId + "/" + servingDate + "/" + mealSlot;
    }
}
