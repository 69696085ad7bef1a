package tech.andrefsramos.meal_scraper.core.domain;

import java.util.Locale;
import java.util.Optional;

/**
 * Meal slot of a menu. Declaration order is the fixed read order
 * (breakfast, lunch, dinner, other).
 */
public enum MealSlot {
    BREAKFAST,
    LUNCH,
    DINNER,
    OTHER;

    public static Optional<MealSlot> parse(String value) {
        if (value == null || value.isBlank()) return Optional.empty();
        String v = value.trim().toUpperCase(Locale.ROOT);
        for (MealSlot s : values()) {
            if (s.name().equals(v)) return Optional.of(s);
        }
        return Optional.empty();
    }
}
