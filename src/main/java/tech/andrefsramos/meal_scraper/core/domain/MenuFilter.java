package tech.andrefsramos.meal_scraper.core.domain;

import java.time.LocalDate;

/**
 * Resolved read filter: dates are concrete and ordered, blank provider is null.
 */
public record MenuFilter(String providerId, LocalDate dateFrom, LocalDate dateTo, MealSlot mealSlot) {

    public boolean matches(MenuRecord r) {
        if (providerId != null && !providerId.equals(r.providerId())) return false;
        if (mealSlot != null && mealSlot != r.mealSlot()) return false;
        return !r.servingDate().isBefore(dateFrom) && !r.servingDate().isAfter(dateTo);
    }

    /** Short, stable digest of the filter, carried in page tokens. */
    public String fingerprint() {
        String raw = (providerId == null ? "" : providerId) + "|" + dateFrom + "|" + dateTo + "|"
                + (mealSlot == null ? "" : mealSlot.name());
        return Integer.toHexString(raw.hashCode());
    }
}
