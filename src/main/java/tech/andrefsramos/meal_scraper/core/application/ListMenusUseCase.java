package tech.andrefsramos.meal_scraper.core.application;

import tech.andrefsramos.meal_scraper.core.domain.MenuPage;
import tech.andrefsramos.meal_scraper.core.domain.MenuRecord;

import java.util.Optional;

public interface ListMenusUseCase {
    MenuPage list(String providerId, String dateFrom, String dateTo, String mealSlot, String pageToken, Integer size);
    Optional<MenuRecord> latestForProvider(String providerId, String mealSlot);
    /** Newest record of each (provider, meal slot) pair within the date range; never paginated. */
    MenuPage latestPerProvider(String dateFrom, String dateTo, String mealSlot);
}
