package tech.andrefsramos.meal_scraper.core.ports;

import tech.andrefsramos.meal_scraper.core.domain.MealSlot;
import tech.andrefsramos.meal_scraper.core.domain.MenuKey;
import tech.andrefsramos.meal_scraper.core.domain.MenuRecord;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Store of current menu records, unique per {@link MenuKey}.
 * Writes are atomic per key: {@link #insert} fails with {@code StaleWriteException} when the key
 * already exists, {@link #compareAndSwap} when the stored version is not {@code expectedVersion}
 * or the record is no longer crawl-owned.
 */
public interface MenuRecordRepository {
    Optional<MenuRecord> findCurrent(MenuKey key);
    MenuRecord insert(MenuRecord record);
    MenuRecord compareAndSwap(MenuRecord updated, long expectedVersion);
    /** Records of one serving date in read order; {@code providerId} null means every provider. */
    List<MenuRecord> findByServingDate(LocalDate servingDate, String providerId);
    Optional<MenuRecord> findLatestByProvider(String providerId, MealSlot mealSlot);
}
