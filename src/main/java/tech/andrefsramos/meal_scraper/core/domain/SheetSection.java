package tech.andrefsramos.meal_scraper.core.domain;

/**
 * Block of spreadsheet rows (0-based, inclusive) holding one provider's dishes for one slot.
 */
public record SheetSection(String providerId, MealSlot slot, int firstRow, int lastRow) {
}
