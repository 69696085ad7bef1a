package tech.andrefsramos.meal_scraper.core.domain;

public enum MenuSource {
    CRAWLED,
    VENDOR_SUBMITTED
}
