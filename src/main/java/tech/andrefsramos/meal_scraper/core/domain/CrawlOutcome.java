package tech.andrefsramos.meal_scraper.core.domain;

public enum CrawlOutcome {
    SUCCESS,
    PARTIAL,
    FAILURE
}
