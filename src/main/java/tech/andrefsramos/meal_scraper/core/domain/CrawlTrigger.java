package tech.andrefsramos.meal_scraper.core.domain;

public enum CrawlTrigger {
    SCHEDULED,
    ON_DEMAND,
    STARTUP
}
