package tech.andrefsramos.meal_scraper.core.domain;

public record CrawlerStatus(SchedulerState state, CrawlRun current, CrawlRun last) {
}
