package tech.andrefsramos.meal_scraper.core.domain;

/**
 * Answer to a crawl trigger. {@code coalesced} is true when a run was already in flight and
 * {@code run} is that run rather than a new one.
 */
public record TriggerResult(CrawlRun run, boolean coalesced) {
}
