package tech.andrefsramos.meal_scraper.core.domain;

import java.time.Instant;
import java.util.UUID;

/**
 * One scheduled or on-demand crawl cycle. {@code finishedAt} and {@code outcome} stay null
 * while the run is in flight; {@code errorDetail} is only set for PARTIAL and FAILURE.
 */
public record CrawlRun(
        String runId,
        CrawlTrigger trigger,
        Instant startedAt,
        Instant finishedAt,
        CrawlOutcome outcome,
        int recordsSeen,
        int recordsChanged,
        int recordsSkipped,
        int recordsFailed,
        String errorDetail
) {
    public static CrawlRun start(CrawlTrigger trigger, Instant now) {
        return new CrawlRun(UUID.randomUUID().toString(), trigger, now, null, null, 0, 0, 0, 0, null);
    }

    public boolean running() {
        return finishedAt == null;
    }

    public CrawlRun finish(Instant now, CrawlOutcome outcome, ReconcileResult totals, String errorDetail) {
        String detail = outcome == CrawlOutcome.SUCCESS ? null : errorDetail;
        return new CrawlRun(runId, trigger, startedAt, now, outcome,
                totals.seen(), totals.changed(), totals.skipped(), totals.failed(), detail);
    }
}
