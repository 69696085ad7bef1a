package tech.andrefsramos.meal_scraper.core.ports;

import tech.andrefsramos.meal_scraper.core.domain.CrawlRun;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface CrawlRunRepository {
    void create(CrawlRun run);
    /** Writes the final state once; returns false when the run was already finalized. */
    boolean finalizeRun(CrawlRun finished);
    Optional<CrawlRun> findById(String runId);
    List<CrawlRun> findLatest(int limit);
    /** Finalizes as FAILURE every run still open (left behind by a stopped process). */
    int abandonOpenRuns(Instant now, String reason);
}
