package tech.andrefsramos.meal_scraper.core.application;

import tech.andrefsramos.meal_scraper.core.domain.CrawlRun;
import tech.andrefsramos.meal_scraper.core.domain.CrawlTrigger;
import tech.andrefsramos.meal_scraper.core.domain.CrawlerStatus;
import tech.andrefsramos.meal_scraper.core.domain.TriggerResult;

import java.util.List;
import java.util.Optional;

public interface CrawlMenusUseCase {
    TriggerResult trigger(CrawlTrigger trigger);
    Optional<CrawlRun> findRun(String runId);
    List<CrawlRun> latestRuns(int limit);
    CrawlerStatus status();
    int recoverAbandonedRuns();
}
