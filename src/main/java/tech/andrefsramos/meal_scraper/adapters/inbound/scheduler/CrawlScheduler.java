package tech.andrefsramos.meal_scraper.adapters.inbound.scheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import tech.andrefsramos.meal_scraper.core.application.CrawlMenusUseCase;
import tech.andrefsramos.meal_scraper.core.domain.CrawlTrigger;
import tech.andrefsramos.meal_scraper.core.domain.TriggerResult;

/**
 * CrawlScheduler

 * Overview:
 * - Fires the crawl cycle on a fixed delay (app.crawl.fixed-delay, ISO-8601, default PT1H).
 * - The cycle itself runs on the crawl executor; this method only asks for it, so a slow
 *   crawl never holds the scheduling thread. A tick during a running cycle is coalesced.

 * Startup:
 * - Runs left RUNNING by a previous process are finalized as FAILURE.
 * - With app.crawl.run-on-startup=true a first cycle is triggered right away.
 */
@Component
public class CrawlScheduler {

    private static final Logger log = LoggerFactory.getLogger(CrawlScheduler.class);
    private final CrawlMenusUseCase crawl;
    private final boolean runOnStartup;

    public CrawlScheduler(CrawlMenusUseCase crawl, @Value("${app.crawl.run-on-startup:false}") boolean runOnStartup) {
        this.crawl = crawl;
        this.runOnStartup = runOnStartup;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onStartup() {
        try {
            int abandoned = crawl.recoverAbandonedRuns();
            log.info("CrawlScheduler: startup recovery done (abandonedRuns={}).", abandoned);
        } catch (Exception ex) {
            log.error("CrawlScheduler: startup recovery failed.", ex);
        }
        if (runOnStartup) {
            fire(CrawlTrigger.STARTUP);
        }
    }

    @Scheduled(fixedDelayString = "${app.crawl.fixed-delay:PT1H}", initialDelayString = "${app.crawl.initial-delay:PT1M}")
    public void tick() {
        fire(CrawlTrigger.SCHEDULED);
    }

    private void fire(CrawlTrigger trigger) {
        long start = System.nanoTime();
        try {
            TriggerResult r = crawl.trigger(trigger);
            long elapsedMs = (System.nanoTime() - start) / 1_000_000;
            log.info("CrawlScheduler: trigger={} runId={} coalesced={} (elapsedMs={} ms).",
                    trigger, r.run().runId(), r.coalesced(), elapsedMs);
        } catch (Exception ex) {
            long elapsedMs = (System.nanoTime() - start) / 1_000_000;
            log.error("CrawlScheduler: trigger={} failed (elapsedMs={} ms).", trigger, elapsedMs, ex);
        }
    }
}
