package tech.andrefsramos.meal_scraper.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

/*
 * Purpose

 * Enables Spring Scheduling for the crawl tick ({@code @Scheduled} in CrawlScheduler) and the
 * binding of the structured crawl configuration ({@link MealScraperProperties}).

 * Technical details

 * - The scheduling thread only triggers; the cycle runs on the crawl executors built in AppConfig.
 * - Frequencies come from app.crawl.fixed-delay / app.crawl.initial-delay.
 */
@Configuration
@EnableScheduling
@EnableConfigurationProperties(MealScraperProperties.class)
public class SchedulingConfig {

    private static final Logger log = LoggerFactory.getLogger(SchedulingConfig.class);

    public SchedulingConfig() {
        log.info("[Scheduling] Scheduler enabled, @Scheduled methods will now run.");
    }
}
