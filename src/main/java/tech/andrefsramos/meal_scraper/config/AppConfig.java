package tech.andrefsramos.meal_scraper.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import tech.andrefsramos.meal_scraper.adapters.outbound.cache.CaffeineMenuCache;
import tech.andrefsramos.meal_scraper.core.application.*;
import tech.andrefsramos.meal_scraper.core.application.impl.*;
import tech.andrefsramos.meal_scraper.core.domain.CrawlTarget;
import tech.andrefsramos.meal_scraper.core.ports.*;

import java.time.Clock;
import java.time.Duration;
import java.time.ZoneId;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/*
 * Purpose

 * Composition root: builds the use cases and the ports they need, with dependencies passed
 * through constructors. Scalar knobs come from application.yml / env via @Value; crawl targets
 * come from MealScraperProperties.

 * Beans

 * - Clock: system clock in app.timezone (Asia/Seoul by default). "Today" and header dates use it.
 * - MenuCachePort: Caffeine cache of per-date snapshots (app.cache.*).
 * - ReconcileMenusUseCase: compares drafts with the store and applies inserts / version swaps.
 * - crawlCycleExecutor / crawlTargetExecutor: one thread running the cycle, a bounded pool for targets.
 * - CrawlMenusUseCase: single-flight crawl coordinator over every MenuSourcePort adapter.
 * - ListMenusUseCase: paginated reads through the cache.
 */
@Configuration
public class AppConfig {

    private static final Logger log = LoggerFactory.getLogger(AppConfig.class);

    /* ============================= Clock ============================= */

    @Bean
    Clock clock(@Value("${app.timezone:Asia/Seoul}") String timezone) {
        try {
            Clock bean = Clock.system(ZoneId.of(timezone));
            log.info("[AppConfig] Clock initialized (zone={})", bean.getZone());
            return bean;
        } catch (RuntimeException e) {
            log.error("[AppConfig] Invalid app.timezone='{}': {}", timezone, e.getMessage(), e);
            throw e;
        }
    }

    /* ============================= MenuCachePort ============================= */

    @Bean
    MenuCachePort menuCache(
            Clock clock,
            @Value("${app.cache.max-entries:1000}") long maxEntries,
            @Value("${app.cache.ttl:PT10M}") Duration ttl,
            @Value("${app.cache.stale-grace:PT1H}") Duration staleGrace
    ) {
        final long t0 = System.nanoTime();
        try {
            if (maxEntries < 1) {
                log.warn("[AppConfig] app.cache.max-entries={} invalid. Using 1.", maxEntries);
                maxEntries = 1;
            }
            if (ttl.isNegative() || ttl.isZero()) {
                log.warn("[AppConfig] app.cache.ttl={} invalid. Using PT10M.", ttl);
                ttl = Duration.ofMinutes(10);
            }
            MenuCachePort bean = new CaffeineMenuCache(maxEntries, ttl, staleGrace, clock);
            long tookMs = (System.nanoTime() - t0) / 1_000_000;
            log.info("[AppConfig] MenuCachePort initialized (maxEntries={}, ttl={}, staleGrace={}) tookMs={}ms",
                    maxEntries, ttl, staleGrace, tookMs);
            return bean;
        } catch (RuntimeException e) {
            log.error("[AppConfig] Error creating MenuCachePort: {}", e.getMessage(), e);
            throw e;
        }
    }

    /* ============================= ReconcileMenusUseCase ============================= */

    @Bean
    ReconcileMenusUseCase reconcileMenusUseCase(MenuRecordRepository menuRecordRepository, MenuCachePort menuCache, Clock clock) {
        final long t0 = System.nanoTime();
        try {
            Objects.requireNonNull(menuRecordRepository, "menuRecordRepository is required");
            Objects.requireNonNull(menuCache, "menuCache is required");

            ReconcileMenusUseCase bean = new ReconcileMenusService(menuRecordRepository, menuCache, clock);
            long tookMs = (System.nanoTime() - t0) / 1_000_000;
            log.info("[AppConfig] ReconcileMenusUseCase initialized (tookMs={}ms)", tookMs);
            return bean;
        } catch (RuntimeException e) {
            log.error("[AppConfig] Error creating ReconcileMenusUseCase: {}", e.getMessage(), e);
            throw e;
        }
    }

    /* ============================= Crawl executors ============================= */

    @Bean(destroyMethod = "shutdownNow")
    ExecutorService crawlCycleExecutor() {
        return Executors.newSingleThreadExecutor(new CustomizableThreadFactory("crawl-cycle-"));
    }

    @Bean(destroyMethod = "shutdownNow")
    ExecutorService crawlTargetExecutor(@Value("${app.crawl.target-parallelism:4}") int parallelism) {
        if (parallelism < 1) {
            log.warn("[AppConfig] app.crawl.target-parallelism={} invalid. Using 1.", parallelism);
            parallelism = 1;
        }
        log.info("[AppConfig] crawl target pool size={}", parallelism);
        return Executors.newFixedThreadPool(parallelism, new CustomizableThreadFactory("crawl-target-"));
    }

    /* ============================= CrawlMenusUseCase ============================= */

    @Bean
    CrawlMenusUseCase crawlMenusUseCase(
            List<MenuSourcePort> sources,
            ReconcileMenusUseCase reconcileMenusUseCase,
            CrawlRunRepository crawlRunRepository,
            MenuCachePort menuCache,
            MealScraperProperties properties,
            @Qualifier("crawlCycleExecutor") ExecutorService cycleExecutor,
            @Qualifier("crawlTargetExecutor") ExecutorService targetExecutor,
            @Value("${app.crawl.run-deadline:PT5M}") Duration runDeadline,
            Clock clock
    ) {
        final long t0 = System.nanoTime();
        try {
            List<CrawlTarget> targets = CrawlTargetFactory.fromProperties(properties.getCrawl());
            if (targets.isEmpty()) {
                log.warn("[AppConfig] No crawl target enabled (app.crawl.targets). Crawls will do nothing.");
            }

            int sourceCount = (sources == null) ? 0 : sources.size();
            if (sourceCount == 0) {
                log.warn("[AppConfig] No MenuSourcePort found in the Spring context.");
            }
            for (CrawlTarget t : targets) {
                boolean supported = sources != null && sources.stream().anyMatch(s -> s.supports(t));
                if (!supported) {
                    log.warn("[AppConfig] crawl target '{}' has type '{}' with no adapter; it will fail every run.", t.id(), t.type());
                }
            }

            CrawlMenusUseCase bean = new CrawlCoordinatorService(
                    sources,
                    reconcileMenusUseCase,
                    crawlRunRepository,
                    menuCache,
                    targets,
                    cycleExecutor,
                    targetExecutor,
                    runDeadline,
                    clock
            );

            long tookMs = (System.nanoTime() - t0) / 1_000_000;
            log.info("[AppConfig] CrawlMenusUseCase initialized (targets={}, sources={}, runDeadline={}) tookMs={}ms",
                    targets.stream().map(CrawlTarget::id).toList(), sourceCount, runDeadline, tookMs);
            return bean;
        } catch (RuntimeException e) {
            log.error("[AppConfig] Error creating CrawlMenusUseCase: {}", e.getMessage(), e);
            throw e;
        }
    }

    /* ============================= ListMenusUseCase ============================= */

    @Bean
    ListMenusUseCase listMenusUseCase(
            MenuRecordRepository menuRecordRepository,
            MenuCachePort menuCache,
            Clock clock,
            @Value("${app.query.default-page-size:20}") int defaultPageSize,
            @Value("${app.query.max-page-size:100}") int maxPageSize,
            @Value("${app.query.max-range-days:31}") int maxRangeDays
    ) {
        final long t0 = System.nanoTime();
        try {
            ListMenusUseCase bean = new ListMenusService(menuRecordRepository, menuCache, clock, clock.getZone(),
                    defaultPageSize, maxPageSize, maxRangeDays);
            long tookMs = (System.nanoTime() - t0) / 1_000_000;
            log.info("[AppConfig] ListMenusUseCase initialized (defaultPageSize={}, maxPageSize={}, maxRangeDays={}) tookMs={}ms",
                    defaultPageSize, maxPageSize, maxRangeDays, tookMs);
            return bean;
        } catch (RuntimeException e) {
            log.error("[AppConfig] Error creating ListMenusUseCase: {}", e.getMessage(), e);
            throw e;
        }
    }
}
