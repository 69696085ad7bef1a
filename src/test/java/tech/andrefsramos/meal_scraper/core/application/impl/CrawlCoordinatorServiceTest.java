package tech.andrefsramos.meal_scraper.core.application.impl;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import tech.andrefsramos.meal_scraper.core.domain.CrawlOutcome;
import tech.andrefsramos.meal_scraper.core.domain.CrawlRun;
import tech.andrefsramos.meal_scraper.core.domain.CrawlTarget;
import tech.andrefsramos.meal_scraper.core.domain.CrawlTrigger;
import tech.andrefsramos.meal_scraper.core.domain.CrawlerStatus;
import tech.andrefsramos.meal_scraper.core.domain.MealSlot;
import tech.andrefsramos.meal_scraper.core.domain.MenuDraft;
import tech.andrefsramos.meal_scraper.core.domain.MenuItem;
import tech.andrefsramos.meal_scraper.core.domain.MenuKey;
import tech.andrefsramos.meal_scraper.core.domain.MenuNormalizer;
import tech.andrefsramos.meal_scraper.core.domain.SchedulerState;
import tech.andrefsramos.meal_scraper.core.domain.SourceContent;
import tech.andrefsramos.meal_scraper.core.domain.TriggerResult;
import tech.andrefsramos.meal_scraper.core.domain.exception.MenuParseException;
import tech.andrefsramos.meal_scraper.core.domain.exception.SourceUnavailableException;
import tech.andrefsramos.meal_scraper.core.ports.MenuCachePort;
import tech.andrefsramos.meal_scraper.core.ports.MenuSourcePort;
import tech.andrefsramos.meal_scraper.support.InMemoryCrawlRunRepository;
import tech.andrefsramos.meal_scraper.support.InMemoryMenuRecordRepository;
import tech.andrefsramos.meal_scraper.support.MutableClock;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.LocalDate;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class CrawlCoordinatorServiceTest {

    private static final LocalDate DAY = LocalDate.of(2024, 5, 1);

    @Mock
    MenuCachePort cache;

    private InMemoryMenuRecordRepository menus;
    private InMemoryCrawlRunRepository runs;
    private MutableClock clock;
    private ExecutorService targetPool;
    private StubSource source;

    @BeforeEach
    void setUp() {
        menus = new InMemoryMenuRecordRepository();
        runs = new InMemoryCrawlRunRepository();
        clock = MutableClock.at("2024-05-01T00:00:00Z");
        targetPool = Executors.newFixedThreadPool(4);
        source = new StubSource("stub");
    }

    @AfterEach
    void tearDown() {
        targetPool.shutdownNow();
    }

    @Test
    void oneUnreachableTargetMakesThePartialRunKeepOtherTargetsData() {
        source.on("P1", t -> content(t, "ok"), draft("P1", MealSlot.LUNCH, "A", "B"));
        source.on("P2", t -> {
            throw new SourceUnavailableException(t.id(), "timeout after PT20S", (Throwable) null);
        });
        CrawlCoordinatorService coordinator = coordinator(Runnable::run, Duration.ofMinutes(1), "P1", "P2");

        TriggerResult tr = coordinator.trigger(CrawlTrigger.SCHEDULED);

        CrawlRun done = runs.findById(tr.run().runId()).orElseThrow();
        assertThat(tr.coalesced()).isFalse();
        assertThat(done.outcome()).isEqualTo(CrawlOutcome.PARTIAL);
        assertThat(done.errorDetail()).contains("P2").contains("source unavailable");
        assertThat(done.recordsChanged()).isEqualTo(1);
        assertThat(menus.get(new MenuKey("P1", DAY, MealSlot.LUNCH))).isPresent();
        assertThat(coordinator.status().state()).isEqualTo(SchedulerState.IDLE);
        verify(cache, atLeastOnce()).invalidateMenus(argThat(keys -> keys.contains(new MenuKey("P1", DAY, MealSlot.LUNCH))));
    }

    @Test
    void everyTargetFailingIsAFailure() {
        source.on("P1", t -> {
            throw new SourceUnavailableException(t.id(), "HTTP 503 from url", 503);
        });
        source.on("P2", t -> content(t, "garbage"));
        source.failParse("P2");
        CrawlCoordinatorService coordinator = coordinator(Runnable::run, Duration.ofMinutes(1), "P1", "P2");

        CrawlRun done = runs.findById(coordinator.trigger(CrawlTrigger.ON_DEMAND).run().runId()).orElseThrow();

        assertThat(done.outcome()).isEqualTo(CrawlOutcome.FAILURE);
        assertThat(done.errorDetail()).contains("target P1").contains("target P2: parse error");
    }

    @Test
    void cleanRunIsASuccessWithoutDetail() {
        source.on("P1", t -> content(t, "ok"), draft("P1", MealSlot.LUNCH, "A"));
        source.on("P2", t -> SourceContent.empty(t.id(), t.url(), "text/html", clock.instant()));
        CrawlCoordinatorService coordinator = coordinator(Runnable::run, Duration.ofMinutes(1), "P1", "P2");

        CrawlRun done = runs.findById(coordinator.trigger(CrawlTrigger.ON_DEMAND).run().runId()).orElseThrow();

        assertThat(done.outcome()).isEqualTo(CrawlOutcome.SUCCESS);
        assertThat(done.errorDetail()).isNull();
        assertThat(done.finishedAt()).isNotNull();
    }

    @Test
    void targetWithoutAdapterFailsOnItsOwn() {
        source.on("P1", t -> content(t, "ok"), draft("P1", MealSlot.LUNCH, "A"));
        List<CrawlTarget> targets = List.of(
                CrawlTarget.simple("P1", "stub", "http://p1", "P1"),
                CrawlTarget.simple("RSS", "rss", "http://rss", "RSS"));
        CrawlCoordinatorService coordinator = new CrawlCoordinatorService(List.of(source),
                new ReconcileMenusService(menus, cache, clock), runs, cache, targets,
                Runnable::run, targetPool, Duration.ofMinutes(1), clock);

        CrawlRun done = runs.findById(coordinator.trigger(CrawlTrigger.ON_DEMAND).run().runId()).orElseThrow();

        assertThat(done.outcome()).isEqualTo(CrawlOutcome.PARTIAL);
        assertThat(done.errorDetail()).contains("no source adapter for type 'rss'");
    }

    @Test
    void triggersDuringAnInFlightRunAreCoalesced() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        source.on("P1", t -> {
            entered.countDown();
            await(release);
            return content(t, "ok");
        }, draft("P1", MealSlot.LUNCH, "A"));
        ExecutorService cycle = Executors.newSingleThreadExecutor();
        CrawlCoordinatorService coordinator = coordinator(cycle, Duration.ofMinutes(1), "P1");

        try {
            TriggerResult first = coordinator.trigger(CrawlTrigger.SCHEDULED);
            assertThat(entered.await(5, TimeUnit.SECONDS)).isTrue();

            TriggerResult second = coordinator.trigger(CrawlTrigger.ON_DEMAND);
            TriggerResult third = coordinator.trigger(CrawlTrigger.SCHEDULED);
            CrawlerStatus during = coordinator.status();

            assertThat(second.coalesced()).isTrue();
            assertThat(third.coalesced()).isTrue();
            assertThat(second.run().runId()).isEqualTo(first.run().runId());
            assertThat(third.run().runId()).isEqualTo(first.run().runId());
            assertThat(during.state()).isEqualTo(SchedulerState.RUNNING);
            assertThat(coordinator.findRun(first.run().runId())).get().matches(CrawlRun::running);

            release.countDown();
        } finally {
            release.countDown();
            cycle.shutdown();
            assertThat(cycle.awaitTermination(5, TimeUnit.SECONDS)).isTrue();
        }

        assertThat(runs.createdCount()).isEqualTo(1);
        assertThat(source.fetches("P1")).isEqualTo(1);
        assertThat(coordinator.status().state()).isEqualTo(SchedulerState.IDLE);
        assertThat(coordinator.status().last().outcome()).isEqualTo(CrawlOutcome.SUCCESS);
    }

    @Test
    void triggerAfterCompletionStartsANewRun() {
        source.on("P1", t -> content(t, "ok"), draft("P1", MealSlot.LUNCH, "A"));
        CrawlCoordinatorService coordinator = coordinator(Runnable::run, Duration.ofMinutes(1), "P1");

        TriggerResult a = coordinator.trigger(CrawlTrigger.SCHEDULED);
        TriggerResult b = coordinator.trigger(CrawlTrigger.SCHEDULED);

        assertThat(b.coalesced()).isFalse();
        assertThat(b.run().runId()).isNotEqualTo(a.run().runId());
        assertThat(runs.createdCount()).isEqualTo(2);
        assertThat(coordinator.latestRuns(10)).hasSize(2);
    }

    @Test
    void targetsStillRunningAtTheDeadlineAreCancelled() throws Exception {
        CountDownLatch never = new CountDownLatch(1);
        CountDownLatch slowReturned = new CountDownLatch(1);
        source.on("P1", t -> content(t, "ok"), draft("P1", MealSlot.LUNCH, "A"));
        source.on("SLOW", t -> {
            awaitIgnoringInterrupt(never, Duration.ofMillis(200));
            slowReturned.countDown();
            return content(t, "late");
        }, draft("SLOW", MealSlot.LUNCH, "X"), draft("SLOW", MealSlot.DINNER, "Y"));
        CrawlCoordinatorService coordinator = coordinator(Runnable::run, Duration.ofMillis(300), "P1", "SLOW");

        CrawlRun done = runs.findById(coordinator.trigger(CrawlTrigger.SCHEDULED).run().runId()).orElseThrow();
        int writesAtFinalize = menus.writes();

        assertThat(slowReturned.getCount()).isZero();
        assertThat(done.outcome()).isEqualTo(CrawlOutcome.PARTIAL);
        assertThat(done.errorDetail()).contains("target SLOW: deadline of PT0.3S exceeded");
        assertThat(done.recordsChanged()).isEqualTo(1);
        assertThat(menus.get(new MenuKey("P1", DAY, MealSlot.LUNCH))).isPresent();

        targetPool.shutdown();
        assertThat(targetPool.awaitTermination(5, TimeUnit.SECONDS)).isTrue();
        assertThat(menus.writes()).isEqualTo(writesAtFinalize).isEqualTo(1);
        assertThat(menus.get(new MenuKey("SLOW", DAY, MealSlot.LUNCH))).isEmpty();
        assertThat(menus.get(new MenuKey("SLOW", DAY, MealSlot.DINNER))).isEmpty();
    }

    @Test
    void runsLeftOpenByAPreviousProcessAreFailedOnRecovery() {
        CrawlRun orphan = CrawlRun.start(CrawlTrigger.SCHEDULED, clock.instant().minusSeconds(3600));
        runs.create(orphan);
        CrawlCoordinatorService coordinator = coordinator(Runnable::run, Duration.ofMinutes(1));

        assertThat(coordinator.recoverAbandonedRuns()).isEqualTo(1);

        CrawlRun recovered = coordinator.findRun(orphan.runId()).orElseThrow();
        assertThat(recovered.outcome()).isEqualTo(CrawlOutcome.FAILURE);
        assertThat(recovered.errorDetail()).startsWith("abandoned");
        assertThat(coordinator.status().last()).isEqualTo(recovered);
    }

    @Test
    void rejectedCycleReleasesTheToken() {
        CrawlCoordinatorService coordinator = coordinator(r -> {
            throw new java.util.concurrent.RejectedExecutionException("shutting down");
        }, Duration.ofMinutes(1), "P1");

        TriggerResult tr = coordinator.trigger(CrawlTrigger.ON_DEMAND);

        assertThat(runs.findById(tr.run().runId()).orElseThrow().outcome()).isEqualTo(CrawlOutcome.FAILURE);
        assertThat(coordinator.status().state()).isEqualTo(SchedulerState.IDLE);
    }

    private CrawlCoordinatorService coordinator(java.util.concurrent.Executor cycle, Duration deadline, String... ids) {
        List<CrawlTarget> targets = Arrays.stream(ids)
                .map(id -> CrawlTarget.simple(id, "stub", "http://" + id.toLowerCase(), id))
                .toList();
        return new CrawlCoordinatorService(List.of(source), new ReconcileMenusService(menus, cache, clock),
                runs, cache, targets, cycle, targetPool, deadline, clock);
    }

    private SourceContent content(CrawlTarget t, String body) {
        return new SourceContent(t.id(), t.url(), body.getBytes(StandardCharsets.UTF_8), "text/html", clock.instant());
    }

    private static MenuDraft draft(String provider, MealSlot slot, String... dishes) {
        List<MenuItem> items = Arrays.stream(dishes).map(MenuItem::of).toList();
        return MenuNormalizer.draft(provider, DAY, slot, items, List.of()).orElseThrow();
    }

    private static void await(CountDownLatch latch) {
        try {
            if (!latch.await(10, TimeUnit.SECONDS)) {
                throw new IllegalStateException("latch never released");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SourceUnavailableException("stub", "interrupted", e);
        }
    }

    /** Blocks like a socket read that does not react to interrupts, then keeps the interrupt flag set. */
    private static void awaitIgnoringInterrupt(CountDownLatch latch, Duration afterInterrupt) {
        try {
            latch.await(10, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            long until = System.nanoTime() + afterInterrupt.toNanos();
            while (System.nanoTime() < until) {
                Thread.onSpinWait();
            }
            Thread.currentThread().interrupt();
        }
    }

    private static final class StubSource implements MenuSourcePort {

        private final String type;
        private final Map<String, Function<CrawlTarget, SourceContent>> fetchers = new HashMap<>();
        private final Map<String, List<MenuDraft>> drafts = new HashMap<>();
        private final Map<String, Integer> fetches = new HashMap<>();
        private final java.util.Set<String> failParse = new java.util.HashSet<>();

        private StubSource(String type) {
            this.type = type;
        }

        void on(String targetId, Function<CrawlTarget, SourceContent> fetcher, MenuDraft... out) {
            fetchers.put(targetId, fetcher);
            drafts.put(targetId, List.of(out));
        }

        void failParse(String targetId) {
            failParse.add(targetId);
        }

        synchronized int fetches(String targetId) {
            return fetches.getOrDefault(targetId, 0);
        }

        @Override
        public boolean supports(CrawlTarget target) {
            return type.equals(target.type());
        }

        @Override
        public SourceContent fetch(CrawlTarget target) {
            synchronized (this) {
                fetches.merge(target.id(), 1, Integer::sum);
            }
            return fetchers.get(target.id()).apply(target);
        }

        @Override
        public List<MenuDraft> parse(SourceContent content, CrawlTarget target) {
            if (failParse.contains(target.id())) {
                throw new MenuParseException(target.id(), "table", "a menu table");
            }
            return drafts.getOrDefault(target.id(), List.of());
        }
    }
}
