package tech.andrefsramos.meal_scraper.core.application.impl;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tech.andrefsramos.meal_scraper.core.application.CrawlMenusUseCase;
import tech.andrefsramos.meal_scraper.core.application.ReconcileMenusUseCase;
import tech.andrefsramos.meal_scraper.core.domain.CrawlOutcome;
import tech.andrefsramos.meal_scraper.core.domain.CrawlRun;
import tech.andrefsramos.meal_scraper.core.domain.CrawlTarget;
import tech.andrefsramos.meal_scraper.core.domain.CrawlTrigger;
import tech.andrefsramos.meal_scraper.core.domain.CrawlerStatus;
import tech.andrefsramos.meal_scraper.core.domain.MenuDraft;
import tech.andrefsramos.meal_scraper.core.domain.ReconcileResult;
import tech.andrefsramos.meal_scraper.core.domain.SchedulerState;
import tech.andrefsramos.meal_scraper.core.domain.SourceContent;
import tech.andrefsramos.meal_scraper.core.domain.TargetOutcome;
import tech.andrefsramos.meal_scraper.core.domain.TriggerResult;
import tech.andrefsramos.meal_scraper.core.domain.exception.MenuParseException;
import tech.andrefsramos.meal_scraper.core.domain.exception.SourceUnavailableException;
import tech.andrefsramos.meal_scraper.core.ports.CrawlRunRepository;
import tech.andrefsramos.meal_scraper.core.ports.MenuCachePort;
import tech.andrefsramos.meal_scraper.core.ports.MenuSourcePort;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/*
 * Purpose

 * Owns the crawl cadence and the single-flight guarantee:
 *  1) trigger(): an atomically checked run token. The first caller creates the CrawlRun and
 *     hands the cycle to the cycle executor; callers arriving while a run is in flight get that
 *     run back (coalesced) and nothing new is created.
 *  2) runCycle(): every enabled target goes through fetch -> parse -> reconcile on the target
 *     pool, bounded by the overall run deadline. Targets still running at the deadline are
 *     cancelled, reported as failed and given a bounded grace to stop before the run is finalized;
 *     work interrupted after its fetch is not reconciled.
 *  3) The run is finalized exactly once (FAILURE only if every target failed, PARTIAL if some
 *     target or record failed), then the cache entries of every touched key are dropped and
 *     the token is released.
 * Reads never wait on any of this.
 */
public class CrawlCoordinatorService implements CrawlMenusUseCase {

    private static final Logger log = LoggerFactory.getLogger(CrawlCoordinatorService.class);
    private static final int MAX_ERROR_LINES = 20;
    private static final Duration CANCEL_GRACE = Duration.ofSeconds(10);

    private final List<MenuSourcePort> sources;
    private final ReconcileMenusUseCase reconcile;
    private final CrawlRunRepository runs;
    private final MenuCachePort cache;
    private final List<CrawlTarget> targets;
    private final Executor cycleExecutor;
    private final ExecutorService targetExecutor;
    private final Duration runDeadline;
    private final Clock clock;

    private final AtomicReference<CrawlRun> inFlight = new AtomicReference<>();
    private final AtomicReference<CrawlRun> lastFinished = new AtomicReference<>();

    public CrawlCoordinatorService(
            List<MenuSourcePort> sources,
            ReconcileMenusUseCase reconcile,
            CrawlRunRepository runs,
            MenuCachePort cache,
            List<CrawlTarget> targets,
            Executor cycleExecutor,
            ExecutorService targetExecutor,
            Duration runDeadline,
            Clock clock
    ) {
        this.sources = sources != null ? sources : List.of();
        this.reconcile = Objects.requireNonNull(reconcile, "reconcile");
        this.runs = Objects.requireNonNull(runs, "runs");
        this.cache = Objects.requireNonNull(cache, "cache");
        this.targets = targets != null ? List.copyOf(targets) : List.of();
        this.cycleExecutor = Objects.requireNonNull(cycleExecutor, "cycleExecutor");
        this.targetExecutor = Objects.requireNonNull(targetExecutor, "targetExecutor");
        this.runDeadline = (runDeadline == null || runDeadline.isNegative() || runDeadline.isZero())
                ? Duration.ofMinutes(5) : runDeadline;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public TriggerResult trigger(CrawlTrigger trigger) {
        final CrawlRun candidate = CrawlRun.start(trigger, clock.instant());

        while (true) {
            CrawlRun current = inFlight.get();
            if (current != null) {
                log.info("[Crawl] trigger={} coalesced into in-flight run={} (started {})",
                        trigger, current.runId(), current.startedAt());
                return new TriggerResult(current, true);
            }
            if (inFlight.compareAndSet(null, candidate)) break;
        }

        log.info("[Crawl] run={} created trigger={} targets={}", candidate.runId(), trigger, targets.size());
        try {
            runs.create(candidate);
        } catch (Exception e) {
            log.error("[Crawl] run={} could not be recorded in the store, continuing in memory: {}",
                    candidate.runId(), e.getMessage(), e);
        }

        try {
            cycleExecutor.execute(() -> runCycle(candidate));
        } catch (RejectedExecutionException e) {
            log.error("[Crawl] run={} rejected by the cycle executor: {}", candidate.runId(), e.getMessage());
            complete(candidate, candidate.finish(clock.instant(), CrawlOutcome.FAILURE, ReconcileResult.EMPTY,
                    "cycle could not be started: " + e.getMessage()));
        }
        return new TriggerResult(candidate, false);
    }

    void runCycle(CrawlRun run) {
        final long t0 = System.nanoTime();
        CrawlRun finished;
        ReconcileResult totals = ReconcileResult.EMPTY;

        try {
            List<TargetOutcome> outcomes = crawlTargets(run);

            List<String> errors = new ArrayList<>();
            int targetsFailed = 0;
            for (TargetOutcome o : outcomes) {
                totals = totals.plus(o.result());
                if (o.targetFailed()) {
                    targetsFailed++;
                    errors.add("target " + o.targetId() + ": " + o.error());
                }
                o.result().errors().forEach(err -> errors.add("target " + o.targetId() + ": " + err));
            }

            CrawlOutcome outcome;
            if (!outcomes.isEmpty() && targetsFailed == outcomes.size()) {
                outcome = CrawlOutcome.FAILURE;
            } else if (targetsFailed > 0 || totals.failed() > 0) {
                outcome = CrawlOutcome.PARTIAL;
            } else {
                outcome = CrawlOutcome.SUCCESS;
            }

            finished = run.finish(clock.instant(), outcome, totals, summarize(errors));
            log.info("[Crawl] run={} finished outcome={} targets={} targetsFailed={} seen={} changed={} skipped={} failed={} took={} ms",
                    run.runId(), outcome, outcomes.size(), targetsFailed, totals.seen(), totals.changed(),
                    totals.skipped(), totals.failed(), durMs(t0, System.nanoTime()));
        } catch (Exception e) {
            log.error("[Crawl] run={} aborted: {}", run.runId(), e.getMessage(), e);
            finished = run.finish(clock.instant(), CrawlOutcome.FAILURE, totals, "cycle aborted: " + e.getMessage());
        }

        complete(run, finished);

        if (!totals.touchedKeys().isEmpty()) {
            try {
                cache.invalidateMenus(totals.touchedKeys());
                log.debug("[Crawl] run={} invalidated cache for {} touched keys", run.runId(), totals.touchedKeys().size());
            } catch (Exception e) {
                log.warn("[Crawl] run={} final cache invalidation failed: {}", run.runId(), e.getMessage());
            }
        }
    }

    private List<TargetOutcome> crawlTargets(CrawlRun run) {
        if (targets.isEmpty()) {
            log.warn("[Crawl] run={} no enabled targets. Check app.crawl.targets.", run.runId());
            return List.of();
        }

        List<TargetTask> tasks = new ArrayList<>(targets.size());
        for (CrawlTarget t : targets) {
            tasks.add(new TargetTask(t, run));
        }

        List<Future<TargetOutcome>> futures;
        try {
            futures = targetExecutor.invokeAll(tasks, runDeadline.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[Crawl] run={} interrupted while waiting for targets", run.runId());
            return targets.stream().map(t -> TargetOutcome.failed(t.id(), "interrupted")).toList();
        }

        List<TargetOutcome> outcomes = new ArrayList<>(futures.size());
        for (int i = 0; i < futures.size(); i++) {
            CrawlTarget t = targets.get(i);
            Future<TargetOutcome> f = futures.get(i);
            try {
                outcomes.add(f.get());
            } catch (CancellationException e) {
                log.warn("[Crawl] run={} target={} cancelled at the run deadline ({})", run.runId(), t.id(), runDeadline);
                tasks.get(i).awaitStopped();
                outcomes.add(TargetOutcome.failed(t.id(), "deadline of " + runDeadline + " exceeded"));
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                log.error("[Crawl] run={} target={} crashed: {}", run.runId(), t.id(), cause.getMessage(), cause);
                outcomes.add(TargetOutcome.failed(t.id(), cause.getClass().getSimpleName() + ": " + cause.getMessage()));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                outcomes.add(TargetOutcome.failed(t.id(), "interrupted"));
            }
        }
        return outcomes;
    }

    TargetOutcome crawlOne(CrawlTarget target, CrawlRun run) {
        final long t0 = System.nanoTime();
        final String tid = target.id();

        if (Thread.currentThread().isInterrupted()) {
            return TargetOutcome.failed(tid, "cancelled before start");
        }

        MenuSourcePort source = resolveSource(target);
        if (source == null) {
            log.warn("[Crawl] run={} target={} no MenuSourcePort supports type='{}'. Registered={}",
                    run.runId(), tid, target.type(), sources.size());
            return TargetOutcome.failed(tid, "no source adapter for type '" + target.type() + "'");
        }

        final SourceContent content;
        try {
            content = source.fetch(target);
        } catch (SourceUnavailableException e) {
            log.warn("[Crawl] run={} target={} source unavailable: {}", run.runId(), tid, e.getMessage());
            return TargetOutcome.failed(tid, "source unavailable: " + e.getMessage());
        } catch (MenuParseException e) {
            log.error("[Crawl] run={} target={} landing document not recognized: {}", run.runId(), tid, e.getMessage());
            return TargetOutcome.failed(tid, "parse error: " + e.getMessage());
        }

        if (content == null || content.isEmpty()) {
            log.info("[Crawl] run={} target={} returned an empty document, no menu published.", run.runId(), tid);
            return TargetOutcome.ok(tid, ReconcileResult.EMPTY);
        }

        final List<MenuDraft> drafts;
        try {
            drafts = source.parse(content, target);
        } catch (MenuParseException e) {
            log.error("[Crawl] run={} target={} parse error section='{}' expected='{}': {}",
                    run.runId(), tid, e.getSection(), e.getExpected(), e.getMessage());
            return TargetOutcome.failed(tid, "parse error: " + e.getMessage());
        }

        if (Thread.currentThread().isInterrupted()) {
            log.warn("[Crawl] run={} target={} cancelled after fetch, {} drafts dropped.", run.runId(), tid, drafts.size());
            return TargetOutcome.failed(tid, "cancelled before reconcile");
        }

        ReconcileResult result = reconcile.reconcile(drafts, run);
        log.info("[Crawl] run={} target={} drafts={} changed={} failed={} ({} ms)",
                run.runId(), tid, drafts.size(), result.changed(), result.failed(), durMs(t0, System.nanoTime()));
        return TargetOutcome.ok(tid, result);
    }

    private MenuSourcePort resolveSource(CrawlTarget target) {
        for (MenuSourcePort s : sources) {
            try {
                if (s.supports(target)) return s;
            } catch (Exception e) {
                log.warn("[Crawl] supports() failed in {} for target={}: {}",
                        s.getClass().getSimpleName(), target.id(), e.toString());
            }
        }
        return null;
    }

    private void complete(CrawlRun run, CrawlRun finished) {
        try {
            if (!runs.finalizeRun(finished)) {
                log.warn("[Crawl] run={} was already finalized in the store", run.runId());
            }
        } catch (Exception e) {
            log.error("[Crawl] run={} final state could not be stored: {}", run.runId(), e.getMessage(), e);
        } finally {
            lastFinished.set(finished);
            inFlight.compareAndSet(run, null);
        }
    }

    @Override
    public Optional<CrawlRun> findRun(String runId) {
        if (runId == null || runId.isBlank()) return Optional.empty();
        CrawlRun current = inFlight.get();
        if (current != null && current.runId().equals(runId)) return Optional.of(current);
        CrawlRun last = lastFinished.get();
        if (last != null && last.runId().equals(runId)) return Optional.of(last);
        return runs.findById(runId);
    }

    @Override
    public List<CrawlRun> latestRuns(int limit) {
        return runs.findLatest(Math.min(Math.max(limit, 1), 100));
    }

    @Override
    public CrawlerStatus status() {
        CrawlRun current = inFlight.get();
        CrawlRun last = lastFinished.get();
        if (last == null) {
            try {
                last = runs.findLatest(5).stream().filter(r -> !r.running()).findFirst().orElse(null);
            } catch (Exception e) {
                log.warn("[Crawl] last run lookup failed: {}", e.getMessage());
            }
        }
        return new CrawlerStatus(current != null ? SchedulerState.RUNNING : SchedulerState.IDLE, current, last);
    }

    @Override
    public int recoverAbandonedRuns() {
        int n = runs.abandonOpenRuns(clock.instant(), "abandoned: the process stopped while the run was in flight");
        if (n > 0) {
            log.warn("[Crawl] {} run(s) left RUNNING by a previous process finalized as FAILURE", n);
        }
        return n;
    }

    private static String summarize(List<String> errors) {
        if (errors.isEmpty()) return null;
        List<String> head = errors.size() > MAX_ERROR_LINES ? errors.subList(0, MAX_ERROR_LINES) : errors;
        String s = String.join("\n", head);
        return errors.size() > MAX_ERROR_LINES ? s + "\n(+" + (errors.size() - MAX_ERROR_LINES) + " more)" : s;
    }

    private static long durMs(long tStart, long tEnd) {
        return TimeUnit.NANOSECONDS.toMillis(Math.max(0, tEnd - tStart));
    }

    /**
     * One target of one run. Once cancelled, a task that already started is awaited (bounded) before
     * the run is finalized; one that never started is claimed and will not start afterwards.
     */
    private final class TargetTask implements Callable<TargetOutcome> {

        private final CrawlTarget target;
        private final CrawlRun run;
        private final AtomicBoolean claimed = new AtomicBoolean();
        private final CountDownLatch stopped = new CountDownLatch(1);

        private TargetTask(CrawlTarget target, CrawlRun run) {
            this.target = target;
            this.run = run;
        }

        @Override
        public TargetOutcome call() {
            if (!claimed.compareAndSet(false, true)) {
                return TargetOutcome.failed(target.id(), "cancelled before start");
            }
            try {
                return crawlOne(target, run);
            } finally {
                stopped.countDown();
            }
        }

        void awaitStopped() {
            if (claimed.compareAndSet(false, true)) return;
            try {
                if (!stopped.await(CANCEL_GRACE.toMillis(), TimeUnit.MILLISECONDS)) {
                    log.warn("[Crawl] run={} target={} still running {} after cancellation; late writes are not counted.",
                            run.runId(), target.id(), CANCEL_GRACE);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }
}
