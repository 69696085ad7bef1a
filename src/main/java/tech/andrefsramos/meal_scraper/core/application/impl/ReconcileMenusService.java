package tech.andrefsramos.meal_scraper.core.application.impl;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tech.andrefsramos.meal_scraper.core.application.ReconcileMenusUseCase;
import tech.andrefsramos.meal_scraper.core.domain.CrawlRun;
import tech.andrefsramos.meal_scraper.core.domain.MenuDraft;
import tech.andrefsramos.meal_scraper.core.domain.MenuKey;
import tech.andrefsramos.meal_scraper.core.domain.MenuRecord;
import tech.andrefsramos.meal_scraper.core.domain.MenuSource;
import tech.andrefsramos.meal_scraper.core.domain.ReconcileResult;
import tech.andrefsramos.meal_scraper.core.domain.exception.ReconcileException;
import tech.andrefsramos.meal_scraper.core.domain.exception.StaleWriteException;
import tech.andrefsramos.meal_scraper.core.ports.MenuCachePort;
import tech.andrefsramos.meal_scraper.core.ports.MenuRecordRepository;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.TimeUnit;

/*
 * Purpose

 * Walks a batch of parsed drafts and compares each one with the current record of its key:
 *  1) No current record: insert as version 1 (crawl-owned).
 *  2) Same contentHash: nothing written, counted as seen/skipped.
 *  3) Different hash and crawl-owned: compare-and-swap to version + 1.
 *  4) Vendor-owned: skipped, a crawl never replaces a vendor's own submission.
 * A lost compare-and-swap is retried once from a fresh read; a second loss, like any other
 * write error, is counted as a failed record and never stops the batch.
 * An interrupt (run deadline) stops the batch between drafts; the drafts not reached count as failed.
 * Every accepted write invalidates the cache entries of its (provider, date).
 */
public class ReconcileMenusService implements ReconcileMenusUseCase {

    private static final Logger log = LoggerFactory.getLogger(ReconcileMenusService.class);

    enum Decision { INSERTED, UPDATED, UNCHANGED, VENDOR_OWNED }

    private final MenuRecordRepository repository;
    private final MenuCachePort cache;
    private final Clock clock;

    public ReconcileMenusService(MenuRecordRepository repository, MenuCachePort cache, Clock clock) {
        this.repository = repository;
        this.cache = cache;
        this.clock = clock;
    }

    @Override
    public ReconcileResult reconcile(List<MenuDraft> drafts, CrawlRun asOf) {
        final long t0 = System.nanoTime();
        final String runId = asOf != null ? asOf.runId() : "-";

        if (drafts == null || drafts.isEmpty()) {
            log.info("[Reconcile] run={} empty batch, nothing to compare.", runId);
            return ReconcileResult.EMPTY;
        }

        int seen = 0;
        int inserted = 0;
        int updated = 0;
        int unchanged = 0;
        int vendorOwned = 0;
        int invalid = 0;
        int failed = 0;
        final Set<MenuKey> touched = new LinkedHashSet<>();
        final List<String> errors = new ArrayList<>();

        for (MenuDraft draft : drafts) {
            if (Thread.currentThread().isInterrupted()) {
                int remaining = drafts.size() - seen;
                seen += remaining;
                failed += remaining;
                errors.add("interrupted with " + remaining + " drafts not reconciled");
                log.warn("[Reconcile] run={} interrupted, {} of {} drafts not reconciled.", runId, remaining, drafts.size());
                break;
            }
            seen++;

            if (draft == null || draft.contentHash() == null || draft.providerId() == null
                    || draft.servingDate() == null || draft.mealSlot() == null) {
                invalid++;
                log.warn("[Reconcile] run={} incomplete draft at position {}, ignored.", runId, seen - 1);
                continue;
            }

            final MenuKey key = draft.key();
            try {
                Decision d = applyWithRetry(draft, runId);
                switch (d) {
                    case INSERTED -> inserted++;
                    case UPDATED -> updated++;
                    case UNCHANGED -> unchanged++;
                    case VENDOR_OWNED -> vendorOwned++;
                }
                if (d == Decision.INSERTED || d == Decision.UPDATED) {
                    touched.add(key);
                    invalidate(key, runId);
                }
            } catch (ReconcileException e) {
                failed++;
                errors.add(e.getMessage());
                log.error("[Reconcile] run={} write failed key={}: {}", runId, key, e.getMessage());
            } catch (Exception e) {
                failed++;
                errors.add(key + ": " + e.getMessage());
                log.error("[Reconcile] run={} unexpected error key={}: {}", runId, key, e.getMessage(), e);
            }
        }

        int changed = inserted + updated;
        int skipped = unchanged + vendorOwned + invalid;
        log.info("[Reconcile] run={} done: seen={}, inserted={}, updated={}, unchanged={}, vendorOwned={}, invalid={}, failed={}, took={} ms",
                runId, seen, inserted, updated, unchanged, vendorOwned, invalid, failed, durMs(t0, System.nanoTime()));

        return new ReconcileResult(seen, changed, skipped, failed, touched, errors);
    }

    private Decision applyWithRetry(MenuDraft draft, String runId) {
        try {
            return applyOnce(draft);
        } catch (StaleWriteException first) {
            log.warn("[Reconcile] run={} concurrent change on key={} ({}), retrying from a fresh read.",
                    runId, draft.key(), first.getMessage());
            try {
                return applyOnce(draft);
            } catch (StaleWriteException second) {
                throw new ReconcileException(draft.key(), "lost compare-and-swap twice", second);
            }
        } catch (RuntimeException e) {
            throw new ReconcileException(draft.key(), e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage(), e);
        }
    }

    Decision applyOnce(MenuDraft draft) {
        final Instant now = clock.instant();
        final Optional<MenuRecord> currentOpt = repository.findCurrent(draft.key());

        if (currentOpt.isEmpty()) {
            MenuRecord saved = repository.insert(MenuRecord.firstVersion(draft, now));
            if (log.isDebugEnabled()) {
                log.debug("[Reconcile] NEW key={} version={} items={}", draft.key(), saved.version(), saved.items().size());
            }
            return Decision.INSERTED;
        }

        final MenuRecord current = currentOpt.get();
        if (current.source() == MenuSource.VENDOR_SUBMITTED) {
            if (log.isDebugEnabled()) {
                log.debug("[Reconcile] VENDOR-OWNED key={} version={}, crawl draft ignored.", draft.key(), current.version());
            }
            return Decision.VENDOR_OWNED;
        }

        if (current.contentHash().equals(draft.contentHash())) {
            if (log.isDebugEnabled()) {
                log.debug("[Reconcile] NO-CHANGE key={} version={}", draft.key(), current.version());
            }
            return Decision.UNCHANGED;
        }

        MenuRecord saved = repository.compareAndSwap(current.nextVersion(draft, now), current.version());
        if (log.isDebugEnabled()) {
            log.debug("[Reconcile] UPDATE key={} version {} -> {}", draft.key(), current.version(), saved.version());
        }
        return Decision.UPDATED;
    }

    private void invalidate(MenuKey key, String runId) {
        try {
            cache.invalidateMenus(List.of(key));
        } catch (Exception e) {
            log.warn("[Reconcile] run={} cache invalidation failed key={}: {}", runId, key, e.getMessage());
        }
    }

    private static long durMs(long tStart, long tEnd) {
        return TimeUnit.NANOSECONDS.toMillis(Math.max(0, tEnd - tStart));
    }
}
