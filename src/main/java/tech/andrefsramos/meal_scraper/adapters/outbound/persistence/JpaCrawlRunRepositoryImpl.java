package tech.andrefsramos.meal_scraper.adapters.outbound.persistence;

import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;
import tech.andrefsramos.meal_scraper.adapters.outbound.persistence.entity.CrawlRunEntity;
import tech.andrefsramos.meal_scraper.core.domain.CrawlOutcome;
import tech.andrefsramos.meal_scraper.core.domain.CrawlRun;
import tech.andrefsramos.meal_scraper.core.ports.CrawlRunRepository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/*
 * JpaCrawlRunRepositoryImpl

 * Purpose

 * Crawl run history (table `crawl_run`). A run row is created when the run starts and written a
 * second time when it finishes; the final write only applies while finished_at is still null,
 * so a run is finalized exactly once.
 */
@Repository
public class JpaCrawlRunRepositoryImpl implements CrawlRunRepository {

    private static final Logger log = LoggerFactory.getLogger(JpaCrawlRunRepositoryImpl.class);

    @PersistenceContext
    private EntityManager em;

    @Override
    @Transactional
    public void create(CrawlRun run) {
        CrawlRunEntity e = toEntity(run);
        em.persist(e);
        em.flush();
        log.debug("[JPA] crawl run created runId={} trigger={}", run.runId(), run.trigger());
    }

    @Override
    @Transactional
    public boolean finalizeRun(CrawlRun finished) {
        long t0 = System.nanoTime();
        em.flush();
        int rows = em.createQuery("""
                  UPDATE CrawlRunEntity r
                     SET r.finishedAt = :fin, r.outcome = :outcome,
                         r.recordsSeen = :seen, r.recordsChanged = :changed,
                         r.recordsSkipped = :skipped, r.recordsFailed = :failed,
                         r.errorDetail = :detail
                   WHERE r.runId = :id AND r.finishedAt IS NULL
                """)
                .setParameter("fin", Timestamp.from(finished.finishedAt()))
                .setParameter("outcome", finished.outcome())
                .setParameter("seen", finished.recordsSeen())
                .setParameter("changed", finished.recordsChanged())
                .setParameter("skipped", finished.recordsSkipped())
                .setParameter("failed", finished.recordsFailed())
                .setParameter("detail", finished.errorDetail())
                .setParameter("id", finished.runId())
                .executeUpdate();
        em.clear();

        if (rows == 0) {
            if (em.find(CrawlRunEntity.class, finished.runId()) != null) {
                log.warn("[JPA] finalizeRun runId={} ignored: already finalized", finished.runId());
                return false;
            }
            // the start row was never written; keep the final state anyway
            em.persist(toEntity(finished));
            em.flush();
        }

        long tookMs = (System.nanoTime() - t0) / 1_000_000;
        log.info("[JPA] crawl run finalized runId={} outcome={} tookMs={}", finished.runId(), finished.outcome(), tookMs);
        return true;
    }

    @Override
    public Optional<CrawlRun> findById(String runId) {
        CrawlRunEntity e = em.find(CrawlRunEntity.class, runId);
        return Optional.ofNullable(e).map(this::toDomain);
    }

    @Override
    public List<CrawlRun> findLatest(int limit) {
        int lim = Math.min(Math.max(limit, 1), 100);
        List<CrawlRun> out = em.createQuery("SELECT r FROM CrawlRunEntity r ORDER BY r.startedAt DESC", CrawlRunEntity.class)
                .setMaxResults(lim)
                .getResultList()
                .stream()
                .map(this::toDomain)
                .toList();
        log.debug("[JPA] findLatest runs limit={} rows={}", lim, out.size());
        return out;
    }

    @Override
    @Transactional
    public int abandonOpenRuns(Instant now, String reason) {
        try {
            int updated = em.createQuery("""
                      UPDATE CrawlRunEntity r
                         SET r.finishedAt = :now, r.outcome = :failure, r.errorDetail = :reason
                       WHERE r.finishedAt IS NULL
                    """)
                    .setParameter("now", Timestamp.from(now))
                    .setParameter("failure", CrawlOutcome.FAILURE)
                    .setParameter("reason", reason)
                    .executeUpdate();
            em.clear();
            log.info("[JPA] abandonOpenRuns updated={}", updated);
            return updated;
        } catch (Exception e) {
            log.error("[JPA] abandonOpenRuns failed. cause={}", e.getMessage(), e);
            throw e;
        }
    }

    private CrawlRunEntity toEntity(CrawlRun run) {
        CrawlRunEntity e = new CrawlRunEntity();
        e.setRunId(run.runId());
        e.setTrigger(run.trigger());
        e.setStartedAt(Timestamp.from(run.startedAt()));
        e.setFinishedAt(run.finishedAt() != null ? Timestamp.from(run.finishedAt()) : null);
        e.setOutcome(run.outcome());
        e.setRecordsSeen(run.recordsSeen());
        e.setRecordsChanged(run.recordsChanged());
        e.setRecordsSkipped(run.recordsSkipped());
        e.setRecordsFailed(run.recordsFailed());
        e.setErrorDetail(run.errorDetail());
        return e;
    }

    private CrawlRun toDomain(CrawlRunEntity e) {
        return new CrawlRun(
                e.getRunId(),
                e.getTrigger(),
                e.getStartedAt() != null ? e.getStartedAt().toInstant() : null,
                e.getFinishedAt() != null ? e.getFinishedAt().toInstant() : null,
                e.getOutcome(),
                e.getRecordsSeen(),
                e.getRecordsChanged(),
                e.getRecordsSkipped(),
                e.getRecordsFailed(),
                e.getErrorDetail()
        );
    }
}
