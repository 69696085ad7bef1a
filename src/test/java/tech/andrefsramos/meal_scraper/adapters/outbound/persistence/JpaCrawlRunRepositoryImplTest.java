package tech.andrefsramos.meal_scraper.adapters.outbound.persistence;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import tech.andrefsramos.meal_scraper.core.domain.CrawlOutcome;
import tech.andrefsramos.meal_scraper.core.domain.CrawlRun;
import tech.andrefsramos.meal_scraper.core.domain.CrawlTrigger;
import tech.andrefsramos.meal_scraper.core.domain.ReconcileResult;

import java.time.Instant;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
@Import(JpaCrawlRunRepositoryImpl.class)
class JpaCrawlRunRepositoryImplTest {

    private static final Instant T0 = Instant.parse("2024-05-01T00:00:00Z");

    @Autowired
    JpaCrawlRunRepositoryImpl repo;

    @Test
    void runIsCreatedRunningAndFinalizedOnce() {
        CrawlRun run = CrawlRun.start(CrawlTrigger.SCHEDULED, T0);
        repo.create(run);
        assertThat(repo.findById(run.runId())).get().matches(CrawlRun::running);

        ReconcileResult totals = new ReconcileResult(10, 3, 6, 1, Set.of(), List.of("x"));
        CrawlRun partial = run.finish(T0.plusSeconds(30), CrawlOutcome.PARTIAL, totals, "target P2: timeout");
        assertThat(repo.finalizeRun(partial)).isTrue();

        CrawlRun again = run.finish(T0.plusSeconds(60), CrawlOutcome.SUCCESS, ReconcileResult.EMPTY, null);
        assertThat(repo.finalizeRun(again)).isFalse();

        CrawlRun stored = repo.findById(run.runId()).orElseThrow();
        assertThat(stored.outcome()).isEqualTo(CrawlOutcome.PARTIAL);
        assertThat(stored.finishedAt()).isEqualTo(T0.plusSeconds(30));
        assertThat(stored.recordsSeen()).isEqualTo(10);
        assertThat(stored.recordsChanged()).isEqualTo(3);
        assertThat(stored.recordsSkipped()).isEqualTo(6);
        assertThat(stored.recordsFailed()).isEqualTo(1);
        assertThat(stored.errorDetail()).isEqualTo("target P2: timeout");
    }

    @Test
    void finalizingAnUnrecordedRunStoresItsFinalState() {
        CrawlRun run = CrawlRun.start(CrawlTrigger.ON_DEMAND, T0);

        assertThat(repo.finalizeRun(run.finish(T0.plusSeconds(5), CrawlOutcome.SUCCESS, ReconcileResult.EMPTY, null))).isTrue();

        assertThat(repo.findById(run.runId())).get()
                .satisfies(r -> assertThat(r.outcome()).isEqualTo(CrawlOutcome.SUCCESS));
    }

    @Test
    void latestRunsComeNewestFirst() {
        CrawlRun older = CrawlRun.start(CrawlTrigger.SCHEDULED, T0);
        CrawlRun newer = CrawlRun.start(CrawlTrigger.ON_DEMAND, T0.plusSeconds(3600));
        repo.create(older);
        repo.create(newer);

        assertThat(repo.findLatest(10)).extracting(CrawlRun::runId).containsExactly(newer.runId(), older.runId());
        assertThat(repo.findLatest(1)).hasSize(1);
    }

    @Test
    void openRunsAreAbandonedAsFailures() {
        CrawlRun open = CrawlRun.start(CrawlTrigger.SCHEDULED, T0);
        CrawlRun closed = CrawlRun.start(CrawlTrigger.SCHEDULED, T0.minusSeconds(7200));
        repo.create(open);
        repo.create(closed);
        repo.finalizeRun(closed.finish(T0.minusSeconds(7000), CrawlOutcome.SUCCESS, ReconcileResult.EMPTY, null));

        assertThat(repo.abandonOpenRuns(T0.plusSeconds(10), "abandoned")).isEqualTo(1);

        assertThat(repo.findById(open.runId())).get().satisfies(r -> {
            assertThat(r.outcome()).isEqualTo(CrawlOutcome.FAILURE);
            assertThat(r.errorDetail()).isEqualTo("abandoned");
            assertThat(r.running()).isFalse();
        });
        assertThat(repo.findById(closed.runId())).get()
                .satisfies(r -> assertThat(r.outcome()).isEqualTo(CrawlOutcome.SUCCESS));
    }
}
