package tech.andrefsramos.meal_scraper.adapters.outbound.persistence.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;
import tech.andrefsramos.meal_scraper.core.domain.CrawlOutcome;
import tech.andrefsramos.meal_scraper.core.domain.CrawlTrigger;

import java.sql.Timestamp;

@Setter
@Getter
@ToString
@Entity
@Table(name = "crawl_run", indexes = @Index(name = "ix_crawl_run_started", columnList = "started_at"))
public class CrawlRunEntity {
    @Id
    @Column(name = "run_id", length = 36)
    private String runId;

    @Enumerated(EnumType.STRING)
    @Column(name = "trigger_type", nullable = false, length = 20)
    private CrawlTrigger trigger;

    @Column(name = "started_at", nullable = false) private Timestamp startedAt;
    @Column(name = "finished_at")                  private Timestamp finishedAt;

    @Enumerated(EnumType.STRING)
    @Column(length = 20)
    private CrawlOutcome outcome;

    @Column(name = "records_seen", nullable = false)    private int recordsSeen;
    @Column(name = "records_changed", nullable = false) private int recordsChanged;
    @Column(name = "records_skipped", nullable = false) private int recordsSkipped;
    @Column(name = "records_failed", nullable = false)  private int recordsFailed;

    @Lob @Column(name = "error_detail")
    private String errorDetail;
}
