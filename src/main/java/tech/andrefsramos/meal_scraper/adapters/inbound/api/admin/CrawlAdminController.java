package tech.andrefsramos.meal_scraper.adapters.inbound.api.admin;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.ExampleObject;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import tech.andrefsramos.meal_scraper.adapters.inbound.api.ApiError;
import tech.andrefsramos.meal_scraper.core.application.CrawlMenusUseCase;
import tech.andrefsramos.meal_scraper.core.domain.CrawlRun;
import tech.andrefsramos.meal_scraper.core.domain.CrawlTrigger;
import tech.andrefsramos.meal_scraper.core.domain.CrawlerStatus;
import tech.andrefsramos.meal_scraper.core.domain.TriggerResult;

import java.util.List;
import java.util.Optional;

/**
 * CrawlAdminController

 * Operational endpoints of the crawler: on-demand trigger, run lookup and scheduler state.
 * Triggering never waits for the crawl; it answers with the run id right away.
 */
@RestController
@RequestMapping("/admin/crawl")
@Tag(
        name = "02 - Admin",
        description = """
## ADMIN
---
Operational endpoints of the menu crawler.

### ⚙️ Available operations
- Trigger a crawl cycle now (coalesced into the running one, if any)
- Look up a crawl run and its counters
- List the latest runs
- Read the scheduler state (IDLE / RUNNING)
"""
)
public class CrawlAdminController {

    private static final Logger log = LoggerFactory.getLogger(CrawlAdminController.class);
    private final CrawlMenusUseCase crawl;

    public CrawlAdminController(CrawlMenusUseCase crawl) {
        this.crawl = crawl;
    }

    public record TriggerResponse(String runId, String status, boolean coalesced) {
        static TriggerResponse of(TriggerResult r) {
            CrawlRun run = r.run();
            String status = run.running() ? "RUNNING" : String.valueOf(run.outcome());
            return new TriggerResponse(run.runId(), status, r.coalesced());
        }
    }

    @PostMapping
    @Operation(
            summary = "Triggers a crawl cycle now",
            description = """
                Starts a crawl of every configured target in the background and returns its run id.

                🧩 Single flight
                    - If a cycle is already running, no new run is created: the answer carries the
                      running cycle's id and `coalesced=true`.
            """,
            responses = {
                    @ApiResponse(
                            responseCode = "202",
                            description = "Run accepted (new or coalesced)",
                            content = @Content(
                                    mediaType = "application/json",
                                    examples = @ExampleObject(
                                            value = "{\"runId\":\"5c0f...\",\"status\":\"RUNNING\",\"coalesced\":false}"
                                    )
                            )
                    ),
                    @ApiResponse(responseCode = "500", description = "Unexpected error while starting the run")
            }
    )
    public ResponseEntity<?> trigger() {
        log.info("CrawlAdminController: on-demand crawl requested");
        try {
            TriggerResult r = crawl.trigger(CrawlTrigger.ON_DEMAND);
            log.info("CrawlAdminController: runId={} coalesced={}", r.run().runId(), r.coalesced());
            return ResponseEntity.status(HttpStatus.ACCEPTED).body(TriggerResponse.of(r));
        } catch (Exception ex) {
            log.error("CrawlAdminController: error while triggering the crawl", ex);
            return ResponseEntity.internalServerError()
                    .body(ApiError.of(500, "internal_error", "Error while triggering the crawl: " + ex.getMessage()));
        }
    }

    @GetMapping("/runs/{runId}")
    @Operation(
            summary = "Crawl run by id",
            responses = {
                    @ApiResponse(responseCode = "200", description = "Run found"),
                    @ApiResponse(responseCode = "404", description = "Unknown run id")
            },
            parameters = @Parameter(name = "runId", description = "Id returned by the trigger endpoint")
    )
    public ResponseEntity<?> run(@PathVariable String runId) {
        try {
            Optional<CrawlRun> run = crawl.findRun(runId);
            if (run.isEmpty()) {
                return ResponseEntity.status(HttpStatus.NOT_FOUND)
                        .body(ApiError.of(404, "not_found", "Unknown crawl run '" + runId + "'."));
            }
            return ResponseEntity.ok(run.get());
        } catch (Exception ex) {
            log.error("CrawlAdminController: error reading runId='{}'", runId, ex);
            return ResponseEntity.internalServerError()
                    .body(ApiError.of(500, "internal_error", "Error while reading the run: " + ex.getMessage()));
        }
    }

    @GetMapping("/runs")
    @Operation(summary = "Latest crawl runs, newest first")
    public ResponseEntity<?> runs(
            @Parameter(description = "How many runs (1..100)", example = "10")
            @RequestParam(defaultValue = "10") int limit
    ) {
        try {
            List<CrawlRun> runs = crawl.latestRuns(limit);
            return ResponseEntity.ok(runs);
        } catch (Exception ex) {
            log.error("CrawlAdminController: error listing runs limit={}", limit, ex);
            return ResponseEntity.internalServerError()
                    .body(ApiError.of(500, "internal_error", "Error while listing runs: " + ex.getMessage()));
        }
    }

    @GetMapping("/state")
    @Operation(summary = "Scheduler state with the in-flight run and the last finished run")
    public ResponseEntity<CrawlerStatus> state() {
        return ResponseEntity.ok(crawl.status());
    }
}
