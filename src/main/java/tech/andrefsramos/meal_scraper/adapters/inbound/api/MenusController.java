package tech.andrefsramos.meal_scraper.adapters.inbound.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.ExampleObject;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import tech.andrefsramos.meal_scraper.core.application.ListMenusUseCase;
import tech.andrefsramos.meal_scraper.core.domain.MenuPage;
import tech.andrefsramos.meal_scraper.core.domain.MenuRecord;
import tech.andrefsramos.meal_scraper.core.domain.exception.InvalidFilterException;
import tech.andrefsramos.meal_scraper.core.domain.exception.MenuStoreUnavailableException;

import java.util.Optional;

/**
 * MenusController
 *
 * Overview:
 * - REST controller (v1) for reading menus collected by the crawler.
 * - GET /api/v1/menus lists menus with keyset pagination (pageToken), filtered by provider,
 *   serving date range and meal slot.
 * - GET /api/v1/menus/latest returns the newest menu of every (provider, meal slot) pair in a date range.
 * - GET /api/v1/menus/latest/{providerId} returns the most recently updated menu of a provider.
 *
 * Status mapping:
 * - InvalidFilterException -> 400, MenuStoreUnavailableException -> 503, anything else -> 500.
 */
@RestController
@RequestMapping("/api/v1")
@Tag(name = "01 - Menus")
public class MenusController {

    private static final Logger log = LoggerFactory.getLogger(MenusController.class);

    private final ListMenusUseCase query;

    public MenusController(ListMenusUseCase query) {this.query = query;}

    @GetMapping("/menus")
    @Operation(
            summary = "Lists menus by serving date",
            description = """
        Returns one page of menus ordered by `servingDate` ascending, then `providerId`, then meal slot
        (BREAKFAST, LUNCH, DINNER, OTHER).

        ### 🔎 Pagination
        Pages are keyset-based. Pass the `nextPageToken` of a response as `pageToken` with the **same filters**
        to get the next page; a missing `nextPageToken` means the last page was reached.

        ### ⚠️ Rules
        - Without `dateFrom`/`dateTo` the range is today (service time zone).
        - A reversed range is swapped; ranges longer than the configured maximum return `400`.
        - `size` is limited to the configured maximum (100 by default).
        - `stale=true` means part of the page came from cache because the store was unreachable.
        """,
            responses = {
                    @ApiResponse(responseCode = "200", description = "Page of menus (possibly empty).",
                            content = @Content(mediaType = "application/json",
                                    schema = @Schema(implementation = MenuPage.class),
                                    examples = @ExampleObject(name = "Page", value = """
                        {
                          "items": [
                            {
                              "id": 12,
                              "providerId": "tip",
                              "servingDate": "2024-05-01",
                              "mealSlot": "LUNCH",
                              "items": [{"name": "김치찌개", "price": 5000, "tags": ["SPICY"]}],
                              "source": "CRAWLED",
                              "contentHash": "9f2c...",
                              "lastUpdatedAt": "2024-04-30T13:00:00Z",
                              "version": 2
                            }
                          ],
                          "nextPageToken": "djF8...",
                          "stale": false,
                          "dateFrom": "2024-05-01",
                          "dateTo": "2024-05-03"
                        }
                        """))),
                    @ApiResponse(responseCode = "400", description = "Invalid date, meal slot, range or page token."),
                    @ApiResponse(responseCode = "503", description = "Menu store unavailable and no cached data within the grace window."),
                    @ApiResponse(responseCode = "500", description = "Unexpected error.")
            }
    )
    public ResponseEntity<?> list(
            @Parameter(description = "Provider (cafeteria) id. Omitted means every provider.", example = "tip")
            @RequestParam(required = false) String providerId,

            @Parameter(description = "First serving date, `yyyy-MM-dd`.", example = "2024-05-01")
            @RequestParam(required = false) String dateFrom,

            @Parameter(description = "Last serving date (inclusive), `yyyy-MM-dd`.", example = "2024-05-03")
            @RequestParam(required = false) String dateTo,

            @Parameter(description = "BREAKFAST, LUNCH, DINNER or OTHER.", example = "LUNCH")
            @RequestParam(required = false) String mealSlot,

            @Parameter(description = "`nextPageToken` of the previous page.")
            @RequestParam(required = false) String pageToken,

            @Parameter(description = "Items per page.", example = "20")
            @RequestParam(required = false) Integer size
    ) {
        long t0 = System.nanoTime();
        log.info("MenusController: list providerId='{}', dateFrom='{}', dateTo='{}', mealSlot='{}', hasToken={}, size={}",
                providerId, dateFrom, dateTo, mealSlot, pageToken != null, size);

        try {
            MenuPage page = query.list(providerId, dateFrom, dateTo, mealSlot, pageToken, size);
            long elapsedMs = (System.nanoTime() - t0) / 1_000_000;
            log.info("MenusController: list done items={} hasNext={} stale={} elapsedMs={}",
                    page.items().size(), page.nextPageToken() != null, page.stale(), elapsedMs);
            return ResponseEntity.ok(page);
        } catch (InvalidFilterException ex) {
            log.warn("MenusController: invalid parameter {}: {}", ex.getParameter(), ex.getMessage());
            return ResponseEntity.badRequest()
                    .body(new ApiError(400, "invalid_filter", ex.getMessage(), ex.getParameter()));
        } catch (MenuStoreUnavailableException ex) {
            log.error("MenusController: store unavailable: {}", ex.getMessage());
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                    .body(ApiError.of(503, "store_unavailable", ex.getMessage()));
        } catch (Exception ex) {
            long elapsedMs = (System.nanoTime() - t0) / 1_000_000;
            log.error("MenusController: unexpected error (elapsedMs={})", elapsedMs, ex);
            return ResponseEntity.internalServerError()
                    .body(ApiError.of(500, "internal_error", "Unexpected error while listing menus."));
        }
    }

    @GetMapping("/menus/latest")
    @Operation(
            summary = "Latest menu per provider and meal slot",
            description = """
        For every provider and meal slot found between `dateFrom` and `dateTo`, returns the most recently
        updated menu. Date rules are the same as in `GET /api/v1/menus`; the result is a single page.
        """,
            responses = {
                    @ApiResponse(responseCode = "200", description = "Newest menus (possibly empty).",
                            content = @Content(mediaType = "application/json", schema = @Schema(implementation = MenuPage.class))),
                    @ApiResponse(responseCode = "400", description = "Invalid date, meal slot or range."),
                    @ApiResponse(responseCode = "503", description = "Menu store unavailable and no cached data within the grace window.")
            }
    )
    public ResponseEntity<?> latestPerProvider(
            @Parameter(description = "First serving date, `yyyy-MM-dd`.", example = "2024-05-01")
            @RequestParam(required = false) String dateFrom,
            @Parameter(description = "Last serving date (inclusive), `yyyy-MM-dd`.", example = "2024-05-03")
            @RequestParam(required = false) String dateTo,
            @Parameter(description = "BREAKFAST, LUNCH, DINNER or OTHER.", example = "LUNCH")
            @RequestParam(required = false) String mealSlot
    ) {
        log.info("MenusController: latestPerProvider dateFrom='{}', dateTo='{}', mealSlot='{}'", dateFrom, dateTo, mealSlot);
        try {
            return ResponseEntity.ok(query.latestPerProvider(dateFrom, dateTo, mealSlot));
        } catch (InvalidFilterException ex) {
            log.warn("MenusController: invalid parameter {}: {}", ex.getParameter(), ex.getMessage());
            return ResponseEntity.badRequest()
                    .body(new ApiError(400, "invalid_filter", ex.getMessage(), ex.getParameter()));
        } catch (MenuStoreUnavailableException ex) {
            log.error("MenusController: store unavailable: {}", ex.getMessage());
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                    .body(ApiError.of(503, "store_unavailable", ex.getMessage()));
        } catch (Exception ex) {
            log.error("MenusController: unexpected error in latestPerProvider", ex);
            return ResponseEntity.internalServerError()
                    .body(ApiError.of(500, "internal_error", "Unexpected error while reading the latest menus."));
        }
    }

    @GetMapping("/menus/latest/{providerId}")
    @Operation(
            summary = "Latest menu of a provider",
            description = "Most recently updated menu of the provider, optionally restricted to one meal slot.",
            responses = {
                    @ApiResponse(responseCode = "200", description = "Menu found.",
                            content = @Content(mediaType = "application/json", schema = @Schema(implementation = MenuRecord.class))),
                    @ApiResponse(responseCode = "404", description = "The provider has no menu yet."),
                    @ApiResponse(responseCode = "400", description = "Invalid meal slot."),
                    @ApiResponse(responseCode = "503", description = "Menu store unavailable.")
            }
    )
    public ResponseEntity<?> latest(
            @Parameter(description = "Provider (cafeteria) id.", example = "tip")
            @PathVariable String providerId,
            @Parameter(description = "BREAKFAST, LUNCH, DINNER or OTHER.", example = "DINNER")
            @RequestParam(required = false) String mealSlot
    ) {
        log.info("MenusController: latest providerId='{}', mealSlot='{}'", providerId, mealSlot);
        try {
            Optional<MenuRecord> r = query.latestForProvider(providerId, mealSlot);
            if (r.isEmpty()) {
                return ResponseEntity.status(HttpStatus.NOT_FOUND)
                        .body(ApiError.of(404, "not_found", "No menu for provider '" + providerId + "'."));
            }
            return ResponseEntity.ok(r.get());
        } catch (InvalidFilterException ex) {
            log.warn("MenusController: invalid parameter {}: {}", ex.getParameter(), ex.getMessage());
            return ResponseEntity.badRequest()
                    .body(new ApiError(400, "invalid_filter", ex.getMessage(), ex.getParameter()));
        } catch (MenuStoreUnavailableException ex) {
            log.error("MenusController: store unavailable: {}", ex.getMessage());
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                    .body(ApiError.of(503, "store_unavailable", ex.getMessage()));
        } catch (Exception ex) {
            log.error("MenusController: unexpected error for providerId='{}'", providerId, ex);
            return ResponseEntity.internalServerError()
                    .body(ApiError.of(500, "internal_error", "Unexpected error while reading the latest menu."));
        }
    }
}
