package tech.andrefsramos.meal_scraper.adapters.inbound.api;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;
import tech.andrefsramos.meal_scraper.core.application.ListMenusUseCase;
import tech.andrefsramos.meal_scraper.core.domain.MealSlot;
import tech.andrefsramos.meal_scraper.core.domain.MenuItem;
import tech.andrefsramos.meal_scraper.core.domain.MenuPage;
import tech.andrefsramos.meal_scraper.core.domain.MenuRecord;
import tech.andrefsramos.meal_scraper.core.domain.MenuSource;
import tech.andrefsramos.meal_scraper.core.domain.exception.InvalidFilterException;
import tech.andrefsramos.meal_scraper.core.domain.exception.MenuStoreUnavailableException;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(MenusController.class)
class MenusControllerTest {

    private static final LocalDate D1 = LocalDate.of(2024, 5, 1);

    @Autowired
    MockMvc mvc;

    @MockBean
    ListMenusUseCase query;

    @Test
    void listReturnsThePage() throws Exception {
        MenuRecord r = new MenuRecord(7L, "tip", D1, MealSlot.LUNCH, List.of(new MenuItem("김치찌개", 5000, List.of("SPICY"))),
                MenuSource.CRAWLED, "abc", Instant.parse("2024-04-30T13:00:00Z"), 2L);
        when(query.list(eq("tip"), eq("2024-05-01"), isNull(), isNull(), isNull(), eq(10)))
                .thenReturn(new MenuPage(List.of(r), "next-token", false, D1, D1));

        mvc.perform(get("/api/v1/menus").param("providerId", "tip").param("dateFrom", "2024-05-01").param("size", "10"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.items[0].providerId").value("tip"))
                .andExpect(jsonPath("$.items[0].servingDate").value("2024-05-01"))
                .andExpect(jsonPath("$.items[0].mealSlot").value("LUNCH"))
                .andExpect(jsonPath("$.items[0].items[0].price").value(5000))
                .andExpect(jsonPath("$.items[0].version").value(2))
                .andExpect(jsonPath("$.nextPageToken").value("next-token"))
                .andExpect(jsonPath("$.stale").value(false));
    }

    @Test
    void invalidFilterIsA400NamingTheParameter() throws Exception {
        when(query.list(any(), any(), any(), any(), any(), any()))
                .thenThrow(new InvalidFilterException("mealSlot", "unknown meal slot 'BRUNCH'"));

        mvc.perform(get("/api/v1/menus").param("mealSlot", "BRUNCH"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("invalid_filter"))
                .andExpect(jsonPath("$.parameter").value("mealSlot"));
    }

    @Test
    void unavailableStoreIsA503() throws Exception {
        when(query.list(any(), any(), any(), any(), any(), any()))
                .thenThrow(new MenuStoreUnavailableException("menu store unavailable", new IllegalStateException("down")));

        mvc.perform(get("/api/v1/menus"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.error").value("store_unavailable"));
    }

    @Test
    void unexpectedErrorIsA500() throws Exception {
        when(query.list(any(), any(), any(), any(), any(), any())).thenThrow(new IllegalStateException("boom"));

        mvc.perform(get("/api/v1/menus"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.status").value(500));
    }

    @Test
    void latestIs404WhenTheProviderHasNoMenu() throws Exception {
        when(query.latestForProvider("tip", null)).thenReturn(Optional.empty());

        mvc.perform(get("/api/v1/menus/latest/tip"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("not_found"));
    }

    @Test
    void latestReturnsTheRecord() throws Exception {
        MenuRecord r = new MenuRecord(3L, "tip", D1, MealSlot.DINNER, List.of(MenuItem.of("라면")),
                MenuSource.VENDOR_SUBMITTED, "h", Instant.parse("2024-05-01T09:00:00Z"), 1L);
        when(query.latestForProvider("tip", "DINNER")).thenReturn(Optional.of(r));

        mvc.perform(get("/api/v1/menus/latest/tip").param("mealSlot", "DINNER"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.mealSlot").value("DINNER"))
                .andExpect(jsonPath("$.source").value("VENDOR_SUBMITTED"));
    }

    @Test
    void latestPerProviderReturnsOneMenuPerProviderAndSlot() throws Exception {
        MenuRecord tip = new MenuRecord(3L, "tip", D1, MealSlot.LUNCH, List.of(MenuItem.of("라면")),
                MenuSource.CRAWLED, "h1", Instant.parse("2024-05-01T09:00:00Z"), 1L);
        MenuRecord dorm = new MenuRecord(4L, "dorm", D1, MealSlot.LUNCH, List.of(MenuItem.of("비빔밥")),
                MenuSource.CRAWLED, "h2", Instant.parse("2024-05-01T08:00:00Z"), 1L);
        when(query.latestPerProvider("2024-05-01", "2024-05-03", null))
                .thenReturn(new MenuPage(List.of(dorm, tip), null, false, D1, D1.plusDays(2)));

        mvc.perform(get("/api/v1/menus/latest").param("dateFrom", "2024-05-01").param("dateTo", "2024-05-03"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.items[0].providerId").value("dorm"))
                .andExpect(jsonPath("$.items[1].providerId").value("tip"))
                .andExpect(jsonPath("$.dateTo").value("2024-05-03"));
    }

    @Test
    void latestPerProviderRejectsAnInvalidRange() throws Exception {
        when(query.latestPerProvider(any(), any(), any()))
                .thenThrow(new InvalidFilterException("dateFrom", "expected yyyy-MM-dd, got 'May 1'"));

        mvc.perform(get("/api/v1/menus/latest").param("dateFrom", "May 1"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.parameter").value("dateFrom"));
    }
}
