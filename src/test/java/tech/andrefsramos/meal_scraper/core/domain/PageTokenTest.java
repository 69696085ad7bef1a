package tech.andrefsramos.meal_scraper.core.domain;

import org.junit.jupiter.api.Test;
import tech.andrefsramos.meal_scraper.core.domain.exception.InvalidFilterException;

import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.util.Base64;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PageTokenTest {

    @Test
    void decodesWhatItEncodes() {
        PageToken token = new PageToken("1a2b", new MenuKey("제2|식당", LocalDate.of(2024, 5, 1), MealSlot.DINNER));

        PageToken back = PageToken.decode(token.encode());

        assertThat(back).isEqualTo(token);
        assertThat(token.encode()).doesNotContain("+", "/", "=");
    }

    @Test
    void garbageIsRejectedAsPageTokenError() {
        String wrongVersion = Base64.getUrlEncoder().encodeToString("v0|x|2024-05-01|LUNCH|UDE".getBytes(StandardCharsets.UTF_8));
        String badSlot = Base64.getUrlEncoder().encodeToString("v1|x|2024-05-01|BRUNCH|UDE".getBytes(StandardCharsets.UTF_8));
        String badDate = Base64.getUrlEncoder().encodeToString("v1|x|2024-02-30|LUNCH|UDE".getBytes(StandardCharsets.UTF_8));

        for (String t : new String[]{"***", wrongVersion, badSlot, badDate}) {
            assertThatThrownBy(() -> PageToken.decode(t))
                    .isInstanceOfSatisfying(InvalidFilterException.class, e -> assertThat(e.getParameter()).isEqualTo("pageToken"));
        }
    }

    @Test
    void fingerprintDependsOnEveryFilterField() {
        MenuFilter base = new MenuFilter(null, LocalDate.of(2024, 5, 1), LocalDate.of(2024, 5, 3), null);

        assertThat(base.fingerprint()).isEqualTo(new MenuFilter(null, LocalDate.of(2024, 5, 1), LocalDate.of(2024, 5, 3), null).fingerprint());
        assertThat(new MenuFilter("P1", base.dateFrom(), base.dateTo(), null).fingerprint()).isNotEqualTo(base.fingerprint());
        assertThat(new MenuFilter(null, base.dateFrom(), base.dateTo(), MealSlot.LUNCH).fingerprint()).isNotEqualTo(base.fingerprint());
        assertThat(new MenuFilter(null, base.dateFrom(), LocalDate.of(2024, 5, 4), null).fingerprint()).isNotEqualTo(base.fingerprint());
    }
}
