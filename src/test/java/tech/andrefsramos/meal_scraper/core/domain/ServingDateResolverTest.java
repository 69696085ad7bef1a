package tech.andrefsramos.meal_scraper.core.domain;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;

class ServingDateResolverTest {

    private static final LocalDate REF = LocalDate.of(2024, 5, 1);

    @Test
    void readsFullDates() {
        assertThat(ServingDateResolver.resolve("2024-05-03", REF)).contains(LocalDate.of(2024, 5, 3));
        assertThat(ServingDateResolver.resolve("2024.5.3(금)", REF)).contains(LocalDate.of(2024, 5, 3));
        assertThat(ServingDateResolver.resolve("2024년 5월 3일", REF)).contains(LocalDate.of(2024, 5, 3));
    }

    @Test
    void readsShortDatesInTheNearestYear() {
        assertThat(ServingDateResolver.resolve("05.02(목)", REF)).contains(LocalDate.of(2024, 5, 2));
        assertThat(ServingDateResolver.resolve("5월 2일", REF)).contains(LocalDate.of(2024, 5, 2));
        assertThat(ServingDateResolver.resolve("12/30", LocalDate.of(2025, 1, 2))).contains(LocalDate.of(2024, 12, 30));
        assertThat(ServingDateResolver.resolve("1/2", LocalDate.of(2024, 12, 30))).contains(LocalDate.of(2025, 1, 2));
    }

    @Test
    void rejectsTextWithoutDate() {
        assertThat(ServingDateResolver.resolve("월요일", REF)).isEmpty();
        assertThat(ServingDateResolver.resolve("13/45", REF)).isEmpty();
        assertThat(ServingDateResolver.resolve(" ", REF)).isEmpty();
    }

    @Test
    void weekdayColumnsMapToMondayBasedWeek() {
        LocalDate wednesday = LocalDate.of(2024, 5, 1);

        assertThat(ServingDateResolver.weekdayOf(wednesday, 1)).isEqualTo(LocalDate.of(2024, 4, 29));
        assertThat(ServingDateResolver.weekdayOf(wednesday, 5)).isEqualTo(LocalDate.of(2024, 5, 3));
    }
}
