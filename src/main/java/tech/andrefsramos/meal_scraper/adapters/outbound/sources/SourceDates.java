package tech.andrefsramos.meal_scraper.adapters.outbound.sources;

import tech.andrefsramos.meal_scraper.core.domain.SourceContent;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;

final class SourceDates {

    private SourceDates() {}

    /** Calendar date of the fetch in the configured zone; year-less and weekday-only dates resolve against it. */
    static LocalDate referenceDate(SourceContent content, Clock clock) {
        Instant at = content.fetchedAt() != null ? content.fetchedAt() : clock.instant();
        return LocalDate.ofInstant(at, clock.getZone());
    }
}
