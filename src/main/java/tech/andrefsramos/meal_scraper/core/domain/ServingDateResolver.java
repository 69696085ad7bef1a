package tech.andrefsramos.meal_scraper.core.domain;

import java.time.DateTimeException;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.temporal.TemporalAdjusters;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/*
 * Purpose

 * Resolves the date text printed in menu headers to a calendar date.
 * Accepted shapes: "2024-05-01", "2024.05.01", "2024/5/1", "05.01(수)", "5/1", "5월 1일".
 * Texts without a year take the year that puts the date closest to the reference date
 * (a menu for 12/30 read on 01/02 belongs to the previous year).
 */
public final class ServingDateResolver {

    private static final Pattern FULL = Pattern.compile("(\\d{4})\\s*[-./년]\\s*(\\d{1,2})\\s*[-./월]\\s*(\\d{1,2})");
    private static final Pattern SHORT = Pattern.compile("(\\d{1,2})\\s*[-./월]\\s*(\\d{1,2})");

    private ServingDateResolver() {}

    public static Optional<LocalDate> resolve(String text, LocalDate reference) {
        if (text == null || text.isBlank()) return Optional.empty();
        String t = MenuNormalizer.cleanName(text);

        Matcher full = FULL.matcher(t);
        if (full.find()) {
            return of(Integer.parseInt(full.group(1)), Integer.parseInt(full.group(2)), Integer.parseInt(full.group(3)));
        }

        Matcher shortM = SHORT.matcher(t);
        if (shortM.find() && reference != null) {
            int month = Integer.parseInt(shortM.group(1));
            int day = Integer.parseInt(shortM.group(2));
            LocalDate best = null;
            for (int year = reference.getYear() - 1; year <= reference.getYear() + 1; year++) {
                Optional<LocalDate> candidate = of(year, month, day);
                if (candidate.isEmpty()) continue;
                LocalDate c = candidate.get();
                if (best == null || distance(c, reference) < distance(best, reference)) best = c;
            }
            return Optional.ofNullable(best);
        }
        return Optional.empty();
    }

    /** Date of the given 1-based weekday column (1 = Monday) in the week containing {@code reference}. */
    public static LocalDate weekdayOf(LocalDate reference, int isoDayOfWeek) {
        LocalDate monday = reference.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
        return monday.plusDays(isoDayOfWeek - 1L);
    }

    private static Optional<LocalDate> of(int y, int m, int d) {
        try {
            return Optional.of(LocalDate.of(y, m, d));
        } catch (DateTimeException e) {
            return Optional.empty();
        }
    }

    private static long distance(LocalDate a, LocalDate b) {
        return Math.abs(a.toEpochDay() - b.toEpochDay());
    }
}
