package tech.andrefsramos.meal_scraper.core.domain;

import java.time.LocalTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/*
 * Purpose

 * Maps the slot label printed by a source ("중식", "Lunch", "11:30~13:30") to a {@link MealSlot}.
 * Rules, in order:
 *  1) exact match against the configured label table (case-folded);
 *  2) the longest configured label contained in the text;
 *  3) the first HH:mm found, placed by the time-of-day boundaries;
 *  4) OTHER.
 */
public final class MealSlotResolver {

    public static final Map<String, MealSlot> DEFAULT_LABELS = defaultLabels();

    private static final Pattern TIME = Pattern.compile("(\\d{1,2})\\s*[:시]\\s*(\\d{2})?");

    private final Map<String, MealSlot> labels;
    private final List<String> labelsLongestFirst;
    private final LocalTime lunchFrom;
    private final LocalTime dinnerFrom;

    public MealSlotResolver(Map<String, MealSlot> labels, LocalTime lunchFrom, LocalTime dinnerFrom) {
        Map<String, MealSlot> folded = new LinkedHashMap<>();
        Map<String, MealSlot> src = (labels == null || labels.isEmpty()) ? DEFAULT_LABELS : labels;
        src.forEach((k, v) -> {
            String f = MenuNormalizer.fold(k);
            if (!f.isEmpty() && v != null) folded.put(f, v);
        });
        this.labels = Map.copyOf(folded);
        List<String> keys = new ArrayList<>(folded.keySet());
        keys.sort(Comparator.comparingInt(String::length).reversed());
        this.labelsLongestFirst = List.copyOf(keys);
        this.lunchFrom = lunchFrom != null ? lunchFrom : LocalTime.of(10, 30);
        this.dinnerFrom = dinnerFrom != null ? dinnerFrom : LocalTime.of(16, 0);
    }

    public static MealSlotResolver defaults() {
        return new MealSlotResolver(DEFAULT_LABELS, null, null);
    }

    public MealSlot resolve(String label) {
        String f = MenuNormalizer.fold(label);
        if (f.isEmpty()) return MealSlot.OTHER;

        MealSlot exact = labels.get(f);
        if (exact != null) return exact;

        for (String l : labelsLongestFirst) {
            if (f.contains(l)) return labels.get(l);
        }

        return byTime(f).orElse(MealSlot.OTHER);
    }

    private Optional<MealSlot> byTime(String text) {
        Matcher m = TIME.matcher(text);
        if (!m.find()) return Optional.empty();
        int h = Integer.parseInt(m.group(1));
        int min = m.group(2) == null ? 0 : Integer.parseInt(m.group(2));
        if (h > 23 || min > 59) return Optional.empty();

        LocalTime t = LocalTime.of(h, min);
        if (t.isBefore(lunchFrom)) return Optional.of(MealSlot.BREAKFAST);
        if (t.isBefore(dinnerFrom)) return Optional.of(MealSlot.LUNCH);
        return Optional.of(MealSlot.DINNER);
    }

    private static Map<String, MealSlot> defaultLabels() {
        Map<String, MealSlot> m = new LinkedHashMap<>();
        m.put("조식", MealSlot.BREAKFAST);
        m.put("아침", MealSlot.BREAKFAST);
        m.put("breakfast", MealSlot.BREAKFAST);
        m.put("중식", MealSlot.LUNCH);
        m.put("점심", MealSlot.LUNCH);
        m.put("lunch", MealSlot.LUNCH);
        m.put("석식", MealSlot.DINNER);
        m.put("저녁", MealSlot.DINNER);
        m.put("dinner", MealSlot.DINNER);
        return Map.copyOf(m);
    }
}
