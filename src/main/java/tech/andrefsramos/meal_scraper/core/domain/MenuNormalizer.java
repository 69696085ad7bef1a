package tech.andrefsramos.meal_scraper.core.domain;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/*
 * Purpose

 * Pure normalization shared by every parser:
 *  1) Dish names: trim, collapse whitespace (NBSP included); comparison uses the case-folded form.
 *  2) Dish lines: "김치찌개 5,000원 [V, GF]" -> name + optional price + tags.
 *  3) Items: blanks and placeholders removed, duplicates (same folded name) collapsed into the one that
 *     sorts first canonically, at the position of the first occurrence.
 *  4) contentHash: SHA-256 over provider|date|slot plus the items sorted canonically, so two
 *     documents that only differ in order or spacing hash the same.
 */
public final class MenuNormalizer {

    private static final Pattern WS = Pattern.compile("[\\s\\u00A0\\u3000]+");
    private static final Pattern TAGS = Pattern.compile("\\[([^\\]]*)]");
    private static final Pattern PRICE_WON = Pattern.compile("(\\d{1,3}(?:,\\d{3})+|\\d+)\\s*원");
    private static final Pattern PRICE_SIGN = Pattern.compile("[₩\\\\]\\s*(\\d{1,3}(?:,\\d{3})+|\\d+)");
    private static final Pattern PRICE_KRW = Pattern.compile("(\\d{1,3}(?:,\\d{3})+|\\d+)\\s*KRW", Pattern.CASE_INSENSITIVE);

    private static final Comparator<MenuItem> CANONICAL = Comparator
            .comparing((MenuItem i) -> fold(i.name()))
            .thenComparing(i -> i.price() == null ? -1 : i.price())
            .thenComparing(i -> String.join(",", i.tags()))
            .thenComparing(MenuItem::name);

    private MenuNormalizer() {}

    public static String cleanName(String raw) {
        if (raw == null) return "";
        return WS.matcher(raw).replaceAll(" ").trim();
    }

    public static String fold(String raw) {
        return cleanName(raw).toLowerCase(Locale.ROOT);
    }

    /**
     * Splits one dish line into name, price and dietary tags. Missing parts stay absent.
     */
    public static MenuItem parseItemLine(String line) {
        String rest = cleanName(line);
        if (rest.isEmpty()) return MenuItem.of("");

        Set<String> tags = new LinkedHashSet<>();
        Matcher tm = TAGS.matcher(rest);
        while (tm.find()) {
            for (String t : tm.group(1).split("[,/·]")) {
                String tag = cleanName(t).toUpperCase(Locale.ROOT);
                if (!tag.isEmpty()) tags.add(tag);
            }
        }
        rest = TAGS.matcher(rest).replaceAll(" ");

        Integer price = null;
        for (Pattern p : List.of(PRICE_WON, PRICE_SIGN, PRICE_KRW)) {
            Matcher pm = p.matcher(rest);
            if (pm.find()) {
                price = toPrice(pm.group(1));
                rest = rest.substring(0, pm.start()) + " " + rest.substring(pm.end());
                break;
            }
        }

        return new MenuItem(cleanName(rest), price, List.copyOf(tags));
    }

    public static List<MenuItem> normalizeItems(Collection<MenuItem> raw, Collection<String> ignoredNames) {
        if (raw == null || raw.isEmpty()) return List.of();
        Set<String> ignored = new LinkedHashSet<>();
        if (ignoredNames != null) {
            ignoredNames.forEach(n -> ignored.add(fold(n)));
        }

        Map<String, MenuItem> byFolded = new LinkedHashMap<>();
        for (MenuItem i : raw) {
            if (i == null) continue;
            String name = cleanName(i.name());
            String folded = name.toLowerCase(Locale.ROOT);
            if (name.isEmpty() || ignored.contains(folded)) continue;

            List<String> tags = i.tags().stream()
                    .map(t -> cleanName(t).toUpperCase(Locale.ROOT))
                    .filter(t -> !t.isEmpty())
                    .distinct()
                    .sorted()
                    .toList();
            Integer price = (i.price() != null && i.price() >= 0) ? i.price() : null;
            MenuItem item = new MenuItem(name, price, tags);
            byFolded.merge(folded, item, (kept, next) -> CANONICAL.compare(next, kept) < 0 ? next : kept);
        }
        return List.copyOf(byFolded.values());
    }

    public static String contentHash(String providerId, LocalDate servingDate, MealSlot slot, List<MenuItem> items) {
        StringBuilder sb = new StringBuilder()
                .append(providerId).append('|')
                .append(servingDate).append('|')
                .append(slot.name());

        List<MenuItem> sorted = new ArrayList<>(items);
        sorted.sort(CANONICAL);
        for (MenuItem i : sorted) {
            sb.append('\n')
                    .append(fold(i.name())).append('|')
                    .append(i.price() == null ? "" : i.price()).append('|')
                    .append(String.join(",", i.tags()));
        }
        return sha256(sb.toString());
    }

    /**
     * Builds a hashed draft. Empty when the date is unresolved or no dish survives cleanup;
     * callers log the reason and move on.
     */
    public static Optional<MenuDraft> draft(String providerId, LocalDate servingDate, MealSlot slot,
                                            Collection<MenuItem> rawItems, Collection<String> ignoredNames) {
        if (providerId == null || providerId.isBlank() || servingDate == null || slot == null) {
            return Optional.empty();
        }
        List<MenuItem> items = normalizeItems(rawItems, ignoredNames);
        if (items.isEmpty()) return Optional.empty();

        String pid = providerId.trim();
        return Optional.of(new MenuDraft(pid, servingDate, slot, items, contentHash(pid, servingDate, slot, items)));
    }

    private static Integer toPrice(String digits) {
        try {
            return Integer.parseInt(digits.replace(",", ""));
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static String sha256(String s) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(md.digest(s.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
