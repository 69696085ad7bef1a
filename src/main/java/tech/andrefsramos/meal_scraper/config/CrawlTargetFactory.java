package tech.andrefsramos.meal_scraper.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tech.andrefsramos.meal_scraper.core.domain.CrawlTarget;
import tech.andrefsramos.meal_scraper.core.domain.MealSlot;
import tech.andrefsramos.meal_scraper.core.domain.MealSlotResolver;
import tech.andrefsramos.meal_scraper.core.domain.SheetSection;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/*
 * Purpose

 * Turns app.crawl.targets into CrawlTargets:
 *  - disabled targets and targets missing id, type or url are left out (WARN);
 *  - a repeated id keeps the first occurrence (WARN);
 *  - slot labels = built-in table + app.crawl.slot-labels + the target's own slot-labels (later wins);
 *  - sections with an unreadable row range are dropped (WARN).
 */
final class CrawlTargetFactory {

    private static final Logger log = LoggerFactory.getLogger(CrawlTargetFactory.class);

    private CrawlTargetFactory() {}

    static List<CrawlTarget> fromProperties(MealScraperProperties.Crawl crawl) {
        List<CrawlTarget> out = new ArrayList<>();
        if (crawl == null || crawl.getTargets() == null) return out;

        Set<String> ids = new HashSet<>();
        for (MealScraperProperties.Target t : crawl.getTargets()) {
            if (t == null) continue;
            if (!t.isEnabled()) {
                log.info("[AppConfig] crawl target '{}' disabled, skipped.", t.getId());
                continue;
            }
            if (isBlank(t.getId()) || isBlank(t.getType()) || isBlank(t.getUrl())) {
                log.warn("[AppConfig] crawl target without id/type/url ignored: {}", t);
                continue;
            }
            String id = t.getId().trim();
            if (!ids.add(id)) {
                log.warn("[AppConfig] duplicate crawl target id '{}', keeping the first one.", id);
                continue;
            }

            Map<String, MealSlot> labels = new LinkedHashMap<>(MealSlotResolver.DEFAULT_LABELS);
            addLabels(labels, crawl.getSlotLabels());
            addLabels(labels, t.getSlotLabels());

            List<SheetSection> sections = new ArrayList<>();
            for (MealScraperProperties.Section s : t.getSections()) {
                String provider = isBlank(s.getProviderId()) ? t.getProviderId() : s.getProviderId();
                if (s.getSlot() == null || isBlank(provider) || s.getFirstRow() < 0 || s.getLastRow() < s.getFirstRow()) {
                    log.warn("[AppConfig] target '{}': invalid section {}, skipped.", id, s);
                    continue;
                }
                sections.add(new SheetSection(provider.trim(), s.getSlot(), s.getFirstRow(), s.getLastRow()));
            }

            out.add(new CrawlTarget(
                    id,
                    t.getType().trim().toLowerCase(Locale.ROOT),
                    t.getUrl().trim(),
                    isBlank(t.getProviderId()) ? id : t.getProviderId().trim(),
                    t.getFileListUrl(),
                    t.getTableSelector(),
                    sections,
                    t.getDateRow(),
                    t.getDayColumns(),
                    labels,
                    t.getIgnoreItems(),
                    t.getExpectedContentTypes(),
                    t.getFetchTimeout()
            ));
        }
        return out;
    }

    private static void addLabels(Map<String, MealSlot> into, Map<MealSlot, List<String>> bySlot) {
        if (bySlot == null) return;
        bySlot.forEach((slot, labels) -> {
            if (slot == null || labels == null) return;
            for (String l : labels) {
                if (!isBlank(l)) into.put(l.trim(), slot);
            }
        });
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
