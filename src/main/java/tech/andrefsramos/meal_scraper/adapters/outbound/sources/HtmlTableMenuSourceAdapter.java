package tech.andrefsramos.meal_scraper.adapters.outbound.sources;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.jsoup.select.Elements;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import tech.andrefsramos.meal_scraper.adapters.outbound.http.HttpFetch;
import tech.andrefsramos.meal_scraper.core.domain.CrawlTarget;
import tech.andrefsramos.meal_scraper.core.domain.MealSlot;
import tech.andrefsramos.meal_scraper.core.domain.MealSlotResolver;
import tech.andrefsramos.meal_scraper.core.domain.MenuDraft;
import tech.andrefsramos.meal_scraper.core.domain.MenuItem;
import tech.andrefsramos.meal_scraper.core.domain.MenuKey;
import tech.andrefsramos.meal_scraper.core.domain.MenuNormalizer;
import tech.andrefsramos.meal_scraper.core.domain.ServingDateResolver;
import tech.andrefsramos.meal_scraper.core.domain.SourceContent;
import tech.andrefsramos.meal_scraper.core.domain.exception.MenuParseException;
import tech.andrefsramos.meal_scraper.core.ports.MenuSourcePort;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/*
 * Purpose

 * Reads a weekly menu published as an HTML table (type "html-table"):
 *   header row  : one date per column ("05.01(수)", "2024-05-01", "5월 1일"); the first cell is a corner label
 *   other rows  : first cell is the slot label ("중식", "Lunch", "11:30~13:30"), then one cell per date
 *   each cell   : dishes separated by <br> (or by block elements), optional price and [tags] per line

 * How it works

 * - Bytes are decoded with the charset of the Content-Type header when it names a known one; otherwise
 *   jsoup detects it from the BOM or the page's <meta charset>, falling back to UTF-8.
 * - The table is located with target.tableSelector (default "table"); a page without it is a parse error.
 * - Header dates are resolved against the fetch date, so a year-less header lands in the nearest year.
 * - Two rows resolving to the same slot are merged into one draft per (date, slot).
 * - Blank cells produce no draft ("no menu that day"), never an error.
 */
@Component
public class HtmlTableMenuSourceAdapter implements MenuSourcePort {

    private static final Logger log = LoggerFactory.getLogger(HtmlTableMenuSourceAdapter.class);

    public static final String TYPE = "html-table";
    private static final String DEFAULT_SELECTOR = "table";
    private static final List<String> DEFAULT_CONTENT_TYPES = List.of("text/html", "application/xhtml");

    private final Clock clock;
    private final Duration defaultTimeout;

    public HtmlTableMenuSourceAdapter(Clock clock, @Value("${app.crawl.fetch-timeout:PT20S}") Duration defaultTimeout) {
        this.clock = clock;
        this.defaultTimeout = defaultTimeout;
    }

    @Override
    public boolean supports(CrawlTarget target) {
        return target != null && TYPE.equalsIgnoreCase(target.type());
    }

    @Override
    public SourceContent fetch(CrawlTarget target) {
        return HttpFetch.get(target, HttpFetch.timeoutOf(target, defaultTimeout), DEFAULT_CONTENT_TYPES, clock.instant());
    }

    @Override
    public List<MenuDraft> parse(SourceContent content, CrawlTarget target) {
        final long t0 = System.nanoTime();
        final String tid = target.id();
        final String providerId = providerOf(target);
        final LocalDate reference = SourceDates.referenceDate(content, clock);
        final MealSlotResolver slots = new MealSlotResolver(target.slotLabels(), null, null);

        Document doc;
        try {
            doc = Jsoup.parse(new ByteArrayInputStream(content.body()), supportedCharset(content),
                    content.url() == null ? "" : content.url());
        } catch (IOException e) {
            throw new MenuParseException(tid, "document", "an HTML page", e);
        }
        String selector = (target.tableSelector() == null || target.tableSelector().isBlank())
                ? DEFAULT_SELECTOR : target.tableSelector().trim();

        Element table = doc.selectFirst(selector);
        if (table == null) {
            throw new MenuParseException(tid, "selector '" + selector + "'", "a menu table");
        }

        Elements rows = table.select("tr");
        if (rows.size() < 2) {
            throw new MenuParseException(tid, "table rows", "a header row and at least one slot row");
        }

        Elements header = rows.get(0).select("th, td");
        Map<Integer, LocalDate> dateByColumn = new LinkedHashMap<>();
        for (int c = 1; c < header.size(); c++) {
            Optional<LocalDate> d = ServingDateResolver.resolve(header.get(c).text(), reference);
            if (d.isPresent()) {
                dateByColumn.put(c, d.get());
            } else if (log.isDebugEnabled()) {
                log.debug("[Source] target={} header column {} has no date: '{}'", tid, c, header.get(c).text());
            }
        }
        if (dateByColumn.isEmpty()) {
            throw new MenuParseException(tid, "header row", "serving dates in the header cells");
        }

        Map<MenuKey, List<MenuItem>> byKey = new LinkedHashMap<>();
        for (int r = 1; r < rows.size(); r++) {
            Elements cells = rows.get(r).select("th, td");
            if (cells.isEmpty()) continue;

            String label = cells.get(0).text();
            MealSlot slot = slots.resolve(label);

            for (Map.Entry<Integer, LocalDate> e : dateByColumn.entrySet()) {
                int c = e.getKey();
                if (c >= cells.size()) continue;
                List<MenuItem> items = new ArrayList<>();
                for (String line : lines(cells.get(c))) {
                    MenuItem item = MenuNormalizer.parseItemLine(line);
                    if (!item.name().isEmpty()) items.add(item);
                }
                if (items.isEmpty()) continue;
                byKey.computeIfAbsent(new MenuKey(providerId, e.getValue(), slot), k -> new ArrayList<>()).addAll(items);
            }
        }

        List<MenuDraft> drafts = new ArrayList<>(byKey.size());
        byKey.forEach((k, items) -> MenuNormalizer
                .draft(k.providerId(), k.servingDate(), k.mealSlot(), items, target.ignoreItems())
                .ifPresent(drafts::add));

        log.info("[Source] target={} html-table parsed: dates={} drafts={} tookMs={}ms",
                tid, dateByColumn.size(), drafts.size(), (System.nanoTime() - t0) / 1_000_000);
        return drafts;
    }

    static List<String> lines(Element cell) {
        StringBuilder sb = new StringBuilder();
        appendLines(cell, sb);
        List<String> out = new ArrayList<>();
        for (String l : sb.toString().split("\n")) {
            String s = MenuNormalizer.cleanName(l);
            if (!s.isEmpty()) out.add(s);
        }
        return out;
    }

    private static void appendLines(Element el, StringBuilder sb) {
        for (Node n : el.childNodes()) {
            if (n instanceof TextNode t) {
                sb.append(t.getWholeText().replace('\n', ' '));
            } else if (n instanceof Element child) {
                String tag = child.normalName();
                if ("br".equals(tag)) {
                    sb.append('\n');
                } else if ("p".equals(tag) || "div".equals(tag) || "li".equals(tag)) {
                    sb.append('\n');
                    appendLines(child, sb);
                    sb.append('\n');
                } else {
                    appendLines(child, sb);
                }
            }
        }
    }

    static String supportedCharset(SourceContent content) {
        String declared = content.declaredCharset();
        if (declared == null) return null;
        try {
            if (Charset.isSupported(declared)) return declared;
        } catch (IllegalCharsetNameException e) {
            log.debug("[Source] target={} illegal charset name '{}' in Content-Type", content.targetId(), declared);
            return null;
        }
        log.debug("[Source] target={} unsupported charset '{}', detecting from the document", content.targetId(), declared);
        return null;
    }

    private static String providerOf(CrawlTarget target) {
        return (target.providerId() == null || target.providerId().isBlank()) ? target.id() : target.providerId().trim();
    }
}
