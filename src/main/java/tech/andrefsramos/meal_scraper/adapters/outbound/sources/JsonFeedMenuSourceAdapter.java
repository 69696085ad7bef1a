package tech.andrefsramos.meal_scraper.adapters.outbound.sources;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
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
import tech.andrefsramos.meal_scraper.core.domain.MenuNormalizer;
import tech.andrefsramos.meal_scraper.core.domain.ServingDateResolver;
import tech.andrefsramos.meal_scraper.core.domain.SourceContent;
import tech.andrefsramos.meal_scraper.core.domain.exception.MenuParseException;
import tech.andrefsramos.meal_scraper.core.ports.MenuSourcePort;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/*
 * Purpose

 * Menus published as a JSON document (type "json-feed"):
 *   {"providerId": "P1",
 *    "menus": [{"date": "2024-05-01", "slot": "LUNCH", "items": [{"name": "...", "price": 5000, "tags": ["V"]}, "plain dish"]}]}
 * Items may be objects or plain dish lines. A menu entry whose date cannot be read is skipped with a WARN;
 * a document without a "menus" array is a parse error.
 */
@Component
public class JsonFeedMenuSourceAdapter implements MenuSourcePort {

    private static final Logger log = LoggerFactory.getLogger(JsonFeedMenuSourceAdapter.class);

    public static final String TYPE = "json-feed";
    private static final List<String> DEFAULT_CONTENT_TYPES = List.of("application/json", "text/json", "text/plain");

    private final ObjectMapper mapper;
    private final Clock clock;
    private final Duration defaultTimeout;

    public JsonFeedMenuSourceAdapter(ObjectMapper mapper, Clock clock,
                                     @Value("${app.crawl.fetch-timeout:PT20S}") Duration defaultTimeout) {
        this.mapper = mapper;
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
        final String tid = target.id();
        final LocalDate reference = SourceDates.referenceDate(content, clock);
        final MealSlotResolver slots = new MealSlotResolver(target.slotLabels(), null, null);

        JsonNode root;
        try {
            root = mapper.readTree(content.body());
        } catch (IOException e) {
            throw new MenuParseException(tid, "document", "a JSON object", e);
        }

        JsonNode menus = root == null ? null : root.get("menus");
        if (menus == null || !menus.isArray()) {
            throw new MenuParseException(tid, "$.menus", "an array of menus");
        }

        String providerId = text(root.get("providerId"));
        if (providerId.isEmpty()) {
            providerId = (target.providerId() == null || target.providerId().isBlank()) ? tid : target.providerId().trim();
        }

        List<MenuDraft> drafts = new ArrayList<>();
        int index = 0;
        for (JsonNode menu : menus) {
            Optional<LocalDate> date = ServingDateResolver.resolve(text(menu.get("date")), reference);
            if (date.isEmpty()) {
                log.warn("[Source] target={} $.menus[{}] has no readable date ('{}'), skipped.", tid, index, text(menu.get("date")));
                index++;
                continue;
            }

            String slotText = text(menu.get("slot"));
            MealSlot slot = MealSlot.parse(slotText).orElseGet(() -> slots.resolve(slotText));

            List<MenuItem> items = new ArrayList<>();
            JsonNode itemsNode = menu.get("items");
            if (itemsNode != null && itemsNode.isArray()) {
                for (JsonNode i : itemsNode) {
                    if (i.isTextual()) {
                        items.add(MenuNormalizer.parseItemLine(i.asText()));
                    } else if (i.isObject()) {
                        items.add(item(i));
                    }
                }
            }

            MenuNormalizer.draft(providerId, date.get(), slot, items, target.ignoreItems()).ifPresent(drafts::add);
            index++;
        }

        log.info("[Source] target={} json-feed parsed: menus={} drafts={}", tid, menus.size(), drafts.size());
        return drafts;
    }

    private static MenuItem item(JsonNode node) {
        Integer price = null;
        JsonNode p = node.get("price");
        if (p != null && p.isNumber()) price = p.asInt();

        List<String> tags = new ArrayList<>();
        JsonNode t = node.get("tags");
        if (t != null && t.isArray()) {
            t.forEach(tag -> tags.add(tag.asText()));
        }
        return new MenuItem(text(node.get("name")), price, tags);
    }

    private static String text(JsonNode node) {
        return node == null || node.isNull() ? "" : node.asText("").trim();
    }
}
