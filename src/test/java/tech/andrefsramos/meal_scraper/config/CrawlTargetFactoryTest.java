package tech.andrefsramos.meal_scraper.config;

import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.context.properties.source.MapConfigurationPropertySource;
import tech.andrefsramos.meal_scraper.core.domain.CrawlTarget;
import tech.andrefsramos.meal_scraper.core.domain.MealSlot;
import tech.andrefsramos.meal_scraper.core.domain.SheetSection;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class CrawlTargetFactoryTest {

    @Test
    void bindsAndBuildsTargetsFromProperties() {
        Map<String, String> props = new LinkedHashMap<>();
        props.put("app.crawl.slot-labels.lunch[0]", "한식");
        props.put("app.crawl.targets[0].id", "tukorea-ibook");
        props.put("app.crawl.targets[0].type", "IBOOK-EXCEL");
        props.put("app.crawl.targets[0].url", " https://ibook.example/viewer ");
        props.put("app.crawl.targets[0].provider-id", "tip");
        props.put("app.crawl.targets[0].date-row", "0");
        props.put("app.crawl.targets[0].fetch-timeout", "PT7S");
        props.put("app.crawl.targets[0].ignore-items[0]", "*복수메뉴*");
        props.put("app.crawl.targets[0].sections[0].slot", "LUNCH");
        props.put("app.crawl.targets[0].sections[0].first-row", "7");
        props.put("app.crawl.targets[0].sections[0].last-row", "12");
        props.put("app.crawl.targets[0].sections[1].provider-id", "e-dong");
        props.put("app.crawl.targets[0].sections[1].slot", "DINNER");
        props.put("app.crawl.targets[0].sections[1].first-row", "31");
        props.put("app.crawl.targets[0].sections[1].last-row", "37");
        props.put("app.crawl.targets[0].sections[2].slot", "DINNER");
        props.put("app.crawl.targets[0].sections[2].first-row", "9");
        props.put("app.crawl.targets[0].sections[2].last-row", "3");

        MealScraperProperties bound = new Binder(new MapConfigurationPropertySource(props))
                .bind("app", MealScraperProperties.class).get();
        List<CrawlTarget> targets = CrawlTargetFactory.fromProperties(bound.getCrawl());

        assertThat(targets).singleElement().satisfies(t -> {
            assertThat(t.id()).isEqualTo("tukorea-ibook");
            assertThat(t.type()).isEqualTo("ibook-excel");
            assertThat(t.url()).isEqualTo("https://ibook.example/viewer");
            assertThat(t.providerId()).isEqualTo("tip");
            assertThat(t.dateRow()).isZero();
            assertThat(t.dayColumns()).isEqualTo(5);
            assertThat(t.fetchTimeout()).isEqualTo(Duration.ofSeconds(7));
            assertThat(t.ignoreItems()).containsExactly("*복수메뉴*");
            assertThat(t.sections()).containsExactly(
                    new SheetSection("tip", MealSlot.LUNCH, 7, 12),
                    new SheetSection("e-dong", MealSlot.DINNER, 31, 37));
            assertThat(t.slotLabels()).containsEntry("한식", MealSlot.LUNCH).containsEntry("석식", MealSlot.DINNER);
        });
    }

    @Test
    void skipsDisabledIncompleteAndDuplicateTargets() {
        MealScraperProperties.Crawl crawl = new MealScraperProperties.Crawl();
        crawl.setTargets(List.of(
                target("a", "html-table", "http://a", true),
                target("b", "html-table", "http://b", false),
                target("c", null, "http://c", true),
                target("a", "json-feed", "http://a2", true),
                target("d", "json-feed", "http://d", true)));

        List<CrawlTarget> targets = CrawlTargetFactory.fromProperties(crawl);

        assertThat(targets).extracting(CrawlTarget::id).containsExactly("a", "d");
        assertThat(targets.get(0).type()).isEqualTo("html-table");
        assertThat(targets.get(1).providerId()).isEqualTo("d");
    }

    @Test
    void targetLabelsOverrideGlobalOnes() {
        MealScraperProperties.Crawl crawl = new MealScraperProperties.Crawl();
        crawl.getSlotLabels().put(MealSlot.LUNCH, List.of("특식"));
        MealScraperProperties.Target t = target("a", "html-table", "http://a", true);
        t.getSlotLabels().put(MealSlot.DINNER, List.of("특식"));
        crawl.setTargets(List.of(t));

        CrawlTarget built = CrawlTargetFactory.fromProperties(crawl).get(0);

        assertThat(built.slotLabels()).containsEntry("특식", MealSlot.DINNER);
    }

    @Test
    void noTargetsConfiguredGivesAnEmptyList() {
        assertThat(CrawlTargetFactory.fromProperties(new MealScraperProperties.Crawl())).isEmpty();
        assertThat(CrawlTargetFactory.fromProperties(null)).isEmpty();
    }

    private static MealScraperProperties.Target target(String id, String type, String url, boolean enabled) {
        MealScraperProperties.Target t = new MealScraperProperties.Target();
        t.setId(id);
        t.setType(type);
        t.setUrl(url);
        t.setEnabled(enabled);
        return t;
    }
}
