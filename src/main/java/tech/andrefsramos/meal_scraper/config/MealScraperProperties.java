package tech.andrefsramos.meal_scraper.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import tech.andrefsramos.meal_scraper.core.domain.MealSlot;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Structured part of the configuration: crawl targets and slot label tables.
 * Scalar knobs (delays, TTLs, page sizes) are read with {@code @Value} in {@link AppConfig}.
 */
@ConfigurationProperties(prefix = "app")
@Data
public class MealScraperProperties {

    private Crawl crawl = new Crawl();

    @Data
    public static class Crawl {
        /** Extra labels per slot, added to the built-in Korean/English table for every target. */
        private Map<MealSlot, List<String>> slotLabels = new EnumMap<>(MealSlot.class);
        private List<Target> targets = new ArrayList<>();
    }

    @Data
    public static class Target {
        private String id;
        private String type;
        private String url;
        private String providerId;
        private boolean enabled = true;

        /* html-table */
        private String tableSelector;

        /* ibook-excel */
        private String fileListUrl;
        private List<Section> sections = new ArrayList<>();
        private Integer dateRow;
        private int dayColumns = 5;

        private Map<MealSlot, List<String>> slotLabels = new EnumMap<>(MealSlot.class);
        private List<String> ignoreItems = new ArrayList<>();
        private List<String> expectedContentTypes = new ArrayList<>();
        private Duration fetchTimeout;
    }

    @Data
    public static class Section {
        private String providerId;
        private MealSlot slot;
        private int firstRow;
        private int lastRow;
    }
}
