package tech.andrefsramos.meal_scraper.adapters.outbound.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import tech.andrefsramos.meal_scraper.core.domain.MenuItem;

import java.util.List;

/**
 * JSON column format of a record's dish list: [{"name":..,"price":..,"tags":[..]}].
 */
final class MenuItemsJson {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    private static final TypeReference<List<MenuItem>> ITEMS = new TypeReference<>() {};

    private MenuItemsJson() {}

    static String write(List<MenuItem> items) {
        try {
            return MAPPER.writeValueAsString(items == null ? List.of() : items);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("menu items could not be serialized", e);
        }
    }

    static List<MenuItem> read(String json) {
        if (json == null || json.isBlank()) return List.of();
        try {
            return MAPPER.readValue(json, ITEMS);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("stored menu items are not valid JSON", e);
        }
    }
}
