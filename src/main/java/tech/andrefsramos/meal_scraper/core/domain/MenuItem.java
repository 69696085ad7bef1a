package tech.andrefsramos.meal_scraper.core.domain;

import java.util.List;

public record MenuItem(
        String name,
        Integer price,
        List<String> tags
) {
    public MenuItem {
        tags = tags == null ? List.of() : List.copyOf(tags);
    }

    public static MenuItem of(String name) {
        return new MenuItem(name, null, List.of());
    }
}
