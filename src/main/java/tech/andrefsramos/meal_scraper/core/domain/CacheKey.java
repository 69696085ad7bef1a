package tech.andrefsramos.meal_scraper.core.domain;

import java.time.LocalDate;
import java.util.Objects;

/**
 * Cache key: one provider (or every provider) on one serving date.
 */
public record CacheKey(String providerId, LocalDate servingDate) {

    public static final String ALL_PROVIDERS = "*";

    public CacheKey {
        Objects.requireNonNull(servingDate, "servingDate");
        providerId = (providerId == null || providerId.isBlank()) ? ALL_PROVIDERS : providerId;
    }

    public static CacheKey of(String providerId, LocalDate servingDate) {
        return new CacheKey(providerId, servingDate);
    }

    public static CacheKey allProviders(LocalDate servingDate) {
        return new CacheKey(ALL_PROVIDERS, servingDate);
    }

    public boolean coversAllProviders() {
        return ALL_PROVIDERS.equals(providerId);
    }

    /** Provider filter for the store, null for every provider. */
    public String providerFilter() {
        return coversAllProviders() ? null : providerId;
    }
}
