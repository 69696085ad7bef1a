package tech.andrefsramos.meal_scraper.core.ports;

import tech.andrefsramos.meal_scraper.core.domain.CacheKey;
import tech.andrefsramos.meal_scraper.core.domain.CacheLookup;
import tech.andrefsramos.meal_scraper.core.domain.MenuKey;
import tech.andrefsramos.meal_scraper.core.domain.MenuSnapshot;

import java.time.Duration;
import java.util.Collection;

public interface MenuCachePort {
    CacheLookup get(CacheKey key);
    void put(CacheKey key, MenuSnapshot snapshot, Duration ttl);
    void put(CacheKey key, MenuSnapshot snapshot);
    void invalidate(CacheKey key);
    /** Drops the provider entry and the all-providers entry of each key's serving date. */
    void invalidateMenus(Collection<MenuKey> keys);
}
