package tech.andrefsramos.meal_scraper.adapters.outbound.persistence;

import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import jakarta.persistence.PersistenceException;
import jakarta.persistence.TypedQuery;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;
import tech.andrefsramos.meal_scraper.adapters.outbound.persistence.entity.MenuRecordEntity;
import tech.andrefsramos.meal_scraper.core.domain.MealSlot;
import tech.andrefsramos.meal_scraper.core.domain.MenuKey;
import tech.andrefsramos.meal_scraper.core.domain.MenuRecord;
import tech.andrefsramos.meal_scraper.core.domain.MenuSource;
import tech.andrefsramos.meal_scraper.core.domain.exception.StaleWriteException;
import tech.andrefsramos.meal_scraper.core.ports.MenuRecordRepository;

import java.sql.Timestamp;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/*
 * JpaMenuRecordRepositoryImpl

 * Purpose

 * JPA implementation of the menu record store (MySQL in production, H2 in tests).

 * Data model (summary)

 * - MenuRecordEntity (table `menu_record`): one current row per (provider_id, serving_date, meal_slot),
 *   guarded by the unique constraint uk_menu_record_key. Dishes live in items_json.
 * - version starts at 1 and is bumped by every accepted update.

 * Write rules

 * - insert(): fails with StaleWriteException when the key already exists (read first, unique constraint as backstop).
 * - compareAndSwap(): a single UPDATE ... WHERE version = :expected AND source = CRAWLED; zero rows
 *   means someone else won (or the key became vendor-owned) and is reported as StaleWriteException.
 */
@Repository
public class JpaMenuRecordRepositoryImpl implements MenuRecordRepository {

    private static final Logger log = LoggerFactory.getLogger(JpaMenuRecordRepositoryImpl.class);

    @PersistenceContext
    private EntityManager em;

    @Override
    public Optional<MenuRecord> findCurrent(MenuKey key) {
        long t0 = System.nanoTime();
        List<MenuRecordEntity> list = byKey(key).getResultList();
        long tookMs = (System.nanoTime() - t0) / 1_000_000;

        if (list.size() > 1) {
            log.warn("[JPA] findCurrent() returned {} rows for key={}. Check uk_menu_record_key.", list.size(), key);
        }
        log.debug("[JPA] findCurrent key={} found={} tookMs={}", key, !list.isEmpty(), tookMs);
        return list.isEmpty() ? Optional.empty() : Optional.of(toDomain(list.get(0)));
    }

    @Override
    @Transactional
    public MenuRecord insert(MenuRecord r) {
        long t0 = System.nanoTime();
        if (r == null) {
            throw new IllegalArgumentException("MenuRecord must not be null in insert()");
        }

        MenuKey key = r.key();
        if (!byKey(key).getResultList().isEmpty()) {
            throw new StaleWriteException(key, "already exists");
        }

        MenuRecordEntity e = new MenuRecordEntity();
        e.setProviderId(r.providerId());
        e.setServingDate(r.servingDate());
        e.setMealSlot(r.mealSlot());
        e.setItemsJson(MenuItemsJson.write(r.items()));
        e.setSource(r.source() != null ? r.source() : MenuSource.CRAWLED);
        e.setContentHash(r.contentHash());
        e.setLastUpdatedAt(Timestamp.from(r.lastUpdatedAt()));
        e.setVersion(r.version());

        try {
            em.persist(e);
            em.flush();
        } catch (PersistenceException ex) {
            log.warn("[JPA] insert() lost the race for key={}: {}", key, ex.getMessage());
            throw new StaleWriteException(key, "concurrent insert", ex);
        }

        long tookMs = (System.nanoTime() - t0) / 1_000_000;
        log.debug("[JPA] insert id={} key={} version={} tookMs={}", e.getId(), key, e.getVersion(), tookMs);
        return toDomain(e);
    }

    @Override
    @Transactional
    public MenuRecord compareAndSwap(MenuRecord updated, long expectedVersion) {
        long t0 = System.nanoTime();
        MenuKey key = updated.key();

        em.flush();
        int rows = em.createQuery("""
                  UPDATE MenuRecordEntity m
                     SET m.itemsJson = :items, m.contentHash = :hash, m.version = :next, m.lastUpdatedAt = :ts
                   WHERE m.providerId = :p AND m.servingDate = :d AND m.mealSlot = :s
                     AND m.version = :expected AND m.source = :crawled
                """)
                .setParameter("items", MenuItemsJson.write(updated.items()))
                .setParameter("hash", updated.contentHash())
                .setParameter("next", expectedVersion + 1)
                .setParameter("ts", Timestamp.from(updated.lastUpdatedAt()))
                .setParameter("p", key.providerId())
                .setParameter("d", key.servingDate())
                .setParameter("s", key.mealSlot())
                .setParameter("expected", expectedVersion)
                .setParameter("crawled", MenuSource.CRAWLED)
                .executeUpdate();
        em.clear();

        long tookMs = (System.nanoTime() - t0) / 1_000_000;
        if (rows == 0) {
            log.debug("[JPA] compareAndSwap miss key={} expectedVersion={} tookMs={}", key, expectedVersion, tookMs);
            throw new StaleWriteException(key, "expected version " + expectedVersion + " of a crawl-owned record");
        }
        log.debug("[JPA] compareAndSwap key={} version {} -> {} tookMs={}", key, expectedVersion, expectedVersion + 1, tookMs);

        return new MenuRecord(updated.id(), key.providerId(), key.servingDate(), key.mealSlot(), updated.items(),
                MenuSource.CRAWLED, updated.contentHash(), updated.lastUpdatedAt(), expectedVersion + 1);
    }

    @Override
    public List<MenuRecord> findByServingDate(LocalDate servingDate, String providerId) {
        long t0 = System.nanoTime();

        StringBuilder jpql = new StringBuilder("SELECT m FROM MenuRecordEntity m WHERE m.servingDate = :d ");
        if (providerId != null && !providerId.isBlank()) {
            jpql.append(" AND m.providerId = :p ");
        }
        jpql.append(" ORDER BY m.providerId ASC ");

        TypedQuery<MenuRecordEntity> q = em.createQuery(jpql.toString(), MenuRecordEntity.class);
        q.setParameter("d", servingDate);
        if (providerId != null && !providerId.isBlank()) q.setParameter("p", providerId);

        List<MenuRecord> out = q.getResultList().stream()
                .map(this::toDomain)
                .sorted(MenuRecord.READ_ORDER)
                .toList();

        long tookMs = (System.nanoTime() - t0) / 1_000_000;
        log.debug("[JPA] findByServingDate date={} provider='{}' rows={} tookMs={}", servingDate, providerId, out.size(), tookMs);
        return out;
    }

    @Override
    public Optional<MenuRecord> findLatestByProvider(String providerId, MealSlot mealSlot) {
        StringBuilder jpql = new StringBuilder("SELECT m FROM MenuRecordEntity m WHERE m.providerId = :p ");
        if (mealSlot != null) {
            jpql.append(" AND m.mealSlot = :s ");
        }
        jpql.append(" ORDER BY m.lastUpdatedAt DESC, m.servingDate DESC ");

        TypedQuery<MenuRecordEntity> q = em.createQuery(jpql.toString(), MenuRecordEntity.class);
        q.setParameter("p", providerId);
        if (mealSlot != null) q.setParameter("s", mealSlot);
        q.setMaxResults(1);

        List<MenuRecordEntity> rows = q.getResultList();
        log.debug("[JPA] findLatestByProvider provider='{}' slot={} found={}", providerId, mealSlot, !rows.isEmpty());
        return rows.stream().findFirst().map(this::toDomain);
    }

    private TypedQuery<MenuRecordEntity> byKey(MenuKey key) {
        TypedQuery<MenuRecordEntity> q = em.createQuery("""
                  SELECT m FROM MenuRecordEntity m
                  WHERE m.providerId = :p AND m.servingDate = :d AND m.mealSlot = :s
                """, MenuRecordEntity.class);
        q.setParameter("p", key.providerId());
        q.setParameter("d", key.servingDate());
        q.setParameter("s", key.mealSlot());
        return q;
    }

    private MenuRecord toDomain(MenuRecordEntity e) {
        return new MenuRecord(
                e.getId(),
                e.getProviderId(),
                e.getServingDate(),
                e.getMealSlot(),
                MenuItemsJson.read(e.getItemsJson()),
                e.getSource(),
                e.getContentHash(),
                e.getLastUpdatedAt() != null ? e.getLastUpdatedAt().toInstant() : null,
                e.getVersion() != null ? e.getVersion() : 0L
        );
    }
}
