package tech.andrefsramos.meal_scraper.adapters.outbound.persistence.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;
import tech.andrefsramos.meal_scraper.core.domain.MealSlot;
import tech.andrefsramos.meal_scraper.core.domain.MenuSource;

import java.sql.Timestamp;
import java.time.LocalDate;

@Setter
@Getter
@ToString(exclude = "itemsJson")
@Entity
@Table(name = "menu_record",
        uniqueConstraints = @UniqueConstraint(name = "uk_menu_record_key",
                columnNames = {"provider_id", "serving_date", "meal_slot"}),
        indexes = {
                @Index(name = "ix_menu_record_date", columnList = "serving_date, provider_id"),
                @Index(name = "ix_menu_record_provider_updated", columnList = "provider_id, last_updated_at")
        })
public class MenuRecordEntity {
    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "provider_id", nullable = false, length = 100)
    private String providerId;

    @Column(name = "serving_date", nullable = false)
    private LocalDate servingDate;

    @Enumerated(EnumType.STRING)
    @Column(name = "meal_slot", nullable = false, length = 20)
    private MealSlot mealSlot;

    @Lob @Column(name = "items_json", nullable = false)
    private String itemsJson;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private MenuSource source;

    @Column(name = "content_hash", nullable = false, length = 64)
    private String contentHash;

    @Column(name = "last_updated_at", nullable = false)
    private Timestamp lastUpdatedAt;

    @Column(nullable = false)
    private Long version;
}
