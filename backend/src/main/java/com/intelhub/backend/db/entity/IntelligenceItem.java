package com.intelhub.backend.db.entity;

import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Embedded;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.MapKeyColumn;
import jakarta.persistence.OrderColumn;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;
import org.hibernate.Length;
import org.hibernate.annotations.CreationTimestamp;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(name = "intelligence_items", indexes = {
        @Index(name = "idx_items_state", columnList = "state"),
        @Index(name = "idx_items_fingerprint", columnList = "fingerprint", unique = true),
        @Index(name = "idx_items_next_attempt", columnList = "nextAttemptAt"),
        @Index(name = "idx_items_pub_time", columnList = "pubTime")
})
public class IntelligenceItem {

    // Widths of the bounded label columns; AI output is checked against them before it is stored
    public static final int DIMENSION_LENGTH = 100;
    public static final int LABEL_LENGTH = 200;

    @Id
    private UUID uuid;

    @Column(nullable = false, length = 2000)
    private String informant;

    private LocalDateTime pubTime;

    @Column(length = Length.LONG32)
    private String title;

    @ToString.Exclude
    @Column(columnDefinition = "TEXT")
    private String rawContent;

    @Column(length = Length.LONG32)
    private String eventTitle;

    @Column(length = Length.LONG32)
    private String eventBrief;

    @ToString.Exclude
    @Column(columnDefinition = "TEXT")
    private String eventText;

    @Builder.Default
    @ElementCollection
    @CollectionTable(name = "item_locations", joinColumns = @JoinColumn(name = "item_uuid"))
    @OrderColumn(name = "list_index")
    @Column(name = "location", length = Length.LONG32)
    private List<String> locations = new ArrayList<>();

    @Builder.Default
    @ElementCollection
    @CollectionTable(name = "item_people", joinColumns = @JoinColumn(name = "item_uuid"))
    @OrderColumn(name = "list_index")
    @Column(name = "person", length = Length.LONG32)
    private List<String> people = new ArrayList<>();

    @Builder.Default
    @ElementCollection
    @CollectionTable(name = "item_organizations", joinColumns = @JoinColumn(name = "item_uuid"))
    @OrderColumn(name = "list_index")
    @Column(name = "organization", length = Length.LONG32)
    private List<String> organizations = new ArrayList<>();

    @Builder.Default
    @ElementCollection
    @CollectionTable(name = "item_event_times", joinColumns = @JoinColumn(name = "item_uuid"))
    @OrderColumn(name = "list_index")
    @Column(name = "event_time", length = Length.LONG32)
    private List<String> eventTimes = new ArrayList<>();

    @Builder.Default
    @ElementCollection
    @CollectionTable(name = "item_sub_categories", joinColumns = @JoinColumn(name = "item_uuid"))
    @OrderColumn(name = "list_index")
    @Column(name = "sub_category", length = Length.LONG32)
    private List<String> subCategories = new ArrayList<>();

    // AI-produced ratings; written once by the terminal transition
    @Builder.Default
    @ElementCollection
    @CollectionTable(name = "item_rates", joinColumns = @JoinColumn(name = "item_uuid"))
    @MapKeyColumn(name = "dimension", length = DIMENSION_LENGTH)
    @Column(name = "score", nullable = false)
    private Map<String, Double> rates = new LinkedHashMap<>();

    @Column(length = LABEL_LENGTH)
    private String geography;

    @Column(columnDefinition = "TEXT")
    private String impact;

    @Column(columnDefinition = "TEXT")
    private String tips;

    @Column(columnDefinition = "TEXT")
    private String reason;

    @Column(length = LABEL_LENGTH)
    private String taxonomy;

    @Column(nullable = false, length = 64)
    private String fingerprint;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private ItemState state;

    @Column(length = 200)
    private String leaseOwner;

    private LocalDateTime leaseExpiresAt;

    @Builder.Default
    @Column(nullable = false)
    private Integer attempts = 0;

    private LocalDateTime nextAttemptAt;

    @Column(columnDefinition = "TEXT")
    private String lastError;

    @CreationTimestamp
    private LocalDateTime collectedAt;

    @Builder.Default
    @Embedded
    private IntelligenceAppendix appendix = new IntelligenceAppendix();

    @Version
    private Long version;

    /**
     * Text used for classification: normalized raw content, prefixed by the title when present.
     */
    public String classificationText() {
        if (title == null || title.isBlank()) {
            return rawContent;
        }
        return title + "\n\n" + (rawContent != null ? rawContent : "");
    }
}
