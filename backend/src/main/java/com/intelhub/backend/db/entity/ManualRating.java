package com.intelhub.backend.db.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.time.LocalDateTime;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.UpdateTimestamp;

/**
 * Human override for one rating dimension of an archived item. Stored beside the AI ratings,
 * never in place of them.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(name = "manual_ratings",
        uniqueConstraints = @UniqueConstraint(name = "uk_manual_rating_item_dimension", columnNames = {"item_uuid", "dimension"}))
public class ManualRating {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "item_uuid", nullable = false)
    private UUID itemUuid;

    @Column(name = "dimension", nullable = false, length = IntelligenceItem.DIMENSION_LENGTH)
    private String dimension;

    @Column(name = "rating_value", nullable = false)
    private Double value;

    // Client-side timestamp of the submission
    private LocalDateTime ratedAt;

    @UpdateTimestamp
    private LocalDateTime submittedAt;
}
