package com.intelhub.backend.db.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * System-managed metadata attached to every item.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Embeddable
public class IntelligenceAppendix {

    private LocalDateTime pubTimeCache;

    private LocalDateTime archivedAt;

    @Column(length = IntelligenceItem.DIMENSION_LENGTH)
    private String maxRateClass;

    private Double maxRateScore;

    // Weighted total (0-100), informational only
    private Double weightedScore;

    @Column(length = 100)
    private String aiProvider;

    @Column(length = 200)
    private String aiModel;

    @Column(length = 50)
    private String promptVersion;

    // Threshold snapshot used for the routing decision
    private Double thresholdAtClassification;
}
