package com.intelhub.backend.vector;

import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Optional metadata filters applied before ranking. Null fields do not filter.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SearchFilters {
    private LocalDateTime archivedFrom;
    private LocalDateTime archivedTo;
    private Double minRateScore;

    public static SearchFilters none() {
        return new SearchFilters();
    }

    boolean accepts(VectorIndex.Entry entry) {
        if (archivedFrom != null && (entry.getArchivedAt() == null || entry.getArchivedAt().isBefore(archivedFrom))) {
            return false;
        }
        if (archivedTo != null && (entry.getArchivedAt() == null || entry.getArchivedAt().isAfter(archivedTo))) {
            return false;
        }
        return minRateScore == null || (entry.getMaxRateScore() != null && entry.getMaxRateScore() >= minRateScore);
    }
}
