package com.intelhub.backend.model.dto;

import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class BatchIngestionResult {
    private List<IngestionResult> results;
    private long queued;
    private long duplicates;
    private long rejected;

    public static BatchIngestionResult of(List<IngestionResult> results) {
        return new BatchIngestionResult(results,
                count(results, IngestionResult.Status.QUEUED),
                count(results, IngestionResult.Status.DUPLICATE),
                count(results, IngestionResult.Status.REJECTED));
    }

    private static long count(List<IngestionResult> results, IngestionResult.Status status) {
        return results.stream().filter(r -> r.getStatus() == status).count();
    }
}
