package com.intelhub.backend.model.dto;

import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class IngestionResult {

    public enum Status {
        QUEUED,
        DUPLICATE,
        REJECTED
    }

    private UUID uuid;
    private Status status;
    private String sourceUrl;
    private String message;

    public static IngestionResult queued(UUID uuid, String sourceUrl) {
        return new IngestionResult(uuid, Status.QUEUED, sourceUrl, "Queued for classification");
    }

    public static IngestionResult duplicate(String sourceUrl) {
        return new IngestionResult(null, Status.DUPLICATE, sourceUrl, "Already collected");
    }

    public static IngestionResult rejected(String sourceUrl, String message) {
        return new IngestionResult(null, Status.REJECTED, sourceUrl, message);
    }
}
