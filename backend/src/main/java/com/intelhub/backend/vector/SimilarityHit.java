package com.intelhub.backend.vector;

import java.time.LocalDateTime;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

@Getter
@ToString
@AllArgsConstructor
public class SimilarityHit {
    private final UUID uuid;
    private final double score;
    private final LocalDateTime archivedAt;
}
