package com.intelhub.backend.ai.classification;

import java.time.LocalDate;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ClassificationRequest {
    private UUID uuid;
    private String text;
    // Relative dates in the text are resolved against this
    private LocalDate referenceDate;
    private String promptVersion;
}
