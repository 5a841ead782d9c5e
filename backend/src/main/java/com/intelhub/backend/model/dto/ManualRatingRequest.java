package com.intelhub.backend.model.dto;

import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ManualRatingRequest {

    @NotNull
    private UUID uuid;

    @NotEmpty
    @Builder.Default
    private Map<String, Double> ratings = new LinkedHashMap<>();

    // Client-side submission time; defaults to receipt time
    private LocalDateTime timestamp;
}
