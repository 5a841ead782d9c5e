package com.intelhub.backend.model.dto;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class IntelligenceQuery {

    public enum SearchMode {
        FILTER,
        VECTOR_TEXT,
        VECTOR_SIMILAR;

        @JsonCreator
        public static SearchMode from(String value) {
            if (value == null || value.isBlank()) {
                return FILTER;
            }
            String normalized = value.trim().toLowerCase(Locale.ROOT);
            return switch (normalized) {
                case "mongo", "filter" -> FILTER;
                case "vector_text" -> VECTOR_TEXT;
                case "vector_similar" -> VECTOR_SIMILAR;
                default -> throw new IllegalArgumentException("Unknown search_mode: " + value);
            };
        }
    }

    @Builder.Default
    @JsonProperty("search_mode")
    private SearchMode searchMode = SearchMode.FILTER;

    @Builder.Default
    private Integer page = 1;

    @Builder.Default
    @JsonProperty("per_page")
    private Integer perPage = 10;

    private String keywords;

    @JsonProperty("start_time")
    private LocalDateTime startTime;

    @JsonProperty("end_time")
    private LocalDateTime endTime;

    // Minimum max_rate_score
    private Double threshold;

    @Builder.Default
    private List<String> peoples = new ArrayList<>();

    @Builder.Default
    private List<String> locations = new ArrayList<>();

    @Builder.Default
    private List<String> organizations = new ArrayList<>();

    @Builder.Default
    @JsonProperty("in_summary")
    private Boolean inSummary = true;

    @Builder.Default
    @JsonProperty("in_fulltext")
    private Boolean inFulltext = false;

    @Builder.Default
    @JsonProperty("score_threshold")
    private Double scoreThreshold = 0.5;

    private UUID reference;
}
