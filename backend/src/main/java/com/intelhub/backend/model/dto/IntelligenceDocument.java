package com.intelhub.backend.model.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
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

/**
 * Outgoing (and import/export) form of an intelligence item, keyed the way the stored
 * collections have always been keyed.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class IntelligenceDocument {

    @JsonProperty("UUID")
    private UUID uuid;

    @JsonProperty("INFORMANT")
    private String informant;

    @JsonProperty("PUB_TIME")
    private LocalDateTime pubTime;

    @JsonProperty("EVENT_TITLE")
    private String eventTitle;

    @JsonProperty("EVENT_BRIEF")
    private String eventBrief;

    @JsonProperty("EVENT_TEXT")
    private String eventText;

    @Builder.Default
    @JsonProperty("LOCATION")
    private List<String> locations = new ArrayList<>();

    @Builder.Default
    @JsonProperty("PEOPLE")
    private List<String> people = new ArrayList<>();

    @Builder.Default
    @JsonProperty("ORGANIZATION")
    private List<String> organizations = new ArrayList<>();

    @Builder.Default
    @JsonProperty("TIME")
    private List<String> times = new ArrayList<>();

    @JsonProperty("GEOGRAPHY")
    private String geography;

    @JsonProperty("IMPACT")
    private String impact;

    @JsonProperty("TIPS")
    private String tips;

    @JsonProperty("REASON")
    private String reason;

    @JsonProperty("TAXONOMY")
    private String taxonomy;

    @Builder.Default
    @JsonProperty("SUB_CATEGORY")
    private List<String> subCategories = new ArrayList<>();

    @Builder.Default
    @JsonProperty("RATE")
    private Map<String, Double> rates = new LinkedHashMap<>();

    @JsonProperty("APPENDIX")
    private Appendix appendix;

    // Only on single-item reads and exports
    @JsonProperty("RAW_DATA")
    private RawData rawData;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Appendix {
        @JsonProperty("pub_time")
        private LocalDateTime pubTime;
        @JsonProperty("archived_time")
        private LocalDateTime archivedTime;
        @JsonProperty("max_rate_class")
        private String maxRateClass;
        @JsonProperty("max_rate_score")
        private Double maxRateScore;
        @JsonProperty("weighted_score")
        private Double weightedScore;
        @JsonProperty("ai_provider")
        private String aiProvider;
        @JsonProperty("ai_model")
        private String aiModel;
        @JsonProperty("prompt_version")
        private String promptVersion;
        @JsonProperty("threshold")
        private Double threshold;
        @JsonProperty("manual_rating")
        private Map<String, Double> manualRating;
        @JsonProperty("vector_score")
        private Double vectorScore;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class RawData {
        private String title;
        private String content;
    }
}
