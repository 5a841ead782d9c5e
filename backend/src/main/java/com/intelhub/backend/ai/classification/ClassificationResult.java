package com.intelhub.backend.ai.classification;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Validated classifier output for one item. A non-intelligence verdict carries only the taxonomy,
 * the reason and an empty rating map.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ClassificationResult {

    private String eventTitle;
    private String eventBrief;
    private String eventText;

    @Builder.Default
    private List<String> times = new ArrayList<>();
    @Builder.Default
    private List<String> locations = new ArrayList<>();
    @Builder.Default
    private List<String> people = new ArrayList<>();
    @Builder.Default
    private List<String> organizations = new ArrayList<>();
    @Builder.Default
    private List<String> subCategories = new ArrayList<>();

    private String geography;
    private String taxonomy;
    private String impact;
    private String reason;
    private String tips;

    // Dimension name -> score in [0,10], in the order the model produced them
    @Builder.Default
    private Map<String, Double> rates = new LinkedHashMap<>();

    private boolean nonIntelligence;

    // Provenance
    private String provider;
    private String model;
    private String promptVersion;
}
