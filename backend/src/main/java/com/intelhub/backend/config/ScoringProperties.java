package com.intelhub.backend.config;

import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Weights for the informational weighted score. Dimension and taxonomy keys are matched
 * case-insensitively.
 */
@Component
@ConfigurationProperties(prefix = "pipeline.scoring")
@Data
public class ScoringProperties {

    private Map<String, Double> weights = new LinkedHashMap<>(Map.of(
            "impact_severity", 3.5,
            "impact_scope", 3.0,
            "evolution_potential", 2.0,
            "sentiment", 1.0,
            "novelty", 0.5,
            "actionability", 0.0
    ));

    private Map<String, Double> taxonomyMultipliers = new LinkedHashMap<>(Map.of(
            "politics & security", 1.2,
            "economy & finance", 1.1,
            "technology & cyber", 1.0,
            "social & environment", 1.0,
            "no intelligence value", 0.0
    ));

    // Used for taxonomies not listed above
    private double defaultMultiplier = 1.0;
}
