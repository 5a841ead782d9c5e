package com.intelhub.backend.pipeline;

import com.intelhub.backend.config.ScoringProperties;
import java.util.Locale;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Weighted total score (0-100) shown next to the ratings. Routing never uses it.
 */
@Component
@RequiredArgsConstructor
public class IntelligenceScoringEngine {

    private final ScoringProperties scoringProperties;

    public double score(Map<String, Double> rates, String taxonomy) {
        if (rates == null || rates.isEmpty()) {
            return 0.0;
        }

        double rawScore = 0.0;
        for (Map.Entry<String, Double> weight : scoringProperties.getWeights().entrySet()) {
            rawScore += lookup(rates, weight.getKey()) * weight.getValue();
        }

        double multiplier = scoringProperties.getDefaultMultiplier();
        if (taxonomy != null) {
            Double configured = lookupKey(scoringProperties.getTaxonomyMultipliers(), taxonomy);
            if (configured != null) {
                multiplier = configured;
            }
        }

        double finalScore = Math.round(rawScore * multiplier * 10.0) / 10.0;
        return Math.min(100.0, Math.max(0.0, finalScore));
    }

    // Missing dimensions count as 0
    private static double lookup(Map<String, Double> rates, String dimension) {
        Double value = lookupKey(rates, dimension);
        return value != null ? value : 0.0;
    }

    private static Double lookupKey(Map<String, Double> values, String key) {
        String normalized = key.trim().toLowerCase(Locale.ROOT);
        for (Map.Entry<String, Double> entry : values.entrySet()) {
            if (entry.getKey().trim().toLowerCase(Locale.ROOT).equals(normalized)) {
                return entry.getValue();
            }
        }
        return null;
    }
}
