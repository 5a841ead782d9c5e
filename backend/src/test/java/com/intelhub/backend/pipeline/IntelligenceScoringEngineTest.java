package com.intelhub.backend.pipeline;

import static org.assertj.core.api.Assertions.assertThat;

import com.intelhub.backend.config.ScoringProperties;
import java.util.Map;
import org.junit.jupiter.api.Test;

class IntelligenceScoringEngineTest {

    private final IntelligenceScoringEngine engine = new IntelligenceScoringEngine(new ScoringProperties());

    @Test
    void score_shouldApplyWeightsAndTaxonomyMultiplier() {
        Map<String, Double> rates = Map.of(
                "Impact_Severity", 8.0,
                "impact_scope", 6.0,
                "evolution_potential", 4.0,
                "sentiment", 2.0,
                "novelty", 2.0);

        // 8*3.5 + 6*3.0 + 4*2.0 + 2*1.0 + 2*0.5 = 57.0
        assertThat(engine.score(rates, "Technology & Cyber")).isEqualTo(57.0);
        assertThat(engine.score(rates, "Politics & Security")).isEqualTo(68.4);
    }

    @Test
    void score_shouldBeZero_whenNoIntelligenceValue() {
        assertThat(engine.score(Map.of("impact_severity", 9.0), "No Intelligence Value")).isZero();
    }

    @Test
    void score_shouldClampToHundred() {
        Map<String, Double> rates = Map.of(
                "impact_severity", 10.0,
                "impact_scope", 10.0,
                "evolution_potential", 10.0,
                "sentiment", 10.0,
                "novelty", 10.0);

        assertThat(engine.score(rates, "politics & security")).isEqualTo(100.0);
    }

    @Test
    void score_shouldUseDefaultMultiplier_whenTaxonomyUnknown() {
        assertThat(engine.score(Map.of("sentiment", 5.0), "Sports")).isEqualTo(5.0);
        assertThat(engine.score(Map.of(), null)).isZero();
    }
}
