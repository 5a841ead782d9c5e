package com.intelhub.backend.ai.classification;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;

import org.junit.jupiter.api.Test;

class ClassificationResultParserTest {

    private final ClassificationResultParser parser = new ClassificationResultParser();

    private static final String VALID = """
            {
              "EVENT_TITLE": "Port strike halts exports",
              "EVENT_BRIEF": "Dock workers strike at the main port.",
              "EVENT_TEXT": "A strike by dock workers halted container exports on Monday.",
              "TIME": ["2026-10-12"],
              "LOCATION": "Rotterdam",
              "PEOPLE": [],
              "ORGANIZATION": ["Port Authority", " "],
              "TAXONOMY": "Economy & Finance",
              "SUB_CATEGORY": ["Logistics"],
              "RATE": {"impact_severity": 7, "impact_scope": 6.5, "novelty": 3}
            }
            """;

    @Test
    void parse_shouldReturnResult_whenResponseIsFencedJson() {
        ClassificationOutcome outcome = parser.parse("Here you go:\n```json\n" + VALID + "\n```");

        assertThat(outcome.isValid()).isTrue();
        ClassificationResult result = outcome.getResult();
        assertThat(result.getEventTitle()).isEqualTo("Port strike halts exports");
        assertThat(result.getLocations()).containsExactly("Rotterdam");
        assertThat(result.getOrganizations()).containsExactly("Port Authority");
        assertThat(result.getRates()).containsExactly(
                entry("impact_severity", 7.0),
                entry("impact_scope", 6.5),
                entry("novelty", 3.0));
        assertThat(result.isNonIntelligence()).isFalse();
    }

    @Test
    void parse_shouldKeepLongNarrativeFields() {
        String brief = "b".repeat(2500);

        ClassificationOutcome outcome = parser.parse(VALID.replace("Dock workers strike at the main port.", brief));

        assertThat(outcome.isValid()).isTrue();
        assertThat(outcome.getResult().getEventBrief()).hasSize(2500);
    }

    @Test
    void parse_shouldReturnError_whenRateDimensionTooLong() {
        String dimension = "d".repeat(101);

        ClassificationOutcome outcome = parser.parse(VALID.replace("\"novelty\"", "\"" + dimension + "\""));

        assertThat(outcome.isValid()).isFalse();
        assertThat(outcome.getError()).contains("RATE dimension longer than 100");
    }

    @Test
    void parse_shouldReturnError_whenTaxonomyTooLong() {
        ClassificationOutcome outcome = parser.parse(VALID.replace("Economy & Finance", "x".repeat(201)));

        assertThat(outcome.isValid()).isFalse();
        assertThat(outcome.getError()).contains("TAXONOMY");
    }

    @Test
    void parse_shouldReturnError_whenJsonInvalid() {
        ClassificationOutcome outcome = parser.parse("{\"EVENT_TITLE\": ");

        assertThat(outcome.isValid()).isFalse();
        assertThat(outcome.getError()).startsWith("Invalid JSON");
    }

    @Test
    void parse_shouldReturnError_whenRequiredFieldMissing() {
        ClassificationOutcome outcome = parser.parse(VALID.replace("\"EVENT_BRIEF\"", "\"OTHER\""));

        assertThat(outcome.isValid()).isFalse();
        assertThat(outcome.getError()).contains("EVENT_BRIEF");
    }

    @Test
    void parse_shouldReturnError_whenRateOutOfRange() {
        ClassificationOutcome outcome = parser.parse(VALID.replace("\"novelty\": 3", "\"novelty\": 11"));

        assertThat(outcome.isValid()).isFalse();
        assertThat(outcome.getError()).contains("novelty");
    }

    @Test
    void parse_shouldReturnError_whenRateNotNumeric() {
        ClassificationOutcome outcome = parser.parse(VALID.replace("\"novelty\": 3", "\"novelty\": \"high\""));

        assertThat(outcome.isValid()).isFalse();
    }

    @Test
    void parse_shouldAcceptNonIntelligenceVerdict_whenReasonGiven() {
        ClassificationOutcome outcome = parser.parse(
                "{\"TAXONOMY\": \"no intelligence value\", \"REASON\": \"Advertisement\"}");

        assertThat(outcome.isValid()).isTrue();
        assertThat(outcome.getResult().isNonIntelligence()).isTrue();
        assertThat(outcome.getResult().getTaxonomy()).isEqualTo(ClassificationResultParser.NON_INTELLIGENCE_TAXONOMY);
        assertThat(outcome.getResult().getRates()).isEmpty();
    }

    @Test
    void parse_shouldReturnError_whenNonIntelligenceWithoutReason() {
        ClassificationOutcome outcome = parser.parse("{\"TAXONOMY\": \"No Intelligence Value\"}");

        assertThat(outcome.isValid()).isFalse();
    }

    @Test
    void parse_shouldReturnError_whenEmptyOrNotAnObject() {
        assertThat(parser.parse("  ").isValid()).isFalse();
        assertThat(parser.parse("[1, 2]").isValid()).isFalse();
    }
}
