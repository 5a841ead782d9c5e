package com.intelhub.backend.ai.classification;

import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Classification prompts keyed by schema version. The JSON schema is passed to the template as a
 * variable so the template itself contains no literal braces.
 */
@Component
public class PromptTemplates {

    private static final String OUTPUT_SCHEMA_V2 = """
            type AnalysisResult = ValuableIntelligence | NonIntelligence;

            interface ValuableIntelligence {
              TIME: string[];            // absolute dates YYYY-MM-DD where possible
              LOCATION: string[];
              GEOGRAPHY: string;         // ISO country code or organization acronym
              PEOPLE: string[];
              ORGANIZATION: string[];
              EVENT_TITLE: string;
              EVENT_BRIEF: string;
              EVENT_TEXT: string;
              TAXONOMY: "Politics & Security" | "Economy & Finance" | "Technology & Cyber" | "Social & Environment";
              SUB_CATEGORY: string[];    // at most 5
              IMPACT: string;
              REASON: string;
              TIPS: string;
              RATE: {
                impact_scope: number; impact_severity: number; novelty: number;
                evolution_potential: number; sentiment: number; actionability: number;
              };                         // integers 1-10
            }

            interface NonIntelligence {
              TAXONOMY: "No Intelligence Value";
              REASON: string;
            }
            """;

    private static final String CLASSIFY_V2 = """
            You are a professional intelligence analyst.
            Reference date: {referenceDate}

            1. Decide whether the input has intelligence value. Entertainment, advertising, lifestyle
               guides, personal writing and history without current relevance have none; answer with
               the NonIntelligence structure and stop.
            2. Otherwise choose one primary taxonomy and up to five sub-categories, and rate every
               dimension from 1 to 10. Prefer moderate scores unless the text gives clear evidence.
            3. Extract times, places, people and organizations from the body text only, and rewrite
               the event as a concise brief and a detailed text.

            Answer with JSON only, matching this TypeScript definition:
            {schema}

            Input:
            {content}
            """;

    private final Map<String, String> templates = Map.of("v2.2", CLASSIFY_V2);

    public String get(String version) {
        String template = templates.get(version);
        if (template == null) {
            throw new IllegalArgumentException("Unknown prompt version: " + version);
        }
        return template;
    }

    public String schema(String version) {
        get(version);
        return OUTPUT_SCHEMA_V2;
    }
}
