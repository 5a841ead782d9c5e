package com.intelhub.backend.ai.classification;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.intelhub.backend.db.entity.IntelligenceItem;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Parses and validates raw model output. Never throws on bad input; every rejection is reported
 * as a parse error.
 */
@Slf4j
@Component
public class ClassificationResultParser {

    public static final String NON_INTELLIGENCE_TAXONOMY = "No Intelligence Value";

    private static final Set<String> NON_INTELLIGENCE_ALIASES = Set.of(
            "no intelligence value", "non-intelligence", "无情报价值");

    private static final List<String> REQUIRED_TEXT_FIELDS = List.of(
            "EVENT_TITLE", "EVENT_BRIEF", "EVENT_TEXT", "TAXONOMY");

    private final ObjectMapper objectMapper = new ObjectMapper();

    public ClassificationOutcome parse(String aiResponse) {
        if (aiResponse == null || aiResponse.isBlank()) {
            return ClassificationOutcome.parseError("Empty AI response");
        }

        String cleanedResponse = stripMarkdown(aiResponse);

        JsonNode root;
        try {
            root = objectMapper.readTree(cleanedResponse);
        } catch (JsonProcessingException e) {
            log.warn("⚠️ AI response is not valid JSON: {}", abbreviate(cleanedResponse));
            return ClassificationOutcome.parseError("Invalid JSON: " + e.getOriginalMessage());
        }
        if (root == null || !root.isObject()) {
            return ClassificationOutcome.parseError("AI response is not a JSON object");
        }

        String taxonomy = text(root, "TAXONOMY");
        if (taxonomy != null && NON_INTELLIGENCE_ALIASES.contains(taxonomy.trim().toLowerCase())) {
            return parseNonIntelligence(root);
        }

        for (String field : REQUIRED_TEXT_FIELDS) {
            if (isBlank(text(root, field))) {
                return ClassificationOutcome.parseError("Missing required field " + field);
            }
        }

        if (taxonomy.trim().length() > IntelligenceItem.LABEL_LENGTH) {
            return ClassificationOutcome.parseError("TAXONOMY longer than " + IntelligenceItem.LABEL_LENGTH + " characters");
        }
        String geography = text(root, "GEOGRAPHY");
        if (geography != null && geography.trim().length() > IntelligenceItem.LABEL_LENGTH) {
            return ClassificationOutcome.parseError("GEOGRAPHY longer than " + IntelligenceItem.LABEL_LENGTH + " characters");
        }

        JsonNode rateNode = root.get("RATE");
        if (rateNode == null || !rateNode.isObject() || rateNode.isEmpty()) {
            return ClassificationOutcome.parseError("RATE must be a non-empty object");
        }
        Map<String, Double> rates = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = rateNode.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            JsonNode value = entry.getValue();
            if (entry.getKey().isBlank() || !value.isNumber()) {
                return ClassificationOutcome.parseError("RATE." + entry.getKey() + " is not a number");
            }
            double score = value.asDouble();
            if (Double.isNaN(score) || score < 0 || score > 10) {
                return ClassificationOutcome.parseError("RATE." + entry.getKey() + " out of range: " + score);
            }
            if (entry.getKey().trim().length() > IntelligenceItem.DIMENSION_LENGTH) {
                return ClassificationOutcome.parseError("RATE dimension longer than "
                        + IntelligenceItem.DIMENSION_LENGTH + " characters");
            }
            rates.put(entry.getKey().trim(), score);
        }

        return ClassificationOutcome.valid(ClassificationResult.builder()
                .eventTitle(text(root, "EVENT_TITLE").trim())
                .eventBrief(text(root, "EVENT_BRIEF").trim())
                .eventText(text(root, "EVENT_TEXT").trim())
                .taxonomy(taxonomy.trim())
                .times(list(root, "TIME"))
                .locations(list(root, "LOCATION"))
                .people(list(root, "PEOPLE"))
                .organizations(list(root, "ORGANIZATION"))
                .subCategories(list(root, "SUB_CATEGORY"))
                .geography(geography != null ? geography.trim() : null)
                .impact(text(root, "IMPACT"))
                .reason(text(root, "REASON"))
                .tips(text(root, "TIPS"))
                .rates(rates)
                .nonIntelligence(false)
                .build());
    }

    private ClassificationOutcome parseNonIntelligence(JsonNode root) {
        String reason = text(root, "REASON");
        if (isBlank(reason)) {
            return ClassificationOutcome.parseError("Non-intelligence verdict without REASON");
        }
        return ClassificationOutcome.valid(ClassificationResult.builder()
                .taxonomy(NON_INTELLIGENCE_TAXONOMY)
                .reason(reason.trim())
                .nonIntelligence(true)
                .build());
    }

    private String stripMarkdown(String aiResponse) {
        String cleaned = aiResponse.trim();
        if (cleaned.contains("```json")) {
            cleaned = cleaned.substring(cleaned.indexOf("```json") + 7);
        } else if (cleaned.startsWith("```")) {
            cleaned = cleaned.substring(3);
        }
        if (cleaned.contains("```")) {
            cleaned = cleaned.substring(0, cleaned.lastIndexOf("```"));
        }
        return cleaned.trim();
    }

    private static String text(JsonNode root, String field) {
        JsonNode node = root.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        return node.isValueNode() ? node.asText() : node.toString();
    }

    // Accepts an array of strings or a single string
    private static List<String> list(JsonNode root, String field) {
        List<String> values = new ArrayList<>();
        JsonNode node = root.get(field);
        if (node == null || node.isNull()) {
            return values;
        }
        if (node.isArray()) {
            for (JsonNode element : node) {
                String value = element.asText();
                if (!isBlank(value)) {
                    values.add(value.trim());
                }
            }
        } else if (!isBlank(node.asText())) {
            values.add(node.asText().trim());
        }
        return values;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static String abbreviate(String text) {
        return text.substring(0, Math.min(200, text.length()));
    }
}
