package com.intelhub.backend.query;

import com.intelhub.backend.db.entity.IntelligenceAppendix;
import com.intelhub.backend.db.entity.IntelligenceItem;
import com.intelhub.backend.db.entity.ItemState;
import com.intelhub.backend.model.dto.IntelligenceDocument;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.springframework.stereotype.Component;

/**
 * Converts between stored items and their document form. Must be called inside a transaction,
 * the list fields are loaded lazily.
 */
@Component
public class IntelligenceDocumentMapper {

    public IntelligenceDocument toDocument(IntelligenceItem item, boolean includeRawData,
                                           Map<String, Double> manualRatings, Double vectorScore) {
        IntelligenceAppendix appendix = item.getAppendix() != null ? item.getAppendix() : new IntelligenceAppendix();

        IntelligenceDocument.IntelligenceDocumentBuilder builder = IntelligenceDocument.builder()
                .uuid(item.getUuid())
                .informant(item.getInformant())
                .pubTime(item.getPubTime())
                .eventTitle(item.getEventTitle())
                .eventBrief(item.getEventBrief())
                .eventText(item.getEventText())
                .locations(new ArrayList<>(item.getLocations()))
                .people(new ArrayList<>(item.getPeople()))
                .organizations(new ArrayList<>(item.getOrganizations()))
                .times(new ArrayList<>(item.getEventTimes()))
                .geography(item.getGeography())
                .impact(item.getImpact())
                .tips(item.getTips())
                .reason(item.getReason())
                .taxonomy(item.getTaxonomy())
                .subCategories(new ArrayList<>(item.getSubCategories()))
                .rates(new LinkedHashMap<>(item.getRates()))
                .appendix(IntelligenceDocument.Appendix.builder()
                        .pubTime(appendix.getPubTimeCache() != null ? appendix.getPubTimeCache() : item.getPubTime())
                        .archivedTime(appendix.getArchivedAt())
                        .maxRateClass(appendix.getMaxRateClass())
                        .maxRateScore(appendix.getMaxRateScore())
                        .weightedScore(appendix.getWeightedScore())
                        .aiProvider(appendix.getAiProvider())
                        .aiModel(appendix.getAiModel())
                        .promptVersion(appendix.getPromptVersion())
                        .threshold(appendix.getThresholdAtClassification())
                        .manualRating(manualRatings != null && !manualRatings.isEmpty() ? manualRatings : null)
                        .vectorScore(vectorScore)
                        .build());

        if (includeRawData) {
            builder.rawData(new IntelligenceDocument.RawData(item.getTitle(), item.getRawContent()));
        }
        return builder.build();
    }

    /**
     * Builds a new item from an imported document. Lease and retry bookkeeping start fresh.
     */
    public IntelligenceItem toItem(IntelligenceDocument document, ItemState state, String fingerprint) {
        IntelligenceDocument.Appendix appendix = document.getAppendix() != null
                ? document.getAppendix()
                : new IntelligenceDocument.Appendix();
        IntelligenceDocument.RawData rawData = document.getRawData();

        return IntelligenceItem.builder()
                .uuid(document.getUuid() != null ? document.getUuid() : UUID.randomUUID())
                .informant(document.getInformant())
                .pubTime(document.getPubTime())
                .title(rawData != null ? rawData.getTitle() : null)
                .rawContent(rawData != null ? rawData.getContent() : null)
                .eventTitle(document.getEventTitle())
                .eventBrief(document.getEventBrief())
                .eventText(document.getEventText())
                .locations(copy(document.getLocations()))
                .people(copy(document.getPeople()))
                .organizations(copy(document.getOrganizations()))
                .eventTimes(copy(document.getTimes()))
                .subCategories(copy(document.getSubCategories()))
                .rates(document.getRates() != null ? new LinkedHashMap<>(document.getRates()) : new LinkedHashMap<>())
                .geography(document.getGeography())
                .impact(document.getImpact())
                .tips(document.getTips())
                .reason(document.getReason())
                .taxonomy(document.getTaxonomy())
                .fingerprint(fingerprint)
                .state(state)
                .attempts(0)
                .appendix(IntelligenceAppendix.builder()
                        .pubTimeCache(appendix.getPubTime() != null ? appendix.getPubTime() : document.getPubTime())
                        .archivedAt(appendix.getArchivedTime())
                        .maxRateClass(appendix.getMaxRateClass())
                        .maxRateScore(appendix.getMaxRateScore())
                        .weightedScore(appendix.getWeightedScore())
                        .aiProvider(appendix.getAiProvider())
                        .aiModel(appendix.getAiModel())
                        .promptVersion(appendix.getPromptVersion())
                        .thresholdAtClassification(appendix.getThreshold())
                        .build())
                .build();
    }

    private static List<String> copy(List<String> values) {
        return values != null ? new ArrayList<>(values) : new ArrayList<>();
    }
}
