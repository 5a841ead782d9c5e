package com.intelhub.backend.vector;

import com.intelhub.backend.ai.entity.AiUsageLog;
import com.intelhub.backend.ai.service.AiUsageMonitoringService;
import com.intelhub.backend.config.AiProviderProperties;
import com.intelhub.backend.config.EmbeddingProperties;
import com.intelhub.backend.db.entity.EmbeddingVector;
import com.intelhub.backend.db.entity.IntelligenceItem;
import com.intelhub.backend.db.entity.ItemState;
import com.intelhub.backend.db.entity.VectorSpan;
import com.intelhub.backend.db.repository.EmbeddingVectorRepository;
import com.intelhub.backend.db.repository.IntelligenceItemRepository;
import com.intelhub.backend.exception.AiProviderException;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Service;

/**
 * Embeds archived items and keeps the stored vectors and the in-memory index in step.
 * An embedding failure leaves the item archived but unindexed until the next rebuild.
 */
@Slf4j
@Service
public class EmbeddingIndexer {

    private final EmbeddingModel embeddingModel;
    private final EmbeddingVectorRepository embeddingVectorRepository;
    private final IntelligenceItemRepository itemRepository;
    private final VectorIndex vectorIndex;
    private final EmbeddingProperties embeddingProperties;
    private final AiProviderProperties aiProviderProperties;
    private final AiUsageMonitoringService usageMonitoringService;
    private final ThreadPoolTaskExecutor embeddingTaskExecutor;

    public EmbeddingIndexer(EmbeddingModel embeddingModel,
                            EmbeddingVectorRepository embeddingVectorRepository,
                            IntelligenceItemRepository itemRepository,
                            VectorIndex vectorIndex,
                            EmbeddingProperties embeddingProperties,
                            AiProviderProperties aiProviderProperties,
                            AiUsageMonitoringService usageMonitoringService,
                            @Qualifier("embeddingTaskExecutor") ThreadPoolTaskExecutor embeddingTaskExecutor) {
        this.embeddingModel = embeddingModel;
        this.embeddingVectorRepository = embeddingVectorRepository;
        this.itemRepository = itemRepository;
        this.vectorIndex = vectorIndex;
        this.embeddingProperties = embeddingProperties;
        this.aiProviderProperties = aiProviderProperties;
        this.usageMonitoringService = usageMonitoringService;
        this.embeddingTaskExecutor = embeddingTaskExecutor;
    }

    public Set<VectorSpan> enabledSpans() {
        Set<VectorSpan> spans = EnumSet.noneOf(VectorSpan.class);
        if (embeddingProperties.isInSummary()) {
            spans.add(VectorSpan.SUMMARY);
        }
        if (embeddingProperties.isInFulltext()) {
            spans.add(VectorSpan.FULLTEXT);
        }
        return spans;
    }

    /**
     * Queues indexing of a freshly archived item on the embedding pool.
     */
    public void indexAsync(UUID uuid) {
        try {
            embeddingTaskExecutor.execute(() -> {
                try {
                    index(uuid);
                } catch (RuntimeException e) {
                    log.error("❌ Indexing of item {} failed: {}", uuid, e.getMessage(), e);
                }
            });
        } catch (TaskRejectedException e) {
            log.warn("⚠️ Embedding queue full, item {} left for the next rebuild", uuid);
        }
    }

    /**
     * Embeds every enabled span of an archived item.
     *
     * @return number of spans indexed
     */
    public int index(UUID uuid) {
        return index(uuid, enabledSpans());
    }

    private int index(UUID uuid, Set<VectorSpan> spans) {
        IntelligenceItem item = itemRepository.findById(uuid).orElse(null);
        if (item == null || item.getState() != ItemState.ARCHIVED) {
            log.debug("Skipping indexing of {}: not an archived item", uuid);
            return 0;
        }

        int indexed = 0;
        for (VectorSpan span : spans) {
            String text = spanText(item, span);
            if (text == null || text.isBlank()) {
                log.debug("Item {} has no {} text to embed", uuid, span);
                continue;
            }
            try {
                float[] vector = embed(text, uuid);
                store(item, span, vector);
                indexed++;
            } catch (AiProviderException e) {
                log.warn("⚠️ Embedding of item {} ({}) failed: {}", uuid, span, e.getMessage());
            }
        }
        if (indexed > 0) {
            log.info("🧭 Indexed item {} ({} spans)", uuid, indexed);
        }
        return indexed;
    }

    /**
     * Re-embeds archived items that are missing a vector for any enabled span.
     */
    public Map<String, Object> rebuildIndex() {
        Set<VectorSpan> spans = enabledSpans();
        List<UUID> archived = itemRepository.findArchivedUuids();
        int itemsIndexed = 0;
        int spansIndexed = 0;
        int failed = 0;

        log.info("🔄 Rebuilding vector index over {} archived items", archived.size());
        for (UUID uuid : archived) {
            Set<VectorSpan> missing = spans.stream()
                    .filter(span -> !embeddingVectorRepository.existsByItemUuidAndSpan(uuid, span))
                    .collect(Collectors.toCollection(() -> EnumSet.noneOf(VectorSpan.class)));
            if (missing.isEmpty()) {
                continue;
            }
            int indexed = index(uuid, missing);
            spansIndexed += indexed;
            if (indexed == missing.size()) {
                itemsIndexed++;
            } else {
                failed++;
            }
        }
        int loaded = vectorIndex.load();

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("archivedItems", archived.size());
        result.put("itemsIndexed", itemsIndexed);
        result.put("spansIndexed", spansIndexed);
        result.put("itemsFailed", failed);
        result.put("indexSize", loaded);
        log.info("✅ Vector index rebuild finished: {}", result);
        return result;
    }

    /**
     * Embeds free text with the configured model.
     *
     * @throws AiProviderException when the provider fails
     */
    public float[] embed(String text, UUID itemUuid) {
        String input = truncate(text);
        int tokenCount = AiUsageMonitoringService.estimateTokenCount(input);
        try {
            float[] vector = embeddingModel.embed(input);
            if (vector == null || vector.length == 0) {
                throw new AiProviderException(aiProviderProperties.getProvider(), "Empty embedding returned");
            }
            usageMonitoringService.record(AiUsageLog.Operation.EMBED, aiProviderProperties.getEmbeddingModel(),
                    itemUuid, tokenCount, true, null);
            return vector;
        } catch (AiProviderException e) {
            usageMonitoringService.record(AiUsageLog.Operation.EMBED, aiProviderProperties.getEmbeddingModel(),
                    itemUuid, tokenCount, false, e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            usageMonitoringService.record(AiUsageLog.Operation.EMBED, aiProviderProperties.getEmbeddingModel(),
                    itemUuid, tokenCount, false, e.getMessage());
            throw new AiProviderException(aiProviderProperties.getProvider(), "Embedding failed: " + e.getMessage(), e);
        }
    }

    /**
     * Summary span: title, brief and event text joined by blank lines. Full-text span: the
     * translated text, falling back to the raw content.
     */
    public static String spanText(IntelligenceItem item, VectorSpan span) {
        return switch (span) {
            case SUMMARY -> Stream.of(item.getEventTitle(), item.getEventBrief(), item.getEventText())
                    .filter(part -> part != null && !part.isBlank())
                    .collect(Collectors.joining("\n\n"));
            case FULLTEXT -> item.getEventText() != null && !item.getEventText().isBlank()
                    ? item.getEventText()
                    : item.getRawContent();
        };
    }

    private void store(IntelligenceItem item, VectorSpan span, float[] vector) {
        EmbeddingVector stored = embeddingVectorRepository.findByItemUuidAndSpan(item.getUuid(), span)
                .orElseGet(() -> EmbeddingVector.builder().itemUuid(item.getUuid()).span(span).build());
        stored.setVector(vector);
        stored.setDimensions(vector.length);
        stored.setModelName(aiProviderProperties.getEmbeddingModel());
        stored.setArchivedAt(item.getAppendix() != null ? item.getAppendix().getArchivedAt() : null);
        embeddingVectorRepository.save(stored);

        vectorIndex.put(item.getUuid(), span, vector, stored.getArchivedAt(),
                item.getAppendix() != null ? item.getAppendix().getMaxRateScore() : null);
    }

    private String truncate(String text) {
        int max = embeddingProperties.getMaxTextLength();
        return max > 0 && text.length() > max ? text.substring(0, max) : text;
    }
}
