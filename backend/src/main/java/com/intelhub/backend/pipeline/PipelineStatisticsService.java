package com.intelhub.backend.pipeline;

import com.intelhub.backend.db.entity.ItemState;
import com.intelhub.backend.db.entity.Partition;
import com.intelhub.backend.db.entity.VectorSpan;
import com.intelhub.backend.db.repository.EmbeddingVectorRepository;
import com.intelhub.backend.db.repository.IntelligenceItemRepository;
import com.intelhub.backend.vector.VectorIndex;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
public class PipelineStatisticsService {

    private final StagingService stagingService;
    private final IntelligenceItemRepository itemRepository;
    private final EmbeddingVectorRepository embeddingVectorRepository;
    private final ThresholdSettings thresholdSettings;
    private final VectorIndex vectorIndex;
    private final PipelineDispatcher dispatcher;

    @Transactional(readOnly = true)
    public Map<String, Object> getStats() {
        Map<ItemState, Long> byState = stagingService.countByState();

        Map<String, Long> byPartition = new LinkedHashMap<>();
        for (Partition partition : Partition.values()) {
            long count = partition.getStates().stream().mapToLong(state -> byState.getOrDefault(state, 0L)).sum();
            byPartition.put(partition.getCollectionName(), count);
        }

        Map<String, Long> vectors = new LinkedHashMap<>();
        for (VectorSpan span : VectorSpan.values()) {
            Long count = embeddingVectorRepository.countBySpan(span);
            vectors.put(span.name(), count != null ? count : 0L);
        }

        return Map.of(
                "states", byState,
                "collections", byPartition,
                "threshold", thresholdSettings.current(),
                "storedVectors", vectors,
                "indexedItems", vectorIndex.size(),
                "dispatcherRunning", dispatcher.isRunning(),
                "activeWorkers", dispatcher.getActiveWorkers(),
                "timestamp", LocalDateTime.now()
        );
    }

    /**
     * Number of items archived in [start, end] per integer max score (0-10).
     */
    @Transactional(readOnly = true)
    public Map<String, Object> getScoreDistribution(LocalDateTime start, LocalDateTime end) {
        Map<Integer, Long> distribution = new LinkedHashMap<>();
        for (int score = 0; score <= 10; score++) {
            distribution.put(score, 0L);
        }

        List<Double> scores = itemRepository.findArchivedMaxScoresBetween(start, end);
        for (Double score : scores) {
            if (score == null) {
                continue;
            }
            int bucket = (int) Math.max(0, Math.min(10, Math.floor(score)));
            distribution.merge(bucket, 1L, Long::sum);
        }

        return Map.of(
                "start", start,
                "end", end,
                "total", scores.size(),
                "distribution", distribution
        );
    }
}
