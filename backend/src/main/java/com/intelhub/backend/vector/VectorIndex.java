package com.intelhub.backend.vector;

import com.intelhub.backend.db.entity.EmbeddingVector;
import com.intelhub.backend.db.entity.VectorSpan;
import com.intelhub.backend.db.repository.EmbeddingVectorRepository;
import com.intelhub.backend.db.repository.IntelligenceItemRepository;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * In-memory copy of the stored embeddings of archived items, scanned by cosine similarity.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class VectorIndex {

    static final Comparator<SimilarityHit> RANKING = Comparator
            .comparingDouble(SimilarityHit::getScore).reversed()
            .thenComparing(SimilarityHit::getArchivedAt, Comparator.nullsLast(Comparator.reverseOrder()));

    private final EmbeddingVectorRepository embeddingVectorRepository;
    private final IntelligenceItemRepository itemRepository;

    private final Map<UUID, Entry> entries = new ConcurrentHashMap<>();

    @Getter
    @AllArgsConstructor
    public static class Entry {
        private final UUID uuid;
        private final Map<VectorSpan, float[]> vectors;
        private final LocalDateTime archivedAt;
        private final Double maxRateScore;
    }

    /**
     * Replaces the index content with what is stored in the database.
     */
    @Transactional(readOnly = true)
    public int load() {
        Map<UUID, Double> scores = new HashMap<>();
        for (Object[] row : itemRepository.findArchivedScores()) {
            scores.put((UUID) row[0], (Double) row[1]);
        }

        Map<UUID, Entry> loaded = new HashMap<>();
        for (EmbeddingVector stored : embeddingVectorRepository.findAll()) {
            if (!scores.containsKey(stored.getItemUuid())) {
                continue;
            }
            Entry existing = loaded.get(stored.getItemUuid());
            Map<VectorSpan, float[]> vectors = existing != null
                    ? new EnumMap<>(existing.getVectors())
                    : new EnumMap<>(VectorSpan.class);
            vectors.put(stored.getSpan(), stored.getVector());
            loaded.put(stored.getItemUuid(), new Entry(stored.getItemUuid(), vectors, stored.getArchivedAt(),
                    scores.get(stored.getItemUuid())));
        }

        entries.clear();
        entries.putAll(loaded);
        log.info("📊 Vector index loaded: {} items", entries.size());
        return entries.size();
    }

    public void put(UUID uuid, VectorSpan span, float[] vector, LocalDateTime archivedAt, Double maxRateScore) {
        entries.compute(uuid, (key, existing) -> {
            Map<VectorSpan, float[]> vectors = existing != null
                    ? new EnumMap<>(existing.getVectors())
                    : new EnumMap<>(VectorSpan.class);
            vectors.put(span, vector);
            return new Entry(uuid, Collections.unmodifiableMap(vectors), archivedAt, maxRateScore);
        });
    }

    public Entry get(UUID uuid) {
        return entries.get(uuid);
    }

    public boolean contains(UUID uuid, VectorSpan span) {
        Entry entry = entries.get(uuid);
        return entry != null && entry.getVectors().containsKey(span);
    }

    public int size() {
        return entries.size();
    }

    /**
     * Scores every indexed item by its best cosine similarity to the query vectors over the given
     * spans. Items below the threshold or rejected by the filters are dropped.
     *
     * @return hits sorted by score descending, ties by most recent archive time
     */
    public List<SimilarityHit> search(Map<VectorSpan, float[]> queryVectors, Set<VectorSpan> spans,
                                      double scoreThreshold, SearchFilters filters, UUID exclude) {
        List<SimilarityHit> hits = new ArrayList<>();
        for (Entry entry : entries.values()) {
            if (entry.getUuid().equals(exclude) || (filters != null && !filters.accepts(entry))) {
                continue;
            }
            double best = Double.NEGATIVE_INFINITY;
            for (VectorSpan span : spans) {
                float[] query = queryVectors.get(span);
                float[] candidate = entry.getVectors().get(span);
                if (query != null && candidate != null && query.length == candidate.length) {
                    best = Math.max(best, cosineSimilarity(query, candidate));
                }
            }
            if (best >= scoreThreshold) {
                hits.add(new SimilarityHit(entry.getUuid(), best, entry.getArchivedAt()));
            }
        }
        hits.sort(RANKING);
        return hits;
    }

    static double cosineSimilarity(float[] vectorA, float[] vectorB) {
        if (vectorA.length != vectorB.length) {
            throw new IllegalArgumentException("Vectors must have the same dimensions");
        }

        double dotProduct = 0.0;
        double normA = 0.0;
        double normB = 0.0;

        for (int i = 0; i < vectorA.length; i++) {
            dotProduct += vectorA[i] * vectorB[i];
            normA += vectorA[i] * vectorA[i];
            normB += vectorB[i] * vectorB[i];
        }

        if (normA == 0.0 || normB == 0.0) {
            return 0.0;
        }

        return dotProduct / (Math.sqrt(normA) * Math.sqrt(normB));
    }
}
