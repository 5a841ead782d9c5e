package com.intelhub.backend.vector;

import com.intelhub.backend.db.entity.VectorSpan;
import com.intelhub.backend.db.repository.IntelligenceItemRepository;
import com.intelhub.backend.exception.ItemNotFoundException;
import com.intelhub.backend.exception.ValidationException;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Similarity search over archived items, either from free text or from an archived reference item.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SimilaritySearchService {

    private final VectorIndex vectorIndex;
    private final EmbeddingIndexer embeddingIndexer;
    private final IntelligenceItemRepository itemRepository;

    public List<SimilarityHit> searchByText(String text, Set<VectorSpan> spans, double scoreThreshold,
                                            int limit, SearchFilters filters) {
        if (text == null || text.isBlank()) {
            throw new ValidationException("keywords", text, "Search text is required");
        }
        validate(spans, scoreThreshold);

        float[] queryVector = embeddingIndexer.embed(text, null);
        Map<VectorSpan, float[]> queryVectors = new EnumMap<>(VectorSpan.class);
        for (VectorSpan span : spans) {
            queryVectors.put(span, queryVector);
        }

        List<SimilarityHit> hits = limit(vectorIndex.search(queryVectors, spans, scoreThreshold, filters, null), limit);
        log.debug("Text search over {} returned {} hits (threshold {})", spans, hits.size(), scoreThreshold);
        return hits;
    }

    /**
     * Finds items similar to an indexed reference item. The reference itself is never returned.
     *
     * @throws ItemNotFoundException when the reference is unknown or has no vector for the spans
     */
    public List<SimilarityHit> searchByReference(UUID reference, Set<VectorSpan> spans, double scoreThreshold,
                                                 int limit, SearchFilters filters) {
        if (reference == null) {
            throw new ValidationException("reference", null, "Reference uuid is required");
        }
        validate(spans, scoreThreshold);

        VectorIndex.Entry entry = vectorIndex.get(reference);
        if (entry == null || spans.stream().noneMatch(entry.getVectors()::containsKey)) {
            if (!itemRepository.existsById(reference)) {
                throw new ItemNotFoundException(reference);
            }
            throw new ItemNotFoundException(reference, "Reference item " + reference + " has no indexed vector for " + spans);
        }

        List<SimilarityHit> hits = limit(
                vectorIndex.search(entry.getVectors(), spans, scoreThreshold, filters, reference), limit);
        log.debug("Reference search for {} returned {} hits (threshold {})", reference, hits.size(), scoreThreshold);
        return hits;
    }

    private void validate(Set<VectorSpan> spans, double scoreThreshold) {
        if (spans == null || spans.isEmpty()) {
            throw new ValidationException("in_summary", false, "At least one of in_summary / in_fulltext must be set");
        }
        if (Double.isNaN(scoreThreshold) || scoreThreshold < -1 || scoreThreshold > 1) {
            throw new ValidationException("score_threshold", scoreThreshold, "Score threshold must be within [-1, 1]");
        }
    }

    private static List<SimilarityHit> limit(List<SimilarityHit> hits, int limit) {
        return limit > 0 && hits.size() > limit ? hits.subList(0, limit) : hits;
    }
}
