package com.intelhub.backend.query;

import com.intelhub.backend.db.entity.IntelligenceItem;
import com.intelhub.backend.db.entity.ItemState;
import com.intelhub.backend.db.entity.VectorSpan;
import com.intelhub.backend.db.repository.IntelligenceItemRepository;
import com.intelhub.backend.exception.ItemNotFoundException;
import com.intelhub.backend.exception.ValidationException;
import com.intelhub.backend.model.dto.IntelligenceDocument;
import com.intelhub.backend.model.dto.IntelligenceQuery;
import com.intelhub.backend.model.dto.QueryResult;
import com.intelhub.backend.rating.ManualRatingService;
import com.intelhub.backend.vector.SearchFilters;
import com.intelhub.backend.vector.SimilarityHit;
import com.intelhub.backend.vector.SimilaritySearchService;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Slf4j
@Service
@RequiredArgsConstructor
public class IntelligenceQueryService {

    public static final int MAX_PER_PAGE = 100;

    private final IntelligenceItemRepository itemRepository;
    private final SimilaritySearchService similaritySearchService;
    private final ManualRatingService manualRatingService;
    private final IntelligenceDocumentMapper documentMapper;

    @Transactional(readOnly = true)
    public QueryResult query(IntelligenceQuery query) {
        int page = query.getPage() != null ? query.getPage() : 1;
        if (page < 1) {
            throw new ValidationException("page", page, "Page numbers start at 1");
        }
        int perPage = query.getPerPage() != null ? query.getPerPage() : 10;
        if (perPage < 1) {
            throw new ValidationException("per_page", perPage, "per_page must be positive");
        }
        perPage = Math.min(perPage, MAX_PER_PAGE);
        if ((long) (page - 1) * perPage > Integer.MAX_VALUE) {
            throw new ValidationException("page", page, "Page is beyond the last addressable result");
        }

        IntelligenceQuery.SearchMode mode = query.getSearchMode() != null
                ? query.getSearchMode()
                : IntelligenceQuery.SearchMode.FILTER;
        log.debug("Query mode {} page {} per_page {}", mode, page, perPage);

        return switch (mode) {
            case FILTER -> filterQuery(query, page, perPage);
            case VECTOR_TEXT, VECTOR_SIMILAR -> vectorQuery(query, mode, page, perPage);
        };
    }

    /**
     * Any item in any collection, raw data included.
     */
    @Transactional(readOnly = true)
    public IntelligenceDocument get(UUID uuid) {
        IntelligenceItem item = itemRepository.findById(uuid).orElseThrow(() -> new ItemNotFoundException(uuid));
        return documentMapper.toDocument(item, true, manualRatingService.getRatings(uuid), null);
    }

    private QueryResult filterQuery(IntelligenceQuery query, int page, int perPage) {
        Specification<IntelligenceItem> specification = Specification
                .where(IntelligenceSpecifications.inStates(EnumSet.of(ItemState.ARCHIVED)))
                .and(IntelligenceSpecifications.publishedBetween(query.getStartTime(), query.getEndTime()))
                .and(IntelligenceSpecifications.keyword(query.getKeywords()))
                .and(IntelligenceSpecifications.containsAny("locations", query.getLocations()))
                .and(IntelligenceSpecifications.containsAny("people", query.getPeoples()))
                .and(IntelligenceSpecifications.containsAny("organizations", query.getOrganizations()))
                .and(IntelligenceSpecifications.minRateScore(query.getThreshold()));

        Pageable pageable = PageRequest.of(page - 1, perPage,
                Sort.by(Sort.Direction.DESC, "appendix.archivedAt").and(Sort.by(Sort.Direction.ASC, "uuid")));
        Page<IntelligenceItem> items = itemRepository.findAll(specification, pageable);

        Map<UUID, Map<String, Double>> manualRatings = manualRatingService.getRatings(
                items.getContent().stream().map(IntelligenceItem::getUuid).toList());
        List<IntelligenceDocument> documents = items.getContent().stream()
                .map(item -> documentMapper.toDocument(item, false, manualRatings.get(item.getUuid()), null))
                .toList();
        return new QueryResult(documents, items.getTotalElements());
    }

    private QueryResult vectorQuery(IntelligenceQuery query, IntelligenceQuery.SearchMode mode, int page, int perPage) {
        Set<VectorSpan> spans = EnumSet.noneOf(VectorSpan.class);
        if (!Boolean.FALSE.equals(query.getInSummary())) {
            spans.add(VectorSpan.SUMMARY);
        }
        if (Boolean.TRUE.equals(query.getInFulltext())) {
            spans.add(VectorSpan.FULLTEXT);
        }
        double scoreThreshold = query.getScoreThreshold() != null ? query.getScoreThreshold() : 0.5;
        SearchFilters filters = SearchFilters.builder()
                .archivedFrom(query.getStartTime())
                .archivedTo(query.getEndTime())
                .minRateScore(query.getThreshold())
                .build();

        List<SimilarityHit> hits = mode == IntelligenceQuery.SearchMode.VECTOR_TEXT
                ? similaritySearchService.searchByText(query.getKeywords(), spans, scoreThreshold, 0, filters)
                : similaritySearchService.searchByReference(query.getReference(), spans, scoreThreshold, 0, filters);

        int from = (int) Math.min((long) (page - 1) * perPage, hits.size());
        int to = Math.min(from + perPage, hits.size());
        List<SimilarityHit> pageHits = hits.subList(from, to);

        List<UUID> uuids = pageHits.stream().map(SimilarityHit::getUuid).toList();
        Map<UUID, IntelligenceItem> items = itemRepository.findAllById(uuids).stream()
                .collect(Collectors.toMap(IntelligenceItem::getUuid, Function.identity()));
        Map<UUID, Map<String, Double>> manualRatings = manualRatingService.getRatings(uuids);

        List<IntelligenceDocument> documents = new ArrayList<>();
        for (SimilarityHit hit : pageHits) {
            IntelligenceItem item = items.get(hit.getUuid());
            if (item != null) {
                documents.add(documentMapper.toDocument(item, false, manualRatings.get(hit.getUuid()), hit.getScore()));
            }
        }
        return new QueryResult(documents, hits.size());
    }
}
