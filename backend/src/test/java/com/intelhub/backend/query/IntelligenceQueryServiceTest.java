package com.intelhub.backend.query;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

import com.intelhub.backend.db.entity.IntelligenceAppendix;
import com.intelhub.backend.db.entity.IntelligenceItem;
import com.intelhub.backend.db.entity.ItemState;
import com.intelhub.backend.db.repository.IntelligenceItemRepository;
import com.intelhub.backend.exception.ItemNotFoundException;
import com.intelhub.backend.exception.ValidationException;
import com.intelhub.backend.model.dto.IntelligenceDocument;
import com.intelhub.backend.model.dto.IntelligenceQuery;
import com.intelhub.backend.model.dto.QueryResult;
import com.intelhub.backend.rating.ManualRatingService;
import com.intelhub.backend.vector.SimilarityHit;
import com.intelhub.backend.vector.SimilaritySearchService;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.bean.override.mockito.MockitoBean;

@DataJpaTest
@Import({IntelligenceQueryService.class, IntelligenceDocumentMapper.class, ManualRatingService.class})
class IntelligenceQueryServiceTest {

    @Autowired
    private IntelligenceQueryService queryService;

    @Autowired
    private IntelligenceItemRepository itemRepository;

    @MockitoBean
    private SimilaritySearchService similaritySearchService;

    private final LocalDateTime now = LocalDateTime.of(2026, 10, 15, 9, 0);

    private UUID strike;
    private UUID outage;
    private UUID election;

    @BeforeEach
    void setUp() {
        strike = save("Port strike halts exports", List.of("Rotterdam"), 8.0, now.minusDays(1), ItemState.ARCHIVED);
        outage = save("Cloud outage hits banks", List.of("Frankfurt"), 6.5, now, ItemState.ARCHIVED);
        election = save("Snap election called", List.of("Rotterdam", "The Hague"), 9.0, now.minusDays(2), ItemState.ARCHIVED);
        save("Port strike rumour", List.of("Rotterdam"), 3.0, null, ItemState.LOW_VALUE);
    }

    @Test
    void query_shouldReturnArchivedItemsNewestFirst() {
        QueryResult result = queryService.query(IntelligenceQuery.builder().build());

        assertThat(result.getTotal()).isEqualTo(3);
        assertThat(result.getResults()).extracting(IntelligenceDocument::getUuid).containsExactly(outage, strike, election);
        assertThat(result.getResults()).allSatisfy(document -> assertThat(document.getRawData()).isNull());
    }

    @Test
    void query_shouldFilterByKeywordLocationAndScore() {
        assertThat(queryService.query(IntelligenceQuery.builder().keywords("STRIKE").build()).getResults())
                .extracting(IntelligenceDocument::getUuid).containsExactly(strike);

        assertThat(queryService.query(IntelligenceQuery.builder()
                        .locations(new ArrayList<>(List.of("Rotterdam")))
                        .threshold(8.5)
                        .build()).getResults())
                .extracting(IntelligenceDocument::getUuid).containsExactly(election);
    }

    @Test
    void query_shouldPage() {
        QueryResult second = queryService.query(IntelligenceQuery.builder().page(2).perPage(2).build());

        assertThat(second.getTotal()).isEqualTo(3);
        assertThat(second.getResults()).extracting(IntelligenceDocument::getUuid).containsExactly(election);
    }

    @Test
    void query_shouldRejectInvalidPaging() {
        assertThatThrownBy(() -> queryService.query(IntelligenceQuery.builder().page(0).build()))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> queryService.query(IntelligenceQuery.builder().perPage(0).build()))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void query_shouldRejectPage_whenOffsetOverflows() {
        // Act & Assert
        assertThatThrownBy(() -> queryService.query(IntelligenceQuery.builder()
                .page(Integer.MAX_VALUE).perPage(100).build()))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("beyond");
    }

    @Test
    void query_shouldReturnEmptyPage_whenVectorPageBeyondHits() {
        // Arrange
        when(similaritySearchService.searchByText(eq("dock workers"), any(), anyDouble(), anyInt(), any()))
                .thenReturn(List.of(new SimilarityHit(strike, 0.91, now), new SimilarityHit(outage, 0.62, now)));

        // Act
        QueryResult result = queryService.query(IntelligenceQuery.builder()
                .searchMode(IntelligenceQuery.SearchMode.VECTOR_TEXT)
                .keywords("dock workers")
                .page(5_000_000)
                .perPage(100)
                .build());

        // Assert
        assertThat(result.getTotal()).isEqualTo(2);
        assertThat(result.getResults()).isEmpty();
    }

    @Test
    void query_shouldAttachVectorScore_whenSearchingByText() {
        when(similaritySearchService.searchByText(eq("dock workers"), any(), anyDouble(), anyInt(), any()))
                .thenReturn(List.of(new SimilarityHit(strike, 0.91, now), new SimilarityHit(outage, 0.62, now)));

        QueryResult result = queryService.query(IntelligenceQuery.builder()
                .searchMode(IntelligenceQuery.SearchMode.VECTOR_TEXT)
                .keywords("dock workers")
                .perPage(1)
                .build());

        assertThat(result.getTotal()).isEqualTo(2);
        assertThat(result.getResults()).singleElement().satisfies(document -> {
            assertThat(document.getUuid()).isEqualTo(strike);
            assertThat(document.getAppendix().getVectorScore()).isEqualTo(0.91);
        });
    }

    @Test
    void get_shouldIncludeRawData() {
        IntelligenceDocument document = queryService.get(strike);

        assertThat(document.getRawData().getContent()).isEqualTo("Raw content");
        assertThat(document.getLocations()).containsExactly("Rotterdam");
        assertThat(document.getAppendix().getMaxRateScore()).isEqualTo(8.0);
    }

    @Test
    void get_shouldFailNotFound_whenUnknown() {
        assertThatThrownBy(() -> queryService.get(UUID.randomUUID())).isInstanceOf(ItemNotFoundException.class);
    }

    private UUID save(String title, List<String> locations, double score, LocalDateTime archivedAt, ItemState state) {
        UUID uuid = UUID.randomUUID();
        Map<String, Double> rates = new LinkedHashMap<>();
        rates.put("impact_scope", score);
        itemRepository.save(IntelligenceItem.builder()
                .uuid(uuid)
                .informant("https://news.example.com/" + uuid)
                .title(title)
                .rawContent("Raw content")
                .eventTitle(title)
                .eventBrief("Brief")
                .eventText("Text")
                .taxonomy("Economy & Finance")
                .locations(new ArrayList<>(locations))
                .rates(rates)
                .fingerprint((uuid.toString() + uuid).replace("-", ""))
                .state(state)
                .appendix(IntelligenceAppendix.builder()
                        .archivedAt(archivedAt)
                        .maxRateClass("impact_scope")
                        .maxRateScore(score)
                        .build())
                .build());
        return uuid;
    }
}
