package com.intelhub.backend.vector;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.intelhub.backend.db.entity.VectorSpan;
import com.intelhub.backend.db.repository.EmbeddingVectorRepository;
import com.intelhub.backend.db.repository.IntelligenceItemRepository;
import com.intelhub.backend.exception.ItemNotFoundException;
import com.intelhub.backend.exception.ValidationException;
import java.time.LocalDateTime;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class SimilaritySearchServiceTest {

    @Mock
    private EmbeddingIndexer embeddingIndexer;

    @Mock
    private IntelligenceItemRepository itemRepository;

    @Mock
    private EmbeddingVectorRepository embeddingVectorRepository;

    private VectorIndex vectorIndex;
    private SimilaritySearchService searchService;

    private final Set<VectorSpan> summary = EnumSet.of(VectorSpan.SUMMARY);

    @BeforeEach
    void setUp() {
        vectorIndex = new VectorIndex(embeddingVectorRepository, itemRepository);
        searchService = new SimilaritySearchService(vectorIndex, embeddingIndexer, itemRepository);
    }

    @Test
    void searchByText_shouldEmbedQueryAndLimitHits() {
        // Arrange
        LocalDateTime now = LocalDateTime.now();
        UUID first = UUID.randomUUID();
        UUID second = UUID.randomUUID();
        vectorIndex.put(first, VectorSpan.SUMMARY, new float[]{1, 0, 0}, now, 8.0);
        vectorIndex.put(second, VectorSpan.SUMMARY, new float[]{1, 1, 0}, now, 8.0);
        when(embeddingIndexer.embed("port strike", null)).thenReturn(new float[]{1, 0, 0});

        // Act
        List<SimilarityHit> hits = searchService.searchByText("port strike", summary, 0.5, 1, SearchFilters.none());

        // Assert
        assertThat(hits).extracting(SimilarityHit::getUuid).containsExactly(first);
    }

    @Test
    void searchByReference_shouldNeverReturnReference() {
        // Arrange
        LocalDateTime now = LocalDateTime.now();
        UUID reference = UUID.randomUUID();
        UUID other = UUID.randomUUID();
        vectorIndex.put(reference, VectorSpan.SUMMARY, new float[]{1, 0}, now, 8.0);
        vectorIndex.put(other, VectorSpan.SUMMARY, new float[]{1, 0}, now, 8.0);

        // Act
        List<SimilarityHit> hits = searchService.searchByReference(reference, summary, 0.9, 0, null);

        // Assert
        assertThat(hits).extracting(SimilarityHit::getUuid).containsExactly(other);
        verify(embeddingIndexer, never()).embed(any(), any());
    }

    @Test
    void searchByReference_shouldRankAboveThresholdAndDropTheRest() {
        // Arrange
        LocalDateTime now = LocalDateTime.now();
        UUID reference = UUID.randomUUID();
        UUID close = UUID.randomUUID();
        UUID related = UUID.randomUUID();
        UUID distant = UUID.randomUUID();
        vectorIndex.put(reference, VectorSpan.SUMMARY, new float[]{1, 0}, now, 8.0);
        vectorIndex.put(distant, VectorSpan.SUMMARY, unitAt(0.3), now, 8.0);
        vectorIndex.put(related, VectorSpan.SUMMARY, unitAt(0.7), now, 8.0);
        vectorIndex.put(close, VectorSpan.SUMMARY, unitAt(0.95), now, 8.0);

        // Act
        List<SimilarityHit> hits = searchService.searchByReference(reference, summary, 0.6, 10, null);

        // Assert
        assertThat(hits).extracting(SimilarityHit::getUuid).containsExactly(close, related);
        assertThat(hits.get(0).getScore()).isCloseTo(0.95, within(1e-4));
        assertThat(hits.get(1).getScore()).isCloseTo(0.7, within(1e-4));
    }

    @Test
    void searchByReference_shouldFailNotFound_whenReferenceUnknown() {
        UUID reference = UUID.randomUUID();
        when(itemRepository.existsById(reference)).thenReturn(false);

        assertThatThrownBy(() -> searchService.searchByReference(reference, summary, 0.5, 10, null))
                .isInstanceOf(ItemNotFoundException.class);
    }

    @Test
    void searchByReference_shouldFailNotFound_whenReferenceNotIndexed() {
        UUID reference = UUID.randomUUID();
        when(itemRepository.existsById(reference)).thenReturn(true);

        assertThatThrownBy(() -> searchService.searchByReference(reference, summary, 0.5, 10, null))
                .isInstanceOf(ItemNotFoundException.class)
                .hasMessageContaining("no indexed vector");
    }

    @Test
    void search_shouldRejectInvalidArguments() {
        assertThatThrownBy(() -> searchService.searchByText("x", EnumSet.noneOf(VectorSpan.class), 0.5, 10, null))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> searchService.searchByText("x", summary, 1.5, 10, null))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> searchService.searchByText(" ", summary, 0.5, 10, null))
                .isInstanceOf(ValidationException.class);
    }

    // Unit vector whose cosine with (1, 0) is the given value
    private static float[] unitAt(double cosine) {
        return new float[]{(float) cosine, (float) Math.sqrt(1 - cosine * cosine)};
    }
}
