package com.intelhub.backend.ingestion;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.intelhub.backend.db.entity.IntelligenceItem;
import com.intelhub.backend.db.entity.ItemState;
import com.intelhub.backend.db.repository.FingerprintRepository;
import com.intelhub.backend.db.repository.IntelligenceItemRepository;
import com.intelhub.backend.exception.IngestionException;
import com.intelhub.backend.model.dto.BatchIngestionResult;
import com.intelhub.backend.model.dto.FeedRecord;
import com.intelhub.backend.model.dto.IngestionResult;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

@DataJpaTest
@Import({IngestionService.class, FingerprintStore.class, FingerprintPolicy.class, ContentNormalizer.class})
@Transactional(propagation = Propagation.NOT_SUPPORTED)
class IngestionServiceTest {

    @Autowired
    private IngestionService ingestionService;

    @Autowired
    private IntelligenceItemRepository itemRepository;

    @Autowired
    private FingerprintRepository fingerprintRepository;

    @AfterEach
    void cleanUp() {
        itemRepository.deleteAll();
        fingerprintRepository.deleteAll();
    }

    @Test
    void ingest_shouldQueueNormalizedItem() {
        LocalDateTime published = LocalDateTime.of(2026, 10, 12, 8, 30);

        IngestionResult result = ingestionService.ingest(FeedRecord.builder()
                .sourceUrl("https://news.example.com/a?utm_source=rss")
                .title(" Port strike ")
                .publishedAt(published)
                .rawContent("<p>Dock workers   walked out.</p><script>track()</script>")
                .build());

        assertThat(result.getStatus()).isEqualTo(IngestionResult.Status.QUEUED);
        IntelligenceItem item = itemRepository.findById(result.getUuid()).orElseThrow();
        assertThat(item.getState()).isEqualTo(ItemState.PENDING);
        assertThat(item.getTitle()).isEqualTo("Port strike");
        assertThat(item.getRawContent()).isEqualTo("Dock workers walked out.");
        assertThat(item.getPubTime()).isEqualTo(published);
        assertThat(item.getAttempts()).isZero();
        assertThat(fingerprintRepository.existsById(item.getFingerprint())).isTrue();
    }

    @Test
    void ingest_shouldReportDuplicate_whenSameSourceSeenAgain() {
        ingestionService.ingest(record("https://news.example.com/a", "first body"));

        IngestionResult second = ingestionService.ingest(record("https://NEWS.example.com/a/?fbclid=1", "other body"));

        assertThat(second.getStatus()).isEqualTo(IngestionResult.Status.DUPLICATE);
        assertThat(itemRepository.count()).isEqualTo(1);
    }

    @Test
    void ingest_shouldReject_whenContentMissing() {
        assertThatThrownBy(() -> ingestionService.ingest(record("https://news.example.com/a", "  ")))
                .isInstanceOf(IngestionException.class);
        assertThatThrownBy(() -> ingestionService.ingest(record(null, "body")))
                .isInstanceOf(IngestionException.class);
        assertThat(itemRepository.count()).isZero();
    }

    @Test
    void ingestBatch_shouldReportEachRecord() {
        BatchIngestionResult result = ingestionService.ingestBatch(List.of(
                record("https://news.example.com/1", "one"),
                record("https://news.example.com/1", "one again"),
                record("https://news.example.com/2", ""),
                record("https://news.example.com/3", "three")));

        assertThat(result.getQueued()).isEqualTo(2);
        assertThat(result.getDuplicates()).isEqualTo(1);
        assertThat(result.getRejected()).isEqualTo(1);
        assertThat(result.getResults()).extracting(IngestionResult::getStatus).containsExactly(
                IngestionResult.Status.QUEUED,
                IngestionResult.Status.DUPLICATE,
                IngestionResult.Status.REJECTED,
                IngestionResult.Status.QUEUED);
    }

    @Test
    void ingestBatch_shouldReject_whenTooLarge() {
        List<FeedRecord> records = new ArrayList<>();
        for (int i = 0; i <= IngestionService.MAX_BATCH_SIZE; i++) {
            records.add(record("https://news.example.com/" + i, "body " + i));
        }

        assertThatThrownBy(() -> ingestionService.ingestBatch(records)).isInstanceOf(IngestionException.class);
        assertThat(itemRepository.count()).isZero();
    }

    private static FeedRecord record(String url, String content) {
        return FeedRecord.builder().sourceUrl(url).title("Title").rawContent(content).build();
    }
}
