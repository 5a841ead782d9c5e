package com.intelhub.backend.transfer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;

import com.intelhub.backend.config.PipelineProperties;
import com.intelhub.backend.db.entity.IntelligenceAppendix;
import com.intelhub.backend.db.entity.IntelligenceItem;
import com.intelhub.backend.db.entity.ItemState;
import com.intelhub.backend.db.entity.Partition;
import com.intelhub.backend.db.repository.FingerprintRepository;
import com.intelhub.backend.db.repository.IntelligenceItemRepository;
import com.intelhub.backend.ingestion.FingerprintPolicy;
import com.intelhub.backend.ingestion.FingerprintStore;
import com.intelhub.backend.pipeline.ArchiveRouter;
import com.intelhub.backend.pipeline.ThresholdSettings;
import com.intelhub.backend.query.IntelligenceDocumentMapper;
import com.intelhub.backend.rating.ManualRatingService;
import com.intelhub.backend.vector.EmbeddingIndexer;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.ImportAutoConfiguration;
import org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

@DataJpaTest
@ImportAutoConfiguration(JacksonAutoConfiguration.class)
@Import({IntelligenceTransferService.class, IntelligenceDocumentMapper.class, ManualRatingService.class,
        FingerprintPolicy.class, FingerprintStore.class, ArchiveRouter.class, ThresholdSettings.class})
@EnableConfigurationProperties(PipelineProperties.class)
@Transactional(propagation = Propagation.NOT_SUPPORTED)
class IntelligenceTransferServiceTest {

    @Autowired
    private IntelligenceTransferService transferService;

    @Autowired
    private IntelligenceItemRepository itemRepository;

    @Autowired
    private FingerprintRepository fingerprintRepository;

    @MockitoBean
    private EmbeddingIndexer embeddingIndexer;

    @AfterEach
    void cleanUp() {
        itemRepository.deleteAll();
        fingerprintRepository.deleteAll();
    }

    @Test
    void exportThenImport_shouldRestoreArchiveAndSkipDuplicates() throws Exception {
        UUID first = saveArchived("https://news.example.com/1", 8.0);
        UUID second = saveArchived("https://news.example.com/2", 7.0);
        ByteArrayOutputStream out = new ByteArrayOutputStream();

        int exported = transferService.export(Partition.ARCHIVED, TransferFormat.JSONL, out);

        assertThat(exported).isEqualTo(2);
        String jsonl = out.toString(StandardCharsets.UTF_8);
        assertThat(jsonl.lines()).hasSize(2).allSatisfy(line -> assertThat(line).contains("\"RAW_DATA\""));

        itemRepository.deleteAll();
        fingerprintRepository.deleteAll();

        ImportResult imported = transferService.importDocuments(Partition.ARCHIVED, TransferFormat.JSONL, input(jsonl));
        assertThat(imported.getImported()).isEqualTo(2);
        assertThat(imported.getDuplicates()).isZero();
        IntelligenceItem restored = itemRepository.findById(first).orElseThrow();
        assertThat(restored.getState()).isEqualTo(ItemState.ARCHIVED);
        assertThat(restored.getAppendix().getMaxRateScore()).isEqualTo(8.0);
        verify(embeddingIndexer).indexAsync(first);
        verify(embeddingIndexer).indexAsync(second);

        ImportResult again = transferService.importDocuments(Partition.ARCHIVED, TransferFormat.JSONL, input(jsonl));
        assertThat(again.getImported()).isZero();
        assertThat(again.getDuplicates()).isEqualTo(2);
    }

    @Test
    void export_shouldWriteJsonArray() throws Exception {
        saveArchived("https://news.example.com/1", 8.0);
        ByteArrayOutputStream out = new ByteArrayOutputStream();

        transferService.export(Partition.ARCHIVED, TransferFormat.ARRAY, out);

        String json = out.toString(StandardCharsets.UTF_8);
        assertThat(json).startsWith("[{").endsWith("}]").contains("\"max_rate_score\":8.0");
        assertThat(transferService.export(Partition.LOW_VALUE, TransferFormat.ARRAY, new ByteArrayOutputStream())).isZero();
    }

    @Test
    void importDocuments_shouldQueueCachedItemsAndCountRejects() throws Exception {
        String jsonl = String.join("\n", List.of(
                "{\"INFORMANT\":\"https://news.example.com/9\",\"RAW_DATA\":{\"title\":\"T\",\"content\":\"Body\"}}",
                "{\"RAW_DATA\":{\"content\":\"No informant\"}}",
                "{\"INFORMANT\":\"https://news.example.com/10\"}",
                "not json at all",
                ""));

        ImportResult result = transferService.importDocuments(Partition.CACHED, TransferFormat.JSONL, input(jsonl));

        assertThat(result.getImported()).isEqualTo(1);
        assertThat(result.getRejected()).isEqualTo(3);
        assertThat(itemRepository.findAll()).singleElement()
                .satisfies(item -> {
                    assertThat(item.getState()).isEqualTo(ItemState.PENDING);
                    assertThat(item.getRawContent()).isEqualTo("Body");
                });
    }

    @Test
    void importDocuments_shouldRecomputeMaxScoreFromRatings() throws Exception {
        String json = "[{\"UUID\":\"" + UUID.randomUUID() + "\",\"INFORMANT\":\"https://news.example.com/5\","
                + "\"EVENT_TEXT\":\"Text\",\"RATE\":{\"novelty\":3,\"impact_scope\":9},"
                + "\"APPENDIX\":{\"max_rate_score\":1.0,\"threshold\":6.0}}]";

        ImportResult result = transferService.importDocuments(Partition.ARCHIVED, TransferFormat.ARRAY, input(json));

        assertThat(result.getImported()).isEqualTo(1);
        IntelligenceItem item = itemRepository.findAll().get(0);
        assertThat(item.getState()).isEqualTo(ItemState.ARCHIVED);
        assertThat(item.getAppendix().getMaxRateScore()).isEqualTo(9.0);
        assertThat(item.getAppendix().getMaxRateClass()).isEqualTo("impact_scope");
        assertThat(item.getAppendix().getArchivedAt()).isNotNull();
    }

    @Test
    void importDocuments_shouldRejectRatingsThatContradictTheCollection() throws Exception {
        String json = "[{\"UUID\":\"" + UUID.randomUUID() + "\",\"INFORMANT\":\"https://news.example.com/6\","
                + "\"EVENT_TEXT\":\"Below\",\"RATE\":{\"importance\":4,\"credibility\":3},"
                + "\"APPENDIX\":{\"threshold\":6.0}},"
                + "{\"UUID\":\"" + UUID.randomUUID() + "\",\"INFORMANT\":\"https://news.example.com/7\","
                + "\"EVENT_TEXT\":\"Unrated\"},"
                + "{\"UUID\":\"" + UUID.randomUUID() + "\",\"INFORMANT\":\"https://news.example.com/8\","
                + "\"EVENT_TEXT\":\"Bad threshold\",\"RATE\":{\"importance\":8},\"APPENDIX\":{\"threshold\":0}}]";

        ImportResult result = transferService.importDocuments(Partition.ARCHIVED, TransferFormat.ARRAY, input(json));

        assertThat(result.getImported()).isZero();
        assertThat(result.getRejected()).isEqualTo(3);
        assertThat(itemRepository.count()).isZero();
        assertThat(fingerprintRepository.count()).isZero();
    }

    @Test
    void importDocuments_shouldRejectLowValueDocument_whenMaxReachesThreshold() throws Exception {
        String json = "[{\"UUID\":\"" + UUID.randomUUID() + "\",\"INFORMANT\":\"https://news.example.com/11\","
                + "\"EVENT_TEXT\":\"Text\",\"RATE\":{\"novelty\":3,\"impact_scope\":9},"
                + "\"APPENDIX\":{\"threshold\":6.0}}]";

        ImportResult result = transferService.importDocuments(Partition.LOW_VALUE, TransferFormat.ARRAY, input(json));

        assertThat(result.getRejected()).isEqualTo(1);
        assertThat(itemRepository.count()).isZero();
    }

    @Test
    void importDocuments_shouldRouteWithCurrentThreshold_whenNoneRecorded() throws Exception {
        String json = "[{\"UUID\":\"" + UUID.randomUUID() + "\",\"INFORMANT\":\"https://news.example.com/12\","
                + "\"EVENT_TEXT\":\"Text\",\"RATE\":{\"importance\":8,\"credibility\":5}}]";

        ImportResult result = transferService.importDocuments(Partition.ARCHIVED, TransferFormat.ARRAY, input(json));

        assertThat(result.getImported()).isEqualTo(1);
        IntelligenceItem item = itemRepository.findAll().get(0);
        assertThat(item.getAppendix().getMaxRateScore()).isEqualTo(8.0);
        assertThat(item.getAppendix().getThresholdAtClassification()).isEqualTo(6.0);
    }

    private UUID saveArchived(String url, double score) {
        UUID uuid = UUID.randomUUID();
        Map<String, Double> rates = new LinkedHashMap<>();
        rates.put("impact_scope", score);
        itemRepository.save(IntelligenceItem.builder()
                .uuid(uuid)
                .informant(url)
                .title("Title " + uuid)
                .rawContent("Content " + uuid)
                .eventTitle("Event")
                .eventBrief("Brief")
                .eventText("Text")
                .taxonomy("Economy & Finance")
                .locations(new java.util.ArrayList<>(List.of("Rotterdam")))
                .rates(rates)
                .fingerprint(new FingerprintPolicy().fingerprint(url, "Content " + uuid))
                .state(ItemState.ARCHIVED)
                .appendix(IntelligenceAppendix.builder()
                        .archivedAt(LocalDateTime.now())
                        .maxRateClass("impact_scope")
                        .maxRateScore(score)
                        .thresholdAtClassification(6.0)
                        .build())
                .build());
        return uuid;
    }

    private static ByteArrayInputStream input(String content) {
        return new ByteArrayInputStream(content.getBytes(StandardCharsets.UTF_8));
    }
}
