package com.intelhub.backend.transfer;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.intelhub.backend.db.entity.IntelligenceItem;
import com.intelhub.backend.db.entity.ItemState;
import com.intelhub.backend.db.entity.Partition;
import com.intelhub.backend.db.repository.IntelligenceItemRepository;
import com.intelhub.backend.ingestion.FingerprintPolicy;
import com.intelhub.backend.ingestion.FingerprintStore;
import com.intelhub.backend.ingestion.RegistrationResult;
import com.intelhub.backend.model.dto.IntelligenceDocument;
import com.intelhub.backend.pipeline.ArchiveRouter;
import com.intelhub.backend.pipeline.RoutingDecision;
import com.intelhub.backend.pipeline.ThresholdSettings;
import com.intelhub.backend.query.IntelligenceDocumentMapper;
import com.intelhub.backend.rating.ManualRatingService;
import com.intelhub.backend.vector.EmbeddingIndexer;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Bulk export and import of the named collections.
 */
@Slf4j
@Service
public class IntelligenceTransferService {

    private static final int EXPORT_PAGE_SIZE = 200;

    private final IntelligenceItemRepository itemRepository;
    private final IntelligenceDocumentMapper documentMapper;
    private final ManualRatingService manualRatingService;
    private final FingerprintPolicy fingerprintPolicy;
    private final FingerprintStore fingerprintStore;
    private final ArchiveRouter archiveRouter;
    private final ThresholdSettings thresholdSettings;
    private final EmbeddingIndexer embeddingIndexer;
    private final ObjectMapper objectMapper;

    public IntelligenceTransferService(IntelligenceItemRepository itemRepository,
                                       IntelligenceDocumentMapper documentMapper,
                                       ManualRatingService manualRatingService,
                                       FingerprintPolicy fingerprintPolicy,
                                       FingerprintStore fingerprintStore,
                                       ArchiveRouter archiveRouter,
                                       ThresholdSettings thresholdSettings,
                                       EmbeddingIndexer embeddingIndexer,
                                       ObjectMapper objectMapper) {
        this.itemRepository = itemRepository;
        this.documentMapper = documentMapper;
        this.manualRatingService = manualRatingService;
        this.fingerprintPolicy = fingerprintPolicy;
        this.fingerprintStore = fingerprintStore;
        this.archiveRouter = archiveRouter;
        this.thresholdSettings = thresholdSettings;
        this.embeddingIndexer = embeddingIndexer;
        this.objectMapper = objectMapper.copy()
                .disable(SerializationFeature.INDENT_OUTPUT)
                .disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);
    }

    /**
     * Writes every document of a collection, oldest first, raw data included.
     *
     * @return number of documents written
     */
    @Transactional(readOnly = true)
    public int export(Partition partition, TransferFormat format, OutputStream out) throws IOException {
        int written = 0;
        int page = 0;
        if (format == TransferFormat.ARRAY) {
            out.write('[');
        }

        Page<IntelligenceItem> items;
        do {
            items = itemRepository.findByStateIn(partition.getStates(),
                    PageRequest.of(page++, EXPORT_PAGE_SIZE, Sort.by("collectedAt", "uuid")));
            Map<UUID, Map<String, Double>> manualRatings = manualRatingService.getRatings(
                    items.getContent().stream().map(IntelligenceItem::getUuid).toList());

            for (IntelligenceItem item : items.getContent()) {
                IntelligenceDocument document = documentMapper.toDocument(item, true,
                        manualRatings.get(item.getUuid()), null);
                if (format == TransferFormat.ARRAY && written > 0) {
                    out.write(',');
                }
                out.write(objectMapper.writeValueAsBytes(document));
                if (format == TransferFormat.JSONL) {
                    out.write('\n');
                }
                written++;
            }
        } while (items.hasNext());

        if (format == TransferFormat.ARRAY) {
            out.write(']');
        }
        out.flush();
        log.info("📤 Exported {} documents from {}", written, partition.getCollectionName());
        return written;
    }

    /**
     * Imports documents into a collection. Known fingerprints are skipped; malformed documents
     * are counted and skipped. Imported cached documents are queued for classification again.
     */
    public ImportResult importDocuments(Partition partition, TransferFormat format, InputStream in) throws IOException {
        List<JsonNode> nodes = readNodes(format, in);
        ImportResult result = new ImportResult(partition.getCollectionName(), 0, 0, 0);

        for (JsonNode node : nodes) {
            IntelligenceDocument document;
            try {
                document = objectMapper.treeToValue(node, IntelligenceDocument.class);
            } catch (JsonProcessingException | IllegalArgumentException e) {
                log.warn("⚠️ Skipping malformed document: {}", e.getMessage());
                result.setRejected(result.getRejected() + 1);
                continue;
            }

            switch (importOne(document, partition)) {
                case IMPORTED -> result.setImported(result.getImported() + 1);
                case DUPLICATE -> result.setDuplicates(result.getDuplicates() + 1);
                case REJECTED -> result.setRejected(result.getRejected() + 1);
            }
        }

        log.info("📥 Import into {}: {} imported, {} duplicates, {} rejected", partition.getCollectionName(),
                result.getImported(), result.getDuplicates(), result.getRejected());
        return result;
    }

    private enum ImportStatus {
        IMPORTED,
        DUPLICATE,
        REJECTED
    }

    private ImportStatus importOne(IntelligenceDocument document, Partition partition) {
        if (document.getInformant() == null || document.getInformant().isBlank()) {
            log.warn("⚠️ Rejecting document {} without INFORMANT", document.getUuid());
            return ImportStatus.REJECTED;
        }
        String content = document.getRawData() != null ? document.getRawData().getContent() : null;
        ItemState state = partition.getImportState();
        if (state == ItemState.PENDING && (content == null || content.isBlank())) {
            log.warn("⚠️ Rejecting cached document {} without RAW_DATA content", document.getUuid());
            return ImportStatus.REJECTED;
        }
        if (document.getUuid() != null && itemRepository.existsById(document.getUuid())) {
            return ImportStatus.DUPLICATE;
        }

        String fingerprint = fingerprintPolicy.fingerprint(document.getInformant(),
                content != null ? content : document.getEventText());
        IntelligenceItem item = documentMapper.toItem(document, state, fingerprint);
        if (state != ItemState.PENDING && !applyRouting(item)) {
            return ImportStatus.REJECTED;
        }

        if (fingerprintStore.registerIfAbsent(fingerprint, item.getUuid()) == RegistrationResult.DUPLICATE) {
            return ImportStatus.DUPLICATE;
        }
        try {
            itemRepository.save(item);
        } catch (RuntimeException e) {
            fingerprintStore.release(fingerprint, item.getUuid());
            log.warn("⚠️ Failed to store imported document {}: {}", item.getUuid(), e.getMessage());
            return ImportStatus.REJECTED;
        }

        if (state == ItemState.ARCHIVED) {
            embeddingIndexer.indexAsync(item.getUuid());
        }
        return ImportStatus.IMPORTED;
    }

    /**
     * Re-routes a terminal document with its recorded threshold, or the current one when none was
     * recorded. The stored max score always follows the stored ratings.
     *
     * @return false when the ratings do not belong in the target collection
     */
    private boolean applyRouting(IntelligenceItem item) {
        Double recorded = item.getAppendix().getThresholdAtClassification();
        if (recorded != null && (recorded.isNaN() || recorded <= 0 || recorded > 10)) {
            log.warn("⚠️ Rejecting document {} with invalid threshold {}", item.getUuid(), recorded);
            return false;
        }
        double threshold = recorded != null ? recorded : thresholdSettings.current();

        RoutingDecision decision = archiveRouter.route(item.getRates(), threshold);
        if (decision.getState() != item.getState()) {
            log.warn("⚠️ Rejecting document {}: max rate {} against threshold {} belongs to {}, not {}",
                    item.getUuid(), decision.getMaxRateScore(), threshold, decision.getState(), item.getState());
            return false;
        }

        item.getAppendix().setMaxRateScore(decision.getMaxRateScore());
        item.getAppendix().setMaxRateClass(decision.getMaxRateClass());
        item.getAppendix().setThresholdAtClassification(threshold);
        if (item.getState() == ItemState.ARCHIVED && item.getAppendix().getArchivedAt() == null) {
            item.getAppendix().setArchivedAt(LocalDateTime.now());
        }
        return true;
    }

    private List<JsonNode> readNodes(TransferFormat format, InputStream in) throws IOException {
        List<JsonNode> nodes = new ArrayList<>();
        if (format == TransferFormat.ARRAY) {
            JsonNode root = objectMapper.readTree(in);
            if (root == null || !root.isArray()) {
                throw new IllegalArgumentException("Expected a JSON array");
            }
            root.forEach(nodes::add);
            return nodes;
        }

        BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
        String line;
        int lineNumber = 0;
        while ((line = reader.readLine()) != null) {
            lineNumber++;
            if (line.isBlank()) {
                continue;
            }
            try {
                nodes.add(objectMapper.readTree(line));
            } catch (JsonProcessingException e) {
                // Keep the slot so the document is counted as rejected
                log.warn("⚠️ Line {} is not valid JSON: {}", lineNumber, e.getOriginalMessage());
                nodes.add(objectMapper.getNodeFactory().textNode(line));
            }
        }
        return nodes;
    }
}
