package com.intelhub.backend.ingestion;

import com.intelhub.backend.db.entity.IntelligenceAppendix;
import com.intelhub.backend.db.entity.IntelligenceItem;
import com.intelhub.backend.db.entity.ItemState;
import com.intelhub.backend.db.repository.IntelligenceItemRepository;
import com.intelhub.backend.exception.IngestionException;
import com.intelhub.backend.model.dto.BatchIngestionResult;
import com.intelhub.backend.model.dto.FeedRecord;
import com.intelhub.backend.model.dto.IngestionResult;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Entry point of the pipeline: dedups a feed record and stages it as PENDING.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IngestionService {

    public static final int MAX_BATCH_SIZE = 100;

    private final FingerprintStore fingerprintStore;
    private final FingerprintPolicy fingerprintPolicy;
    private final ContentNormalizer contentNormalizer;
    private final IntelligenceItemRepository itemRepository;

    public IngestionResult ingest(FeedRecord record) {
        if (record == null) {
            throw new IngestionException("Record is required");
        }
        if (record.getSourceUrl() == null || record.getSourceUrl().isBlank()) {
            throw new IngestionException("Source reference is required");
        }
        if (record.getRawContent() == null || record.getRawContent().isBlank()) {
            throw new IngestionException("Content is required for " + record.getSourceUrl());
        }

        String content = contentNormalizer.toText(record.getRawContent());
        if (content.isBlank()) {
            throw new IngestionException("Content is empty after normalization for " + record.getSourceUrl());
        }

        String fingerprint = fingerprintPolicy.fingerprint(record.getSourceUrl(), content);
        UUID uuid = UUID.randomUUID();

        if (fingerprintStore.registerIfAbsent(fingerprint, uuid) == RegistrationResult.DUPLICATE) {
            log.debug("Skipping duplicate record: {}", record.getSourceUrl());
            return IngestionResult.duplicate(record.getSourceUrl());
        }

        IntelligenceItem item = IntelligenceItem.builder()
                .uuid(uuid)
                .informant(record.getSourceUrl().trim())
                .title(record.getTitle() != null ? record.getTitle().trim() : null)
                .pubTime(record.getPublishedAt())
                .rawContent(content)
                .fingerprint(fingerprint)
                .state(ItemState.PENDING)
                .attempts(0)
                .appendix(IntelligenceAppendix.builder().pubTimeCache(record.getPublishedAt()).build())
                .build();
        try {
            itemRepository.save(item);
        } catch (RuntimeException e) {
            fingerprintStore.release(fingerprint, uuid);
            throw new IngestionException("Failed to stage record " + record.getSourceUrl() + ": " + e.getMessage(), e);
        }

        log.info("📥 Queued item {} from {}", uuid, record.getSourceUrl());
        return IngestionResult.queued(uuid, record.getSourceUrl());
    }

    /**
     * Ingests each record independently; a bad record is reported and skipped.
     */
    public BatchIngestionResult ingestBatch(List<FeedRecord> records) {
        if (records == null || records.isEmpty()) {
            throw new IngestionException("No records provided");
        }
        if (records.size() > MAX_BATCH_SIZE) {
            throw new IngestionException("Maximum " + MAX_BATCH_SIZE + " records per batch allowed");
        }

        List<IngestionResult> results = new ArrayList<>();
        for (FeedRecord record : records) {
            String sourceUrl = record != null ? record.getSourceUrl() : null;
            try {
                results.add(ingest(record));
            } catch (IngestionException e) {
                log.warn("⚠️ Rejected record {}: {}", sourceUrl, e.getMessage());
                results.add(IngestionResult.rejected(sourceUrl, e.getMessage()));
            }
        }

        BatchIngestionResult batch = BatchIngestionResult.of(results);
        log.info("📊 Batch ingestion: {} queued, {} duplicates, {} rejected",
                batch.getQueued(), batch.getDuplicates(), batch.getRejected());
        return batch;
    }
}
