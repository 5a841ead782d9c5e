package com.intelhub.backend.ingestion;

import com.intelhub.backend.model.dto.BatchIngestionResult;
import com.intelhub.backend.model.dto.FeedRecord;
import com.intelhub.backend.model.dto.IngestionResult;
import jakarta.validation.constraints.NotNull;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@Slf4j
@Validated
@RestController
@RequestMapping("/api/intelligence")
@RequiredArgsConstructor
public class IngestionController {

    private final IngestionService ingestionService;

    /**
     * Endpoint for the feed gateway to submit one parsed record
     */
    @PostMapping("/collect")
    public ResponseEntity<IngestionResult> collect(@RequestBody @NotNull FeedRecord record) {
        IngestionResult result = ingestionService.ingest(record);
        HttpStatus status = result.getStatus() == IngestionResult.Status.QUEUED ? HttpStatus.ACCEPTED : HttpStatus.OK;
        return ResponseEntity.status(status).body(result);
    }

    /**
     * Endpoint for the feed gateway to submit up to 100 records at once
     */
    @PostMapping("/collect/batch")
    public ResponseEntity<BatchIngestionResult> collectBatch(@RequestBody @NotNull List<FeedRecord> records) {
        log.info("Received batch of {} records", records.size());
        return ResponseEntity.ok(ingestionService.ingestBatch(records));
    }
}
