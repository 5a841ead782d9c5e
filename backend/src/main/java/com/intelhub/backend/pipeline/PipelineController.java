package com.intelhub.backend.pipeline;

import com.intelhub.backend.vector.EmbeddingIndexer;
import java.time.LocalDateTime;
import java.util.Map;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Operator actions on the pipeline.
 */
@Slf4j
@RestController
@RequestMapping("/api/pipeline")
@RequiredArgsConstructor
public class PipelineController {

    private final StagingService stagingService;
    private final ThresholdSettings thresholdSettings;
    private final EmbeddingIndexer embeddingIndexer;
    private final PipelineStatisticsService statisticsService;
    private final PipelineDispatcher pipelineDispatcher;

    @PostMapping("/items/{uuid}/retry")
    public ResponseEntity<Map<String, Object>> retry(@PathVariable UUID uuid) {
        stagingService.operatorRetry(uuid);
        return ResponseEntity.ok(Map.of(
                "success", true,
                "uuid", uuid,
                "message", "Item re-queued for classification"
        ));
    }

    @GetMapping("/threshold")
    public ResponseEntity<Map<String, Object>> getThreshold() {
        return ResponseEntity.ok(Map.of("threshold", thresholdSettings.current()));
    }

    /**
     * Applies to attempts that start after the change
     */
    @PutMapping("/threshold")
    public ResponseEntity<Map<String, Object>> setThreshold(@RequestBody Map<String, Double> body) {
        Double threshold = body.get("threshold");
        if (threshold == null) {
            return ResponseEntity.badRequest().body(Map.of(
                    "success", false,
                    "error", "Missing threshold",
                    "message", "Body must contain a numeric 'threshold'"
            ));
        }
        double previous = thresholdSettings.update(threshold);
        return ResponseEntity.ok(Map.of(
                "success", true,
                "previous", previous,
                "threshold", thresholdSettings.current()
        ));
    }

    @PostMapping("/vector-index/rebuild")
    public ResponseEntity<Map<String, Object>> rebuildVectorIndex() {
        log.info("Vector index rebuild requested");
        Map<String, Object> result = embeddingIndexer.rebuildIndex();
        return ResponseEntity.ok(Map.of(
                "success", true,
                "result", result,
                "timestamp", LocalDateTime.now()
        ));
    }

    @PostMapping("/dispatcher/start")
    public ResponseEntity<Map<String, Object>> startDispatcher() {
        pipelineDispatcher.start();
        return ResponseEntity.ok(Map.of("success", true, "running", pipelineDispatcher.isRunning()));
    }

    /**
     * Stops claiming new items; attempts already running finish normally
     */
    @PostMapping("/dispatcher/stop")
    public ResponseEntity<Map<String, Object>> stopDispatcher() {
        pipelineDispatcher.stop();
        return ResponseEntity.ok(Map.of(
                "success", true,
                "running", pipelineDispatcher.isRunning(),
                "activeWorkers", pipelineDispatcher.getActiveWorkers()
        ));
    }

    @GetMapping("/stats")
    public ResponseEntity<Map<String, Object>> getStats() {
        return ResponseEntity.ok(statisticsService.getStats());
    }
}
