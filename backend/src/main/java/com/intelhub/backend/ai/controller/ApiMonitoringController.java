package com.intelhub.backend.ai.controller;

import com.intelhub.backend.ai.entity.AiUsageLog;
import com.intelhub.backend.ai.service.AiUsageMonitoringService;
import com.intelhub.backend.pipeline.PipelineStatisticsService;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@Slf4j
@Validated
@RestController
@RequestMapping("/api/monitoring")
@RequiredArgsConstructor
public class ApiMonitoringController {

    private final AiUsageMonitoringService monitoringService;
    private final PipelineStatisticsService statisticsService;

    /**
     * AI calls, tokens and failures per operation
     */
    @GetMapping("/ai-usage")
    public ResponseEntity<Map<String, Object>> getAiUsage() {
        return ResponseEntity.ok(monitoringService.getUsageStats());
    }

    /**
     * Get failed AI operations, newest first
     */
    @GetMapping("/ai-usage/failures")
    public ResponseEntity<List<AiUsageLog>> getFailedOperations(
            @RequestParam(defaultValue = "50") @Min(1) @Max(500) int limit) {
        return ResponseEntity.ok(monitoringService.getRecentFailures(limit));
    }

    /**
     * Archived item count per integer max score over an archive period (default: last 7 days)
     */
    @GetMapping("/score-distribution")
    public ResponseEntity<Map<String, Object>> getScoreDistribution(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime start,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime end) {
        LocalDateTime to = end != null ? end : LocalDateTime.now();
        LocalDateTime from = start != null ? start : to.minusDays(7);
        return ResponseEntity.ok(statisticsService.getScoreDistribution(from, to));
    }
}
