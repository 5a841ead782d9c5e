package com.intelhub.backend.ai.service;

import com.intelhub.backend.ai.entity.AiUsageLog;
import com.intelhub.backend.ai.repository.AiUsageLogRepository;
import com.intelhub.backend.config.AiProviderProperties;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

/**
 * Meters the AI budget: every provider call is recorded, successful or not.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AiUsageMonitoringService {

    private final AiUsageLogRepository aiUsageLogRepository;
    private final AiProviderProperties aiProviderProperties;

    public void record(AiUsageLog.Operation operation, String model, UUID itemUuid, int tokenCount,
                       boolean success, String errorMessage) {
        try {
            aiUsageLogRepository.save(AiUsageLog.builder()
                    .provider(aiProviderProperties.getProvider())
                    .model(model)
                    .operation(operation)
                    .itemUuid(itemUuid)
                    .tokenCount(tokenCount)
                    .success(success)
                    .errorMessage(errorMessage)
                    .build());
        } catch (RuntimeException e) {
            log.error("Failed to log AI usage for {} {}: {}", operation, itemUuid, e.getMessage());
        }
    }

    /**
     * Calls, tokens and failures per operation over the last hour and day
     */
    public Map<String, Object> getUsageStats() {
        LocalDateTime now = LocalDateTime.now();
        LocalDateTime oneHourAgo = now.minusHours(1);
        LocalDateTime oneDayAgo = now.minusDays(1);

        Map<String, Object> operationStats = new LinkedHashMap<>();
        for (AiUsageLog.Operation operation : AiUsageLog.Operation.values()) {
            operationStats.put(operation.name(), Map.of(
                    "hourlyRequests", orZero(aiUsageLogRepository.countOperationUsageSince(operation, oneHourAgo)),
                    "hourlyTokens", orZero(aiUsageLogRepository.sumTokensByOperationSince(operation, oneHourAgo)),
                    "hourlyFailures", orZero(aiUsageLogRepository.countOperationFailuresSince(operation, oneHourAgo)),
                    "dailyRequests", orZero(aiUsageLogRepository.countOperationUsageSince(operation, oneDayAgo)),
                    "dailyTokens", orZero(aiUsageLogRepository.sumTokensByOperationSince(operation, oneDayAgo)),
                    "dailyFailures", orZero(aiUsageLogRepository.countOperationFailuresSince(operation, oneDayAgo))
            ));
        }

        return Map.of(
                "provider", aiProviderProperties.getProvider(),
                "chatModel", aiProviderProperties.getChatModel(),
                "embeddingModel", aiProviderProperties.getEmbeddingModel(),
                "operationStatistics", operationStats,
                "timestamp", now
        );
    }

    public List<AiUsageLog> getRecentFailures(int limit) {
        return aiUsageLogRepository.findFailedOperations(PageRequest.of(0, Math.max(1, limit)));
    }

    public static int estimateTokenCount(String text) {
        // Rough estimation: 1 token ≈ 4 characters
        return text == null ? 0 : Math.max(1, text.length() / 4);
    }

    private static long orZero(Long value) {
        return value != null ? value : 0L;
    }
}
