package com.intelhub.backend.pipeline;

import com.intelhub.backend.ai.classification.ClassificationOutcome;
import com.intelhub.backend.ai.classification.ClassificationRequest;
import com.intelhub.backend.ai.classification.ClassificationResult;
import com.intelhub.backend.ai.classification.IntelligenceClassifier;
import com.intelhub.backend.config.AiProviderProperties;
import com.intelhub.backend.config.PipelineProperties;
import com.intelhub.backend.db.entity.IntelligenceItem;
import com.intelhub.backend.db.entity.ItemState;
import com.intelhub.backend.db.repository.IntelligenceItemRepository;
import com.intelhub.backend.exception.AiProviderException;
import com.intelhub.backend.exception.StorageConflictException;
import com.intelhub.backend.vector.EmbeddingIndexer;
import java.lang.management.ManagementFactory;
import java.time.LocalDate;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Service;

/**
 * Runs one classification attempt for one item: claim, classify, route, complete.
 * Any failure before the terminal write leaves the item untouched apart from the failed attempt.
 */
@Slf4j
@Service
public class ClassificationWorker {

    public enum Outcome {
        SKIPPED,
        ARCHIVED,
        LOW_VALUE,
        FAILED,
        CONFLICT
    }

    private final StagingService stagingService;
    private final IntelligenceItemRepository itemRepository;
    private final IntelligenceClassifier classifier;
    private final ArchiveRouter archiveRouter;
    private final IntelligenceScoringEngine scoringEngine;
    private final ThresholdSettings thresholdSettings;
    private final PipelineProperties pipelineProperties;
    private final AiProviderProperties aiProviderProperties;
    private final EmbeddingIndexer embeddingIndexer;
    private final ThreadPoolTaskExecutor aiTaskExecutor;
    private final String workerId;

    public ClassificationWorker(StagingService stagingService,
                                IntelligenceItemRepository itemRepository,
                                IntelligenceClassifier classifier,
                                ArchiveRouter archiveRouter,
                                IntelligenceScoringEngine scoringEngine,
                                ThresholdSettings thresholdSettings,
                                PipelineProperties pipelineProperties,
                                AiProviderProperties aiProviderProperties,
                                EmbeddingIndexer embeddingIndexer,
                                @Qualifier("aiTaskExecutor") ThreadPoolTaskExecutor aiTaskExecutor) {
        this.stagingService = stagingService;
        this.itemRepository = itemRepository;
        this.classifier = classifier;
        this.archiveRouter = archiveRouter;
        this.scoringEngine = scoringEngine;
        this.thresholdSettings = thresholdSettings;
        this.pipelineProperties = pipelineProperties;
        this.aiProviderProperties = aiProviderProperties;
        this.embeddingIndexer = embeddingIndexer;
        this.aiTaskExecutor = aiTaskExecutor;
        // pid@host
        this.workerId = ManagementFactory.getRuntimeMXBean().getName();
    }

    public Outcome process(UUID uuid) {
        String owner = workerId + "/" + Thread.currentThread().getName();
        if (!stagingService.claim(uuid, owner)) {
            log.debug("Item {} already claimed or not due, skipping", uuid);
            return Outcome.SKIPPED;
        }

        // Routing uses the threshold as of the start of this attempt
        double threshold = thresholdSettings.current();

        try {
            IntelligenceItem item = itemRepository.findById(uuid)
                    .orElseThrow(() -> new StorageConflictException(uuid, "Claimed item " + uuid + " disappeared"));

            ClassificationRequest request = ClassificationRequest.builder()
                    .uuid(uuid)
                    .text(item.classificationText())
                    .referenceDate(item.getPubTime() != null ? item.getPubTime().toLocalDate() : LocalDate.now())
                    .promptVersion(pipelineProperties.getPromptVersion())
                    .build();

            ClassificationOutcome outcome;
            try {
                outcome = classifyWithTimeout(request);
            } catch (AiProviderException e) {
                return failAttempt(uuid, owner, e.getMessage());
            }
            if (!outcome.isValid()) {
                return failAttempt(uuid, owner, "Invalid AI output: " + outcome.getError());
            }

            ClassificationResult result = outcome.getResult();
            RoutingDecision decision = archiveRouter.route(result.getRates(), threshold);
            double weightedScore = scoringEngine.score(result.getRates(), result.getTaxonomy());
            try {
                stagingService.complete(uuid, owner, result, decision, weightedScore);
            } catch (DataAccessException e) {
                // The terminal write rolled back; the item is still ours in ANALYZING
                log.error("❌ Storing classification of item {} failed: {}", uuid, e.getMessage());
                return failAttempt(uuid, owner, "Storage error: " + e.getMostSpecificCause().getMessage());
            }

            if (decision.getState() == ItemState.ARCHIVED) {
                embeddingIndexer.indexAsync(uuid);
                return Outcome.ARCHIVED;
            }
            return Outcome.LOW_VALUE;

        } catch (StorageConflictException e) {
            log.error("🚨 CRITICAL item {} abandoned by {}: {}", uuid, owner, e.getMessage());
            return Outcome.CONFLICT;
        }
    }

    private ClassificationOutcome classifyWithTimeout(ClassificationRequest request) {
        long timeoutSeconds = pipelineProperties.getAiTimeoutSeconds();
        Future<ClassificationOutcome> future = aiTaskExecutor.submit(() -> classifier.classify(request));
        try {
            return future.get(timeoutSeconds, TimeUnit.SECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new AiProviderException(aiProviderProperties.getProvider(),
                    "AI call timed out after " + timeoutSeconds + "s", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof AiProviderException providerException) {
                throw providerException;
            }
            throw new AiProviderException(aiProviderProperties.getProvider(),
                    "AI call failed: " + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new AiProviderException(aiProviderProperties.getProvider(), "Interrupted while waiting for AI", e);
        }
    }

    private Outcome failAttempt(UUID uuid, String owner, String error) {
        stagingService.fail(uuid, owner, error);
        return Outcome.FAILED;
    }
}
