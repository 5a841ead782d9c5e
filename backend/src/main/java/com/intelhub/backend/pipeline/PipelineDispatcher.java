package com.intelhub.backend.pipeline;

import com.intelhub.backend.config.PipelineProperties;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Semaphore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Component;

/**
 * Feeds claimable items to the classification pool without ever queueing more work than there
 * are workers, and reaps expired leases.
 */
@Slf4j
@Component
public class PipelineDispatcher {

    private final StagingService stagingService;
    private final ClassificationWorker classificationWorker;
    private final PipelineProperties pipelineProperties;
    private final ThreadPoolTaskExecutor classificationTaskExecutor;
    private final Semaphore permits;
    private final Set<UUID> inFlight = ConcurrentHashMap.newKeySet();

    private volatile boolean running = false;

    public PipelineDispatcher(StagingService stagingService,
                              ClassificationWorker classificationWorker,
                              PipelineProperties pipelineProperties,
                              @Qualifier("classificationTaskExecutor") ThreadPoolTaskExecutor classificationTaskExecutor) {
        this.stagingService = stagingService;
        this.classificationWorker = classificationWorker;
        this.pipelineProperties = pipelineProperties;
        this.classificationTaskExecutor = classificationTaskExecutor;
        this.permits = new Semaphore(pipelineProperties.getWorkerPoolSize());
    }

    public void start() {
        running = true;
        log.info("▶️ Pipeline dispatcher started with {} workers", pipelineProperties.getWorkerPoolSize());
    }

    public void stop() {
        running = false;
        log.info("⏸️ Pipeline dispatcher stopped");
    }

    public boolean isRunning() {
        return running;
    }

    public int getActiveWorkers() {
        return inFlight.size();
    }

    @Scheduled(fixedDelayString = "${pipeline.poll-interval-ms:5000}")
    public void dispatch() {
        if (!running) {
            return;
        }
        int free = permits.availablePermits();
        if (free == 0) {
            return;
        }

        List<UUID> claimable = stagingService.findClaimable(Math.min(free, pipelineProperties.getDispatchBatchSize()));
        int submitted = 0;
        for (UUID uuid : claimable) {
            if (!inFlight.add(uuid)) {
                continue;
            }
            if (!permits.tryAcquire()) {
                inFlight.remove(uuid);
                break;
            }
            try {
                classificationTaskExecutor.execute(() -> runWorker(uuid));
                submitted++;
            } catch (TaskRejectedException e) {
                inFlight.remove(uuid);
                permits.release();
                log.warn("⚠️ Classification pool rejected item {}, retrying next poll", uuid);
                break;
            }
        }
        if (submitted > 0) {
            log.debug("Dispatched {} items ({} in flight)", submitted, inFlight.size());
        }
    }

    @Scheduled(fixedDelayString = "${pipeline.reap-interval-ms:30000}")
    public void reapExpiredLeases() {
        if (!running) {
            return;
        }
        stagingService.releaseExpiredLeases(LocalDateTime.now());
    }

    private void runWorker(UUID uuid) {
        try {
            ClassificationWorker.Outcome outcome = classificationWorker.process(uuid);
            log.debug("Item {} -> {}", uuid, outcome);
        } catch (RuntimeException e) {
            log.error("❌ Worker crashed on item {}: {}", uuid, e.getMessage(), e);
        } finally {
            inFlight.remove(uuid);
            permits.release();
        }
    }
}
