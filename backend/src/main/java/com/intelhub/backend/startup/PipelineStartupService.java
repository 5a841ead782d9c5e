package com.intelhub.backend.startup;

import com.intelhub.backend.config.PipelineProperties;
import com.intelhub.backend.pipeline.PipelineDispatcher;
import com.intelhub.backend.pipeline.ThresholdSettings;
import com.intelhub.backend.vector.VectorIndex;
import java.time.LocalDateTime;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class PipelineStartupService {

    private final VectorIndex vectorIndex;
    private final PipelineDispatcher pipelineDispatcher;
    private final PipelineProperties pipelineProperties;
    private final ThresholdSettings thresholdSettings;

    /**
     * Loads stored vectors, then lets the dispatcher start claiming work
     */
    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        log.info("🌟 ===== INTEL HUB PIPELINE STARTUP =====");
        log.info("📅 Start Time: {}", LocalDateTime.now());

        int loaded = vectorIndex.load();
        log.info("🧭 Vector index loaded with {} items", loaded);
        log.info("⚖️ Archive threshold: {}", thresholdSettings.current());

        if (!pipelineProperties.isAutoStart()) {
            log.info("🔕 Pipeline auto-start disabled via configuration");
            return;
        }
        pipelineDispatcher.start();
    }
}
