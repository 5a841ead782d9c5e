package com.intelhub.backend.pipeline;

import com.intelhub.backend.config.PipelineProperties;
import com.intelhub.backend.exception.ValidationException;
import java.util.concurrent.atomic.AtomicReference;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Operator-settable archive threshold. Workers read it once per attempt; changing it never
 * touches items that were already routed.
 */
@Slf4j
@Component
public class ThresholdSettings {

    private final AtomicReference<Double> current;

    public ThresholdSettings(PipelineProperties pipelineProperties) {
        this.current = new AtomicReference<>(validate(pipelineProperties.getScoreThreshold()));
    }

    public double current() {
        return current.get();
    }

    public double update(double threshold) {
        double previous = current.getAndSet(validate(threshold));
        log.info("🎚️ Archive threshold changed: {} -> {}", previous, threshold);
        return previous;
    }

    private static double validate(double threshold) {
        if (Double.isNaN(threshold) || threshold <= 0 || threshold > 10) {
            throw new ValidationException("threshold", threshold, "Threshold must be greater than 0 and at most 10");
        }
        return threshold;
    }
}
