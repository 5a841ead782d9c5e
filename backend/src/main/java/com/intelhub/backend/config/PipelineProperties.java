package com.intelhub.backend.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

@Component
@Validated
@ConfigurationProperties(prefix = "pipeline")
@Data
public class PipelineProperties {

    // Slack between the AI timeout and lease expiry for the terminal write
    public static final long LEASE_MARGIN_SECONDS = 30;

    // Initial archive threshold; operators can change it at runtime
    @DecimalMin(value = "0.0", inclusive = false)
    @DecimalMax("10.0")
    private double scoreThreshold = 6.0;

    @Min(1)
    private int maxAttempts = 3;

    @Min(1)
    private long leaseSeconds = 300;

    @Min(1)
    private long aiTimeoutSeconds = 120;

    // Retry backoff: min(base * 2^(attempts-1), max)
    @Min(0)
    private long backoffBaseSeconds = 30;
    @Min(0)
    private long backoffMaxSeconds = 1800;

    @Min(1)
    private int workerPoolSize = 4;

    private long pollIntervalMs = 5000;
    private long reapIntervalMs = 30000;

    @Min(1)
    private int dispatchBatchSize = 20;

    private String promptVersion = "v2.2";

    private boolean autoStart = true;

    /**
     * A lease that expires while the AI call is still running lets a second worker claim the item.
     */
    @AssertTrue(message = "pipeline.lease-seconds must exceed pipeline.ai-timeout-seconds by at least "
            + LEASE_MARGIN_SECONDS + " seconds")
    public boolean isLeaseLongerThanAiTimeout() {
        return leaseSeconds >= aiTimeoutSeconds + LEASE_MARGIN_SECONDS;
    }
}
