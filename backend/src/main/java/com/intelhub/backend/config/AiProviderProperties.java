package com.intelhub.backend.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "pipeline.ai")
@Data
public class AiProviderProperties {

    // Recorded in provenance and usage logs
    private String provider = "openai";
    private String chatModel = "gpt-4o-mini";
    private String embeddingModel = "text-embedding-3-small";
    private double temperature = 0.2;
}
