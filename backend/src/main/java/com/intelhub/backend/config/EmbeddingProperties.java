package com.intelhub.backend.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "pipeline.embedding")
@Data
public class EmbeddingProperties {

    // Which spans get embedded for archived items
    private boolean inSummary = true;
    private boolean inFulltext = false;

    // Texts longer than this are truncated before embedding
    private int maxTextLength = 8000;
}
