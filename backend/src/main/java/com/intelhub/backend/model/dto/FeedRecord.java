package com.intelhub.backend.model.dto;

import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * An already-parsed record handed over by the feed gateway.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FeedRecord {
    private String sourceUrl;
    private String title;
    private LocalDateTime publishedAt;
    private String rawContent;
}
