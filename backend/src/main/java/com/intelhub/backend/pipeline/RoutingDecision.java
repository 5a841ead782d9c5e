package com.intelhub.backend.pipeline;

import com.intelhub.backend.db.entity.ItemState;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

@Getter
@ToString
@AllArgsConstructor
public class RoutingDecision {
    private final ItemState state;
    private final double maxRateScore;
    // Null when there were no ratings
    private final String maxRateClass;
    private final double threshold;
}
