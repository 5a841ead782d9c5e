package com.intelhub.backend.pipeline;

import com.intelhub.backend.db.entity.ItemState;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Routes a classified item by its highest rating against a threshold snapshot.
 */
@Component
public class ArchiveRouter {

    /**
     * @param rates     dimension -> score; ties on the maximum go to the first dimension in iteration order
     * @param threshold threshold captured when the attempt started
     */
    public RoutingDecision route(Map<String, Double> rates, double threshold) {
        if (rates == null || rates.isEmpty()) {
            return new RoutingDecision(ItemState.LOW_VALUE, 0.0, null, threshold);
        }

        String maxRateClass = null;
        double maxRateScore = Double.NEGATIVE_INFINITY;
        for (Map.Entry<String, Double> entry : rates.entrySet()) {
            if (entry.getValue() != null && entry.getValue() > maxRateScore) {
                maxRateScore = entry.getValue();
                maxRateClass = entry.getKey();
            }
        }
        if (maxRateClass == null) {
            return new RoutingDecision(ItemState.LOW_VALUE, 0.0, null, threshold);
        }

        ItemState state = maxRateScore >= threshold ? ItemState.ARCHIVED : ItemState.LOW_VALUE;
        return new RoutingDecision(state, maxRateScore, maxRateClass, threshold);
    }
}
