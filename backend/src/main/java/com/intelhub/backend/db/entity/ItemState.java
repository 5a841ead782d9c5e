package com.intelhub.backend.db.entity;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of an intelligence item inside the pipeline.
 * <p>
 * PENDING -> ANALYZING -> {ARCHIVED | LOW_VALUE | FAILED}, FAILED -> ANALYZING while attempts remain.
 * ARCHIVED and LOW_VALUE are terminal.
 */
public enum ItemState {
    PENDING,
    ANALYZING,
    ARCHIVED,
    LOW_VALUE,
    FAILED;

    public Set<ItemState> allowedTargets() {
        return switch (this) {
            case PENDING, FAILED -> EnumSet.of(ANALYZING);
            case ANALYZING -> EnumSet.of(ARCHIVED, LOW_VALUE, FAILED);
            case ARCHIVED, LOW_VALUE -> EnumSet.noneOf(ItemState.class);
        };
    }

    public boolean canTransitionTo(ItemState target) {
        return allowedTargets().contains(target);
    }
}
