package com.intelhub.backend.db.entity;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Set;

/**
 * The three named collections exposed to import/export and queries.
 * Backed by one table; the partition is selected by item state.
 */
public enum Partition {
    CACHED("cached", EnumSet.of(ItemState.PENDING, ItemState.ANALYZING, ItemState.FAILED), ItemState.PENDING),
    ARCHIVED("archived", EnumSet.of(ItemState.ARCHIVED), ItemState.ARCHIVED),
    LOW_VALUE("low_value", EnumSet.of(ItemState.LOW_VALUE), ItemState.LOW_VALUE);

    private final String collectionName;
    private final Set<ItemState> states;
    private final ItemState importState;

    Partition(String collectionName, Set<ItemState> states, ItemState importState) {
        this.collectionName = collectionName;
        this.states = states;
        this.importState = importState;
    }

    public String getCollectionName() {
        return collectionName;
    }

    public Set<ItemState> getStates() {
        return states;
    }

    /**
     * State given to documents imported into this collection.
     */
    public ItemState getImportState() {
        return importState;
    }

    public static Partition fromCollectionName(String name) {
        return Arrays.stream(values())
                .filter(p -> p.collectionName.equalsIgnoreCase(name) || p.name().equalsIgnoreCase(name))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown collection: " + name));
    }
}
