package com.intelhub.backend.transfer;

import java.util.Locale;

public enum TransferFormat {
    // One JSON document per line
    JSONL,
    // A single JSON array
    ARRAY;

    public static TransferFormat from(String value) {
        if (value == null || value.isBlank()) {
            return JSONL;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "jsonl", "ndjson" -> JSONL;
            case "array", "json" -> ARRAY;
            default -> throw new IllegalArgumentException("Unknown format: " + value);
        };
    }
}
