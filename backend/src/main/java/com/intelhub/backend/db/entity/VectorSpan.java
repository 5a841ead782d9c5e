package com.intelhub.backend.db.entity;

/**
 * Which text an embedding was computed from.
 */
public enum VectorSpan {
    SUMMARY,
    FULLTEXT
}
