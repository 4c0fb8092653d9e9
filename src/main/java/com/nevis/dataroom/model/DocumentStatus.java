package com.nevis.dataroom.model;

/**
 * Forward-only lifecycle of a document inside one indexing run.
 * {@link #FAILED} is terminal for the run; the failing stage is kept on the record.
 */
public enum DocumentStatus {
    DISCOVERED,
    NORMALIZED,
    RASTERIZED,
    SUMMARIZED,
    FAILED;

    public boolean isAtLeast(DocumentStatus other) {
        return this != FAILED && other != FAILED && ordinal() >= other.ordinal();
    }
}
