package com.agilab.model_ingestion.data;

/**
 * Marker stored for a file that exists but holds no data rows.
 * Distinguishes an empty file from a missing one, which leaves no store entry at all.
 */
public enum EmptyDataset {
    INSTANCE;

    public static boolean isEmpty(Object data) {
        return data == INSTANCE;
    }

    @Override
    public String toString() {
        return "EmptyDataset";
    }
}
