package com.factorbot.writer;

/**
 * Outcome of one write phase. {@code failure} is set when a batch was rejected;
 * batches committed before it are still counted in {@code rowsWritten}.
 */
public final class WriteResult {
    public final int candidates;
    public final int rowsWritten;
    public final int duplicatesCollapsed;
    public final int batches;
    public final Exception failure;

    WriteResult(int candidates, int rowsWritten, int duplicatesCollapsed, int batches, Exception failure) {
        this.candidates = candidates;
        this.rowsWritten = rowsWritten;
        this.duplicatesCollapsed = duplicatesCollapsed;
        this.batches = batches;
        this.failure = failure;
    }

    public boolean failed() {
        return failure != null;
    }
}
