package com.stori.backend.exceptions;

/**
 * A batch chunk still had unprocessed items after the last retry. Chunks written before it stay committed.
 */
public class BatchWriteFailedException extends RuntimeException {

    private final int chunkStart;
    private final int chunkEnd;
    private final int unprocessedCount;

    public BatchWriteFailedException(int chunkStart, int chunkEnd, int unprocessedCount, int attempts, Throwable cause) {
        super(String.format(
                "Failed to write batch %d-%d: %d items unprocessed after %d attempts",
                chunkStart, chunkEnd, unprocessedCount, attempts), cause);
        this.chunkStart = chunkStart;
        this.chunkEnd = chunkEnd;
        this.unprocessedCount = unprocessedCount;
    }

    /** Index of the first input item of the failed chunk, inclusive. */
    public int getChunkStart() {
        return chunkStart;
    }

    /** Index after the last input item of the failed chunk. */
    public int getChunkEnd() {
        return chunkEnd;
    }

    public int getUnprocessedCount() {
        return unprocessedCount;
    }
}
