package com.stori.backend.repositories.store;

import java.time.Duration;
import java.util.List;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import com.stori.backend.config.StoreProperties;
import com.stori.backend.exceptions.BatchWriteFailedException;
import com.stori.backend.store.DocumentStore;
import com.stori.backend.store.Item;
import com.stori.backend.store.StoreException;
import com.stori.backend.store.TransientStoreException;

import lombok.extern.slf4j.Slf4j;

/**
 * Chunked bulk writer. Each chunk is retried with linear backoff, resubmitting only the items the
 * store reported as unprocessed (or the whole pending remainder after a transient failure).
 * Chunks that completed before a failing one are not rolled back.
 */
@Slf4j
@Component
public class BatchItemWriter {

    @FunctionalInterface
    interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }

    private final DocumentStore store;
    private final int batchSize;
    private final int maxAttempts;
    private final Duration backoff;
    private final Sleeper sleeper;

    @Autowired
    public BatchItemWriter(DocumentStore store, StoreProperties properties) {
        this(store, properties.batchSize(), properties.batchMaxRetries(), properties.batchBackoff(),
                duration -> Thread.sleep(duration.toMillis()));
    }

    BatchItemWriter(DocumentStore store, int batchSize, int maxAttempts, Duration backoff, Sleeper sleeper) {
        this.store = store;
        this.batchSize = batchSize;
        this.maxAttempts = maxAttempts;
        this.backoff = backoff;
        this.sleeper = sleeper;
    }

    /**
     * @return number of items written
     */
    public int writeAll(List<Item> items) {
        for (int start = 0; start < items.size(); start += batchSize) {
            int end = Math.min(start + batchSize, items.size());
            writeChunk(items.subList(start, end), start, end);
            log.info("Successfully wrote batch {}-{} ({} items)", start, end - 1, end - start);
        }
        return items.size();
    }

    private void writeChunk(List<Item> chunk, int start, int end) {
        List<Item> pending = chunk;
        StoreException lastError = null;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                pending = store.batchWrite(pending);
                lastError = null;
            } catch (TransientStoreException e) {
                lastError = e;
                log.warn("Batch {}-{} attempt {} failed transiently: {}", start, end - 1, attempt, e.getMessage());
            } catch (StoreException e) {
                throw new BatchWriteFailedException(start, end, pending.size(), attempt, e);
            }

            if (pending.isEmpty()) {
                return;
            }
            if (attempt < maxAttempts) {
                log.info("Batch {}-{}: retrying {} unprocessed items", start, end - 1, pending.size());
                pause(backoff.multipliedBy(attempt), start, end, pending.size(), attempt);
            }
        }

        throw new BatchWriteFailedException(start, end, pending.size(), maxAttempts, lastError);
    }

    private void pause(Duration duration, int start, int end, int pendingCount, int attempt) {
        try {
            sleeper.sleep(duration);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BatchWriteFailedException(start, end, pendingCount, attempt, e);
        }
    }
}
