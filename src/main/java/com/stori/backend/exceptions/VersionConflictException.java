package com.stori.backend.exceptions;

/**
 * Optimistic-concurrency loss on update. Callers re-fetch the record and resubmit.
 */
public class VersionConflictException extends ConflictException {

    private final String recordId;

    public VersionConflictException(String recordId) {
        super("Transaction " + recordId + " was modified by another process, please retry");
        this.recordId = recordId;
    }

    public String getRecordId() {
        return recordId;
    }
}
