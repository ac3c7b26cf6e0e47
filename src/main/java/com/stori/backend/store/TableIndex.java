package com.stori.backend.store;

/**
 * Physical indexes of the single table. The primary index has no name on the wire.
 */
public enum TableIndex {

    PRIMARY(null, "PK", "SK"),
    BY_MONTH("GSI1", "GSI1PK", "GSI1SK"),
    BY_CATEGORY("GSI2", "GSI2PK", "GSI2SK"),
    BY_ID("GSI3", "GSI3PK", "GSI3SK");

    private final String indexName;
    private final String partitionAttribute;
    private final String sortAttribute;

    TableIndex(String indexName, String partitionAttribute, String sortAttribute) {
        this.indexName = indexName;
        this.partitionAttribute = partitionAttribute;
        this.sortAttribute = sortAttribute;
    }

    public String indexName() {
        return indexName;
    }

    public String partitionAttribute() {
        return partitionAttribute;
    }

    public String sortAttribute() {
        return sortAttribute;
    }

    public boolean isPrimary() {
        return this == PRIMARY;
    }
}
