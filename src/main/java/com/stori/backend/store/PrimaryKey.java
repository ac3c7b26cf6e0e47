package com.stori.backend.store;

import java.util.Objects;

public record PrimaryKey(String partitionKey, String sortKey) {

    public PrimaryKey {
        Objects.requireNonNull(partitionKey, "partitionKey");
        Objects.requireNonNull(sortKey, "sortKey");
    }
}
