package com.stori.backend.store;

import java.util.List;
import java.util.Map;

import lombok.Value;

@Value
public class QueryPage {

    List<Item> items;

    /** {@code null} when the query reached the end of the partition. */
    Map<String, String> lastEvaluatedKey;

    public boolean hasMore() {
        return lastEvaluatedKey != null && !lastEvaluatedKey.isEmpty();
    }
}
