package com.stori.backend.store;

import java.util.Map;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Single-partition query against the primary index or one of the secondary indexes.
 */
@Value
@Builder
public class QuerySpec {

    @NonNull
    @Builder.Default
    TableIndex index = TableIndex.PRIMARY;

    @NonNull
    String partitionKey;

    /** Optional; all items of the partition match when absent. */
    SortKeyCondition sortKeyCondition;

    /** Maximum number of items evaluated for this page. */
    int limit;

    /** Last evaluated key of the previous page, as returned in {@link QueryPage#getLastEvaluatedKey()}. */
    Map<String, String> exclusiveStartKey;

    @Builder.Default
    boolean scanForward = true;

    /** Strongly consistent read. Only honoured on the primary index; secondary indexes are eventually consistent. */
    boolean consistentRead;
}
