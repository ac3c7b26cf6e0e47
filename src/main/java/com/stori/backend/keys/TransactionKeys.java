package com.stori.backend.keys;

import com.stori.backend.store.PrimaryKey;

/**
 * Every key attribute a transaction record carries: the primary pair plus one pair per secondary index.
 */
public record TransactionKeys(
        String pk,
        String sk,
        String monthPk,
        String monthSk,
        String categoryPk,
        String categorySk,
        String idPk,
        String idSk
) {

    public PrimaryKey primaryKey() {
        return new PrimaryKey(pk, sk);
    }
}
