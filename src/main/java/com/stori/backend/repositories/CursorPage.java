package com.stori.backend.repositories;

import java.util.List;

/**
 * One page of a newest-first listing. {@code nextCursor} is opaque and {@code null} on the last page.
 */
public record CursorPage<T>(List<T> items, String nextCursor) {

    public CursorPage {
        items = items == null ? List.of() : List.copyOf(items);
    }

    public boolean hasMore() {
        return nextCursor != null;
    }
}
