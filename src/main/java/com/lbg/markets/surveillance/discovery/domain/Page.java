package com.lbg.markets.surveillance.discovery.domain;

import java.util.List;

/**
 * One page of a keyset-paginated query. A null continuation token means the last page.
 */
public record Page<T>(List<T> items, String continuationToken) {
    public Page {
        items = items != null ? List.copyOf(items) : List.of();
    }

    public boolean hasMore() {
        return continuationToken != null;
    }
}
