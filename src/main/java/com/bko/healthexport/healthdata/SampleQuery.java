package com.bko.healthexport.healthdata;

import java.time.Instant;
import java.util.Objects;

public record SampleQuery(QuantityKind kind, Instant start, Instant end, SortOrder order, int limit) {

    public enum SortOrder {
        ASCENDING,
        DESCENDING
    }

    public SampleQuery {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
        Objects.requireNonNull(order, "order");
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive: " + limit);
        }
    }
}
