package com.bko.healthexport.healthdata;

import javax.measure.Quantity;
import java.time.Instant;
import java.util.Objects;

public record QuantitySample(QuantityKind kind, Instant startDate, Instant endDate, Quantity<?> quantity) {
    public QuantitySample {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(startDate, "startDate");
        Objects.requireNonNull(quantity, "quantity");
    }
}
