package com.bko.healthexport.healthdata;

import javax.measure.Quantity;
import java.util.Optional;

public record QuantityStatistics(
        QuantityKind kind,
        Quantity<?> sumQuantity,
        Quantity<?> averageQuantity,
        Quantity<?> maximumQuantity
) {
    public static QuantityStatistics cumulative(QuantityKind kind, Quantity<?> sum) {
        return new QuantityStatistics(kind, sum, null, null);
    }

    public static QuantityStatistics discrete(QuantityKind kind, Quantity<?> average, Quantity<?> maximum) {
        return new QuantityStatistics(kind, null, average, maximum);
    }

    public Optional<Quantity<?>> sum() {
        return Optional.ofNullable(sumQuantity);
    }

    public Optional<Quantity<?>> average() {
        return Optional.ofNullable(averageQuantity);
    }

    public Optional<Quantity<?>> maximum() {
        return Optional.ofNullable(maximumQuantity);
    }
}
