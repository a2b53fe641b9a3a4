package com.bko.healthexport.export.model;

import java.time.Instant;
import java.util.Objects;

public record ActivityData(
        String type,
        Instant startDate,
        Instant endDate,
        double duration,
        WorkoutStatistics statistics
) {
    public ActivityData {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(startDate, "startDate");
        Objects.requireNonNull(endDate, "endDate");
        Objects.requireNonNull(statistics, "statistics");
        if (endDate.isBefore(startDate)) {
            throw new IllegalArgumentException("Activity ends (" + endDate + ") before it starts (" + startDate + ")");
        }
    }
}
