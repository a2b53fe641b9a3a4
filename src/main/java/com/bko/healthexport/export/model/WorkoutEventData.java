package com.bko.healthexport.export.model;

import java.time.Instant;
import java.util.Objects;

public record WorkoutEventData(String type, Instant startDate, Instant endDate) {
    public WorkoutEventData {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(startDate, "startDate");
    }
}
