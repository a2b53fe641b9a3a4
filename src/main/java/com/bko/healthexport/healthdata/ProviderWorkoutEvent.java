package com.bko.healthexport.healthdata;

import java.time.Instant;
import java.util.Objects;

public record ProviderWorkoutEvent(ProviderEventType type, Instant startDate, Instant endDate) {
    public ProviderWorkoutEvent {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(startDate, "startDate");
    }
}
