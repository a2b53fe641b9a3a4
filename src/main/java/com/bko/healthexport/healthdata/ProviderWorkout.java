package com.bko.healthexport.healthdata;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

public record ProviderWorkout(
        UUID id,
        ProviderActivityType activityType,
        String sourceName,
        Instant startDate,
        Instant endDate,
        double duration,
        List<ProviderWorkoutEvent> events,
        List<ProviderWorkoutActivity> activities
) {
    public ProviderWorkout {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(activityType, "activityType");
        Objects.requireNonNull(sourceName, "sourceName");
        Objects.requireNonNull(startDate, "startDate");
        Objects.requireNonNull(endDate, "endDate");
        activities = activities == null ? List.of() : List.copyOf(activities);
        events = events == null ? null : List.copyOf(events);
    }
}
