package com.bko.healthexport.export.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

public record WorkoutData(
        String type,
        String sourceApp,
        Instant startDate,
        Instant endDate,
        double duration,
        WorkoutStatistics statistics,
        List<HeartRateSample> heartRateSamples,
        List<RoutePoint> route,
        List<WorkoutEventData> events,
        List<ActivityData> activities
) {
    public WorkoutData {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(sourceApp, "sourceApp");
        Objects.requireNonNull(startDate, "startDate");
        Objects.requireNonNull(endDate, "endDate");
        Objects.requireNonNull(statistics, "statistics");
        if (endDate.isBefore(startDate)) {
            throw new IllegalArgumentException("Workout ends (" + endDate + ") before it starts (" + startDate + ")");
        }
        heartRateSamples = immutable(heartRateSamples);
        route = immutable(route);
        events = immutable(events);
        activities = immutable(activities);
    }

    private static <T> List<T> immutable(List<T> values) {
        return values == null ? List.of() : List.copyOf(values);
    }
}
