package com.bko.healthexport.export.model;

import java.time.Instant;
import java.util.Objects;

public record RoutePoint(
        double latitude,
        double longitude,
        double altitude,
        Instant timestamp,
        Double horizontalAccuracy,
        Double speed
) {
    public RoutePoint {
        Objects.requireNonNull(timestamp, "timestamp");
    }
}
