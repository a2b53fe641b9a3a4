package com.bko.healthexport.healthdata;

import java.time.Instant;
import java.util.Objects;

public record ProviderWorkoutActivity(
        ProviderActivityType activityType,
        Instant startDate,
        Instant endDate,
        double duration
) {
    public ProviderWorkoutActivity {
        Objects.requireNonNull(activityType, "activityType");
        Objects.requireNonNull(startDate, "startDate");
    }
}
