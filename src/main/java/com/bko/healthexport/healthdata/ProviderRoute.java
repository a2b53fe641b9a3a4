package com.bko.healthexport.healthdata;

import java.time.Instant;
import java.util.UUID;

public record ProviderRoute(UUID id, UUID workoutId, Instant startDate) {
}
