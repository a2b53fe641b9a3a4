package com.bko.healthexport.healthdata;

import java.time.Instant;

/**
 * A recorded location. The provider reports a negative {@code horizontalAccuracy} or {@code speed}
 * when that value is unavailable.
 */
public record ProviderLocation(
        double latitude,
        double longitude,
        double altitude,
        Instant timestamp,
        double horizontalAccuracy,
        double speed
) {
}
