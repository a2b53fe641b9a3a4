package com.bko.healthexport.export.model;

/**
 * Summary statistics of a workout or of one of its activities. A {@code null} field means the provider had
 * no samples of that quantity in the time range; a recorded zero is a present {@link StatValue} of 0.
 */
public record WorkoutStatistics(
        StatValue activeEnergyBurned,
        StatValue distance,
        StatValue stepCount,
        StatValue averageHeartRate,
        StatValue maxHeartRate,
        StatValue averageSpeed,
        StatValue averagePower
) {
    public static WorkoutStatistics none() {
        return new WorkoutStatistics(null, null, null, null, null, null, null);
    }
}
