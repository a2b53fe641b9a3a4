package com.bko.healthexport.export.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ActivityDataTest {
    private static final Instant START = Instant.parse("2024-03-07T08:20:00Z");

    @Test
    void rejectsEndBeforeStart() {
        assertThrows(IllegalArgumentException.class, () -> new ActivityData("running", START,
                START.minusSeconds(600), 600, WorkoutStatistics.none()));
    }

    @Test
    void acceptsZeroLengthActivity() {
        ActivityData activity = new ActivityData("other", START, START, 0, WorkoutStatistics.none());

        assertEquals(START, activity.endDate());
    }
}
