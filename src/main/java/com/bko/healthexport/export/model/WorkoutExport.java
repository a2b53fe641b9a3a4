package com.bko.healthexport.export.model;

import java.time.Instant;
import java.util.Objects;

/**
 * The exported document. {@code exportVersion} is the compatibility contract with consumers: it changes
 * whenever a field of any nested record is added, removed or retyped.
 *
 * @param exportDate when the document was generated, not when the workout took place
 */
public record WorkoutExport(String exportVersion, Instant exportDate, WorkoutData workout) {
    public static final String CURRENT_VERSION = "1.0";

    public WorkoutExport {
        Objects.requireNonNull(exportVersion, "exportVersion");
        Objects.requireNonNull(exportDate, "exportDate");
        Objects.requireNonNull(workout, "workout");
    }
}
