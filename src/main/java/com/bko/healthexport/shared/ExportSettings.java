package com.bko.healthexport.shared;

import java.nio.file.Path;

public record ExportSettings(String workoutId, String outputDirectory) {
    public static final String LATEST_WORKOUT = "latest";

    public boolean isRequested() {
        return hasText(workoutId);
    }

    public boolean isLatestRequested() {
        return isRequested() && LATEST_WORKOUT.equalsIgnoreCase(workoutId.trim());
    }

    public Path outputPath() {
        if (hasText(outputDirectory)) {
            return Path.of(outputDirectory.trim());
        }
        return Path.of(System.getProperty("java.io.tmpdir"));
    }

    private boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
