package com.bko.healthexport.shared;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ExportSettingsTest {

    @Test
    void latestIsRecognizedIgnoringCaseAndWhitespace() {
        ExportSettings settings = new ExportSettings(" Latest ", null);

        assertTrue(settings.isRequested());
        assertTrue(settings.isLatestRequested());
    }

    @Test
    void workoutIdIsNotLatest() {
        ExportSettings settings = new ExportSettings("6f1c1f4e-8a3c-4b59-9d2b-0d6f1b3a9a01", null);

        assertTrue(settings.isRequested());
        assertFalse(settings.isLatestRequested());
    }

    @Test
    void blankWorkoutIdIsNoRequest() {
        assertFalse(new ExportSettings("  ", null).isRequested());
        assertFalse(new AppSettings(new HealthDataSettings(null), new ExportSettings(null, null)).isExportRequested());
    }

    @Test
    void outputPathFallsBackToTemporaryDirectory() {
        assertEquals(Path.of(System.getProperty("java.io.tmpdir")), new ExportSettings("latest", " ").outputPath());
        assertEquals(Path.of("/exports"), new ExportSettings("latest", "/exports").outputPath());
    }
}
