package com.bko.healthexport.export.app;

import com.bko.healthexport.export.ExportDocument;
import com.bko.healthexport.export.ExportSerializationException;
import com.bko.healthexport.export.model.ActivityData;
import com.bko.healthexport.export.model.HeartRateSample;
import com.bko.healthexport.export.model.RoutePoint;
import com.bko.healthexport.export.model.StatValue;
import com.bko.healthexport.export.model.WorkoutData;
import com.bko.healthexport.export.model.WorkoutEventData;
import com.bko.healthexport.export.model.WorkoutExport;
import com.bko.healthexport.export.model.WorkoutStatistics;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ExportDocumentSerializerTest {
    private static final Instant START = Instant.parse("2024-03-07T08:15:00Z");
    private static final Instant END = Instant.parse("2024-03-07T08:45:00Z");
    private static final Instant NOW = Instant.parse("2024-03-08T12:00:00Z");

    private final ExportDocumentSerializer serializer = new ExportDocumentSerializer(Clock.fixed(NOW, ZoneOffset.UTC));
    private final ObjectMapper reader = new ObjectMapper();

    @Test
    void namesFileAfterTypeAndStartDay() throws Exception {
        ExportDocument document = serializer.serialize(export(minimalWorkout("running", START)));

        assertEquals("workout-running-2024-03-07.json", document.filename());
    }

    @Test
    void startDayFollowsTheClockZone() {
        ExportDocumentSerializer berlin = new ExportDocumentSerializer(Clock.fixed(NOW, ZoneId.of("Europe/Berlin")));
        Instant lateEvening = Instant.parse("2024-03-07T23:30:00Z");

        assertEquals("workout-strength_training-2024-03-08.json",
                berlin.filename(export(minimalWorkout("strength_training", lateEvening))));
    }

    @Test
    void writesKeysInLexicographicOrder() throws Exception {
        JsonNode root = reader.readTree(serializer.serialize(export(fullWorkout())).content());

        assertSorted(root);
        assertEquals(List.of("exportDate", "exportVersion", "workout"), fieldNames(root));
        assertEquals(List.of("activities", "duration", "endDate", "events", "heartRateSamples", "route",
                "sourceApp", "startDate", "statistics", "type"), fieldNames(root.get("workout")));
    }

    @Test
    void writesInstantsAsIsoStrings() throws Exception {
        JsonNode root = reader.readTree(serializer.serialize(export(fullWorkout())).content());

        assertEquals("1.0", root.get("exportVersion").asText());
        assertEquals("2024-03-08T12:00:00Z", root.get("exportDate").asText());
        assertEquals("2024-03-07T08:15:00Z", root.get("workout").get("startDate").asText());
        assertEquals("2024-03-07T08:16:00Z", root.get("workout").get("heartRateSamples").get(0).get("date").asText());
    }

    @Test
    void omitsAbsentValuesButKeepsEmptyLists() throws Exception {
        JsonNode root = reader.readTree(serializer.serialize(export(minimalWorkout("running", START))).content());
        JsonNode workout = root.get("workout");

        assertEquals(0, workout.get("statistics").size());
        assertTrue(workout.get("route").isArray());
        assertEquals(0, workout.get("route").size());
        assertEquals(0, workout.get("events").size());
        assertEquals(0, workout.get("activities").size());

        JsonNode full = reader.readTree(serializer.serialize(export(fullWorkout())).content()).get("workout");
        assertFalse(full.get("events").get(0).has("endDate"));
        assertFalse(full.get("route").get(0).has("speed"));
        assertEquals(4.5, full.get("route").get(0).get("horizontalAccuracy").asDouble());
        assertFalse(full.get("statistics").has("averagePower"));
        assertEquals("kcal", full.get("statistics").get("activeEnergyBurned").get("unit").asText());
    }

    @Test
    void indentsOutput() throws Exception {
        String json = new String(serializer.serialize(export(minimalWorkout("running", START))).content(),
                StandardCharsets.UTF_8);

        assertTrue(json.contains("\n"));
    }

    @Test
    void decodesWhatItEncodes() throws Exception {
        WorkoutExport export = export(fullWorkout());

        WorkoutExport decoded = serializer.deserialize(serializer.serialize(export).content());

        assertEquals(export, decoded);
    }

    @Test
    void rejectsMalformedDocument() {
        byte[] truncated = "{\"exportVersion\" : \"1.0\", \"workout\" : {".getBytes(StandardCharsets.UTF_8);

        assertThrows(ExportSerializationException.class, () -> serializer.deserialize(truncated));
    }

    private static WorkoutExport export(WorkoutData workout) {
        return new WorkoutExport(WorkoutExport.CURRENT_VERSION, NOW, workout);
    }

    private static WorkoutData minimalWorkout(String type, Instant start) {
        return new WorkoutData(type, "Apple Watch", start, start.plusSeconds(1800), 1800, WorkoutStatistics.none(),
                List.of(), List.of(), List.of(), List.of());
    }

    private static WorkoutData fullWorkout() {
        WorkoutStatistics statistics = new WorkoutStatistics(
                new StatValue(312.5, "kcal"),
                new StatValue(5.02, "km"),
                new StatValue(6120, "steps"),
                new StatValue(151.3, "bpm"),
                new StatValue(178, "bpm"),
                new StatValue(2.79, "m/s"),
                null
        );
        Instant split = Instant.parse("2024-03-07T08:35:00Z");
        return new WorkoutData("running", "Apple Watch", START, END, 1790.5, statistics,
                List.of(new HeartRateSample(Instant.parse("2024-03-07T08:16:00Z"), 128)),
                List.of(new RoutePoint(52.5200, 13.4050, 34.2, START, 4.5, null)),
                List.of(new WorkoutEventData("lap", Instant.parse("2024-03-07T08:25:00Z"), null),
                        new WorkoutEventData("pause", Instant.parse("2024-03-07T08:30:00Z"),
                                Instant.parse("2024-03-07T08:31:00Z"))),
                List.of(new ActivityData("running", START, split, 1200, statistics),
                        new ActivityData("other", split, END, 600, WorkoutStatistics.none())));
    }

    private static void assertSorted(JsonNode node) {
        if (node.isObject()) {
            List<String> names = fieldNames(node);
            List<String> sorted = new ArrayList<>(names);
            sorted.sort(null);
            assertEquals(sorted, names);
        }
        node.elements().forEachRemaining(ExportDocumentSerializerTest::assertSorted);
    }

    private static List<String> fieldNames(JsonNode node) {
        List<String> names = new ArrayList<>();
        Iterator<String> iterator = node.fieldNames();
        iterator.forEachRemaining(names::add);
        return names;
    }
}
