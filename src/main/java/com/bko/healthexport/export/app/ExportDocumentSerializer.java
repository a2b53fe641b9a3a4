package com.bko.healthexport.export.app;

import com.bko.healthexport.export.ExportDocument;
import com.bko.healthexport.export.ExportSerializationException;
import com.bko.healthexport.export.model.WorkoutExport;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Clock;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;

/**
 * Encodes export documents as canonical JSON: keys sorted in every object, ISO-8601 instants, indented, absent
 * optional values omitted. The file name is {@code workout-<type>-<yyyy-MM-dd>.json}, dated by the workout's
 * start in the clock's zone.
 */
@Component
public class ExportDocumentSerializer {
    private static final DateTimeFormatter FILE_DATE = DateTimeFormatter.ofPattern("yyyy-MM-dd");

    private final ObjectMapper objectMapper = createObjectMapper();
    private final ZoneId zone;

    public ExportDocumentSerializer(Clock clock) {
        this.zone = clock.getZone();
    }

    public ExportDocument serialize(WorkoutExport export) throws ExportSerializationException {
        try {
            byte[] content = objectMapper.writeValueAsBytes(export);
            return new ExportDocument(filename(export), content);
        } catch (JsonProcessingException e) {
            throw new ExportSerializationException("Could not encode export of " + export.workout().type() + " workout", e);
        }
    }

    public WorkoutExport deserialize(byte[] content) throws ExportSerializationException {
        try {
            return objectMapper.readValue(content, WorkoutExport.class);
        } catch (IOException e) {
            throw new ExportSerializationException("Could not decode export document", e);
        }
    }

    public String filename(WorkoutExport export) {
        String day = FILE_DATE.format(export.workout().startDate().atZone(zone));
        return "workout-" + export.workout().type() + "-" + day + ".json";
    }

    static ObjectMapper createObjectMapper() {
        return JsonMapper.builder()
                .addModule(new JavaTimeModule())
                .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
                .disable(MapperFeature.SORT_CREATOR_PROPERTIES_FIRST)
                .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
                .enable(SerializationFeature.INDENT_OUTPUT)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .serializationInclusion(JsonInclude.Include.NON_NULL)
                .build();
    }
}
