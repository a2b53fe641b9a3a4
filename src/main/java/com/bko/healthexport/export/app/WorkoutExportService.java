package com.bko.healthexport.export.app;

import com.bko.healthexport.export.ExportDocument;
import com.bko.healthexport.export.ExportWorkoutUseCase;
import com.bko.healthexport.export.model.WorkoutExport;
import com.bko.healthexport.healthdata.HealthDataPort;
import com.bko.healthexport.healthdata.ProviderActivityType;
import com.bko.healthexport.healthdata.ProviderWorkout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

@Service
public class WorkoutExportService implements ExportWorkoutUseCase {
    private static final Logger logger = LoggerFactory.getLogger(WorkoutExportService.class);
    static final Set<ProviderActivityType> EXPORTABLE_TYPES = EnumSet.of(
            ProviderActivityType.RUNNING,
            ProviderActivityType.TRADITIONAL_STRENGTH_TRAINING,
            ProviderActivityType.FUNCTIONAL_STRENGTH_TRAINING
    );

    private final HealthDataPort healthDataPort;
    private final WorkoutExportAssembler assembler;
    private final ExportDocumentSerializer serializer;

    public WorkoutExportService(HealthDataPort healthDataPort,
                                WorkoutExportAssembler assembler,
                                ExportDocumentSerializer serializer) {
        this.healthDataPort = healthDataPort;
        this.assembler = assembler;
        this.serializer = serializer;
    }

    @Override
    public ExportDocument exportWorkout(UUID workoutId) throws IOException {
        ProviderWorkout workout = ProviderCalls.await(healthDataPort.findWorkout(workoutId), "workout lookup")
                .orElseThrow(() -> new IllegalArgumentException("No workout with id " + workoutId));
        return export(workout);
    }

    @Override
    public ExportDocument exportLatestWorkout() throws IOException {
        List<ProviderWorkout> workouts = ProviderCalls.await(
                healthDataPort.findWorkouts(EXPORTABLE_TYPES, 1), "workout list");
        if (workouts.isEmpty()) {
            throw new IllegalStateException("No running or strength workouts to export.");
        }
        return export(workouts.get(0));
    }

    private ExportDocument export(ProviderWorkout workout) throws IOException {
        WorkoutExport export = assembler.buildExport(workout);
        ExportDocument document = serializer.serialize(export);
        logger.info("Encoded workout {} as {} ({} bytes)", workout.id(), document.filename(), document.content().length);
        return document;
    }
}
