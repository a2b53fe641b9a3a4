package com.bko.healthexport.export.delivery;

import com.bko.healthexport.export.ExportDocument;
import com.bko.healthexport.export.ExportWorkoutUseCase;
import com.bko.healthexport.shared.AppSettings;
import com.bko.healthexport.shared.ExportSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.UUID;

@Component
public class ExportRunner implements ApplicationRunner {
    private static final Logger logger = LoggerFactory.getLogger(ExportRunner.class);

    private final ExportWorkoutUseCase exportWorkoutUseCase;
    private final ExportFileWriter fileWriter;
    private final AppSettings settings;

    public ExportRunner(ExportWorkoutUseCase exportWorkoutUseCase, ExportFileWriter fileWriter, AppSettings settings) {
        this.exportWorkoutUseCase = exportWorkoutUseCase;
        this.fileWriter = fileWriter;
        this.settings = settings;
    }

    @Override
    public void run(ApplicationArguments args) throws IOException {
        if (!settings.isExportRequested()) {
            logger.info("EXPORT_WORKOUT_ID not set, nothing to export.");
            return;
        }
        ExportSettings export = settings.export();
        try {
            ExportDocument document = export.isLatestRequested()
                    ? exportWorkoutUseCase.exportLatestWorkout()
                    : exportWorkoutUseCase.exportWorkout(UUID.fromString(export.workoutId().trim()));
            fileWriter.write(document);
        } catch (IOException | RuntimeException e) {
            logger.error("Export of workout {} failed", export.workoutId(), e);
            throw e;
        }
    }
}
