package com.bko.healthexport.export.delivery;

import com.bko.healthexport.export.ExportDocument;
import com.bko.healthexport.export.ExportWorkoutUseCase;
import com.bko.healthexport.healthdata.HealthDataException;
import com.bko.healthexport.shared.AppSettings;
import com.bko.healthexport.shared.ExportSettings;
import com.bko.healthexport.shared.HealthDataSettings;
import org.junit.jupiter.api.Test;
import org.springframework.boot.DefaultApplicationArguments;

import java.nio.charset.StandardCharsets;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class ExportRunnerTest {
    private static final ExportDocument DOCUMENT = new ExportDocument("workout-running-2024-03-07.json",
            "{}".getBytes(StandardCharsets.UTF_8));

    private final ExportWorkoutUseCase useCase = mock(ExportWorkoutUseCase.class);
    private final ExportFileWriter fileWriter = mock(ExportFileWriter.class);

    @Test
    void doesNothingWhenNoExportRequested() throws Exception {
        runner(null).run(new DefaultApplicationArguments());

        verifyNoInteractions(useCase);
        verifyNoInteractions(fileWriter);
    }

    @Test
    void exportsLatestWorkout() throws Exception {
        when(useCase.exportLatestWorkout()).thenReturn(DOCUMENT);

        runner("latest").run(new DefaultApplicationArguments());

        verify(fileWriter).write(DOCUMENT);
    }

    @Test
    void exportsWorkoutById() throws Exception {
        UUID id = UUID.fromString("6f1c1f4e-8a3c-4b59-9d2b-0d6f1b3a9a01");
        when(useCase.exportWorkout(id)).thenReturn(DOCUMENT);

        runner(id.toString()).run(new DefaultApplicationArguments());

        verify(useCase).exportWorkout(id);
        verify(fileWriter).write(DOCUMENT);
    }

    @Test
    void exportFailureIsRethrown() throws Exception {
        HealthDataException failure = new HealthDataException("Authorization revoked");
        when(useCase.exportLatestWorkout()).thenThrow(failure);

        HealthDataException thrown = assertThrows(HealthDataException.class,
                () -> runner("latest").run(new DefaultApplicationArguments()));

        assertSame(failure, thrown);
        verify(fileWriter, never()).write(DOCUMENT);
    }

    @Test
    void malformedWorkoutIdIsRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> runner("not-a-uuid").run(new DefaultApplicationArguments()));

        verifyNoInteractions(fileWriter);
    }

    private ExportRunner runner(String workoutId) {
        AppSettings settings = new AppSettings(new HealthDataSettings("/data/dump.json"),
                new ExportSettings(workoutId, null));
        return new ExportRunner(useCase, fileWriter, settings);
    }
}
