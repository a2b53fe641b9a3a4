package com.bko.healthexport.export;

import java.io.IOException;
import java.util.UUID;

public interface ExportWorkoutUseCase {

    ExportDocument exportWorkout(UUID workoutId) throws IOException;

    ExportDocument exportLatestWorkout() throws IOException;
}
