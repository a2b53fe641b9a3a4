package com.bko.healthexport.export.app;

import com.bko.healthexport.export.model.WorkoutEventData;
import com.bko.healthexport.healthdata.ProviderWorkout;
import com.bko.healthexport.healthdata.ProviderWorkoutEvent;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;

@Component
public class WorkoutEventExtractor {

    public List<WorkoutEventData> extract(ProviderWorkout workout) {
        if (workout.events() == null) {
            return List.of();
        }
        return workout.events().stream()
                .map(WorkoutEventExtractor::toEventData)
                .toList();
    }

    private static WorkoutEventData toEventData(ProviderWorkoutEvent event) {
        Instant endDate = event.endDate();
        if (endDate != null && endDate.equals(event.startDate())) {
            // zero-length interval: an instantaneous event
            endDate = null;
        }
        return new WorkoutEventData(TypeTags.eventTag(event.type()), event.startDate(), endDate);
    }
}
