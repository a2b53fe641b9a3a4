package com.bko.healthexport.export.app;

import com.bko.healthexport.export.model.ActivityData;
import com.bko.healthexport.export.model.WorkoutStatistics;
import com.bko.healthexport.healthdata.HealthDataException;
import com.bko.healthexport.healthdata.ProviderWorkout;
import com.bko.healthexport.healthdata.ProviderWorkoutActivity;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Component
public class WorkoutActivityExtractor {
    private final StatisticsExtractor statisticsExtractor;

    public WorkoutActivityExtractor(StatisticsExtractor statisticsExtractor) {
        this.statisticsExtractor = statisticsExtractor;
    }

    public List<ActivityData> extract(ProviderWorkout workout) throws HealthDataException {
        List<ActivityData> activities = new ArrayList<>();
        for (ProviderWorkoutActivity activity : workout.activities()) {
            Instant endDate = resolveEndDate(activity);
            WorkoutStatistics statistics = statisticsExtractor.extract(activity.startDate(), endDate);
            activities.add(new ActivityData(
                    TypeTags.activityTag(activity.activityType()),
                    activity.startDate(),
                    endDate,
                    activity.duration(),
                    statistics
            ));
        }
        return List.copyOf(activities);
    }

    /**
     * The reported end date, or start plus duration when the provider left the activity open. A reported end
     * date is taken as is, even if it disagrees with the duration.
     */
    static Instant resolveEndDate(ProviderWorkoutActivity activity) throws HealthDataException {
        if (activity.endDate() != null) {
            return activity.endDate();
        }
        if (!Double.isFinite(activity.duration()) || activity.duration() < 0) {
            throw new HealthDataException("Open " + activity.activityType() + " activity starting at "
                    + activity.startDate() + " has unusable duration " + activity.duration());
        }
        return activity.startDate().plus(Duration.ofNanos(Math.round(activity.duration() * 1_000_000_000d)));
    }
}
