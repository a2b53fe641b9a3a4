package com.bko.healthexport.healthdata.file;

import com.bko.healthexport.healthdata.ProviderActivityType;
import com.bko.healthexport.healthdata.ProviderWorkout;
import com.bko.healthexport.healthdata.ProviderWorkoutActivity;
import com.bko.healthexport.healthdata.ProviderWorkoutEvent;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@JsonIgnoreProperties(ignoreUnknown = true)
public class WorkoutRecord {
    private UUID id;
    private String activityType;
    private String sourceName;
    private Instant startDate;
    private Instant endDate;
    private Double duration;
    private List<WorkoutEventRecord> events;
    private List<WorkoutActivityRecord> activities = new ArrayList<>();

    public UUID getId() { return id; }
    public void setId(UUID id) { this.id = id; }
    public String getActivityType() { return activityType; }
    public void setActivityType(String activityType) { this.activityType = activityType; }
    public String getSourceName() { return sourceName; }
    public void setSourceName(String sourceName) { this.sourceName = sourceName; }
    public Instant getStartDate() { return startDate; }
    public void setStartDate(Instant startDate) { this.startDate = startDate; }
    public Instant getEndDate() { return endDate; }
    public void setEndDate(Instant endDate) { this.endDate = endDate; }
    public Double getDuration() { return duration; }
    public void setDuration(Double duration) { this.duration = duration; }
    public List<WorkoutEventRecord> getEvents() { return events; }
    public void setEvents(List<WorkoutEventRecord> events) { this.events = events; }
    public List<WorkoutActivityRecord> getActivities() { return activities; }
    public void setActivities(List<WorkoutActivityRecord> activities) { this.activities = activities; }

    public ProviderWorkout toWorkout() {
        List<ProviderWorkoutEvent> workoutEvents = null;
        if (events != null) {
            workoutEvents = events.stream().map(WorkoutEventRecord::toEvent).toList();
        }
        List<ProviderWorkoutActivity> workoutActivities = activities == null
                ? List.of()
                : activities.stream().map(WorkoutActivityRecord::toActivity).toList();
        double seconds = duration != null
                ? duration
                : (endDate.toEpochMilli() - startDate.toEpochMilli()) / 1000.0;
        return new ProviderWorkout(
                id,
                ProviderActivityType.fromIdentifier(activityType),
                sourceName != null ? sourceName : "",
                startDate,
                endDate,
                seconds,
                workoutEvents,
                workoutActivities
        );
    }
}
