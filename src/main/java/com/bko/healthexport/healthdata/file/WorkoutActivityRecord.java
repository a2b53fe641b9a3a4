package com.bko.healthexport.healthdata.file;

import com.bko.healthexport.healthdata.ProviderActivityType;
import com.bko.healthexport.healthdata.ProviderWorkoutActivity;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.time.Instant;

@JsonIgnoreProperties(ignoreUnknown = true)
public class WorkoutActivityRecord {
    private String activityType;
    private Instant startDate;
    private Instant endDate;
    private double duration;

    public String getActivityType() { return activityType; }
    public void setActivityType(String activityType) { this.activityType = activityType; }
    public Instant getStartDate() { return startDate; }
    public void setStartDate(Instant startDate) { this.startDate = startDate; }
    public Instant getEndDate() { return endDate; }
    public void setEndDate(Instant endDate) { this.endDate = endDate; }
    public double getDuration() { return duration; }
    public void setDuration(double duration) { this.duration = duration; }

    public ProviderWorkoutActivity toActivity() {
        return new ProviderWorkoutActivity(ProviderActivityType.fromIdentifier(activityType), startDate, endDate, duration);
    }
}
