package com.bko.healthexport.healthdata.file;

import com.bko.healthexport.healthdata.ProviderEventType;
import com.bko.healthexport.healthdata.ProviderWorkoutEvent;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.time.Instant;

@JsonIgnoreProperties(ignoreUnknown = true)
public class WorkoutEventRecord {
    private String type;
    private Instant startDate;
    private Instant endDate;

    public String getType() { return type; }
    public void setType(String type) { this.type = type; }
    public Instant getStartDate() { return startDate; }
    public void setStartDate(Instant startDate) { this.startDate = startDate; }
    public Instant getEndDate() { return endDate; }
    public void setEndDate(Instant endDate) { this.endDate = endDate; }

    public ProviderWorkoutEvent toEvent() {
        return new ProviderWorkoutEvent(ProviderEventType.fromIdentifier(type), startDate, endDate);
    }
}
