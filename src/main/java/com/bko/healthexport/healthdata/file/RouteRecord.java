package com.bko.healthexport.healthdata.file;

import com.bko.healthexport.healthdata.ProviderRoute;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@JsonIgnoreProperties(ignoreUnknown = true)
public class RouteRecord {
    private UUID id;
    private UUID workoutId;
    private Instant startDate;
    private List<LocationRecord> locations = new ArrayList<>();

    public UUID getId() { return id; }
    public void setId(UUID id) { this.id = id; }
    public UUID getWorkoutId() { return workoutId; }
    public void setWorkoutId(UUID workoutId) { this.workoutId = workoutId; }
    public Instant getStartDate() { return startDate; }
    public void setStartDate(Instant startDate) { this.startDate = startDate; }
    public List<LocationRecord> getLocations() { return locations; }
    public void setLocations(List<LocationRecord> locations) { this.locations = locations != null ? locations : new ArrayList<>(); }

    public ProviderRoute toRoute() {
        return new ProviderRoute(id, workoutId, startDate);
    }
}
