package com.bko.healthexport.healthdata.file;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.ArrayList;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public class HealthDataDump {
    private List<WorkoutRecord> workouts = new ArrayList<>();
    private List<SampleRecord> samples = new ArrayList<>();
    private List<RouteRecord> routes = new ArrayList<>();

    public List<WorkoutRecord> getWorkouts() { return workouts; }
    public void setWorkouts(List<WorkoutRecord> workouts) { this.workouts = workouts != null ? workouts : new ArrayList<>(); }
    public List<SampleRecord> getSamples() { return samples; }
    public void setSamples(List<SampleRecord> samples) { this.samples = samples != null ? samples : new ArrayList<>(); }
    public List<RouteRecord> getRoutes() { return routes; }
    public void setRoutes(List<RouteRecord> routes) { this.routes = routes != null ? routes : new ArrayList<>(); }
}
