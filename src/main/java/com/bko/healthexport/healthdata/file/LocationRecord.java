package com.bko.healthexport.healthdata.file;

import com.bko.healthexport.healthdata.ProviderLocation;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.time.Instant;

@JsonIgnoreProperties(ignoreUnknown = true)
public class LocationRecord {
    private static final double UNAVAILABLE = -1;

    private double latitude;
    private double longitude;
    private double altitude;
    private Instant timestamp;
    private Double horizontalAccuracy;
    private Double speed;

    public double getLatitude() { return latitude; }
    public void setLatitude(double latitude) { this.latitude = latitude; }
    public double getLongitude() { return longitude; }
    public void setLongitude(double longitude) { this.longitude = longitude; }
    public double getAltitude() { return altitude; }
    public void setAltitude(double altitude) { this.altitude = altitude; }
    public Instant getTimestamp() { return timestamp; }
    public void setTimestamp(Instant timestamp) { this.timestamp = timestamp; }
    public Double getHorizontalAccuracy() { return horizontalAccuracy; }
    public void setHorizontalAccuracy(Double horizontalAccuracy) { this.horizontalAccuracy = horizontalAccuracy; }
    public Double getSpeed() { return speed; }
    public void setSpeed(Double speed) { this.speed = speed; }

    public ProviderLocation toLocation() {
        return new ProviderLocation(
                latitude,
                longitude,
                altitude,
                timestamp,
                horizontalAccuracy != null ? horizontalAccuracy : UNAVAILABLE,
                speed != null ? speed : UNAVAILABLE
        );
    }
}
