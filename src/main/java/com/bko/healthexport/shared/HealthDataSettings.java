package com.bko.healthexport.shared;

public record HealthDataSettings(String dataFile) {
    public boolean isConfigured() {
        return dataFile != null && !dataFile.isBlank();
    }
}
