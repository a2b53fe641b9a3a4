package com.bko.healthexport.shared;

public record AppSettings(HealthDataSettings healthData, ExportSettings export) {
    public boolean isHealthDataConfigured() {
        return healthData != null && healthData.isConfigured();
    }

    public boolean isExportRequested() {
        return export != null && export.isRequested();
    }
}
