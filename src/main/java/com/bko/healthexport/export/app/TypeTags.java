package com.bko.healthexport.export.app;

import com.bko.healthexport.healthdata.ProviderActivityType;
import com.bko.healthexport.healthdata.ProviderEventType;

public final class TypeTags {
    public static final String OTHER_ACTIVITY = "other";
    public static final String UNKNOWN_EVENT = "unknown";

    private TypeTags() {
    }

    public static String activityTag(ProviderActivityType type) {
        return switch (type) {
            case RUNNING -> "running";
            case TRADITIONAL_STRENGTH_TRAINING -> "strength_training";
            case FUNCTIONAL_STRENGTH_TRAINING -> "functional_strength";
            default -> OTHER_ACTIVITY;
        };
    }

    public static String eventTag(ProviderEventType type) {
        return switch (type) {
            case PAUSE -> "pause";
            case RESUME -> "resume";
            case LAP -> "lap";
            case SEGMENT -> "segment";
            case MARKER -> "marker";
            case MOTION_PAUSED -> "motionPaused";
            case MOTION_RESUMED -> "motionResumed";
            default -> UNKNOWN_EVENT;
        };
    }
}
