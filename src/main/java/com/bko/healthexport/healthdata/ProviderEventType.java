package com.bko.healthexport.healthdata;

import java.util.Arrays;

public enum ProviderEventType {
    PAUSE("pause"),
    RESUME("resume"),
    LAP("lap"),
    MARKER("marker"),
    MOTION_PAUSED("motionPaused"),
    MOTION_RESUMED("motionResumed"),
    SEGMENT("segment"),
    PAUSE_OR_RESUME_REQUEST("pauseOrResumeRequest"),
    UNRECOGNIZED("unrecognized");

    private final String identifier;

    ProviderEventType(String identifier) {
        this.identifier = identifier;
    }

    public String identifier() {
        return identifier;
    }

    public static ProviderEventType fromIdentifier(String identifier) {
        return Arrays.stream(values())
                .filter(type -> type != UNRECOGNIZED && type.identifier.equals(identifier))
                .findFirst()
                .orElse(UNRECOGNIZED);
    }
}
