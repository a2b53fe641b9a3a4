package com.bko.healthexport.healthdata;

import java.util.Arrays;

public enum ProviderActivityType {
    RUNNING("running"),
    TRADITIONAL_STRENGTH_TRAINING("traditionalStrengthTraining"),
    FUNCTIONAL_STRENGTH_TRAINING("functionalStrengthTraining"),
    WALKING("walking"),
    HIKING("hiking"),
    CYCLING("cycling"),
    SWIMMING("swimming"),
    YOGA("yoga"),
    HIGH_INTENSITY_INTERVAL_TRAINING("highIntensityIntervalTraining"),
    CORE_TRAINING("coreTraining"),
    COOLDOWN("cooldown"),
    UNRECOGNIZED("unrecognized");

    private final String identifier;

    ProviderActivityType(String identifier) {
        this.identifier = identifier;
    }

    public String identifier() {
        return identifier;
    }

    public static ProviderActivityType fromIdentifier(String identifier) {
        return Arrays.stream(values())
                .filter(type -> type != UNRECOGNIZED && type.identifier.equals(identifier))
                .findFirst()
                .orElse(UNRECOGNIZED);
    }
}
