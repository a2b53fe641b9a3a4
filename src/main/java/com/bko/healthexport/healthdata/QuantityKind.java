package com.bko.healthexport.healthdata;

import tech.units.indriya.unit.Units;

import javax.measure.Unit;
import java.util.Arrays;
import java.util.Optional;

public enum QuantityKind {
    HEART_RATE("heartRate", Aggregation.DISCRETE, HealthUnits.BEATS_PER_MINUTE),
    ACTIVE_ENERGY_BURNED("activeEnergyBurned", Aggregation.CUMULATIVE, HealthUnits.KILOCALORIE),
    DISTANCE_WALKING_RUNNING("distanceWalkingRunning", Aggregation.CUMULATIVE, Units.METRE),
    STEP_COUNT("stepCount", Aggregation.CUMULATIVE, HealthUnits.COUNT),
    RUNNING_SPEED("runningSpeed", Aggregation.DISCRETE, Units.METRE_PER_SECOND),
    RUNNING_POWER("runningPower", Aggregation.DISCRETE, Units.WATT);

    public enum Aggregation {
        CUMULATIVE,
        DISCRETE
    }

    private final String identifier;
    private final Aggregation aggregation;
    private final Unit<?> canonicalUnit;

    QuantityKind(String identifier, Aggregation aggregation, Unit<?> canonicalUnit) {
        this.identifier = identifier;
        this.aggregation = aggregation;
        this.canonicalUnit = canonicalUnit;
    }

    public String identifier() {
        return identifier;
    }

    public Aggregation aggregation() {
        return aggregation;
    }

    public Unit<?> canonicalUnit() {
        return canonicalUnit;
    }

    public static Optional<QuantityKind> fromIdentifier(String identifier) {
        return Arrays.stream(values())
                .filter(kind -> kind.identifier.equals(identifier))
                .findFirst();
    }
}
