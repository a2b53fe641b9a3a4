package com.bko.healthexport.export.model;

import java.util.Objects;

public record StatValue(double value, String unit) {
    public StatValue {
        Objects.requireNonNull(unit, "unit");
    }
}
