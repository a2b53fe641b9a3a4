package com.bko.healthexport.export.model;

import java.time.Instant;
import java.util.Objects;

public record HeartRateSample(Instant date, double bpm) {
    public HeartRateSample {
        Objects.requireNonNull(date, "date");
    }
}
