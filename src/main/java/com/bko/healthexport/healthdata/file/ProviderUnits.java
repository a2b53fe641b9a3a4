package com.bko.healthexport.healthdata.file;

import com.bko.healthexport.healthdata.HealthDataException;
import com.bko.healthexport.healthdata.HealthUnits;
import tech.units.indriya.unit.Units;

import javax.measure.Unit;
import java.util.Map;

import static javax.measure.MetricPrefix.KILO;

final class ProviderUnits {

    private static final Map<String, Unit<?>> UNITS = Map.ofEntries(
            Map.entry("kcal", HealthUnits.KILOCALORIE),
            Map.entry("kJ", KILO(Units.JOULE)),
            Map.entry("J", Units.JOULE),
            Map.entry("m", Units.METRE),
            Map.entry("km", KILO(Units.METRE)),
            Map.entry("mi", Units.METRE.multiply(1609.344)),
            Map.entry("count", HealthUnits.COUNT),
            Map.entry("count/min", HealthUnits.BEATS_PER_MINUTE),
            Map.entry("m/s", Units.METRE_PER_SECOND),
            Map.entry("km/h", Units.KILOMETRE_PER_HOUR),
            Map.entry("W", Units.WATT)
    );

    private ProviderUnits() {
    }

    static Unit<?> parse(String label) throws HealthDataException {
        Unit<?> unit = label == null ? null : UNITS.get(label.trim());
        if (unit == null) {
            throw new HealthDataException("Unsupported unit in health data: " + label);
        }
        return unit;
    }
}
