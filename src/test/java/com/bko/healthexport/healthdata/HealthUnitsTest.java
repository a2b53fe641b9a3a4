package com.bko.healthexport.healthdata;

import org.junit.jupiter.api.Test;
import tech.units.indriya.quantity.Quantities;
import tech.units.indriya.unit.Units;

import javax.measure.IncommensurableException;

import static javax.measure.MetricPrefix.KILO;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class HealthUnitsTest {

    @Test
    void convertsEnergyIntoKilocalories() throws Exception {
        assertEquals(1.0, HealthUnits.valueIn(Quantities.getQuantity(4184, Units.JOULE), HealthUnits.KILOCALORIE), 1e-9);
        assertEquals(250.0, HealthUnits.valueIn(Quantities.getQuantity(1046, KILO(Units.JOULE)), HealthUnits.KILOCALORIE), 1e-9);
    }

    @Test
    void convertsDistanceIntoKilometres() throws Exception {
        assertEquals(5.0, HealthUnits.valueIn(Quantities.getQuantity(5000, Units.METRE), KILO(Units.METRE)), 1e-9);
        assertEquals(1.609344,
                HealthUnits.valueIn(Quantities.getQuantity(1, Units.METRE.multiply(1609.344)), KILO(Units.METRE)), 1e-9);
    }

    @Test
    void convertsHertzIntoBeatsPerMinute() throws Exception {
        assertEquals(150.0, HealthUnits.valueIn(Quantities.getQuantity(2.5, Units.HERTZ), HealthUnits.BEATS_PER_MINUTE), 1e-9);
    }

    @Test
    void rejectsIncompatibleUnits() {
        HealthDataException thrown = assertThrows(HealthDataException.class,
                () -> HealthUnits.valueIn(Quantities.getQuantity(10, Units.METRE), HealthUnits.KILOCALORIE));

        assertEquals(IncommensurableException.class, thrown.getCause().getClass());
    }
}
