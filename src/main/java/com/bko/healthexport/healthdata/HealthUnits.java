package com.bko.healthexport.healthdata;

import tech.units.indriya.AbstractUnit;
import tech.units.indriya.unit.Units;

import javax.measure.IncommensurableException;
import javax.measure.Quantity;
import javax.measure.UnconvertibleException;
import javax.measure.Unit;
import javax.measure.quantity.Dimensionless;
import javax.measure.quantity.Energy;
import javax.measure.quantity.Frequency;

public final class HealthUnits {

    public static final Unit<Energy> KILOCALORIE = Units.JOULE.multiply(4184);

    public static final Unit<Frequency> BEATS_PER_MINUTE = Units.HERTZ.divide(60);

    public static final Unit<Dimensionless> COUNT = AbstractUnit.ONE;

    private HealthUnits() {
    }

    public static double valueIn(Quantity<?> quantity, Unit<?> unit) throws HealthDataException {
        try {
            return quantity.getUnit().getConverterToAny(unit).convert(quantity.getValue()).doubleValue();
        } catch (IncommensurableException | UnconvertibleException e) {
            throw new HealthDataException("Cannot express " + quantity + " in " + unit, e);
        }
    }
}
