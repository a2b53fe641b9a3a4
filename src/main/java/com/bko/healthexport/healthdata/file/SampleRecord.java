package com.bko.healthexport.healthdata.file;

import com.bko.healthexport.healthdata.HealthDataException;
import com.bko.healthexport.healthdata.QuantityKind;
import com.bko.healthexport.healthdata.QuantitySample;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import tech.units.indriya.quantity.Quantities;

import java.time.Instant;

@JsonIgnoreProperties(ignoreUnknown = true)
public class SampleRecord {
    private String type;
    private Instant startDate;
    private Instant endDate;
    private double value;
    private String unit;

    public String getType() { return type; }
    public void setType(String type) { this.type = type; }
    public Instant getStartDate() { return startDate; }
    public void setStartDate(Instant startDate) { this.startDate = startDate; }
    public Instant getEndDate() { return endDate; }
    public void setEndDate(Instant endDate) { this.endDate = endDate; }
    public double getValue() { return value; }
    public void setValue(double value) { this.value = value; }
    public String getUnit() { return unit; }
    public void setUnit(String unit) { this.unit = unit; }

    public boolean isOfKind(QuantityKind kind) {
        return kind.identifier().equals(type);
    }

    public QuantitySample toSample(QuantityKind kind) throws HealthDataException {
        return new QuantitySample(
                kind,
                startDate,
                endDate != null ? endDate : startDate,
                Quantities.getQuantity(value, ProviderUnits.parse(unit))
        );
    }
}
