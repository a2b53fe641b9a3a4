package com.bko.healthexport.export.app;

import com.bko.healthexport.export.model.StatValue;
import com.bko.healthexport.export.model.WorkoutStatistics;
import com.bko.healthexport.healthdata.HealthDataException;
import com.bko.healthexport.healthdata.HealthDataPort;
import com.bko.healthexport.healthdata.HealthUnits;
import com.bko.healthexport.healthdata.QuantityKind;
import com.bko.healthexport.healthdata.QuantityStatistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import tech.units.indriya.unit.Units;

import javax.measure.Quantity;
import javax.measure.Unit;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import static javax.measure.MetricPrefix.KILO;

@Component
public class StatisticsExtractor {
    private static final Logger logger = LoggerFactory.getLogger(StatisticsExtractor.class);

    private static final Conversion KILOCALORIES = new Conversion(HealthUnits.KILOCALORIE, "kcal");
    private static final Conversion KILOMETRES = new Conversion(KILO(Units.METRE), "km");
    private static final Conversion STEPS = new Conversion(HealthUnits.COUNT, "steps");
    private static final Conversion BPM = new Conversion(HealthUnits.BEATS_PER_MINUTE, "bpm");
    private static final Conversion METRES_PER_SECOND = new Conversion(Units.METRE_PER_SECOND, "m/s");
    private static final Conversion WATTS = new Conversion(Units.WATT, "W");

    private final HealthDataPort healthDataPort;

    public StatisticsExtractor(HealthDataPort healthDataPort) {
        this.healthDataPort = healthDataPort;
    }

    public WorkoutStatistics extract(Instant start, Instant end) throws HealthDataException {
        Map<QuantityKind, CompletableFuture<Optional<QuantityStatistics>>> pending = new EnumMap<>(QuantityKind.class);
        for (QuantityKind kind : QuantityKind.values()) {
            pending.put(kind, healthDataPort.queryStatistics(kind, start, end));
        }

        Map<QuantityKind, QuantityStatistics> statistics = new EnumMap<>(QuantityKind.class);
        try {
            for (Map.Entry<QuantityKind, CompletableFuture<Optional<QuantityStatistics>>> entry : pending.entrySet()) {
                ProviderCalls.await(entry.getValue(), entry.getKey() + " statistics")
                        .ifPresent(value -> statistics.put(entry.getKey(), value));
            }
        } catch (HealthDataException e) {
            pending.values().forEach(future -> future.cancel(true));
            throw e;
        }
        if (statistics.isEmpty()) {
            logger.debug("No statistics recorded between {} and {}", start, end);
            return WorkoutStatistics.none();
        }
        logger.debug("Statistics between {} and {} available for {}", start, end, statistics.keySet());

        QuantityStatistics heartRate = statistics.get(QuantityKind.HEART_RATE);
        return new WorkoutStatistics(
                convert(sum(statistics.get(QuantityKind.ACTIVE_ENERGY_BURNED)), KILOCALORIES),
                convert(sum(statistics.get(QuantityKind.DISTANCE_WALKING_RUNNING)), KILOMETRES),
                convert(sum(statistics.get(QuantityKind.STEP_COUNT)), STEPS),
                convert(average(heartRate), BPM),
                convert(maximum(heartRate), BPM),
                convert(average(statistics.get(QuantityKind.RUNNING_SPEED)), METRES_PER_SECOND),
                convert(average(statistics.get(QuantityKind.RUNNING_POWER)), WATTS)
        );
    }

    private static Optional<Quantity<?>> sum(QuantityStatistics statistics) {
        return statistics == null ? Optional.empty() : statistics.sum();
    }

    private static Optional<Quantity<?>> average(QuantityStatistics statistics) {
        return statistics == null ? Optional.empty() : statistics.average();
    }

    private static Optional<Quantity<?>> maximum(QuantityStatistics statistics) {
        return statistics == null ? Optional.empty() : statistics.maximum();
    }

    private static StatValue convert(Optional<Quantity<?>> quantity, Conversion conversion) throws HealthDataException {
        if (quantity.isEmpty()) {
            return null;
        }
        return new StatValue(HealthUnits.valueIn(quantity.get(), conversion.unit()), conversion.label());
    }

    private record Conversion(Unit<?> unit, String label) {
    }
}
