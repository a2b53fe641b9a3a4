package com.bko.healthexport.export.app;

import com.bko.healthexport.export.model.HeartRateSample;
import com.bko.healthexport.healthdata.HealthDataException;
import com.bko.healthexport.healthdata.HealthDataPort;
import com.bko.healthexport.healthdata.HealthUnits;
import com.bko.healthexport.healthdata.ProviderWorkout;
import com.bko.healthexport.healthdata.QuantityKind;
import com.bko.healthexport.healthdata.QuantitySample;
import com.bko.healthexport.healthdata.SampleQuery;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

@Component
public class HeartRateFetcher {
    static final int MAX_SAMPLES = 5000;

    private final HealthDataPort healthDataPort;

    public HeartRateFetcher(HealthDataPort healthDataPort) {
        this.healthDataPort = healthDataPort;
    }

    public CompletableFuture<List<HeartRateSample>> fetch(ProviderWorkout workout) {
        SampleQuery query = new SampleQuery(
                QuantityKind.HEART_RATE,
                workout.startDate(),
                workout.endDate(),
                SampleQuery.SortOrder.ASCENDING,
                MAX_SAMPLES
        );
        CompletableFuture<List<QuantitySample>> samples = healthDataPort.querySamples(query);
        return ProviderCalls.cancelWith(samples.thenApply(this::toHeartRateSamples), samples);
    }

    private List<HeartRateSample> toHeartRateSamples(List<QuantitySample> samples) {
        List<HeartRateSample> heartRateSamples = new ArrayList<>(samples.size());
        for (QuantitySample sample : samples) {
            try {
                double bpm = HealthUnits.valueIn(sample.quantity(), HealthUnits.BEATS_PER_MINUTE);
                heartRateSamples.add(new HeartRateSample(sample.startDate(), bpm));
            } catch (HealthDataException e) {
                throw new CompletionException(e);
            }
        }
        return List.copyOf(heartRateSamples);
    }
}
