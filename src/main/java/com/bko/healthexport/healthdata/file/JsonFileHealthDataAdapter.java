package com.bko.healthexport.healthdata.file;

import com.bko.healthexport.healthdata.HealthDataException;
import com.bko.healthexport.healthdata.HealthDataPort;
import com.bko.healthexport.healthdata.HealthUnits;
import com.bko.healthexport.healthdata.ProviderActivityType;
import com.bko.healthexport.healthdata.ProviderLocation;
import com.bko.healthexport.healthdata.ProviderRoute;
import com.bko.healthexport.healthdata.ProviderWorkout;
import com.bko.healthexport.healthdata.QuantityKind;
import com.bko.healthexport.healthdata.QuantitySample;
import com.bko.healthexport.healthdata.QuantityStatistics;
import com.bko.healthexport.healthdata.SampleQuery;
import com.bko.healthexport.shared.AppSettings;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import tech.units.indriya.quantity.Quantities;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.function.Consumer;

/**
 * Answers provider queries from a JSON dump of workouts, samples and routes. The dump is read again for
 * every query, so edits to the file are visible without a restart.
 */
@Component
public class JsonFileHealthDataAdapter implements HealthDataPort {
    private static final Logger logger = LoggerFactory.getLogger(JsonFileHealthDataAdapter.class);
    static final int ROUTE_BATCH_SIZE = 100;

    private final AppSettings settings;
    private final Executor executor;
    private final ObjectMapper objectMapper = new ObjectMapper().registerModule(new JavaTimeModule());

    public JsonFileHealthDataAdapter(AppSettings settings,
                                     @Qualifier(HealthDataConfiguration.EXECUTOR_BEAN) Executor executor) {
        this.settings = settings;
        this.executor = executor;
    }

    @Override
    public CompletableFuture<List<ProviderWorkout>> findWorkouts(Set<ProviderActivityType> types, int limit) {
        return supply(() -> load().getWorkouts().stream()
                .map(WorkoutRecord::toWorkout)
                .filter(workout -> types.contains(workout.activityType()))
                .sorted(Comparator.comparing(ProviderWorkout::endDate).reversed())
                .limit(limit)
                .toList());
    }

    @Override
    public CompletableFuture<Optional<ProviderWorkout>> findWorkout(UUID id) {
        return supply(() -> load().getWorkouts().stream()
                .filter(record -> id.equals(record.getId()))
                .findFirst()
                .map(WorkoutRecord::toWorkout));
    }

    @Override
    public CompletableFuture<Optional<QuantityStatistics>> queryStatistics(QuantityKind kind, Instant start, Instant end) {
        return supply(() -> {
            List<QuantitySample> samples = samplesInRange(load(), kind, start, end);
            logger.debug("Aggregating {} {} samples between {} and {}", samples.size(), kind, start, end);
            if (samples.isEmpty()) {
                return Optional.empty();
            }
            return Optional.of(aggregate(kind, samples));
        });
    }

    @Override
    public CompletableFuture<List<QuantitySample>> querySamples(SampleQuery query) {
        return supply(() -> {
            Comparator<QuantitySample> order = Comparator.comparing(QuantitySample::startDate);
            if (query.order() == SampleQuery.SortOrder.DESCENDING) {
                order = order.reversed();
            }
            return samplesInRange(load(), query.kind(), query.start(), query.end()).stream()
                    .sorted(order)
                    .limit(query.limit())
                    .toList();
        });
    }

    @Override
    public CompletableFuture<Optional<ProviderRoute>> findRoute(UUID workoutId) {
        return supply(() -> load().getRoutes().stream()
                .filter(route -> workoutId.equals(route.getWorkoutId()))
                .map(RouteRecord::toRoute)
                .min(Comparator.comparing(ProviderRoute::startDate, Comparator.nullsLast(Comparator.<Instant>naturalOrder()))));
    }

    @Override
    public CompletableFuture<Void> streamRouteLocations(ProviderRoute route, Consumer<List<ProviderLocation>> batchHandler) {
        CompletableFuture<Void> streaming = new CompletableFuture<>();
        executor.execute(() -> {
            try {
                List<ProviderLocation> locations = loadLocations(route);
                for (int from = 0; from < locations.size(); from += ROUTE_BATCH_SIZE) {
                    if (streaming.isDone()) {
                        logger.debug("Streaming of route {} stopped after {} locations", route.id(), from);
                        return;
                    }
                    batchHandler.accept(locations.subList(from, Math.min(from + ROUTE_BATCH_SIZE, locations.size())));
                }
                streaming.complete(null);
            } catch (HealthDataException | RuntimeException e) {
                streaming.completeExceptionally(e);
            }
        });
        return streaming;
    }

    private List<ProviderLocation> loadLocations(ProviderRoute route) throws HealthDataException {
        RouteRecord record = load().getRoutes().stream()
                .filter(candidate -> route.id().equals(candidate.getId()))
                .findFirst()
                .orElseThrow(() -> new HealthDataException("Route " + route.id() + " no longer exists"));
        return record.getLocations().stream()
                .map(LocationRecord::toLocation)
                .sorted(Comparator.comparing(ProviderLocation::timestamp))
                .toList();
    }

    private HealthDataDump load() throws HealthDataException {
        if (!settings.isHealthDataConfigured()) {
            throw new HealthDataException("Missing health data configuration. Check HEALTH_DATA_FILE.");
        }
        Path file = Path.of(settings.healthData().dataFile());
        try {
            return objectMapper.readValue(file.toFile(), HealthDataDump.class);
        } catch (IOException e) {
            throw new HealthDataException("Could not read health data file " + file, e);
        }
    }

    private List<QuantitySample> samplesInRange(HealthDataDump dump, QuantityKind kind, Instant start, Instant end)
            throws HealthDataException {
        List<QuantitySample> samples = new ArrayList<>();
        for (SampleRecord record : dump.getSamples()) {
            if (!record.isOfKind(kind) || record.getStartDate() == null) {
                continue;
            }
            if (record.getStartDate().isBefore(start) || record.getStartDate().isAfter(end)) {
                continue;
            }
            samples.add(record.toSample(kind));
        }
        return samples;
    }

    private QuantityStatistics aggregate(QuantityKind kind, List<QuantitySample> samples) throws HealthDataException {
        double sum = 0;
        double maximum = Double.NEGATIVE_INFINITY;
        for (QuantitySample sample : samples) {
            double value = HealthUnits.valueIn(sample.quantity(), kind.canonicalUnit());
            sum += value;
            maximum = Math.max(maximum, value);
        }
        if (kind.aggregation() == QuantityKind.Aggregation.CUMULATIVE) {
            return QuantityStatistics.cumulative(kind, Quantities.getQuantity(sum, kind.canonicalUnit()));
        }
        return QuantityStatistics.discrete(
                kind,
                Quantities.getQuantity(sum / samples.size(), kind.canonicalUnit()),
                Quantities.getQuantity(maximum, kind.canonicalUnit())
        );
    }

    private <T> CompletableFuture<T> supply(HealthDataCall<T> call) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                return call.execute();
            } catch (HealthDataException e) {
                throw new CompletionException(e);
            }
        }, executor);
    }

    @FunctionalInterface
    private interface HealthDataCall<T> {
        T execute() throws HealthDataException;
    }
}
