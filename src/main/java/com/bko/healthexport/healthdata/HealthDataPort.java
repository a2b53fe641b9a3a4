package com.bko.healthexport.healthdata;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * Read-only access to the health-data provider. Every query is asynchronous; a failed query completes
 * its future exceptionally, typically with a {@link HealthDataException}.
 */
public interface HealthDataPort {

    /**
     * Completed workouts of the given kinds, most recently finished first.
     */
    CompletableFuture<List<ProviderWorkout>> findWorkouts(Set<ProviderActivityType> types, int limit);

    CompletableFuture<Optional<ProviderWorkout>> findWorkout(UUID id);

    /**
     * Aggregates of {@code kind} over {@code [start, end]}, empty when no samples exist in that range.
     */
    CompletableFuture<Optional<QuantityStatistics>> queryStatistics(QuantityKind kind, Instant start, Instant end);

    CompletableFuture<List<QuantitySample>> querySamples(SampleQuery query);

    /**
     * The route recorded for a workout. A workout has at most one.
     */
    CompletableFuture<Optional<ProviderRoute>> findRoute(UUID workoutId);

    /**
     * Streams the route's locations in chronological order, one batch at a time. Batches are handed to
     * {@code batchHandler} sequentially; the returned future completes once the last batch was delivered.
     * Cancelling the future stops the delivery of further batches.
     */
    CompletableFuture<Void> streamRouteLocations(ProviderRoute route, Consumer<List<ProviderLocation>> batchHandler);
}
