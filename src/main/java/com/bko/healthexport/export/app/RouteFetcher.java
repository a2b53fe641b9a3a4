package com.bko.healthexport.export.app;

import com.bko.healthexport.export.model.RoutePoint;
import com.bko.healthexport.healthdata.HealthDataPort;
import com.bko.healthexport.healthdata.ProviderLocation;
import com.bko.healthexport.healthdata.ProviderRoute;
import com.bko.healthexport.healthdata.ProviderWorkout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;

@Component
public class RouteFetcher {
    private static final Logger logger = LoggerFactory.getLogger(RouteFetcher.class);

    private final HealthDataPort healthDataPort;

    public RouteFetcher(HealthDataPort healthDataPort) {
        this.healthDataPort = healthDataPort;
    }

    public CompletableFuture<List<RoutePoint>> fetch(ProviderWorkout workout) {
        CompletableFuture<Optional<ProviderRoute>> lookup = healthDataPort.findRoute(workout.id());
        AtomicReference<CompletableFuture<Void>> stream = new AtomicReference<>();
        CompletableFuture<List<RoutePoint>> points = lookup.thenCompose(route -> route
                .map(found -> collectPoints(found, stream))
                .orElseGet(() -> {
                    logger.debug("Workout {} has no route", workout.id());
                    return CompletableFuture.completedFuture(List.of());
                }));
        points.whenComplete((value, failure) -> {
            CompletableFuture<Void> started = stream.get();
            if (failure instanceof CancellationException && started != null) {
                started.cancel(true);
            }
        });
        return ProviderCalls.cancelWith(points, lookup);
    }

    private CompletableFuture<List<RoutePoint>> collectPoints(ProviderRoute route,
                                                              AtomicReference<CompletableFuture<Void>> stream) {
        List<RoutePoint> points = new ArrayList<>();
        CompletableFuture<Void> streaming = healthDataPort.streamRouteLocations(route,
                batch -> batch.forEach(location -> points.add(toRoutePoint(location))));
        stream.set(streaming);
        return streaming.thenApply(done -> List.copyOf(points));
    }

    static RoutePoint toRoutePoint(ProviderLocation location) {
        return new RoutePoint(
                location.latitude(),
                location.longitude(),
                location.altitude(),
                location.timestamp(),
                availableOrNull(location.horizontalAccuracy()),
                availableOrNull(location.speed())
        );
    }

    // negative means unavailable
    private static Double availableOrNull(double value) {
        return value >= 0 ? value : null;
    }
}
