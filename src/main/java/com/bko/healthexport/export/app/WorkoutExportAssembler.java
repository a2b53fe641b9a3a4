package com.bko.healthexport.export.app;

import com.bko.healthexport.export.model.ActivityData;
import com.bko.healthexport.export.model.HeartRateSample;
import com.bko.healthexport.export.model.RoutePoint;
import com.bko.healthexport.export.model.WorkoutData;
import com.bko.healthexport.export.model.WorkoutEventData;
import com.bko.healthexport.export.model.WorkoutExport;
import com.bko.healthexport.export.model.WorkoutStatistics;
import com.bko.healthexport.healthdata.HealthDataException;
import com.bko.healthexport.healthdata.ProviderWorkout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Builds the export document of one workout. Heart-rate samples and the route are fetched concurrently while
 * statistics, events and activities are extracted on the calling thread; the document is only assembled once
 * both fetches completed. Any failure fails the whole export.
 */
@Service
public class WorkoutExportAssembler {
    private static final Logger logger = LoggerFactory.getLogger(WorkoutExportAssembler.class);

    private final HeartRateFetcher heartRateFetcher;
    private final RouteFetcher routeFetcher;
    private final StatisticsExtractor statisticsExtractor;
    private final WorkoutEventExtractor eventExtractor;
    private final WorkoutActivityExtractor activityExtractor;
    private final Clock clock;

    public WorkoutExportAssembler(HeartRateFetcher heartRateFetcher,
                                  RouteFetcher routeFetcher,
                                  StatisticsExtractor statisticsExtractor,
                                  WorkoutEventExtractor eventExtractor,
                                  WorkoutActivityExtractor activityExtractor,
                                  Clock clock) {
        this.heartRateFetcher = heartRateFetcher;
        this.routeFetcher = routeFetcher;
        this.statisticsExtractor = statisticsExtractor;
        this.eventExtractor = eventExtractor;
        this.activityExtractor = activityExtractor;
        this.clock = clock;
    }

    /**
     * @throws HealthDataException the first provider failure; when both fetches fail, the heart-rate failure
     *                             with the route failure attached as suppressed
     */
    public WorkoutExport buildExport(ProviderWorkout workout) throws HealthDataException {
        logger.info("Building export for workout {} ({})", workout.id(), workout.activityType());
        CompletableFuture<List<HeartRateSample>> heartRate = heartRateFetcher.fetch(workout);
        CompletableFuture<List<RoutePoint>> route = routeFetcher.fetch(workout);

        try {
            WorkoutStatistics statistics = statisticsExtractor.extract(workout.startDate(), workout.endDate());
            List<WorkoutEventData> events = eventExtractor.extract(workout);
            List<ActivityData> activities = activityExtractor.extract(workout);
            TimeSeries timeSeries = awaitBoth(heartRate, route);

            WorkoutData data = new WorkoutData(
                    TypeTags.activityTag(workout.activityType()),
                    workout.sourceName(),
                    workout.startDate(),
                    workout.endDate(),
                    workout.duration(),
                    statistics,
                    timeSeries.heartRateSamples(),
                    timeSeries.route(),
                    events,
                    activities
            );
            logger.info("Export of workout {} ready: {} heart-rate samples, {} route points, {} events, {} activities",
                    workout.id(), data.heartRateSamples().size(), data.route().size(),
                    data.events().size(), data.activities().size());
            return new WorkoutExport(WorkoutExport.CURRENT_VERSION, clock.instant(), data);
        } catch (HealthDataException | RuntimeException e) {
            heartRate.cancel(true);
            route.cancel(true);
            throw e;
        }
    }

    private TimeSeries awaitBoth(CompletableFuture<List<HeartRateSample>> heartRate,
                                 CompletableFuture<List<RoutePoint>> route) throws HealthDataException {
        List<HeartRateSample> samples = null;
        List<RoutePoint> points = null;
        HealthDataException failure = null;
        try {
            samples = ProviderCalls.await(heartRate, "heart-rate samples");
        } catch (HealthDataException e) {
            failure = e;
        }
        try {
            points = ProviderCalls.await(route, "route");
        } catch (HealthDataException e) {
            if (failure == null) {
                failure = e;
            } else if (failure != e) {
                failure.addSuppressed(e);
            }
        }
        if (failure != null) {
            throw failure;
        }
        return new TimeSeries(samples, points);
    }

    private record TimeSeries(List<HeartRateSample> heartRateSamples, List<RoutePoint> route) {
    }
}
