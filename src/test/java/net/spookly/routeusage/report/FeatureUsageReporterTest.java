package net.spookly.routeusage.report;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import net.spookly.routeusage.config.RouteUsageConfig;
import net.spookly.routeusage.feature.BackendFeature;
import net.spookly.routeusage.feature.FrontendFeature;
import net.spookly.routeusage.feature.NegFeature;
import net.spookly.routeusage.metrics.BackendGroupAggregator;
import net.spookly.routeusage.metrics.FeatureStateRegistry;
import net.spookly.routeusage.metrics.FeatureUsageAggregator;
import net.spookly.routeusage.model.BackendGroupState;
import net.spookly.routeusage.testutil.RoutingFixtures;
import org.junit.jupiter.api.Test;

class FeatureUsageReporterTest {
    @Test
    void runOncePublishesAllThreeMaps() {
        FeatureStateRegistry registry = new FeatureStateRegistry();
        RoutingFixtures.Scenario scenario = RoutingFixtures.scenario(4);
        registry.setRoutingObject(scenario.object().key(), scenario.state());
        registry.setBackendGroup("default/foo-service", new BackendGroupState(0, 2, 0));
        List<FeatureUsageSnapshot> published = new CopyOnWriteArrayList<>();
        FeatureUsageReporter reporter = reporter(registry, published::add, 60);

        FeatureUsageSnapshot snapshot = reporter.runOnce();

        assertEquals(List.of(snapshot), published);
        assertNotNull(snapshot.computedAt());
        assertEquals(1, snapshot.objectFeatureCounts().get(FrontendFeature.PATH_BASED_ROUTING));
        assertEquals(1, snapshot.backendFeatureCounts().get(BackendFeature.CUSTOM_REQUEST_HEADERS));
        assertEquals(2, snapshot.groupFeatureCounts().get(NegFeature.NEG));
        reporter.close();
    }

    @Test
    void sinkFailureIsContained() {
        FeatureUsageReporter reporter = reporter(new FeatureStateRegistry(), snapshot -> {
            throw new IllegalStateException("sink down");
        }, 60);

        FeatureUsageSnapshot snapshot = reporter.runOnce();

        assertEquals(0, snapshot.objectFeatureCounts().get(FrontendFeature.INGRESS));
        reporter.close();
    }

    @Test
    void startSchedulesPeriodicPasses() throws InterruptedException {
        CountDownLatch passes = new CountDownLatch(2);
        FeatureUsageReporter reporter = reporter(new FeatureStateRegistry(), snapshot -> passes.countDown(), 1);

        reporter.start();
        try {
            assertTrue(reporter.isRunning());
            assertTrue(passes.await(5, TimeUnit.SECONDS));
        } finally {
            reporter.stop();
        }
        assertFalse(reporter.isRunning());
    }

    @Test
    void stopIsIdempotentAndPreventsRestart() {
        FeatureUsageReporter reporter = reporter(new FeatureStateRegistry(), FeatureUsageSink.NOOP, 60);

        reporter.stop();
        reporter.stop();
        reporter.start();

        assertFalse(reporter.isRunning());
    }

    @Test
    void racingStartAndStopLeavesReporterStopped() throws Exception {
        ExecutorService callers = Executors.newFixedThreadPool(2);
        try {
            for (int i = 0; i < 200; i++) {
                FeatureUsageReporter reporter = reporter(new FeatureStateRegistry(), FeatureUsageSink.NOOP, 60);
                CountDownLatch go = new CountDownLatch(1);
                Future<?> starter = callers.submit(() -> {
                    go.await();
                    reporter.start();
                    return null;
                });
                Future<?> stopper = callers.submit(() -> {
                    go.await();
                    reporter.stop();
                    return null;
                });
                go.countDown();

                starter.get(5, TimeUnit.SECONDS);
                stopper.get(5, TimeUnit.SECONDS);
                assertFalse(reporter.isRunning());
            }
        } finally {
            callers.shutdownNow();
        }
    }

    @Test
    void disabledReportingDoesNotSchedule() {
        RouteUsageConfig config = new RouteUsageConfig();
        config.reporting = new RouteUsageConfig.ReportingConfig();
        config.reporting.enabled = false;
        FeatureStateRegistry registry = new FeatureStateRegistry();
        FeatureUsageReporter reporter = FeatureUsageReporter.fromConfig(config,
                new FeatureUsageAggregator(registry), new BackendGroupAggregator(registry));

        reporter.start();

        assertFalse(reporter.isRunning());
        reporter.close();
    }

    @Test
    void loggingSinkFormatsLabelsInVocabularyOrder() {
        FeatureUsageSnapshot snapshot = new FeatureUsageSnapshot(
                Instant.parse("2024-01-01T00:00:00Z"),
                Map.of(),
                Map.of(),
                new EnumMap<>(Map.of(
                        NegFeature.STANDALONE_NEG, 5,
                        NegFeature.INGRESS_NEG, 4,
                        NegFeature.ASM_NEG, 3,
                        NegFeature.NEG, 12
                ))
        );

        assertEquals(
                "feature_usage scope=backend_group StandaloneNEG=5 IngressNEG=4 AsmNEG=3 NEG=12"
                        + " computedAt=2024-01-01T00:00:00Z",
                LoggingFeatureUsageSink.format("backend_group", snapshot.groupFeatureCounts(), snapshot)
        );
    }

    private static FeatureUsageReporter reporter(FeatureStateRegistry registry, FeatureUsageSink sink, int interval) {
        return new FeatureUsageReporter(
                new FeatureUsageAggregator(registry),
                new BackendGroupAggregator(registry),
                sink,
                interval,
                0
        );
    }
}
