package net.spookly.routeusage.report;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import net.spookly.routeusage.config.ConfigDefaults;
import net.spookly.routeusage.config.RouteUsageConfig;
import net.spookly.routeusage.feature.NegFeature;
import net.spookly.routeusage.metrics.BackendGroupAggregator;
import net.spookly.routeusage.metrics.FeatureUsageAggregator;
import net.spookly.routeusage.metrics.ObjectFeatureCounts;

/**
 * Periodically computes feature usage and publishes it to a sink.
 */
public final class FeatureUsageReporter implements AutoCloseable {
    private final FeatureUsageAggregator aggregator;
    private final BackendGroupAggregator groupAggregator;
    private final FeatureUsageSink sink;
    private final boolean enabled;
    private final int intervalSeconds;
    private final int initialDelaySeconds;
    private final ScheduledExecutorService scheduler;
    private final AtomicBoolean stopped = new AtomicBoolean(false);
    // Guarded by this.
    private ScheduledFuture<?> scheduledTask;

    public FeatureUsageReporter(FeatureUsageAggregator aggregator,
                                BackendGroupAggregator groupAggregator,
                                FeatureUsageSink sink,
                                int intervalSeconds,
                                int initialDelaySeconds) {
        this(aggregator, groupAggregator, sink, true, intervalSeconds, initialDelaySeconds);
    }

    private FeatureUsageReporter(FeatureUsageAggregator aggregator,
                                 BackendGroupAggregator groupAggregator,
                                 FeatureUsageSink sink,
                                 boolean enabled,
                                 int intervalSeconds,
                                 int initialDelaySeconds) {
        this.aggregator = Objects.requireNonNull(aggregator, "aggregator");
        this.groupAggregator = Objects.requireNonNull(groupAggregator, "groupAggregator");
        this.sink = sink == null ? FeatureUsageSink.NOOP : sink;
        this.enabled = enabled;
        this.intervalSeconds = intervalSeconds;
        this.initialDelaySeconds = Math.max(0, initialDelaySeconds);
        this.scheduler = Executors.newSingleThreadScheduledExecutor(threadFactory());
    }

    /**
     * Build a reporter whose schedule and sink come from config.
     */
    public static FeatureUsageReporter fromConfig(RouteUsageConfig config,
                                                  FeatureUsageAggregator aggregator,
                                                  BackendGroupAggregator groupAggregator) {
        RouteUsageConfig.ReportingConfig reporting = config == null ? null : config.reporting;
        boolean enabled = true;
        int interval = ConfigDefaults.DEFAULT_INTERVAL_SECONDS;
        int initialDelay = 0;
        FeatureUsageSink sink = LoggingFeatureUsageSink.INSTANCE;
        if (reporting != null) {
            if (reporting.enabled != null) {
                enabled = reporting.enabled;
            }
            if (reporting.intervalSeconds != null) {
                interval = reporting.intervalSeconds;
            }
            if (reporting.initialDelaySeconds != null) {
                initialDelay = reporting.initialDelaySeconds;
            }
            if ("none".equalsIgnoreCase(reporting.sink)) {
                sink = FeatureUsageSink.NOOP;
            }
        }
        return new FeatureUsageReporter(aggregator, groupAggregator, sink, enabled, interval, initialDelay);
    }

    /**
     * Start periodic reporting when enabled.
     */
    public synchronized void start() {
        if (stopped.get() || !enabled || scheduledTask != null) {
            return;
        }
        if (intervalSeconds <= 0) {
            return;
        }
        scheduledTask = scheduler.scheduleAtFixedRate(
                this::runOnceSafely, initialDelaySeconds, intervalSeconds, TimeUnit.SECONDS);
    }

    /**
     * Stop periodic reporting.
     */
    public synchronized void stop() {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        if (scheduledTask != null) {
            scheduledTask.cancel(false);
            scheduledTask = null;
        }
        scheduler.shutdownNow();
    }

    @Override
    public void close() {
        stop();
    }

    public synchronized boolean isRunning() {
        return scheduledTask != null && !stopped.get();
    }

    /**
     * Compute both aggregations and publish them. Sink failures are reported and swallowed so the
     * schedule keeps running.
     */
    public FeatureUsageSnapshot runOnce() {
        ObjectFeatureCounts objectCounts = aggregator.computeObjectMetrics();
        Map<NegFeature, Integer> groupCounts = groupAggregator.computeGroupMetrics();
        FeatureUsageSnapshot snapshot = new FeatureUsageSnapshot(
                Instant.now(),
                objectCounts.objectFeatureCounts(),
                objectCounts.backendFeatureCounts(),
                groupCounts
        );
        try {
            sink.publish(snapshot);
        } catch (RuntimeException e) {
            System.err.println("Failed to publish feature usage: " + e.getMessage());
        }
        return snapshot;
    }

    private void runOnceSafely() {
        try {
            runOnce();
        } catch (RuntimeException e) {
            // An exception escaping a scheduled task cancels every later run.
            System.err.println("Feature usage reporting pass failed: " + e.getMessage());
        }
    }

    private static ThreadFactory threadFactory() {
        return runnable -> {
            Thread thread = new Thread(runnable, "route-usage-reporter");
            thread.setDaemon(true);
            return thread;
        };
    }
}
