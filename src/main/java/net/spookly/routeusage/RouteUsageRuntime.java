package net.spookly.routeusage;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.NonNull;
import lombok.experimental.Accessors;
import net.spookly.routeusage.config.ConfigLoader;
import net.spookly.routeusage.config.RouteUsageConfig;
import net.spookly.routeusage.metrics.BackendGroupAggregator;
import net.spookly.routeusage.metrics.BackendGroupMetricsCollector;
import net.spookly.routeusage.metrics.FeatureStateRegistry;
import net.spookly.routeusage.metrics.FeatureUsageAggregator;
import net.spookly.routeusage.metrics.RoutingObjectMetricsCollector;
import net.spookly.routeusage.report.FeatureUsageReporter;

import java.nio.file.Path;

/**
 * Registry, aggregators and reporter wired from one configuration.
 * <p>
 * Reconcilers write through {@link #routingObjects()} and {@link #backendGroups()}; the reporter reads
 * the same registry on its own thread.
 */
@Getter
@Accessors(fluent = true)
public final class RouteUsageRuntime implements AutoCloseable {
    private final RouteUsageConfig config;
    @Getter(AccessLevel.NONE)
    private final FeatureStateRegistry registry;
    private final FeatureUsageAggregator aggregator;
    private final BackendGroupAggregator groupAggregator;
    private final FeatureUsageReporter reporter;

    private RouteUsageRuntime(RouteUsageConfig config) {
        this.config = config;
        this.registry = FeatureStateRegistry.fromConfig(config);
        this.aggregator = new FeatureUsageAggregator(registry);
        this.groupAggregator = new BackendGroupAggregator(registry);
        this.reporter = FeatureUsageReporter.fromConfig(config, aggregator, groupAggregator);
    }

    /**
     * Load the YAML file at {@code configPath} and wire the components it configures.
     */
    public static RouteUsageRuntime load(@NonNull Path configPath) {
        return fromConfig(ConfigLoader.load(configPath));
    }

    public static RouteUsageRuntime fromConfig(@NonNull RouteUsageConfig config) {
        return new RouteUsageRuntime(config);
    }

    public RoutingObjectMetricsCollector routingObjects() {
        return registry;
    }

    public BackendGroupMetricsCollector backendGroups() {
        return registry;
    }

    /**
     * Start periodic reporting; a no-op when reporting is disabled.
     */
    public RouteUsageRuntime start() {
        reporter.start();
        return this;
    }

    @Override
    public void close() {
        reporter.stop();
    }
}
