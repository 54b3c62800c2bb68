package net.spookly.routeusage.report;

/**
 * Receives computed usage counts. Implementations own serialization and transport.
 */
@FunctionalInterface
public interface FeatureUsageSink {
    FeatureUsageSink NOOP = snapshot -> {
    };

    void publish(FeatureUsageSnapshot snapshot);
}
