package net.spookly.routeusage.report;

import net.spookly.routeusage.feature.FeatureTag;

import java.util.Map;

/**
 * Sink that prints one {@code feature_usage} line per feature vocabulary.
 */
public final class LoggingFeatureUsageSink implements FeatureUsageSink {
    public static final LoggingFeatureUsageSink INSTANCE = new LoggingFeatureUsageSink();

    private LoggingFeatureUsageSink() {
    }

    @Override
    public void publish(FeatureUsageSnapshot snapshot) {
        System.out.println(format("routing_object", snapshot.objectFeatureCounts(), snapshot));
        System.out.println(format("backend", snapshot.backendFeatureCounts(), snapshot));
        System.out.println(format("backend_group", snapshot.groupFeatureCounts(), snapshot));
    }

    static String format(String scope, Map<? extends FeatureTag, Integer> counts, FeatureUsageSnapshot snapshot) {
        StringBuilder builder = new StringBuilder("feature_usage");
        builder.append(" scope=").append(scope);
        for (Map.Entry<? extends FeatureTag, Integer> entry : counts.entrySet()) {
            builder.append(' ').append(entry.getKey().label()).append('=').append(entry.getValue());
        }
        builder.append(" computedAt=").append(snapshot.computedAt());
        return builder.toString();
    }
}
