package net.spookly.routeusage.metrics;

import net.spookly.routeusage.feature.BackendFeature;
import net.spookly.routeusage.feature.FeatureClassifier;
import net.spookly.routeusage.feature.FrontendFeature;
import net.spookly.routeusage.model.Backend;
import net.spookly.routeusage.model.BackendId;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Folds the routing object store into per-feature usage counts.
 * <p>
 * Backends are counted by identity: a service port referenced from several routing objects
 * contributes once. When the same identity appears with different settings, the first one seen in
 * registration order wins.
 */
public final class FeatureUsageAggregator {
    private final FeatureStateRegistry registry;

    public FeatureUsageAggregator(FeatureStateRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    public ObjectFeatureCounts computeObjectMetrics() {
        Map<String, RoutingObjectState> snapshot = registry.routingObjectSnapshot();

        Map<FrontendFeature, Integer> objectCounts = new EnumMap<>(FrontendFeature.class);
        for (FrontendFeature feature : FrontendFeature.values()) {
            objectCounts.put(feature, 0);
        }
        Map<BackendFeature, Integer> backendCounts = new EnumMap<>(BackendFeature.class);
        for (BackendFeature feature : BackendFeature.values()) {
            backendCounts.put(feature, 0);
        }

        Map<BackendId, Backend> distinctBackends = new LinkedHashMap<>();
        for (RoutingObjectState state : snapshot.values()) {
            for (FrontendFeature feature : FeatureClassifier.classifyFrontend(state.routingObject())) {
                objectCounts.merge(feature, 1, Integer::sum);
            }
            for (Backend backend : state.backends()) {
                distinctBackends.putIfAbsent(backend.id(), backend);
            }
        }

        for (Backend backend : distinctBackends.values()) {
            for (BackendFeature feature : FeatureClassifier.classifyBackend(backend)) {
                backendCounts.merge(feature, 1, Integer::sum);
            }
        }
        return new ObjectFeatureCounts(
                Collections.unmodifiableMap(objectCounts),
                Collections.unmodifiableMap(backendCounts)
        );
    }
}
