package net.spookly.routeusage.metrics;

import net.spookly.routeusage.feature.NegFeature;
import net.spookly.routeusage.model.BackendGroupState;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Sums backend group tallies across all registered services.
 */
public final class BackendGroupAggregator {
    private final FeatureStateRegistry registry;

    public BackendGroupAggregator(FeatureStateRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    /**
     * Sum every counter across services. Totals beyond {@link Integer#MAX_VALUE} are clamped to it.
     */
    public Map<NegFeature, Integer> computeGroupMetrics() {
        long standalone = 0;
        long ingress = 0;
        long mesh = 0;
        long total = 0;
        for (BackendGroupState state : registry.backendGroupSnapshot().values()) {
            standalone += state.standaloneCount();
            ingress += state.ingressCount();
            mesh += state.meshCount();
            total += state.total();
        }
        Map<NegFeature, Integer> counts = new EnumMap<>(NegFeature.class);
        counts.put(NegFeature.STANDALONE_NEG, saturate(standalone));
        counts.put(NegFeature.INGRESS_NEG, saturate(ingress));
        counts.put(NegFeature.ASM_NEG, saturate(mesh));
        counts.put(NegFeature.NEG, saturate(total));
        return Collections.unmodifiableMap(counts);
    }

    private static int saturate(long value) {
        return (int) Math.min(value, Integer.MAX_VALUE);
    }
}
