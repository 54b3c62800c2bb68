package net.spookly.routeusage.report;

import lombok.Value;
import lombok.experimental.Accessors;
import net.spookly.routeusage.feature.BackendFeature;
import net.spookly.routeusage.feature.FrontendFeature;
import net.spookly.routeusage.feature.NegFeature;

import java.time.Instant;
import java.util.Map;

/**
 * Counts produced by one reporting pass, handed to a {@link FeatureUsageSink}.
 */
@Value
@Accessors(fluent = true)
public class FeatureUsageSnapshot {
    Instant computedAt;
    Map<FrontendFeature, Integer> objectFeatureCounts;
    Map<BackendFeature, Integer> backendFeatureCounts;
    Map<NegFeature, Integer> groupFeatureCounts;
}
