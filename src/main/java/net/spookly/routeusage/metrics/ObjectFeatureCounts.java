package net.spookly.routeusage.metrics;

import lombok.Value;
import lombok.experimental.Accessors;
import net.spookly.routeusage.feature.BackendFeature;
import net.spookly.routeusage.feature.FrontendFeature;

import java.util.Map;

/**
 * Result of one routing object aggregation pass. Both maps cover their full vocabulary.
 */
@Value
@Accessors(fluent = true)
public class ObjectFeatureCounts {
    /**
     * Number of routing objects using each frontend feature.
     */
    Map<FrontendFeature, Integer> objectFeatureCounts;
    /**
     * Number of distinct backends using each backend feature.
     */
    Map<BackendFeature, Integer> backendFeatureCounts;
}
