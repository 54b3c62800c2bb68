package net.spookly.routeusage.metrics;

import net.spookly.routeusage.model.BackendGroupState;

/**
 * Write side used by the NEG controller to keep per-service group tallies current.
 */
public interface BackendGroupMetricsCollector {
    void setBackendGroup(String key, BackendGroupState state);

    void deleteBackendGroup(String key);
}
