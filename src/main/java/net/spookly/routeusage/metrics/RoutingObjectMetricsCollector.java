package net.spookly.routeusage.metrics;

/**
 * Write side used by the reconciler to keep routing object state current.
 */
public interface RoutingObjectMetricsCollector {
    /**
     * Add or replace the state stored for the given routing object key.
     */
    void setRoutingObject(String key, RoutingObjectState state);

    /**
     * Remove the given routing object key. Unknown keys are ignored.
     */
    void deleteRoutingObject(String key);
}
