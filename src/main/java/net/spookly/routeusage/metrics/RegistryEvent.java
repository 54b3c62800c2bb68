package net.spookly.routeusage.metrics;

import lombok.Value;
import lombok.experimental.Accessors;

import java.time.Instant;

/**
 * Snapshot of a registry state change for audit logging.
 */
@Value
@Accessors(fluent = true)
public class RegistryEvent {
    RegistryEventType type;
    Instant timestamp;
    String key;
    /**
     * Number of entries in the affected store after the change.
     */
    int storeSize;
}
