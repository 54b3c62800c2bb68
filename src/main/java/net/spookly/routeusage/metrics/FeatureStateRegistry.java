package net.spookly.routeusage.metrics;

import lombok.NonNull;
import net.spookly.routeusage.config.RouteUsageConfig;
import net.spookly.routeusage.model.BackendGroupState;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-memory store of the latest routing object and backend group state per key.
 * <p>
 * Each store keeps keys in first-insertion order; replacing a value keeps its position. Readers in
 * this package take copies under the store lock, so an aggregation pass never sees a half-applied write.
 */
public final class FeatureStateRegistry implements RoutingObjectMetricsCollector, BackendGroupMetricsCollector {
    private final Map<String, RoutingObjectState> routingObjects = new LinkedHashMap<>();
    private final Map<String, BackendGroupState> backendGroups = new LinkedHashMap<>();
    private final ReentrantLock routingObjectLock = new ReentrantLock();
    private final ReentrantLock backendGroupLock = new ReentrantLock();
    private final RegistryEventListener eventListener;

    public FeatureStateRegistry() {
        this(RegistryEventListener.NOOP);
    }

    /**
     * Create a registry that reports every state change to an audit listener.
     */
    public FeatureStateRegistry(RegistryEventListener eventListener) {
        this.eventListener = eventListener == null ? RegistryEventListener.NOOP : eventListener;
    }

    /**
     * Build a registry, attaching the audit logger when {@code registry.auditEvents} is set.
     */
    public static FeatureStateRegistry fromConfig(RouteUsageConfig config) {
        if (config != null && config.registry != null && Boolean.TRUE.equals(config.registry.auditEvents)) {
            return new FeatureStateRegistry(RegistryAuditLogger.INSTANCE);
        }
        return new FeatureStateRegistry();
    }

    @Override
    public void setRoutingObject(@NonNull String key, @NonNull RoutingObjectState state) {
        int size;
        routingObjectLock.lock();
        try {
            routingObjects.put(key, state);
            size = routingObjects.size();
        } finally {
            routingObjectLock.unlock();
        }
        emit(RegistryEventType.SET_ROUTING_OBJECT, key, size);
    }

    @Override
    public void deleteRoutingObject(@NonNull String key) {
        boolean removed;
        int size;
        routingObjectLock.lock();
        try {
            removed = routingObjects.remove(key) != null;
            size = routingObjects.size();
        } finally {
            routingObjectLock.unlock();
        }
        if (removed) {
            emit(RegistryEventType.DELETE_ROUTING_OBJECT, key, size);
        }
    }

    @Override
    public void setBackendGroup(@NonNull String key, @NonNull BackendGroupState state) {
        int size;
        backendGroupLock.lock();
        try {
            backendGroups.put(key, state);
            size = backendGroups.size();
        } finally {
            backendGroupLock.unlock();
        }
        emit(RegistryEventType.SET_BACKEND_GROUP, key, size);
    }

    @Override
    public void deleteBackendGroup(@NonNull String key) {
        boolean removed;
        int size;
        backendGroupLock.lock();
        try {
            removed = backendGroups.remove(key) != null;
            size = backendGroups.size();
        } finally {
            backendGroupLock.unlock();
        }
        if (removed) {
            emit(RegistryEventType.DELETE_BACKEND_GROUP, key, size);
        }
    }

    /**
     * Point-in-time copy of the routing object store in key insertion order.
     */
    Map<String, RoutingObjectState> routingObjectSnapshot() {
        routingObjectLock.lock();
        try {
            return Collections.unmodifiableMap(new LinkedHashMap<>(routingObjects));
        } finally {
            routingObjectLock.unlock();
        }
    }

    /**
     * Point-in-time copy of the backend group store in key insertion order.
     */
    Map<String, BackendGroupState> backendGroupSnapshot() {
        backendGroupLock.lock();
        try {
            return Collections.unmodifiableMap(new LinkedHashMap<>(backendGroups));
        } finally {
            backendGroupLock.unlock();
        }
    }

    private void emit(RegistryEventType type, String key, int storeSize) {
        try {
            eventListener.onEvent(new RegistryEvent(type, Instant.now(), key, storeSize));
        } catch (RuntimeException e) {
            System.err.println("Failed to emit registry audit event: " + e.getMessage());
        }
    }
}
