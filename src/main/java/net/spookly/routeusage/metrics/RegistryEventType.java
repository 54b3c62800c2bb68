package net.spookly.routeusage.metrics;

/**
 * Audit event types emitted by the state registry.
 */
public enum RegistryEventType {
    SET_ROUTING_OBJECT,
    DELETE_ROUTING_OBJECT,
    SET_BACKEND_GROUP,
    DELETE_BACKEND_GROUP
}
