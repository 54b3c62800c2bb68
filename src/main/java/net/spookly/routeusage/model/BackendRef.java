package net.spookly.routeusage.model;

import lombok.Value;
import lombok.experimental.Accessors;

/**
 * Unresolved service reference as written on a routing object.
 */
@Value
@Accessors(fluent = true)
public class BackendRef {
    String serviceName;
    int port;
}
