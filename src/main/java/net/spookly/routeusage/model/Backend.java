package net.spookly.routeusage.model;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;
import lombok.experimental.Accessors;

/**
 * Resolved service port that a routing object forwards traffic to.
 */
@Getter
@Accessors(fluent = true)
@AllArgsConstructor
@EqualsAndHashCode
@ToString
public final class Backend {
    @NonNull
    private final BackendId id;
    private final boolean negEnabled;
    private final boolean internalLoadBalancerEnabled;
    private final BackendConfig config;

    public static Backend of(String namespace, String serviceName, int port) {
        return new Backend(new BackendId(namespace, serviceName, port), false, false, null);
    }
}
