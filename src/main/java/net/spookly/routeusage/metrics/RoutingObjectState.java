package net.spookly.routeusage.metrics;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;
import lombok.experimental.Accessors;
import net.spookly.routeusage.model.Backend;
import net.spookly.routeusage.model.RoutingObject;

import java.util.List;

/**
 * A routing object together with the backends it resolves to.
 */
@Getter
@Accessors(fluent = true)
@EqualsAndHashCode
@ToString
public final class RoutingObjectState {
    private final RoutingObject routingObject;
    private final List<Backend> backends;

    private RoutingObjectState(RoutingObject routingObject, List<Backend> backends) {
        this.routingObject = routingObject;
        this.backends = backends;
    }

    public static RoutingObjectState of(@NonNull RoutingObject routingObject, List<Backend> backends) {
        return new RoutingObjectState(routingObject, backends == null ? List.of() : List.copyOf(backends));
    }
}
