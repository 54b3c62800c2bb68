package net.spookly.routeusage.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import lombok.experimental.Accessors;

import java.util.List;

/**
 * One host section of a routing object with its ordered path entries.
 */
@Getter
@Accessors(fluent = true)
@EqualsAndHashCode
@ToString
public final class RoutingRule {
    private final String host;
    private final List<PathRule> paths;

    public RoutingRule(String host, List<PathRule> paths) {
        this.host = host;
        this.paths = paths == null ? List.of() : List.copyOf(paths);
    }

    /**
     * Host-only rule without path entries.
     */
    public static RoutingRule hostOnly(String host) {
        return new RoutingRule(host, List.of());
    }

    public boolean hasHost() {
        return host != null && !host.isEmpty();
    }

    public boolean hasPaths() {
        return !paths.isEmpty();
    }
}
