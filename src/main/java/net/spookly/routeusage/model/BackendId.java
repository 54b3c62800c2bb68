package net.spookly.routeusage.model;

import lombok.Value;
import lombok.experimental.Accessors;

/**
 * Identity of a backend. Two backends with equal ids count as one during aggregation.
 */
@Value
@Accessors(fluent = true)
public class BackendId {
    String namespace;
    String serviceName;
    int port;

    @Override
    public String toString() {
        return namespace + "/" + serviceName + ":" + port;
    }
}
