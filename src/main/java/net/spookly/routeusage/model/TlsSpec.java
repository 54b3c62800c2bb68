package net.spookly.routeusage.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import lombok.experimental.Accessors;

import java.util.List;

@Getter
@Accessors(fluent = true)
@EqualsAndHashCode
@ToString
public final class TlsSpec {
    private final List<String> hosts;
    private final String secretName;

    public TlsSpec(List<String> hosts, String secretName) {
        this.hosts = hosts == null ? List.of() : List.copyOf(hosts);
        this.secretName = secretName;
    }

    public boolean hasSecret() {
        return secretName != null && !secretName.isEmpty();
    }
}
