package net.spookly.routeusage.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;
import lombok.experimental.Accessors;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable snapshot of a declarative HTTP routing resource.
 */
@Getter
@Accessors(fluent = true)
@EqualsAndHashCode
@ToString
public final class RoutingObject {
    private final String namespace;
    private final String name;
    private final BackendRef defaultBackend;
    private final List<RoutingRule> rules;
    private final Map<String, String> annotations;
    private final List<TlsSpec> tls;

    public RoutingObject(@NonNull String namespace,
                         @NonNull String name,
                         BackendRef defaultBackend,
                         List<RoutingRule> rules,
                         Map<String, String> annotations,
                         List<TlsSpec> tls) {
        this.namespace = namespace;
        this.name = name;
        this.defaultBackend = defaultBackend;
        this.rules = rules == null ? List.of() : List.copyOf(rules);
        this.annotations = annotations == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(annotations));
        this.tls = tls == null ? List.of() : List.copyOf(tls);
    }

    /**
     * Routing object with identity and annotations only.
     */
    public static RoutingObject of(String namespace, String name, Map<String, String> annotations) {
        return new RoutingObject(namespace, name, null, List.of(), annotations, List.of());
    }

    /**
     * Registry key in {@code namespace/name} form.
     */
    public String key() {
        return namespace + "/" + name;
    }

    public String annotation(String key) {
        return annotations.get(key);
    }
}
