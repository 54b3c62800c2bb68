package net.spookly.routeusage.model;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import lombok.Value;
import lombok.experimental.Accessors;

import java.util.List;

/**
 * Advanced traffic settings attached to a backend. Every section is optional; a null section
 * means the setting is not configured.
 */
@Getter
@Accessors(fluent = true)
@AllArgsConstructor
@EqualsAndHashCode
@ToString
public final class BackendConfig {
    private final CdnConfig cdn;
    private final IapConfig iap;
    private final SessionAffinityConfig sessionAffinity;
    private final SecurityPolicyConfig securityPolicy;
    private final ConnectionDrainingConfig connectionDraining;
    private final Integer timeoutSec;
    private final CustomRequestHeadersConfig customRequestHeaders;

    /**
     * Config object with no section set. Use the {@code with*} methods to add sections.
     */
    public static BackendConfig empty() {
        return new BackendConfig(null, null, null, null, null, null, null);
    }

    public BackendConfig withCdn(boolean enabled) {
        return new BackendConfig(new CdnConfig(enabled), iap, sessionAffinity, securityPolicy,
                connectionDraining, timeoutSec, customRequestHeaders);
    }

    public BackendConfig withIap(boolean enabled) {
        return new BackendConfig(cdn, new IapConfig(enabled), sessionAffinity, securityPolicy,
                connectionDraining, timeoutSec, customRequestHeaders);
    }

    public BackendConfig withSessionAffinity(SessionAffinityType type, Integer cookieTtlSec) {
        return new BackendConfig(cdn, iap, new SessionAffinityConfig(type, cookieTtlSec), securityPolicy,
                connectionDraining, timeoutSec, customRequestHeaders);
    }

    public BackendConfig withSecurityPolicy(String name) {
        return new BackendConfig(cdn, iap, sessionAffinity, new SecurityPolicyConfig(name),
                connectionDraining, timeoutSec, customRequestHeaders);
    }

    public BackendConfig withConnectionDraining(int drainingTimeoutSec) {
        return new BackendConfig(cdn, iap, sessionAffinity, securityPolicy,
                new ConnectionDrainingConfig(drainingTimeoutSec), timeoutSec, customRequestHeaders);
    }

    public BackendConfig withTimeoutSec(Integer value) {
        return new BackendConfig(cdn, iap, sessionAffinity, securityPolicy,
                connectionDraining, value, customRequestHeaders);
    }

    public BackendConfig withCustomRequestHeaders(List<String> headers) {
        return new BackendConfig(cdn, iap, sessionAffinity, securityPolicy,
                connectionDraining, timeoutSec, new CustomRequestHeadersConfig(headers));
    }

    @Value
    @Accessors(fluent = true)
    public static class CdnConfig {
        boolean enabled;
    }

    @Value
    @Accessors(fluent = true)
    public static class IapConfig {
        boolean enabled;
    }

    @Value
    @Accessors(fluent = true)
    public static class SessionAffinityConfig {
        SessionAffinityType affinityType;
        Integer affinityCookieTtlSec;
    }

    @Value
    @Accessors(fluent = true)
    public static class SecurityPolicyConfig {
        String name;
    }

    @Value
    @Accessors(fluent = true)
    public static class ConnectionDrainingConfig {
        int drainingTimeoutSec;
    }

    @Getter
    @Accessors(fluent = true)
    @EqualsAndHashCode
    @ToString
    public static final class CustomRequestHeadersConfig {
        private final List<String> headers;

        public CustomRequestHeadersConfig(List<String> headers) {
            this.headers = headers == null ? List.of() : List.copyOf(headers);
        }
    }
}
