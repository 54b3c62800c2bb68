package net.spookly.routeusage.feature;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Capabilities counted once per routing object.
 */
@Getter
@Accessors(fluent = true)
@AllArgsConstructor
public enum FrontendFeature implements FeatureTag {
    INGRESS("Ingress"),
    EXTERNAL_INGRESS("ExternalIngress"),
    INTERNAL_INGRESS("InternalIngress"),
    HTTP_ENABLED("HTTPEnabled"),
    HOST_BASED_ROUTING("HostBasedRouting"),
    PATH_BASED_ROUTING("PathBasedRouting"),
    TLS_TERMINATION("TLSTermination"),
    PRE_SHARED_CERTS_FOR_TLS("PreSharedCertsForTLS"),
    MANAGED_CERTS_FOR_TLS("ManagedCertsForTLS"),
    SECRET_BASED_CERTS_FOR_TLS("SecretBasedCertsForTLS"),
    STATIC_GLOBAL_IP("StaticGlobalIP");

    private final String label;
}
