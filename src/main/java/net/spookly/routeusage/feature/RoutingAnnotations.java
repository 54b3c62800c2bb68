package net.spookly.routeusage.feature;

/**
 * Annotation keys and values read from routing objects during classification.
 */
public final class RoutingAnnotations {
    public static final String INGRESS_CLASS = "kubernetes.io/ingress.class";
    public static final String ALLOW_HTTP = "kubernetes.io/ingress.allow-http";
    public static final String STATIC_IP = "kubernetes.io/ingress.global-static-ip-name";
    public static final String PRE_SHARED_CERT = "ingress.gcp.kubernetes.io/pre-shared-cert";
    public static final String MANAGED_CERTIFICATES = "networking.gke.io/managed-certificates";

    public static final String GCE_INTERNAL_INGRESS_CLASS = "gce-internal";

    private RoutingAnnotations() {
    }
}
