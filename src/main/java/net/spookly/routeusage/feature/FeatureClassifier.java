package net.spookly.routeusage.feature;

import net.spookly.routeusage.model.Backend;
import net.spookly.routeusage.model.BackendConfig;
import net.spookly.routeusage.model.RoutingObject;
import net.spookly.routeusage.model.RoutingRule;
import net.spookly.routeusage.model.SessionAffinityType;
import net.spookly.routeusage.model.TlsSpec;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Maps routing objects and backends to the capability tags they use.
 * <p>
 * Results are duplicate-free and ordered by first appearance, so two calls on equal input
 * return equal lists.
 */
public final class FeatureClassifier {
    private FeatureClassifier() {
    }

    /**
     * Frontend features of a single routing object.
     */
    public static List<FrontendFeature> classifyFrontend(RoutingObject object) {
        Set<FrontendFeature> features = new LinkedHashSet<>();
        features.add(FrontendFeature.INGRESS);

        if (isInternalClass(object.annotation(RoutingAnnotations.INGRESS_CLASS))) {
            features.add(FrontendFeature.INTERNAL_INGRESS);
        } else {
            features.add(FrontendFeature.EXTERNAL_INGRESS);
        }

        if (isHttpAllowed(object)) {
            features.add(FrontendFeature.HTTP_ENABLED);
        }

        boolean hostBased = false;
        boolean pathBased = false;
        for (RoutingRule rule : object.rules()) {
            hostBased |= rule.hasHost();
            pathBased |= rule.hasPaths();
            if (hostBased && pathBased) {
                break;
            }
        }
        if (hostBased) {
            features.add(FrontendFeature.HOST_BASED_ROUTING);
        }
        if (pathBased) {
            features.add(FrontendFeature.PATH_BASED_ROUTING);
        }

        boolean tls = false;
        if (hasValue(object.annotation(RoutingAnnotations.PRE_SHARED_CERT))) {
            tls = true;
            features.add(FrontendFeature.PRE_SHARED_CERTS_FOR_TLS);
        }
        if (hasValue(object.annotation(RoutingAnnotations.MANAGED_CERTIFICATES))) {
            tls = true;
            features.add(FrontendFeature.MANAGED_CERTS_FOR_TLS);
        }
        if (hasSecretBasedCerts(object)) {
            tls = true;
            features.add(FrontendFeature.SECRET_BASED_CERTS_FOR_TLS);
        }
        if (tls) {
            features.add(FrontendFeature.TLS_TERMINATION);
        }

        // User-reserved and controller-reserved static addresses both count.
        if (hasValue(object.annotation(RoutingAnnotations.STATIC_IP))) {
            features.add(FrontendFeature.STATIC_GLOBAL_IP);
        }
        return Collections.unmodifiableList(new ArrayList<>(features));
    }

    /**
     * Backend features of a single service port.
     */
    public static List<BackendFeature> classifyBackend(Backend backend) {
        Set<BackendFeature> features = new LinkedHashSet<>();
        features.add(BackendFeature.SERVICE_PORT);
        if (backend.internalLoadBalancerEnabled()) {
            features.add(BackendFeature.INTERNAL_SERVICE_PORT);
        } else {
            features.add(BackendFeature.EXTERNAL_SERVICE_PORT);
        }
        if (backend.negEnabled()) {
            features.add(BackendFeature.NEG);
        }
        BackendConfig config = backend.config();
        if (config != null) {
            addConfigFeatures(config, features);
        }
        return Collections.unmodifiableList(new ArrayList<>(features));
    }

    private static void addConfigFeatures(BackendConfig config, Set<BackendFeature> features) {
        if (config.cdn() != null && config.cdn().enabled()) {
            features.add(BackendFeature.CLOUD_CDN);
        }
        if (config.iap() != null && config.iap().enabled()) {
            features.add(BackendFeature.CLOUD_IAP);
        }
        if (config.sessionAffinity() != null) {
            SessionAffinityType type = config.sessionAffinity().affinityType();
            if (type == SessionAffinityType.GENERATED_COOKIE) {
                features.add(BackendFeature.COOKIE_AFFINITY);
            } else if (type == SessionAffinityType.CLIENT_IP) {
                features.add(BackendFeature.CLIENT_IP_AFFINITY);
            }
        }
        if (config.securityPolicy() != null && hasValue(config.securityPolicy().name())) {
            features.add(BackendFeature.CLOUD_ARMOR);
        }
        if (config.connectionDraining() != null) {
            features.add(BackendFeature.BACKEND_CONNECTION_DRAINING);
        }
        if (config.timeoutSec() != null) {
            features.add(BackendFeature.BACKEND_TIMEOUT);
        }
        // An explicitly empty header list still counts as configured.
        if (config.customRequestHeaders() != null) {
            features.add(BackendFeature.CUSTOM_REQUEST_HEADERS);
        }
    }

    private static boolean isInternalClass(String ingressClass) {
        return ingressClass != null
                && RoutingAnnotations.GCE_INTERNAL_INGRESS_CLASS.equals(ingressClass.trim());
    }

    private static boolean isHttpAllowed(RoutingObject object) {
        Boolean parsed = parseBoolean(object.annotation(RoutingAnnotations.ALLOW_HTTP));
        // Missing or unparsable values leave HTTP enabled.
        return parsed == null || parsed;
    }

    private static Boolean parseBoolean(String raw) {
        if (raw == null) {
            return null;
        }
        switch (raw) {
            case "1":
            case "t":
            case "T":
            case "true":
            case "TRUE":
            case "True":
                return Boolean.TRUE;
            case "0":
            case "f":
            case "F":
            case "false":
            case "FALSE":
            case "False":
                return Boolean.FALSE;
            default:
                return null;
        }
    }

    private static boolean hasSecretBasedCerts(RoutingObject object) {
        for (TlsSpec tls : object.tls()) {
            if (tls.hasSecret()) {
                return true;
            }
        }
        return false;
    }

    private static boolean hasValue(String value) {
        return value != null && !value.isEmpty();
    }
}
