package net.spookly.routeusage.feature;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Capabilities counted once per distinct backend identity.
 */
@Getter
@Accessors(fluent = true)
@AllArgsConstructor
public enum BackendFeature implements FeatureTag {
    SERVICE_PORT("ServicePort"),
    EXTERNAL_SERVICE_PORT("ExternalServicePort"),
    INTERNAL_SERVICE_PORT("InternalServicePort"),
    NEG("NEG"),
    CLOUD_CDN("CloudCDN"),
    CLOUD_IAP("CloudIAP"),
    COOKIE_AFFINITY("CookieAffinity"),
    CLIENT_IP_AFFINITY("ClientIPAffinity"),
    CLOUD_ARMOR("CloudArmor"),
    BACKEND_CONNECTION_DRAINING("BackendConnectionDraining"),
    BACKEND_TIMEOUT("BackendTimeout"),
    CUSTOM_REQUEST_HEADERS("CustomRequestHeaders");

    private final String label;
}
