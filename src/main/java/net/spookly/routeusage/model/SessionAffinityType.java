package net.spookly.routeusage.model;

/**
 * Load balancer session affinity modes understood by the classifier.
 */
public enum SessionAffinityType {
    NONE,
    CLIENT_IP,
    GENERATED_COOKIE;

    /**
     * Parse the wire spelling, mapping anything unknown to {@link #NONE}.
     */
    public static SessionAffinityType parse(String value) {
        if (value == null) {
            return NONE;
        }
        String normalized = value.trim();
        for (SessionAffinityType type : values()) {
            if (type.name().equalsIgnoreCase(normalized)) {
                return type;
            }
        }
        return NONE;
    }
}
