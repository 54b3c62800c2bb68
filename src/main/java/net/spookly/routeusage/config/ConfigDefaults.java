package net.spookly.routeusage.config;

/**
 * Default configuration template written when no config file exists.
 */
public final class ConfigDefaults {
    public static final int DEFAULT_INTERVAL_SECONDS = 600;

    private static final String DEFAULT_YAML_TEMPLATE = """
            # Generated default route-usage config.
            reporting:
              enabled: true
              intervalSeconds: %d
              initialDelaySeconds: 0
              sink: log

            registry:
              auditEvents: false
            """;

    private ConfigDefaults() {
    }

    /**
     * Render the default configuration template.
     */
    public static String defaultYaml() {
        return DEFAULT_YAML_TEMPLATE.formatted(DEFAULT_INTERVAL_SECONDS);
    }
}
