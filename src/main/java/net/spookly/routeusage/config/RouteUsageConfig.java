package net.spookly.routeusage.config;

public class RouteUsageConfig {
    public ReportingConfig reporting;
    public RegistryConfig registry;

    public static class ReportingConfig {
        public Boolean enabled;
        /**
         * Period between two reporting passes.
         */
        public Integer intervalSeconds;
        public Integer initialDelaySeconds;
        /**
         * Sink receiving the computed counts: {@code log} or {@code none}.
         */
        public String sink;
    }

    public static class RegistryConfig {
        public Boolean auditEvents;
    }
}
