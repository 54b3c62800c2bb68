package net.spookly.routeusage.config;

import java.util.ArrayList;
import java.util.List;

public final class ConfigValidator {
    private ConfigValidator() {
    }

    /**
     * Validate configuration, throwing ConfigException on any violations.
     */
    public static void validate(RouteUsageConfig config) {
        List<String> errors = new ArrayList<>();
        if (config == null) {
            errors.add("config is required");
            throwIfErrors(errors);
            return;
        }

        validateReporting(config, errors);

        throwIfErrors(errors);
    }

    private static void validateReporting(RouteUsageConfig config, List<String> errors) {
        RouteUsageConfig.ReportingConfig reporting = config.reporting;
        if (reporting == null) {
            errors.add("reporting section is required");
            return;
        }
        if (reporting.intervalSeconds != null) {
            requirePositive(errors, reporting.intervalSeconds, "reporting.intervalSeconds");
        }
        if (reporting.initialDelaySeconds != null && reporting.initialDelaySeconds < 0) {
            errors.add("reporting.initialDelaySeconds must not be negative");
        }
        if (!isBlank(reporting.sink) && !isOneOf(reporting.sink, "log", "none")) {
            errors.add("reporting.sink must be one of: log, none");
        }
    }

    private static void requirePositive(List<String> errors, Integer value, String field) {
        if (value == null || value <= 0) {
            errors.add(field + " must be greater than 0");
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }

    private static boolean isOneOf(String value, String... options) {
        if (value == null) {
            return false;
        }
        for (String option : options) {
            if (value.equalsIgnoreCase(option)) {
                return true;
            }
        }
        return false;
    }

    private static void throwIfErrors(List<String> errors) {
        if (!errors.isEmpty()) {
            StringBuilder builder = new StringBuilder("Invalid config:\n");
            for (String error : errors) {
                builder.append("- ").append(error).append('\n');
            }
            throw new ConfigException(builder.toString());
        }
    }
}
