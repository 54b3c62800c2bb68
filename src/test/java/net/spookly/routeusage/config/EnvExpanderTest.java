package net.spookly.routeusage.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

class EnvExpanderTest {
    @Test
    void expandsNestedEnvReferences() {
        Map<String, String> environment = Map.of("SINK", "none");
        Object raw = Map.of("reporting", Map.of("sink", "env:SINK", "tags", List.of("env:SINK", "plain")));

        Object expanded = EnvExpander.expand(raw, environment::get);

        assertEquals(Map.of("reporting", Map.of("sink", "none", "tags", List.of("none", "plain"))), expanded);
    }

    @Test
    void missingVariableFails() {
        ConfigException exception = assertThrows(ConfigException.class,
                () -> EnvExpander.expand("env:ROUTE_USAGE_MISSING", key -> null));

        assertEquals("Missing required environment variable: ROUTE_USAGE_MISSING", exception.getMessage());
    }
}
