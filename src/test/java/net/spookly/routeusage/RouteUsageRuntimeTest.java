package net.spookly.routeusage;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import net.spookly.routeusage.config.ConfigException;
import net.spookly.routeusage.feature.BackendFeature;
import net.spookly.routeusage.feature.FrontendFeature;
import net.spookly.routeusage.feature.NegFeature;
import net.spookly.routeusage.model.BackendGroupState;
import net.spookly.routeusage.report.FeatureUsageSnapshot;
import net.spookly.routeusage.testutil.RoutingFixtures;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class RouteUsageRuntimeTest {
    @Test
    void loadWiresRegistryIntoReporter(@TempDir Path tempDir) throws IOException {
        Path configPath = writeConfig(tempDir, "reporting:\n  enabled: true\n  intervalSeconds: 3600\n  sink: none\n");

        try (RouteUsageRuntime runtime = RouteUsageRuntime.load(configPath)) {
            RoutingFixtures.Scenario scenario = RoutingFixtures.scenario(4);
            runtime.routingObjects().setRoutingObject(scenario.object().key(), scenario.state());
            runtime.backendGroups().setBackendGroup("default/foo-service", new BackendGroupState(1, 2, 0));

            FeatureUsageSnapshot snapshot = runtime.reporter().runOnce();

            assertEquals(1, snapshot.objectFeatureCounts().get(FrontendFeature.INGRESS));
            assertEquals(1, snapshot.backendFeatureCounts().get(BackendFeature.SERVICE_PORT));
            assertEquals(3, snapshot.groupFeatureCounts().get(NegFeature.NEG));
        }
    }

    @Test
    void startHonoursReportingSwitch(@TempDir Path tempDir) throws IOException {
        Path enabled = writeConfig(tempDir.resolve("on"), "reporting:\n  intervalSeconds: 3600\n  sink: none\n");
        Path disabled = writeConfig(tempDir.resolve("off"), "reporting:\n  enabled: false\n");

        RouteUsageRuntime running = RouteUsageRuntime.load(enabled).start();
        RouteUsageRuntime idle = RouteUsageRuntime.load(disabled).start();
        try {
            assertTrue(running.reporter().isRunning());
            assertFalse(idle.reporter().isRunning());
        } finally {
            running.close();
            idle.close();
        }
        assertFalse(running.reporter().isRunning());
    }

    @Test
    void missingConfigFailsAfterWritingDefault(@TempDir Path tempDir) {
        Path configPath = tempDir.resolve("route-usage.yaml");

        assertThrows(ConfigException.class, () -> RouteUsageRuntime.load(configPath));
        assertTrue(Files.exists(configPath));
    }

    @Test
    void parsesConfigAndDryRunFlags() {
        RouteUsageMain.CliOptions defaults = RouteUsageMain.parseArgs(new String[0]);
        RouteUsageMain.CliOptions custom = RouteUsageMain.parseArgs(
                new String[] {"-c", "/etc/route-usage.yaml", "--dry-run"});

        assertEquals(Paths.get("config/route-usage.yaml"), defaults.configPath());
        assertFalse(defaults.dryRun());
        assertEquals(Paths.get("/etc/route-usage.yaml"), custom.configPath());
        assertTrue(custom.dryRun());
    }

    private static Path writeConfig(Path dir, String yaml) throws IOException {
        Files.createDirectories(dir);
        Path configPath = dir.resolve("route-usage.yaml");
        Files.writeString(configPath, yaml, StandardCharsets.UTF_8);
        return configPath;
    }
}
