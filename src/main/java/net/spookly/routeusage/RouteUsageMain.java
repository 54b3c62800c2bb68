package net.spookly.routeusage;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.concurrent.CountDownLatch;

/**
 * Standalone entry point that runs the feature usage reporter until the JVM shuts down.
 */
public final class RouteUsageMain {
    private static final String DEFAULT_CONFIG = "config/route-usage.yaml";

    private RouteUsageMain() {
    }

    public static void main(String[] args) {
        CliOptions options = parseArgs(args);
        RouteUsageRuntime runtime = RouteUsageRuntime.load(options.configPath());
        if (options.dryRun()) {
            System.out.println("Config OK (--dry-run).");
            return;
        }
        runtime.start();
        System.out.println("route-usage started: reporting=" + runtime.reporter().isRunning()
                + " config=" + options.configPath());

        CountDownLatch latch = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            runtime.close();
            latch.countDown();
        }));
        try {
            latch.await();
        } catch (InterruptedException ignored) {
            Thread.currentThread().interrupt();
        }
    }

    static CliOptions parseArgs(String[] args) {
        Path configPath = Paths.get(DEFAULT_CONFIG);
        boolean dryRun = false;
        if (args == null) {
            return new CliOptions(configPath, dryRun);
        }
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if (("--config".equals(arg) || "-c".equals(arg)) && i + 1 < args.length) {
                configPath = Paths.get(args[++i]);
                continue;
            }
            if ("--dry-run".equals(arg)) {
                dryRun = true;
            }
        }
        return new CliOptions(configPath, dryRun);
    }

    record CliOptions(Path configPath, boolean dryRun) {
    }
}
