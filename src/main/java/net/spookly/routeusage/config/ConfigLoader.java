package net.spookly.routeusage.config;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;

/**
 * Reads the route-usage YAML file into a validated {@link RouteUsageConfig}.
 * <p>
 * A missing file is replaced by the default template and reported as an error, so the operator reviews
 * the generated values before the first real start.
 */
public final class ConfigLoader {
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, true);

    private ConfigLoader() {
    }

    public static RouteUsageConfig load(Path path) {
        if (path == null) {
            throw new ConfigException("Config path is required");
        }
        if (Files.notExists(path)) {
            generateDefault(path);
            throw new ConfigException("Config file did not exist, generated default at: " + path);
        }
        if (Files.isDirectory(path)) {
            throw new ConfigException("Config path is a directory: " + path);
        }
        RouteUsageConfig config = bind(readTree(path), path);
        ConfigValidator.validate(config);
        return config;
    }

    private static Object readTree(Path path) {
        Object tree;
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            tree = new Yaml(new LoaderOptions()).load(reader);
        } catch (IOException e) {
            throw new ConfigException("Failed to read config: " + path, e);
        } catch (RuntimeException e) {
            throw new ConfigException("Failed to parse config: " + path, e);
        }
        if (tree == null) {
            throw new ConfigException("Config file is empty: " + path);
        }
        return tree;
    }

    private static RouteUsageConfig bind(Object tree, Path path) {
        try {
            return MAPPER.convertValue(EnvExpander.expand(tree), RouteUsageConfig.class);
        } catch (IllegalArgumentException e) {
            throw new ConfigException("Failed to parse config: " + path, e);
        }
    }

    private static void generateDefault(Path path) {
        Path parent = path.toAbsolutePath().getParent();
        try {
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(path, ConfigDefaults.defaultYaml(), StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
        } catch (IOException e) {
            throw new ConfigException("Failed to write default config: " + path, e);
        }
    }
}
