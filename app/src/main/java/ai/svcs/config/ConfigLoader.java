package ai.svcs.config;

import ai.svcs.semantic.Layer;
import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Builds {@link EngineConfig} from layered properties: the bundled {@code svcs-defaults.properties}, then an
 * optional user file, then {@code svcs.*} system properties.
 */
public final class ConfigLoader {
    private static final Logger logger = LogManager.getLogger(ConfigLoader.class);

    public static final String DEFAULTS_RESOURCE = "/svcs-defaults.properties";
    private static final String PREFIX = "svcs.";

    private ConfigLoader() {}

    public static EngineConfig defaults() {
        return fromProperties(defaultProperties());
    }

    /** Defaults, overlaid by {@code userFile} when given, overlaid by {@code svcs.*} system properties. */
    public static EngineConfig load(@Nullable Path userFile) {
        var props = defaultProperties();
        if (userFile != null) {
            props.putAll(readFile(userFile));
        }
        for (var name : System.getProperties().stringPropertyNames()) {
            if (name.startsWith(PREFIX)) {
                props.setProperty(name, System.getProperty(name));
            }
        }
        return fromProperties(props);
    }

    /** Defaults overlaid by the given keys. */
    public static EngineConfig withOverrides(Map<String, String> overrides) {
        var props = defaultProperties();
        props.putAll(overrides);
        return fromProperties(props);
    }

    public static Properties defaultProperties() {
        var props = new Properties();
        try (InputStream in = ConfigLoader.class.getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (in == null) {
                throw new ConfigException("Missing classpath resource " + DEFAULTS_RESOURCE);
            }
            props.load(in);
        } catch (IOException e) {
            throw new ConfigException("Unable to read " + DEFAULTS_RESOURCE, e);
        }
        return props;
    }

    private static Properties readFile(Path file) {
        var props = new Properties();
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            props.load(reader);
        } catch (IOException e) {
            throw new ConfigException("Unable to read configuration file " + file, e);
        }
        logger.debug("Loaded {} settings from {}", props.size(), file);
        return props;
    }

    public static EngineConfig fromProperties(Properties props) {
        return new EngineConfig(
                parseLayers(required(props, "svcs.layers.enabled")),
                intValue(props, "svcs.behavior.tolerance"),
                intValue(props, "svcs.complexity.threshold"),
                doubleValue(props, "svcs.patterns.minConfidence"),
                doubleValue(props, "svcs.parse.maxErrorRatio"),
                doubleValue(props, "svcs.gate.threshold"),
                intValue(props, "svcs.gate.minLines"),
                parseProviders(props),
                Duration.ofSeconds(intValue(props, "svcs.ai.timeoutSeconds")),
                intValue(props, "svcs.ai.maxRetries"),
                Duration.ofMillis(intValue(props, "svcs.ai.backoffMillis")),
                intValue(props, "svcs.ai.callBudget"),
                intValue(props, "svcs.ai.maxConcurrentCalls"),
                doubleValue(props, "svcs.ai.minConfidence"),
                intValue(props, "svcs.ai.maxPromptChars"),
                intValue(props, "svcs.engine.threads"));
    }

    /** Comma-separated layer labels, e.g. {@code 1,2,3,4,5a}. */
    public static EnumSet<Layer> parseLayers(String value) {
        var layers = EnumSet.noneOf(Layer.class);
        for (var part : value.split(",")) {
            if (part.isBlank()) {
                continue;
            }
            var layer = Layer.fromLabel(part).orElseThrow(() -> new ConfigException("Unknown layer '" + part.trim()
                    + "' in svcs.layers.enabled; expected 1, 2, 3, 4, 5a or 5b"));
            layers.add(layer);
        }
        return layers;
    }

    private static List<ProviderSettings> parseProviders(Properties props) {
        var names = props.getProperty("svcs.ai.providers", "");
        var providers = new ArrayList<ProviderSettings>();
        for (var raw : names.split(",")) {
            var name = raw.trim();
            if (name.isEmpty()) {
                continue;
            }
            var base = "svcs.ai.provider." + name + ".";
            providers.add(new ProviderSettings(
                    name,
                    props.getProperty(base + "baseUrl", "").trim(),
                    props.getProperty(base + "model", "").trim(),
                    props.getProperty(base + "apiKeyEnv")));
        }
        return providers;
    }

    private static String required(Properties props, String key) {
        var value = props.getProperty(key);
        if (value == null) {
            throw new ConfigException("Missing setting " + key);
        }
        return value.trim();
    }

    private static int intValue(Properties props, String key) {
        var value = required(props, key);
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new ConfigException(key + " must be an integer, was '" + value + "'", e);
        }
    }

    private static double doubleValue(Properties props, String key) {
        var value = required(props, key);
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new ConfigException(key + " must be a number, was '" + value + "'", e);
        }
    }
}
