package io.flowtemplate.core.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads {@link EngineConfig} from YAML with an environment variable overlay.
 *
 * <pre>
 * template:
 *   max-length: 65536
 *   max-expression-depth: 32
 *   strict-functions: true
 * </pre>
 *
 * <p>
 * Missing keys keep the {@link EngineConfig#DEFAULT} values. Environment variables take
 * precedence over YAML:
 *
 * <ul>
 * <li>{@code FLOW_TEMPLATE_MAX_LENGTH}
 * <li>{@code FLOW_TEMPLATE_MAX_DEPTH}
 * <li>{@code FLOW_TEMPLATE_STRICT_FUNCTIONS}
 * </ul>
 *
 * A variable counts as set only if its trimmed value is non-empty.
 */
public final class EngineConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(EngineConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    static final String ENV_MAX_LENGTH = "FLOW_TEMPLATE_MAX_LENGTH";
    static final String ENV_MAX_DEPTH = "FLOW_TEMPLATE_MAX_DEPTH";
    static final String ENV_STRICT_FUNCTIONS = "FLOW_TEMPLATE_STRICT_FUNCTIONS";

    private EngineConfigLoader() {
        // utility class
    }

    /**
     * Loads the file at {@code configPath}, applying overrides from {@link System#getenv}.
     *
     * @throws ConfigLoadException if the file is missing, is not valid YAML, or holds invalid values
     */
    public static EngineConfig load(Path configPath) {
        return load(configPath, System::getenv);
    }

    /**
     * Loads the file at {@code configPath}, applying overrides from {@code envLookup}. The lookup
     * returns {@code null} for an undefined variable.
     */
    public static EngineConfig load(Path configPath, Function<String, String> envLookup) {
        if (!Files.exists(configPath)) {
            throw new ConfigLoadException("Configuration file not found: " + configPath);
        }
        try (InputStream in = Files.newInputStream(configPath)) {
            JsonNode root = YAML_MAPPER.readTree(in);
            EngineConfig config = mapToConfig(root, envLookup);
            LOG.debug("Loaded engine configuration from {}: {}", configPath, config);
            return config;
        } catch (ConfigLoadException e) {
            throw e;
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to parse YAML configuration: " + configPath, e);
        }
    }

    /** Builds a configuration from the defaults and {@link System#getenv} alone. */
    public static EngineConfig fromEnvironment() {
        return fromEnvironment(System::getenv);
    }

    /** Builds a configuration from the defaults and {@code envLookup} alone. */
    public static EngineConfig fromEnvironment(Function<String, String> envLookup) {
        return mapToConfig(null, envLookup);
    }

    private static EngineConfig mapToConfig(JsonNode root, Function<String, String> envLookup) {
        JsonNode template = root != null ? root.path("template") : YAML_MAPPER.missingNode();
        EngineConfig defaults = EngineConfig.DEFAULT;

        int maxLength = intOrDefault(template, "max-length", defaults.maxTemplateLength());
        int maxDepth = intOrDefault(template, "max-expression-depth", defaults.maxExpressionDepth());
        boolean strict = boolOrDefault(template, "strict-functions", defaults.strictFunctions());

        maxLength = envIntOrDefault(envLookup, ENV_MAX_LENGTH, maxLength);
        maxDepth = envIntOrDefault(envLookup, ENV_MAX_DEPTH, maxDepth);
        strict = envBoolOrDefault(envLookup, ENV_STRICT_FUNCTIONS, strict);

        try {
            return new EngineConfig(maxLength, maxDepth, strict);
        } catch (IllegalArgumentException e) {
            throw new ConfigLoadException("Invalid engine configuration: " + e.getMessage(), e);
        }
    }

    // --- Environment helpers ---

    private static boolean isSet(Function<String, String> envLookup, String envVar) {
        String value = envLookup.apply(envVar);
        return value != null && !value.trim().isEmpty();
    }

    private static int envIntOrDefault(Function<String, String> envLookup, String envVar, int yamlDefault) {
        if (!isSet(envLookup, envVar)) {
            return yamlDefault;
        }
        String raw = envLookup.apply(envVar).trim();
        try {
            return Integer.parseInt(raw);
        } catch (NumberFormatException e) {
            throw new ConfigLoadException(envVar + " must be an integer, got: '" + raw + "'", e);
        }
    }

    private static boolean envBoolOrDefault(Function<String, String> envLookup, String envVar, boolean yamlDefault) {
        if (!isSet(envLookup, envVar)) {
            return yamlDefault;
        }
        String raw = envLookup.apply(envVar).trim();
        switch (raw.toLowerCase(Locale.ROOT)) {
            case "true":
                return true;
            case "false":
                return false;
            default:
                throw new ConfigLoadException(envVar + " must be 'true' or 'false', got: '" + raw + "'");
        }
    }

    // --- YAML helpers ---

    private static int intOrDefault(JsonNode node, String field, int defaultValue) {
        if (!node.has(field)) {
            return defaultValue;
        }
        JsonNode value = node.get(field);
        if (!value.isIntegralNumber() || !value.canConvertToInt()) {
            throw new ConfigLoadException("template." + field + " must be an integer, got: " + value);
        }
        return value.intValue();
    }

    private static boolean boolOrDefault(JsonNode node, String field, boolean defaultValue) {
        if (!node.has(field)) {
            return defaultValue;
        }
        JsonNode value = node.get(field);
        if (!value.isBoolean()) {
            throw new ConfigLoadException("template." + field + " must be a boolean, got: " + value);
        }
        return value.booleanValue();
    }
}
