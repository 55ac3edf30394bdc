package io.rasasa.evaluation.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.rasasa.evaluation.engine.EngineDescriptor;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads the default {@link EngineDescriptor} from a TOML file:
 *
 * <pre>
 * [engine]
 * name = "stockfish"
 * version = "17"
 * depth = 16
 * threads = 2
 * hash_mb = 256
 * </pre>
 *
 * A missing file or a missing {@code [engine]} table yields the built-in defaults; keys left
 * out of the table keep their default value.
 */
public class EngineConfigLoader {

    private final ObjectMapper tomlMapper;
    private final EngineDescriptor defaults;

    public EngineConfigLoader(EngineDescriptor defaults) {
        this.tomlMapper = ObjectMapperFactory.createToml();
        this.defaults = defaults;
    }

    /**
     * Built-in engine settings. The version is empty and must come from the
     * configuration file or the command line.
     */
    public static EngineDescriptor builtInDefaults() {
        return new EngineDescriptor("stockfish", "", 16, 2, 256);
    }

    /**
     * Reads {@code path}, falling back to the defaults this loader was created with.
     *
     * @throws ConfigurationException if the file is not valid TOML or a value has the wrong type
     */
    public EngineDescriptor load(Path path) {
        if (!Files.exists(path)) {
            return defaults;
        }
        JsonNode root;
        try {
            root = tomlMapper.readTree(path.toFile());
        } catch (IOException e) {
            throw new ConfigurationException("Malformed configuration file " + path + ": " + e.getMessage(), e);
        }
        JsonNode engine = root == null ? null : root.get("engine");
        if (engine == null || !engine.isObject()) {
            return defaults;
        }
        return new EngineDescriptor(
            requireString(engine, "name", defaults.name()),
            requireString(engine, "version", defaults.version()),
            requireInt(engine, "depth", defaults.depth()),
            requireInt(engine, "threads", defaults.threads()),
            requireInt(engine, "hash_mb", defaults.hashMb())
        );
    }

    /**
     * Checks that {@code engine} is complete enough to run.
     *
     * @return the same descriptor
     * @throws ConfigurationException naming the first invalid field
     */
    public static EngineDescriptor validate(EngineDescriptor engine) {
        if (engine.name() == null || engine.name().isBlank()) {
            throw new ConfigurationException("Missing required engine name");
        }
        if (engine.version() == null || engine.version().isBlank()) {
            throw new ConfigurationException("Missing required engine version (set [engine] version or --engine-version)");
        }
        if (engine.depth() < 1) {
            throw new ConfigurationException("Invalid depth " + engine.depth() + "; expected at least 1");
        }
        if (engine.threads() < 0) {
            throw new ConfigurationException("Invalid threads " + engine.threads() + "; expected 0 or more");
        }
        if (engine.hashMb() < 0) {
            throw new ConfigurationException("Invalid hash_mb " + engine.hashMb() + "; expected 0 or more");
        }
        return engine;
    }

    private static String requireString(JsonNode table, String key, String fallback) {
        JsonNode value = table.get(key);
        if (value == null) {
            return fallback;
        }
        if (!value.isTextual() || value.asText().isEmpty()) {
            throw new ConfigurationException("Invalid " + key + "; expected non-empty string");
        }
        return value.asText();
    }

    private static int requireInt(JsonNode table, String key, int fallback) {
        JsonNode value = table.get(key);
        if (value == null) {
            return fallback;
        }
        if (!value.isIntegralNumber() || !value.canConvertToInt()) {
            throw new ConfigurationException("Invalid " + key + "; expected int");
        }
        return value.intValue();
    }
}
