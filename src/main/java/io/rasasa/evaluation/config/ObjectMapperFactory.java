package io.rasasa.evaluation.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.toml.TomlMapper;
import com.fasterxml.jackson.datatype.guava.GuavaModule;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;

/**
 * Shared ObjectMapper factory for consistent JSON handling of game records, evaluation
 * records and run metadata.
 */
public final class ObjectMapperFactory {

    private ObjectMapperFactory() {
        // Utility class
    }

    /**
     * Creates a pre-configured ObjectMapper with Guava and JDK8 module support. Output is
     * compact, one document per line, as required for NDJSON.
     *
     * @return a new ObjectMapper instance
     */
    public static ObjectMapper create() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new GuavaModule());
        mapper.registerModule(new Jdk8Module());
        return mapper;
    }

    /**
     * Same as {@link #create()} but indenting output, for human-readable sidecar files.
     */
    public static ObjectMapper createIndenting() {
        return create().enable(SerializationFeature.INDENT_OUTPUT);
    }

    /**
     * Mapper for {@code config.toml}.
     */
    public static TomlMapper createToml() {
        return new TomlMapper();
    }
}
