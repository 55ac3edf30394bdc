package io.rasasa.evaluation.session;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import io.rasasa.evaluation.engine.EngineDescriptor;

/**
 * Engine settings embedded in every evaluation record.
 */
@JsonPropertyOrder({"path", "version", "depth", "threads", "hash_mb"})
public record EngineStamp(
    @JsonProperty("path") String path,
    @JsonProperty("version") String version,
    @JsonProperty("depth") int depth,
    @JsonProperty("threads") int threads,
    @JsonProperty("hash_mb") int hashMb
) {

    public static EngineStamp of(String enginePath, EngineDescriptor engine) {
        return new EngineStamp(enginePath, engine.version(), engine.depth(), engine.threads(), engine.hashMb());
    }
}
