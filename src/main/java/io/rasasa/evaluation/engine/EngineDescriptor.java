package io.rasasa.evaluation.engine;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableMap;

/**
 * Identifies the engine and search settings used for a run. Two runs with equal descriptors
 * produce interchangeable evaluations, which is what makes the descriptor part of the run cache key.
 *
 * @param name    engine name, either an installed engine ("stockfish") or a command on the PATH
 * @param version engine version string, required
 * @param depth   fixed search depth per position
 * @param threads UCI {@code Threads} option, 0 to keep the engine default
 * @param hashMb  UCI {@code Hash} option in MB, 0 to keep the engine default
 */
public record EngineDescriptor(
    @JsonProperty("name") String name,
    @JsonProperty("version") String version,
    @JsonProperty("depth") int depth,
    @JsonProperty("threads") int threads,
    @JsonProperty("hash_mb") int hashMb
) {

    public EngineDescriptor withName(String name) {
        return new EngineDescriptor(name, version, depth, threads, hashMb);
    }

    public EngineDescriptor withVersion(String version) {
        return new EngineDescriptor(name, version, depth, threads, hashMb);
    }

    public EngineDescriptor withDepth(int depth) {
        return new EngineDescriptor(name, version, depth, threads, hashMb);
    }

    public EngineDescriptor withThreads(int threads) {
        return new EngineDescriptor(name, version, depth, threads, hashMb);
    }

    public EngineDescriptor withHashMb(int hashMb) {
        return new EngineDescriptor(name, version, depth, threads, hashMb);
    }

    /**
     * UCI options to send once at session start. Non-positive values are left out so the
     * engine keeps its own default.
     */
    public ImmutableMap<String, Integer> uciOptions() {
        ImmutableMap.Builder<String, Integer> options = ImmutableMap.builder();
        if (threads > 0) {
            options.put("Threads", threads);
        }
        if (hashMb > 0) {
            options.put("Hash", hashMb);
        }
        return options.build();
    }
}
