package io.rasasa.evaluation.runner;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import io.rasasa.evaluation.engine.EngineDescriptor;
import io.rasasa.evaluation.session.EvaluationStats;

import java.time.Instant;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * The {@code <output>.meta.json} sidecar written when a run completes.
 */
@JsonPropertyOrder({"input_path", "output_path", "max_games", "fetched_at", "stats", "engine"})
public record RunMetadata(
    @JsonProperty("input_path") String inputPath,
    @JsonProperty("output_path") String outputPath,
    @JsonProperty("max_games") OptionalInt maxGames,
    @JsonProperty("fetched_at") String fetchedAt,
    @JsonProperty("stats") EvaluationStats stats,
    @JsonProperty("engine") EngineDescriptor engine
) {

    public RunMetadata {
        maxGames = maxGames == null ? OptionalInt.empty() : maxGames;
    }

    public static RunMetadata of(EvaluateRequest request, EvaluationStats stats, Instant completedAt) {
        return new RunMetadata(
            request.inputPath().toString(),
            request.outputPath().toString(),
            request.maxGames(),
            completedAt.toString(),
            stats,
            request.engine());
    }

    /**
     * Whether this run was made with exactly the parameters of {@code request}: same input,
     * output, cap and every engine field.
     */
    public boolean matches(EvaluateRequest request) {
        return Objects.equals(inputPath, request.inputPath().toString())
            && Objects.equals(outputPath, request.outputPath().toString())
            && maxGames.equals(request.maxGames())
            && Objects.equals(engine, request.engine());
    }
}
