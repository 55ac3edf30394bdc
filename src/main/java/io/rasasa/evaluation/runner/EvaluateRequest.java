package io.rasasa.evaluation.runner;

import com.google.common.base.Preconditions;
import io.rasasa.evaluation.engine.EngineDescriptor;

import java.nio.file.Path;
import java.util.OptionalInt;

/**
 * One evaluation run as requested on the command line.
 *
 * @param inputPath  NDJSON game records
 * @param outputPath final NDJSON evaluation records
 * @param maxGames   cap on games counted across the whole input
 * @param engine     engine settings, part of the run cache key
 * @param workers    1 for a sequential run, more for that many shard processes
 */
public record EvaluateRequest(
    Path inputPath,
    Path outputPath,
    OptionalInt maxGames,
    EngineDescriptor engine,
    int workers
) {

    public EvaluateRequest {
        Preconditions.checkArgument(workers >= 1, "workers must be at least 1, got %s", workers);
        Preconditions.checkArgument(maxGames.isEmpty() || maxGames.getAsInt() >= 1,
            "max games must be at least 1, got %s", maxGames);
    }

    public RunLayout layout() {
        return new RunLayout(outputPath);
    }
}
