package io.rasasa.evaluation.runner;

import com.google.common.collect.ImmutableList;
import io.rasasa.evaluation.engine.EngineException;
import io.rasasa.evaluation.session.EvaluationSession;
import io.rasasa.evaluation.session.EvaluationStats;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;

/**
 * Runs one evaluation request end to end.
 *
 * <ol>
 *   <li>Consult the {@link RunCache}; a hit returns immediately without touching the engine.</li>
 *   <li>Discard outputs that cannot be verified against the request.</li>
 *   <li>Evaluate sequentially (one worker) or through {@link ShardPlanner} and
 *       {@link ParallelCoordinator} (several workers).</li>
 *   <li>Write the run metadata sidecar.</li>
 * </ol>
 */
public class Evaluator {

    private final EngineBackend backend;
    private final ShardPlanner planner;
    private final RunMetadataStore metadataStore;
    private final RunCache cache;
    private final Clock clock;

    public Evaluator(EngineBackend backend) {
        this(backend, new ShardPlanner(), new RunMetadataStore(), Clock.systemUTC());
    }

    public Evaluator(EngineBackend backend, ShardPlanner planner, RunMetadataStore metadataStore, Clock clock) {
        this.backend = backend;
        this.planner = planner;
        this.metadataStore = metadataStore;
        this.cache = new RunCache(metadataStore);
        this.clock = clock;
    }

    public EvaluationResult evaluate(EvaluateRequest request)
            throws IOException, EngineException, ShardFailedException, InterruptedException {
        RunLayout layout = request.layout();
        RunCache.Lookup lookup = cache.lookup(request);
        if (lookup.status() == RunCache.Status.HIT) {
            EvaluationStats cached = lookup.recorded().orElseThrow().stats();
            System.out.printf("Skipped evaluation; using existing %s (%d games evaluated)%n",
                request.outputPath(), cached.evaluatedGames());
            System.out.printf("Metadata: %s%n", layout.metadataPath());
            return new EvaluationResult(cached, true, request.outputPath(), layout.metadataPath());
        }

        String enginePath = backend.resolve(request.engine());
        discardUnverified(layout, lookup.status());

        EvaluationStats stats;
        if (request.workers() == 1) {
            EvaluationSession session = new EvaluationSession(
                backend.connector(enginePath), request.engine(), enginePath);
            stats = session.evaluate(request.inputPath(), request.outputPath(), request.maxGames());
        } else {
            if (planner.reusablePlan(request.inputPath(), layout.shardDir(), request.workers(),
                    request.maxGames()).isEmpty()) {
                discardParts(layout, "Shard plan changed; discarding parts of the previous plan");
            }
            ShardManifest manifest = planner.plan(
                request.inputPath(), layout.shardDir(), request.workers(), request.maxGames());
            ParallelCoordinator coordinator = new ParallelCoordinator(
                backend.shardLauncher(request.engine(), enginePath));
            stats = coordinator.run(manifest, layout);
        }

        metadataStore.write(layout.metadataPath(), RunMetadata.of(request, stats, Instant.now(clock)));
        System.out.printf("Wrote %s (%d games evaluated)%n", request.outputPath(), stats.evaluatedGames());
        System.out.printf("Games: %d total, %d illegal, %d engine errors%n",
            stats.totalGames(), stats.skippedIllegalGames(), stats.skippedEngineErrors());
        System.out.printf("Metadata: %s%n", layout.metadataPath());
        return new EvaluationResult(stats, false, request.outputPath(), layout.metadataPath());
    }

    /**
     * The final output of a run that is not a cache hit is never trusted. A stale sidecar also
     * condemns the part files, which may come from a run with other parameters.
     */
    private void discardUnverified(RunLayout layout, RunCache.Status status) throws IOException {
        if (Files.deleteIfExists(layout.output())) {
            System.out.printf("Discarding unverified output %s%n", layout.output());
        }
        if (status != RunCache.Status.STALE) {
            return;
        }
        System.out.printf("Metadata %s does not match this request; re-running from scratch%n",
            layout.metadataPath());
        Files.deleteIfExists(layout.metadataPath());
        discardParts(layout, "Discarding parts of the previous run");
    }

    /**
     * Part files are only valid for the shard plan that produced them.
     */
    private static void discardParts(RunLayout layout, String reason) throws IOException {
        ImmutableList<Path> parts = layout.existingPartFiles();
        if (parts.isEmpty()) {
            return;
        }
        System.out.println(reason);
        for (Path part : parts) {
            Files.delete(part);
        }
    }
}
