package io.rasasa.evaluation.runner;

import io.rasasa.evaluation.engine.EngineDescriptor;
import io.rasasa.evaluation.engine.EngineException;
import io.rasasa.evaluation.engine.UciEngineConnector;
import io.rasasa.evaluation.session.EvaluationSession;
import io.rasasa.evaluation.session.EvaluationStats;

import java.io.IOException;
import java.nio.file.Path;
import java.util.OptionalInt;

/**
 * Entry point of a shard worker process: evaluates one shard file with its own engine, then
 * writes the part metadata that marks the shard complete. Exits non-zero on any failure.
 */
public final class ShardWorker {

    private ShardWorker() {}

    record WorkerArgs(ShardTask task, EngineDescriptor engine, String enginePath) {}

    public static void main(String[] args) {
        try {
            WorkerArgs parsed = parseArgs(args);
            EvaluationSession session = new EvaluationSession(
                new UciEngineConnector(parsed.enginePath()), parsed.engine(), parsed.enginePath());
            EvaluationStats stats = run(parsed.task(), session);
            System.out.printf("Shard %d complete (%d games, %d evaluated, %d illegal, %d engine errors)%n",
                parsed.task().index(), stats.totalGames(), stats.evaluatedGames(),
                stats.skippedIllegalGames(), stats.skippedEngineErrors());
        } catch (Exception e) {
            System.err.println("Shard worker failed: " + e.getMessage());
            e.printStackTrace();
            System.exit(1);
        }
    }

    /**
     * Evaluates the shard without a game cap (the cap was applied when sharding) and records
     * its counters. The part output is in place before the metadata is written.
     */
    public static EvaluationStats run(ShardTask task, EvaluationSession session) throws IOException, EngineException {
        EvaluationStats stats = session.evaluate(task.shardPath(), task.partPath(), OptionalInt.empty());
        PartMetadata.write(task.partMetadataPath(), stats);
        return stats;
    }

    static WorkerArgs parseArgs(String[] args) {
        Integer index = null;
        Path shard = null;
        Path part = null;
        Path partMeta = null;
        String enginePath = null;
        String name = null;
        String version = null;
        Integer depth = null;
        int threads = 0;
        int hashMb = 0;

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--index" -> index = Integer.parseInt(value(args, ++i));
                case "--shard" -> shard = Path.of(value(args, ++i));
                case "--part" -> part = Path.of(value(args, ++i));
                case "--part-meta" -> partMeta = Path.of(value(args, ++i));
                case "--engine-path" -> enginePath = value(args, ++i);
                case "--engine" -> name = value(args, ++i);
                case "--engine-version" -> version = value(args, ++i);
                case "--depth" -> depth = Integer.parseInt(value(args, ++i));
                case "--threads" -> threads = Integer.parseInt(value(args, ++i));
                case "--hash-mb" -> hashMb = Integer.parseInt(value(args, ++i));
                default -> throw new IllegalArgumentException("Unknown argument: " + args[i]);
            }
        }
        if (index == null || shard == null || part == null || partMeta == null
                || enginePath == null || name == null || version == null || depth == null) {
            throw new IllegalArgumentException("Missing required worker arguments");
        }
        return new WorkerArgs(
            new ShardTask(index, shard, part, partMeta),
            new EngineDescriptor(name, version, depth, threads, hashMb),
            enginePath);
    }

    private static String value(String[] args, int i) {
        if (i >= args.length) {
            throw new IllegalArgumentException("Missing value for " + args[i - 1]);
        }
        return args[i];
    }
}
