package io.rasasa.evaluation.runner;

import io.rasasa.evaluation.session.EvaluationStats;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * Evaluates the shards of a {@link ShardManifest} concurrently and merges their parts.
 *
 * <p>Shards whose part output and part metadata already exist are not run again. The rest are
 * handed to the {@link ShardLauncher}, at most {@code workers} at a time. The first failed shard
 * aborts the run; parts of shards that did complete stay on disk for the next attempt. Once every
 * shard is complete the parts are concatenated in shard index order, never completion order.
 */
public class ParallelCoordinator {

    private final ShardLauncher launcher;

    public ParallelCoordinator(ShardLauncher launcher) {
        this.launcher = launcher;
    }

    /**
     * @param manifest shards to evaluate
     * @param layout   where part files and the final output go
     * @return the summed counters of every shard
     * @throws ShardFailedException if any shard fails
     */
    public EvaluationStats run(ShardManifest manifest, RunLayout layout)
            throws ShardFailedException, IOException, InterruptedException {
        List<ShardTask> tasks = new ArrayList<>();
        for (int index = 0; index < manifest.shardPaths().size(); index++) {
            tasks.add(ShardTask.of(index, manifest.shardPaths().get(index), layout));
        }

        List<EvaluationStats> completed = new ArrayList<>();
        List<ShardTask> pending = new ArrayList<>();
        for (ShardTask task : tasks) {
            Optional<EvaluationStats> done = completedStats(task);
            if (done.isPresent()) {
                System.out.printf("Shard %d already complete, skipping (%s, %d games)%n",
                    task.index(), task.partPath(), done.get().totalGames());
                completed.add(done.get());
            } else {
                pending.add(task);
            }
        }

        if (!pending.isEmpty()) {
            completed.addAll(runPending(pending, manifest.workers(), tasks.size()));
        }

        EvaluationStats stats = EvaluationStats.sum(completed);
        Path output = layout.output();
        if (Files.exists(output)) {
            System.out.printf("%s already exists, leaving it unchanged%n", output);
        } else {
            List<Path> parts = tasks.stream().map(ShardTask::partPath).toList();
            AtomicFiles.concatenate(parts, output);
            System.out.printf("Merged %d parts into %s%n", parts.size(), output);
        }
        return stats;
    }

    private List<EvaluationStats> runPending(List<ShardTask> pending, int workers, int shardCount)
            throws ShardFailedException, InterruptedException {
        ExecutorService pool = Executors.newFixedThreadPool(Math.min(workers, pending.size()));
        CompletionService<EvaluationStats> completionService = new ExecutorCompletionService<>(pool);
        List<Future<EvaluationStats>> dispatched = new ArrayList<>();
        List<EvaluationStats> results = new ArrayList<>();
        try {
            for (ShardTask task : pending) {
                dispatched.add(completionService.submit(() -> launchGuarded(task)));
                System.out.printf("Dispatched shard %d/%d (%s)%n", task.index() + 1, shardCount, task.shardPath());
            }
            for (int i = 0; i < pending.size(); i++) {
                try {
                    results.add(completionService.take().get());
                } catch (ExecutionException e) {
                    if (e.getCause() instanceof ShardFailedException failed) {
                        throw failed;
                    }
                    throw new ShardFailedException(-1, "unexpected failure: " + e.getCause(), e.getCause());
                }
            }
        } catch (ShardFailedException e) {
            System.err.printf("Shard %d failed, not starting remaining shards%n", e.shardIndex());
            for (Future<EvaluationStats> future : dispatched) {
                future.cancel(false);
            }
            throw e;
        } finally {
            pool.shutdown();
            // shards already running finish and keep their parts
            pool.awaitTermination(Long.MAX_VALUE, TimeUnit.MILLISECONDS);
        }
        return results;
    }

    private EvaluationStats launchGuarded(ShardTask task) throws ShardFailedException, InterruptedException {
        try {
            return launcher.launch(task);
        } catch (RuntimeException e) {
            throw new ShardFailedException(task.index(), "unhandled fault: " + e.getMessage(), e);
        }
    }

    /**
     * Counters of a shard that finished in an earlier attempt, empty if it has to run.
     */
    static Optional<EvaluationStats> completedStats(ShardTask task) {
        if (!Files.exists(task.partPath()) || !Files.exists(task.partMetadataPath())) {
            return Optional.empty();
        }
        return PartMetadata.read(task.partMetadataPath());
    }
}
