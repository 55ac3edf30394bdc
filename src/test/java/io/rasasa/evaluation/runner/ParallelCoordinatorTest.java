package io.rasasa.evaluation.runner;

import io.rasasa.evaluation.session.EvaluationStats;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.OptionalInt;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class ParallelCoordinatorTest {

    private static ShardManifest plan(Path dir, int lines, int workers) throws IOException {
        List<String> games = new ArrayList<>();
        for (int i = 0; i < lines; i++) {
            games.add("{\"game\":" + i + "}");
        }
        Path input = dir.resolve("games.ndjson");
        Files.write(input, games);
        return new ShardPlanner().plan(input, dir.resolve("games.evals.shards"), workers, OptionalInt.empty());
    }

    /**
     * Stands in for a worker: the part holds the shard's lines tagged with the shard index.
     */
    private static EvaluationStats completeShard(ShardTask task) throws ShardFailedException {
        try {
            List<String> part = new ArrayList<>();
            for (String line : Files.readAllLines(task.shardPath())) {
                part.add("shard" + task.index() + " " + line);
            }
            Files.write(task.partPath(), part);
            EvaluationStats stats = new EvaluationStats(part.size(), part.size(), 0, 0);
            PartMetadata.write(task.partMetadataPath(), stats);
            return stats;
        } catch (IOException e) {
            throw new ShardFailedException(task.index(), "test worker failed", e);
        }
    }

    private static byte[] concat(List<Path> files) throws IOException {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        for (Path file : files) {
            bytes.write(Files.readAllBytes(file));
        }
        return bytes.toByteArray();
    }

    @Test
    void run_mergesInShardOrderWhateverFinishesFirst(@TempDir Path tempDir) throws Exception {
        ShardManifest manifest = plan(tempDir, 8, 3);
        RunLayout layout = new RunLayout(tempDir.resolve("games.evals.ndjson"));
        CountDownLatch othersDone = new CountDownLatch(2);
        List<Integer> finished = Collections.synchronizedList(new ArrayList<>());

        EvaluationStats stats = new ParallelCoordinator(task -> {
            if (task.index() == 0) {
                assertTrue(othersDone.await(10, TimeUnit.SECONDS), "shards 1 and 2 should finish first");
            }
            EvaluationStats shardStats = completeShard(task);
            finished.add(task.index());
            if (task.index() != 0) {
                othersDone.countDown();
            }
            return shardStats;
        }).run(manifest, layout);

        assertEquals(0, finished.get(2));
        assertEquals(new EvaluationStats(8, 8, 0, 0), stats);
        assertArrayEquals(concat(List.of(layout.partPath(0), layout.partPath(1), layout.partPath(2))),
            Files.readAllBytes(layout.output()));
        assertTrue(Files.readAllLines(layout.output()).get(0).startsWith("shard0 "));
    }

    @Test
    void run_skipsShardsCompletedEarlier(@TempDir Path tempDir) throws Exception {
        ShardManifest manifest = plan(tempDir, 6, 3);
        RunLayout layout = new RunLayout(tempDir.resolve("games.evals.ndjson"));
        Files.writeString(layout.partPath(1), "from an earlier attempt\n");
        PartMetadata.write(layout.partMetadataPath(1), new EvaluationStats(2, 1, 1, 0));
        Set<Integer> launched = Collections.synchronizedSet(new TreeSet<>());

        EvaluationStats stats = new ParallelCoordinator(task -> {
            launched.add(task.index());
            return completeShard(task);
        }).run(manifest, layout);

        assertEquals(Set.of(0, 2), launched);
        assertEquals(new EvaluationStats(6, 5, 1, 0), stats);
        assertEquals("from an earlier attempt", Files.readAllLines(layout.output()).get(2));
    }

    @Test
    void run_partWithoutValidMetadata_isRelaunched(@TempDir Path tempDir) throws Exception {
        ShardManifest manifest = plan(tempDir, 4, 2);
        RunLayout layout = new RunLayout(tempDir.resolve("games.evals.ndjson"));
        Files.writeString(layout.partPath(0), "half written");
        Files.writeString(layout.partMetadataPath(0), "total_games=2\n");
        Files.writeString(layout.partPath(1), "no metadata at all\n");
        Set<Integer> launched = Collections.synchronizedSet(new TreeSet<>());

        new ParallelCoordinator(task -> {
            launched.add(task.index());
            return completeShard(task);
        }).run(manifest, layout);

        assertEquals(Set.of(0, 1), launched);
        assertEquals(List.of("shard0 {\"game\":0}", "shard0 {\"game\":2}", "shard1 {\"game\":1}", "shard1 {\"game\":3}"),
            Files.readAllLines(layout.output()));
    }

    @Test
    void run_failedShardAbortsAndKeepsCompletedParts(@TempDir Path tempDir) throws Exception {
        ShardManifest manifest = plan(tempDir, 6, 3);
        RunLayout layout = new RunLayout(tempDir.resolve("games.evals.ndjson"));
        CountDownLatch shardZeroDone = new CountDownLatch(1);

        ShardFailedException e = assertThrows(ShardFailedException.class,
            () -> new ParallelCoordinator(task -> {
                if (task.index() == 1) {
                    shardZeroDone.await(10, TimeUnit.SECONDS);
                    throw new ShardFailedException(1, "worker exited with code 1");
                }
                EvaluationStats shardStats = completeShard(task);
                if (task.index() == 0) {
                    shardZeroDone.countDown();
                }
                return shardStats;
            }).run(manifest, layout));

        assertEquals(1, e.shardIndex());
        assertFalse(Files.exists(layout.output()));
        assertTrue(ParallelCoordinator.completedStats(ShardTask.of(0, manifest.shardPaths().get(0), layout)).isPresent());
        assertFalse(Files.exists(layout.partPath(1)));

        Set<Integer> relaunched = Collections.synchronizedSet(new TreeSet<>());
        EvaluationStats stats = new ParallelCoordinator(task -> {
            relaunched.add(task.index());
            return completeShard(task);
        }).run(manifest, layout);

        assertTrue(relaunched.contains(1));
        assertFalse(relaunched.contains(0));
        assertEquals(6, stats.totalGames());
        assertTrue(Files.exists(layout.output()));
    }

    @Test
    void run_unhandledFaultInLauncherIsShardFailure(@TempDir Path tempDir) throws Exception {
        ShardManifest manifest = plan(tempDir, 2, 1);
        RunLayout layout = new RunLayout(tempDir.resolve("games.evals.ndjson"));

        ShardFailedException e = assertThrows(ShardFailedException.class,
            () -> new ParallelCoordinator(task -> {
                throw new IllegalStateException("boom");
            }).run(manifest, layout));

        assertEquals(0, e.shardIndex());
        assertTrue(e.getMessage().contains("boom"));
    }

    @Test
    void run_existingOutputIsLeftUnchanged(@TempDir Path tempDir) throws Exception {
        ShardManifest manifest = plan(tempDir, 4, 2);
        RunLayout layout = new RunLayout(tempDir.resolve("games.evals.ndjson"));
        Files.writeString(layout.output(), "previous merge\n");

        EvaluationStats stats = new ParallelCoordinator(ParallelCoordinatorTest::completeShard).run(manifest, layout);

        assertEquals(4, stats.evaluatedGames());
        assertEquals("previous merge\n", Files.readString(layout.output()));
    }

    @Test
    void run_allShardsComplete_launchesNothing(@TempDir Path tempDir) throws Exception {
        ShardManifest manifest = plan(tempDir, 4, 2);
        RunLayout layout = new RunLayout(tempDir.resolve("games.evals.ndjson"));
        for (int i = 0; i < 2; i++) {
            completeShard(ShardTask.of(i, manifest.shardPaths().get(i), layout));
        }

        EvaluationStats stats = new ParallelCoordinator(task -> {
            throw new ShardFailedException(task.index(), "should not be launched");
        }).run(manifest, layout);

        assertEquals(new EvaluationStats(4, 4, 0, 0), stats);
        assertEquals(4, Files.readAllLines(layout.output()).size());
    }
}
