package io.rasasa.evaluation.runner;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalInt;

import static org.junit.jupiter.api.Assertions.*;

class ShardPlannerTest {

    private final ShardPlanner planner = new ShardPlanner();

    private static Path inputWithLines(Path dir, int count) throws Exception {
        List<String> lines = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            lines.add("{\"game\":" + i + "}");
        }
        Path input = dir.resolve("games.ndjson");
        Files.write(input, lines);
        return input;
    }

    @Test
    void plan_assignsLinesRoundRobin(@TempDir Path tempDir) throws Exception {
        Path input = inputWithLines(tempDir, 10);
        Path shardDir = tempDir.resolve("games.evals.shards");

        ShardManifest manifest = planner.plan(input, shardDir, 3, OptionalInt.empty());

        assertEquals(10, manifest.totalLines());
        assertEquals(3, manifest.shardPaths().size());
        assertEquals(shardDir.resolve("shard-000.ndjson"), manifest.shardPaths().get(0));
        assertEquals(List.of("{\"game\":0}", "{\"game\":3}", "{\"game\":6}", "{\"game\":9}"),
            Files.readAllLines(manifest.shardPaths().get(0)));
        assertEquals(List.of("{\"game\":1}", "{\"game\":4}", "{\"game\":7}"),
            Files.readAllLines(manifest.shardPaths().get(1)));
        assertEquals(List.of("{\"game\":2}", "{\"game\":5}", "{\"game\":8}"),
            Files.readAllLines(manifest.shardPaths().get(2)));
    }

    @Test
    void plan_shardSizesDifferByAtMostOne(@TempDir Path tempDir) throws Exception {
        Path input = inputWithLines(tempDir, 23);

        ShardManifest manifest = planner.plan(input, tempDir.resolve("shards"), 4, OptionalInt.empty());

        int sum = 0;
        for (Path shard : manifest.shardPaths()) {
            int lines = Files.readAllLines(shard).size();
            assertTrue(lines == 5 || lines == 6, "shard " + shard + " has " + lines + " lines");
            sum += lines;
        }
        assertEquals(23, sum);
    }

    @Test
    void plan_capLimitsDistributedLines(@TempDir Path tempDir) throws Exception {
        Path input = inputWithLines(tempDir, 10);

        ShardManifest manifest = planner.plan(input, tempDir.resolve("shards"), 3, OptionalInt.of(4));

        assertEquals(4, manifest.totalLines());
        assertEquals(2, Files.readAllLines(manifest.shardPaths().get(0)).size());
        assertEquals(1, Files.readAllLines(manifest.shardPaths().get(1)).size());
        assertEquals(1, Files.readAllLines(manifest.shardPaths().get(2)).size());
    }

    @Test
    void plan_moreWorkersThanLines_leavesEmptyShards(@TempDir Path tempDir) throws Exception {
        Path input = inputWithLines(tempDir, 2);

        ShardManifest manifest = planner.plan(input, tempDir.resolve("shards"), 4, OptionalInt.empty());

        assertEquals(0, Files.size(manifest.shardPaths().get(3)));
        assertTrue(manifest.shardsExist());
    }

    @Test
    void plan_writesManifest(@TempDir Path tempDir) throws Exception {
        Path input = inputWithLines(tempDir, 5);
        Path shardDir = tempDir.resolve("shards");

        planner.plan(input, shardDir, 2, OptionalInt.empty());

        List<String> manifest = Files.readAllLines(shardDir.resolve(ShardManifest.FILE_NAME));
        assertEquals(List.of(
            "input_path=" + input,
            "output_dir=" + shardDir,
            "max_games=",
            "workers=2",
            "total_lines=5",
            "shard_path=" + shardDir.resolve("shard-000.ndjson"),
            "shard_path=" + shardDir.resolve("shard-001.ndjson")), manifest);
    }

    @Test
    void plan_sameParameters_reusesFilesUnchanged(@TempDir Path tempDir) throws Exception {
        Path input = inputWithLines(tempDir, 9);
        Path shardDir = tempDir.resolve("shards");
        ShardManifest first = planner.plan(input, shardDir, 3, OptionalInt.of(8));
        Path manifestPath = shardDir.resolve(ShardManifest.FILE_NAME);
        byte[] manifestBytes = Files.readAllBytes(manifestPath);
        byte[] shardBytes = Files.readAllBytes(first.shardPaths().get(1));
        FileTime old = FileTime.fromMillis(1_000_000L);
        Files.setLastModifiedTime(manifestPath, old);
        Files.setLastModifiedTime(first.shardPaths().get(1), old);

        ShardManifest second = planner.plan(input, shardDir, 3, OptionalInt.of(8));

        assertEquals(first, second);
        assertArrayEquals(manifestBytes, Files.readAllBytes(manifestPath));
        assertArrayEquals(shardBytes, Files.readAllBytes(first.shardPaths().get(1)));
        assertEquals(old, Files.getLastModifiedTime(manifestPath));
        assertEquals(old, Files.getLastModifiedTime(first.shardPaths().get(1)));
    }

    @Test
    void plan_workerCountChanged_regenerates(@TempDir Path tempDir) throws Exception {
        Path input = inputWithLines(tempDir, 6);
        Path shardDir = tempDir.resolve("shards");
        planner.plan(input, shardDir, 3, OptionalInt.empty());

        ShardManifest manifest = planner.plan(input, shardDir, 2, OptionalInt.empty());

        assertEquals(2, manifest.workers());
        assertEquals(3, Files.readAllLines(manifest.shardPaths().get(0)).size());
        assertEquals(manifest, ShardManifest.read(shardDir.resolve(ShardManifest.FILE_NAME)).orElseThrow());
    }

    @Test
    void plan_missingShard_regeneratesAll(@TempDir Path tempDir) throws Exception {
        Path input = inputWithLines(tempDir, 6);
        Path shardDir = tempDir.resolve("shards");
        ShardManifest first = planner.plan(input, shardDir, 3, OptionalInt.empty());
        Files.delete(first.shardPaths().get(2));
        Files.writeString(first.shardPaths().get(0), "tampered\n");

        ShardManifest second = planner.plan(input, shardDir, 3, OptionalInt.empty());

        assertTrue(second.shardsExist());
        assertEquals(List.of("{\"game\":0}", "{\"game\":3}"), Files.readAllLines(second.shardPaths().get(0)));
    }

    @Test
    void plan_corruptManifest_regenerates(@TempDir Path tempDir) throws Exception {
        Path input = inputWithLines(tempDir, 4);
        Path shardDir = tempDir.resolve("shards");
        planner.plan(input, shardDir, 2, OptionalInt.empty());
        Files.writeString(shardDir.resolve(ShardManifest.FILE_NAME), "workers=two\n");

        ShardManifest manifest = planner.plan(input, shardDir, 2, OptionalInt.empty());

        assertEquals(4, manifest.totalLines());
        assertTrue(ShardManifest.read(shardDir.resolve(ShardManifest.FILE_NAME)).isPresent());
    }

    @Test
    void plan_rejectsZeroWorkers(@TempDir Path tempDir) throws Exception {
        Path input = inputWithLines(tempDir, 1);

        assertThrows(IllegalArgumentException.class,
            () -> planner.plan(input, tempDir.resolve("shards"), 0, OptionalInt.empty()));
    }

    @Test
    void reusablePlan_onlyForMatchingParameters(@TempDir Path tempDir) throws Exception {
        Path input = inputWithLines(tempDir, 6);
        Path shardDir = tempDir.resolve("shards");
        assertTrue(planner.reusablePlan(input, shardDir, 2, OptionalInt.empty()).isEmpty());

        ShardManifest manifest = planner.plan(input, shardDir, 2, OptionalInt.empty());

        assertEquals(manifest, planner.reusablePlan(input, shardDir, 2, OptionalInt.empty()).orElseThrow());
        assertTrue(planner.reusablePlan(input, shardDir, 2, OptionalInt.of(4)).isEmpty());
        assertTrue(planner.reusablePlan(input, shardDir, 3, OptionalInt.empty()).isEmpty());
    }
}
