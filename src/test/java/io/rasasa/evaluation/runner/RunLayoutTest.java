package io.rasasa.evaluation.runner;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RunLayoutTest {

    @Test
    void derivedPaths() {
        RunLayout layout = new RunLayout(Path.of("/data/out/games.evals.ndjson"));

        assertEquals(Path.of("/data/out/games.evals.ndjson.meta.json"), layout.metadataPath());
        assertEquals(Path.of("/data/out/games.evals.shards"), layout.shardDir());
        assertEquals(Path.of("/data/out/games.evals.part-002.ndjson"), layout.partPath(2));
        assertEquals(Path.of("/data/out/games.evals.part-002.ndjson.meta.txt"), layout.partMetadataPath(2));
    }

    @Test
    void existingPartFiles_findsOnlyThisOutputsParts(@TempDir Path tempDir) throws Exception {
        RunLayout layout = new RunLayout(tempDir.resolve("games.evals.ndjson"));
        Files.writeString(layout.partPath(0), "");
        Files.writeString(layout.partMetadataPath(0), "");
        Files.writeString(layout.partPath(11), "");
        Files.writeString(tempDir.resolve("other.part-000.ndjson"), "");
        Files.writeString(tempDir.resolve("games.evals.ndjson"), "");

        assertEquals(List.of(layout.partPath(0), layout.partMetadataPath(0), layout.partPath(11)),
            layout.existingPartFiles());
    }
}
