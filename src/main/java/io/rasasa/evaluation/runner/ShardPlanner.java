package io.rasasa.evaluation.runner;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.io.Closer;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.stream.IntStream;

/**
 * Splits an NDJSON input into {@code workers} shard files in a single streaming pass.
 *
 * <p>Line {@code i} goes to shard {@code i mod workers}, so shard sizes differ by at most one
 * line whatever the line lengths are. The plan is recorded in a {@link ShardManifest}; asking
 * again with the same parameters while every shard file still exists returns the recorded plan
 * without touching any file.
 */
public class ShardPlanner {

    /**
     * @param input    NDJSON input, one game per line
     * @param shardDir directory for shard files and the manifest
     * @param workers  number of shards, at least 1
     * @param maxGames cap on the number of lines distributed
     * @return the reused or freshly written manifest
     */
    public ShardManifest plan(Path input, Path shardDir, int workers, OptionalInt maxGames) throws IOException {
        Preconditions.checkArgument(workers >= 1, "workers must be at least 1, got %s", workers);
        Preconditions.checkArgument(maxGames.isEmpty() || maxGames.getAsInt() >= 1,
            "max games must be at least 1, got %s", maxGames);
        Files.createDirectories(shardDir);
        Path manifestPath = shardDir.resolve(ShardManifest.FILE_NAME);

        Optional<ShardManifest> existing = reusablePlan(input, shardDir, workers, maxGames);
        if (existing.isPresent()) {
            System.out.printf("Reusing %d shards of %s (%d lines) from %s%n",
                workers, input, existing.get().totalLines(), manifestPath);
            return existing.get();
        }

        ImmutableList<Path> shardPaths = IntStream.range(0, workers)
            .mapToObj(index -> shardDir.resolve(String.format("shard-%03d.ndjson", index)))
            .collect(ImmutableList.toImmutableList());
        int totalLines = distribute(input, shardPaths, maxGames);

        ShardManifest manifest = new ShardManifest(input, shardDir, maxGames, workers, totalLines, shardPaths);
        manifest.write(manifestPath);
        System.out.printf("Split %d lines of %s into %d shards under %s%n", totalLines, input, workers, shardDir);
        return manifest;
    }

    /**
     * The recorded plan under {@code shardDir}, if {@link #plan} would return it unchanged. When
     * this is empty, parts produced under an earlier plan belong to other shard contents.
     */
    public Optional<ShardManifest> reusablePlan(Path input, Path shardDir, int workers, OptionalInt maxGames) {
        return ShardManifest.read(shardDir.resolve(ShardManifest.FILE_NAME))
            .filter(manifest -> manifest.matches(input, shardDir, maxGames, workers))
            .filter(ShardManifest::shardsExist);
    }

    private static int distribute(Path input, List<Path> shardPaths, OptionalInt maxGames) throws IOException {
        int workers = shardPaths.size();
        int totalLines = 0;
        Closer closer = Closer.create();
        try {
            BufferedReader reader = closer.register(Files.newBufferedReader(input, StandardCharsets.UTF_8));
            List<BufferedWriter> writers = new ArrayList<>(workers);
            for (Path shard : shardPaths) {
                writers.add(closer.register(Files.newBufferedWriter(shard, StandardCharsets.UTF_8)));
            }
            String line;
            while ((maxGames.isEmpty() || totalLines < maxGames.getAsInt())
                    && (line = reader.readLine()) != null) {
                BufferedWriter writer = writers.get(totalLines % workers);
                writer.write(line);
                writer.write('\n');
                totalLines++;
            }
        } catch (Throwable e) {
            throw closer.rethrow(e);
        } finally {
            closer.close();
        }
        return totalLines;
    }
}
