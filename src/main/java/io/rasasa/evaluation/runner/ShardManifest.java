package io.rasasa.evaluation.runner;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.LinkedListMultimap;
import com.google.common.collect.ListMultimap;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Record of how an input file was split into shards. Stored as {@code manifest.txt} in the
 * shard directory:
 *
 * <pre>
 * input_path=/data/games.ndjson
 * output_dir=/data/games.evals.shards
 * max_games=
 * workers=3
 * total_lines=1200
 * shard_path=/data/games.evals.shards/shard-000.ndjson
 * shard_path=/data/games.evals.shards/shard-001.ndjson
 * shard_path=/data/games.evals.shards/shard-002.ndjson
 * </pre>
 *
 * @param inputPath  the sharded input file
 * @param outputDir  directory holding the shard files and this manifest
 * @param maxGames   cap on distributed lines, empty for no cap
 * @param workers    number of shards
 * @param totalLines lines distributed over all shards
 * @param shardPaths shard files in index order
 */
public record ShardManifest(
    Path inputPath,
    Path outputDir,
    OptionalInt maxGames,
    int workers,
    int totalLines,
    ImmutableList<Path> shardPaths
) {

    public static final String FILE_NAME = "manifest.txt";

    /**
     * Whether this manifest was produced for exactly these parameters.
     */
    public boolean matches(Path inputPath, Path outputDir, OptionalInt maxGames, int workers) {
        return this.inputPath.equals(inputPath)
            && this.outputDir.equals(outputDir)
            && this.maxGames.equals(maxGames)
            && this.workers == workers;
    }

    public boolean shardsExist() {
        return shardPaths.stream().allMatch(Files::exists);
    }

    public void write(Path path) throws IOException {
        ListMultimap<String, String> entries = LinkedListMultimap.create();
        entries.put("input_path", inputPath.toString());
        entries.put("output_dir", outputDir.toString());
        entries.put("max_games", maxGames.isPresent() ? Integer.toString(maxGames.getAsInt()) : "");
        entries.put("workers", Integer.toString(workers));
        entries.put("total_lines", Integer.toString(totalLines));
        for (Path shard : shardPaths) {
            entries.put("shard_path", shard.toString());
        }
        KeyValueFile.write(path, entries);
    }

    /**
     * @return the manifest, or empty if it is missing, unreadable or incomplete
     */
    public static Optional<ShardManifest> read(Path path) {
        Optional<ListMultimap<String, String>> read = KeyValueFile.read(path);
        if (read.isEmpty()) {
            return Optional.empty();
        }
        ListMultimap<String, String> entries = read.get();
        String input = KeyValueFile.last(entries, "input_path");
        String outputDir = KeyValueFile.last(entries, "output_dir");
        String workers = KeyValueFile.last(entries, "workers");
        String totalLines = KeyValueFile.last(entries, "total_lines");
        String maxGames = KeyValueFile.last(entries, "max_games");
        if (isNullOrEmpty(input) || isNullOrEmpty(outputDir) || isNullOrEmpty(workers) || isNullOrEmpty(totalLines)) {
            return Optional.empty();
        }
        List<Path> shardPaths = entries.get("shard_path").stream()
            .filter(value -> !value.isEmpty())
            .map(Path::of)
            .toList();
        try {
            int workerCount = Integer.parseInt(workers);
            if (shardPaths.isEmpty() || shardPaths.size() != workerCount) {
                return Optional.empty();
            }
            return Optional.of(new ShardManifest(
                Path.of(input),
                Path.of(outputDir),
                isNullOrEmpty(maxGames) ? OptionalInt.empty() : OptionalInt.of(Integer.parseInt(maxGames)),
                workerCount,
                Integer.parseInt(totalLines),
                ImmutableList.copyOf(shardPaths)));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    private static boolean isNullOrEmpty(String value) {
        return value == null || value.isEmpty();
    }
}
