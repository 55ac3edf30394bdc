package io.rasasa.evaluation.runner;

import com.google.common.collect.ImmutableList;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * File locations derived from a run's final output path. For {@code out/games.evals.ndjson}:
 *
 * <ul>
 *   <li>run metadata: {@code out/games.evals.ndjson.meta.json}</li>
 *   <li>shard directory: {@code out/games.evals.shards/}</li>
 *   <li>part output {@code i}: {@code out/games.evals.part-00i.ndjson}</li>
 *   <li>part metadata {@code i}: {@code out/games.evals.part-00i.ndjson.meta.txt}</li>
 * </ul>
 */
public record RunLayout(Path output) {

    public Path metadataPath() {
        return output.resolveSibling(fileName() + ".meta.json");
    }

    public Path shardDir() {
        return output.resolveSibling(stem() + ".shards");
    }

    public Path partPath(int index) {
        return output.resolveSibling(String.format("%s.part-%03d%s", stem(), index, suffix()));
    }

    public Path partMetadataPath(int index) {
        return partPath(index).resolveSibling(partPath(index).getFileName() + ".meta.txt");
    }

    /**
     * Part outputs and part metadata files currently on disk for this output, whatever worker
     * count produced them.
     */
    public ImmutableList<Path> existingPartFiles() throws IOException {
        Path dir = output.toAbsolutePath().getParent();
        if (dir == null || !Files.isDirectory(dir)) {
            return ImmutableList.of();
        }
        Pattern partName = Pattern.compile(
            Pattern.quote(stem() + ".part-") + "\\d{3,}" + Pattern.quote(suffix()) + "(\\.meta\\.txt)?");
        try (Stream<Path> files = Files.list(dir)) {
            return files
                .filter(file -> partName.matcher(file.getFileName().toString()).matches())
                .sorted()
                .collect(ImmutableList.toImmutableList());
        }
    }

    private String fileName() {
        return output.getFileName().toString();
    }

    private String stem() {
        String name = fileName();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    private String suffix() {
        String name = fileName();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(dot) : "";
    }
}
