package io.rasasa.evaluation.runner;

import java.nio.file.Path;

/**
 * One unit of parallel work: a shard file and where its results go.
 */
public record ShardTask(int index, Path shardPath, Path partPath, Path partMetadataPath) {

    public static ShardTask of(int index, Path shardPath, RunLayout layout) {
        return new ShardTask(index, shardPath, layout.partPath(index), layout.partMetadataPath(index));
    }
}
