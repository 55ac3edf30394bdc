package io.rasasa.evaluation.runner;

import com.google.common.collect.ImmutableList;
import io.rasasa.evaluation.engine.EngineDescriptor;
import io.rasasa.evaluation.session.EvaluationStats;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Runs each shard in its own JVM ({@link ShardWorker}) so that a crashing worker or engine
 * cannot affect other shards. Child processes share the parent's console.
 */
public class ProcessShardLauncher implements ShardLauncher {

    private final EngineDescriptor engine;
    private final String enginePath;

    public ProcessShardLauncher(EngineDescriptor engine, String enginePath) {
        this.engine = engine;
        this.enginePath = enginePath;
    }

    @Override
    public EvaluationStats launch(ShardTask task) throws ShardFailedException, InterruptedException {
        Process process;
        try {
            process = start(task);
        } catch (IOException e) {
            throw new ShardFailedException(task.index(), "failed to start worker process", e);
        }
        int exitCode;
        try {
            exitCode = process.waitFor();
        } catch (InterruptedException e) {
            process.descendants().forEach(ProcessHandle::destroyForcibly);
            process.destroyForcibly();
            throw e;
        }
        if (exitCode != 0) {
            throw new ShardFailedException(task.index(), "worker exited with code " + exitCode);
        }
        return PartMetadata.read(task.partMetadataPath())
            .orElseThrow(() -> new ShardFailedException(task.index(),
                "worker exited without valid part metadata " + task.partMetadataPath()));
    }

    Process start(ShardTask task) throws IOException {
        return new ProcessBuilder(command(task)).inheritIO().start();
    }

    /**
     * The worker command line for {@code task}, reusing this JVM's executable and class path.
     */
    ImmutableList<String> command(ShardTask task) {
        String java = Path.of(System.getProperty("java.home"), "bin", "java").toString();
        return ImmutableList.<String>builder()
            .add(java, "-cp", System.getProperty("java.class.path"))
            .add(ShardWorker.class.getName())
            .add("--index", Integer.toString(task.index()))
            .add("--shard", task.shardPath().toString())
            .add("--part", task.partPath().toString())
            .add("--part-meta", task.partMetadataPath().toString())
            .add("--engine-path", enginePath)
            .add("--engine", engine.name())
            .add("--engine-version", engine.version())
            .add("--depth", Integer.toString(engine.depth()))
            .add("--threads", Integer.toString(engine.threads()))
            .add("--hash-mb", Integer.toString(engine.hashMb()))
            .build();
    }
}
