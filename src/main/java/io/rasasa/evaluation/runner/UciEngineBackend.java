package io.rasasa.evaluation.runner;

import io.rasasa.evaluation.engine.EngineConnector;
import io.rasasa.evaluation.engine.EngineDescriptor;
import io.rasasa.evaluation.engine.EngineResolver;
import io.rasasa.evaluation.engine.UciEngineConnector;

/**
 * UCI engine processes: in this JVM for sequential runs, in shard worker JVMs for sharded runs.
 */
public class UciEngineBackend implements EngineBackend {

    private final EngineResolver resolver;

    public UciEngineBackend(EngineResolver resolver) {
        this.resolver = resolver;
    }

    @Override
    public String resolve(EngineDescriptor engine) {
        return resolver.resolve(engine);
    }

    @Override
    public EngineConnector connector(String enginePath) {
        return new UciEngineConnector(enginePath);
    }

    @Override
    public ShardLauncher shardLauncher(EngineDescriptor engine, String enginePath) {
        return new ProcessShardLauncher(engine, enginePath);
    }
}
