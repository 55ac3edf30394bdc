package io.rasasa.evaluation.runner;

import io.rasasa.evaluation.engine.EngineConnector;
import io.rasasa.evaluation.engine.EngineDescriptor;

/**
 * Everything the {@link Evaluator} needs to reach an engine, kept behind one seam so that
 * nothing engine-related happens before the run cache has been consulted.
 */
public interface EngineBackend {

    /**
     * Resolves the engine executable.
     *
     * @throws io.rasasa.evaluation.config.ConfigurationException if it cannot be found
     */
    String resolve(EngineDescriptor engine);

    /**
     * Connector for the sequential path.
     */
    EngineConnector connector(String enginePath);

    /**
     * Launcher for the sharded path.
     */
    ShardLauncher shardLauncher(EngineDescriptor engine, String enginePath);
}
