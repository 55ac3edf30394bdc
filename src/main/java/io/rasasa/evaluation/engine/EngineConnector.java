package io.rasasa.evaluation.engine;

/**
 * Spawns a fresh engine for one evaluation session.
 */
@FunctionalInterface
public interface EngineConnector {

    EngineLink connect() throws EngineException;
}
