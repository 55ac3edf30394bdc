package io.rasasa.evaluation.engine;

import io.rasasa.evaluation.session.EvalScore;

import java.util.Map;

/**
 * Narrow capability over a persistent analysis engine. Implementations own the engine process
 * and its protocol; callers only configure it once, ask for scores and release it.
 */
public interface EngineChannel extends AutoCloseable {

    /**
     * Applies engine options. Called once, before the first analysis.
     */
    void configure(Map<String, Integer> options) throws EngineException;

    /**
     * Analyses {@code position} to a fixed depth with no time limit.
     *
     * @return the score relative to the side to move, {@link EvalScore#unknown()} if the engine gave none
     */
    EvalScore analyse(Position position, int depth) throws EngineException;

    /**
     * Releases the engine. Never throws; a process that does not exit is killed.
     */
    @Override
    void close();
}
