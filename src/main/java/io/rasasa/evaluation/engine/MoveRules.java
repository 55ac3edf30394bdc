package io.rasasa.evaluation.engine;

/**
 * Decides whether a recorded move is legal and produces the resulting position.
 */
public interface MoveRules {

    Position play(Position position, String move) throws IllegalMoveException, EngineException;
}
