package io.rasasa.evaluation.engine;

import java.util.regex.Pattern;

/**
 * {@link MoveRules} that asks the engine itself for the legal moves of a position, so the
 * evaluator needs no board representation of its own.
 */
public final class PerftMoveRules implements MoveRules {

    private static final Pattern UCI_MOVE = Pattern.compile("^[a-h][1-8][a-h][1-8][qrbn]?$");

    private final UciEngineChannel channel;

    public PerftMoveRules(UciEngineChannel channel) {
        this.channel = channel;
    }

    @Override
    public Position play(Position position, String move) throws IllegalMoveException, EngineException {
        if (move == null || !UCI_MOVE.matcher(move).matches()) {
            throw new IllegalMoveException(String.valueOf(move), position);
        }
        if (!channel.legalMoves(position).contains(move)) {
            throw new IllegalMoveException(move, position);
        }
        return position.then(move);
    }
}
