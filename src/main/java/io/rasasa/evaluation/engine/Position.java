package io.rasasa.evaluation.engine;

import com.google.common.collect.ImmutableList;

/**
 * A position identified by the legal move prefix that reaches it from the standard start position.
 * This is exactly what a UCI engine needs to set up the board, so no board representation is kept here.
 */
public record Position(ImmutableList<String> moves) {

    private static final Position START = new Position(ImmutableList.of());

    public static Position start() {
        return START;
    }

    /**
     * Returns the position after {@code move}. Legality is not checked here; see {@link MoveRules}.
     */
    public Position then(String move) {
        return new Position(ImmutableList.<String>builderWithExpectedSize(moves.size() + 1)
            .addAll(moves)
            .add(move)
            .build());
    }

    public boolean whiteToMove() {
        return moves.size() % 2 == 0;
    }

    /**
     * The UCI {@code position} command for this position.
     */
    public String toUciCommand() {
        if (moves.isEmpty()) {
            return "position startpos";
        }
        return "position startpos moves " + String.join(" ", moves);
    }
}
