package io.rasasa.evaluation.engine;

/**
 * A recorded move that cannot be played in the position it was recorded for.
 */
public class IllegalMoveException extends Exception {

    private final String move;

    public IllegalMoveException(String move, Position position) {
        super("Illegal move " + move + " after " + position.moves().size() + " plies");
        this.move = move;
    }

    public String move() {
        return move;
    }
}
