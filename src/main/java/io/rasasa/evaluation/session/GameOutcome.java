package io.rasasa.evaluation.session;

import com.google.common.collect.ImmutableList;

/**
 * How evaluation of a single game ended.
 *
 * @param gameNumber 1-based position of the game in the session input
 * @param status     terminal state of the game
 * @param evals      scores gathered so far; complete only for {@link Status#DONE}
 * @param ply        0-based move index the game stopped at, or the move count when done
 * @param detail     human-readable reason for a skipped game, empty when done
 */
public record GameOutcome(int gameNumber, Status status, ImmutableList<EvalScore> evals, int ply, String detail) {

    public enum Status {
        DONE,
        ILLEGAL,
        ENGINE_ERROR
    }

    public static GameOutcome done(int gameNumber, ImmutableList<EvalScore> evals) {
        return new GameOutcome(gameNumber, Status.DONE, evals, evals.size(), "");
    }

    public static GameOutcome illegal(int gameNumber, ImmutableList<EvalScore> evals, int ply, String move) {
        return new GameOutcome(gameNumber, Status.ILLEGAL, evals, ply, "illegal move " + move);
    }

    public static GameOutcome engineError(int gameNumber, ImmutableList<EvalScore> evals, int ply, String reason) {
        return new GameOutcome(gameNumber, Status.ENGINE_ERROR, evals, ply, "engine error: " + reason);
    }
}
