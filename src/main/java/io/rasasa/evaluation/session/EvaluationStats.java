package io.rasasa.evaluation.session;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.Preconditions;

/**
 * Game counters of a session, a shard or a whole run. Every counted game ends in exactly one
 * of the three outcomes, so {@code totalGames} is always their sum.
 */
public record EvaluationStats(
    @JsonProperty("total_games") int totalGames,
    @JsonProperty("evaluated_games") int evaluatedGames,
    @JsonProperty("skipped_illegal_games") int skippedIllegalGames,
    @JsonProperty("skipped_engine_errors") int skippedEngineErrors
) {

    private static final EvaluationStats EMPTY = new EvaluationStats(0, 0, 0, 0);

    public EvaluationStats {
        Preconditions.checkArgument(evaluatedGames >= 0 && skippedIllegalGames >= 0 && skippedEngineErrors >= 0,
            "negative game counter");
        Preconditions.checkArgument(totalGames == evaluatedGames + skippedIllegalGames + skippedEngineErrors,
            "total_games %s != %s evaluated + %s illegal + %s engine errors",
            totalGames, evaluatedGames, skippedIllegalGames, skippedEngineErrors);
    }

    public static EvaluationStats empty() {
        return EMPTY;
    }

    public EvaluationStats plus(EvaluationStats other) {
        return new EvaluationStats(
            totalGames + other.totalGames,
            evaluatedGames + other.evaluatedGames,
            skippedIllegalGames + other.skippedIllegalGames,
            skippedEngineErrors + other.skippedEngineErrors);
    }

    public static EvaluationStats sum(Iterable<EvaluationStats> parts) {
        EvaluationStats total = EMPTY;
        for (EvaluationStats part : parts) {
            total = total.plus(part);
        }
        return total;
    }
}
