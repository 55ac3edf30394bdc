package io.rasasa.evaluation.session;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

/**
 * A fully evaluated game: the input record plus one score per move, aligned index for index.
 */
@JsonPropertyOrder({"headers", "moves", "clocks", "evals", "engine"})
public record EvaluationRecord(
    @JsonProperty("headers") ImmutableMap<String, String> headers,
    @JsonProperty("moves") ImmutableList<String> moves,
    @JsonProperty("clocks") ImmutableList<Double> clocks,
    @JsonProperty("evals") ImmutableList<EvalScore> evals,
    @JsonProperty("engine") EngineStamp engine
) {

    public EvaluationRecord {
        Preconditions.checkArgument(evals.size() == moves.size(),
            "%s evals for %s moves", evals.size(), moves.size());
    }

    public static EvaluationRecord of(GameRecord game, ImmutableList<EvalScore> evals, EngineStamp engine) {
        return new EvaluationRecord(game.headers(), game.moves(), game.clocks(), evals, engine);
    }
}
