package io.rasasa.evaluation.session;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.google.common.base.Preconditions;

/**
 * Engine score of one position, relative to the side to move. Either a centipawn value, a
 * mate distance, or neither when the engine reported no score.
 */
@JsonPropertyOrder({"cp", "mate"})
public record EvalScore(
    @JsonProperty("cp") Integer cp,
    @JsonProperty("mate") Integer mate
) {

    private static final EvalScore UNKNOWN = new EvalScore(null, null);

    public EvalScore {
        Preconditions.checkArgument(cp == null || mate == null,
            "score cannot be both centipawns (%s) and mate (%s)", cp, mate);
    }

    public static EvalScore centipawns(int cp) {
        return new EvalScore(cp, null);
    }

    public static EvalScore mateIn(int moves) {
        return new EvalScore(null, moves);
    }

    public static EvalScore unknown() {
        return UNKNOWN;
    }
}
