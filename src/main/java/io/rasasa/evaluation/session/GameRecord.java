package io.rasasa.evaluation.session;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

/**
 * One extracted game: PGN headers, mainline moves in UCI coordinate notation and the clock
 * reading (seconds) after each move.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record GameRecord(
    @JsonProperty("headers") ImmutableMap<String, String> headers,
    @JsonProperty("moves") ImmutableList<String> moves,
    @JsonProperty("clocks") ImmutableList<Double> clocks
) {

    public GameRecord {
        Preconditions.checkArgument(moves != null, "game record has no moves");
        Preconditions.checkArgument(clocks != null, "game record has no clocks");
        headers = headers == null ? ImmutableMap.of() : headers;
    }
}
