package io.rasasa.evaluation.runner;

import com.google.common.collect.LinkedListMultimap;
import com.google.common.collect.ListMultimap;
import io.rasasa.evaluation.session.EvaluationStats;

import java.io.IOException;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Reads and writes the per-shard counter file that marks a shard as complete.
 */
public final class PartMetadata {

    static final String TOTAL_GAMES = "total_games";
    static final String EVALUATED_GAMES = "evaluated_games";
    static final String SKIPPED_ILLEGAL_GAMES = "skipped_illegal_games";
    static final String SKIPPED_ENGINE_ERRORS = "skipped_engine_errors";

    private PartMetadata() {}

    public static void write(Path path, EvaluationStats stats) throws IOException {
        ListMultimap<String, String> entries = LinkedListMultimap.create();
        entries.put(TOTAL_GAMES, Integer.toString(stats.totalGames()));
        entries.put(EVALUATED_GAMES, Integer.toString(stats.evaluatedGames()));
        entries.put(SKIPPED_ILLEGAL_GAMES, Integer.toString(stats.skippedIllegalGames()));
        entries.put(SKIPPED_ENGINE_ERRORS, Integer.toString(stats.skippedEngineErrors()));
        KeyValueFile.write(path, entries);
    }

    /**
     * @return the counters, or empty if the file is missing, unreadable, lacks a counter, holds
     *         a non-integer value or holds counters that do not add up
     */
    public static Optional<EvaluationStats> read(Path path) {
        Optional<ListMultimap<String, String>> entries = KeyValueFile.read(path);
        if (entries.isEmpty()) {
            return Optional.empty();
        }
        Map<String, Integer> values = new HashMap<>();
        for (Map.Entry<String, String> entry : entries.get().entries()) {
            if (entry.getValue().isEmpty()) {
                continue;
            }
            try {
                values.put(entry.getKey(), Integer.parseInt(entry.getValue().trim()));
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
        if (!values.keySet().containsAll(
                List.of(TOTAL_GAMES, EVALUATED_GAMES, SKIPPED_ILLEGAL_GAMES, SKIPPED_ENGINE_ERRORS))) {
            return Optional.empty();
        }
        try {
            return Optional.of(new EvaluationStats(
                values.get(TOTAL_GAMES),
                values.get(EVALUATED_GAMES),
                values.get(SKIPPED_ILLEGAL_GAMES),
                values.get(SKIPPED_ENGINE_ERRORS)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
