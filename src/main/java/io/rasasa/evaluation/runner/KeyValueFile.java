package io.rasasa.evaluation.runner;

import com.google.common.collect.LinkedListMultimap;
import com.google.common.collect.ListMultimap;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Plain {@code key=value} line files used for the shard manifest and part metadata.
 * Keys may repeat; entries keep file order. Lines without {@code =} are ignored and the value
 * is everything after the first {@code =}.
 */
final class KeyValueFile {

    private KeyValueFile() {}

    /**
     * @return the entries, or empty if the file cannot be read
     */
    static Optional<ListMultimap<String, String>> read(Path path) {
        List<String> lines;
        try {
            lines = Files.readAllLines(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            return Optional.empty();
        }
        ListMultimap<String, String> entries = LinkedListMultimap.create();
        for (String line : lines) {
            int eq = line.indexOf('=');
            if (eq < 0) {
                continue;
            }
            entries.put(line.substring(0, eq), line.substring(eq + 1));
        }
        return Optional.of(entries);
    }

    static void write(Path path, ListMultimap<String, String> entries) throws IOException {
        StringBuilder content = new StringBuilder();
        for (Map.Entry<String, String> entry : entries.entries()) {
            content.append(entry.getKey()).append('=').append(entry.getValue()).append('\n');
        }
        AtomicFiles.writeString(path, content.toString());
    }

    /**
     * The last value recorded for a single-valued key, null if absent.
     */
    static String last(ListMultimap<String, String> entries, String key) {
        List<String> values = entries.get(key);
        return values.isEmpty() ? null : values.get(values.size() - 1);
    }
}
