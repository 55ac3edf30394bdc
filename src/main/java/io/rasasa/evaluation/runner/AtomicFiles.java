package io.rasasa.evaluation.runner;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;

/**
 * Writes files through a sibling {@code .tmp} file and an atomic rename, so readers never
 * observe a partially written file.
 */
final class AtomicFiles {

    private AtomicFiles() {}

    static void writeString(Path target, String content) throws IOException {
        Path temp = tempFor(target);
        Files.writeString(temp, content, StandardCharsets.UTF_8);
        Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
    }

    /**
     * Writes the byte-for-byte concatenation of {@code parts}, in list order, to {@code target}.
     */
    static void concatenate(List<Path> parts, Path target) throws IOException {
        Path temp = tempFor(target);
        try (OutputStream out = Files.newOutputStream(temp)) {
            for (Path part : parts) {
                Files.copy(part, out);
            }
        }
        Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
    }

    static Path tempFor(Path target) {
        return target.resolveSibling(target.getFileName() + ".tmp");
    }
}
