package io.rasasa.evaluation.runner;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.rasasa.evaluation.config.ObjectMapperFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * Writes and reads run metadata sidecars. Sidecars are written atomically to prevent partial writes.
 */
public class RunMetadataStore {

    private final ObjectMapper objectMapper;

    public RunMetadataStore() {
        this.objectMapper = ObjectMapperFactory.createIndenting();
    }

    /**
     * Writes the sidecar atomically.
     */
    public void write(Path path, RunMetadata metadata) throws IOException {
        Path temp = AtomicFiles.tempFor(path);
        objectMapper.writeValue(temp.toFile(), metadata);
        Files.move(temp, path, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
    }

    /**
     * @return the sidecar, or empty if it is missing or cannot be parsed
     */
    public Optional<RunMetadata> read(Path path) {
        if (!Files.exists(path)) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(objectMapper.readValue(path.toFile(), RunMetadata.class));
        } catch (IOException e) {
            return Optional.empty();
        }
    }
}
