package io.rasasa.evaluation.runner;

import java.nio.file.Files;
import java.util.Optional;

/**
 * Whole-run idempotency gate. A run is skipped only when its output and sidecar both exist
 * and the sidecar records the same input, output, cap and engine settings as the request.
 */
public class RunCache {

    public enum Status {
        /** Output and matching sidecar exist; nothing to do. */
        HIT,
        /** No usable completed run; leftovers of an interrupted run with these parameters may be resumed. */
        MISS,
        /** A sidecar exists but is unreadable or records other parameters; everything it covers is stale. */
        STALE
    }

    /**
     * @param status   the decision
     * @param recorded the parsed sidecar, when there is one
     */
    public record Lookup(Status status, Optional<RunMetadata> recorded) {}

    private final RunMetadataStore store;

    public RunCache(RunMetadataStore store) {
        this.store = store;
    }

    public Lookup lookup(EvaluateRequest request) {
        RunLayout layout = request.layout();
        if (!Files.exists(layout.metadataPath())) {
            return new Lookup(Status.MISS, Optional.empty());
        }
        Optional<RunMetadata> recorded = store.read(layout.metadataPath());
        if (recorded.isEmpty() || !recorded.get().matches(request)) {
            return new Lookup(Status.STALE, recorded);
        }
        if (!Files.exists(request.outputPath())) {
            return new Lookup(Status.MISS, recorded);
        }
        return new Lookup(Status.HIT, recorded);
    }
}
