package io.rasasa.evaluation.runner;

import io.rasasa.evaluation.session.EvaluationStats;

import java.nio.file.Path;

/**
 * Outcome of {@link Evaluator#evaluate}.
 *
 * @param stats        counters of the run, or of the cached run when skipped
 * @param skipped      true when the run cache answered and no engine was started
 * @param outputPath   final output
 * @param metadataPath run metadata sidecar
 */
public record EvaluationResult(EvaluationStats stats, boolean skipped, Path outputPath, Path metadataPath) {}
