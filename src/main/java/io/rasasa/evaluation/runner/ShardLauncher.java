package io.rasasa.evaluation.runner;

import io.rasasa.evaluation.session.EvaluationStats;

/**
 * Runs one shard to completion. On success the task's part output and part metadata exist.
 */
@FunctionalInterface
public interface ShardLauncher {

    /**
     * @return the shard's counters
     * @throws ShardFailedException if the shard did not complete
     */
    EvaluationStats launch(ShardTask task) throws ShardFailedException, InterruptedException;
}
