package io.rasasa.evaluation.runner;

/**
 * A shard worker did not complete. Fatal to the whole parallel run.
 */
public class ShardFailedException extends Exception {

    private final int shardIndex;

    public ShardFailedException(int shardIndex, String message) {
        super("Shard " + shardIndex + ": " + message);
        this.shardIndex = shardIndex;
    }

    public ShardFailedException(int shardIndex, String message, Throwable cause) {
        super("Shard " + shardIndex + ": " + message, cause);
        this.shardIndex = shardIndex;
    }

    public int shardIndex() {
        return shardIndex;
    }
}
