package io.rasasa.evaluation.engine;

/**
 * A connected engine together with the rules component that answers move legality for it.
 * Closing the link closes the channel.
 */
public record EngineLink(EngineChannel channel, MoveRules rules) implements AutoCloseable {

    @Override
    public void close() {
        channel.close();
    }
}
