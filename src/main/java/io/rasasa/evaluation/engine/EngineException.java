package io.rasasa.evaluation.engine;

/**
 * Raised when the engine channel cannot deliver an answer: the process died, the stream
 * closed, or the engine replied with something that is not valid UCI.
 */
public class EngineException extends Exception {

    public EngineException(String message) {
        super(message);
    }

    public EngineException(String message, Throwable cause) {
        super(message, cause);
    }
}
