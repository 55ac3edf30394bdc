package io.rasasa.evaluation.engine;

import java.util.List;
import java.util.Locale;

/**
 * Connects to a UCI engine executable, one process per session.
 */
public final class UciEngineConnector implements EngineConnector {

    private final String enginePath;

    public UciEngineConnector(String enginePath) {
        this.enginePath = enginePath;
    }

    @Override
    public EngineLink connect() throws EngineException {
        UciEngineChannel channel = UciEngineChannel.start(List.of(enginePath));
        if (!channel.engineName().toLowerCase(Locale.ROOT).contains("stockfish")) {
            channel.close();
            throw new EngineException("Engine at " + enginePath + " identifies as '" + channel.engineName()
                + "'; legal moves need Stockfish's 'go perft 1'");
        }
        System.out.printf("Engine %s started from %s%n",
            channel.engineName().isEmpty() ? "(unnamed)" : channel.engineName(), enginePath);
        return new EngineLink(channel, new PerftMoveRules(channel));
    }
}
