package io.rasasa.evaluation.engine;

import io.rasasa.evaluation.session.EvalScore;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class UciEngineConnectorTest {

    @Test
    void connect_stockfish_analysesAndChecksMoves(@TempDir Path tempDir) throws Exception {
        Path engine = StubEngineScript.write(tempDir, "stockfish", "Stockfish 17");

        try (EngineLink link = new UciEngineConnector(engine.toString()).connect()) {
            Position position = link.rules().play(Position.start(), "e2e4");

            assertEquals(EvalScore.centipawns(12), link.channel().analyse(position, 4));
            assertThrows(IllegalMoveException.class, () -> link.rules().play(position, "a2a4"));
        }
    }

    @Test
    void connect_engineWithoutPerft_throws(@TempDir Path tempDir) throws Exception {
        Path engine = StubEngineScript.write(tempDir, "stockfish", "Lc0 v0.31");

        EngineException e = assertThrows(EngineException.class,
            () -> new UciEngineConnector(engine.toString()).connect());
        assertTrue(e.getMessage().contains("Lc0"), e.getMessage());
    }
}
