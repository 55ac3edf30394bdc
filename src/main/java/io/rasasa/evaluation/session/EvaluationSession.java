package io.rasasa.evaluation.session;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.collect.ImmutableList;
import io.rasasa.evaluation.config.ObjectMapperFactory;
import io.rasasa.evaluation.engine.EngineConnector;
import io.rasasa.evaluation.engine.EngineDescriptor;
import io.rasasa.evaluation.engine.EngineException;
import io.rasasa.evaluation.engine.EngineLink;
import io.rasasa.evaluation.engine.IllegalMoveException;
import io.rasasa.evaluation.engine.Position;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.OptionalInt;

/**
 * Drives one engine process through every game of an NDJSON input file.
 *
 * <p>Each game starts from the initial position. For every move the position before it is
 * analysed at the configured depth, then the move is played. A failed analysis marks the game
 * {@link GameOutcome.Status#ENGINE_ERROR}, a move the rules reject marks it
 * {@link GameOutcome.Status#ILLEGAL}; either way only that game is skipped. Games whose moves
 * all play out are written as {@link EvaluationRecord}s.
 *
 * <p>The engine is connected and configured once per call to {@link #evaluate} and is closed on
 * every exit path.
 */
public class EvaluationSession {

    private final EngineConnector connector;
    private final EngineDescriptor engine;
    private final EngineStamp stamp;
    private final ObjectMapper mapper;

    /**
     * @param connector  spawns the engine for this session
     * @param engine     engine settings; the depth is used for every analysis
     * @param enginePath resolved engine command, recorded in every output record
     */
    public EvaluationSession(EngineConnector connector, EngineDescriptor engine, String enginePath) {
        this.connector = connector;
        this.engine = engine;
        this.stamp = EngineStamp.of(enginePath, engine);
        this.mapper = ObjectMapperFactory.create();
    }

    /**
     * Evaluates the games in {@code input} and writes the evaluated ones to {@code output}.
     * The output only appears once the whole input has been processed.
     *
     * @param maxGames stop after this many games have been counted, if present
     * @return counters for the games read
     * @throws IOException     if the input cannot be read, contains a malformed record, or the output cannot be written
     * @throws EngineException if the engine cannot be started or configured
     */
    public EvaluationStats evaluate(Path input, Path output, OptionalInt maxGames)
            throws IOException, EngineException {
        Path parent = output.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Path temp = output.resolveSibling(output.getFileName() + ".tmp");
        EvaluationStats stats;
        try (BufferedReader reader = Files.newBufferedReader(input, StandardCharsets.UTF_8);
             BufferedWriter writer = Files.newBufferedWriter(temp, StandardCharsets.UTF_8);
             EngineLink link = connector.connect()) {
            link.channel().configure(engine.uciOptions());
            stats = evaluateAll(input, reader, writer, link, maxGames);
        } catch (IOException | EngineException | RuntimeException e) {
            Files.deleteIfExists(temp);
            throw e;
        }
        Files.move(temp, output, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        return stats;
    }

    private EvaluationStats evaluateAll(Path input, BufferedReader reader, Writer writer, EngineLink link,
                                        OptionalInt maxGames) throws IOException {
        int total = 0;
        int evaluated = 0;
        int illegal = 0;
        int engineErrors = 0;
        int lineNumber = 0;
        String line;
        while ((line = reader.readLine()) != null) {
            lineNumber++;
            if (line.isBlank()) {
                continue;
            }
            GameRecord game = parseGame(line, input, lineNumber);
            total++;

            GameOutcome outcome = evaluateGame(total, game, link);
            switch (outcome.status()) {
                case DONE -> {
                    writer.write(mapper.writeValueAsString(EvaluationRecord.of(game, outcome.evals(), stamp)));
                    writer.write('\n');
                    evaluated++;
                }
                case ILLEGAL -> illegal++;
                case ENGINE_ERROR -> engineErrors++;
            }
            if (outcome.status() != GameOutcome.Status.DONE) {
                System.out.printf("Skipped game %d of %s (%s at ply %d)%n",
                    outcome.gameNumber(), input, outcome.detail(), outcome.ply());
            }

            if (maxGames.isPresent() && total >= maxGames.getAsInt()) {
                break;
            }
        }
        return new EvaluationStats(total, evaluated, illegal, engineErrors);
    }

    /**
     * Runs the per-game state machine: analyse, then play, for every move in order.
     */
    GameOutcome evaluateGame(int gameNumber, GameRecord game, EngineLink link) {
        Position position = Position.start();
        ImmutableList.Builder<EvalScore> evals = ImmutableList.builderWithExpectedSize(game.moves().size());
        for (int ply = 0; ply < game.moves().size(); ply++) {
            String move = game.moves().get(ply);
            try {
                evals.add(link.channel().analyse(position, engine.depth()));
            } catch (EngineException e) {
                return GameOutcome.engineError(gameNumber, evals.build(), ply, e.getMessage());
            }
            try {
                position = link.rules().play(position, move);
            } catch (IllegalMoveException e) {
                return GameOutcome.illegal(gameNumber, evals.build(), ply, move);
            } catch (EngineException e) {
                return GameOutcome.engineError(gameNumber, evals.build(), ply, e.getMessage());
            }
        }
        return GameOutcome.done(gameNumber, evals.build());
    }

    private GameRecord parseGame(String line, Path input, int lineNumber) throws IOException {
        try {
            return mapper.readValue(line, GameRecord.class);
        } catch (JsonProcessingException e) {
            throw new IOException("Malformed game record at " + input + ":" + lineNumber + ": "
                + e.getOriginalMessage(), e);
        }
    }
}
