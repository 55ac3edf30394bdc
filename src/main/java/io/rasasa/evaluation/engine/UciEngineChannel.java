package io.rasasa.evaluation.engine;

import com.google.common.collect.ImmutableSet;
import com.google.common.io.Closeables;
import io.rasasa.evaluation.session.EvalScore;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * {@link EngineChannel} speaking UCI to an engine process over its standard streams.
 *
 * <p>Only the subset of the protocol the evaluator needs is implemented: the {@code uci}
 * handshake, {@code setoption}, {@code isready}, {@code position startpos moves ...},
 * {@code go depth N} and {@code go perft 1} (used by {@link PerftMoveRules}).
 */
public final class UciEngineChannel implements EngineChannel {

    private static final Pattern PERFT_LINE = Pattern.compile("^([a-h][1-8][a-h][1-8][qrbn]?): \\d+$");
    private static final long QUIT_GRACE_MILLIS = 2000;

    private final Process process;
    private final BufferedReader fromEngine;
    private final Writer toEngine;
    private String engineName = "";
    private boolean closed;

    /**
     * @param process    the engine process, or null when the streams are not backed by a process
     * @param fromEngine engine output
     * @param toEngine   engine input
     */
    UciEngineChannel(Process process, BufferedReader fromEngine, Writer toEngine) {
        this.process = process;
        this.fromEngine = fromEngine;
        this.toEngine = toEngine;
    }

    /**
     * Starts the engine and completes the UCI handshake.
     *
     * @param command the engine command line
     * @throws EngineException if the process cannot be started or never answers {@code uciok}
     */
    public static UciEngineChannel start(List<String> command) throws EngineException {
        Process process;
        try {
            process = new ProcessBuilder(command)
                .redirectError(ProcessBuilder.Redirect.INHERIT)
                .start();
        } catch (IOException e) {
            throw new EngineException("Failed to start engine " + String.join(" ", command), e);
        }
        UciEngineChannel channel = new UciEngineChannel(
            process,
            new BufferedReader(new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8)),
            new OutputStreamWriter(process.getOutputStream(), StandardCharsets.UTF_8));
        try {
            channel.handshake();
        } catch (EngineException e) {
            channel.close();
            throw e;
        }
        return channel;
    }

    void handshake() throws EngineException {
        send("uci");
        String line;
        while (!(line = readLine()).equals("uciok")) {
            if (line.startsWith("id name ")) {
                engineName = line.substring("id name ".length()).trim();
            }
        }
    }

    /**
     * The name the engine reported during the handshake, empty if it sent none.
     */
    public String engineName() {
        return engineName;
    }

    @Override
    public void configure(Map<String, Integer> options) throws EngineException {
        for (Map.Entry<String, Integer> option : options.entrySet()) {
            send("setoption name " + option.getKey() + " value " + option.getValue());
        }
        awaitReady();
    }

    @Override
    public EvalScore analyse(Position position, int depth) throws EngineException {
        send(position.toUciCommand());
        send("go depth " + depth);
        EvalScore score = EvalScore.unknown();
        EngineException malformed = null;
        String line;
        // the search output is read up to bestmove even after a bad line, so the next search starts clean
        while (!(line = readLine()).startsWith("bestmove")) {
            if (line.startsWith("info ") && !line.startsWith("info string") && malformed == null) {
                try {
                    EvalScore parsed = parseScore(line);
                    if (parsed != null) {
                        score = parsed;
                    }
                } catch (EngineException e) {
                    malformed = e;
                }
            }
        }
        if (malformed != null) {
            throw malformed;
        }
        return score;
    }

    /**
     * Lists the legal moves in {@code position} using the engine's {@code go perft 1} output.
     */
    public ImmutableSet<String> legalMoves(Position position) throws EngineException {
        send(position.toUciCommand());
        send("go perft 1");
        ImmutableSet.Builder<String> moves = ImmutableSet.builder();
        String line;
        while (!(line = readLine()).startsWith("Nodes searched")) {
            Matcher matcher = PERFT_LINE.matcher(line);
            if (matcher.matches()) {
                moves.add(matcher.group(1));
            }
        }
        return moves.build();
    }

    /**
     * Extracts the score from a UCI {@code info} line.
     *
     * @return the score, or null if the line carries none
     * @throws EngineException if the score value is not an integer
     */
    static EvalScore parseScore(String infoLine) throws EngineException {
        String[] tokens = infoLine.trim().split("\\s+");
        for (int i = 0; i + 2 < tokens.length; i++) {
            if (!tokens[i].equals("score")) {
                continue;
            }
            try {
                int value = Integer.parseInt(tokens[i + 2]);
                return switch (tokens[i + 1]) {
                    case "cp" -> EvalScore.centipawns(value);
                    case "mate" -> EvalScore.mateIn(value);
                    default -> throw new EngineException("Unknown score type in: " + infoLine);
                };
            } catch (NumberFormatException e) {
                throw new EngineException("Malformed score in: " + infoLine, e);
            }
        }
        return null;
    }

    private void awaitReady() throws EngineException {
        send("isready");
        while (!readLine().equals("readyok")) {
            // skip output until the engine is synchronized
        }
    }

    private void send(String command) throws EngineException {
        if (closed) {
            throw new EngineException("Engine channel is closed");
        }
        try {
            toEngine.write(command);
            toEngine.write('\n');
            toEngine.flush();
        } catch (IOException e) {
            throw new EngineException("Failed to send '" + command + "' to engine", e);
        }
    }

    private String readLine() throws EngineException {
        String line;
        try {
            line = fromEngine.readLine();
        } catch (IOException e) {
            throw new EngineException("Failed to read from engine", e);
        }
        if (line == null) {
            throw new EngineException("Engine terminated unexpectedly");
        }
        return line.trim();
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            toEngine.write("quit\n");
            toEngine.flush();
            toEngine.close();
        } catch (IOException e) {
            // the engine is already gone; make sure the process is too
            if (process != null) {
                process.destroyForcibly();
            }
        }
        Closeables.closeQuietly(fromEngine);
        if (process == null) {
            return;
        }
        try {
            if (!process.waitFor(QUIT_GRACE_MILLIS, TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
            }
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
        }
    }
}
