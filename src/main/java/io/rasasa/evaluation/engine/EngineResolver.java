package io.rasasa.evaluation.engine;

import com.google.common.base.Splitter;
import com.google.common.base.Strings;
import io.rasasa.evaluation.config.ConfigurationException;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Resolves the executable for an {@link EngineDescriptor}.
 *
 * <p>An installed Stockfish lives at {@code <tools>/stockfish/<version-number>/stockfish}; any
 * other name is either a path to an executable or a command looked up on the PATH. Resolution
 * fails with a {@link ConfigurationException} when nothing executable is found or the name is
 * not a Stockfish build, so a bad engine setting is reported before a single process is spawned.
 */
public class EngineResolver {

    private static final Pattern VERSION_NUMBER = Pattern.compile("(\\d+(?:\\.\\d+)*)");

    private final Path toolsDir;
    private final String searchPath;

    public EngineResolver(Path toolsDir) {
        this(toolsDir, Strings.nullToEmpty(System.getenv("PATH")));
    }

    /**
     * @param toolsDir   directory engines are installed into
     * @param searchPath PATH-style list of directories for bare command names
     */
    public EngineResolver(Path toolsDir, String searchPath) {
        this.toolsDir = toolsDir;
        this.searchPath = searchPath;
    }

    /**
     * Returns the command to launch for {@code engine}.
     *
     * @throws ConfigurationException if no executable can be found, or the engine is not a
     *                                Stockfish build
     */
    public String resolve(EngineDescriptor engine) {
        String name = engine.name();
        requirePerftSupport(name);
        if ("stockfish".equals(name)) {
            Optional<Path> installed = installedStockfish(engine.version());
            if (installed.isPresent()) {
                return installed.get().toString();
            }
        }
        if (name.indexOf('/') >= 0 || name.indexOf(File.separatorChar) >= 0) {
            Path binary = Path.of(name);
            if (!isExecutable(binary)) {
                throw new ConfigurationException("Engine binary not found or not executable: " + binary);
            }
            return name;
        }
        for (String dir : Splitter.on(File.pathSeparatorChar).omitEmptyStrings().split(searchPath)) {
            if (isExecutable(Path.of(dir, name))) {
                return name;
            }
        }
        throw new ConfigurationException(
            "Engine '" + name + "' is neither installed under " + toolsDir + " nor found on PATH");
    }

    /**
     * Where an installed Stockfish of {@code version} is expected.
     *
     * @return the binary path, empty if the version contains no version number
     */
    public Optional<Path> stockfishBinaryPath(String version) {
        Matcher matcher = VERSION_NUMBER.matcher(Strings.nullToEmpty(version));
        if (!matcher.find()) {
            return Optional.empty();
        }
        return Optional.of(toolsDir.resolve("stockfish").resolve(matcher.group(1)).resolve("stockfish"));
    }

    /**
     * Legal moves are listed with {@code go perft 1}, a Stockfish extension other UCI engines do
     * not answer.
     */
    private static void requirePerftSupport(String name) {
        Path fileName = Path.of(name).getFileName();
        if (fileName == null || !fileName.toString().toLowerCase(Locale.ROOT).contains("stockfish")) {
            throw new ConfigurationException("Engine '" + name + "' is not a Stockfish build; only Stockfish"
                + " answers the 'go perft 1' legal move listing the evaluator relies on");
        }
    }

    private Optional<Path> installedStockfish(String version) {
        return stockfishBinaryPath(version).filter(EngineResolver::isExecutable);
    }

    private static boolean isExecutable(Path path) {
        return Files.isRegularFile(path) && Files.isExecutable(path);
    }
}
