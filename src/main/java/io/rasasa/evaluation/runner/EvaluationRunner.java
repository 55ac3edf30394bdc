package io.rasasa.evaluation.runner;

import io.rasasa.evaluation.config.ConfigurationException;
import io.rasasa.evaluation.config.EngineConfigLoader;
import io.rasasa.evaluation.engine.EngineDescriptor;
import io.rasasa.evaluation.engine.EngineResolver;

import java.nio.file.Path;
import java.util.OptionalInt;

/**
 * Main entry point for the evaluator CLI.
 *
 * <p>Invocation:
 * <pre>
 * java -jar rasasa-evaluator.jar evaluate \
 *   --input data/processed/lichess_2024-01.ndjson \
 *   --engine-version 17 --depth 16 --workers 4
 * </pre>
 *
 * <p>Engine settings come from {@code config.toml} ({@code [engine]} table) and are overridden
 * by the command line. Running the same command again after it completed is a no-op; running it
 * after an interrupted sharded run resumes the shards that did not finish.
 */
public class EvaluationRunner {

    /**
     * Parsed command line of the {@code evaluate} operation. Engine fields are null when not given.
     */
    record EvaluateOptions(
        Path input,
        Path output,
        OptionalInt maxGames,
        String engine,
        String engineVersion,
        Integer depth,
        Integer threads,
        Integer hashMb,
        int workers,
        Path config,
        Path toolsDir
    ) {}

    public static void main(String[] args) {
        System.exit(run(args));
    }

    /**
     * Runs the CLI and returns the process exit code.
     */
    static int run(String[] args) {
        if (args.length < 1 || !"evaluate".equals(args[0])) {
            printUsage();
            return 1;
        }

        String[] remainingArgs = new String[args.length - 1];
        System.arraycopy(args, 1, remainingArgs, 0, args.length - 1);

        EvaluateOptions options;
        try {
            options = parseArgs(remainingArgs);
        } catch (IllegalArgumentException e) {
            System.err.println("Error: " + e.getMessage());
            printUsage();
            return 1;
        }

        try {
            EngineConfigLoader loader = new EngineConfigLoader(EngineConfigLoader.builtInDefaults());
            EngineDescriptor engine = EngineConfigLoader.validate(
                applyOverrides(loader.load(options.config()), options));
            EvaluateRequest request = toRequest(options, engine);
            Evaluator evaluator = new Evaluator(new UciEngineBackend(new EngineResolver(options.toolsDir())));
            evaluator.evaluate(request);
            return 0;
        } catch (ConfigurationException e) {
            System.err.println("Configuration error: " + e.getMessage());
            return 1;
        } catch (ShardFailedException e) {
            System.err.println("Evaluation aborted: " + e.getMessage());
            System.err.println("Completed shards were kept; run the same command again to resume.");
            return 1;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            System.err.println("Evaluation interrupted");
            return 1;
        } catch (Exception e) {
            System.err.println("Evaluation failed: " + e.getMessage());
            e.printStackTrace();
            return 1;
        }
    }

    /**
     * Parses the arguments following {@code evaluate}.
     *
     * @throws IllegalArgumentException if an argument is unknown, malformed or missing
     */
    static EvaluateOptions parseArgs(String[] args) {
        Path input = null;
        Path output = null;
        OptionalInt maxGames = OptionalInt.empty();
        String engine = null;
        String engineVersion = null;
        Integer depth = null;
        Integer threads = null;
        Integer hashMb = null;
        int workers = 1;
        Path config = Path.of("config.toml");
        Path toolsDir = Path.of("tools");

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--input" -> input = Path.of(value(args, ++i));
                case "--output" -> output = Path.of(value(args, ++i));
                case "--max" -> maxGames = OptionalInt.of(positive(args, ++i));
                case "--engine" -> engine = value(args, ++i);
                case "--engine-version" -> engineVersion = value(args, ++i);
                case "--depth" -> depth = integer(args, ++i);
                case "--threads" -> threads = integer(args, ++i);
                case "--hash-mb" -> hashMb = integer(args, ++i);
                case "--workers" -> workers = positive(args, ++i);
                case "--config" -> config = Path.of(value(args, ++i));
                case "--tools-dir" -> toolsDir = Path.of(value(args, ++i));
                default -> throw new IllegalArgumentException("Unknown argument: " + args[i]);
            }
        }

        if (input == null) {
            throw new IllegalArgumentException("Missing required argument: --input");
        }
        if (output == null) {
            output = defaultOutput(input);
        }
        return new EvaluateOptions(input, output, maxGames, engine, engineVersion, depth, threads, hashMb,
            workers, config, toolsDir);
    }

    /**
     * {@code data/processed/<input stem>.evals.ndjson}.
     */
    static Path defaultOutput(Path input) {
        String name = input.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String stem = dot > 0 ? name.substring(0, dot) : name;
        return Path.of("data", "processed", stem + ".evals.ndjson");
    }

    /**
     * Command-line engine fields win over the loaded configuration.
     */
    static EngineDescriptor applyOverrides(EngineDescriptor loaded, EvaluateOptions options) {
        EngineDescriptor engine = loaded;
        if (options.engine() != null && !options.engine().isEmpty()) {
            engine = engine.withName(options.engine());
        }
        if (options.engineVersion() != null && !options.engineVersion().isEmpty()) {
            engine = engine.withVersion(options.engineVersion());
        }
        if (options.depth() != null) {
            engine = engine.withDepth(options.depth());
        }
        if (options.threads() != null) {
            engine = engine.withThreads(options.threads());
        }
        if (options.hashMb() != null) {
            engine = engine.withHashMb(options.hashMb());
        }
        return engine;
    }

    /**
     * Paths are made absolute so that the same run is recognised from any working directory.
     */
    static EvaluateRequest toRequest(EvaluateOptions options, EngineDescriptor engine) {
        return new EvaluateRequest(
            options.input().toAbsolutePath().normalize(),
            options.output().toAbsolutePath().normalize(),
            options.maxGames(),
            engine,
            options.workers());
    }

    private static String value(String[] args, int i) {
        if (i >= args.length) {
            throw new IllegalArgumentException("Missing value for " + args[i - 1]);
        }
        return args[i];
    }

    private static int integer(String[] args, int i) {
        String raw = value(args, i);
        try {
            return Integer.parseInt(raw);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid integer for " + args[i - 1] + ": " + raw);
        }
    }

    private static int positive(String[] args, int i) {
        int parsed = integer(args, i);
        if (parsed < 1) {
            throw new IllegalArgumentException(args[i - 1] + " must be at least 1, got " + parsed);
        }
        return parsed;
    }

    private static void printUsage() {
        System.err.println("Usage: java -jar rasasa-evaluator.jar evaluate --input <path> [options]");
        System.err.println();
        System.err.println("Options:");
        System.err.println("  --input <path>             NDJSON game records (required)");
        System.err.println("  --output <path>            Output NDJSON (default: data/processed/<input>.evals.ndjson)");
        System.err.println("  --max <n>                  Evaluate at most n games");
        System.err.println("  --engine <name>            Engine name or executable (default from config: stockfish)");
        System.err.println("  --engine-version <v>       Engine version (required unless set in config)");
        System.err.println("  --depth <n>                Search depth per position (default from config: 16)");
        System.err.println("  --threads <n>              Engine Threads option (default from config: 2)");
        System.err.println("  --hash-mb <n>              Engine Hash option in MB (default from config: 256)");
        System.err.println("  --workers <n>              1 = sequential, more = that many shard processes (default: 1)");
        System.err.println("  --config <path>            Configuration file (default: config.toml)");
        System.err.println("  --tools-dir <dir>          Installed engines directory (default: tools)");
    }
}
