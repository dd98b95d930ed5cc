package chess.curator.cli;

import chess.curator.build.BuildOptions;
import chess.curator.build.BuildStats;
import chess.curator.build.CurationBuilder;
import chess.curator.compare.ComparisonResult;
import chess.curator.compare.PgnComparator;
import chess.curator.compare.ReplicationConfigWriter;
import chess.curator.config.CuratorProperties;
import chess.curator.plan.ConfigLoader;
import chess.curator.plan.CurationConfig;
import chess.curator.plan.RepertoireColor;
import chess.curator.report.PgnInspector;
import chess.curator.report.ReportPrinter;
import chess.curator.report.StarterConfigGenerator;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.stereotype.Component;

/**
 * Dispatches the command line to the curator's commands.
 *
 * <p>The first non-option argument names the command, the following ones are its positional
 * arguments. Options use the {@code --name=value} form.
 */
@Component
public class CuratorCommands {

    private static final Logger log = LoggerFactory.getLogger(CuratorCommands.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_FAILURE = 1;
    public static final int EXIT_USAGE = 2;

    private static final String SHORT_OUTPUT = "-o=";

    static final String USAGE = String.join("\n",
            "Usage: pgn-curator <command> [arguments] [--options]",
            "",
            "Commands:",
            "  build <config.yml> [--depth=N] [--dry-run] [--split] [--strict]",
            "      Build curated PGN files from a config",
            "  validate <config.yml>",
            "      Check a config without building",
            "  inspect <file.pgn> [--game=N] [--list-variations]",
            "      Show the structure of a PGN file",
            "  init <file.pgn> [--output=config.yml | -o=config.yml]",
            "      Generate a starter config for a PGN file",
            "  compare <baseline.pgn> <target.pgn> [--game1=N --game2=M] [--color=white|black] [--depth=N] [--output=F | -o=F]",
            "      Compute the remove/add instructions that turn one file into the other",
            "  help",
            "      Show this message");

    private final ConfigLoader configLoader;
    private final CurationBuilder builder;
    private final PgnInspector inspector;
    private final StarterConfigGenerator starterConfigGenerator;
    private final PgnComparator comparator;
    private final ReplicationConfigWriter replicationWriter;
    private final CuratorProperties properties;

    public CuratorCommands(
            ConfigLoader configLoader,
            CurationBuilder builder,
            PgnInspector inspector,
            StarterConfigGenerator starterConfigGenerator,
            PgnComparator comparator,
            ReplicationConfigWriter replicationWriter,
            CuratorProperties properties) {
        this.configLoader = configLoader;
        this.builder = builder;
        this.inspector = inspector;
        this.starterConfigGenerator = starterConfigGenerator;
        this.comparator = comparator;
        this.replicationWriter = replicationWriter;
        this.properties = properties;
    }

    /**
     * Runs the command named by {@code args} and returns the process exit code.
     */
    public int run(ApplicationArguments args, PrintStream out) {
        List<String> positional = positional(args);
        if (positional.isEmpty()) {
            out.println(USAGE);
            return EXIT_USAGE;
        }
        String command = positional.get(0);
        try {
            return switch (command) {
                case "build" -> build(args, out);
                case "validate" -> validate(args, out);
                case "inspect" -> inspect(args, out);
                case "init" -> init(args, out);
                case "compare" -> compare(args, out);
                case "help" -> {
                    out.println(USAGE);
                    yield EXIT_OK;
                }
                default -> throw new UsageException("Unknown command '" + command + "'");
            };
        } catch (UsageException e) {
            log.error(e.getMessage());
            out.println(USAGE);
            return EXIT_USAGE;
        } catch (IOException | IllegalArgumentException | IllegalStateException e) {
            log.error("{} failed: {}", command, e.getMessage());
            if (log.isDebugEnabled()) {
                log.debug("Failure detail", e);
            }
            return EXIT_FAILURE;
        }
    }

    private int build(ApplicationArguments args, PrintStream out) throws IOException {
        CurationConfig config = configLoader.load(Path.of(argument(args, 1, "config file")));
        BuildOptions options = new BuildOptions(
                intOption(args, "depth", properties.getDepth()),
                args.containsOption("dry-run"),
                args.containsOption("split"),
                args.containsOption("strict") || properties.isStrictFilters());
        BuildStats stats = builder.build(config, options);
        new ReportPrinter(out).printBuildStats(stats);
        return stats.hasFailures() ? EXIT_FAILURE : EXIT_OK;
    }

    private int validate(ApplicationArguments args, PrintStream out) throws IOException {
        CurationConfig config = configLoader.load(Path.of(argument(args, 1, "config file")));
        new ReportPrinter(out).printConfigSummary(config);
        return EXIT_OK;
    }

    private int inspect(ApplicationArguments args, PrintStream out) throws IOException {
        Path pgn = Path.of(argument(args, 1, "PGN file"));
        ReportPrinter printer = new ReportPrinter(out);
        Integer game = intOption(args, "game", null);
        if (game == null) {
            printer.printInspection(pgn, inspector.inspect(pgn));
        } else {
            printer.printGame(inspector.inspectGame(pgn, game, args.containsOption("list-variations")));
        }
        return EXIT_OK;
    }

    private int init(ApplicationArguments args, PrintStream out) throws IOException {
        String yaml = starterConfigGenerator.render(Path.of(argument(args, 1, "PGN file")));
        String output = option(args, "output");
        if (output == null) {
            out.print(yaml);
        } else {
            Files.writeString(Path.of(output), yaml, StandardCharsets.UTF_8);
            out.println("Config written to " + output);
        }
        return EXIT_OK;
    }

    private int compare(ApplicationArguments args, PrintStream out) throws IOException {
        Path baseline = Path.of(argument(args, 1, "baseline PGN file"));
        Path target = Path.of(argument(args, 2, "target PGN file"));
        Integer game1 = intOption(args, "game1", null);
        Integer game2 = intOption(args, "game2", null);
        if ((game1 == null) != (game2 == null)) {
            throw new UsageException("--game1 and --game2 must be given together");
        }
        String colorOption = option(args, "color");
        RepertoireColor color;
        try {
            color = colorOption == null ? null : RepertoireColor.fromKey(colorOption);
        } catch (IllegalArgumentException e) {
            throw new UsageException(e.getMessage());
        }
        int depth = intOption(args, "depth", properties.getDepth());

        List<ComparisonResult> results = comparator.compareFiles(baseline, target, game1, game2, color, depth);
        new ReportPrinter(out).printComparison(results);

        String output = option(args, "output");
        if (output != null) {
            replicationWriter.write(results, baseline, color, Path.of(output));
            out.println("Replication config written to " + output);
        }
        return EXIT_OK;
    }

    /**
     * Non-option arguments without the {@code -o=F} short form of {@code --output}.
     */
    private static List<String> positional(ApplicationArguments args) {
        return args.getNonOptionArgs().stream().filter(arg -> !arg.startsWith(SHORT_OUTPUT)).toList();
    }

    private static String argument(ApplicationArguments args, int position, String what) {
        List<String> positional = positional(args);
        if (positional.size() <= position) {
            throw new UsageException("Missing " + what + " for '" + positional.get(0) + "'");
        }
        return positional.get(position);
    }

    private static String option(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        if (values == null || values.isEmpty()) {
            if (name.equals("output")) {
                return args.getNonOptionArgs().stream()
                        .filter(arg -> arg.startsWith(SHORT_OUTPUT))
                        .map(arg -> arg.substring(SHORT_OUTPUT.length()))
                        .reduce((first, second) -> second)
                        .orElse(null);
            }
            return null;
        }
        return values.get(values.size() - 1);
    }

    private static Integer intOption(ApplicationArguments args, String name, Integer fallback) {
        String value = option(args, name);
        if (value == null) {
            return fallback;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new UsageException("--" + name + " must be a number, got '" + value + "'");
        }
    }
}
