package chess.curator.report;

import chess.curator.build.BuildStats;
import chess.curator.build.ColorBuildStats;
import chess.curator.build.GameStats;
import chess.curator.compare.ComparisonResult;
import chess.curator.plan.ColorConfig;
import chess.curator.plan.CurationConfig;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Console renderings of inspection, build, validation and comparison results.
 */
public class ReportPrinter {
    private final PrintStream out;

    public ReportPrinter(PrintStream out) {
        this.out = out;
    }

    public void printInspection(Path file, List<GameSummary> games) {
        out.println("File: " + file);
        if (games.isEmpty()) {
            out.println("No games found in PGN file");
            return;
        }
        TableFormatter table = new TableFormatter("#Game", "Name", "ECO", "#Variations", "#Avg depth", "#Max depth");
        int totalVariations = 0;
        double totalDepth = 0.0;
        int maxDepth = 0;
        for (GameSummary game : games) {
            table.row(game.index(), game.name(), game.eco(), game.variationCount(),
                    decimal(game.averageDepth()), game.maxDepth());
            totalVariations += game.variationCount();
            totalDepth += game.averageDepth();
            maxDepth = Math.max(maxDepth, game.maxDepth());
        }
        out.print(table.format());
        out.println("Total: " + games.size() + " game(s), " + totalVariations + " variations");
        out.println("Average: " + Math.round((double) totalVariations / games.size()) + " variations per game, "
                + decimal(totalDepth / games.size()) + " plies depth");
        out.println("Max depth: " + maxDepth + " plies");
    }

    public void printGame(GameSummary game) {
        out.println("Game [" + game.index() + "]: " + game.name());
        out.println("ECO: " + game.eco());
        out.println("Headers:");
        for (Map.Entry<String, String> header : game.headers().entrySet()) {
            out.println("  " + header.getKey() + ": " + header.getValue());
        }
        out.println("Variations: " + game.variationCount());
        out.println("Average depth: " + decimal(game.averageDepth()) + " plies");
        out.println("Max depth: " + game.maxDepth() + " plies");
        if (!game.openingMoves().isEmpty()) {
            out.println("Opening moves: " + game.openingMoves());
        }
        if (!game.variations().isEmpty()) {
            out.println("All variations:");
            for (int i = 0; i < game.variations().size(); i++) {
                out.println("  " + (i + 1) + ". " + game.variations().get(i));
            }
        }
    }

    public void printConfigSummary(CurationConfig config) {
        out.println("Config is valid: " + config.getName());
        out.println("  Source: " + config.getSource());
        out.println("  Output: " + config.getOutput());
        for (ColorConfig color : config.getConfigs()) {
            StringBuilder line = new StringBuilder("  ").append(color.getColor().key()).append(": ");
            line.append(color.getGames().size()).append(" game entr").append(color.getGames().size() == 1 ? "y" : "ies");
            if (color.getSkip() != null) {
                line.append(", skip ").append(color.getSkip());
            }
            if (color.getInclude() != null) {
                line.append(", include ").append(color.getInclude());
            }
            if (!color.getPlanComments().isEmpty()) {
                line.append(", ").append(color.getPlanComments().size()).append(" plan comment(s)");
            }
            out.println(line);
        }
    }

    public void printBuildStats(BuildStats stats) {
        out.println("Input: " + stats.getInputGames() + " game(s), " + stats.getInputVariations() + " variations, avg depth "
                + decimal(stats.getInputAvgDepth()) + ", " + bytes(stats.getInputSize()));
        for (ColorBuildStats color : stats.getColors().values()) {
            out.println();
            out.println(color.getColor().key().toUpperCase(Locale.ROOT) + " repertoire");
            TableFormatter table = new TableFormatter("#Game", "Name", "#Before", "#After");
            for (GameStats game : color.getGameStats()) {
                table.row(game.index(), game.name(), game.variationsBefore(), game.variationsAfter());
            }
            out.print(table.format());
            out.println("  Output: " + color.getOutputGames() + " game(s), " + color.getOutputVariations()
                    + " variations, avg depth " + decimal(color.getOutputAvgDepth()) + ", " + bytes(color.getOutputSize()));
            for (String file : color.getOutputFiles()) {
                out.println("  File: " + file);
            }
            for (ColorBuildStats.GameUnmatched unmatched : color.getUnmatched()) {
                out.println("  Unmatched in game [" + unmatched.gameIndex() + "]: " + unmatched.entry().describe());
            }
            for (String variation : color.getUnmatchedPlanComments()) {
                out.println("  Unmatched plan comment: " + variation);
            }
            for (String failure : color.getFailedGames()) {
                out.println("  Failed: " + failure);
            }
        }
        out.println();
        out.println("Total output: " + stats.getTotalOutputGames() + " game(s), " + stats.getTotalOutputVariations()
                + " variations, " + bytes(stats.getTotalOutputSize()));
    }

    public void printComparison(List<ComparisonResult> results) {
        if (results.isEmpty()) {
            out.println("No differences found");
            return;
        }
        TableFormatter table = new TableFormatter("#Game", "Name", "#Variations", "#Target", "#Remove", "#Add");
        for (ComparisonResult result : results) {
            table.row(result.game1Index() == result.game2Index()
                            ? String.valueOf(result.game1Index())
                            : result.game1Index() + "/" + result.game2Index(),
                    result.game1Name(),
                    result.diff().stats().baselineVariations(),
                    result.diff().stats().targetVariations(),
                    result.diff().remove().size(),
                    result.diff().add().size());
        }
        out.print(table.format());
        for (ComparisonResult result : results) {
            if (!result.hasDifferences()) {
                continue;
            }
            out.println("Game [" + result.game1Index() + "] " + result.game1Name());
            for (String prefix : result.diff().remove()) {
                out.println("  - " + prefix);
            }
            for (String prefix : result.diff().add()) {
                out.println("  + " + prefix);
            }
        }
    }

    private static String decimal(double value) {
        return String.format(Locale.ROOT, "%.1f", value);
    }

    static String bytes(long size) {
        if (size < 1024) {
            return size + " B";
        }
        if (size < 1024 * 1024) {
            return String.format(Locale.ROOT, "%.1f KB", size / 1024.0);
        }
        return String.format(Locale.ROOT, "%.1f MB", size / (1024.0 * 1024.0));
    }
}
