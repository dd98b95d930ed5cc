package chess.curator.build;

import chess.curator.config.CuratorProperties;
import chess.curator.game.MoveTree;
import chess.curator.game.PgnGame;
import chess.curator.pgn.PgnReader;
import chess.curator.pgn.PgnWriter;
import chess.curator.plan.ColorConfig;
import chess.curator.plan.ConflictingInstructionException;
import chess.curator.plan.CurationConfig;
import chess.curator.plan.GameAction;
import chess.curator.plan.GameConfig;
import chess.curator.plan.Settings;
import chess.curator.tree.FilterResult;
import chess.curator.tree.UnresolvedEntry;
import chess.curator.tree.UnresolvedFilterEntryException;
import chess.curator.tree.VariationExtractor;
import chess.curator.tree.VariationFilter;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Turns a source PGN and a curation config into one curated PGN per color.
 *
 * <p>Games are processed in config order. An included game goes through removal and addition,
 * depth trimming, short-variation pruning, comment stripping, header reduction and plan comments,
 * in that order. A game whose instructions conflict, or that fails strict filtering, is left out
 * and reported; the rest of the build carries on.
 */
@Component
public class CurationBuilder {

    private static final Logger log = LoggerFactory.getLogger(CurationBuilder.class);

    private final PgnReader reader;
    private final PgnWriter writer;
    private final CuratorProperties properties;

    public CurationBuilder(PgnReader reader, PgnWriter writer, CuratorProperties properties) {
        this.reader = reader;
        this.writer = writer;
        this.properties = properties;
    }

    public BuildStats build(CurationConfig config, BuildOptions options) throws IOException {
        Path source = Path.of(config.getSource());
        List<PgnGame> games = reader.readFile(source);

        BuildStats stats = new BuildStats();
        stats.setInputGames(games.size());
        stats.setInputSize(Files.size(source));
        stats.setInputVariations(games.stream().mapToInt(g -> VariationExtractor.countVariations(g.tree())).sum());
        stats.setInputAvgDepth(averageDepth(games));
        log.info("Loaded {} game(s) with {} variation(s) from {}", stats.getInputGames(), stats.getInputVariations(), source);

        for (ColorConfig colorConfig : config.getConfigs()) {
            stats.putColor(buildColor(colorConfig, games, config.getOutput(), options));
        }
        return stats;
    }

    private ColorBuildStats buildColor(ColorConfig colorConfig, List<PgnGame> games, String output, BuildOptions options)
            throws IOException {
        ColorBuildStats stats = new ColorBuildStats(colorConfig.getColor());
        Settings settings = colorConfig.getSettings();
        int colorDepth = colorConfig.getColor().maxDepth(options.depth());
        log.info("Processing {} repertoire (max depth {} plies)", colorConfig.getColor().key(), colorDepth);

        Map<Integer, PgnGame> written = new LinkedHashMap<>();
        Map<Integer, Boolean> planCommentResolved = new LinkedHashMap<>();
        for (int i = 0; i < colorConfig.getPlanComments().size(); i++) {
            planCommentResolved.put(i, false);
        }

        for (GameConfig gameConfig : colorConfig.resolveGames(games.size())) {
            int index = gameConfig.getIndex();
            if (index > games.size()) {
                log.warn("Game index {} out of range (only {} games), skipping", index, games.size());
                continue;
            }
            PgnGame source = games.get(index - 1);
            String name = gameConfig.getName() != null
                    ? gameConfig.getName()
                    : source.displayName(colorConfig.getColor().header(), index);
            int before = VariationExtractor.countVariations(source.tree());

            if (gameConfig.getAction() == GameAction.SKIP) {
                log.debug("Game [{}] {}: skipped", index, name);
                continue;
            }
            if (gameConfig.getAction() == GameAction.SKIP_KEEP_HEADERS) {
                written.put(index, withHeaderPolicy(source.withTree(MoveTree.empty()), settings));
                stats.addGameStats(new GameStats(index, name, before, 0));
                log.debug("Game [{}] {}: headers kept, variations removed", index, name);
                continue;
            }

            PgnGame curated;
            try {
                curated = curate(source, gameConfig, colorConfig, colorDepth, options, stats, planCommentResolved);
            } catch (ConflictingInstructionException | UnresolvedFilterEntryException e) {
                log.error("Game [{}] {}: {}", index, name, e.getMessage());
                stats.addFailedGame("Game [" + index + "] " + name + ": " + e.getMessage());
                continue;
            }

            int after = VariationExtractor.countVariations(curated.tree());
            if (settings.isRemoveEmptyGames() && after == 0) {
                log.info("Game [{}] {}: removed, no variations left after filtering", index, name);
                continue;
            }
            written.put(index, curated);
            stats.addGameStats(new GameStats(index, name, before, after));
            log.info("Game [{}] {}: {} -> {} variation(s)", index, name, before, after);
        }

        for (Map.Entry<Integer, Boolean> resolved : planCommentResolved.entrySet()) {
            if (!resolved.getValue()) {
                String variation = colorConfig.getPlanComments().get(resolved.getKey()).getVariation();
                log.warn("Plan comment for '{}' matched no game", variation);
                stats.addUnmatchedPlanComment(variation);
            }
        }

        List<PgnGame> outputGames = new ArrayList<>(written.values());
        stats.setOutputGames(outputGames.size());
        stats.setOutputVariations(outputGames.stream().mapToInt(g -> VariationExtractor.countVariations(g.tree())).sum());
        stats.setOutputAvgDepth(averageDepth(outputGames));

        String prefix = output + "_" + colorConfig.getColor().key() + "_" + options.depth();
        if (options.split()) {
            for (Map.Entry<Integer, PgnGame> entry : written.entrySet()) {
                write(List.of(entry.getValue()), prefix + "_" + entry.getKey() + ".pgn", settings, options, stats);
            }
        } else {
            write(outputGames, prefix + ".pgn", settings, options, stats);
        }
        return stats;
    }

    private PgnGame curate(
            PgnGame source,
            GameConfig gameConfig,
            ColorConfig colorConfig,
            int colorDepth,
            BuildOptions options,
            ColorBuildStats stats,
            Map<Integer, Boolean> planCommentResolved) {
        Settings settings = colorConfig.getSettings();
        int maxDepth = gameConfig.getMaxDepth() != null ? gameConfig.getMaxDepth() : colorDepth;
        FilterResult filtered = VariationFilter.filter(
                source.tree(), gameConfig.removeInstructions(), gameConfig.addInstructions(), maxDepth);
        if (!filtered.fullyMatched()) {
            if (options.strictFilters()) {
                throw new UnresolvedFilterEntryException(filtered.unmatched());
            }
            for (UnresolvedEntry entry : filtered.unmatched()) {
                log.warn("Game [{}]: unresolved {}", gameConfig.getIndex(), entry.describe());
            }
            stats.addUnmatched(gameConfig.getIndex(), filtered.unmatched());
        }

        int minDepth = gameConfig.getMinDepth() != null ? gameConfig.getMinDepth() : settings.getMinDepth();
        MoveTree tree = VariationFilter.pruneShorterThan(filtered.tree(), minDepth);
        if (!settings.isPreserveComments()) {
            tree = VariationFilter.stripAnnotations(tree);
        }

        for (int i = 0; i < colorConfig.getPlanComments().size(); i++) {
            FilterResult commented = PlanCommentApplier.apply(tree, List.of(colorConfig.getPlanComments().get(i)));
            if (commented.fullyMatched()) {
                planCommentResolved.put(i, true);
                tree = commented.tree();
            } else if (log.isDebugEnabled()) {
                log.debug("Game [{}]: plan comment not applied, {}", gameConfig.getIndex(), commented.unmatched().get(0).describe());
            }
        }
        return withHeaderPolicy(source.withTree(tree), settings);
    }

    private static PgnGame withHeaderPolicy(PgnGame game, Settings settings) {
        if (settings.isPreserveHeaders()) {
            return game;
        }
        Map<String, String> roster = new LinkedHashMap<>();
        for (String key : PgnGame.SEVEN_TAG_ROSTER) {
            String value = game.header(key);
            if (value != null) {
                roster.put(key, value);
            }
        }
        return game.withHeaders(roster);
    }

    private void write(List<PgnGame> games, String file, Settings settings, BuildOptions options, ColorBuildStats stats)
            throws IOException {
        stats.addOutputFile(file);
        if (options.dryRun()) {
            log.info("[DRY RUN] Would write {} game(s) to {}", games.size(), file);
            return;
        }
        List<PgnGame> toWrite = new ArrayList<>(games);
        if (settings.isAddCurationComment() && !toWrite.isEmpty() && toWrite.get(0).header("Curator") == null) {
            toWrite.set(0, toWrite.get(0).withHeader("Curator", properties.getCuratorTag()));
        }
        Path path = Path.of(file);
        writer.writeFile(toWrite, path);
        stats.addOutputSize(Files.size(path));
        log.info("Wrote {} game(s) to {}", toWrite.size(), file);
    }

    private static double averageDepth(List<PgnGame> games) {
        if (games.isEmpty()) {
            return 0.0;
        }
        double total = 0.0;
        for (PgnGame game : games) {
            total += VariationExtractor.averageDepth(game.tree());
        }
        return total / games.size();
    }
}
