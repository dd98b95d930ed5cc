package chess.curator.compare;

import chess.curator.game.PgnGame;
import chess.curator.pgn.PgnReader;
import chess.curator.plan.RepertoireColor;
import chess.curator.tree.VariationFilter;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Compares games of two PGN files and reports the instructions that turn the first into the second.
 */
@Component
public class PgnComparator {

    private static final Logger log = LoggerFactory.getLogger(PgnComparator.class);

    private final PgnReader reader;

    public PgnComparator(PgnReader reader) {
        this.reader = reader;
    }

    /**
     * Compares two PGN files.
     *
     * <p>With both indices given, only that pair is compared and always reported. Otherwise games
     * are paired by position up to the shorter file and only pairs that differ are reported.
     *
     * @param game1 1-based game index in the baseline file, or null
     * @param game2 1-based game index in the target file, or null
     * @param color when not null, both trees are first trimmed to the color's depth
     * @param depth move pairs used with {@code color}
     * @throws IllegalArgumentException if a requested index is out of range
     */
    public List<ComparisonResult> compareFiles(
            Path baseline,
            Path target,
            Integer game1,
            Integer game2,
            RepertoireColor color,
            int depth) throws IOException {
        List<PgnGame> games1 = reader.readFile(baseline);
        List<PgnGame> games2 = reader.readFile(target);
        Integer maxDepth = color == null ? null : color.maxDepth(depth);
        String nameHeader = color == null ? RepertoireColor.WHITE.header() : color.header();

        List<ComparisonResult> results = new ArrayList<>();
        if (game1 != null && game2 != null) {
            checkIndex(game1, games1, baseline);
            checkIndex(game2, games2, target);
            results.add(compareGames(games1.get(game1 - 1), games2.get(game2 - 1), game1, game2, maxDepth, nameHeader));
            return results;
        }

        int pairs = Math.min(games1.size(), games2.size());
        if (games1.size() != games2.size()) {
            log.warn("Files hold {} and {} game(s); comparing the first {} pair(s)", games1.size(), games2.size(), pairs);
        }
        for (int i = 0; i < pairs; i++) {
            ComparisonResult result = compareGames(games1.get(i), games2.get(i), i + 1, i + 1, maxDepth, nameHeader);
            if (result.hasDifferences()) {
                results.add(result);
            }
        }
        return results;
    }

    /**
     * Compares one game pair, trimming both trees to {@code maxDepth} plies when it is not null.
     */
    public ComparisonResult compareGames(
            PgnGame baseline,
            PgnGame target,
            int game1Index,
            int game2Index,
            Integer maxDepth,
            String nameHeader) {
        var baselineTree = maxDepth == null ? baseline.tree() : VariationFilter.trim(baseline.tree(), maxDepth);
        var targetTree = maxDepth == null ? target.tree() : VariationFilter.trim(target.tree(), maxDepth);
        TreeDiff diff = VariationComparator.diff(baselineTree, targetTree);
        return new ComparisonResult(
                game1Index,
                game2Index,
                baseline.displayName(nameHeader, game1Index),
                target.displayName(nameHeader, game2Index),
                diff);
    }

    private static void checkIndex(int index, List<PgnGame> games, Path file) {
        if (index < 1 || index > games.size()) {
            throw new IllegalArgumentException(
                    "Game index " + index + " out of range in " + file + " (has " + games.size() + " games)");
        }
    }
}
