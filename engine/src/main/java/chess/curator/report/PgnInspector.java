package chess.curator.report;

import chess.curator.game.MoveSequence;
import chess.curator.game.MoveTree;
import chess.curator.game.PgnGame;
import chess.curator.pgn.PgnReader;
import chess.curator.tree.VariationExtractor;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Summarises the games of a PGN file.
 */
@Component
public class PgnInspector {

    static final int OPENING_PLIES = 10;

    private final PgnReader reader;

    public PgnInspector(PgnReader reader) {
        this.reader = reader;
    }

    /**
     * One summary per game, without variation lists.
     */
    public List<GameSummary> inspect(Path pgn) throws IOException {
        List<PgnGame> games = reader.readFile(pgn);
        List<GameSummary> summaries = new ArrayList<>(games.size());
        for (int i = 0; i < games.size(); i++) {
            summaries.add(summarise(games.get(i), i + 1, false));
        }
        return summaries;
    }

    /**
     * Summary of a single game.
     *
     * @param index 1-based game index
     * @param listVariations whether to include every variation string
     * @throws IllegalArgumentException if the index is out of range
     */
    public GameSummary inspectGame(Path pgn, int index, boolean listVariations) throws IOException {
        List<PgnGame> games = reader.readFile(pgn);
        if (index < 1 || index > games.size()) {
            throw new IllegalArgumentException("Game index " + index + " out of range (file has "
                    + games.size() + " games, indices 1-" + games.size() + ")");
        }
        return summarise(games.get(index - 1), index, listVariations);
    }

    static GameSummary summarise(PgnGame game, int index, boolean listVariations) {
        MoveTree tree = game.tree();
        List<String> variations = listVariations
                ? new ArrayList<>(VariationExtractor.extractSequences(tree))
                : List.of();
        return new GameSummary(
                index,
                name(game, index),
                game.headers(),
                VariationExtractor.countVariations(tree),
                VariationExtractor.averageDepth(tree),
                VariationExtractor.maxDepth(tree),
                openingMoves(tree),
                variations);
    }

    /**
     * White tag, then Event tag, then {@code Game <index>}.
     */
    static String name(PgnGame game, int index) {
        String white = game.displayName("White", index);
        return white.equals("Game " + index) ? game.displayName("Event", index) : white;
    }

    private static String openingMoves(MoveTree tree) {
        List<String> moves = new ArrayList<>();
        int node = MoveTree.ROOT;
        while (moves.size() < OPENING_PLIES && !tree.isLeaf(node)) {
            node = tree.children(node).get(0);
            moves.add(tree.move(node));
        }
        return MoveSequence.format(moves);
    }
}
