package chess.curator.game;

import java.util.List;

/**
 * Ordered move tokens from the starting position to some node.
 *
 * <p>Two paths are equal exactly when their canonical strings are equal, which is the case
 * exactly when their token lists are equal.
 */
public record VariationPath(List<String> moves) {

    public VariationPath {
        moves = List.copyOf(moves);
    }

    public static VariationPath parse(String sequence) {
        return new VariationPath(MoveSequence.parse(sequence));
    }

    /**
     * Number of plies in this path.
     */
    public int depth() {
        return moves.size();
    }

    /**
     * True if {@code prefix} is this path or an ancestor of it.
     */
    public boolean startsWith(VariationPath prefix) {
        return prefix.depth() <= depth() && moves.subList(0, prefix.depth()).equals(prefix.moves);
    }

    /**
     * Canonical move-sequence string, e.g. {@code 1.e4 e5 2.Nf3}.
     */
    public String canonical() {
        return MoveSequence.format(moves);
    }

    @Override
    public String toString() {
        return canonical();
    }
}
