package chess.curator.compare;

/**
 * Diff of one game pair, with the 1-based game indices and display names of both sides.
 */
public record ComparisonResult(int game1Index, int game2Index, String game1Name, String game2Name, TreeDiff diff) {

    public boolean hasDifferences() {
        return diff.hasDifferences();
    }
}
