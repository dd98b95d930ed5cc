package chess.curator.tree;

import chess.curator.game.MoveTree;
import java.util.List;

/**
 * Outcome of a filter transform: the new tree plus every instruction that did not resolve.
 */
public record FilterResult(MoveTree tree, List<UnresolvedEntry> unmatched) {

    public FilterResult {
        unmatched = List.copyOf(unmatched);
    }

    public boolean fullyMatched() {
        return unmatched.isEmpty();
    }
}
