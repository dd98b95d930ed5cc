package chess.curator.compare;

import java.util.List;

/**
 * Remove and add prefixes that turn one tree into another, applied remove first.
 */
public record TreeDiff(List<String> remove, List<String> add, DiffStats stats) {

    public TreeDiff {
        remove = List.copyOf(remove);
        add = List.copyOf(add);
    }

    public boolean hasDifferences() {
        return !remove.isEmpty() || !add.isEmpty();
    }
}
