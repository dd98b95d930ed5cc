package chess.curator.tree;

import chess.curator.game.MoveTree;
import chess.curator.game.VariationPath;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Enumerates the variations of a tree: every path from the root to a leaf.
 *
 * <p>Order is depth-first pre-order with children visited in stored order, so the mainline comes
 * first and the result is reproducible for the same tree. A tree holding only the root has no
 * variations.
 */
public final class VariationExtractor {

    private VariationExtractor() {
    }

    /**
     * Leaf node indices in enumeration order.
     */
    public static List<Integer> leaves(MoveTree tree) {
        List<Integer> leaves = new ArrayList<>();
        if (tree.isEmpty()) {
            return leaves;
        }
        Deque<Integer> stack = new ArrayDeque<>();
        stack.push(MoveTree.ROOT);
        while (!stack.isEmpty()) {
            int node = stack.pop();
            List<Integer> children = tree.children(node);
            if (children.isEmpty()) {
                leaves.add(node);
                continue;
            }
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(children.get(i));
            }
        }
        return leaves;
    }

    public static List<VariationPath> extract(MoveTree tree) {
        List<VariationPath> variations = new ArrayList<>();
        for (int leaf : leaves(tree)) {
            variations.add(new VariationPath(tree.pathTo(leaf)));
        }
        return variations;
    }

    /**
     * Canonical strings of every variation, in enumeration order.
     */
    public static Set<String> extractSequences(MoveTree tree) {
        Set<String> sequences = new LinkedHashSet<>();
        for (VariationPath path : extract(tree)) {
            sequences.add(path.canonical());
        }
        return sequences;
    }

    public static int countVariations(MoveTree tree) {
        return leaves(tree).size();
    }

    /**
     * Mean ply depth of all variations, 0 when there are none.
     */
    public static double averageDepth(MoveTree tree) {
        List<Integer> leaves = leaves(tree);
        if (leaves.isEmpty()) {
            return 0.0;
        }
        long total = 0;
        for (int leaf : leaves) {
            total += tree.depth(leaf);
        }
        return (double) total / leaves.size();
    }

    public static int maxDepth(MoveTree tree) {
        int max = 0;
        for (int leaf : leaves(tree)) {
            max = Math.max(max, tree.depth(leaf));
        }
        return max;
    }
}
