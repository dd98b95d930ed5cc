package chess.curator.tree;

import chess.curator.game.MoveSequence;
import chess.curator.game.MoveTree;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tree transforms behind variation curation.
 *
 * <p>The resulting variation set of {@link #filter} is
 * {@code (variations not under any remove prefix) ∪ (variations reachable by replaying every add entry)}.
 * Removal and addition are independent transforms applied in that order, followed by an optional
 * depth trim. Every transform returns a new tree and leaves its input untouched.
 *
 * <p><b>Removal</b> replays a sequence from the root and detaches the node it reaches together with
 * its subtree. A sequence that leaves the tree part-way is not an error: it is reported as an
 * {@link UnresolvedEntry} and the tree is left as it was.
 *
 * <p><b>Addition</b> replays a sequence from the root, descending into existing children and
 * appending new nodes after the existing siblings where a move is missing. Existing nodes keep their
 * comments and NAGs; created nodes start without any.
 */
public final class VariationFilter {

    private static final Logger log = LoggerFactory.getLogger(VariationFilter.class);

    private VariationFilter() {
    }

    /**
     * Removes, then adds, then trims to {@code maxDepth} plies when it is not null.
     */
    public static FilterResult filter(
            MoveTree tree,
            List<VariationInstruction> remove,
            List<VariationInstruction> add,
            Integer maxDepth) {
        FilterResult removed = remove(tree, remove);
        FilterResult added = add(removed.tree(), add);

        List<UnresolvedEntry> unmatched = new ArrayList<>(removed.unmatched());
        unmatched.addAll(added.unmatched());

        MoveTree result = maxDepth == null ? added.tree() : trim(added.tree(), maxDepth);
        if (log.isDebugEnabled()) {
            log.debug("Filtered tree: {} -> {} node(s), {} remove / {} add instruction(s), {} unmatched",
                    tree.size(), result.size(), remove.size(), add.size(), unmatched.size());
        }
        return new FilterResult(result, unmatched);
    }

    /**
     * Detaches the node each instruction resolves to. An instruction with a depth no greater than
     * its length only cuts the plies below that depth.
     */
    public static FilterResult remove(MoveTree tree, List<VariationInstruction> instructions) {
        if (instructions.isEmpty()) {
            return new FilterResult(tree, List.of());
        }
        MoveTree.Builder builder = tree.toBuilder();
        List<UnresolvedEntry> unmatched = new ArrayList<>();

        for (VariationInstruction instruction : instructions) {
            List<String> moves = tokens(instruction, UnresolvedEntry.Operation.REMOVE, unmatched);
            if (moves == null) {
                continue;
            }
            int node = MoveTree.ROOT;
            int resolved = 0;
            for (String move : moves) {
                int child = builder.childWithMove(node, move);
                if (child == MoveTree.NONE) {
                    break;
                }
                node = child;
                resolved++;
            }
            if (resolved < moves.size()) {
                unmatched.add(new UnresolvedEntry(
                        UnresolvedEntry.Operation.REMOVE, instruction, UnmatchedReason.NOT_IN_TREE, resolved));
                continue;
            }
            Integer depth = instruction.depth();
            if (depth == null || moves.size() > depth) {
                builder.detach(node);
            } else {
                cutBelow(builder, node, depth);
            }
        }
        return new FilterResult(builder.build(), unmatched);
    }

    /**
     * Replays each instruction, creating the missing part of its path. An instruction with a depth
     * stops after that many plies.
     */
    public static FilterResult add(MoveTree tree, List<VariationInstruction> instructions) {
        if (instructions.isEmpty()) {
            return new FilterResult(tree, List.of());
        }
        MoveTree.Builder builder = tree.toBuilder();
        List<UnresolvedEntry> unmatched = new ArrayList<>();

        for (VariationInstruction instruction : instructions) {
            List<String> moves = tokens(instruction, UnresolvedEntry.Operation.ADD, unmatched);
            if (moves == null) {
                continue;
            }
            int plies = instruction.depth() == null ? moves.size() : Math.min(moves.size(), instruction.depth());
            int node = MoveTree.ROOT;
            for (String move : moves.subList(0, plies)) {
                int child = builder.childWithMove(node, move);
                node = child == MoveTree.NONE ? builder.addChild(node, move) : child;
            }
        }
        return new FilterResult(builder.build(), unmatched);
    }

    /**
     * Drops every node deeper than {@code maxDepth} plies. Nodes at or above the boundary keep their
     * comments and NAGs.
     */
    public static MoveTree trim(MoveTree tree, int maxDepth) {
        if (maxDepth < 0) {
            throw new IllegalArgumentException("maxDepth must not be negative: " + maxDepth);
        }
        MoveTree.Builder builder = tree.toBuilder();
        boolean changed = false;
        for (int node = 0; node < tree.size(); node++) {
            if (tree.depth(node) == maxDepth) {
                for (int child : tree.children(node)) {
                    builder.detach(child);
                    changed = true;
                }
            }
        }
        return changed ? builder.build() : tree;
    }

    /**
     * Drops every variation shorter than {@code minDepth} plies, along with the part of its path
     * that no longer leads to a kept variation.
     */
    public static MoveTree pruneShorterThan(MoveTree tree, int minDepth) {
        if (minDepth <= 0) {
            return tree;
        }
        // Built trees number nodes in pre-order, so every child has a larger index than its parent.
        boolean[] keep = new boolean[tree.size()];
        for (int node = tree.size() - 1; node > MoveTree.ROOT; node--) {
            if (tree.isLeaf(node)) {
                keep[node] = tree.depth(node) >= minDepth;
            } else {
                for (int child : tree.children(node)) {
                    keep[node] |= keep[child];
                }
            }
        }
        keep[MoveTree.ROOT] = true;

        MoveTree.Builder builder = tree.toBuilder();
        boolean changed = false;
        for (int node = 1; node < tree.size(); node++) {
            if (!keep[node] && keep[tree.parent(node)]) {
                builder.detach(node);
                changed = true;
            }
        }
        return changed ? builder.build() : tree;
    }

    /**
     * Copy of the tree with every comment and NAG removed.
     */
    public static MoveTree stripAnnotations(MoveTree tree) {
        MoveTree.Builder builder = tree.toBuilder();
        for (int node = 0; node < tree.size(); node++) {
            builder.clearAnnotations(node);
        }
        return builder.build();
    }

    /**
     * Detaches every descendant of {@code node} deeper than {@code depth} plies.
     */
    private static void cutBelow(MoveTree.Builder builder, int node, int depth) {
        Deque<Integer> stack = new ArrayDeque<>();
        stack.push(node);
        while (!stack.isEmpty()) {
            int current = stack.pop();
            List<Integer> children = builder.children(current);
            if (builder.depth(current) >= depth) {
                for (int child : children) {
                    builder.detach(child);
                }
            } else {
                children.forEach(stack::push);
            }
        }
    }

    private static List<String> tokens(
            VariationInstruction instruction,
            UnresolvedEntry.Operation operation,
            List<UnresolvedEntry> unmatched) {
        try {
            return MoveSequence.parse(instruction.sequence());
        } catch (IllegalArgumentException e) {
            unmatched.add(new UnresolvedEntry(operation, instruction, UnmatchedReason.INVALID_SEQUENCE, 0));
            return null;
        }
    }
}
