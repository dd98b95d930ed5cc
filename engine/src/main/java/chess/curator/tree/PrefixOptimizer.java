package chess.curator.tree;

import chess.curator.game.MoveTree;
import chess.curator.game.VariationPath;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Compresses a set of target variations into the smallest set of prefixes that reproduces it
 * exactly against a reference tree.
 *
 * <p><b>How it works:</b>
 * <ol>
 *   <li>Build a trie over every variation of the reference tree, then insert the targets.</li>
 *   <li>Bottom-up, mark a node <em>covered</em> when every reference variation below it is a target:
 *       a leaf is covered iff it is a target reference leaf, an inner node iff it exists in the
 *       reference tree and all its children are covered.</li>
 *   <li>Walk the trie top-down and emit the first covered node on each path without descending
 *       further. Targets absent from the reference tree are emitted as full lines, since adding a
 *       prefix only ever creates that prefix.</li>
 *   <li>Re-expand the result against the reference and require it to equal the target set.</li>
 * </ol>
 *
 * <p>No emitted prefix is an ancestor of another. Output order follows the trie's insertion order,
 * which is the reference tree's enumeration order followed by the order of the targets.
 */
public final class PrefixOptimizer {

    private static final Logger log = LoggerFactory.getLogger(PrefixOptimizer.class);

    private PrefixOptimizer() {
    }

    /**
     * Computes the minimal covering prefix set of {@code targets} against {@code reference}.
     *
     * @param targets canonical or loosely formatted move sequences, each a complete variation
     * @throws IllegalArgumentException if a target is malformed or is a strict prefix of another
     *         variation, which makes it impossible to reproduce as a variation
     * @throws CoverageInvariantViolation if the computed prefixes do not expand back to the targets
     */
    public static List<String> optimize(Collection<String> targets, MoveTree reference) {
        if (targets.isEmpty()) {
            return List.of();
        }
        PrefixTrie trie = new PrefixTrie();
        for (VariationPath variation : VariationExtractor.extract(reference)) {
            trie.insertReference(variation.moves());
        }

        Set<String> targetSet = new LinkedHashSet<>();
        List<Integer> targetNodes = new ArrayList<>();
        for (String target : targets) {
            int node = trie.insertTarget(VariationPath.parse(target).moves());
            targetSet.add(trie.prefix(node));
            targetNodes.add(node);
        }
        for (int node : targetNodes) {
            if (!trie.isLeaf(node)) {
                throw new IllegalArgumentException(
                        "Target '" + trie.prefix(node) + "' is not a variation: other lines continue from it");
            }
        }

        boolean[] covered = coverage(trie);
        List<String> prefixes = emit(trie, covered);

        Set<String> expanded = expand(prefixes, reference);
        if (!expanded.equals(targetSet)) {
            throw new CoverageInvariantViolation("Prefix optimisation", targetSet, expanded);
        }
        if (log.isDebugEnabled()) {
            log.debug("Optimised {} target variation(s) into {} prefix(es)", targetSet.size(), prefixes.size());
        }
        return prefixes;
    }

    /**
     * Every variation obtained by replaying {@code prefixes} on {@code reference} that starts with
     * one of them, in enumeration order.
     */
    public static Set<String> expand(Collection<String> prefixes, MoveTree reference) {
        List<VariationInstruction> instructions = VariationInstruction.allOf(prefixes);
        FilterResult replayed = VariationFilter.add(reference, instructions);
        if (!replayed.fullyMatched()) {
            throw new IllegalArgumentException(
                    "Invalid prefix: " + replayed.unmatched().get(0).instruction().sequence());
        }
        MoveTree tree = replayed.tree();

        Set<Integer> leaves = new LinkedHashSet<>();
        for (String prefix : prefixes) {
            int start = tree.find(VariationPath.parse(prefix).moves());
            Deque<Integer> stack = new ArrayDeque<>();
            stack.push(start);
            while (!stack.isEmpty()) {
                int node = stack.pop();
                List<Integer> children = tree.children(node);
                if (children.isEmpty()) {
                    leaves.add(node);
                }
                for (int i = children.size() - 1; i >= 0; i--) {
                    stack.push(children.get(i));
                }
            }
        }

        Set<String> variations = new LinkedHashSet<>();
        for (int leaf : leaves) {
            variations.add(new VariationPath(tree.pathTo(leaf)).canonical());
        }
        return variations;
    }

    /**
     * Bottom-up coverage flags. Children always have larger indices than their parents, so a
     * reverse index sweep visits every node after all of its descendants.
     */
    private static boolean[] coverage(PrefixTrie trie) {
        boolean[] covered = new boolean[trie.size()];
        for (int node = trie.size() - 1; node > PrefixTrie.ROOT; node--) {
            if (trie.isLeaf(node)) {
                covered[node] = trie.isTarget(node) && trie.isReferenceLeaf(node);
                continue;
            }
            boolean all = trie.inReference(node);
            for (int child : trie.children(node)) {
                if (!all) {
                    break;
                }
                all = covered[child];
            }
            covered[node] = all;
        }
        return covered;
    }

    private static List<String> emit(PrefixTrie trie, boolean[] covered) {
        List<String> prefixes = new ArrayList<>();
        Deque<Integer> stack = new ArrayDeque<>();
        pushChildren(trie, PrefixTrie.ROOT, stack);
        while (!stack.isEmpty()) {
            int node = stack.pop();
            if (covered[node] || (trie.isLeaf(node) && trie.isTarget(node))) {
                prefixes.add(trie.prefix(node));
            } else {
                pushChildren(trie, node, stack);
            }
        }
        return prefixes;
    }

    private static void pushChildren(PrefixTrie trie, int node, Deque<Integer> stack) {
        List<Integer> children = trie.children(node);
        for (int i = children.size() - 1; i >= 0; i--) {
            stack.push(children.get(i));
        }
    }
}
