package chess.curator.tree;

import chess.curator.game.MoveSequence;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Prefix tree over move sequences, used to find covering prefixes.
 *
 * <p>Nodes live in an arena and are only ever appended, so a child always has a larger index than
 * its parent. Children keep insertion order.
 */
final class PrefixTrie {

    static final int ROOT = 0;

    private final List<TrieNode> nodes = new ArrayList<>();

    PrefixTrie() {
        nodes.add(new TrieNode(null, -1));
    }

    /**
     * Inserts a path taken from the reference tree. Every node on it is marked as present in the
     * reference, the last one as a reference leaf.
     */
    int insertReference(List<String> moves) {
        int node = ROOT;
        for (String move : moves) {
            node = childOrCreate(node, move);
            nodes.get(node).inReference = true;
        }
        nodes.get(node).referenceLeaf = true;
        return node;
    }

    /**
     * Inserts a target path and marks its last node.
     */
    int insertTarget(List<String> moves) {
        int node = ROOT;
        for (String move : moves) {
            node = childOrCreate(node, move);
        }
        nodes.get(node).target = true;
        return node;
    }

    int size() {
        return nodes.size();
    }

    List<Integer> children(int node) {
        return Collections.unmodifiableList(nodes.get(node).children);
    }

    boolean isLeaf(int node) {
        return nodes.get(node).children.isEmpty();
    }

    boolean inReference(int node) {
        return nodes.get(node).inReference;
    }

    boolean isReferenceLeaf(int node) {
        return nodes.get(node).referenceLeaf;
    }

    boolean isTarget(int node) {
        return nodes.get(node).target;
    }

    /**
     * Canonical move-sequence string of the path ending at {@code node}.
     */
    String prefix(int node) {
        List<String> moves = new ArrayList<>();
        for (int current = node; current != ROOT; current = nodes.get(current).parent) {
            moves.add(nodes.get(current).move);
        }
        Collections.reverse(moves);
        return MoveSequence.format(moves);
    }

    private int childOrCreate(int parent, String move) {
        TrieNode p = nodes.get(parent);
        Integer existing = p.byMove.get(MoveSequence.matchKey(move));
        if (existing != null) {
            return existing;
        }
        int index = nodes.size();
        nodes.add(new TrieNode(move, parent));
        p.byMove.put(MoveSequence.matchKey(move), index);
        p.children.add(index);
        return index;
    }

    private static final class TrieNode {
        final String move;
        final int parent;
        final List<Integer> children = new ArrayList<>();
        final Map<String, Integer> byMove = new LinkedHashMap<>();
        boolean inReference;
        boolean referenceLeaf;
        boolean target;

        TrieNode(String move, int parent) {
            this.move = move;
            this.parent = parent;
        }
    }
}
