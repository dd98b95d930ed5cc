package chess.curator.game;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable move tree of one game, stored as an arena of nodes addressed by index.
 *
 * <p><b>Layout:</b>
 * <ul>
 *   <li>Index {@link #ROOT} is the starting position. It carries no move but may carry a game comment.</li>
 *   <li>Every other node is one ply: a canonical SAN token, an optional comment and a set of NAG codes.</li>
 *   <li>Children are ordered; the first child is the mainline continuation.</li>
 *   <li>The parent link is a plain index used for navigation only.</li>
 * </ul>
 *
 * <p>Trees are never modified in place. Transformations copy the arena into a {@link Builder},
 * edit the copy and {@link Builder#build() build} a fresh tree. Node indices are stable within one
 * tree instance and are assigned in depth-first pre-order when a tree is built.
 */
public final class MoveTree {

    /** Index of the root node in every tree. */
    public static final int ROOT = 0;

    /** Sentinel returned by lookups that do not resolve. */
    public static final int NONE = -1;

    private static final MoveTree EMPTY = new Builder().build();

    private final Node[] nodes;

    private MoveTree(Node[] nodes) {
        this.nodes = nodes;
    }

    /**
     * Returns a tree consisting of the root only.
     */
    public static MoveTree empty() {
        return EMPTY;
    }

    /**
     * Starts a new, empty tree builder.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Number of nodes in the tree, root included.
     */
    public int size() {
        return nodes.length;
    }

    public String move(int node) {
        return node(node).move;
    }

    /**
     * Returns the parent index, or {@link #NONE} for the root.
     */
    public int parent(int node) {
        return node(node).parent;
    }

    public List<Integer> children(int node) {
        return node(node).children;
    }

    public boolean isLeaf(int node) {
        return node(node).children.isEmpty();
    }

    /**
     * Ply depth of a node: 0 for the root, 1 for white's first move, and so on.
     */
    public int depth(int node) {
        return node(node).depth;
    }

    /**
     * Comment attached after the move of this node, or null.
     */
    public String comment(int node) {
        return node(node).comment;
    }

    public Set<Integer> nags(int node) {
        return node(node).nags;
    }

    /**
     * Returns true when the root has no children.
     */
    public boolean isEmpty() {
        return nodes[ROOT].children.isEmpty();
    }

    /**
     * Move tokens from the root down to (and including) the given node.
     */
    public List<String> pathTo(int node) {
        Node n = node(node);
        String[] path = new String[n.depth];
        int current = node;
        while (current != ROOT) {
            Node c = nodes[current];
            path[c.depth - 1] = c.move;
            current = c.parent;
        }
        return List.of(path);
    }

    /**
     * Returns the child of {@code parent} holding {@code move}, or {@link #NONE}. Check and mate
     * markers are ignored.
     */
    public int childWithMove(int parent, String move) {
        for (int child : node(parent).children) {
            if (MoveSequence.sameMove(nodes[child].move, move)) {
                return child;
            }
        }
        return NONE;
    }

    /**
     * Replays a move sequence from the root.
     *
     * @return the node reached by the full sequence, {@link #ROOT} for an empty sequence,
     *         or {@link #NONE} when some step has no matching child
     */
    public int find(List<String> moves) {
        int current = ROOT;
        for (String move : moves) {
            current = childWithMove(current, move);
            if (current == NONE) {
                return NONE;
            }
        }
        return current;
    }

    /**
     * Copies this tree into a builder. Node indices are preserved in the copy.
     */
    public Builder toBuilder() {
        Builder builder = new Builder(nodes.length);
        for (int i = 1; i < nodes.length; i++) {
            Node n = nodes[i];
            builder.append(n.parent, n.move, n.comment, n.nags);
        }
        builder.setComment(ROOT, nodes[ROOT].comment);
        builder.nodes.get(ROOT).nags.addAll(nodes[ROOT].nags);
        return builder;
    }

    private Node node(int index) {
        if (index < 0 || index >= nodes.length) {
            throw new IndexOutOfBoundsException("No node " + index + " in tree of size " + nodes.length);
        }
        return nodes[index];
    }

    private static final class Node {
        final int parent;
        final String move;
        final List<Integer> children;
        final String comment;
        final Set<Integer> nags;
        final int depth;

        Node(int parent, String move, List<Integer> children, String comment, Set<Integer> nags, int depth) {
            this.parent = parent;
            this.move = move;
            this.children = children;
            this.comment = comment;
            this.nags = nags;
            this.depth = depth;
        }
    }

    /**
     * Mutable arena used to assemble or edit a tree.
     *
     * <p>Detached nodes stay in the arena until {@link #build()}, which keeps only the nodes still
     * reachable from the root.
     */
    public static final class Builder {

        private final List<MutableNode> nodes;

        private Builder() {
            this(16);
        }

        private Builder(int capacity) {
            this.nodes = new ArrayList<>(capacity);
            this.nodes.add(new MutableNode(NONE, null, 0));
        }

        /**
         * Appends a new node holding {@code move} as the last child of {@code parent}.
         *
         * @return the index of the new node
         */
        public int addChild(int parent, String move) {
            return append(parent, move, null, Set.of());
        }

        /**
         * Returns the attached child of {@code parent} holding {@code move}, or {@link #NONE}.
         */
        public int childWithMove(int parent, String move) {
            for (int child : live(parent).children) {
                if (MoveSequence.sameMove(nodes.get(child).move, move)) {
                    return child;
                }
            }
            return NONE;
        }

        /**
         * Detaches a node, and with it its whole subtree, from its parent.
         */
        public void detach(int node) {
            if (node == ROOT) {
                throw new IllegalArgumentException("The root cannot be detached");
            }
            MutableNode n = live(node);
            nodes.get(n.parent).children.remove(Integer.valueOf(node));
            n.detached = true;
        }

        public List<Integer> children(int node) {
            return List.copyOf(live(node).children);
        }

        public String move(int node) {
            return live(node).move;
        }

        public int parent(int node) {
            return live(node).parent;
        }

        public int depth(int node) {
            return live(node).depth;
        }

        public String comment(int node) {
            return live(node).comment;
        }

        public Builder setComment(int node, String comment) {
            live(node).comment = comment == null || comment.isBlank() ? null : comment;
            return this;
        }

        public Builder addNag(int node, int nag) {
            if (nag < 0 || nag > 255) {
                throw new IllegalArgumentException("NAG out of range: " + nag);
            }
            live(node).nags.add(nag);
            return this;
        }

        /**
         * Removes the comment and all NAGs from a node.
         */
        public Builder clearAnnotations(int node) {
            MutableNode n = live(node);
            n.comment = null;
            n.nags.clear();
            return this;
        }

        /**
         * Number of arena slots, detached ones included.
         */
        public int capacity() {
            return nodes.size();
        }

        /**
         * Freezes the reachable part of the arena into an immutable tree.
         *
         * <p>Nodes are renumbered in depth-first pre-order, children kept in their stored order.
         */
        public MoveTree build() {
            List<Integer> order = new ArrayList<>();
            Deque<Integer> stack = new ArrayDeque<>();
            stack.push(ROOT);
            while (!stack.isEmpty()) {
                int current = stack.pop();
                order.add(current);
                List<Integer> kids = nodes.get(current).children;
                for (int i = kids.size() - 1; i >= 0; i--) {
                    stack.push(kids.get(i));
                }
            }

            int[] remap = new int[nodes.size()];
            for (int i = 0; i < order.size(); i++) {
                remap[order.get(i)] = i;
            }

            Node[] frozen = new Node[order.size()];
            for (int i = 0; i < order.size(); i++) {
                MutableNode m = nodes.get(order.get(i));
                List<Integer> kids = new ArrayList<>(m.children.size());
                for (int child : m.children) {
                    kids.add(remap[child]);
                }
                int parent = m.parent == NONE ? NONE : remap[m.parent];
                frozen[i] = new Node(
                        parent,
                        m.move,
                        Collections.unmodifiableList(kids),
                        m.comment,
                        Collections.unmodifiableSet(new LinkedHashSet<>(m.nags)),
                        m.depth);
            }
            return new MoveTree(frozen);
        }

        private int append(int parent, String move, String comment, Set<Integer> nags) {
            Objects.requireNonNull(move, "move");
            if (move.isBlank()) {
                throw new IllegalArgumentException("Move token cannot be blank");
            }
            MutableNode p = live(parent);
            MutableNode child = new MutableNode(parent, move, p.depth + 1);
            child.comment = comment;
            child.nags.addAll(nags);
            int index = nodes.size();
            nodes.add(child);
            p.children.add(index);
            return index;
        }

        private MutableNode live(int index) {
            if (index < 0 || index >= nodes.size()) {
                throw new IndexOutOfBoundsException("No node " + index);
            }
            MutableNode n = nodes.get(index);
            if (n.detached) {
                throw new IllegalStateException("Node " + index + " has been detached");
            }
            return n;
        }
    }

    private static final class MutableNode {
        final int parent;
        final String move;
        final int depth;
        final List<Integer> children = new ArrayList<>();
        final Set<Integer> nags = new LinkedHashSet<>();
        String comment;
        boolean detached;

        MutableNode(int parent, String move, int depth) {
            this.parent = parent;
            this.move = move;
            this.depth = depth;
        }
    }
}
