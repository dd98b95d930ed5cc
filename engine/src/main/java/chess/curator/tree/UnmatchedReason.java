package chess.curator.tree;

/**
 * Why an instruction could not be applied to a tree.
 */
public enum UnmatchedReason {

    /** Some move of the sequence has no matching child at that point of the tree. */
    NOT_IN_TREE,

    /** The sequence holds no moves or a move that failed validation. */
    INVALID_SEQUENCE,
}
