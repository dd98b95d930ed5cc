package chess.curator.tree;

import java.util.Locale;

/**
 * An instruction that did not resolve against the tree it was applied to.
 *
 * @param operation which transform the instruction belonged to
 * @param instruction the instruction as given
 * @param reason why it did not resolve
 * @param resolvedPlies how many leading moves did resolve before the first miss
 */
public record UnresolvedEntry(Operation operation, VariationInstruction instruction, UnmatchedReason reason, int resolvedPlies) {

    /**
     * The transform an instruction was part of.
     */
    public enum Operation {
        REMOVE,
        ADD,
        PLAN_COMMENT
    }

    /**
     * Short single-line description for logs and reports.
     */
    public String describe() {
        String text = operation.name().toLowerCase(Locale.ROOT) + " '" + instruction.sequence() + "': " + reason;
        if (reason == UnmatchedReason.NOT_IN_TREE) {
            text += " (first " + resolvedPlies + " ply matched)";
        }
        return text;
    }
}
