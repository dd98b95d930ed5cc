package chess.curator.tree;

import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * One remove or add instruction: a move-sequence string, an optional human reason and an optional
 * ply depth.
 *
 * <p>With a depth, a removal only cuts plies deeper than {@code depth} below the sequence, and an
 * addition only replays the sequence up to {@code depth} plies.
 */
public record VariationInstruction(String sequence, String reason, Integer depth) {

    public VariationInstruction {
        Objects.requireNonNull(sequence, "sequence");
        if (depth != null && depth < 1) {
            throw new IllegalArgumentException("depth must be >= 1: " + depth);
        }
    }

    public VariationInstruction(String sequence, String reason) {
        this(sequence, reason, null);
    }

    public static VariationInstruction of(String sequence) {
        return new VariationInstruction(sequence, null);
    }

    /**
     * Wraps plain sequences as reason-less instructions, keeping their order.
     */
    public static List<VariationInstruction> allOf(Collection<String> sequences) {
        return sequences.stream().map(VariationInstruction::of).toList();
    }
}
