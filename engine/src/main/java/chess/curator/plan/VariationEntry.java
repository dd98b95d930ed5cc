package chess.curator.plan;

import chess.curator.tree.VariationInstruction;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * A move sequence listed under {@code remove_variations} or {@code add_variations}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class VariationEntry {
    private String moves;
    private String reason;
    private Integer depth;

    public VariationEntry() {
    }

    public VariationEntry(String moves, String reason) {
        this.moves = moves;
        this.reason = reason;
    }

    public String getMoves() {
        return moves;
    }

    public void setMoves(String moves) {
        this.moves = moves == null ? null : moves.trim();
    }

    public String getReason() {
        return reason;
    }

    public void setReason(String reason) {
        this.reason = reason;
    }

    /**
     * Optional ply limit: a removal keeps the first {@code depth} plies of the lines it matches,
     * an addition creates at most {@code depth} plies.
     */
    public Integer getDepth() {
        return depth;
    }

    public void setDepth(Integer depth) {
        this.depth = depth;
    }

    public VariationInstruction toInstruction() {
        return new VariationInstruction(moves, reason, depth);
    }
}
