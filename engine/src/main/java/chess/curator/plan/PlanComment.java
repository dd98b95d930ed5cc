package chess.curator.plan;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A comment attached to a move along a variation.
 *
 * <p>Without {@code at_move} the comment lands on the last move of {@code variation}; with it, on
 * white's move of that move number, clamped to the end of the sequence.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PlanComment {
    private String variation;

    @JsonProperty("at_move")
    private Integer atMove;

    private String comment;
    private boolean replace;

    public PlanComment() {
    }

    public PlanComment(String variation, Integer atMove, String comment, boolean replace) {
        this.variation = variation;
        this.atMove = atMove;
        this.comment = comment;
        this.replace = replace;
    }

    public String getVariation() {
        return variation;
    }

    public void setVariation(String variation) {
        this.variation = variation;
    }

    public Integer getAtMove() {
        return atMove;
    }

    public void setAtMove(Integer atMove) {
        this.atMove = atMove;
    }

    public String getComment() {
        return comment;
    }

    public void setComment(String comment) {
        this.comment = comment;
    }

    public boolean isReplace() {
        return replace;
    }

    public void setReplace(boolean replace) {
        this.replace = replace;
    }
}
