package chess.curator.build;

import chess.curator.game.MoveSequence;
import chess.curator.game.MoveTree;
import chess.curator.plan.PlanComment;
import chess.curator.tree.FilterResult;
import chess.curator.tree.UnmatchedReason;
import chess.curator.tree.UnresolvedEntry;
import chess.curator.tree.VariationInstruction;
import java.util.ArrayList;
import java.util.List;

/**
 * Writes plan comments into a move tree.
 */
public final class PlanCommentApplier {

    private PlanCommentApplier() {
    }

    /**
     * Applies each plan comment whose variation exists in full in the tree. The others are
     * returned as unresolved entries and leave the tree untouched.
     */
    public static FilterResult apply(MoveTree tree, List<PlanComment> comments) {
        if (comments.isEmpty()) {
            return new FilterResult(tree, List.of());
        }
        MoveTree.Builder builder = tree.toBuilder();
        List<UnresolvedEntry> unmatched = new ArrayList<>();

        for (PlanComment plan : comments) {
            VariationInstruction instruction = new VariationInstruction(plan.getVariation(), plan.getComment());
            List<String> moves;
            try {
                moves = MoveSequence.parse(plan.getVariation());
            } catch (IllegalArgumentException e) {
                unmatched.add(new UnresolvedEntry(
                        UnresolvedEntry.Operation.PLAN_COMMENT, instruction, UnmatchedReason.INVALID_SEQUENCE, 0));
                continue;
            }

            List<Integer> path = new ArrayList<>(moves.size());
            int node = MoveTree.ROOT;
            for (String move : moves) {
                node = builder.childWithMove(node, move);
                if (node == MoveTree.NONE) {
                    break;
                }
                path.add(node);
            }
            if (path.size() < moves.size()) {
                unmatched.add(new UnresolvedEntry(
                        UnresolvedEntry.Operation.PLAN_COMMENT, instruction, UnmatchedReason.NOT_IN_TREE, path.size()));
                continue;
            }

            int target = path.get(targetPly(plan.getAtMove(), path.size()) - 1);
            String existing = builder.comment(target);
            if (plan.isReplace() || existing == null) {
                builder.setComment(target, plan.getComment());
            } else {
                builder.setComment(target, existing + " " + plan.getComment());
            }
        }
        return new FilterResult(builder.build(), unmatched);
    }

    /**
     * Ply the comment lands on: white's move of {@code atMove}, or the last ply when absent,
     * never past the end of the sequence.
     */
    static int targetPly(Integer atMove, int length) {
        if (atMove == null) {
            return length;
        }
        if (atMove < 1) {
            return 1;
        }
        // atMove past the end would overflow 2 * atMove - 1
        return atMove > (length + 1) / 2 ? length : 2 * atMove - 1;
    }
}
