package chess.curator.compare;

import chess.curator.game.MoveTree;
import chess.curator.tree.CoverageInvariantViolation;
import chess.curator.tree.FilterResult;
import chess.curator.tree.PrefixOptimizer;
import chess.curator.tree.VariationExtractor;
import chess.curator.tree.VariationFilter;
import chess.curator.tree.VariationInstruction;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Computes the remove/add instructions that turn a baseline tree into a target tree.
 *
 * <p><b>Phase 1 (remove):</b> variations of the baseline missing from the target are compressed
 * against the baseline itself, so a prefix is only used when every baseline line under it goes.
 *
 * <p><b>Phase 2 (add):</b> the removals are applied to get the intermediate tree, and target
 * variations still missing are compressed against that intermediate tree. The intermediate tree,
 * not the target, is the reference because the add prefixes are later replayed on it.
 *
 * <p>The result is checked: filtering the baseline with both sets must give exactly the target's
 * variation set.
 */
public final class VariationComparator {

    private static final Logger log = LoggerFactory.getLogger(VariationComparator.class);

    private VariationComparator() {
    }

    public static TreeDiff diff(MoveTree baseline, MoveTree target) {
        Set<String> baselineVariations = VariationExtractor.extractSequences(baseline);
        Set<String> targetVariations = VariationExtractor.extractSequences(target);

        Set<String> toRemove = new LinkedHashSet<>(baselineVariations);
        toRemove.removeAll(targetVariations);
        List<String> removePrefixes = PrefixOptimizer.optimize(toRemove, baseline);

        FilterResult intermediate = VariationFilter.remove(baseline, VariationInstruction.allOf(removePrefixes));
        Set<String> toAdd = new LinkedHashSet<>(targetVariations);
        toAdd.removeAll(VariationExtractor.extractSequences(intermediate.tree()));
        List<String> addPrefixes = PrefixOptimizer.optimize(toAdd, intermediate.tree());

        FilterResult replayed = VariationFilter.filter(
                baseline,
                VariationInstruction.allOf(removePrefixes),
                VariationInstruction.allOf(addPrefixes),
                null);
        Set<String> reproduced = VariationExtractor.extractSequences(replayed.tree());
        if (!reproduced.equals(targetVariations) || !replayed.fullyMatched()) {
            throw new CoverageInvariantViolation("Comparison replay", targetVariations, reproduced);
        }

        if (log.isDebugEnabled()) {
            log.debug("Diff {} -> {} variation(s): {} to remove as {} prefix(es), {} to add as {} prefix(es)",
                    baselineVariations.size(), targetVariations.size(),
                    toRemove.size(), removePrefixes.size(), toAdd.size(), addPrefixes.size());
        }
        DiffStats stats = new DiffStats(
                baselineVariations.size(), targetVariations.size(), toRemove.size(), toAdd.size());
        return new TreeDiff(removePrefixes, addPrefixes, stats);
    }
}
