package chess.curator.tree;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import chess.curator.game.MoveTree;
import chess.curator.game.VariationPath;
import chess.curator.helpers.GameTreeBuilder;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class PrefixOptimizerTest {

    private static final List<String> LINES = List.of(
            "1.e4 e5 2.Nf3 Nc6 3.Bb5",
            "1.e4 e5 2.Nf3 Nc6 3.Bc4",
            "1.e4 e5 2.Bc4",
            "1.e4 c5 2.Nf3",
            "1.e4 c6 2.d4");

    private static MoveTree reference() {
        return GameTreeBuilder.newTree().lines(LINES.toArray(new String[0])).build();
    }

    @Nested
    @DisplayName("literal cases")
    class Literal {

        @Test
        void wholeSubtreeCollapsesToItsRoot() {
            List<String> prefixes = PrefixOptimizer.optimize(
                    List.of("1.e4 e5 2.Nf3 Nc6 3.Bb5", "1.e4 e5 2.Nf3 Nc6 3.Bc4", "1.e4 e5 2.Bc4"), reference());
            assertEquals(List.of("1.e4 e5"), prefixes);
        }

        @Test
        void everyVariationCollapsesToFirstMove() {
            assertEquals(List.of("1.e4"), PrefixOptimizer.optimize(LINES, reference()));
        }

        @Test
        void partialBranchStopsAtDeepestCoveredNode() {
            List<String> prefixes = PrefixOptimizer.optimize(
                    List.of("1.e4 e5 2.Nf3 Nc6 3.Bc4", "1.e4 e5 2.Nf3 Nc6 3.Bb5"), reference());
            assertEquals(List.of("1.e4 e5 2.Nf3"), prefixes);
        }

        @Test
        void targetWithoutCheckMarkerMatchesReference() {
            MoveTree tree = GameTreeBuilder.newTree().lines("1.e4 e5 2.Qh5 Nc6 3.Qxf7#", "1.e4 e5 2.Qh5 Nc6 3.Bc4").build();
            assertEquals(List.of("1.e4 e5 2.Qh5 Nc6 3.Qxf7#"),
                    PrefixOptimizer.optimize(List.of("1.e4 e5 2.Qh5 Nc6 3.Qxf7"), tree));
        }

        @Test
        void singleLeafWithUntargetedSiblingStaysFull() {
            assertEquals(List.of("1.e4 e5 2.Nf3 Nc6 3.Bc4"),
                    PrefixOptimizer.optimize(List.of("1.e4 e5 2.Nf3 Nc6 3.Bc4"), reference()));
        }

        @Test
        void outputFollowsReferenceOrder() {
            List<String> prefixes = PrefixOptimizer.optimize(
                    List.of("1.e4 c6 2.d4", "1.e4 e5 2.Bc4", "1.e4 e5 2.Nf3 Nc6 3.Bc4"), reference());
            assertEquals(List.of("1.e4 e5 2.Nf3 Nc6 3.Bc4", "1.e4 e5 2.Bc4", "1.e4 c6"), prefixes);
        }

        @Test
        void lineMissingFromReferenceIsEmittedInFull() {
            assertEquals(List.of("1.d4 d5 2.c4"), PrefixOptimizer.optimize(List.of("1.d4 d5 2.c4"), reference()));
        }

        @Test
        void newLineBranchingFromCoveredNodeKeepsBothParts() {
            List<String> targets = List.of("1.e4 c5 2.Nf3", "1.e4 c5 2.c3");
            List<String> prefixes = PrefixOptimizer.optimize(targets, reference());
            assertEquals(new LinkedHashSet<>(targets), PrefixOptimizer.expand(prefixes, reference()));
            assertTrue(prefixes.contains("1.e4 c5 2.c3"));
        }

        @Test
        void emptyTargetsGiveNoPrefixes() {
            assertTrue(PrefixOptimizer.optimize(List.of(), reference()).isEmpty());
        }

        @Test
        void targetsAreNormalised() {
            assertEquals(List.of("1.e4 c6"), PrefixOptimizer.optimize(List.of("1. e4 c6 2. d4"), reference()));
        }
    }

    @Nested
    @DisplayName("invalid targets")
    class Invalid {

        @Test
        void targetThatContinuesInReferenceIsRejected() {
            assertThrows(IllegalArgumentException.class,
                    () -> PrefixOptimizer.optimize(List.of("1.e4 e5"), reference()));
        }

        @Test
        void targetThatIsPrefixOfAnotherTargetIsRejected() {
            assertThrows(IllegalArgumentException.class,
                    () -> PrefixOptimizer.optimize(List.of("1.d4", "1.d4 d5"), reference()));
        }

        @Test
        void malformedTargetIsRejected() {
            assertThrows(IllegalArgumentException.class,
                    () -> PrefixOptimizer.optimize(List.of("not moves"), reference()));
        }
    }

    @Nested
    @DisplayName("every subset of the reference")
    class Subsets {

        @Test
        void prefixesExpandBackToTargets() {
            MoveTree reference = reference();
            for (Set<String> targets : subsets()) {
                List<String> prefixes = PrefixOptimizer.optimize(targets, reference);
                assertEquals(targets, PrefixOptimizer.expand(prefixes, reference), "targets " + targets);
            }
        }

        @Test
        void noPrefixIsAncestorOfAnother() {
            MoveTree reference = reference();
            for (Set<String> targets : subsets()) {
                List<VariationPath> prefixes = new ArrayList<>();
                for (String prefix : PrefixOptimizer.optimize(targets, reference)) {
                    prefixes.add(VariationPath.parse(prefix));
                }
                for (VariationPath a : prefixes) {
                    for (VariationPath b : prefixes) {
                        assertFalse(a != b && b.startsWith(a), a + " is an ancestor of " + b);
                    }
                }
            }
        }

        @Test
        void noPrefixCouldBeShortened() {
            MoveTree reference = reference();
            for (Set<String> targets : subsets()) {
                for (String prefix : PrefixOptimizer.optimize(targets, reference)) {
                    List<String> moves = VariationPath.parse(prefix).moves();
                    if (moves.size() < 2) {
                        continue;
                    }
                    String parent = new VariationPath(moves.subList(0, moves.size() - 1)).canonical();
                    assertFalse(targets.containsAll(PrefixOptimizer.expand(List.of(parent), reference)),
                            prefix + " could be shortened to " + parent + " for " + targets);
                }
            }
        }

        @Test
        void neverMorePrefixesThanTargets() {
            MoveTree reference = reference();
            for (Set<String> targets : subsets()) {
                assertTrue(PrefixOptimizer.optimize(targets, reference).size() <= targets.size());
            }
        }

        private List<Set<String>> subsets() {
            List<Set<String>> result = new ArrayList<>();
            for (int mask = 1; mask < (1 << LINES.size()); mask++) {
                Set<String> subset = new LinkedHashSet<>();
                for (int i = 0; i < LINES.size(); i++) {
                    if ((mask & (1 << i)) != 0) {
                        subset.add(LINES.get(i));
                    }
                }
                result.add(subset);
            }
            return result;
        }
    }

    @Test
    void expandListsLeavesUnderEachPrefix() {
        assertEquals(Set.of("1.e4 e5 2.Nf3 Nc6 3.Bb5", "1.e4 e5 2.Nf3 Nc6 3.Bc4", "1.e4 c6 2.d4"),
                PrefixOptimizer.expand(List.of("1.e4 e5 2.Nf3", "1.e4 c6"), reference()));
    }
}
