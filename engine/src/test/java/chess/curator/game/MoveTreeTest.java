package chess.curator.game;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import chess.curator.helpers.GameTreeBuilder;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class MoveTreeTest {

    @Nested
    @DisplayName("navigation")
    class Navigation {

        private final MoveTree tree = GameTreeBuilder.newTree()
                .line("1.e4 e5 2.Nf3")
                .line("1.e4 c5")
                .line("1.d4")
                .build();

        @Test
        void emptyTreeIsRootOnly() {
            MoveTree empty = MoveTree.empty();
            assertEquals(1, empty.size());
            assertTrue(empty.isEmpty());
            assertTrue(empty.isLeaf(MoveTree.ROOT));
            assertEquals(MoveTree.NONE, empty.parent(MoveTree.ROOT));
        }

        @Test
        void childrenKeepInsertionOrder() {
            List<Integer> first = tree.children(MoveTree.ROOT);
            assertEquals(2, first.size());
            assertEquals("e4", tree.move(first.get(0)));
            assertEquals("d4", tree.move(first.get(1)));
        }

        @Test
        void findReplaysFromRoot() {
            int node = tree.find(List.of("e4", "e5", "Nf3"));
            assertEquals(3, tree.depth(node));
            assertEquals(List.of("e4", "e5", "Nf3"), tree.pathTo(node));
            assertTrue(tree.isLeaf(node));
            assertEquals(MoveTree.ROOT, tree.find(List.of()));
            assertEquals(MoveTree.NONE, tree.find(List.of("e4", "d5")));
        }

        @Test
        void childrenHaveLargerIndicesThanParents() {
            for (int node = 1; node < tree.size(); node++) {
                assertTrue(tree.parent(node) < node, "node " + node);
            }
        }

        @Test
        void outOfRangeIndexFails() {
            assertThrows(IndexOutOfBoundsException.class, () -> tree.move(tree.size()));
        }
    }

    @Nested
    @DisplayName("builder")
    class BuilderTests {

        @Test
        void detachDropsWholeSubtree() {
            MoveTree tree = GameTreeBuilder.newTree().lines("1.e4 e5 2.Nf3", "1.e4 c5", "1.d4").build();
            MoveTree.Builder builder = tree.toBuilder();
            builder.detach(tree.find(List.of("e4")));
            MoveTree result = builder.build();

            assertEquals(2, result.size());
            assertEquals(List.of("d4"), result.pathTo(1));
            assertEquals(6, tree.size(), "source tree untouched");
        }

        @Test
        void rootCannotBeDetached() {
            MoveTree.Builder builder = MoveTree.builder();
            assertThrows(IllegalArgumentException.class, () -> builder.detach(MoveTree.ROOT));
        }

        @Test
        void annotationsSurviveCopy() {
            MoveTree tree = GameTreeBuilder.newTree()
                    .line("1.e4 e5")
                    .comment("1.e4", "best by test")
                    .nag("1.e4", 1)
                    .build();
            MoveTree copy = tree.toBuilder().build();
            int e4 = copy.find(List.of("e4"));

            assertEquals("best by test", copy.comment(e4));
            assertEquals(Set.of(1), copy.nags(e4));
            assertNull(copy.comment(copy.find(List.of("e4", "e5"))));
        }

        @Test
        void blankCommentIsStoredAsNone() {
            MoveTree.Builder builder = MoveTree.builder();
            int e4 = builder.addChild(MoveTree.ROOT, "e4");
            builder.setComment(e4, "   ");
            assertNull(builder.build().comment(1));
        }

        @Test
        void nagRangeIsChecked() {
            MoveTree.Builder builder = MoveTree.builder();
            int e4 = builder.addChild(MoveTree.ROOT, "e4");
            assertThrows(IllegalArgumentException.class, () -> builder.addNag(e4, 256));
        }

        @Test
        void blankMoveIsRejected() {
            MoveTree.Builder builder = MoveTree.builder();
            assertThrows(IllegalArgumentException.class, () -> builder.addChild(MoveTree.ROOT, " "));
        }

        @Test
        void clearAnnotationsRemovesCommentAndNags() {
            MoveTree tree = GameTreeBuilder.newTree().line("1.e4").comment("1.e4", "x").nag("1.e4", 3).build();
            MoveTree.Builder builder = tree.toBuilder();
            builder.clearAnnotations(1);
            MoveTree cleared = builder.build();
            assertNull(cleared.comment(1));
            assertFalse(cleared.nags(1).contains(3));
        }
    }
}
