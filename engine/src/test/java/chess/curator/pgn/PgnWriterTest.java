package chess.curator.pgn;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import chess.curator.game.MoveTree;
import chess.curator.game.PgnGame;
import chess.curator.helpers.GameTreeBuilder;
import chess.curator.tree.VariationExtractor;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class PgnWriterTest {

    private final PgnWriter writer = new PgnWriter();
    private final PgnReader reader = new PgnReader();

    @Test
    void writesHeadersThenMovetext() {
        PgnGame game = GameTreeBuilder.newTree()
                .header("Event", "Repertoire")
                .header("Result", "*")
                .line("1.e4 e5 2.Nf3")
                .game();

        assertEquals("[Event \"Repertoire\"]\n[Result \"*\"]\n\n1.e4 e5 2.Nf3 *", writer.write(game));
    }

    @Test
    void variationsInterruptMainlineWithBlackMoveNumber() {
        PgnGame game = GameTreeBuilder.newTree()
                .lines("1.e4 e5 2.Nf3 Nc6", "1.e4 e5 2.Bc4 Nf6")
                .game();

        assertEquals("1.e4 e5 2.Nf3 (2.Bc4 Nf6) 2...Nc6 *", writer.write(game));
    }

    @Test
    void blackAlternativeGetsEllipsis() {
        PgnGame game = GameTreeBuilder.newTree().lines("1.e4 e5 2.Nf3", "1.e4 c5").game();
        assertEquals("1.e4 e5 (1...c5) 2.Nf3 *", writer.write(game));
    }

    @Test
    void commentsAndNagsFollowTheirMove() {
        PgnGame game = GameTreeBuilder.newTree()
                .line("1.e4 e5 2.Nf3")
                .comment("1.e4", "best {by} test")
                .nag("1.e4 e5", 6)
                .game();

        assertEquals("1.e4 {best {by) test} 1...e5 $6 2.Nf3 *", writer.write(game));
    }

    @Test
    void longMovetextWrapsAtEightyColumns() {
        PgnGame game = GameTreeBuilder.newTree().longLine(60).game();
        for (String line : writer.write(game).split("\n")) {
            assertTrue(line.length() <= 80, line);
        }
    }

    @Test
    void writtenTextReadsBackToSameVariations(@TempDir Path dir) throws IOException {
        MoveTree tree = GameTreeBuilder.newTree()
                .lines("1.d4 d5 2.c4 e6 3.Nc3", "1.d4 d5 2.c4 c6", "1.d4 Nf6 2.c4 g6", "1.e4")
                .comment("1.d4 Nf6", "Indian")
                .build();
        PgnGame game = new PgnGame(Map.of("Event", "Round trip"), tree);
        Path file = dir.resolve("out.pgn");
        writer.writeFile(List.of(game, game), file);

        List<PgnGame> read = reader.readFile(file);
        assertEquals(2, read.size());
        assertEquals(VariationExtractor.extractSequences(tree), VariationExtractor.extractSequences(read.get(1).tree()));
        assertEquals("Indian", read.get(0).tree().comment(read.get(0).tree().find(List.of("d4", "Nf6"))));
    }
}
