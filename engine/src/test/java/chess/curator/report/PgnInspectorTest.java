package chess.curator.report;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import chess.curator.pgn.PgnReader;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class PgnInspectorTest {

    @TempDir
    Path dir;

    private final PgnInspector inspector = new PgnInspector(new PgnReader());
    private Path pgn;

    @BeforeEach
    void writePgn() throws IOException {
        pgn = dir.resolve("rep.pgn");
        Files.writeString(pgn, """
                [White "Ruy Lopez"]
                [ECO "C60"]

                1.e4 e5 2.Nf3 Nc6 3.Bb5 a6 4.Ba4 Nf6 5.O-O Be7 6.Re1 (6.Qe2 b5) b5 *

                [White "?"]

                1.d4 *
                """);
    }

    @Test
    void summarisesEveryGame() throws IOException {
        List<GameSummary> games = inspector.inspect(pgn);

        assertEquals(2, games.size());
        GameSummary ruy = games.get(0);
        assertEquals("Ruy Lopez", ruy.name());
        assertEquals("C60", ruy.eco());
        assertEquals(2, ruy.variationCount());
        assertEquals(12, ruy.maxDepth());
        assertEquals(12.0, ruy.averageDepth(), 1e-9);
        assertEquals("1.e4 e5 2.Nf3 Nc6 3.Bb5 a6 4.Ba4 Nf6 5.O-O Be7", ruy.openingMoves());
        assertTrue(ruy.variations().isEmpty());

        GameSummary second = games.get(1);
        assertEquals("Game 2", second.name());
        assertEquals("?", second.eco());
    }

    @Test
    void listsVariationsOnRequest() throws IOException {
        GameSummary ruy = inspector.inspectGame(pgn, 1, true);
        assertEquals(List.of(
                "1.e4 e5 2.Nf3 Nc6 3.Bb5 a6 4.Ba4 Nf6 5.O-O Be7 6.Re1 b5",
                "1.e4 e5 2.Nf3 Nc6 3.Bb5 a6 4.Ba4 Nf6 5.O-O Be7 6.Qe2 b5"), ruy.variations());
    }

    @Test
    void rejectsOutOfRangeIndex() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> inspector.inspectGame(pgn, 3, false));
        assertTrue(e.getMessage().contains("indices 1-2"));
    }

    @Test
    void printsInspectionTable() throws IOException {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        new ReportPrinter(new PrintStream(buffer, true, StandardCharsets.UTF_8)).printInspection(pgn, inspector.inspect(pgn));
        String text = buffer.toString(StandardCharsets.UTF_8);

        assertTrue(text.contains("| Ruy Lopez "));
        assertTrue(text.contains("Total: 2 game(s), 3 variations"));
        assertTrue(text.contains("Max depth: 12 plies"));
    }

    @Test
    void fallsBackToEventForName() throws IOException {
        Path file = dir.resolve("events.pgn");
        Files.writeString(file, "[Event \"Najdorf ideas\"]\n\n1.e4 c5 *\n");
        assertEquals("Najdorf ideas", inspector.inspect(file).get(0).name());
    }

    @Test
    void formatsByteSizes() {
        assertEquals("512 B", ReportPrinter.bytes(512));
        assertEquals("1.5 KB", ReportPrinter.bytes(1536));
        assertEquals("2.0 MB", ReportPrinter.bytes(2 * 1024 * 1024));
    }
}
