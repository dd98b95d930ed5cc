package chess.curator.report;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import chess.curator.pgn.PgnReader;
import chess.curator.plan.ConfigLoader;
import chess.curator.plan.CurationConfig;
import chess.curator.plan.GameAction;
import chess.curator.plan.GameConfig;
import chess.curator.plan.RepertoireColor;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class StarterConfigGeneratorTest {

    @TempDir
    Path dir;

    private final ConfigLoader loader = new ConfigLoader();
    private final StarterConfigGenerator generator = new StarterConfigGenerator(new PgnReader(), loader);
    private Path pgn;

    @BeforeEach
    void writePgn() throws IOException {
        pgn = dir.resolve("openings.pgn");
        Files.writeString(pgn, """
                [White "Italian"]

                1.e4 e5 2.Nf3 Nc6 3.Bc4 *

                1.d4 d5 *
                """);
    }

    @Test
    void includesEveryGameForWhite() throws IOException {
        CurationConfig config = generator.generate(pgn);

        assertEquals("openings repertoire", config.getName());
        assertEquals("openings_curated", config.getOutput());
        assertEquals(pgn.toString(), config.getSource());
        assertEquals(1, config.getConfigs().size());
        assertEquals(RepertoireColor.WHITE, config.getConfigs().get(0).getColor());

        List<GameConfig> games = config.getConfigs().get(0).getGames();
        assertEquals(2, games.size());
        assertEquals(GameAction.INCLUDE, games.get(1).getAction());
        assertEquals("Italian", games.get(0).getName());
        assertEquals("Game 2", games.get(1).getName());
    }

    @Test
    void renderedYamlLoadsBack() throws IOException {
        String yaml = generator.render(pgn);

        assertTrue(yaml.contains("action: include"));
        CurationConfig parsed = loader.parse(yaml, "starter");
        assertEquals(2, parsed.getConfigs().get(0).getGames().size());
        assertEquals(2, parsed.getConfigs().get(0).getGames().get(1).getIndex());
    }
}
