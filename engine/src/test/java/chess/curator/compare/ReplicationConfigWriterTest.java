package chess.curator.compare;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import chess.curator.plan.ColorConfig;
import chess.curator.plan.ConfigLoader;
import chess.curator.plan.CurationConfig;
import chess.curator.plan.GameConfig;
import chess.curator.plan.RepertoireColor;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;

class ReplicationConfigWriterTest {

    private final ConfigLoader loader = new ConfigLoader();
    private final ReplicationConfigWriter writer = new ReplicationConfigWriter(loader);

    private final List<ComparisonResult> comparisons = List.of(new ComparisonResult(
            2, 2, "Sicilian", "Sicilian",
            new TreeDiff(List.of("1.e4 c5 2.c3"), List.of("1.e4 c5 2.Nf3 d6 3.d4"), new DiffStats(7, 7, 1, 1))));

    @Test
    void renderedYamlStartsWithStatsComments() {
        String yaml = writer.render(comparisons, Path.of("repertoire.pgn"), RepertoireColor.BLACK);

        assertTrue(yaml.startsWith("# Replication config: repertoire -> target\n"), yaml);
        assertTrue(yaml.contains("# Game [2]: Sicilian\n"), yaml);
        assertTrue(yaml.contains("# Variations: 7 -> 7\n"), yaml);
        assertTrue(yaml.contains("# Removed: 1\n"), yaml);
        assertTrue(yaml.contains("# Added: 1\n"), yaml);
    }

    @Test
    void renderedYamlParsesBackToInstructions() {
        String yaml = writer.render(comparisons, Path.of("repertoire.pgn"), RepertoireColor.BLACK);
        CurationConfig config = loader.parse(yaml, "replication");

        assertEquals("repertoire.pgn", config.getSource());
        assertEquals("repertoire_replicated", config.getOutput());
        ColorConfig color = config.getConfigs().get(0);
        assertEquals(RepertoireColor.BLACK, color.getColor());
        GameConfig game = color.getGames().get(0);
        assertEquals(2, game.getIndex());
        assertEquals("Sicilian", game.getName());
        assertEquals("1.e4 c5 2.c3", game.getRemoveVariations().get(0).getMoves());
        assertEquals("1.e4 c5 2.Nf3 d6 3.d4", game.getAddVariations().get(0).getMoves());
    }

    @Test
    void colorDefaultsToWhite() {
        CurationConfig config = writer.toConfig(comparisons, Path.of("a.pgn"), null);
        assertEquals(RepertoireColor.WHITE, config.getConfigs().get(0).getColor());
    }
}
