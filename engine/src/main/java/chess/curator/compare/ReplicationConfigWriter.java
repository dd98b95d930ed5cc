package chess.curator.compare;

import chess.curator.plan.ColorConfig;
import chess.curator.plan.ConfigLoader;
import chess.curator.plan.CurationConfig;
import chess.curator.plan.GameAction;
import chess.curator.plan.GameConfig;
import chess.curator.plan.RepertoireColor;
import chess.curator.plan.VariationEntry;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Turns comparison results into a curation config that rebuilds the target file from the baseline.
 *
 * <p>The YAML starts with a comment block giving the variation counts of every compared pair,
 * followed by the config itself.
 */
@Component
public class ReplicationConfigWriter {

    static final String DESCRIPTION = "Auto-generated from pgn-curator compare - edit as needed";

    private final ConfigLoader loader;

    public ReplicationConfigWriter(ConfigLoader loader) {
        this.loader = loader;
    }

    public CurationConfig toConfig(List<ComparisonResult> comparisons, Path baseline, RepertoireColor color) {
        String stem = stem(baseline);
        CurationConfig config = new CurationConfig();
        config.setName("Replication config: " + stem + " -> target");
        config.setDescription(DESCRIPTION);
        config.setSource(baseline.toString());
        config.setOutput(stem + "_replicated");

        ColorConfig colorConfig = new ColorConfig(color == null ? RepertoireColor.WHITE : color);
        List<GameConfig> games = new ArrayList<>();
        for (ComparisonResult comparison : comparisons) {
            GameConfig game = new GameConfig(comparison.game1Index(), GameAction.INCLUDE);
            game.setName(comparison.game1Name());
            game.setRemoveVariations(entries(comparison.diff().remove()));
            game.setAddVariations(entries(comparison.diff().add()));
            games.add(game);
        }
        colorConfig.setGames(games);
        config.getConfigs().add(colorConfig);
        return config;
    }

    public String render(List<ComparisonResult> comparisons, Path baseline, RepertoireColor color) {
        CurationConfig config = toConfig(comparisons, baseline, color);
        StringBuilder sb = new StringBuilder();
        sb.append("# ").append(config.getName()).append('\n');
        sb.append("# ").append(DESCRIPTION).append('\n');
        for (ComparisonResult comparison : comparisons) {
            DiffStats stats = comparison.diff().stats();
            sb.append("#\n");
            sb.append("# Game [").append(comparison.game1Index()).append("]: ").append(comparison.game1Name()).append('\n');
            sb.append("# Variations: ").append(stats.baselineVariations())
                    .append(" -> ").append(stats.targetVariations()).append('\n');
            if (!comparison.diff().remove().isEmpty()) {
                sb.append("# Removed: ").append(comparison.diff().remove().size()).append('\n');
            }
            if (!comparison.diff().add().isEmpty()) {
                sb.append("# Added: ").append(comparison.diff().add().size()).append('\n');
            }
        }
        sb.append('\n').append(loader.toYaml(config));
        return sb.toString();
    }

    public void write(List<ComparisonResult> comparisons, Path baseline, RepertoireColor color, Path output)
            throws IOException {
        Files.writeString(output, render(comparisons, baseline, color), StandardCharsets.UTF_8);
    }

    private static List<VariationEntry> entries(List<String> sequences) {
        List<VariationEntry> entries = new ArrayList<>(sequences.size());
        for (String sequence : sequences) {
            entries.add(new VariationEntry(sequence, null));
        }
        return entries;
    }

    private static String stem(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }
}
