package chess.curator.report;

import chess.curator.game.PgnGame;
import chess.curator.pgn.PgnReader;
import chess.curator.plan.ColorConfig;
import chess.curator.plan.ConfigLoader;
import chess.curator.plan.CurationConfig;
import chess.curator.plan.GameAction;
import chess.curator.plan.GameConfig;
import chess.curator.plan.RepertoireColor;
import java.io.IOException;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Writes a starter curation config that includes every game of a PGN file for white.
 */
@Component
public class StarterConfigGenerator {

    private final PgnReader reader;
    private final ConfigLoader loader;

    public StarterConfigGenerator(PgnReader reader, ConfigLoader loader) {
        this.reader = reader;
        this.loader = loader;
    }

    public CurationConfig generate(Path pgn) throws IOException {
        List<PgnGame> games = reader.readFile(pgn);
        String fileName = pgn.getFileName().toString();
        String stem = fileName.contains(".") ? fileName.substring(0, fileName.lastIndexOf('.')) : fileName;

        CurationConfig config = new CurationConfig();
        config.setName(stem + " repertoire");
        config.setVersion("1.0");
        config.setCreated(LocalDate.now().toString());
        config.setSource(pgn.toString());
        config.setOutput(stem + "_curated");

        ColorConfig white = new ColorConfig(RepertoireColor.WHITE);
        List<GameConfig> entries = new ArrayList<>();
        for (int i = 0; i < games.size(); i++) {
            GameConfig entry = new GameConfig(i + 1, GameAction.INCLUDE);
            entry.setName(games.get(i).displayName("White", i + 1));
            entries.add(entry);
        }
        white.setGames(entries);
        config.getConfigs().add(white);
        return config;
    }

    public String render(Path pgn) throws IOException {
        return loader.toYaml(generate(pgn));
    }
}
