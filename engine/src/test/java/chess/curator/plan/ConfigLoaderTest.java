package chess.curator.plan;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ConfigLoaderTest {

    @TempDir
    Path dir;

    private final ConfigLoader loader = new ConfigLoader();
    private Path source;

    @BeforeEach
    void writeSource() throws IOException {
        source = dir.resolve("repertoire.pgn");
        Files.writeString(source, "1.e4 e5 *\n");
    }

    private Path config(String yaml) throws IOException {
        Path file = dir.resolve("config.yml");
        Files.writeString(file, yaml.replace("${source}", source.toString()).replace("${output}", dir.resolve("out").toString()));
        return file;
    }

    @Nested
    @DisplayName("load")
    class Load {

        @Test
        void readsFullConfig() throws IOException {
            CurationConfig config = loader.load(config("""
                    name: My repertoire
                    version: "1.2"
                    source: ${source}
                    output: ${output}
                    configs:
                      - color: white
                        settings:
                          min_depth: 4
                          preserve_comments: false
                        games:
                          - index: 1
                            action: include
                            name: Italian
                            remove_variations:
                              - moves: "1.e4 e5 2.Nf3 Nc6 3.Bc4 Nf6"
                                reason: too much theory
                                depth: 8
                            add_variations:
                              - moves: "1.e4 e5 2.Nf3 Nc6 3.Bc4 Bc5 4.c3"
                            max_depth: 14
                          - index: 2
                            action: skip_keep_headers
                        plan_comments:
                          - variation: "1.e4 e5 2.Nf3"
                            at_move: 2
                            comment: Develop the knight
                            replace: true
                      - color: black
                        skip: "2"
                    """));

            assertEquals("My repertoire", config.getName());
            assertEquals("1.2", config.getVersion());
            ColorConfig white = config.forColor(RepertoireColor.WHITE);
            assertEquals(4, white.getSettings().getMinDepth());
            assertFalse(white.getSettings().isPreserveComments());
            assertTrue(white.getSettings().isPreserveHeaders());

            GameConfig first = white.getGames().get(0);
            assertEquals("Italian", first.getName());
            assertEquals(14, first.getMaxDepth());
            assertNull(first.getMinDepth());
            assertEquals("too much theory", first.getRemoveVariations().get(0).getReason());
            assertEquals(8, first.removeInstructions().get(0).depth());
            assertNull(first.addInstructions().get(0).depth());
            assertEquals(GameAction.SKIP_KEEP_HEADERS, white.getGames().get(1).getAction());

            PlanComment plan = white.getPlanComments().get(0);
            assertEquals(2, plan.getAtMove());
            assertTrue(plan.isReplace());

            assertEquals("2", config.forColor(RepertoireColor.BLACK).getSkip());
        }

        @Test
        void unknownKeysAreIgnored() throws IOException {
            CurationConfig config = loader.load(config("""
                    name: Test
                    source: ${source}
                    output: ${output}
                    importance:
                      main_lines: ["1.e4"]
                    configs:
                      - color: white
                        include: "1"
                    """));
            assertEquals("1", config.getConfigs().get(0).getInclude());
        }

        @Test
        void missingFileFails() {
            assertThrows(NoSuchFileException.class, () -> loader.load(dir.resolve("nope.yml")));
        }

        @Test
        void emptyFileFails() throws IOException {
            ConfigValidationException e = assertThrows(ConfigValidationException.class, () -> loader.load(config("")));
            assertEquals(List.of("Config file is empty"), e.getErrors());
        }

        @Test
        void malformedYamlFails() {
            assertThrows(ConfigValidationException.class, () -> loader.load(config("name: [unclosed\n")));
        }

        @Test
        void unknownColorFails() {
            assertThrows(ConfigValidationException.class, () -> loader.load(config("""
                    name: Test
                    source: ${source}
                    output: ${output}
                    configs:
                      - color: green
                        include: "1"
                    """)));
        }

        @Test
        void unknownActionFails() {
            assertThrows(ConfigValidationException.class, () -> loader.load(config("""
                    name: Test
                    source: ${source}
                    output: ${output}
                    configs:
                      - color: white
                        games:
                          - index: 1
                            action: maybe
                    """)));
        }
    }

    @Nested
    @DisplayName("validate")
    class Validate {

        @Test
        void collectsEveryProblem() throws IOException {
            ConfigValidationException e = assertThrows(ConfigValidationException.class, () -> loader.load(config("""
                    name: ""
                    source: ${source}
                    output: ${output}
                    configs:
                      - color: white
                        skip: "1"
                        include: "2"
                        games:
                          - index: 0
                            max_depth: 0
                            remove_variations:
                              - moves: "  "
                            add_variations:
                              - moves: "1.e4"
                                depth: 0
                      - color: white
                        include: "3-1"
                    """)));

            List<String> errors = e.getErrors();
            assertTrue(errors.contains("name: must not be empty"), errors.toString());
            assertTrue(errors.contains("configs[0]: cannot use both 'skip' and 'include'"), errors.toString());
            assertTrue(errors.contains("configs[0].games[0].index: must be >= 1"), errors.toString());
            assertTrue(errors.contains("configs[0].games[0].max_depth: must be >= 1"), errors.toString());
            assertTrue(errors.contains("configs[0].games[0].remove_variations[0].moves: move sequence cannot be empty"), errors.toString());
            assertTrue(errors.contains("configs[0].games[0].add_variations[0].depth: must be >= 1"), errors.toString());
            assertTrue(errors.contains("configs[1].color: duplicate color configuration 'white'"), errors.toString());
            assertTrue(errors.stream().anyMatch(m -> m.startsWith("configs[1].include: Invalid range")), errors.toString());
        }

        @Test
        void sourceMustExistAndBePgn() throws IOException {
            Path text = dir.resolve("notes.txt");
            Files.writeString(text, "x");
            CurationConfig config = new CurationConfig();
            config.setName("x");
            config.setOutput(dir.resolve("out").toString());
            config.getConfigs().add(colorWithGames());

            config.setSource(dir.resolve("missing.pgn").toString());
            assertTrue(loader.validate(config).get(0).startsWith("source: file not found"));

            config.setSource(text.toString());
            assertTrue(loader.validate(config).get(0).startsWith("source: must be a PGN file"));
        }

        @Test
        void outputDirectoryMustExist() {
            CurationConfig config = new CurationConfig();
            config.setName("x");
            config.setSource(source.toString());
            config.setOutput(dir.resolve("no/such/dir/out").toString());
            config.getConfigs().add(colorWithGames());
            assertTrue(loader.validate(config).get(0).startsWith("output: directory does not exist"));
        }

        @Test
        void needsAtLeastOneColorAndGameSelection() {
            CurationConfig config = new CurationConfig();
            config.setName("x");
            config.setSource(source.toString());
            config.setOutput(dir.resolve("out").toString());
            assertEquals(List.of("configs: must specify at least one color configuration"), loader.validate(config));

            config.getConfigs().add(new ColorConfig(RepertoireColor.BLACK));
            assertEquals(List.of("configs[0]: must specify 'games', 'skip' or 'include'"), loader.validate(config));
        }

        private ColorConfig colorWithGames() {
            ColorConfig color = new ColorConfig(RepertoireColor.WHITE);
            color.setGames(List.of(new GameConfig(1, GameAction.INCLUDE)));
            return color;
        }
    }

    @Test
    void yamlRoundTrip() {
        CurationConfig config = new CurationConfig();
        config.setName("Round trip");
        config.setSource("a.pgn");
        config.setOutput("a_out");
        ColorConfig black = new ColorConfig(RepertoireColor.BLACK);
        GameConfig game = new GameConfig(3, GameAction.INCLUDE);
        game.setRemoveVariations(List.of(new VariationEntry("1.e4 c5 2.c3", null)));
        black.setGames(List.of(game));
        config.getConfigs().add(black);

        String yaml = loader.toYaml(config);
        assertFalse(yaml.startsWith("---"), yaml);
        assertTrue(yaml.contains("remove_variations"), yaml);
        assertFalse(yaml.contains("add_variations"), yaml);

        CurationConfig parsed = loader.parse(yaml, "round trip");
        assertEquals("1.e4 c5 2.c3", parsed.getConfigs().get(0).getGames().get(0).getRemoveVariations().get(0).getMoves());
        assertEquals(RepertoireColor.BLACK, parsed.getConfigs().get(0).getColor());
    }
}
