package chess.curator.plan;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Reads, validates and writes curation configs in YAML.
 *
 * <p>Relative {@code source} and {@code output} paths are resolved against the working directory.
 * Unknown keys are ignored.
 */
@Component
public class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory()
            .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
            .enable(YAMLGenerator.Feature.MINIMIZE_QUOTES))
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    /**
     * Loads and validates a config file.
     *
     * @throws NoSuchFileException if the file does not exist
     * @throws ConfigValidationException if the YAML is malformed or the config is invalid
     */
    public CurationConfig load(Path path) throws IOException {
        if (!Files.exists(path)) {
            throw new NoSuchFileException(path.toString(), null, "Config file not found");
        }
        String yaml = Files.readString(path, StandardCharsets.UTF_8);
        CurationConfig config = parse(yaml, path.toString());

        List<String> errors = validate(config);
        if (!errors.isEmpty()) {
            throw new ConfigValidationException(path.toString(), errors);
        }
        if (log.isDebugEnabled()) {
            log.debug("Loaded config '{}' from {} with {} color config(s)", config.getName(), path, config.getConfigs().size());
        }
        return config;
    }

    /**
     * Parses YAML text without validating it.
     */
    public CurationConfig parse(String yaml, String sourceName) {
        if (yaml == null || yaml.isBlank()) {
            throw new ConfigValidationException(sourceName, List.of("Config file is empty"));
        }
        CurationConfig config;
        try {
            config = yamlMapper.readValue(yaml, CurationConfig.class);
        } catch (JsonProcessingException e) {
            throw new ConfigValidationException(sourceName, "Invalid YAML: " + e.getOriginalMessage(), e);
        }
        if (config == null) {
            throw new ConfigValidationException(sourceName, List.of("Config file is empty"));
        }
        return config;
    }

    /**
     * Checks a config for problems, collecting every one found instead of stopping at the first.
     *
     * @return the problems, empty when the config is valid
     */
    public List<String> validate(CurationConfig config) {
        List<String> errors = new ArrayList<>();
        if (isBlank(config.getName())) {
            errors.add("name: must not be empty");
        }
        validateSource(config.getSource(), errors);
        validateOutput(config.getOutput(), errors);

        if (config.getConfigs().isEmpty()) {
            errors.add("configs: must specify at least one color configuration");
        }
        Set<RepertoireColor> seen = EnumSet.noneOf(RepertoireColor.class);
        for (int i = 0; i < config.getConfigs().size(); i++) {
            ColorConfig color = config.getConfigs().get(i);
            String where = "configs[" + i + "]";
            if (color.getColor() == null) {
                errors.add(where + ".color: must be 'white' or 'black'");
            } else if (!seen.add(color.getColor())) {
                errors.add(where + ".color: duplicate color configuration '" + color.getColor().key() + "'");
            }
            validateColor(color, where, errors);
        }
        return errors;
    }

    /**
     * Renders any config model object as YAML.
     */
    public String toYaml(Object value) {
        try {
            return yamlMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not render YAML", e);
        }
    }

    private static void validateSource(String source, List<String> errors) {
        if (isBlank(source)) {
            errors.add("source: must not be empty");
            return;
        }
        if (!Files.isRegularFile(Path.of(source))) {
            errors.add("source: file not found: " + source);
        } else if (!source.toLowerCase(Locale.ROOT).endsWith(".pgn")) {
            errors.add("source: must be a PGN file: " + source);
        }
    }

    private static void validateOutput(String output, List<String> errors) {
        if (isBlank(output)) {
            errors.add("output: must not be empty");
            return;
        }
        Path parent = Path.of(output).toAbsolutePath().getParent();
        if (parent != null && !Files.isDirectory(parent)) {
            errors.add("output: directory does not exist: " + parent);
        }
    }

    private static void validateColor(ColorConfig color, String where, List<String> errors) {
        boolean hasSkip = !isBlank(color.getSkip());
        boolean hasInclude = !isBlank(color.getInclude());
        if (color.getGames().isEmpty() && !hasSkip && !hasInclude) {
            errors.add(where + ": must specify 'games', 'skip' or 'include'");
        }
        if (hasSkip && hasInclude) {
            errors.add(where + ": cannot use both 'skip' and 'include'");
        }
        validateRange(color.getSkip(), where + ".skip", errors);
        validateRange(color.getInclude(), where + ".include", errors);

        if (color.getSettings().getMinDepth() < 0) {
            errors.add(where + ".settings.min_depth: must be >= 0");
        }

        for (int g = 0; g < color.getGames().size(); g++) {
            validateGame(color.getGames().get(g), where + ".games[" + g + "]", errors);
        }
        for (int p = 0; p < color.getPlanComments().size(); p++) {
            PlanComment plan = color.getPlanComments().get(p);
            String at = where + ".plan_comments[" + p + "]";
            if (isBlank(plan.getVariation())) {
                errors.add(at + ".variation: must not be empty");
            }
            if (plan.getComment() == null) {
                errors.add(at + ".comment: is required");
            }
            if (plan.getAtMove() != null && plan.getAtMove() < 1) {
                errors.add(at + ".at_move: must be >= 1");
            }
        }
    }

    private static void validateGame(GameConfig game, String where, List<String> errors) {
        if (game.getIndex() < 1) {
            errors.add(where + ".index: must be >= 1");
        }
        if (game.getAction() == null) {
            errors.add(where + ".action: must be include, skip or skip_keep_headers");
        }
        if (game.getMaxDepth() != null && game.getMaxDepth() < 1) {
            errors.add(where + ".max_depth: must be >= 1");
        }
        if (game.getMinDepth() != null && game.getMinDepth() < 0) {
            errors.add(where + ".min_depth: must be >= 0");
        }
        validateEntries(game.getRemoveVariations(), where + ".remove_variations", errors);
        validateEntries(game.getAddVariations(), where + ".add_variations", errors);
        validateEntries(game.getSkipVariations(), where + ".skip_variations", errors);
        validateEntries(game.getKeepVariations(), where + ".keep_variations", errors);
    }

    private static void validateEntries(List<VariationEntry> entries, String where, List<String> errors) {
        for (int i = 0; i < entries.size(); i++) {
            if (isBlank(entries.get(i).getMoves())) {
                errors.add(where + "[" + i + "].moves: move sequence cannot be empty");
            }
            if (entries.get(i).getDepth() != null && entries.get(i).getDepth() < 1) {
                errors.add(where + "[" + i + "].depth: must be >= 1");
            }
        }
    }

    private static void validateRange(String range, String where, List<String> errors) {
        if (isBlank(range)) {
            return;
        }
        try {
            RangeParser.parse(range);
        } catch (IllegalArgumentException e) {
            errors.add(where + ": " + e.getMessage());
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
