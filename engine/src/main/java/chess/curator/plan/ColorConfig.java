package chess.curator.plan;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Curation rules for one repertoire color.
 *
 * <p>Games are selected either through a detailed {@code games} list, through one of the
 * {@code skip}/{@code include} range shorthands, or both. With a shorthand every source game gets an
 * entry and detailed entries override the shorthand for their index.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class ColorConfig {
    private RepertoireColor color;
    private Settings settings = new Settings();
    private List<GameConfig> games = new ArrayList<>();
    private String skip;
    private String include;

    @JsonProperty("plan_comments")
    private List<PlanComment> planComments = new ArrayList<>();

    public ColorConfig() {
    }

    public ColorConfig(RepertoireColor color) {
        this.color = color;
    }

    /**
     * The game configs to process, in source order when a shorthand is used and in listed order
     * otherwise.
     *
     * @param totalGames number of games in the source file
     * @throws IllegalArgumentException if a shorthand range is malformed
     */
    public List<GameConfig> resolveGames(int totalGames) {
        boolean useSkip = skip != null && !skip.isBlank();
        boolean useInclude = include != null && !include.isBlank();
        if (!useSkip && !useInclude) {
            return List.copyOf(games);
        }

        Set<Integer> listed;
        try {
            listed = RangeParser.parse(useSkip ? skip : include);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(
                    "Color '" + key() + "': Invalid '" + (useSkip ? "skip" : "include") + "' syntax: " + e.getMessage(), e);
        }

        Map<Integer, GameConfig> detailed = new LinkedHashMap<>();
        for (GameConfig game : games) {
            detailed.put(game.getIndex(), game);
        }
        List<GameConfig> resolved = new ArrayList<>(totalGames);
        for (int index = 1; index <= totalGames; index++) {
            GameConfig game = detailed.get(index);
            if (game == null) {
                boolean included = useSkip != listed.contains(index);
                game = new GameConfig(index, included ? GameAction.INCLUDE : GameAction.SKIP);
            }
            resolved.add(game);
        }
        return resolved;
    }

    private String key() {
        return color == null ? "?" : color.key();
    }

    public RepertoireColor getColor() {
        return color;
    }

    public void setColor(RepertoireColor color) {
        this.color = color;
    }

    public Settings getSettings() {
        return settings;
    }

    public void setSettings(Settings settings) {
        this.settings = settings == null ? new Settings() : settings;
    }

    public List<GameConfig> getGames() {
        return games;
    }

    public void setGames(List<GameConfig> games) {
        this.games = games == null ? new ArrayList<>() : games;
    }

    public String getSkip() {
        return skip;
    }

    public void setSkip(String skip) {
        this.skip = skip;
    }

    public String getInclude() {
        return include;
    }

    public void setInclude(String include) {
        this.include = include;
    }

    public List<PlanComment> getPlanComments() {
        return planComments;
    }

    public void setPlanComments(List<PlanComment> planComments) {
        this.planComments = planComments == null ? new ArrayList<>() : planComments;
    }
}
