package chess.curator.build;

import chess.curator.plan.RepertoireColor;
import chess.curator.tree.UnresolvedEntry;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Build outcome for one repertoire color.
 */
public class ColorBuildStats {

    /**
     * An instruction of a given game that did not resolve.
     */
    public record GameUnmatched(int gameIndex, UnresolvedEntry entry) {
    }

    private final RepertoireColor color;
    private int outputGames;
    private int outputVariations;
    private double outputAvgDepth;
    private long outputSize;
    private final List<String> outputFiles = new ArrayList<>();
    private final List<GameStats> gameStats = new ArrayList<>();
    private final List<GameUnmatched> unmatched = new ArrayList<>();
    private final List<String> failedGames = new ArrayList<>();
    private final List<String> unmatchedPlanComments = new ArrayList<>();

    public ColorBuildStats(RepertoireColor color) {
        this.color = color;
    }

    public RepertoireColor getColor() {
        return color;
    }

    public int getOutputGames() {
        return outputGames;
    }

    void setOutputGames(int outputGames) {
        this.outputGames = outputGames;
    }

    public int getOutputVariations() {
        return outputVariations;
    }

    void setOutputVariations(int outputVariations) {
        this.outputVariations = outputVariations;
    }

    public double getOutputAvgDepth() {
        return outputAvgDepth;
    }

    void setOutputAvgDepth(double outputAvgDepth) {
        this.outputAvgDepth = outputAvgDepth;
    }

    public long getOutputSize() {
        return outputSize;
    }

    void addOutputSize(long bytes) {
        this.outputSize += bytes;
    }

    public List<String> getOutputFiles() {
        return Collections.unmodifiableList(outputFiles);
    }

    void addOutputFile(String file) {
        outputFiles.add(file);
    }

    public List<GameStats> getGameStats() {
        return Collections.unmodifiableList(gameStats);
    }

    void addGameStats(GameStats stats) {
        gameStats.add(stats);
    }

    public List<GameUnmatched> getUnmatched() {
        return Collections.unmodifiableList(unmatched);
    }

    void addUnmatched(int gameIndex, List<UnresolvedEntry> entries) {
        for (UnresolvedEntry entry : entries) {
            unmatched.add(new GameUnmatched(gameIndex, entry));
        }
    }

    /**
     * One message per game that could not be curated.
     */
    public List<String> getFailedGames() {
        return Collections.unmodifiableList(failedGames);
    }

    void addFailedGame(String message) {
        failedGames.add(message);
    }

    /**
     * Variations of plan comments that resolved in none of the color's games.
     */
    public List<String> getUnmatchedPlanComments() {
        return Collections.unmodifiableList(unmatchedPlanComments);
    }

    void addUnmatchedPlanComment(String variation) {
        unmatchedPlanComments.add(variation);
    }
}
