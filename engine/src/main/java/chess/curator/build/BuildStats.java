package chess.curator.build;

import chess.curator.plan.RepertoireColor;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Build outcome across all colors, with the input figures for comparison.
 */
public class BuildStats {
    private int inputGames;
    private int inputVariations;
    private double inputAvgDepth;
    private long inputSize;
    private final Map<RepertoireColor, ColorBuildStats> colors = new EnumMap<>(RepertoireColor.class);

    public int getInputGames() {
        return inputGames;
    }

    void setInputGames(int inputGames) {
        this.inputGames = inputGames;
    }

    public int getInputVariations() {
        return inputVariations;
    }

    void setInputVariations(int inputVariations) {
        this.inputVariations = inputVariations;
    }

    public double getInputAvgDepth() {
        return inputAvgDepth;
    }

    void setInputAvgDepth(double inputAvgDepth) {
        this.inputAvgDepth = inputAvgDepth;
    }

    public long getInputSize() {
        return inputSize;
    }

    void setInputSize(long inputSize) {
        this.inputSize = inputSize;
    }

    public Map<RepertoireColor, ColorBuildStats> getColors() {
        return Collections.unmodifiableMap(colors);
    }

    void putColor(ColorBuildStats stats) {
        colors.put(stats.getColor(), stats);
    }

    public int getTotalOutputGames() {
        return colors.values().stream().mapToInt(ColorBuildStats::getOutputGames).sum();
    }

    public int getTotalOutputVariations() {
        return colors.values().stream().mapToInt(ColorBuildStats::getOutputVariations).sum();
    }

    public long getTotalOutputSize() {
        return colors.values().stream().mapToLong(ColorBuildStats::getOutputSize).sum();
    }

    public boolean hasFailures() {
        return colors.values().stream().anyMatch(c -> !c.getFailedGames().isEmpty());
    }
}
