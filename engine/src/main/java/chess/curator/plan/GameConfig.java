package chess.curator.plan;

import chess.curator.tree.VariationInstruction;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.ArrayList;
import java.util.List;

/**
 * Per-game instructions: what to do with the game and how to filter its variations.
 *
 * <p>{@code skip_variations} and {@code keep_variations} are older names for
 * {@code remove_variations} and {@code add_variations}. A game may use either pair, never both.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class GameConfig {
    private int index;
    private GameAction action = GameAction.INCLUDE;
    private String name;

    @JsonProperty("remove_variations")
    private List<VariationEntry> removeVariations = new ArrayList<>();

    @JsonProperty("add_variations")
    private List<VariationEntry> addVariations = new ArrayList<>();

    @JsonProperty("skip_variations")
    private List<VariationEntry> skipVariations = new ArrayList<>();

    @JsonProperty("keep_variations")
    private List<VariationEntry> keepVariations = new ArrayList<>();

    @JsonProperty("max_depth")
    private Integer maxDepth;

    @JsonProperty("min_depth")
    private Integer minDepth;

    public GameConfig() {
    }

    public GameConfig(int index, GameAction action) {
        this.index = index;
        this.action = action;
    }

    /**
     * Removal instructions from whichever key pair the game uses.
     *
     * @throws ConflictingInstructionException if both key pairs are present
     */
    public List<VariationInstruction> removeInstructions() {
        checkConflicts();
        return instructions(removeVariations.isEmpty() ? skipVariations : removeVariations);
    }

    /**
     * Addition instructions from whichever key pair the game uses.
     *
     * @throws ConflictingInstructionException if both key pairs are present
     */
    public List<VariationInstruction> addInstructions() {
        checkConflicts();
        return instructions(addVariations.isEmpty() ? keepVariations : addVariations);
    }

    public boolean usesLegacyKeys() {
        return !skipVariations.isEmpty() || !keepVariations.isEmpty();
    }

    private void checkConflicts() {
        boolean current = !removeVariations.isEmpty() || !addVariations.isEmpty();
        if (current && usesLegacyKeys()) {
            throw new ConflictingInstructionException(index);
        }
    }

    private static List<VariationInstruction> instructions(List<VariationEntry> entries) {
        List<VariationInstruction> result = new ArrayList<>(entries.size());
        for (VariationEntry entry : entries) {
            result.add(entry.toInstruction());
        }
        return result;
    }

    public int getIndex() {
        return index;
    }

    public void setIndex(int index) {
        this.index = index;
    }

    public GameAction getAction() {
        return action;
    }

    public void setAction(GameAction action) {
        this.action = action;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public List<VariationEntry> getRemoveVariations() {
        return removeVariations;
    }

    public void setRemoveVariations(List<VariationEntry> removeVariations) {
        this.removeVariations = orEmpty(removeVariations);
    }

    public List<VariationEntry> getAddVariations() {
        return addVariations;
    }

    public void setAddVariations(List<VariationEntry> addVariations) {
        this.addVariations = orEmpty(addVariations);
    }

    public List<VariationEntry> getSkipVariations() {
        return skipVariations;
    }

    public void setSkipVariations(List<VariationEntry> skipVariations) {
        this.skipVariations = orEmpty(skipVariations);
    }

    public List<VariationEntry> getKeepVariations() {
        return keepVariations;
    }

    public void setKeepVariations(List<VariationEntry> keepVariations) {
        this.keepVariations = orEmpty(keepVariations);
    }

    public Integer getMaxDepth() {
        return maxDepth;
    }

    public void setMaxDepth(Integer maxDepth) {
        this.maxDepth = maxDepth;
    }

    public Integer getMinDepth() {
        return minDepth;
    }

    public void setMinDepth(Integer minDepth) {
        this.minDepth = minDepth;
    }

    private static List<VariationEntry> orEmpty(List<VariationEntry> entries) {
        return entries == null ? new ArrayList<>() : entries;
    }
}
