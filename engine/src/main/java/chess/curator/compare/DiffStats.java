package chess.curator.compare;

/**
 * Variation counts of one comparison.
 *
 * @param baselineVariations variations in the baseline tree
 * @param targetVariations variations in the target tree
 * @param toRemove baseline variations absent from the target
 * @param toAdd target variations absent from the baseline once removals are applied
 */
public record DiffStats(int baselineVariations, int targetVariations, int toRemove, int toAdd) {
}
