package chess.curator.build;

/**
 * Variation counts of one written game, before and after curation.
 */
public record GameStats(int index, String name, int variationsBefore, int variationsAfter) {
}
