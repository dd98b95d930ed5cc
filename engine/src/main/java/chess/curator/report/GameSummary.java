package chess.curator.report;

import java.util.List;
import java.util.Map;

/**
 * Structure figures of one game in a PGN file.
 *
 * @param index 1-based position in the file
 * @param name White tag, or {@code Game <index>}
 * @param headers every tag pair in file order
 * @param openingMoves first plies of the main line, formatted as a move sequence
 * @param variations variation strings; empty unless they were asked for
 */
public record GameSummary(
        int index,
        String name,
        Map<String, String> headers,
        int variationCount,
        double averageDepth,
        int maxDepth,
        String openingMoves,
        List<String> variations) {

    public String eco() {
        return headers.getOrDefault("ECO", "?");
    }
}
