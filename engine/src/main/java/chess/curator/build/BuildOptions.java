package chess.curator.build;

/**
 * Run-time switches for one build.
 *
 * @param depth move pairs per variation when a game sets no {@code max_depth}; also part of the output file names
 * @param dryRun compute everything but write no files
 * @param split write every output game to its own file
 * @param strictFilters fail a game when one of its instructions does not resolve
 */
public record BuildOptions(int depth, boolean dryRun, boolean split, boolean strictFilters) {

    public BuildOptions {
        if (depth < 1) {
            throw new IllegalArgumentException("depth must be at least 1, got " + depth);
        }
    }
}
