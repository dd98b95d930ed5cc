package chess.curator.pgn;

/**
 * Decides whether a move token may enter a move tree.
 *
 * <p>The curation engine treats moves as opaque canonical tokens. Implementations may be purely
 * syntactic or may replay moves on a board; the reader only needs a yes/no answer and a reason.
 */
@FunctionalInterface
public interface MoveValidator {

    /**
     * Validates a canonical SAN token.
     *
     * @param token canonical token with annotation glyphs already removed
     * @param ply 1-based ply the token would occupy
     * @return null when the token is acceptable, otherwise a short explanation
     */
    String reject(String token, int ply);
}
