package chess.curator.pgn;

/**
 * Malformed PGN text or a move token rejected by the {@link MoveValidator}.
 */
public class PgnParseException extends IllegalArgumentException {

    private final int gameNumber;
    private final String token;

    public PgnParseException(int gameNumber, String token, String message) {
        super("Game " + gameNumber + ": " + message + (token == null ? "" : " ('" + token + "')"));
        this.gameNumber = gameNumber;
        this.token = token;
    }

    /**
     * 1-based index of the game being read when the error occurred.
     */
    public int getGameNumber() {
        return gameNumber;
    }

    /**
     * Offending token, or null when the error is structural.
     */
    public String getToken() {
        return token;
    }
}
