package chess.curator.cli;

/**
 * Bad command line: unknown command, missing argument or malformed option value.
 */
public class UsageException extends IllegalArgumentException {

    public UsageException(String message) {
        super(message);
    }
}
