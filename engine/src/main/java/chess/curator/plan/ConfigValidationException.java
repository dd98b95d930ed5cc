package chess.curator.plan;

import java.util.List;

/**
 * A curation config failed to load or validate. Holds one message per problem found.
 */
public class ConfigValidationException extends IllegalArgumentException {

    private final List<String> errors;

    public ConfigValidationException(String source, List<String> errors) {
        super("Config validation failed for " + source + ":\n  " + String.join("\n  ", errors));
        this.errors = List.copyOf(errors);
    }

    public ConfigValidationException(String source, String error, Throwable cause) {
        super("Config validation failed for " + source + ":\n  " + error, cause);
        this.errors = List.of(error);
    }

    public List<String> getErrors() {
        return errors;
    }
}
