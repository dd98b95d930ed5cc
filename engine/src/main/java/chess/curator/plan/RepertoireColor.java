package chess.curator.plan;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * Side a repertoire is prepared for. The side determines the default ply depth: a white
 * repertoire ends on a white move, a black one on a black move.
 */
public enum RepertoireColor {
    WHITE("White"),
    BLACK("Black");

    private final String header;

    RepertoireColor(String header) {
        this.header = header;
    }

    /**
     * Maximum ply depth for {@code depth} move pairs: {@code 2*depth+1} for white, {@code 2*depth} for black.
     */
    public int maxDepth(int depth) {
        return this == WHITE ? 2 * depth + 1 : 2 * depth;
    }

    /**
     * PGN tag naming the player of this side, used for display names.
     */
    public String header() {
        return header;
    }

    @JsonValue
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parses {@code white} or {@code black}, case-insensitively.
     *
     * @throws IllegalArgumentException for any other value
     */
    @JsonCreator
    public static RepertoireColor fromKey(String key) {
        if (key != null) {
            for (RepertoireColor color : values()) {
                if (color.key().equalsIgnoreCase(key.trim())) {
                    return color;
                }
            }
        }
        throw new IllegalArgumentException("Color must be 'white' or 'black', got '" + key + "'");
    }
}
