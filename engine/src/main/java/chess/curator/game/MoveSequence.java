package chess.curator.game;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Conversion between move-sequence strings and move token lists.
 *
 * <p>The canonical form numbers every white ply and separates plies with single spaces,
 * for example {@code 1.e4 c5 2.Nf3 d6}. Parsing is lenient about the input shape: it accepts
 * {@code 1. e4}, {@code 1...c5}, missing move numbers and trailing annotation glyphs.
 */
public final class MoveSequence {

    private static final Pattern MOVE_NUMBER = Pattern.compile("^\\d+\\.+");
    private static final Pattern ANNOTATION_SUFFIX = Pattern.compile("[!?]+$");
    private static final Pattern CHECK_SUFFIX = Pattern.compile("[+#]+$");
    private static final Pattern SAN = Pattern.compile(
            "^(?:"
                    + "[NBRQK][a-h]?[1-8]?x?[a-h][1-8]"
                    + "|[a-h][1-8](?:=?[NBRQ])?"
                    + "|[a-h]x[a-h][1-8](?:=?[NBRQ])?"
                    + "|O-O-O|O-O"
                    + ")[+#]?$");

    private MoveSequence() {
    }

    /**
     * Splits a move-sequence string into canonical move tokens.
     *
     * @throws IllegalArgumentException if the string is null, holds no moves or holds a token
     *         that is not well-formed SAN
     */
    public static List<String> parse(String sequence) {
        if (sequence == null) {
            throw new IllegalArgumentException("Move sequence cannot be null");
        }
        List<String> moves = new ArrayList<>();
        for (String raw : sequence.trim().split("\\s+")) {
            String token = MOVE_NUMBER.matcher(raw).replaceFirst("");
            if (token.isEmpty()) {
                continue;
            }
            String move = canonicalToken(token);
            if (!isSan(move)) {
                throw new IllegalArgumentException("Not a SAN move: '" + raw + "' in '" + sequence + "'");
            }
            moves.add(move);
        }
        if (moves.isEmpty()) {
            throw new IllegalArgumentException("Move sequence cannot be empty: '" + sequence + "'");
        }
        return List.copyOf(moves);
    }

    /**
     * Renders move tokens in canonical numbered form. The first token is white's first move.
     */
    public static String format(List<String> moves) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < moves.size(); i++) {
            if (i > 0) {
                sb.append(' ');
            }
            if (i % 2 == 0) {
                sb.append(i / 2 + 1).append('.');
            }
            sb.append(moves.get(i));
        }
        return sb.toString();
    }

    /**
     * Syntactic SAN check of a canonical token. Does not replay the move on a board.
     */
    public static boolean isSan(String token) {
        return token != null && SAN.matcher(token).matches();
    }

    /**
     * Normalises a single SAN token: drops annotation glyphs and maps zero-castling to letter-O.
     */
    public static String canonicalToken(String token) {
        String t = ANNOTATION_SUFFIX.matcher(token.trim()).replaceFirst("");
        if (t.startsWith("0-0-0")) {
            return "O-O-O" + t.substring(5);
        }
        if (t.startsWith("0-0")) {
            return "O-O" + t.substring(3);
        }
        return t;
    }

    /**
     * Key under which two tokens name the same move: the token without its check or mate marker.
     * {@code Qxf7}, {@code Qxf7+} and {@code Qxf7#} share one key.
     */
    public static String matchKey(String token) {
        return CHECK_SUFFIX.matcher(token).replaceFirst("");
    }

    public static boolean sameMove(String a, String b) {
        return matchKey(a).equals(matchKey(b));
    }

    /**
     * Returns the annotation glyph suffix of a token ({@code !}, {@code ?!}, ...), or an empty string.
     */
    public static String annotationSuffix(String token) {
        var matcher = ANNOTATION_SUFFIX.matcher(token.trim());
        return matcher.find() ? matcher.group() : "";
    }
}
