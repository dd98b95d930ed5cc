package chess.curator.game;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One game of a PGN file: its tag pairs and its move tree.
 */
public final class PgnGame {

    /** The Seven Tag Roster, in export order. */
    public static final List<String> SEVEN_TAG_ROSTER =
            List.of("Event", "Site", "Date", "Round", "White", "Black", "Result");

    private final Map<String, String> headers;
    private final MoveTree tree;

    public PgnGame(Map<String, String> headers, MoveTree tree) {
        this.headers = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(headers, "headers")));
        this.tree = Objects.requireNonNull(tree, "tree");
    }

    /**
     * Tag pairs in file order.
     */
    public Map<String, String> headers() {
        return headers;
    }

    public String header(String key) {
        return headers.get(key);
    }

    public MoveTree tree() {
        return tree;
    }

    /**
     * Termination marker from the Result tag, or {@code *} when unknown.
     */
    public String result() {
        return headers.getOrDefault("Result", "*");
    }

    public PgnGame withTree(MoveTree newTree) {
        return new PgnGame(headers, newTree);
    }

    public PgnGame withHeaders(Map<String, String> newHeaders) {
        return new PgnGame(newHeaders, tree);
    }

    /**
     * Copy with one tag added or replaced.
     */
    public PgnGame withHeader(String key, String value) {
        Map<String, String> copy = new LinkedHashMap<>(headers);
        copy.put(key, value);
        return new PgnGame(copy, tree);
    }

    /**
     * Display name taken from a header, falling back to {@code Game <index>}.
     */
    public String displayName(String headerKey, int index) {
        String value = headers.get(headerKey);
        if (value == null || value.isBlank() || value.equals("?")) {
            return "Game " + index;
        }
        return value;
    }
}
