package chess.curator.plan;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * What the builder does with one source game.
 */
public enum GameAction {

    /** Filter the game and write it. */
    @JsonProperty("include")
    INCLUDE,

    /** Leave the game out entirely. */
    @JsonProperty("skip")
    SKIP,

    /** Write the tag pairs with an empty move tree. */
    @JsonProperty("skip_keep_headers")
    SKIP_KEEP_HEADERS,
}
