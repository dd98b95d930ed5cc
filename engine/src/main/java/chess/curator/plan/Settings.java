package chess.curator.plan;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Output settings shared by every game of one color.
 */
public class Settings {

    @JsonProperty("min_depth")
    private int minDepth = 0;

    @JsonProperty("preserve_comments")
    private boolean preserveComments = true;

    @JsonProperty("preserve_headers")
    private boolean preserveHeaders = true;

    @JsonProperty("add_curation_comment")
    private boolean addCurationComment = true;

    @JsonProperty("remove_empty_games")
    private boolean removeEmptyGames = false;

    public int getMinDepth() {
        return minDepth;
    }

    public void setMinDepth(int minDepth) {
        this.minDepth = minDepth;
    }

    public boolean isPreserveComments() {
        return preserveComments;
    }

    public void setPreserveComments(boolean preserveComments) {
        this.preserveComments = preserveComments;
    }

    public boolean isPreserveHeaders() {
        return preserveHeaders;
    }

    public void setPreserveHeaders(boolean preserveHeaders) {
        this.preserveHeaders = preserveHeaders;
    }

    public boolean isAddCurationComment() {
        return addCurationComment;
    }

    public void setAddCurationComment(boolean addCurationComment) {
        this.addCurationComment = addCurationComment;
    }

    public boolean isRemoveEmptyGames() {
        return removeEmptyGames;
    }

    public void setRemoveEmptyGames(boolean removeEmptyGames) {
        this.removeEmptyGames = removeEmptyGames;
    }
}
