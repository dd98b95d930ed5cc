package chess.curator.plan;

/**
 * A game mixes the legacy {@code skip_variations}/{@code keep_variations} keys with
 * {@code remove_variations}/{@code add_variations}. Fatal for that game only.
 */
public class ConflictingInstructionException extends IllegalArgumentException {

    private final int gameIndex;

    public ConflictingInstructionException(int gameIndex) {
        super("Game " + gameIndex + ": cannot combine skip_variations/keep_variations"
                + " with remove_variations/add_variations");
        this.gameIndex = gameIndex;
    }

    public int getGameIndex() {
        return gameIndex;
    }
}
