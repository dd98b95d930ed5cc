package chess.curator.pgn;

import chess.curator.game.MoveSequence;
import org.springframework.stereotype.Component;

/**
 * Syntactic Standard Algebraic Notation check.
 *
 * <p>Accepts piece moves with optional disambiguation and capture, pawn pushes and captures with
 * optional promotion, and both castling forms, each optionally followed by {@code +} or {@code #}.
 * It does not replay moves on a board, so a well-formed but illegal move passes.
 */
@Component
public class SanMoveValidator implements MoveValidator {

    @Override
    public String reject(String token, int ply) {
        if (token == null || token.isEmpty()) {
            return "empty move";
        }
        if (!MoveSequence.isSan(token)) {
            return "not a SAN move";
        }
        return null;
    }
}
