package chess.curator.pgn;

import chess.curator.game.MoveSequence;
import chess.curator.game.MoveTree;
import chess.curator.game.PgnGame;
import java.io.IOException;
import java.io.Reader;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Reads multi-game PGN text into {@link PgnGame} instances.
 *
 * <p>Supported syntax: tag pairs, move numbers ({@code 1.}, {@code 1...}), SAN moves, nested
 * {@code ( )} variations, brace and semicolon comments, {@code $n} NAGs, the suffix glyphs
 * {@code ! ? !! ?? !? ?!} (stored as NAGs 1-6), {@code %} escape lines and the four result tokens.
 *
 * <p>A variation is an alternative to the move just played, so it becomes a later sibling of that
 * move. When a variation repeats a move that already exists at that point, the existing node is
 * reused so every node has children with distinct moves.
 */
@Component
public class PgnReader {

    private static final Logger log = LoggerFactory.getLogger(PgnReader.class);

    private static final Map<String, Integer> GLYPH_NAGS =
            Map.of("!", 1, "?", 2, "!!", 3, "??", 4, "!?", 5, "?!", 6);
    private static final Set<String> RESULTS = Set.of("1-0", "0-1", "1/2-1/2", "*");
    private static final Pattern MOVE_NUMBER = Pattern.compile("^\\d+\\.+");
    private static final String WORD_DELIMITERS = "(){}[];$";

    private final MoveValidator validator;

    public PgnReader() {
        this(new SanMoveValidator());
    }

    @Autowired
    public PgnReader(MoveValidator validator) {
        this.validator = validator;
    }

    /**
     * Reads every game of a UTF-8 PGN file.
     */
    public List<PgnGame> readFile(Path path) throws IOException {
        List<PgnGame> games = read(Files.readString(path, StandardCharsets.UTF_8));
        if (log.isDebugEnabled()) {
            log.debug("Read {} game(s) from {}", games.size(), path);
        }
        return games;
    }

    /**
     * Reads every game from a character stream. The reader is consumed but not closed.
     */
    public List<PgnGame> readAll(Reader in) throws IOException {
        StringWriter text = new StringWriter();
        in.transferTo(text);
        return read(text.toString());
    }

    /**
     * Reads every game contained in {@code text}.
     *
     * @throws PgnParseException on malformed input or a rejected move
     */
    public List<PgnGame> read(String text) {
        List<PgnGame> games = new ArrayList<>();
        Lexer lexer = new Lexer(text);
        GameAssembler game = new GameAssembler(1);

        for (Token token = lexer.next(game.number); token.type != TokenType.EOF; token = lexer.next(game.number)) {
            if (token.type == TokenType.TAG) {
                if (game.movetextStarted) {
                    games.add(game.finish());
                    game = new GameAssembler(games.size() + 1);
                }
                game.headers.put(token.text, token.value);
                continue;
            }
            game.movetextStarted = true;
            switch (token.type) {
                case COMMENT -> game.comment(token.text);
                case OPEN -> game.openVariation();
                case CLOSE -> game.closeVariation();
                case NAG -> game.nag(token.text);
                case WORD -> {
                    if (game.word(token.text)) {
                        games.add(game.finish());
                        game = new GameAssembler(games.size() + 1);
                    }
                }
                default -> throw new PgnParseException(game.number, token.text, "unexpected token");
            }
        }
        if (game.movetextStarted || !game.headers.isEmpty()) {
            games.add(game.finish());
        }
        return games;
    }

    /**
     * Collects the tags and moves of the game currently being read.
     */
    private final class GameAssembler {
        private final int number;
        private final Map<String, String> headers = new LinkedHashMap<>();
        private final MoveTree.Builder tree = MoveTree.builder();
        private final Deque<Integer> variations = new ArrayDeque<>();
        private int cursor = MoveTree.ROOT;
        private boolean movetextStarted;
        private boolean variationStart;
        private String pendingComment;

        GameAssembler(int number) {
            this.number = number;
        }

        void comment(String text) {
            String trimmed = text.trim();
            if (trimmed.isEmpty()) {
                return;
            }
            if (variationStart) {
                pendingComment = join(pendingComment, trimmed);
            } else {
                tree.setComment(cursor, join(tree.comment(cursor), trimmed));
            }
        }

        void openVariation() {
            if (cursor == MoveTree.ROOT) {
                throw new PgnParseException(number, "(", "variation before any move");
            }
            variations.push(cursor);
            cursor = tree.parent(cursor);
            variationStart = true;
            pendingComment = null;
        }

        void closeVariation() {
            if (variations.isEmpty()) {
                throw new PgnParseException(number, ")", "unbalanced variation end");
            }
            cursor = variations.pop();
            variationStart = false;
            pendingComment = null;
        }

        void nag(String digits) {
            // at most three digits keeps parseInt in range before the 255 check
            if (digits.length() > 3 || Integer.parseInt(digits) > 255) {
                throw new PgnParseException(number, "$" + digits, "NAG out of range");
            }
            tree.addNag(cursor, Integer.parseInt(digits));
        }

        /**
         * Handles a move, move number, glyph or result token.
         *
         * @return true when the token terminated the game
         */
        boolean word(String word) {
            if (RESULTS.contains(word)) {
                if (!variations.isEmpty()) {
                    throw new PgnParseException(number, word, "result inside a variation");
                }
                headers.putIfAbsent("Result", word);
                return true;
            }
            String stripped = MOVE_NUMBER.matcher(word).replaceFirst("");
            if (stripped.isEmpty()) {
                return false;
            }
            String glyph = MoveSequence.annotationSuffix(stripped);
            String move = MoveSequence.canonicalToken(stripped);
            if (move.isEmpty()) {
                applyGlyph(glyph, stripped);
                return false;
            }

            int ply = tree.depth(cursor) + 1;
            String reason = validator.reject(move, ply);
            if (reason != null) {
                throw new PgnParseException(number, stripped, reason + " at ply " + ply);
            }

            int child = tree.childWithMove(cursor, move);
            if (child == MoveTree.NONE) {
                child = tree.addChild(cursor, move);
            }
            cursor = child;
            if (pendingComment != null) {
                tree.setComment(cursor, join(tree.comment(cursor), pendingComment));
                pendingComment = null;
            }
            variationStart = false;
            applyGlyph(glyph, stripped);
            return false;
        }

        PgnGame finish() {
            if (!variations.isEmpty()) {
                throw new PgnParseException(number, null, "unterminated variation");
            }
            return new PgnGame(headers, tree.build());
        }

        private void applyGlyph(String glyph, String word) {
            if (glyph.isEmpty()) {
                return;
            }
            Integer code = GLYPH_NAGS.get(glyph);
            if (code == null) {
                throw new PgnParseException(number, word, "unknown annotation glyph");
            }
            tree.addNag(cursor, code);
        }

        private String join(String existing, String addition) {
            return existing == null ? addition : existing + " " + addition;
        }
    }

    private enum TokenType {
        TAG,
        COMMENT,
        OPEN,
        CLOSE,
        NAG,
        WORD,
        EOF
    }

    private record Token(TokenType type, String text, String value) {
        static Token of(TokenType type, String text) {
            return new Token(type, text, null);
        }
    }

    /**
     * Splits PGN text into tags, comments, parentheses, NAGs and whitespace-delimited words.
     */
    private static final class Lexer {
        private final String text;
        private int pos;

        Lexer(String text) {
            this.text = text == null ? "" : text;
        }

        Token next(int gameNumber) {
            while (pos < text.length()) {
                char c = text.charAt(pos);
                if (Character.isWhitespace(c)) {
                    pos++;
                } else if (c == '%' && (pos == 0 || text.charAt(pos - 1) == '\n')) {
                    skipLine();
                } else {
                    break;
                }
            }
            if (pos >= text.length()) {
                return Token.of(TokenType.EOF, null);
            }

            char c = text.charAt(pos);
            switch (c) {
                case '[':
                    return tag(gameNumber);
                case '{': {
                    int end = text.indexOf('}', pos + 1);
                    if (end < 0) {
                        throw new PgnParseException(gameNumber, null, "unterminated comment");
                    }
                    String comment = text.substring(pos + 1, end);
                    pos = end + 1;
                    return Token.of(TokenType.COMMENT, comment.replaceAll("\\s+", " "));
                }
                case ';': {
                    int start = pos + 1;
                    skipLine();
                    return Token.of(TokenType.COMMENT, text.substring(start, pos).trim());
                }
                case '(':
                    pos++;
                    return Token.of(TokenType.OPEN, "(");
                case ')':
                    pos++;
                    return Token.of(TokenType.CLOSE, ")");
                case '$': {
                    int start = ++pos;
                    while (pos < text.length() && Character.isDigit(text.charAt(pos))) {
                        pos++;
                    }
                    if (start == pos) {
                        throw new PgnParseException(gameNumber, "$", "NAG without a number");
                    }
                    return Token.of(TokenType.NAG, text.substring(start, pos));
                }
                default: {
                    int start = pos;
                    while (pos < text.length()
                            && !Character.isWhitespace(text.charAt(pos))
                            && WORD_DELIMITERS.indexOf(text.charAt(pos)) < 0) {
                        pos++;
                    }
                    return Token.of(TokenType.WORD, text.substring(start, pos));
                }
            }
        }

        private Token tag(int gameNumber) {
            pos++;
            skipSpaces();
            int nameStart = pos;
            while (pos < text.length()
                    && !Character.isWhitespace(text.charAt(pos))
                    && text.charAt(pos) != '"'
                    && text.charAt(pos) != ']') {
                pos++;
            }
            String name = text.substring(nameStart, pos);
            skipSpaces();
            if (name.isEmpty() || pos >= text.length() || text.charAt(pos) != '"') {
                throw new PgnParseException(gameNumber, name, "malformed tag pair");
            }
            pos++;
            StringBuilder value = new StringBuilder();
            while (pos < text.length() && text.charAt(pos) != '"') {
                char c = text.charAt(pos);
                if (c == '\\' && pos + 1 < text.length()) {
                    pos++;
                    c = text.charAt(pos);
                }
                value.append(c);
                pos++;
            }
            if (pos >= text.length()) {
                throw new PgnParseException(gameNumber, name, "unterminated tag value");
            }
            pos++;
            skipSpaces();
            if (pos >= text.length() || text.charAt(pos) != ']') {
                throw new PgnParseException(gameNumber, name, "malformed tag pair");
            }
            pos++;
            return new Token(TokenType.TAG, name, value.toString());
        }

        private void skipSpaces() {
            while (pos < text.length() && (text.charAt(pos) == ' ' || text.charAt(pos) == '\t')) {
                pos++;
            }
        }

        private void skipLine() {
            while (pos < text.length() && text.charAt(pos) != '\n') {
                pos++;
            }
        }
    }
}
