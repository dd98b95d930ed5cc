package chess.curator.pgn;

import chess.curator.game.MoveTree;
import chess.curator.game.PgnGame;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Renders games as PGN export text: tag pairs, then movetext wrapped at 80 columns.
 *
 * <p>Variations are written right after the mainline move they replace, the mainline then
 * resumes with a {@code N...} move number when black is to move. Comments and NAGs follow the move
 * they belong to.
 */
@Component
public class PgnWriter {

    private static final int LINE_WIDTH = 80;

    /**
     * Writes the games to a UTF-8 file, one blank line between games.
     */
    public void writeFile(List<PgnGame> games, Path path) throws IOException {
        Files.writeString(path, writeAll(games), StandardCharsets.UTF_8);
    }

    public String writeAll(List<PgnGame> games) {
        StringBuilder sb = new StringBuilder();
        for (PgnGame game : games) {
            sb.append(write(game)).append("\n\n");
        }
        return sb.toString();
    }

    /**
     * Renders a single game. The text ends with the result token and no trailing newline.
     */
    public String write(PgnGame game) {
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<String, String> header : game.headers().entrySet()) {
            sb.append('[')
                    .append(header.getKey())
                    .append(" \"")
                    .append(escape(header.getValue()))
                    .append("\"]\n");
        }
        if (!game.headers().isEmpty()) {
            sb.append('\n');
        }

        MoveTree tree = game.tree();
        List<String> tokens = new ArrayList<>();
        if (tree.comment(MoveTree.ROOT) != null) {
            tokens.add(comment(tree.comment(MoveTree.ROOT)));
        }
        for (int nag : tree.nags(MoveTree.ROOT)) {
            tokens.add("$" + nag);
        }
        writeLine(tree, MoveTree.ROOT, false, tokens);
        tokens.add(game.result());

        sb.append(wrap(tokens));
        return sb.toString();
    }

    /**
     * Writes the continuation below {@code node}: its mainline child, the alternatives to that
     * child as variations, then the rest of the mainline.
     */
    private void writeLine(MoveTree tree, int node, boolean forceNumber, List<String> tokens) {
        List<Integer> children = tree.children(node);
        if (children.isEmpty()) {
            return;
        }
        int main = children.get(0);
        writeMove(tree, main, forceNumber, tokens);
        for (int i = 1; i < children.size(); i++) {
            int alternative = children.get(i);
            tokens.add("(");
            writeMove(tree, alternative, true, tokens);
            writeLine(tree, alternative, tree.comment(alternative) != null, tokens);
            tokens.add(")");
        }
        writeLine(tree, main, children.size() > 1 || tree.comment(main) != null, tokens);
    }

    private void writeMove(MoveTree tree, int node, boolean forceNumber, List<String> tokens) {
        int ply = tree.depth(node);
        int moveNumber = (ply + 1) / 2;
        if (ply % 2 == 1) {
            tokens.add(moveNumber + "." + tree.move(node));
        } else if (forceNumber) {
            tokens.add(moveNumber + "..." + tree.move(node));
        } else {
            tokens.add(tree.move(node));
        }
        for (int nag : tree.nags(node)) {
            tokens.add("$" + nag);
        }
        if (tree.comment(node) != null) {
            tokens.add(comment(tree.comment(node)));
        }
    }

    private static String comment(String text) {
        return "{" + text.replace("}", ")") + "}";
    }

    private static String escape(String value) {
        return value.replace("\\", "\\\\").replace("\"", "\\\"");
    }

    /**
     * Glues parentheses to their neighbours and wraps words at {@link #LINE_WIDTH}.
     */
    private static String wrap(List<String> tokens) {
        List<String> words = new ArrayList<>();
        boolean glueNext = false;
        for (String token : tokens) {
            if (token.equals("(")) {
                words.add("(");
                glueNext = true;
            } else if (token.equals(")") && !words.isEmpty()) {
                int last = words.size() - 1;
                words.set(last, words.get(last) + ")");
            } else if (glueNext) {
                int last = words.size() - 1;
                words.set(last, words.get(last) + token);
                glueNext = false;
            } else {
                words.add(token);
            }
        }

        StringBuilder out = new StringBuilder();
        int lineLength = 0;
        for (String word : words) {
            if (lineLength > 0 && lineLength + 1 + word.length() > LINE_WIDTH) {
                out.append('\n');
                lineLength = 0;
            } else if (lineLength > 0) {
                out.append(' ');
                lineLength++;
            }
            out.append(word);
            lineLength += word.length();
        }
        return out.toString();
    }
}
