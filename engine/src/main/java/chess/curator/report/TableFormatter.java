package chess.curator.report;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders rows of text as a bordered, column-aligned table for console display.
 * <p>
 * Column widths grow to fit the widest cell. Columns flagged as numeric are right-aligned.
 */
public class TableFormatter {
    private final List<String> headers;
    private final boolean[] numeric;
    private final List<List<String>> rows = new ArrayList<>();

    /**
     * @param headers column titles; a title starting with {@code #} marks a right-aligned column,
     *     the marker itself is not printed
     */
    public TableFormatter(String... headers) {
        this.headers = new ArrayList<>();
        this.numeric = new boolean[headers.length];
        for (int i = 0; i < headers.length; i++) {
            numeric[i] = headers[i].startsWith("#");
            this.headers.add(numeric[i] ? headers[i].substring(1) : headers[i]);
        }
    }

    /**
     * Adds a row. Missing trailing cells print empty, extra cells are an error.
     *
     * @throws IllegalArgumentException if the row has more cells than there are columns
     */
    public TableFormatter row(Object... cells) {
        if (cells.length > headers.size()) {
            throw new IllegalArgumentException("Row has " + cells.length + " cells, table has " + headers.size() + " columns");
        }
        List<String> row = new ArrayList<>();
        for (int i = 0; i < headers.size(); i++) {
            row.add(i < cells.length && cells[i] != null ? cells[i].toString() : "");
        }
        rows.add(row);
        return this;
    }

    public String format() {
        int[] widths = new int[headers.size()];
        for (int i = 0; i < widths.length; i++) {
            widths[i] = headers.get(i).length();
            for (List<String> row : rows) {
                widths[i] = Math.max(widths[i], row.get(i).length());
            }
        }
        String border = buildBorder(widths);
        StringBuilder sb = new StringBuilder();
        sb.append(border).append('\n');
        appendRow(sb, headers, widths);
        sb.append(border).append('\n');
        for (List<String> row : rows) {
            appendRow(sb, row, widths);
        }
        sb.append(border).append('\n');
        return sb.toString();
    }

    private void appendRow(StringBuilder sb, List<String> cells, int[] widths) {
        sb.append('|');
        for (int i = 0; i < widths.length; i++) {
            sb.append(' ').append(pad(cells.get(i), widths[i], numeric[i])).append(" |");
        }
        sb.append('\n');
    }

    private static String buildBorder(int[] widths) {
        StringBuilder sb = new StringBuilder("+");
        for (int width : widths) {
            sb.append("-".repeat(width + 2)).append('+');
        }
        return sb.toString();
    }

    private static String pad(String text, int width, boolean right) {
        String fill = " ".repeat(width - text.length());
        return right ? fill + text : text + fill;
    }
}
