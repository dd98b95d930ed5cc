package chess.curator.plan;

import java.util.Set;
import java.util.TreeSet;

/**
 * Parses game range shorthand such as {@code 1,3,5-10,20} into a sorted set of numbers.
 */
public final class RangeParser {

    private RangeParser() {
    }

    /**
     * @return every listed number, ranges inclusive; empty for a blank string
     * @throws IllegalArgumentException on malformed parts or a descending range
     */
    public static Set<Integer> parse(String ranges) {
        Set<Integer> result = new TreeSet<>();
        if (ranges == null || ranges.isBlank()) {
            return result;
        }
        for (String raw : ranges.split(",")) {
            String part = raw.trim();
            if (part.contains("-")) {
                String[] bounds = part.split("-", -1);
                if (bounds.length != 2) {
                    throw new IllegalArgumentException("Invalid range syntax: '" + part + "'. Expected format: 'start-end'");
                }
                int start = number(bounds[0], part);
                int end = number(bounds[1], part);
                if (start > end) {
                    throw new IllegalArgumentException("Invalid range: " + start + "-" + end + ". Start must be <= end");
                }
                for (int i = start; i <= end; i++) {
                    result.add(i);
                }
            } else {
                result.add(number(part, part));
            }
        }
        return result;
    }

    private static int number(String text, String part) {
        try {
            return Integer.parseInt(text.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid number in '" + part + "'", e);
        }
    }
}
