package chess.curator.tree;

import java.util.Set;
import java.util.TreeSet;

/**
 * A computed prefix set does not reproduce its target set. This is a defect, never bad input.
 */
public class CoverageInvariantViolation extends IllegalStateException {

    public CoverageInvariantViolation(String context, Set<String> expected, Set<String> actual) {
        super(context + ": expected " + expected.size() + " variation(s), got " + actual.size()
                + "; missing " + difference(expected, actual) + ", extra " + difference(actual, expected));
    }

    private static Set<String> difference(Set<String> a, Set<String> b) {
        Set<String> diff = new TreeSet<>(a);
        diff.removeAll(b);
        return diff;
    }
}
