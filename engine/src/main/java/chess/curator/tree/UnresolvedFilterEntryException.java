package chess.curator.tree;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Raised when strict filtering is enabled and at least one instruction did not resolve.
 */
public class UnresolvedFilterEntryException extends IllegalStateException {

    private final List<UnresolvedEntry> entries;

    public UnresolvedFilterEntryException(List<UnresolvedEntry> entries) {
        super("Unresolved filter entries: "
                + entries.stream().map(UnresolvedEntry::describe).collect(Collectors.joining("; ")));
        this.entries = List.copyOf(entries);
    }

    public List<UnresolvedEntry> getEntries() {
        return entries;
    }
}
