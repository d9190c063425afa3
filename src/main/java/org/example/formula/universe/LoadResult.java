package org.example.formula.universe;

import java.util.List;

/**
 * Outcome of loading package metadata: the universe built from the valid entries and
 * the entries that were rejected.
 */
public class LoadResult {

    private final PackageUniverse universe;
    private final List<RejectedEntry> rejected;

    public LoadResult(PackageUniverse universe, List<RejectedEntry> rejected) {
        this.universe = universe;
        this.rejected = List.copyOf(rejected);
    }

    public PackageUniverse getUniverse() {
        return universe;
    }

    public List<RejectedEntry> getRejected() {
        return rejected;
    }

    public boolean hasRejections() {
        return !rejected.isEmpty();
    }

    @Override
    public String toString() {
        return String.format("LoadResult{packages=%d, releases=%d, rejected=%d}",
                universe.getPackageCount(), universe.getReleaseCount(), rejected.size());
    }

    /**
     * An entry that could not be loaded, with the reason.
     */
    public record RejectedEntry(PackageEntry entry, Exception error) {

        public String getMessage() {
            return error.getMessage();
        }
    }
}
