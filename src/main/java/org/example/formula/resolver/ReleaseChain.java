package org.example.formula.resolver;

import org.example.formula.model.PackageVersion;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Immutable parent-linked list of releases, newest at the head.
 *
 * <p>Used for the commit trail of a search branch and for the dependency path of a goal.
 * Extending a chain allocates one node and shares the rest with every other chain built
 * on the same prefix.</p>
 */
final class ReleaseChain {

    private static final ReleaseChain EMPTY = new ReleaseChain(null, null, 0);

    private final PackageVersion head;
    private final ReleaseChain parent;
    private final int length;

    private ReleaseChain(PackageVersion head, ReleaseChain parent, int length) {
        this.head = head;
        this.parent = parent;
        this.length = length;
    }

    static ReleaseChain empty() {
        return EMPTY;
    }

    ReleaseChain extend(PackageVersion release) {
        return new ReleaseChain(release, this, length + 1);
    }

    boolean isEmpty() {
        return length == 0;
    }

    int length() {
        return length;
    }

    /**
     * Returns the newest release, or null for the empty chain.
     */
    PackageVersion head() {
        return head;
    }

    ReleaseChain parent() {
        return parent;
    }

    /**
     * Returns the releases oldest first.
     */
    List<PackageVersion> toList() {
        List<PackageVersion> releases = new ArrayList<>(length);
        for (ReleaseChain node = this; !node.isEmpty(); node = node.parent) {
            releases.add(node.head);
        }
        Collections.reverse(releases);
        return releases;
    }

    @Override
    public String toString() {
        return toList().toString();
    }
}
