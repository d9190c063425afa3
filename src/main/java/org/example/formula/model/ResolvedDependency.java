package org.example.formula.model;

import java.util.Objects;

/**
 * An edge of a resolved graph: a selected release and one selected release its formula refers to.
 */
public class ResolvedDependency {

    private final PackageVersion source;
    private final PackageVersion target;
    private final int depth;

    /**
     * Creates a new ResolvedDependency.
     *
     * @param source the dependent release
     * @param target the selected dependency
     * @param depth  distance of the source from the root (0 = the root's own formula)
     */
    public ResolvedDependency(PackageVersion source, PackageVersion target, int depth) {
        this.source = Objects.requireNonNull(source, "source cannot be null");
        this.target = Objects.requireNonNull(target, "target cannot be null");
        this.depth = depth;
    }

    public PackageVersion getSource() {
        return source;
    }

    public PackageVersion getTarget() {
        return target;
    }

    public int getDepth() {
        return depth;
    }

    public boolean isDirect() {
        return depth == 0;
    }

    public String getEdgeDescription() {
        return source.getCoordinate() + " -> " + target.getCoordinate() + " (depth=" + depth + ")";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ResolvedDependency that = (ResolvedDependency) o;
        return depth == that.depth &&
               source.equals(that.source) &&
               target.equals(that.target);
    }

    @Override
    public int hashCode() {
        return Objects.hash(source, target, depth);
    }

    @Override
    public String toString() {
        return getEdgeDescription();
    }
}
