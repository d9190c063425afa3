package org.example.formula.version;

import java.util.Objects;

/**
 * A single version bound such as {@code >= "1.0.0"}, optionally negated as in {@code ! (< "2.5.0")}.
 */
public final class Constraint {

    private final Comparator comparator;
    private final Version version;
    private final boolean negated;

    public Constraint(Comparator comparator, Version version, boolean negated) {
        this.comparator = Objects.requireNonNull(comparator, "comparator cannot be null");
        this.version = Objects.requireNonNull(version, "version cannot be null");
        this.negated = negated;
    }

    public static Constraint of(Comparator comparator, Version version) {
        return new Constraint(comparator, version, false);
    }

    public Comparator getComparator() {
        return comparator;
    }

    public Version getVersion() {
        return version;
    }

    public boolean isNegated() {
        return negated;
    }

    /**
     * Returns the same bound with the negation flipped.
     */
    public Constraint negate() {
        return new Constraint(comparator, version, !negated);
    }

    /**
     * Tests whether a candidate version satisfies this constraint.
     */
    public boolean holds(Version candidate) {
        return comparator.test(candidate.compareTo(version)) != negated;
    }

    /**
     * Returns the canonical text, e.g. {@code >= "1.0.0"} or {@code ! (< "2.5.0")}.
     */
    public String toText() {
        String bound = comparator.getSymbol() + " \"" + version + "\"";
        return negated ? "! (" + bound + ")" : bound;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Constraint that = (Constraint) o;
        return negated == that.negated &&
               comparator == that.comparator &&
               version.equals(that.version);
    }

    @Override
    public int hashCode() {
        return Objects.hash(comparator, version, negated);
    }

    @Override
    public String toString() {
        return toText();
    }
}
