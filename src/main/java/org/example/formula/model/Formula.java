package org.example.formula.model;

import org.example.formula.version.Constraint;
import org.example.formula.version.Version;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Boolean dependency formula over package references.
 *
 * <p>A formula is one of four shapes identified by its {@link Kind}:</p>
 * <ul>
 *   <li>{@code PACKAGE} - a package name with zero or more version constraints, all of which must hold</li>
 *   <li>{@code AND} - both operands hold</li>
 *   <li>{@code OR} - at least one operand holds, left tried first</li>
 *   <li>{@code NOT} - the operand does not hold</li>
 * </ul>
 *
 * <p>Formulas are immutable and compare structurally.</p>
 */
public final class Formula {

    public enum Kind {
        PACKAGE,
        AND,
        OR,
        NOT
    }

    private final Kind kind;
    private final String name;
    private final List<Constraint> constraints;
    private final Formula left;
    private final Formula right;

    private Formula(Kind kind, String name, List<Constraint> constraints, Formula left, Formula right) {
        this.kind = kind;
        this.name = name;
        this.constraints = constraints;
        this.left = left;
        this.right = right;
    }

    // Factories

    /**
     * Creates a package leaf.
     *
     * @param name        the package name (must not be empty)
     * @param constraints version constraints on the package, combined as a conjunction
     */
    public static Formula pkg(String name, Collection<Constraint> constraints) {
        Objects.requireNonNull(name, "name cannot be null");
        if (name.isEmpty()) {
            throw new IllegalArgumentException("Package name cannot be empty");
        }
        return new Formula(Kind.PACKAGE, name, List.copyOf(constraints), null, null);
    }

    public static Formula pkg(String name, Constraint... constraints) {
        return pkg(name, List.of(constraints));
    }

    public static Formula and(Formula left, Formula right) {
        return new Formula(Kind.AND, null, List.of(),
                Objects.requireNonNull(left, "left cannot be null"),
                Objects.requireNonNull(right, "right cannot be null"));
    }

    public static Formula or(Formula left, Formula right) {
        return new Formula(Kind.OR, null, List.of(),
                Objects.requireNonNull(left, "left cannot be null"),
                Objects.requireNonNull(right, "right cannot be null"));
    }

    public static Formula not(Formula operand) {
        return new Formula(Kind.NOT, null, List.of(),
                Objects.requireNonNull(operand, "operand cannot be null"), null);
    }

    /**
     * Folds formulas into a left-nested conjunction.
     *
     * @return the conjunction, or empty if no formulas were given
     */
    public static Optional<Formula> allOf(List<Formula> formulas) {
        Formula result = null;
        for (Formula formula : formulas) {
            result = result == null ? formula : and(result, formula);
        }
        return Optional.ofNullable(result);
    }

    // Getters

    public Kind getKind() {
        return kind;
    }

    /**
     * Returns the package name of a {@code PACKAGE} leaf.
     */
    public String getName() {
        requireKind(Kind.PACKAGE);
        return name;
    }

    /**
     * Returns the constraints of a {@code PACKAGE} leaf.
     */
    public List<Constraint> getConstraints() {
        requireKind(Kind.PACKAGE);
        return constraints;
    }

    /**
     * Returns the left operand of {@code AND}/{@code OR}.
     */
    public Formula getLeft() {
        if (kind != Kind.AND && kind != Kind.OR) {
            throw new IllegalStateException("Formula of kind " + kind + " has no left operand");
        }
        return left;
    }

    /**
     * Returns the right operand of {@code AND}/{@code OR}.
     */
    public Formula getRight() {
        if (kind != Kind.AND && kind != Kind.OR) {
            throw new IllegalStateException("Formula of kind " + kind + " has no right operand");
        }
        return right;
    }

    /**
     * Returns the operand of {@code NOT}.
     */
    public Formula getOperand() {
        requireKind(Kind.NOT);
        return left;
    }

    public boolean isPackage() {
        return kind == Kind.PACKAGE;
    }

    // Evaluation

    /**
     * Tests whether a version satisfies every constraint of this leaf.
     */
    public boolean accepts(Version version) {
        requireKind(Kind.PACKAGE);
        for (Constraint constraint : constraints) {
            if (!constraint.holds(version)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Evaluates this formula against a single proposed package version.
     * A leaf holds iff it names the candidate and the candidate's version meets its constraints.
     */
    public boolean evaluate(PackageVersion candidate) {
        return evaluate(packageName -> packageName.equals(candidate.getName())
                ? Optional.of(candidate.getVersion())
                : Optional.empty());
    }

    /**
     * Evaluates this formula against a selection.
     * A leaf holds iff its package is selected and the selected version meets its constraints.
     */
    public boolean evaluate(Selection selection) {
        return evaluate(selection::getVersion);
    }

    private boolean evaluate(Function<String, Optional<Version>> lookup) {
        return switch (kind) {
            case PACKAGE -> lookup.apply(name).map(this::accepts).orElse(false);
            case AND -> left.evaluate(lookup) && right.evaluate(lookup);
            case OR -> left.evaluate(lookup) || right.evaluate(lookup);
            case NOT -> !left.evaluate(lookup);
        };
    }

    // Traversal

    /**
     * Returns every referenced package name in pre-order, left to right, without duplicates.
     */
    public Set<String> packageNames() {
        Set<String> names = new LinkedHashSet<>();
        for (Formula leaf : leaves()) {
            names.add(leaf.name);
        }
        return names;
    }

    /**
     * Returns every package leaf in pre-order, left to right.
     */
    public List<Formula> leaves() {
        return collectLeaves(true);
    }

    /**
     * Returns the package leaves that are not below a {@code NOT}, in pre-order, left to right.
     * These are the leaves that can require a package to be selected.
     */
    public List<Formula> positiveLeaves() {
        return collectLeaves(false);
    }

    /**
     * Returns the package leaves reachable through {@code AND} only, in pre-order.
     * Every one of them must hold for the formula to hold.
     */
    public List<Formula> mandatoryLeaves() {
        List<Formula> leaves = new ArrayList<>();
        Deque<Formula> pending = new ArrayDeque<>();
        pending.push(this);
        while (!pending.isEmpty()) {
            Formula current = pending.pop();
            if (current.kind == Kind.PACKAGE) {
                leaves.add(current);
            } else if (current.kind == Kind.AND) {
                pending.push(current.right);
                pending.push(current.left);
            }
        }
        return leaves;
    }

    private List<Formula> collectLeaves(boolean includeNegated) {
        List<Formula> leaves = new ArrayList<>();
        Deque<Formula> pending = new ArrayDeque<>();
        pending.push(this);
        while (!pending.isEmpty()) {
            Formula current = pending.pop();
            switch (current.kind) {
                case PACKAGE -> leaves.add(current);
                case AND, OR -> {
                    pending.push(current.right);
                    pending.push(current.left);
                }
                case NOT -> {
                    if (includeNegated) {
                        pending.push(current.left);
                    }
                }
            }
        }
        return leaves;
    }

    // Rendering

    /**
     * Returns the canonical text of this formula. Parsing it yields an equal formula.
     */
    public String toText() {
        return switch (kind) {
            case PACKAGE -> leafText();
            case AND -> "(" + left.toText() + " & " + right.toText() + ")";
            case OR -> "(" + left.toText() + " | " + right.toText() + ")";
            case NOT -> "! (" + left.toText() + ")";
        };
    }

    private String leafText() {
        StringBuilder sb = new StringBuilder();
        sb.append('"').append(name).append('"');
        if (!constraints.isEmpty()) {
            sb.append(" {");
            for (int i = 0; i < constraints.size(); i++) {
                if (i > 0) {
                    sb.append(" & ");
                }
                sb.append(constraints.get(i).toText());
            }
            sb.append('}');
        }
        return sb.toString();
    }

    private void requireKind(Kind expected) {
        if (kind != expected) {
            throw new IllegalStateException("Expected formula of kind " + expected + " but was " + kind);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Formula that = (Formula) o;
        return kind == that.kind &&
               Objects.equals(name, that.name) &&
               constraints.equals(that.constraints) &&
               Objects.equals(left, that.left) &&
               Objects.equals(right, that.right);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, name, constraints, left, right);
    }

    @Override
    public String toString() {
        return toText();
    }
}
