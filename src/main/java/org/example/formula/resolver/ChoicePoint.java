package org.example.formula.resolver;

import org.example.formula.model.Formula;
import org.example.formula.model.PackageVersion;
import org.example.formula.universe.PackageRelease;

import java.util.List;

/**
 * A position in the search with alternatives left to try: either the branches of an
 * {@code OR} (left first) or the candidate releases of a package (newest first).
 */
final class ChoicePoint {

    enum Kind {
        BRANCH,
        CANDIDATE
    }

    private final Kind kind;
    private final SearchState base;
    private final Goal goal;
    private final List<Formula> branches;
    private final List<PackageRelease> candidates;
    private int next;

    private ChoicePoint(Kind kind, SearchState base, Goal goal,
                        List<Formula> branches, List<PackageRelease> candidates) {
        this.kind = kind;
        this.base = base;
        this.goal = goal;
        this.branches = branches;
        this.candidates = candidates;
    }

    static ChoicePoint branches(SearchState base, Goal goal) {
        Formula or = goal.formula();
        return new ChoicePoint(Kind.BRANCH, base, goal, List.of(or.getLeft(), or.getRight()), List.of());
    }

    static ChoicePoint candidates(SearchState base, Goal goal, List<PackageRelease> candidates) {
        return new ChoicePoint(Kind.CANDIDATE, base, goal, List.of(), List.copyOf(candidates));
    }

    /**
     * Returns the state every alternative of this choice point starts from.
     */
    SearchState getBase() {
        return base;
    }

    Kind getKind() {
        return kind;
    }

    Goal getGoal() {
        return goal;
    }

    boolean hasNext() {
        return next < size();
    }

    int size() {
        return kind == Kind.BRANCH ? branches.size() : candidates.size();
    }

    /**
     * Returns the release the next alternative commits (candidate choice points only).
     */
    PackageRelease peekCandidate() {
        return candidates.get(next);
    }

    /**
     * Builds the search state for the next untried alternative.
     */
    SearchState next() {
        int index = next++;
        return switch (kind) {
            case BRANCH -> base.withGoals(base.goals().push(goal.child(branches.get(index))));
            case CANDIDATE -> commit(candidates.get(index));
        };
    }

    private SearchState commit(PackageRelease release) {
        PackageVersion committed = release.toPackageVersion();
        GoalStack goals = base.goals();
        if (release.getDepends().isPresent()) {
            goals = goals.push(goal.declaredBy(committed, release.getDepends().get()));
        }
        return base.withCommit(base.trail().extend(committed), goals);
    }

    @Override
    public String toString() {
        return kind == Kind.BRANCH
                ? "branch " + goal.formula().toText() + " [" + next + "/" + size() + "]"
                : "candidates of " + goal.formula().getName() + " " + candidates + " [" + next + "/" + size() + "]";
    }
}
