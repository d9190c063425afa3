package org.example.formula.resolver;

import org.example.formula.model.Formula;
import org.example.formula.model.PackageVersion;

import java.util.List;

/**
 * A formula still to be satisfied, with the chain of releases that led to it.
 * The head of {@code path} is the release that declared the formula; the path is
 * empty for the root request.
 */
record Goal(Formula formula, ReleaseChain path) {

    static Goal root(Formula formula) {
        return new Goal(formula, ReleaseChain.empty());
    }

    Goal child(Formula subFormula) {
        return new Goal(subFormula, path);
    }

    /**
     * Returns the goal for the dependency formula of a release committed for this goal.
     */
    Goal declaredBy(PackageVersion release, Formula depends) {
        return new Goal(depends, path.extend(release));
    }

    PackageVersion origin() {
        return path.head();
    }

    int depth() {
        return path.length();
    }

    /**
     * Returns the path from the root to the declaring release.
     */
    List<PackageVersion> pathFromRoot() {
        return path.toList();
    }
}
