package org.example.formula.resolver;

import org.example.formula.universe.PackageUniverse;
import org.example.formula.version.Constraint;

import java.util.List;

/**
 * Interface for dependency resolvers.
 */
public interface DependencyResolver {

    /**
     * Resolves a root package against a universe.
     *
     * @param universe        the packages available for selection, read only
     * @param rootName        the package to install
     * @param rootConstraints version constraints on the root package (may be empty)
     * @param cancellation    polled at every choice point
     * @return the outcome; failures are reported in the result, never thrown
     */
    ResolutionResult resolve(PackageUniverse universe, String rootName, List<Constraint> rootConstraints,
                             CancellationToken cancellation);

    default ResolutionResult resolve(PackageUniverse universe, String rootName, List<Constraint> rootConstraints) {
        return resolve(universe, rootName, rootConstraints, CancellationToken.never());
    }
}
