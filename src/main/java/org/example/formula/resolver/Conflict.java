package org.example.formula.resolver;

import org.example.formula.model.Formula;
import org.example.formula.model.PackageVersion;
import org.example.formula.model.Selection;
import org.example.formula.version.Version;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Diagnostic report for a failed resolution: the deepest requirement that could not be met,
 * who required it and the partial selection at that point.
 */
public class Conflict {

    /**
     * Why a requirement could not be met.
     */
    public enum Reason {
        /** The required package does not exist in the universe. */
        UNKNOWN_PACKAGE,
        /** The package exists but no version satisfies the accumulated constraints. */
        NO_MATCHING_VERSION,
        /** The package is already selected at a version the requirement rejects. */
        VERSION_MISMATCH,
        /** A negated requirement holds against the complete selection. */
        NEGATION_VIOLATED,
        /** A selected release's formula does not hold against the complete selection. */
        INCONSISTENT_SELECTION
    }

    private final Reason reason;
    private final String packageName;
    private final Formula requirement;
    private final PackageVersion dependent;
    private final List<PackageVersion> path;
    private final Selection partialSelection;
    private final List<Version> availableVersions;

    private Conflict(Builder builder) {
        this.reason = Objects.requireNonNull(builder.reason, "reason cannot be null");
        this.packageName = Objects.requireNonNull(builder.packageName, "packageName cannot be null");
        this.requirement = builder.requirement;
        this.dependent = builder.dependent;
        this.path = List.copyOf(builder.path);
        this.partialSelection = builder.partialSelection;
        this.availableVersions = List.copyOf(builder.availableVersions);
    }

    public static Builder builder() {
        return new Builder();
    }

    public Reason getReason() {
        return reason;
    }

    /**
     * Returns the package the failing requirement is about.
     */
    public String getPackageName() {
        return packageName;
    }

    public Formula getRequirement() {
        return requirement;
    }

    /**
     * Returns the release whose formula could not be satisfied, or empty for the root request.
     */
    public Optional<PackageVersion> getDependent() {
        return Optional.ofNullable(dependent);
    }

    /**
     * Returns the chain of releases from the root to the dependent.
     */
    public List<PackageVersion> getPath() {
        return path;
    }

    public Selection getPartialSelection() {
        return partialSelection;
    }

    /**
     * Returns every version of the package in the universe, newest first.
     */
    public List<Version> getAvailableVersions() {
        return availableVersions;
    }

    public int getDepth() {
        return path.size();
    }

    /**
     * Returns a one-line human readable explanation.
     */
    public String getDescription() {
        String who = dependent != null ? dependent.getCoordinate() : "root request";
        String what = requirement != null ? requirement.toText() : "\"" + packageName + "\"";
        String why = switch (reason) {
            case UNKNOWN_PACKAGE -> "package " + packageName + " is unknown";
            case NO_MATCHING_VERSION -> "no version of " + packageName + " satisfies the constraints (available: "
                    + (availableVersions.isEmpty() ? "none" : availableVersions.stream()
                    .map(Version::toString).collect(Collectors.joining(", "))) + ")";
            case VERSION_MISMATCH -> packageName + " is already selected at "
                    + partialSelection.getVersion(packageName).map(Version::toString).orElse("?");
            case NEGATION_VIOLATED -> "the negated requirement holds for the selection";
            case INCONSISTENT_SELECTION -> "the formula does not hold for the selection";
        };
        return who + " requires " + what + ": " + why;
    }

    @Override
    public String toString() {
        return "Conflict{" +
                "reason=" + reason +
                ", package=" + packageName +
                ", dependent=" + (dependent != null ? dependent : "root") +
                ", path=" + path +
                ", partialSelection=" + partialSelection +
                '}';
    }

    /**
     * Builder for Conflict.
     */
    public static class Builder {
        private Reason reason;
        private String packageName;
        private Formula requirement;
        private PackageVersion dependent;
        private List<PackageVersion> path = List.of();
        private Selection partialSelection = Selection.empty();
        private List<Version> availableVersions = List.of();

        public Builder reason(Reason reason) {
            this.reason = reason;
            return this;
        }

        public Builder packageName(String packageName) {
            this.packageName = packageName;
            return this;
        }

        public Builder requirement(Formula requirement) {
            this.requirement = requirement;
            return this;
        }

        public Builder dependent(PackageVersion dependent) {
            this.dependent = dependent;
            return this;
        }

        public Builder path(List<PackageVersion> path) {
            this.path = path;
            return this;
        }

        public Builder partialSelection(Selection partialSelection) {
            this.partialSelection = partialSelection;
            return this;
        }

        public Builder availableVersions(List<Version> availableVersions) {
            this.availableVersions = availableVersions;
            return this;
        }

        public Conflict build() {
            return new Conflict(this);
        }
    }
}
