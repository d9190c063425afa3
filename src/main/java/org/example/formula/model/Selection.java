package org.example.formula.model;

import org.example.formula.version.Version;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * An assignment of exactly one version per package.
 * Iteration follows the order in which packages were committed.
 */
public final class Selection {

    private static final Selection EMPTY = new Selection(Collections.emptyMap());

    private final Map<String, Version> versions;

    private Selection(Map<String, Version> versions) {
        this.versions = versions;
    }

    public static Selection empty() {
        return EMPTY;
    }

    /**
     * Creates a selection from a name-to-version map, keeping its iteration order.
     */
    public static Selection of(Map<String, Version> versions) {
        return new Selection(Collections.unmodifiableMap(new LinkedHashMap<>(versions)));
    }

    public static Builder builder() {
        return new Builder();
    }

    // Query methods

    public Optional<Version> getVersion(String name) {
        return Optional.ofNullable(versions.get(name));
    }

    public boolean contains(String name) {
        return versions.containsKey(name);
    }

    public int size() {
        return versions.size();
    }

    public boolean isEmpty() {
        return versions.isEmpty();
    }

    public Map<String, Version> asMap() {
        return versions;
    }

    /**
     * Returns the selected releases in commit order.
     */
    public List<PackageVersion> getPackageVersions() {
        List<PackageVersion> result = new ArrayList<>(versions.size());
        versions.forEach((name, version) -> result.add(new PackageVersion(name, version)));
        return result;
    }

    /**
     * Returns a copy of this selection with one more package committed.
     *
     * @throws IllegalStateException if the package is already selected
     */
    public Selection with(String name, Version version) {
        if (versions.containsKey(name)) {
            throw new IllegalStateException("Package already selected: " + name + "@" + versions.get(name));
        }
        Map<String, Version> extended = new LinkedHashMap<>(versions);
        extended.put(name, version);
        return new Selection(Collections.unmodifiableMap(extended));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return versions.equals(((Selection) o).versions);
    }

    @Override
    public int hashCode() {
        return Objects.hash(versions);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("{");
        for (PackageVersion pv : getPackageVersions()) {
            if (sb.length() > 1) {
                sb.append(", ");
            }
            sb.append(pv.getCoordinate());
        }
        return sb.append('}').toString();
    }

    /**
     * Builder for Selection.
     */
    public static class Builder {
        private final Map<String, Version> versions = new LinkedHashMap<>();

        public Builder select(String name, Version version) {
            versions.put(Objects.requireNonNull(name, "name cannot be null"),
                    Objects.requireNonNull(version, "version cannot be null"));
            return this;
        }

        public Selection build() {
            return Selection.of(versions);
        }
    }
}
