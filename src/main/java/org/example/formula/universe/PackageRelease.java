package org.example.formula.universe;

import org.example.formula.model.Formula;
import org.example.formula.model.PackageVersion;
import org.example.formula.version.Version;

import java.util.Objects;
import java.util.Optional;

/**
 * One available version of a package together with the dependency formula it declares.
 */
public final class PackageRelease {

    private final String name;
    private final Version version;
    private final Formula depends;

    /**
     * Creates a new PackageRelease.
     *
     * @param name    the package name
     * @param version the released version
     * @param depends the dependency formula, or null when the release has no dependencies
     */
    public PackageRelease(String name, Version version, Formula depends) {
        this.name = Objects.requireNonNull(name, "name cannot be null");
        this.version = Objects.requireNonNull(version, "version cannot be null");
        this.depends = depends;
    }

    public String getName() {
        return name;
    }

    public Version getVersion() {
        return version;
    }

    public Optional<Formula> getDepends() {
        return Optional.ofNullable(depends);
    }

    public PackageVersion toPackageVersion() {
        return new PackageVersion(name, version);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        PackageRelease that = (PackageRelease) o;
        return name.equals(that.name) &&
               version.equals(that.version) &&
               Objects.equals(depends, that.depends);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, version, depends);
    }

    @Override
    public String toString() {
        return name + "@" + version + (depends != null ? " depends " + depends.toText() : "");
    }
}
