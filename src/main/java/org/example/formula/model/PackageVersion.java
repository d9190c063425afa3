package org.example.formula.model;

import org.example.formula.version.Version;

import java.util.Objects;

/**
 * A concrete package release coordinate: a package name paired with one version.
 */
public final class PackageVersion {

    private final String name;
    private final Version version;

    public PackageVersion(String name, Version version) {
        this.name = Objects.requireNonNull(name, "name cannot be null");
        this.version = Objects.requireNonNull(version, "version cannot be null");
    }

    public String getName() {
        return name;
    }

    public Version getVersion() {
        return version;
    }

    /**
     * Returns the coordinate in {@code name@version} form.
     */
    public String getCoordinate() {
        return name + "@" + version;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        PackageVersion that = (PackageVersion) o;
        return name.equals(that.name) && version.equals(that.version);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, version);
    }

    @Override
    public String toString() {
        return getCoordinate();
    }
}
