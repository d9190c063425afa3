package org.example.formula.universe;

import org.example.formula.model.Formula;
import org.example.formula.model.PackageVersion;
import org.example.formula.version.Constraint;
import org.example.formula.version.Version;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Read-only set of known packages and their releases.
 *
 * <p>Releases of a package are kept newest first. A universe never changes after it is
 * built, so one instance can be shared by concurrent resolutions.</p>
 */
public final class PackageUniverse {

    private final Map<String, List<PackageRelease>> releases;

    private PackageUniverse(Map<String, List<PackageRelease>> releases) {
        this.releases = releases;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static PackageUniverse empty() {
        return builder().build();
    }

    // Query methods

    public boolean contains(String name) {
        return releases.containsKey(name);
    }

    public Set<String> getPackageNames() {
        return releases.keySet();
    }

    public int getPackageCount() {
        return releases.size();
    }

    public int getReleaseCount() {
        return releases.values().stream().mapToInt(List::size).sum();
    }

    /**
     * Returns all releases of a package, newest first (empty for unknown packages).
     */
    public List<PackageRelease> getReleases(String name) {
        return releases.getOrDefault(name, Collections.emptyList());
    }

    /**
     * Returns all versions of a package, newest first.
     */
    public List<Version> getVersions(String name) {
        return getReleases(name).stream()
                .map(PackageRelease::getVersion)
                .collect(Collectors.toList());
    }

    public Optional<PackageRelease> getRelease(String name, Version version) {
        return getReleases(name).stream()
                .filter(r -> r.getVersion().equals(version))
                .findFirst();
    }

    public Optional<PackageRelease> getRelease(PackageVersion packageVersion) {
        return getRelease(packageVersion.getName(), packageVersion.getVersion());
    }

    public Optional<Version> findLatestVersion(String name) {
        List<PackageRelease> list = getReleases(name);
        return list.isEmpty() ? Optional.empty() : Optional.of(list.get(0).getVersion());
    }

    /**
     * Returns the releases of a package that satisfy every given constraint, newest first.
     */
    public List<PackageRelease> candidates(String name, Collection<Constraint> constraints) {
        return getReleases(name).stream()
                .filter(r -> constraints.stream().allMatch(c -> c.holds(r.getVersion())))
                .collect(Collectors.toList());
    }

    @Override
    public String toString() {
        return "PackageUniverse{" +
                "packages=" + getPackageCount() +
                ", releases=" + getReleaseCount() +
                '}';
    }

    /**
     * Builder for PackageUniverse. Rejects a second release with the same package and version.
     */
    public static class Builder {
        private final Map<String, List<PackageRelease>> releases = new TreeMap<>();

        public Builder add(PackageRelease release) {
            List<PackageRelease> list = releases.computeIfAbsent(release.getName(), k -> new ArrayList<>());
            for (PackageRelease existing : list) {
                if (existing.getVersion().equals(release.getVersion())) {
                    throw new IllegalArgumentException("Duplicate release: " + release.getName()
                            + "@" + release.getVersion() + " (already have " + existing.getVersion() + ")");
                }
            }
            list.add(release);
            return this;
        }

        public Builder add(String name, Version version, Formula depends) {
            return add(new PackageRelease(name, version, depends));
        }

        public boolean contains(String name, Version version) {
            return releases.getOrDefault(name, Collections.emptyList()).stream()
                    .anyMatch(r -> r.getVersion().equals(version));
        }

        public PackageUniverse build() {
            Map<String, List<PackageRelease>> sorted = new LinkedHashMap<>();
            releases.forEach((name, list) -> {
                List<PackageRelease> copy = new ArrayList<>(list);
                copy.sort(Comparator.comparing(PackageRelease::getVersion).reversed());
                sorted.put(name, List.copyOf(copy));
            });
            return new PackageUniverse(Collections.unmodifiableMap(sorted));
        }
    }
}
