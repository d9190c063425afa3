package org.example.formula.universe;

/**
 * Raw package metadata as supplied by the surrounding system: a name, a version string
 * and the text of the {@code depends} field (blank when there are no dependencies).
 */
public record PackageEntry(String name, String version, String depends) {

    public String describe() {
        return name + "@" + version;
    }
}
