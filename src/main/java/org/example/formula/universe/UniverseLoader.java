package org.example.formula.universe;

import org.example.formula.exception.FormulaEngineException;
import org.example.formula.exception.UniverseException;
import org.example.formula.model.Formula;
import org.example.formula.parser.FormulaParser;
import org.example.formula.version.Version;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Builds a {@link PackageUniverse} from raw package metadata.
 *
 * <p>Each entry is parsed on its own. An entry with a malformed version, a formula
 * syntax error, a blank name or a duplicate version is rejected without affecting the
 * other entries, unless the loader is strict, in which case the first bad entry fails
 * the whole load.</p>
 */
public class UniverseLoader {

    private static final Logger log = LoggerFactory.getLogger(UniverseLoader.class);

    private final FormulaParser parser;
    private final boolean failOnInvalidMetadata;

    public UniverseLoader() {
        this(new FormulaParser(), false);
    }

    public UniverseLoader(FormulaParser parser, boolean failOnInvalidMetadata) {
        this.parser = Objects.requireNonNull(parser, "parser cannot be null");
        this.failOnInvalidMetadata = failOnInvalidMetadata;
    }

    /**
     * Loads the given entries.
     *
     * @param entries package metadata, in any order
     * @return the universe and any rejected entries
     * @throws UniverseException if the loader is strict and an entry is invalid
     */
    public LoadResult load(Iterable<PackageEntry> entries) throws UniverseException {
        PackageUniverse.Builder builder = PackageUniverse.builder();
        List<LoadResult.RejectedEntry> rejected = new ArrayList<>();
        int accepted = 0;

        for (PackageEntry entry : entries) {
            try {
                PackageRelease release = toRelease(entry);
                if (builder.contains(release.getName(), release.getVersion())) {
                    throw new UniverseException("Duplicate release " + entry.describe());
                }
                builder.add(release);
                accepted++;
            } catch (FormulaEngineException e) {
                if (failOnInvalidMetadata) {
                    throw new UniverseException("Invalid package metadata for " + entry.describe()
                            + ": " + e.getMessage(), e);
                }
                log.warn("Skipping package {}: {}", entry.describe(), e.getMessage());
                rejected.add(new LoadResult.RejectedEntry(entry, e));
            }
        }

        PackageUniverse universe = builder.build();
        log.info("Loaded {} releases of {} packages ({} rejected)",
                accepted, universe.getPackageCount(), rejected.size());
        return new LoadResult(universe, rejected);
    }

    private PackageRelease toRelease(PackageEntry entry) throws FormulaEngineException {
        if (entry.name() == null || entry.name().isBlank()) {
            throw new UniverseException("Package name is required");
        }
        Version version = Version.parse(entry.version());
        Formula depends = parser.parseDependencyList(entry.depends()).orElse(null);
        log.debug("Loaded {}@{} depends {}", entry.name(), version, depends);
        return new PackageRelease(entry.name(), version, depends);
    }
}
