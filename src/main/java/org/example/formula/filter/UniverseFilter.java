package org.example.formula.filter;

import org.example.formula.config.ResolverConfiguration;
import org.example.formula.universe.PackageRelease;
import org.example.formula.universe.PackageUniverse;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Hides packages of a universe from resolution by name.
 *
 * <p>A package is hidden when it matches an exclude pattern, or when include patterns are
 * configured and it matches none of them. The root package of a resolution is always
 * visible. To the resolver a hidden package looks exactly like an unknown one.</p>
 */
public class UniverseFilter {

    /**
     * Why a package is hidden.
     */
    public enum Exclusion {
        /** Matches an exclude pattern. */
        EXCLUDED,
        /** Include patterns are configured and none matches. */
        NOT_INCLUDED
    }

    private final List<PatternMatcher> include;
    private final List<PatternMatcher> exclude;

    /**
     * Creates a filter. Null lists and blank entries are ignored.
     *
     * @throws IllegalArgumentException if a pattern is not a valid package name glob
     */
    public UniverseFilter(List<String> includeFilters, List<String> excludeFilters) {
        this.include = compile(includeFilters);
        this.exclude = compile(excludeFilters);
    }

    public static UniverseFilter from(ResolverConfiguration config) {
        return new UniverseFilter(config.getIncludeFilters(), config.getExcludeFilters());
    }

    private static List<PatternMatcher> compile(List<String> patterns) {
        List<PatternMatcher> matchers = new ArrayList<>();
        if (patterns != null) {
            for (String pattern : patterns) {
                if (pattern != null && !pattern.isBlank()) {
                    matchers.add(new PatternMatcher(pattern));
                }
            }
        }
        return List.copyOf(matchers);
    }

    public boolean isEmpty() {
        return include.isEmpty() && exclude.isEmpty();
    }

    /**
     * Returns why the package would be hidden, or empty if it stays visible.
     */
    public Optional<Exclusion> exclusionOf(String packageName) {
        for (PatternMatcher matcher : exclude) {
            if (matcher.matches(packageName)) {
                return Optional.of(Exclusion.EXCLUDED);
            }
        }
        if (include.isEmpty()) {
            return Optional.empty();
        }
        for (PatternMatcher matcher : include) {
            if (matcher.matches(packageName)) {
                return Optional.empty();
            }
        }
        return Optional.of(Exclusion.NOT_INCLUDED);
    }

    /**
     * Builds the universe a resolution rooted at {@code rootName} sees.
     */
    public FilterResult filter(PackageUniverse universe, String rootName) {
        PackageUniverse.Builder visible = PackageUniverse.builder();
        Map<String, Exclusion> hidden = new TreeMap<>();

        for (String name : universe.getPackageNames()) {
            Optional<Exclusion> exclusion = name.equals(rootName) ? Optional.empty() : exclusionOf(name);
            if (exclusion.isPresent()) {
                hidden.put(name, exclusion.get());
                continue;
            }
            for (PackageRelease release : universe.getReleases(name)) {
                visible.add(release);
            }
        }
        return new FilterResult(visible.build(), universe.getPackageCount(), Collections.unmodifiableMap(hidden));
    }

    /**
     * The visible universe and the hidden package names with their reason.
     */
    public record FilterResult(PackageUniverse universe, int originalCount, Map<String, Exclusion> hidden) {

        public Set<String> hiddenBy(Exclusion exclusion) {
            Set<String> names = new TreeSet<>();
            hidden.forEach((name, reason) -> {
                if (reason == exclusion) {
                    names.add(name);
                }
            });
            return names;
        }

        public int visibleCount() {
            return universe.getPackageCount();
        }

        public boolean hasExclusions() {
            return !hidden.isEmpty();
        }
    }
}
