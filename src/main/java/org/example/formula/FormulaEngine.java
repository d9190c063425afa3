package org.example.formula;

import org.example.formula.config.ConfigurationValidator;
import org.example.formula.config.ResolverConfiguration;
import org.example.formula.exception.ConfigurationException;
import org.example.formula.exception.FormulaSyntaxException;
import org.example.formula.exception.UniverseException;
import org.example.formula.filter.UniverseFilter;
import org.example.formula.model.Formula;
import org.example.formula.parser.FormulaParser;
import org.example.formula.resolver.BacktrackingResolver;
import org.example.formula.resolver.CancellationToken;
import org.example.formula.resolver.DependencyResolver;
import org.example.formula.resolver.ResolutionResult;
import org.example.formula.universe.LoadResult;
import org.example.formula.universe.PackageEntry;
import org.example.formula.universe.PackageUniverse;
import org.example.formula.universe.UniverseLoader;
import org.example.formula.version.Constraint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Entry point for callers: parse formulas, load a universe and resolve root packages.
 *
 * <p>An engine holds only its configuration and stateless collaborators, so it can be
 * shared between threads.</p>
 */
public class FormulaEngine {

    private static final Logger log = LoggerFactory.getLogger(FormulaEngine.class);

    private final ResolverConfiguration config;
    private final FormulaParser parser;
    private final UniverseLoader loader;
    private final UniverseFilter filter;
    private final DependencyResolver resolver;

    public FormulaEngine() throws ConfigurationException {
        this(ResolverConfiguration.defaults());
    }

    /**
     * Creates an engine for the given configuration.
     *
     * @throws ConfigurationException if the configuration is invalid
     */
    public FormulaEngine(ResolverConfiguration config) throws ConfigurationException {
        new ConfigurationValidator().validateOrThrow(config);
        this.config = config;
        this.parser = new FormulaParser();
        this.loader = new UniverseLoader(parser, config.isFailOnInvalidMetadata());
        this.filter = UniverseFilter.from(config);
        this.resolver = new BacktrackingResolver(config);
        log.debug("Formula engine created: {}", config);
    }

    public ResolverConfiguration getConfiguration() {
        return config;
    }

    /**
     * Parses formula text.
     *
     * @throws FormulaSyntaxException if the text is not a well-formed formula
     */
    public Formula parseFormula(String text) throws FormulaSyntaxException {
        return parser.parse(text);
    }

    /**
     * Builds a universe from raw metadata. Invalid entries are skipped and reported unless
     * {@code failOnInvalidMetadata} is set.
     *
     * @throws UniverseException if strict loading is configured and an entry is invalid
     */
    public LoadResult loadUniverse(Iterable<PackageEntry> entries) throws UniverseException {
        return loader.load(entries);
    }

    /**
     * Resolves a root package.
     */
    public ResolutionResult resolve(PackageUniverse universe, String root, List<Constraint> rootConstraints) {
        return resolve(universe, root, rootConstraints, CancellationToken.never());
    }

    /**
     * Resolves a root package, polling the token at every choice point.
     */
    public ResolutionResult resolve(PackageUniverse universe, String root, List<Constraint> rootConstraints,
                                    CancellationToken cancellation) {
        PackageUniverse visible = universe;
        if (!filter.isEmpty()) {
            UniverseFilter.FilterResult filtered = filter.filter(universe, root);
            if (filtered.hasExclusions()) {
                log.info("Universe filtered: {} of {} packages visible (excluded: {}, not included: {})",
                        filtered.visibleCount(), filtered.originalCount(),
                        filtered.hiddenBy(UniverseFilter.Exclusion.EXCLUDED),
                        filtered.hiddenBy(UniverseFilter.Exclusion.NOT_INCLUDED));
            }
            visible = filtered.universe();
        }

        ResolutionResult result = resolver.resolve(visible, root, rootConstraints, cancellation);
        logResult(root, result);
        return result;
    }

    /**
     * Resolves a root request written as a single package atom, e.g. {@code "A" {= "3.0.0"}}.
     *
     * @throws FormulaSyntaxException if the request is not a single package atom
     */
    public ResolutionResult resolve(PackageUniverse universe, String request) throws FormulaSyntaxException {
        Formula root = parser.parse(request);
        if (!root.isPackage()) {
            throw new FormulaSyntaxException(0, "single package",
                    "Root request must name a single package, but was: " + root.toText());
        }
        return resolve(universe, root.getName(), root.getConstraints());
    }

    private void logResult(String root, ResolutionResult result) {
        switch (result.getStatus()) {
            case SOLVED -> log.info("Resolution of {} succeeded: {}", root,
                    result.getSelection().map(Object::toString).orElse("{}"));
            case EXHAUSTED -> log.warn("Resolution of {} failed: {}", root, result.getMessage());
            case CANCELLED -> log.warn("Resolution of {} cancelled: {}", root, result.getMessage());
        }
    }
}
