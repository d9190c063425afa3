package org.example.formula;

import org.example.formula.config.ResolverConfiguration;
import org.example.formula.exception.ConfigurationException;
import org.example.formula.exception.FormulaSyntaxException;
import org.example.formula.exception.UniverseException;
import org.example.formula.model.PackageVersion;
import org.example.formula.resolver.CancellationToken;
import org.example.formula.resolver.ResolutionResult;
import org.example.formula.resolver.ResolutionStatus;
import org.example.formula.universe.LoadResult;
import org.example.formula.universe.PackageEntry;
import org.example.formula.universe.PackageUniverse;
import org.example.formula.version.Comparator;
import org.example.formula.version.Constraint;
import org.example.formula.version.Version;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for FormulaEngine, wiring parser, loader, filter and resolver together.
 */
class FormulaEngineTest {

    private PackageUniverse universe;

    @BeforeEach
    void setUp() {
        universe = PackageFixtures.universe();
    }

    private static List<String> coordinates(ResolutionResult result) {
        return result.getSelection().orElseThrow().getPackageVersions().stream()
                .map(PackageVersion::getCoordinate)
                .toList();
    }

    @Nested
    @DisplayName("Configuration")
    class Configuration {

        @Test
        @DisplayName("should reject invalid configuration")
        void shouldRejectInvalidConfiguration() {
            ResolverConfiguration config = ResolverConfiguration.builder()
                    .maxSteps(-3)
                    .includeFilters(List.of("bad pattern"))
                    .build();

            assertThatThrownBy(() -> new FormulaEngine(config))
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("maxSteps")
                    .hasMessageContaining("includeFilters");
        }

        @Test
        @DisplayName("should expose its configuration")
        void shouldExposeConfiguration() throws Exception {
            ResolverConfiguration config = ResolverConfiguration.builder().maxSteps(50).build();

            assertThat(new FormulaEngine(config).getConfiguration()).isSameAs(config);
        }
    }

    @Nested
    @DisplayName("Loading")
    class Loading {

        private final List<PackageEntry> entries = List.of(
                new PackageEntry("A", "1.0.0", "[ \"B\" ]"),
                new PackageEntry("B", "1.0.0", "[ \"C\" {>> \"1\"} ]"));

        @Test
        @DisplayName("lenient engine should skip bad entries")
        void lenientEngineShouldSkipBadEntries() throws Exception {
            LoadResult result = new FormulaEngine().loadUniverse(entries);

            assertThat(result.getUniverse().getPackageNames()).containsExactly("A");
            assertThat(result.getRejected()).extracting(r -> r.entry().name()).containsExactly("B");
        }

        @Test
        @DisplayName("strict engine should fail on bad entries")
        void strictEngineShouldFail() throws Exception {
            FormulaEngine engine = new FormulaEngine(
                    ResolverConfiguration.builder().failOnInvalidMetadata(true).build());

            assertThatThrownBy(() -> engine.loadUniverse(entries))
                    .isInstanceOf(UniverseException.class)
                    .hasCauseInstanceOf(FormulaSyntaxException.class);
        }

        @Test
        @DisplayName("loaded universe should resolve to its unknown dependency")
        void loadedUniverseShouldReportUnknownDependency() throws Exception {
            FormulaEngine engine = new FormulaEngine();
            PackageUniverse loaded = engine.loadUniverse(entries).getUniverse();

            ResolutionResult result = engine.resolve(loaded, "A", List.of());

            assertThat(result.getStatus()).isEqualTo(ResolutionStatus.EXHAUSTED);
            assertThat(result.getMessage()).contains("package B is unknown");
        }
    }

    @Nested
    @DisplayName("Resolution")
    class Resolution {

        @Test
        @DisplayName("should resolve a textual request")
        void shouldResolveTextualRequest() throws Exception {
            ResolutionResult result = new FormulaEngine().resolve(universe, "\"A\" {= \"3.0.0\"}");

            assertThat(coordinates(result)).containsExactly("A@3.0.0", "B@2.0.0", "C@1.5.0", "E@1.0.0");
        }

        @Test
        @DisplayName("should reject a request that is not a single package")
        void shouldRejectCompoundRequest() throws Exception {
            FormulaEngine engine = new FormulaEngine();

            assertThatThrownBy(() -> engine.resolve(universe, "\"A\" | \"B\""))
                    .isInstanceOf(FormulaSyntaxException.class)
                    .hasMessageContaining("single package");
        }

        @Test
        @DisplayName("should parse formulas")
        void shouldParseFormulas() throws Exception {
            assertThat(new FormulaEngine().parseFormula("\"A\" & ! \"B\"").toText())
                    .isEqualTo("(\"A\" & ! (\"B\"))");
        }

        @Test
        @DisplayName("excluded packages should look unknown")
        void excludedPackagesShouldLookUnknown() throws Exception {
            FormulaEngine engine = new FormulaEngine(
                    ResolverConfiguration.builder().excludeFilters(List.of("B")).build());

            ResolutionResult result = engine.resolve(universe, "A",
                    List.of(Constraint.of(Comparator.EQ, Version.parse("1.1.0"))));

            assertThat(coordinates(result)).containsExactly("A@1.1.0", "C@1.0.0");
        }

        @Test
        @DisplayName("include filters should restrict the universe")
        void includeFiltersShouldRestrict() throws Exception {
            FormulaEngine engine = new FormulaEngine(
                    ResolverConfiguration.builder().includeFilters(List.of("C*")).build());

            ResolutionResult result = engine.resolve(universe, "A",
                    List.of(Constraint.of(Comparator.EQ, Version.parse("1.1.0"))));
            ResolutionResult excludedRequirement = engine.resolve(universe, "A",
                    List.of(Constraint.of(Comparator.EQ, Version.parse("1.0.0"))));

            assertThat(coordinates(result)).containsExactly("A@1.1.0", "C@1.0.0");
            assertThat(excludedRequirement.getStatus()).isEqualTo(ResolutionStatus.EXHAUSTED);
        }

        @Test
        @DisplayName("an expired timeout should cancel the resolution")
        void expiredTimeoutShouldCancel() throws Exception {
            ResolutionResult result = new FormulaEngine().resolve(universe, "A", List.of(),
                    CancellationToken.timeout(Duration.ZERO));

            assertThat(result.getStatus()).isEqualTo(ResolutionStatus.CANCELLED);
        }
    }
}
