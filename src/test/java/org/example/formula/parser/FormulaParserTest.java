package org.example.formula.parser;

import org.example.formula.PackageFixtures;
import org.example.formula.exception.FormulaSyntaxException;
import org.example.formula.exception.MalformedVersionException;
import org.example.formula.model.Formula;
import org.example.formula.version.Comparator;
import org.example.formula.version.Constraint;
import org.example.formula.version.Version;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.MethodSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for FormulaParser.
 */
class FormulaParserTest {

    private FormulaParser parser;

    @BeforeEach
    void setUp() {
        parser = new FormulaParser();
    }

    private static Formula pkg(String name) {
        return Formula.pkg(name);
    }

    private static Constraint constraint(Comparator comparator, String version) throws Exception {
        return Constraint.of(comparator, Version.parse(version));
    }

    static List<String> fixtureFormulas() {
        return PackageFixtures.FORMULAS;
    }

    static Stream<Arguments> malformedFormulas() {
        return Stream.of(
                Arguments.of("\"A\" &", 5, "package name, '(' or '!'"),
                Arguments.of("(\"A\"", 4, "')'"),
                Arguments.of("\"A\")", 3, "end of input"),
                Arguments.of("\"A\" {=> \"1.0\"}", 5, "one of = != < <= > >="),
                Arguments.of("\"A\" {>= \"1.0\"", 13, "'}'"),
                Arguments.of("\"\"", 0, "non-empty package name"),
                Arguments.of("\"A\" {>= 1.0}", 8, "formula token"),
                Arguments.of("\"A\" {>=}", 7, "version string"),
                Arguments.of("\"A\" {\"1.0\"}", 5, "comparator"),
                Arguments.of("\"A\" \"B\"", 4, "'&', '|' or end of input"),
                Arguments.of("\"A\" {>= \"1.0\" \"B\"}", 14, "'&' or '}'")
        );
    }

    @Nested
    @DisplayName("Structure")
    class Structure {

        @Test
        @DisplayName("should parse bare package name")
        void shouldParseBareName() throws Exception {
            assertThat(parser.parse("\"A\"")).isEqualTo(pkg("A"));
        }

        @Test
        @DisplayName("and should bind tighter than or")
        void andShouldBindTighterThanOr() throws Exception {
            assertThat(parser.parse("\"A\" | \"B\" & \"C\""))
                    .isEqualTo(Formula.or(pkg("A"), Formula.and(pkg("B"), pkg("C"))));
            assertThat(parser.parse("\"A\" & \"B\" | \"C\""))
                    .isEqualTo(Formula.or(Formula.and(pkg("A"), pkg("B")), pkg("C")));
        }

        @Test
        @DisplayName("not should bind to the next term")
        void notShouldBindToNextTerm() throws Exception {
            assertThat(parser.parse("! \"A\" & \"B\""))
                    .isEqualTo(Formula.and(Formula.not(pkg("A")), pkg("B")));
            assertThat(parser.parse("!(\"A\" & \"B\")"))
                    .isEqualTo(Formula.not(Formula.and(pkg("A"), pkg("B"))));
            assertThat(parser.parse("!!\"A\""))
                    .isEqualTo(Formula.not(Formula.not(pkg("A"))));
        }

        @Test
        @DisplayName("chains should nest to the left")
        void chainsShouldNestLeft() throws Exception {
            assertThat(parser.parse("\"A\" | \"B\" | \"C\""))
                    .isEqualTo(Formula.or(Formula.or(pkg("A"), pkg("B")), pkg("C")));
        }

        @Test
        @DisplayName("parentheses should override precedence")
        void parenthesesShouldOverridePrecedence() throws Exception {
            assertThat(parser.parse("(\"A\" | \"B\") & \"C\""))
                    .isEqualTo(Formula.and(Formula.or(pkg("A"), pkg("B")), pkg("C")));
        }

        @Test
        @DisplayName("should ignore whitespace")
        void shouldIgnoreWhitespace() throws Exception {
            assertThat(parser.parse("  \"A\"{>=\"1.0\"}\n&\t\"B\"  "))
                    .isEqualTo(parser.parse("\"A\" {>= \"1.0\"} & \"B\""));
        }
    }

    @Nested
    @DisplayName("Constraint blocks")
    class ConstraintBlocks {

        @ParameterizedTest
        @CsvSource({
                "=, EQ",
                "!=, NEQ",
                "<, LT",
                "<=, LE",
                ">, GT",
                ">=, GE"
        })
        @DisplayName("should parse every comparator")
        void shouldParseEveryComparator(String symbol, Comparator expected) throws Exception {
            Formula formula = parser.parse("\"A\" {" + symbol + " \"1.0\"}");

            assertThat(formula.getConstraints()).containsExactly(constraint(expected, "1.0"));
        }

        @Test
        @DisplayName("should combine constraints joined by & or whitespace")
        void shouldCombineConstraints() throws Exception {
            Formula expected = Formula.pkg("A", constraint(Comparator.GE, "1.0"), constraint(Comparator.LT, "2.0"));

            assertThat(parser.parse("\"A\" {>= \"1.0\" & < \"2.0\"}")).isEqualTo(expected);
            assertThat(parser.parse("\"A\" {>= \"1.0\" < \"2.0\"}")).isEqualTo(expected);
        }

        @Test
        @DisplayName("should parse negated constraint")
        void shouldParseNegatedConstraint() throws Exception {
            Formula formula = parser.parse("\"D\" {= \"2.0.0\" & ! (< \"2.5.0\")}");

            assertThat(formula.getConstraints()).containsExactly(
                    constraint(Comparator.EQ, "2.0.0"),
                    constraint(Comparator.LT, "2.5.0").negate());
        }

        @Test
        @DisplayName("should accept negation glued to comparator")
        void shouldAcceptGluedNegation() throws Exception {
            assertThat(parser.parse("\"A\" {!< \"2.0\"}").getConstraints())
                    .containsExactly(constraint(Comparator.LT, "2.0").negate());
        }
    }

    @Nested
    @DisplayName("Round trip")
    class RoundTrip {

        @ParameterizedTest
        @MethodSource("org.example.formula.parser.FormulaParserTest#fixtureFormulas")
        @DisplayName("canonical text should parse back to the same formula")
        void canonicalTextShouldParseBack(String text) throws Exception {
            Formula formula = parser.parse(text);

            assertThat(parser.parse(formula.toText())).isEqualTo(formula);
        }
    }

    @Nested
    @DisplayName("Errors")
    class Errors {

        @ParameterizedTest
        @ValueSource(strings = {"", "   ", "\t\n"})
        @DisplayName("should reject empty formula")
        void shouldRejectEmpty(String text) {
            assertThatThrownBy(() -> parser.parse(text))
                    .isInstanceOf(FormulaSyntaxException.class)
                    .hasMessageContaining("empty");
        }

        @Test
        @DisplayName("should reject null formula")
        void shouldRejectNull() {
            assertThatThrownBy(() -> parser.parse(null))
                    .isInstanceOf(FormulaSyntaxException.class)
                    .hasMessageContaining("null");
        }

        @ParameterizedTest
        @MethodSource("org.example.formula.parser.FormulaParserTest#malformedFormulas")
        @DisplayName("should report position and expectation")
        void shouldReportPositionAndExpectation(String text, int position, String expected) {
            FormulaSyntaxException error = catchThrowableOfType(() -> parser.parse(text), FormulaSyntaxException.class);

            assertThat(error).isNotNull();
            assertThat(error.getPosition()).isEqualTo(position);
            assertThat(error.getExpected()).isEqualTo(expected);
        }

        @Test
        @DisplayName("should name the dangling connective")
        void shouldNameDanglingConnective() {
            assertThatThrownBy(() -> parser.parse("\"A\" | "))
                    .isInstanceOf(FormulaSyntaxException.class)
                    .hasMessageContaining("Dangling connective '|'");
        }

        @Test
        @DisplayName("should wrap malformed version")
        void shouldWrapMalformedVersion() {
            assertThatThrownBy(() -> parser.parse("\"A\" {>= \"1..0\"}"))
                    .isInstanceOf(FormulaSyntaxException.class)
                    .hasCauseInstanceOf(MalformedVersionException.class)
                    .hasMessageContaining("Malformed version at position 8");
        }
    }

    @Nested
    @DisplayName("Dependency lists")
    class DependencyLists {

        @ParameterizedTest
        @ValueSource(strings = {"", "  ", "[]", "[ ]"})
        @DisplayName("should treat empty lists as no dependencies")
        void shouldTreatEmptyListAsNone(String text) throws Exception {
            assertThat(parser.parseDependencyList(text)).isEmpty();
        }

        @Test
        @DisplayName("should combine list items with and")
        void shouldCombineItems() throws Exception {
            assertThat(parser.parseDependencyList("[ \"B\" {> \"1.0.0\"} \"C\" | \"D\" ]"))
                    .contains(Formula.and(
                            Formula.pkg("B", constraint(Comparator.GT, "1.0.0")),
                            Formula.or(pkg("C"), pkg("D"))));
        }

        @Test
        @DisplayName("should accept a bare formula")
        void shouldAcceptBareFormula() throws Exception {
            assertThat(parser.parseDependencyList("\"E\" {= \"1.0.0\"}"))
                    .contains(Formula.pkg("E", constraint(Comparator.EQ, "1.0.0")));
        }

        @Test
        @DisplayName("should reject unclosed list")
        void shouldRejectUnclosedList() {
            FormulaSyntaxException error = catchThrowableOfType(
                    () -> parser.parseDependencyList("[ \"B\" "), FormulaSyntaxException.class);

            assertThat(error.getExpected()).isEqualTo("']'");
        }

        @Test
        @DisplayName("should parse every fixture depends field")
        void shouldParseFixtureFields() {
            assertThat(PackageFixtures.ENTRIES).allSatisfy(entry ->
                    assertThatCode(() -> parser.parseDependencyList(entry.depends())).doesNotThrowAnyException());
        }
    }
}
