package org.example.formula.model;

import org.example.formula.version.Comparator;
import org.example.formula.version.Constraint;
import org.example.formula.version.Version;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for Formula.
 */
class FormulaTest {

    private Constraint ge100;
    private Constraint notLt250;
    private Formula x;

    @BeforeEach
    void setUp() throws Exception {
        ge100 = Constraint.of(Comparator.GE, Version.parse("1.0.0"));
        notLt250 = Constraint.of(Comparator.LT, Version.parse("2.5.0")).negate();
        x = Formula.pkg("X", ge100, notLt250);
    }

    private static PackageVersion pv(String name, String version) throws Exception {
        return new PackageVersion(name, Version.parse(version));
    }

    @Nested
    @DisplayName("Construction")
    class Construction {

        @Test
        @DisplayName("should reject empty package name")
        void shouldRejectEmptyName() {
            assertThatThrownBy(() -> Formula.pkg(""))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("cannot be empty");
        }

        @Test
        @DisplayName("should reject null operands")
        void shouldRejectNullOperands() {
            assertThatThrownBy(() -> Formula.and(x, null))
                    .isInstanceOf(NullPointerException.class)
                    .hasMessageContaining("right");
            assertThatThrownBy(() -> Formula.not(null))
                    .isInstanceOf(NullPointerException.class)
                    .hasMessageContaining("operand");
        }

        @Test
        @DisplayName("should expose only the fields of its kind")
        void shouldExposeOnlyFieldsOfKind() {
            Formula not = Formula.not(x);

            assertThat(not.getOperand()).isEqualTo(x);
            assertThatThrownBy(not::getName).isInstanceOf(IllegalStateException.class);
            assertThatThrownBy(x::getLeft).isInstanceOf(IllegalStateException.class);
        }

        @Test
        @DisplayName("allOf should fold to a left-nested conjunction")
        void allOfShouldFoldLeft() {
            Formula a = Formula.pkg("A");
            Formula b = Formula.pkg("B");
            Formula c = Formula.pkg("C");

            assertThat(Formula.allOf(List.of(a, b, c)))
                    .contains(Formula.and(Formula.and(a, b), c));
            assertThat(Formula.allOf(List.of())).isEmpty();
        }

        @Test
        @DisplayName("should compare structurally")
        void shouldCompareStructurally() {
            Formula first = Formula.or(Formula.pkg("A"), Formula.pkg("B", ge100));
            Formula second = Formula.or(Formula.pkg("A"), Formula.pkg("B", ge100));

            assertThat(first).isEqualTo(second);
            assertThat(first.hashCode()).isEqualTo(second.hashCode());
            assertThat(first).isNotEqualTo(Formula.and(Formula.pkg("A"), Formula.pkg("B", ge100)));
        }
    }

    @Nested
    @DisplayName("Single-candidate evaluation")
    class SingleCandidate {

        @Test
        @DisplayName("negated constraint should require at least the bound")
        void negatedConstraintShouldRequireBound() throws Exception {
            assertThat(x.evaluate(pv("X", "0.9.0"))).isFalse();
            assertThat(x.evaluate(pv("X", "1.0.0"))).isFalse();
            assertThat(x.evaluate(pv("X", "2.0.0"))).isFalse();
            assertThat(x.evaluate(pv("X", "2.5.0"))).isTrue();
            assertThat(x.evaluate(pv("X", "3.0.0"))).isTrue();
        }

        @Test
        @DisplayName("should not match another package")
        void shouldNotMatchOtherPackage() throws Exception {
            assertThat(x.evaluate(pv("Y", "3.0.0"))).isFalse();
            assertThat(Formula.not(x).evaluate(pv("Y", "3.0.0"))).isTrue();
        }

        @Test
        @DisplayName("should combine with or")
        void shouldCombineWithOr() throws Exception {
            Formula either = Formula.or(x, Formula.pkg("X", Constraint.of(Comparator.EQ, Version.parse("1.0.0"))));

            assertThat(either.evaluate(pv("X", "1.0.0"))).isTrue();
            assertThat(either.evaluate(pv("X", "2.0.0"))).isFalse();
        }
    }

    @Nested
    @DisplayName("Selection evaluation")
    class SelectionEvaluation {

        @Test
        @DisplayName("should require the package to be selected")
        void shouldRequireSelection() throws Exception {
            Selection selection = Selection.builder()
                    .select("X", Version.parse("3.0.0"))
                    .build();

            assertThat(x.evaluate(selection)).isTrue();
            assertThat(Formula.pkg("Y").evaluate(selection)).isFalse();
            assertThat(Formula.not(Formula.pkg("Y")).evaluate(selection)).isTrue();
        }

        @Test
        @DisplayName("should evaluate a fixture formula against a selection")
        void shouldEvaluateFixtureFormula() throws Exception {
            Formula a300 = Formula.or(
                    Formula.and(
                            Formula.pkg("B", Constraint.of(Comparator.GE, Version.parse("2.0.0"))),
                            Formula.pkg("C", Constraint.of(Comparator.GE, Version.parse("1.5.0")))),
                    Formula.and(
                            Formula.pkg("D", Constraint.of(Comparator.GE, Version.parse("2.0.0"))),
                            Formula.pkg("E", Constraint.of(Comparator.EQ, Version.parse("1.0.0")))));

            Selection left = Selection.builder()
                    .select("B", Version.parse("2.0.0"))
                    .select("C", Version.parse("1.5.0"))
                    .build();
            Selection right = Selection.builder()
                    .select("D", Version.parse("2.0.0"))
                    .select("E", Version.parse("1.0.0"))
                    .build();
            Selection neither = Selection.builder()
                    .select("B", Version.parse("2.0.0"))
                    .select("C", Version.parse("1.0.0"))
                    .build();

            assertThat(a300.evaluate(left)).isTrue();
            assertThat(a300.evaluate(right)).isTrue();
            assertThat(a300.evaluate(neither)).isFalse();
        }
    }

    @Nested
    @DisplayName("Traversal and rendering")
    class TraversalAndRendering {

        private Formula formula;

        @BeforeEach
        void setUpFormula() {
            // "B" & ("C" | ! "D") & "B" {>= "1.0.0"}
            formula = Formula.and(
                    Formula.and(Formula.pkg("B"), Formula.or(Formula.pkg("C"), Formula.not(Formula.pkg("D")))),
                    Formula.pkg("B", ge100));
        }

        @Test
        @DisplayName("should list package names in pre-order without duplicates")
        void shouldListPackageNames() {
            assertThat(formula.packageNames()).containsExactly("B", "C", "D");
        }

        @Test
        @DisplayName("should separate positive and mandatory leaves")
        void shouldSeparateLeaves() {
            assertThat(formula.leaves()).extracting(Formula::getName).containsExactly("B", "C", "D", "B");
            assertThat(formula.positiveLeaves()).extracting(Formula::getName).containsExactly("B", "C", "B");
            assertThat(formula.mandatoryLeaves()).extracting(Formula::getName).containsExactly("B", "B");
        }

        @Test
        @DisplayName("should render canonical text")
        void shouldRenderCanonicalText() {
            assertThat(formula.toText())
                    .isEqualTo("((\"B\" & (\"C\" | ! (\"D\"))) & \"B\" {>= \"1.0.0\"})");
            assertThat(x.toText()).isEqualTo("\"X\" {>= \"1.0.0\" & ! (< \"2.5.0\")}");
        }
    }
}
