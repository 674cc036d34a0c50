package com.stellarsql.optimizer;

import com.stellarsql.annotation.Annotator;
import com.stellarsql.exception.UnsupportedFeatureException;
import com.stellarsql.expression.BinaryExpression;
import com.stellarsql.expression.Comparison;
import com.stellarsql.expression.Expression;
import com.stellarsql.expression.FunctionCall;
import com.stellarsql.expression.GeometryConstant;
import com.stellarsql.expression.GeometryLiteral;
import com.stellarsql.expression.Literal;
import com.stellarsql.expression.NullCheck;
import com.stellarsql.functions.FunctionRegistry;
import com.stellarsql.logical.DerivedColumn;
import com.stellarsql.logical.QueryExpression;
import com.stellarsql.logical.QuerySpecification;
import com.stellarsql.parser.AdqlQueryParser;
import com.stellarsql.test.TestBase;
import com.stellarsql.test.TestCatalogs;
import com.stellarsql.test.TestCategories;
import com.stellarsql.types.GeometryType;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for the postprocessing rules applied between annotation and
 * morphing.
 */
@TestCategories.Tier1
@TestCategories.Unit
@TestCategories.Expression
@DisplayName("Postprocessor Tests")
public class PostprocessorTest extends TestBase {

    private AdqlQueryParser parser;
    private Annotator annotator;
    private Postprocessor postprocessor;

    @Override
    protected void doSetUp() {
        parser = new AdqlQueryParser();
        annotator = new Annotator();
        postprocessor = new Postprocessor(FunctionRegistry.builtins());
    }

    private QuerySpecification process(String adql) {
        QueryExpression annotated = annotator.annotate(parser.parse(adql), TestCatalogs.standard()).query();
        QueryExpression processed = postprocessor.process(annotated);
        logData("Processed", processed);
        return (QuerySpecification) processed;
    }

    private Expression where(String condition) {
        return process("SELECT ra FROM gaia.dr3 WHERE " + condition).where();
    }

    private Expression selected(String expression) {
        QuerySpecification spec = process("SELECT " + expression + " AS x FROM gaia.dr3");
        return ((DerivedColumn) spec.selectList().items().get(0)).expression();
    }

    // ==================== Constant folding ====================

    @Nested
    @DisplayName("Constant Folding")
    class ConstantFolding {

        @Test
        @DisplayName("Integer arithmetic is folded")
        void testIntegerArithmetic() {
            Comparison comparison = (Comparison) where("dec > 10 + 5");

            assertThat(comparison.right()).isInstanceOf(Literal.class);
            assertThat(((Literal) comparison.right()).value()).isEqualTo(15L);
        }

        @Test
        @DisplayName("Integer division truncates")
        void testIntegerDivision() {
            Expression folded = selected("7 / 2");

            assertThat(((Literal) folded).value()).isEqualTo(3L);
        }

        @Test
        @DisplayName("Mixed arithmetic folds to a double")
        void testDoubleArithmetic() {
            Expression folded = selected("1.5 * 2");

            assertThat(((Literal) folded).kind()).isEqualTo(Literal.Kind.DOUBLE);
            assertThat(((Literal) folded).doubleValue()).isEqualTo(3.0);
        }

        @Test
        @DisplayName("Division by zero is left for the database")
        void testDivisionByZero() {
            assertThat(selected("1 / 0")).isInstanceOf(BinaryExpression.class);
        }

        @Test
        @DisplayName("Nested constants fold bottom-up")
        void testNestedFolding() {
            Expression folded = selected("-(2 * (3 + 4))");

            assertThat(((Literal) folded).value()).isEqualTo(-14L);
        }

        @Test
        @DisplayName("String concatenation of literals is folded")
        void testConcat() {
            Expression folded = selected("'ab' || 'cd'");

            assertThat(((Literal) folded).value()).isEqualTo("abcd");
        }

        @Test
        @DisplayName("Column arithmetic is untouched")
        void testColumnArithmetic() {
            assertThat(selected("ra + 1")).isInstanceOf(BinaryExpression.class);
        }

        @Test
        @DisplayName("COORD1 and COORDSYS of a constant point are folded")
        void testCoordinateAccessors() {
            assertThat(((Literal) selected("COORD1(POINT('ICRS', 10, 20))")).doubleValue()).isEqualTo(10.0);
            assertThat(((Literal) selected("COORD2(POINT('ICRS', 10, 20))")).doubleValue()).isEqualTo(20.0);
            assertThat(((Literal) selected("COORDSYS(POINT('GALACTIC', 10, 20))")).value()).isEqualTo("GALACTIC");
        }
    }

    // ==================== Predicates ====================

    @Nested
    @DisplayName("Predicate Simplification")
    class PredicateSimplification {

        @Test
        @DisplayName("NOT over a comparison negates the operator")
        void testNegatedComparison() {
            Comparison comparison = (Comparison) where("NOT dec < 10");

            assertThat(comparison.operator()).isEqualTo(Comparison.Operator.GE);
        }

        @Test
        @DisplayName("Double negation cancels out")
        void testDoubleNegation() {
            Comparison comparison = (Comparison) where("NOT NOT dec < 10");

            assertThat(comparison.operator()).isEqualTo(Comparison.Operator.LT);
        }

        @Test
        @DisplayName("NOT over IS NULL flips the null check")
        void testNegatedNullCheck() {
            Expression simplified = where("NOT parallax IS NULL");

            assertThat(simplified).isInstanceOf(NullCheck.class);
            assertThat(simplified.toString()).contains("IS NOT NULL");
        }
    }

    // ==================== Geometry ====================

    @Nested
    @DisplayName("Geometry")
    class Geometry {

        @Test
        @DisplayName("Constant constructors become geometry constants")
        void testGeometryFolding() {
            Expression folded = selected("CIRCLE('ICRS', 10, 20, 1)");

            assertThat(folded).isInstanceOf(GeometryConstant.class);
            GeometryConstant circle = (GeometryConstant) folded;
            assertThat(circle.shape()).isEqualTo(GeometryType.Shape.CIRCLE);
            assertThat(circle.frame()).isEqualTo("ICRS");
            assertThat(circle.values()).containsExactly(10.0, 20.0, 1.0);
        }

        @Test
        @DisplayName("A circle around a constant point takes the point's coordinates and frame")
        void testCircleAroundPoint() {
            GeometryConstant circle = (GeometryConstant) selected("CIRCLE(POINT('GALACTIC', 10, 20), 1)");

            assertThat(circle.frame()).isEqualTo("GALACTIC");
            assertThat(circle.values()).containsExactly(10.0, 20.0, 1.0);
        }

        @Test
        @DisplayName("Constructors over columns are not folded")
        void testColumnGeometry() {
            assertThat(selected("POINT('ICRS', ra, dec)")).isInstanceOf(GeometryLiteral.class);
        }

        @Test
        @DisplayName("INTERSECTS with a point becomes CONTAINS with the point first")
        void testIntersectsToContains() {
            Comparison comparison = (Comparison) where(
                "INTERSECTS(CIRCLE('ICRS', 10, 20, 1), POINT('ICRS', ra, dec)) = 1");

            FunctionCall call = (FunctionCall) comparison.left();
            assertThat(call.name()).isEqualTo("CONTAINS");
            assertThat(call.argument(0)).isInstanceOf(GeometryLiteral.class);
            assertThat(((GeometryLiteral) call.argument(0)).shape()).isEqualTo(GeometryType.Shape.POINT);
            assertThat(call.argument(1)).isInstanceOf(GeometryConstant.class);
        }

        @Test
        @DisplayName("INTERSECTS of two areas is kept")
        void testIntersectsOfAreas() {
            Comparison comparison = (Comparison) where(
                "INTERSECTS(CIRCLE('ICRS', ra, dec, 1), BOX('ICRS', 10, 20, 1, 1)) = 1");

            assertThat(((FunctionCall) comparison.left()).name()).isEqualTo("INTERSECTS");
        }
    }

    // ==================== STC-S ====================

    @Nested
    @DisplayName("STC-S Regions")
    class StcsRegions {

        @Test
        @DisplayName("A circle region is parsed with its frame")
        void testCircle() {
            GeometryConstant circle = StcsParser.parse("Circle ICRS GEOCENTER 10 20 0.5", null);

            assertThat(circle.shape()).isEqualTo(GeometryType.Shape.CIRCLE);
            assertThat(circle.frame()).isEqualTo("ICRS");
            assertThat(circle.values()).containsExactly(10.0, 20.0, 0.5);
        }

        @Test
        @DisplayName("Position and polygon regions are parsed")
        void testPositionAndPolygon() {
            assertThat(StcsParser.parse("Position 10 20", null).shape()).isEqualTo(GeometryType.Shape.POINT);
            GeometryConstant polygon = StcsParser.parse("Polygon ICRS 10 20 11 20 11 21 unit deg", null);
            assertThat(polygon.values()).hasSize(6);
        }

        @Test
        @DisplayName("Unsupported shapes and wrong coordinate counts are rejected")
        void testInvalidRegions() {
            assertThatThrownBy(() -> StcsParser.parse("Ellipse ICRS 10 20 1 2 30", null))
                .isInstanceOf(UnsupportedFeatureException.class);
            assertThatThrownBy(() -> StcsParser.parse("Circle ICRS 10 20", null))
                .isInstanceOf(UnsupportedFeatureException.class);
            assertThatThrownBy(() -> StcsParser.parse("   ", null))
                .isInstanceOf(UnsupportedFeatureException.class);
        }

        @Test
        @DisplayName("REGION with a literal folds to a constant")
        void testRegionFolding() {
            GeometryConstant region = (GeometryConstant) selected("REGION('Box FK5 10 20 2 1')");

            assertThat(region.shape()).isEqualTo(GeometryType.Shape.BOX);
            assertThat(region.frame()).isEqualTo("FK5");
        }
    }

    @Test
    @DisplayName("Processing stops once the query no longer changes")
    void testFixpoint() {
        QuerySpecification once = process("SELECT ra FROM gaia.dr3 WHERE dec > 1 + 2");

        assertThat(postprocessor.process(once)).isEqualTo(once);
        assertThat(postprocessor.rules()).hasSize(4);
        assertThat(postprocessor.maxIterations()).isEqualTo(Postprocessor.DEFAULT_MAX_ITERATIONS);
        assertThat(postprocessor.process(null)).isNull();
    }
}
