package com.stellarsql.annotation;

import com.stellarsql.catalog.CatalogSnapshot;
import com.stellarsql.exception.ArityMismatchException;
import com.stellarsql.exception.ErrorKind;
import com.stellarsql.exception.GroupingException;
import com.stellarsql.exception.RecursionLimitException;
import com.stellarsql.exception.TypeMismatchException;
import com.stellarsql.exception.UnknownColumnException;
import com.stellarsql.exception.UnknownTableException;
import com.stellarsql.exception.UnsupportedFunctionException;
import com.stellarsql.expression.BinaryExpression;
import com.stellarsql.expression.ColumnReference;
import com.stellarsql.expression.Comparison;
import com.stellarsql.expression.Expression;
import com.stellarsql.expression.Literal;
import com.stellarsql.functions.FunctionRegistry;
import com.stellarsql.logical.DerivedColumn;
import com.stellarsql.logical.QuerySpecification;
import com.stellarsql.parser.AdqlQueryParser;
import com.stellarsql.parser.SourcePosition;
import com.stellarsql.schema.OutputColumn;
import com.stellarsql.test.TestBase;
import com.stellarsql.test.TestCatalogs;
import com.stellarsql.test.TestCategories;
import com.stellarsql.types.DoubleType;
import com.stellarsql.types.GeometryType;
import com.stellarsql.types.IntegerType;
import com.stellarsql.types.LongType;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for the annotator: name resolution, typing, metadata propagation
 * and grouping validation.
 */
@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("Annotator Tests")
public class AnnotatorTest extends TestBase {

    private AdqlQueryParser parser;
    private Annotator annotator;
    private CatalogSnapshot catalog;

    @Override
    protected void doSetUp() {
        parser = new AdqlQueryParser();
        annotator = new Annotator();
        catalog = TestCatalogs.standard();
    }

    private AnnotatedQuery annotate(String adql) {
        AnnotatedQuery annotated = annotator.annotate(parser.parse(adql), catalog);
        logData("Output columns", annotated.outputColumns());
        return annotated;
    }

    private List<String> names(String adql) {
        return annotate(adql).outputColumns().stream().map(OutputColumn::name).collect(Collectors.toList());
    }

    // ==================== Resolution ====================

    @Nested
    @DisplayName("Name Resolution")
    class NameResolution {

        @Test
        @DisplayName("Column references are bound to their FROM item")
        void testBinding() {
            AnnotatedQuery annotated = annotate("SELECT g.ra FROM gaia.dr3 AS g");

            QuerySpecification spec = (QuerySpecification) annotated.query();
            ColumnReference ref = (ColumnReference) ((DerivedColumn) spec.selectList().items().get(0)).expression();
            assertThat(ref.binding()).isNotNull();
            assertThat(ref.binding().rangeName()).isEqualTo("g");
            assertThat(ref.binding().columnName()).isEqualTo("ra");
            assertThat(ref.binding().scopeDepth()).isZero();
            assertThat(ref.binding().column()).isNotNull();
        }

        @Test
        @DisplayName("Regular identifiers match case-insensitively")
        void testCaseInsensitiveMatch() {
            assertThat(names("SELECT RA, Dec FROM GAIA.DR3")).containsExactly("ra", "dec");
        }

        @Test
        @DisplayName("Delimited identifiers must match exactly")
        void testDelimitedMatch() {
            assertThat(names("SELECT \"Flux\" FROM sdss.photoobj")).containsExactly("Flux");
            assertThatThrownBy(() -> annotate("SELECT \"flux\" FROM sdss.photoobj"))
                .isInstanceOfSatisfying(UnknownColumnException.class, e ->
                    assertThat(e.kind()).isEqualTo(ErrorKind.UNKNOWN_COLUMN));
        }

        @Test
        @DisplayName("An unqualified table name resolves when it is unique")
        void testUnqualifiedTable() {
            assertThat(names("SELECT source_id FROM dr3")).containsExactly("source_id");
        }

        @Test
        @DisplayName("An unknown qualifier is an unknown table")
        void testUnknownQualifier() {
            assertThatThrownBy(() -> annotate("SELECT x.ra FROM gaia.dr3 AS g"))
                .isInstanceOf(UnknownTableException.class);
        }

        @Test
        @DisplayName("Correlated subqueries see the outer query's columns")
        void testCorrelatedReference() {
            AnnotatedQuery annotated = annotate("SELECT source_id FROM gaia.dr3 AS g WHERE EXISTS "
                + "(SELECT objid FROM sdss.photoobj AS p WHERE p.objid = g.source_id)");

            assertThat(annotated.outputColumns()).hasSize(1);
        }

        @Test
        @DisplayName("Derived table columns carry the inner metadata")
        void testDerivedTable() {
            AnnotatedQuery annotated = annotate("SELECT s.x FROM (SELECT ra AS x FROM gaia.dr3) AS s");

            OutputColumn x = annotated.outputColumns().get(0);
            assertThat(x.name()).isEqualTo("x");
            assertThat(x.type()).isEqualTo(DoubleType.get());
            assertThat(x.unit()).isEqualTo("deg");
        }

        @Test
        @DisplayName("USING merges the join column into one output column")
        void testJoinUsing() {
            List<String> names = names("SELECT * FROM gaia.dr3 AS g JOIN sdss.photoobj AS p USING (ra)");

            assertThat(names).filteredOn(name -> name.startsWith("ra")).containsExactly("ra");
        }
    }

    // ==================== Types ====================

    @Nested
    @DisplayName("Types and Metadata")
    class TypesAndMetadata {

        @Test
        @DisplayName("Arithmetic promotes to the wider type")
        void testArithmeticTypes() {
            List<OutputColumn> columns = annotate(
                "SELECT source_id + 1 AS a, ra * 2 AS b, 1 + 2 AS c FROM gaia.dr3").outputColumns();

            assertThat(columns.get(0).type()).isEqualTo(LongType.get());
            assertThat(columns.get(1).type()).isEqualTo(DoubleType.get());
            assertThat(columns.get(2).type()).isEqualTo(IntegerType.get());
        }

        @Test
        @DisplayName("Aggregates have their own result types")
        void testAggregateTypes() {
            List<OutputColumn> columns = annotate(
                "SELECT COUNT(*) AS n, AVG(parallax) AS p, MAX(ra) AS m FROM gaia.dr3").outputColumns();

            assertThat(columns.get(0).type()).isEqualTo(LongType.get());
            assertThat(columns.get(1).type()).isEqualTo(DoubleType.get());
            assertThat(columns.get(2).type()).isEqualTo(DoubleType.get());
            assertThat(columns.get(2).unit()).isEqualTo("deg");
        }

        @Test
        @DisplayName("Geometry constructors are typed by shape")
        void testGeometryTypes() {
            OutputColumn point = annotate("SELECT POINT('ICRS', ra, dec) AS p FROM gaia.dr3")
                .outputColumns().get(0);

            assertThat(point.type()).isEqualTo(GeometryType.point());
            assertThat(point.adqlType()).isEqualTo("POINT");
        }

        @Test
        @DisplayName("Comparing a number with a string is a type error")
        void testComparisonTypeMismatch() {
            assertThatThrownBy(() -> annotate("SELECT ra FROM gaia.dr3 WHERE ra = 'abc'"))
                .isInstanceOf(TypeMismatchException.class);
        }

        @Test
        @DisplayName("Geometries cannot be compared with numbers")
        void testGeometryComparison() {
            assertThatThrownBy(() -> annotate("SELECT ra FROM gaia.dr3 WHERE POINT('ICRS', ra, dec) = 1"))
                .isInstanceOf(TypeMismatchException.class)
                .hasMessageContaining("Cannot compare");
        }

        @Test
        @DisplayName("COALESCE arguments must share a type")
        void testCoalesceMismatch() {
            assertThatThrownBy(() -> annotate("SELECT COALESCE('a', 1) FROM gaia.dr3"))
                .isInstanceOf(TypeMismatchException.class)
                .hasMessageContaining("COALESCE");
            assertThat(annotate("SELECT COALESCE(ra, 0) AS r FROM gaia.dr3").outputColumns().get(0).type())
                .isEqualTo(DoubleType.get());
        }

        @Test
        @DisplayName("Unknown functions and wrong arities are rejected")
        void testFunctionErrors() {
            assertThatThrownBy(() -> annotate("SELECT nosuchfn(ra) FROM gaia.dr3"))
                .isInstanceOf(UnsupportedFunctionException.class);
            assertThatThrownBy(() -> annotate("SELECT ABS(ra, dec) FROM gaia.dr3"))
                .isInstanceOf(ArityMismatchException.class);
            assertThatThrownBy(() -> annotate("SELECT POINT('ICRS', ra) FROM gaia.dr3"))
                .isInstanceOf(ArityMismatchException.class);
        }

        @Test
        @DisplayName("Set operation operands must agree in column count")
        void testSetOperationArity() {
            assertThatThrownBy(() -> annotate("SELECT ra, dec FROM gaia.dr3 UNION SELECT ra FROM sdss.photoobj"))
                .isInstanceOf(TypeMismatchException.class);
        }
    }

    // ==================== Grouping ====================

    @Nested
    @DisplayName("Grouping")
    class Grouping {

        @Test
        @DisplayName("Grouped queries may select keys and aggregates")
        void testValidGrouping() {
            assertThat(names("SELECT phot_g_mean_mag, COUNT(*) AS n FROM gaia.dr3 GROUP BY phot_g_mean_mag"))
                .containsExactly("phot_g_mean_mag", "n");
        }

        @Test
        @DisplayName("A non-grouped column next to an aggregate is rejected")
        void testUngroupedColumn() {
            assertThatThrownBy(() -> annotate("SELECT ra, COUNT(*) FROM gaia.dr3"))
                .isInstanceOfSatisfying(GroupingException.class, e ->
                    assertThat(e.kind()).isEqualTo(ErrorKind.GROUPING_ERROR));
        }

        @Test
        @DisplayName("Aggregates are not allowed in WHERE")
        void testAggregateInWhere() {
            assertThatThrownBy(() -> annotate("SELECT ra FROM gaia.dr3 WHERE COUNT(*) > 1"))
                .isInstanceOf(GroupingException.class);
        }

        @Test
        @DisplayName("Aggregates cannot be nested")
        void testNestedAggregate() {
            assertThatThrownBy(() -> annotate("SELECT MAX(COUNT(*)) FROM gaia.dr3"))
                .isInstanceOf(GroupingException.class);
        }

        @Test
        @DisplayName("GROUP BY may name a select-list alias")
        void testGroupByAlias() {
            assertThat(names("SELECT phot_g_mean_mag AS mag, COUNT(*) AS n FROM gaia.dr3 GROUP BY mag"))
                .containsExactly("mag", "n");
        }
    }

    @Test
    @DisplayName("The annotated query records the catalog version")
    void testCatalogVersion() {
        AnnotatedQuery annotated = annotator.annotate(parser.parse("SELECT ra FROM gaia.dr3"),
            TestCatalogs.standard(42L));

        assertThat(annotated.catalogVersion()).isEqualTo(42L);
        assertThat(annotated.outputColumns()).isEqualTo(annotated.query().outputColumns());
    }

    // ==================== Depth ====================

    @Test
    @DisplayName("A condition tree deeper than the limit fails with a recursion error")
    void testDeepConditionTree() {
        QuerySpecification spec = (QuerySpecification) parser.parse("SELECT ra FROM gaia.dr3");
        Expression condition = ra(0);
        for (int i = 1; i < 500; i++) {
            condition = BinaryExpression.and(condition, ra(i));
        }
        QuerySpecification deep = spec.toBuilder().where(condition).build();

        assertThatThrownBy(() -> annotator.annotate(deep, catalog))
            .isInstanceOfSatisfying(RecursionLimitException.class,
                e -> assertThat(e.kind()).isEqualTo(ErrorKind.RECURSION_LIMIT));
        assertThatCode(() -> new Annotator(FunctionRegistry.builtins(), 1000).annotate(deep, catalog))
            .doesNotThrowAnyException();
    }

    private static Expression ra(long value) {
        return new Comparison(ColumnReference.of("ra"), Comparison.Operator.EQ, Literal.of(value),
            SourcePosition.UNKNOWN);
    }
}
