package com.stellarsql.compiler;

import com.stellarsql.catalog.CatalogRegistry;
import com.stellarsql.catalog.CatalogSnapshot;
import com.stellarsql.exception.AdqlCompilationException;
import com.stellarsql.exception.AdqlSyntaxException;
import com.stellarsql.exception.AmbiguousColumnException;
import com.stellarsql.exception.ErrorKind;
import com.stellarsql.exception.UnknownColumnException;
import com.stellarsql.exception.UnknownTableException;
import com.stellarsql.generator.ParameterStyle;
import com.stellarsql.schema.OutputColumn;
import com.stellarsql.test.TestBase;
import com.stellarsql.test.TestCatalogs;
import com.stellarsql.test.TestCategories;
import com.stellarsql.types.DoubleType;
import com.stellarsql.types.LongType;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.*;

/**
 * End-to-end tests: ADQL text in, PostgreSQL text, parameters and result
 * schema out.
 */
@TestCategories.Tier1
@TestCategories.Integration
@DisplayName("AdqlCompiler End-to-End Tests")
public class AdqlCompilerTest extends TestBase {

    private CatalogSnapshot catalog;
    private AdqlCompiler compiler;

    @Override
    protected void doSetUp() {
        catalog = TestCatalogs.standard();
        compiler = new AdqlCompiler();
    }

    private CompiledQuery compile(String adql) {
        logStep("When: Compiling " + adql);
        CompiledQuery compiled = compiler.compile(adql, catalog);
        logData("Generated SQL", compiled.sql());
        logData("Parameters", compiled.parameters());
        return compiled;
    }

    private static List<String> names(CompiledQuery compiled) {
        return compiled.outputColumns().stream().map(OutputColumn::name).collect(Collectors.toList());
    }

    // ==================== Schema ====================

    @Nested
    @DisplayName("Result Schema")
    class ResultSchema {

        @Test
        @DisplayName("Output columns carry catalog type, unit and UCD")
        void testSchemaFidelity() {
            CompiledQuery compiled = compile("SELECT source_id, ra, dec FROM gaia.dr3");

            assertThat(names(compiled)).containsExactly("source_id", "ra", "dec");
            OutputColumn ra = compiled.outputColumns().get(1);
            assertThat(ra.type()).isEqualTo(DoubleType.get());
            assertThat(ra.unit()).isEqualTo("deg");
            assertThat(ra.ucd()).isEqualTo("pos.eq.ra;meta.main");
            assertThat(ra.adqlType()).isEqualTo("DOUBLE");
            assertThat(compiled.outputColumns().get(0).type()).isEqualTo(LongType.get());
            assertThat(compiled.outputColumns().get(0).nullable()).isFalse();
            assertThat(compiled.catalogVersion()).isEqualTo(1L);
        }

        @Test
        @DisplayName("SELECT * expands to the table's columns in declaration order")
        void testStarExpansion() {
            CompiledQuery compiled = compile("SELECT * FROM gaia.dr3");

            assertThat(names(compiled))
                .containsExactly("source_id", "ra", "dec", "parallax", "phot_g_mean_mag");
            assertThat(compiled.sql()).isEqualTo(
                "SELECT dr3.source_id, dr3.ra, dr3.dec, dr3.parallax, dr3.phot_g_mean_mag FROM gaia.dr3");
        }

        @Test
        @DisplayName("Star expansion is the same on every compilation")
        void testStarExpansionDeterminism() {
            CompiledQuery first = compile("SELECT * FROM gaia.dr3 AS g, sdss.photoobj AS p");
            CompiledQuery second = compile("SELECT * FROM gaia.dr3 AS g, sdss.photoobj AS p");

            assertThat(names(first)).isEqualTo(names(second));
            assertThat(names(first)).containsExactly(
                "source_id", "ra", "dec", "parallax", "phot_g_mean_mag", "objid", "ra_2", "dec_2", "Flux");
        }

        @Test
        @DisplayName("Aliased and computed columns are named and quoted")
        void testComputedColumnNames() {
            CompiledQuery compiled = compile("SELECT ra AS RightAscension, ra + 1 FROM gaia.dr3");

            assertThat(names(compiled)).containsExactly("rightascension", "expr_2");
            assertThat(compiled.sql()).isEqualTo(
                "SELECT dr3.ra AS \"rightascension\", (dr3.ra + ?) AS \"expr_2\" FROM gaia.dr3");
            assertThat(compiled.parameters()).containsExactly(1L);
        }

        @Test
        @DisplayName("Case-sensitive catalog columns are quoted")
        void testCaseSensitiveColumn() {
            CompiledQuery compiled = compile("SELECT flux FROM sdss.photoobj");

            assertThat(names(compiled)).containsExactly("Flux");
            assertThat(compiled.sql()).isEqualTo("SELECT photoobj.\"Flux\" FROM sdss.photoobj");
        }
    }

    // ==================== Geometry ====================

    @Nested
    @DisplayName("Geometry")
    class Geometry {

        @Test
        @DisplayName("CONTAINS on indexed columns becomes a q3c radial query")
        void testContainsWithSpatialIndex() {
            CompiledQuery compiled = compile(
                "SELECT ra, dec FROM gaia.dr3 "
                    + "WHERE CONTAINS(POINT('ICRS', ra, dec), CIRCLE('ICRS', 10, 20, 1)) = 1");

            assertThat(compiled.sql()).isEqualTo(
                "SELECT dr3.ra, dr3.dec FROM gaia.dr3 WHERE q3c_radial_query(dr3.ra, dr3.dec, ?, ?, ?)");
            assertThat(compiled.parameters()).containsExactly(10.0, 20.0, 1.0);
        }

        @Test
        @DisplayName("CONTAINS without a spatial index becomes pgSphere containment")
        void testContainsWithoutSpatialIndex() {
            CompiledQuery compiled = compile(
                "SELECT ra, dec FROM sdss.photoobj "
                    + "WHERE CONTAINS(POINT('ICRS', ra, dec), CIRCLE('ICRS', 10, 20, 1)) = 1");

            assertThat(compiled.sql()).isEqualTo(
                "SELECT photoobj.ra, photoobj.dec FROM sdss.photoobj "
                    + "WHERE (spoint(RADIANS(photoobj.ra), RADIANS(photoobj.dec)) @ scircle '<(10d, 20d), 1d>')");
            assertThat(compiled.parameters()).isEmpty();
        }

        @Test
        @DisplayName("q3c can be disabled by configuration")
        void testQ3cDisabled() {
            AdqlCompiler plain = new AdqlCompiler(CompilerConfig.builder().q3cEnabled(false).build());

            CompiledQuery compiled = plain.compile(
                "SELECT ra FROM gaia.dr3 WHERE CONTAINS(POINT('ICRS', ra, dec), CIRCLE('ICRS', 10, 20, 1)) = 1",
                catalog);

            logData("Generated SQL", compiled.sql());
            assertThat(compiled.sql()).contains("@ scircle '<(10d, 20d), 1d>'");
            assertThat(compiled.sql()).doesNotContain("q3c");
        }

        @Test
        @DisplayName("Comparing CONTAINS with 0 negates the predicate")
        void testContainsEqualsZero() {
            CompiledQuery compiled = compile(
                "SELECT ra FROM sdss.photoobj "
                    + "WHERE CONTAINS(POINT('ICRS', ra, dec), CIRCLE('ICRS', 10, 20, 1)) = 0");

            assertThat(compiled.sql()).endsWith(
                "WHERE (NOT (spoint(RADIANS(photoobj.ra), RADIANS(photoobj.dec)) @ scircle '<(10d, 20d), 1d>'))");
        }

        @Test
        @DisplayName("DISTANCE becomes the pgSphere distance operator in degrees")
        void testDistance() {
            CompiledQuery compiled = compile(
                "SELECT DISTANCE(POINT('ICRS', ra, dec), POINT('ICRS', 10, 20)) AS d FROM sdss.photoobj");

            assertThat(compiled.sql()).isEqualTo(
                "SELECT DEGREES((spoint(RADIANS(photoobj.ra), RADIANS(photoobj.dec)) <-> spoint '(10d, 20d)')) "
                    + "AS \"d\" FROM sdss.photoobj");
            assertThat(compiled.outputColumns().get(0).unit()).isEqualTo("deg");
        }

        @Test
        @DisplayName("Comparing CONTAINS with anything but 0 or 1 is rejected")
        void testContainsComparedWithTwo() {
            assertThatThrownBy(() -> compile(
                "SELECT ra FROM sdss.photoobj "
                    + "WHERE CONTAINS(POINT('ICRS', ra, dec), CIRCLE('ICRS', 10, 20, 1)) = 2"))
                .isInstanceOf(AdqlCompilationException.class)
                .extracting(e -> ((AdqlCompilationException) e).kind())
                .isEqualTo(ErrorKind.UNSUPPORTED_FEATURE);
        }
    }

    // ==================== Row Limits ====================

    @Nested
    @DisplayName("Row Limits")
    class RowLimits {

        @Test
        @DisplayName("TOP becomes a bound LIMIT")
        void testTopBecomesLimit() {
            CompiledQuery compiled = compile("SELECT TOP 10 source_id FROM gaia.dr3");

            assertThat(compiled.sql()).isEqualTo("SELECT dr3.source_id FROM gaia.dr3 LIMIT ?");
            assertThat(compiled.parameters()).containsExactly(10L);
            assertThat(compiled.sql()).doesNotContainIgnoringCase("TOP");
        }

        @Test
        @DisplayName("OFFSET is kept after LIMIT")
        void testTopWithOffset() {
            CompiledQuery compiled = compile("SELECT TOP 10 source_id FROM gaia.dr3 ORDER BY source_id OFFSET 20");

            assertThat(compiled.sql()).isEqualTo(
                "SELECT dr3.source_id FROM gaia.dr3 ORDER BY 1 LIMIT ? OFFSET ?");
            assertThat(compiled.parameters()).containsExactly(10L, 20L);
        }

        @Test
        @DisplayName("The configured maximum caps TOP and supplies a missing limit")
        void testMaxRowLimit() {
            AdqlCompiler capped = new AdqlCompiler(CompilerConfig.builder().maxRowLimit(100).build());

            assertThat(capped.compile("SELECT TOP 1000 ra FROM gaia.dr3", catalog).parameters())
                .containsExactly(100L);
            assertThat(capped.compile("SELECT TOP 5 ra FROM gaia.dr3", catalog).parameters())
                .containsExactly(5L);
            assertThat(capped.compile("SELECT ra FROM gaia.dr3", catalog).sql())
                .isEqualTo("SELECT dr3.ra FROM gaia.dr3 LIMIT ?");
        }

        @Test
        @DisplayName("TOP of the first operand limits the whole UNION")
        void testTopOnUnion() {
            CompiledQuery compiled = compile("SELECT TOP 5 ra FROM gaia.dr3 UNION SELECT ra FROM sdss.photoobj");

            assertThat(compiled.sql()).isEqualTo(
                "SELECT dr3.ra FROM gaia.dr3 UNION SELECT photoobj.ra FROM sdss.photoobj LIMIT ?");
            assertThat(compiled.parameters()).containsExactly(5L);
        }

        @Test
        @DisplayName("TOP of the first operand limits a UNION inside an IN subquery")
        void testTopOnNestedUnion() {
            CompiledQuery compiled = compile("SELECT source_id FROM gaia.dr3 WHERE ra IN "
                + "(SELECT TOP 5 ra FROM gaia.dr3 UNION SELECT ra FROM sdss.photoobj)");

            assertThat(compiled.sql()).endsWith(
                "IN (SELECT dr3.ra FROM gaia.dr3 UNION SELECT photoobj.ra FROM sdss.photoobj LIMIT ?)");
            assertThat(compiled.parameters()).containsExactly(5L);
        }

        @Test
        @DisplayName("The row cap applies to the outer query, not to a nested UNION")
        void testRowCapOnNestedUnion() {
            AdqlCompiler capped = new AdqlCompiler(CompilerConfig.builder().maxRowLimit(2).build());

            CompiledQuery compiled = capped.compile("SELECT source_id FROM gaia.dr3 WHERE ra IN "
                + "(SELECT TOP 5 ra FROM gaia.dr3 UNION SELECT ra FROM sdss.photoobj)", catalog);

            assertThat(compiled.sql()).endsWith("UNION SELECT photoobj.ra FROM sdss.photoobj LIMIT ?) LIMIT ?");
            assertThat(compiled.parameters()).containsExactly(5L, 2L);
        }

        @Test
        @DisplayName("TOP of the first operand limits a UNION in a derived table")
        void testTopOnDerivedUnion() {
            CompiledQuery compiled = compile("SELECT t.ra FROM "
                + "(SELECT TOP 3 ra FROM gaia.dr3 UNION SELECT ra FROM sdss.photoobj) AS t");

            assertThat(compiled.sql()).isEqualTo("SELECT t.ra FROM (SELECT dr3.ra FROM gaia.dr3 "
                + "UNION SELECT photoobj.ra FROM sdss.photoobj LIMIT ?) AS t");
            assertThat(compiled.parameters()).containsExactly(3L);
        }
    }

    // ==================== Determinism ====================

    @Nested
    @DisplayName("Determinism")
    class Determinism {

        @Test
        @DisplayName("Compiling the same query twice gives identical output")
        void testIdempotence() {
            String adql = "SELECT TOP 3 g.source_id, p.objid FROM gaia.dr3 AS g "
                + "JOIN sdss.photoobj AS p ON g.source_id = p.objid WHERE g.dec > 10 ORDER BY g.ra DESC";

            CompiledQuery first = compile(adql);
            CompiledQuery second = compile(adql);

            assertThat(second.sql()).isEqualTo(first.sql());
            assertThat(second.parameters()).isEqualTo(first.parameters());
            assertThat(second.outputColumns()).isEqualTo(first.outputColumns());
        }

        @Test
        @DisplayName("Joins keep their aliases and conditions")
        void testJoin() {
            CompiledQuery compiled = compile("SELECT g.source_id, p.objid FROM gaia.dr3 AS g "
                + "JOIN sdss.photoobj AS p ON g.source_id = p.objid");

            assertThat(compiled.sql()).isEqualTo("SELECT g.source_id, p.objid FROM gaia.dr3 AS g "
                + "INNER JOIN sdss.photoobj AS p ON g.source_id = p.objid");
        }

        @Test
        @DisplayName("Numbered parameter style writes $n placeholders")
        void testNumberedParameters() {
            AdqlCompiler numbered = new AdqlCompiler(
                CompilerConfig.builder().parameterStyle(ParameterStyle.NUMBERED).build());

            CompiledQuery compiled = numbered.compile(
                "SELECT TOP 10 ra FROM gaia.dr3 WHERE dec > 5 AND parallax < 2.5", catalog);

            assertThat(compiled.sql()).isEqualTo(
                "SELECT dr3.ra FROM gaia.dr3 WHERE (dr3.dec > $1 AND dr3.parallax < $2) LIMIT $3");
            assertThat(compiled.parameters()).containsExactly(5L, 2.5, 10L);
            assertThat(compiled.inlinedSql()).isEqualTo(
                "SELECT dr3.ra FROM gaia.dr3 WHERE (dr3.dec > 5 AND dr3.parallax < 2.5) LIMIT 10");
        }
    }

    // ==================== Errors ====================

    @Nested
    @DisplayName("Errors")
    class Errors {

        @Test
        @DisplayName("A missing select list fails at the FROM token")
        void testSyntaxErrorPosition() {
            assertThatThrownBy(() -> compile("SELECT FROM gaia.dr3"))
                .isInstanceOfSatisfying(AdqlSyntaxException.class, e -> {
                    assertThat(e.kind()).isEqualTo(ErrorKind.SYNTAX_ERROR);
                    assertThat(e.position().line()).isEqualTo(1);
                    assertThat(e.position().column()).isEqualTo(8);
                    assertThat(e.offendingText()).isEqualTo("FROM");
                });
        }

        @Test
        @DisplayName("An unknown column is named in the error")
        void testUnknownColumn() {
            assertThatThrownBy(() -> compile("SELECT nosuch FROM gaia.dr3"))
                .isInstanceOfSatisfying(UnknownColumnException.class, e -> {
                    assertThat(e.kind()).isEqualTo(ErrorKind.UNKNOWN_COLUMN);
                    assertThat(e.offendingText()).isEqualTo("nosuch");
                    assertThat(e.getMessage()).contains("nosuch");
                    assertThat(e.position().column()).isEqualTo(8);
                });
        }

        @Test
        @DisplayName("An ORDER BY position past the select list points at the position")
        void testOrderByPositionOutOfRange() {
            assertThatThrownBy(() -> compile("SELECT ra FROM gaia.dr3 ORDER BY 3"))
                .isInstanceOfSatisfying(UnknownColumnException.class, e -> {
                    assertThat(e.offendingText()).isEqualTo("3");
                    assertThat(e.position()).isNotNull();
                    assertThat(e.position().line()).isEqualTo(1);
                    assertThat(e.position().column()).isEqualTo(34);
                });
        }

        @Test
        @DisplayName("An unknown table is named in the error")
        void testUnknownTable() {
            assertThatThrownBy(() -> compile("SELECT ra FROM gaia.nosuch"))
                .isInstanceOf(UnknownTableException.class)
                .hasMessageContaining("gaia.nosuch");
        }

        @Test
        @DisplayName("A column present in two tables must be qualified")
        void testAmbiguousColumn() {
            assertThatThrownBy(() -> compile("SELECT ra FROM gaia.dr3 AS g, sdss.photoobj AS p"))
                .isInstanceOfSatisfying(AmbiguousColumnException.class, e -> {
                    assertThat(e.kind()).isEqualTo(ErrorKind.AMBIGUOUS_COLUMN);
                    assertThat(e.getMessage()).contains("g.ra").contains("p.ra");
                });
        }
    }

    // ==================== Long Conditions ====================

    @Nested
    @DisplayName("Long Conditions")
    class LongConditions {

        @Test
        @DisplayName("Ten thousand AND terms compile without exhausting the stack")
        void testLongAndChain() {
            CompiledQuery compiled = compiler.compile(
                "SELECT ra FROM gaia.dr3 WHERE ra = 1" + " AND ra = 1".repeat(9999), catalog);

            assertThat(compiled.sql()).startsWith("SELECT dr3.ra FROM gaia.dr3 WHERE ((((");
            assertThat(compiled.parameters()).hasSize(10000);
        }

        @Test
        @DisplayName("Ten thousand OR terms compile and keep their order")
        void testLongOrChain() {
            StringBuilder adql = new StringBuilder("SELECT ra FROM gaia.dr3 WHERE source_id = 0");
            for (int i = 1; i < 10000; i++) {
                adql.append(" OR source_id = ").append(i);
            }

            CompiledQuery compiled = compiler.compile(adql.toString(), catalog);

            assertThat(compiled.parameters()).hasSize(10000);
            assertThat(compiled.parameters().get(0)).isEqualTo(0L);
            assertThat(compiled.parameters().get(9999)).isEqualTo(9999L);
        }
    }

    // ==================== Catalog Registry ====================

    @Test
    @DisplayName("Compiling against a registry uses its current snapshot")
    void testCompileAgainstRegistry() {
        CatalogRegistry registry = new CatalogRegistry(catalog);
        assertThat(compiler.compile("SELECT ra FROM gaia.dr3", registry).catalogVersion()).isEqualTo(1L);

        registry.refresh(TestCatalogs.standard(2L));

        assertThat(compiler.compile("SELECT ra FROM gaia.dr3", registry).catalogVersion()).isEqualTo(2L);
    }
}
