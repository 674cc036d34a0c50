package com.stellarsql.catalog;

import com.stellarsql.test.TestBase;
import com.stellarsql.test.TestCatalogs;
import com.stellarsql.test.TestCategories;
import com.stellarsql.types.DoubleType;
import com.stellarsql.types.GeometryType;
import com.stellarsql.types.LongType;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for catalog snapshots, table and column metadata, and the
 * snapshot registry.
 */
@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("Catalog Tests")
public class CatalogSnapshotTest extends TestBase {

    @Nested
    @DisplayName("Table Lookup")
    class TableLookup {

        @Test
        @DisplayName("Qualified names are matched ignoring case")
        void testQualifiedLookup() {
            CatalogSnapshot catalog = TestCatalogs.standard();

            assertThat(catalog.lookupTable("gaia.dr3")).isPresent();
            assertThat(catalog.lookupTable("GAIA.DR3")).isPresent();
            assertThat(catalog.lookupTable("sdss.dr3")).isEmpty();
            assertThat(catalog.tables()).hasSize(2);
        }

        @Test
        @DisplayName("Unqualified names match only when one schema has the table")
        void testUnqualifiedLookup() {
            CatalogSnapshot catalog = CatalogSnapshot.builder(1)
                .table(TestCatalogs.gaiaDr3())
                .table(TableMeta.builder("gaia", "sources").column(ColumnMeta.builder("id", "BIGINT").build()).build())
                .table(TableMeta.builder("sdss", "sources").column(ColumnMeta.builder("id", "BIGINT").build()).build())
                .build();

            assertThat(catalog.lookupTable("dr3")).map(TableMeta::qualifiedName).contains("gaia.dr3");
            assertThat(catalog.lookupTable("sources")).isEmpty();
            assertThat(catalog.lookupTable("gaia.sources")).isPresent();
            assertThat(catalog.lookupTable("")).isEmpty();
            assertThat(catalog.lookupTable(null)).isEmpty();
        }

        @Test
        @DisplayName("Duplicate tables are rejected")
        void testDuplicateTable() {
            assertThatThrownBy(() -> CatalogSnapshot.builder(1)
                    .table(TestCatalogs.gaiaDr3())
                    .table(TestCatalogs.gaiaDr3())
                    .build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("gaia.dr3");
        }
    }

    @Nested
    @DisplayName("Table and Column Metadata")
    class Metadata {

        @Test
        @DisplayName("Columns are found ignoring case and keep their metadata")
        void testColumns() {
            TableMeta dr3 = TestCatalogs.gaiaDr3();

            ColumnMeta ra = dr3.column("RA").orElseThrow();
            assertThat(ra.type()).isEqualTo(DoubleType.get());
            assertThat(ra.unit()).isEqualTo("deg");
            assertThat(ra.ucd()).isEqualTo("pos.eq.ra;meta.main");
            assertThat(ra.nullable()).isTrue();
            assertThat(dr3.column("nosuch")).isEmpty();
        }

        @Test
        @DisplayName("Primary key columns are not nullable")
        void testPrimaryKey() {
            TableMeta dr3 = TestCatalogs.gaiaDr3();

            ColumnMeta sourceId = dr3.column("source_id").orElseThrow();
            assertThat(sourceId.type()).isEqualTo(LongType.get());
            assertThat(sourceId.primaryKey()).isTrue();
            assertThat(sourceId.nullable()).isFalse();
            assertThat(dr3.primaryKey()).containsExactly("source_id");
        }

        @Test
        @DisplayName("Spatial indexes are matched on their column pair")
        void testSpatialIndex() {
            TableMeta dr3 = TestCatalogs.gaiaDr3();

            assertThat(dr3.spatialIndex("RA", "Dec")).isPresent();
            assertThat(dr3.spatialIndex("dec", "ra")).isEmpty();
            assertThat(TestCatalogs.sdssPhotoObj().spatialIndexes()).isEmpty();
        }

        @Test
        @DisplayName("Spatial indexes must name existing columns")
        void testSpatialIndexValidation() {
            assertThatThrownBy(() -> TableMeta.builder("gaia", "t")
                    .column(ColumnMeta.builder("ra", "DOUBLE").build())
                    .spatialIndex("ra", "dec")
                    .build())
                .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("Column names must be unique ignoring case")
        void testDuplicateColumn() {
            assertThatThrownBy(() -> TableMeta.builder("gaia", "t")
                    .column(ColumnMeta.builder("ra", "DOUBLE").build())
                    .column(ColumnMeta.builder("RA", "DOUBLE").build()))
                .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("Geometry columns are recognized")
        void testGeometryColumn() {
            ColumnMeta pos = ColumnMeta.builder("pos", "spoint").frame("ICRS").build();

            assertThat(pos.type()).isEqualTo(GeometryType.point());
            assertThat(pos.geometryBacked()).isTrue();
            assertThat(pos.frame()).isEqualTo("ICRS");
        }

        @Test
        @DisplayName("Tables without a schema use their bare name")
        void testQualifiedName() {
            TableMeta table = TableMeta.builder(null, "t").column(ColumnMeta.builder("a", "INTEGER").build()).build();

            assertThat(table.qualifiedName()).isEqualTo("t");
            assertThat(TestCatalogs.gaiaDr3().qualifiedName()).isEqualTo("gaia.dr3");
        }
    }

    @Nested
    @DisplayName("Catalog Registry")
    class Registry {

        @Test
        @DisplayName("A refresh publishes a newer snapshot")
        void testRefresh() {
            CatalogRegistry registry = new CatalogRegistry(TestCatalogs.standard(1));

            registry.refresh(TestCatalogs.standard(2));

            assertThat(registry.current().version()).isEqualTo(2L);
        }

        @Test
        @DisplayName("Older or equal versions are rejected and the current snapshot kept")
        void testStaleRefresh() {
            CatalogRegistry registry = new CatalogRegistry(TestCatalogs.standard(5));

            assertThatThrownBy(() -> registry.refresh(TestCatalogs.standard(5)))
                .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> registry.refresh(TestCatalogs.standard(3)))
                .isInstanceOf(IllegalArgumentException.class);
            assertThat(registry.current().version()).isEqualTo(5L);
        }

        @Test
        @DisplayName("Null snapshots are rejected")
        void testNullSnapshot() {
            assertThatThrownBy(() -> new CatalogRegistry(null)).isInstanceOf(IllegalArgumentException.class);
            CatalogRegistry registry = new CatalogRegistry(TestCatalogs.standard());
            assertThatThrownBy(() -> registry.refresh(null)).isInstanceOf(IllegalArgumentException.class);
        }
    }
}
