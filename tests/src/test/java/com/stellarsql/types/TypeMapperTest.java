package com.stellarsql.types;

import com.stellarsql.test.TestBase;
import com.stellarsql.test.TestCategories;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.*;

/**
 * Test suite for TypeMapper and the type and unit rules of
 * TypeInferenceEngine.
 */
@TestCategories.Tier1
@TestCategories.Unit
@TestCategories.TypeMapping
@DisplayName("Type Mapping Tests")
public class TypeMapperTest extends TestBase {

    // ==================== Catalog types ====================

    @Nested
    @DisplayName("Catalog Type Strings")
    class CatalogTypes {

        @ParameterizedTest(name = "{0} -> {1}")
        @CsvSource({
            "SMALLINT, smallint",
            "int4, integer",
            "BIGINT, bigint",
            "REAL, real",
            "double precision, double",
            "float8, double",
            "VARCHAR(32), varchar",
            "text, varchar",
            "TIMESTAMP, timestamp",
            "boolean, boolean",
            "spoint, point",
            "CIRCLE, circle",
            "spoly, polygon",
            "DOUBLE[], varchar"
        })
        @DisplayName("ADQL and PostgreSQL type names are both accepted")
        void testFromCatalogType(String catalogType, String expectedTypeName) {
            DataType type = TypeMapper.fromCatalogType(catalogType);

            assertThat(type.typeName()).isEqualTo(expectedTypeName);
        }

        @ParameterizedTest
        @ValueSource(strings = {"", "  ", "HSTORE", "xml"})
        @DisplayName("Unknown or empty type strings are rejected")
        void testUnknownCatalogType(String catalogType) {
            assertThatThrownBy(() -> TypeMapper.fromCatalogType(catalogType))
                .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("Null type strings are rejected")
        void testNullCatalogType() {
            assertThatThrownBy(() -> TypeMapper.fromCatalogType(null))
                .isInstanceOf(IllegalArgumentException.class);
        }
    }

    // ==================== Type names ====================

    @Nested
    @DisplayName("Type Names")
    class TypeNames {

        @Test
        @DisplayName("ADQL names are upper-case")
        void testAdqlNames() {
            assertThat(TypeMapper.toAdqlType(DoubleType.get())).isEqualTo("DOUBLE");
            assertThat(TypeMapper.toAdqlType(LongType.get())).isEqualTo("BIGINT");
            assertThat(TypeMapper.toAdqlType(GeometryType.point())).isEqualTo("POINT");
            assertThat(TypeMapper.toAdqlType(NullType.get())).isEqualTo("VARCHAR");
        }

        @Test
        @DisplayName("PostgreSQL names use the pgSphere types for geometries")
        void testPostgresNames() {
            assertThat(TypeMapper.toPostgresType(DoubleType.get())).isEqualTo("double precision");
            assertThat(TypeMapper.toPostgresType(IntegerType.get())).isEqualTo("integer");
            assertThat(TypeMapper.toPostgresType(StringType.get())).isEqualTo("text");
            assertThat(TypeMapper.toPostgresType(GeometryType.point())).isEqualTo("spoint");
            assertThat(TypeMapper.toPostgresType(GeometryType.of(GeometryType.Shape.CIRCLE))).isEqualTo("scircle");
            assertThat(TypeMapper.toPostgresType(GeometryType.of(GeometryType.Shape.BOX))).isEqualTo("spoly");
        }
    }

    // ==================== Promotion ====================

    @Nested
    @DisplayName("Type Promotion")
    class Promotion {

        @Test
        @DisplayName("Numeric types widen along SMALLINT, INTEGER, BIGINT, REAL, DOUBLE")
        void testNumericPromotion() {
            assertThat(TypeInferenceEngine.promoteNumericTypes(ShortType.get(), IntegerType.get()))
                .isEqualTo(IntegerType.get());
            assertThat(TypeInferenceEngine.promoteNumericTypes(LongType.get(), FloatType.get()))
                .isEqualTo(FloatType.get());
            assertThat(TypeInferenceEngine.promoteNumericTypes(DoubleType.get(), IntegerType.get()))
                .isEqualTo(DoubleType.get());
            assertThat(TypeInferenceEngine.promoteNumericTypes(NullType.get(), LongType.get()))
                .isEqualTo(LongType.get());
        }

        @Test
        @DisplayName("Only numeric scalar types have a rank")
        void testNumericRank() {
            assertThat(ShortType.get().numericRank()).isLessThan(IntegerType.get().numericRank());
            assertThat(FloatType.get().numericRank()).isLessThan(DoubleType.get().numericRank());
            assertThat(StringType.get().isNumeric()).isFalse();
            assertThat(NullType.get().isNumeric()).isFalse();
            assertThat(TypeInferenceEngine.isNumeric(GeometryType.point())).isFalse();
        }

        @Test
        @DisplayName("Different geometries unify to REGION, strings and numbers do not unify")
        void testUnification() {
            assertThat(TypeInferenceEngine.unifyTypes(GeometryType.point(), GeometryType.of(GeometryType.Shape.CIRCLE)))
                .isEqualTo(GeometryType.of(GeometryType.Shape.REGION));
            assertThat(TypeInferenceEngine.unifyTypes(StringType.get(), DoubleType.get())).isNull();
        }

        @Test
        @DisplayName("Geometries are never comparable")
        void testComparability() {
            assertThat(TypeInferenceEngine.isComparable(IntegerType.get(), DoubleType.get())).isTrue();
            assertThat(TypeInferenceEngine.isComparable(GeometryType.point(), GeometryType.point())).isFalse();
            assertThat(TypeInferenceEngine.isComparable(StringType.get(), IntegerType.get())).isFalse();
        }
    }

    // ==================== Units ====================

    @Nested
    @DisplayName("Unit Propagation")
    class Units {

        private final FieldInfo degrees = new FieldInfo(DoubleType.get(), "deg", "pos.eq.ra", "ICRS");
        private final FieldInfo seconds = new FieldInfo(DoubleType.get(), "s", "time.duration", null);
        private final FieldInfo plain = FieldInfo.of(IntegerType.get());

        @Test
        @DisplayName("Sums keep matching units and drop mismatched ones")
        void testAdditive() {
            FieldInfo same = TypeInferenceEngine.combineAdditive(degrees, degrees, DoubleType.get());
            FieldInfo mixed = TypeInferenceEngine.combineAdditive(degrees, seconds, DoubleType.get());

            assertThat(same.unit()).isEqualTo("deg");
            assertThat(same.frame()).isEqualTo("ICRS");
            assertThat(mixed.unit()).isEmpty();
            assertThat(mixed.ucd()).isEmpty();
        }

        @Test
        @DisplayName("Products and quotients combine units")
        void testMultiplicative() {
            assertThat(TypeInferenceEngine.combineMultiplicative(degrees, plain, false, DoubleType.get()).unit())
                .isEqualTo("deg");
            assertThat(TypeInferenceEngine.combineMultiplicative(degrees, seconds, false, DoubleType.get()).unit())
                .isEqualTo("deg*s");
            assertThat(TypeInferenceEngine.combineMultiplicative(degrees, seconds, true, DoubleType.get()).unit())
                .isEqualTo("deg/(s)");
            assertThat(TypeInferenceEngine.combineMultiplicative(plain, seconds, true, DoubleType.get()).unit())
                .isEqualTo("1/(s)");
        }
    }
}
