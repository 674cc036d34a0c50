package com.stellarsql.functions;

import com.stellarsql.test.TestBase;
import com.stellarsql.test.TestCategories;
import com.stellarsql.types.DataType;
import com.stellarsql.types.DoubleType;
import com.stellarsql.types.FieldInfo;
import com.stellarsql.types.GeometryType;
import com.stellarsql.types.IntegerType;
import com.stellarsql.types.LongType;
import com.stellarsql.types.StringType;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for the function registry and the built-in signatures.
 */
@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("FunctionRegistry Tests")
public class FunctionRegistryTest extends TestBase {

    private final FunctionRegistry registry = FunctionRegistry.builtins();

    private FunctionSignature lookup(String name, DataType... types) {
        return registry.lookup(name, List.of(types))
            .orElseThrow(() -> new AssertionError("No signature for " + name));
    }

    @Nested
    @DisplayName("Lookup")
    class Lookup {

        @Test
        @DisplayName("Names are matched in any case")
        void testCaseInsensitiveNames() {
            assertThat(registry.isKnown("sqrt")).isTrue();
            assertThat(registry.isKnown("Sqrt")).isTrue();
            assertThat(registry.isKnown("nosuch")).isFalse();
            assertThat(registry.isKnown(null)).isFalse();
            assertThat(registry.signatures("nosuch")).isEmpty();
        }

        @Test
        @DisplayName("Overloads are selected by argument count")
        void testOverloadsByArity() {
            assertThat(lookup("ROUND", DoubleType.get()).translation())
                .isEqualTo(BackendTranslation.rename("round"));
            assertThat(lookup("ROUND", DoubleType.get(), IntegerType.get()).translation().kind())
                .isEqualTo(BackendTranslation.Kind.TEMPLATE);
            assertThat(registry.acceptsArity("ROUND", 3)).isFalse();
        }

        @Test
        @DisplayName("Argument types must fit the parameters")
        void testTypeMismatch() {
            assertThat(registry.lookup("SQRT", List.of(StringType.get()))).isEmpty();
            assertThat(registry.lookup("ROUND", List.of(DoubleType.get(), DoubleType.get()))).isEmpty();
        }

        @Test
        @DisplayName("COUNT accepts a star or one value")
        void testCount() {
            FunctionSignature star = lookup("COUNT");
            assertThat(star.acceptsStar()).isTrue();
            assertThat(star.isAggregate()).isTrue();
            assertThat(star.resultType(List.of())).isEqualTo(LongType.get());
            assertThat(lookup("COUNT", DoubleType.get()).acceptsStar()).isFalse();
        }

        @Test
        @DisplayName("COALESCE is variadic")
        void testVariadic() {
            FunctionSignature coalesce = lookup("COALESCE", DoubleType.get(), IntegerType.get(), DoubleType.get());

            assertThat(coalesce.variadic()).isTrue();
            assertThat(coalesce.acceptsArity(0)).isFalse();
            assertThat(coalesce.resultType(List.of(IntegerType.get(), DoubleType.get())))
                .isEqualTo(DoubleType.get());
        }

        @Test
        @DisplayName("COALESCE rejects arguments without a common type")
        void testCoalesceWithoutCommonType() {
            assertThat(registry.lookup("COALESCE", List.of(StringType.get(), LongType.get()))).isEmpty();
            assertThat(registry.lookup("COALESCE", List.of(StringType.get(), StringType.get()))).isPresent();
        }
    }

    @Nested
    @DisplayName("Backend Translations")
    class Translations {

        @ParameterizedTest(name = "{0} -> {1}")
        @CsvSource({
            "LOG, ln",
            "LOG10, log",
            "CEILING, ceil",
            "TRUNCATE, trunc",
            "RAND, random",
            "SQRT, sqrt"
        })
        @DisplayName("Math functions are renamed")
        void testRenames(String adqlName, String backendName) {
            FunctionSignature signature = registry.signatures(adqlName).get(0);

            assertThat(signature.translation().kind()).isEqualTo(BackendTranslation.Kind.RENAME);
            assertThat(signature.translation().target()).isEqualTo(backendName);
        }

        @Test
        @DisplayName("SQUARE and the two-argument ROUND use templates")
        void testTemplates() {
            assertThat(lookup("SQUARE", DoubleType.get()).translation().target()).isEqualTo("POWER({0}, 2)");
            assertThat(lookup("ROUND", DoubleType.get(), IntegerType.get()).translation().target())
                .isEqualTo("ROUND(CAST({0} AS numeric), {1})");
        }

        @Test
        @DisplayName("RAND with a seed cannot be translated")
        void testSeededRand() {
            assertThat(lookup("RAND", IntegerType.get()).translation().kind())
                .isEqualTo(BackendTranslation.Kind.UNSUPPORTED);
        }

        @Test
        @DisplayName("Geometry functions are left to the morpher")
        void testGeometryFunctions() {
            FunctionSignature contains = lookup("CONTAINS", GeometryType.point(),
                GeometryType.of(GeometryType.Shape.CIRCLE));

            assertThat(contains.translation()).isSameAs(BackendTranslation.morpher());
            assertThat(contains.category()).isEqualTo(FunctionCategory.GEOMETRY);
            assertThat(contains.resultType(List.of())).isEqualTo(IntegerType.get());
        }

        @Test
        @DisplayName("User-defined functions are registered")
        void testUserFunctions() {
            FunctionSignature match = lookup("gavo_match", StringType.get(), StringType.get());

            assertThat(match.category()).isEqualTo(FunctionCategory.USER_DEFINED);
            assertThat(match.translation().kind()).isEqualTo(BackendTranslation.Kind.TEMPLATE);
            assertThat(registry.isKnown("ivo_hasword")).isTrue();
        }
    }

    @Nested
    @DisplayName("Result Metadata")
    class ResultMetadata {

        @Test
        @DisplayName("ABS keeps the argument's unit and UCD")
        void testKeepMetadata() {
            FieldInfo ra = new FieldInfo(DoubleType.get(), "deg", "pos.eq.ra", "ICRS");

            FieldInfo result = lookup("ABS", DoubleType.get()).resultInfo(List.of(ra));

            assertThat(result.unit()).isEqualTo("deg");
            assertThat(result.ucd()).isEqualTo("pos.eq.ra");
        }

        @Test
        @DisplayName("DEGREES sets the unit and inverse trigonometry returns radians")
        void testUnitChanges() {
            FieldInfo angle = new FieldInfo(DoubleType.get(), "rad", "pos.posAng", null);

            assertThat(lookup("DEGREES", DoubleType.get()).resultInfo(List.of(angle)).unit()).isEqualTo("deg");
            assertThat(lookup("ASIN", DoubleType.get()).resultInfo(List.of(FieldInfo.of(DoubleType.get()))).unit())
                .isEqualTo("rad");
        }

        @Test
        @DisplayName("DISTANCE is in degrees")
        void testDistanceUnit() {
            FieldInfo point = FieldInfo.of(GeometryType.point());

            FieldInfo distance = lookup("DISTANCE", GeometryType.point(), GeometryType.point())
                .resultInfo(List.of(point, point));

            assertThat(distance.type()).isEqualTo(DoubleType.get());
            assertThat(distance.unit()).isEqualTo("deg");
        }
    }

    @Test
    @DisplayName("A custom registry holds only what was registered")
    void testCustomRegistry() {
        FunctionRegistry custom = FunctionRegistry.builder()
            .register(FunctionSignature.builder("MYFN")
                .parameters(ParameterType.NUMERIC)
                .returns(DoubleType.get())
                .translation(BackendTranslation.rename("my_fn"))
                .build())
            .build();

        assertThat(custom.registeredFunctionCount()).isEqualTo(1);
        assertThat(custom.isKnown("myfn")).isTrue();
        assertThat(custom.isKnown("SQRT")).isFalse();
        assertThat(FunctionRegistry.builder().addBuiltins().build().registeredFunctionCount())
            .isEqualTo(registry.registeredFunctionCount());
    }
}
