package com.stellarsql.compiler;

import com.stellarsql.exception.RecursionLimitException;
import com.stellarsql.generator.ParameterStyle;
import com.stellarsql.morph.CoordinateConversionRegistry;
import com.stellarsql.test.TestBase;
import com.stellarsql.test.TestCatalogs;
import com.stellarsql.test.TestCategories;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Properties;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for compiler settings and their property-based loading.
 */
@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("CompilerConfig Tests")
public class CompilerConfigTest extends TestBase {

    private static Properties properties(String... keyValues) {
        Properties properties = new Properties();
        for (int i = 0; i < keyValues.length; i += 2) {
            properties.setProperty(keyValues[i], keyValues[i + 1]);
        }
        return properties;
    }

    @Test
    @DisplayName("Defaults match the documented values")
    void testDefaults() {
        CompilerConfig config = CompilerConfig.defaults();

        assertThat(config.maxNestingDepth()).isEqualTo(100);
        assertThat(config.q3cEnabled()).isTrue();
        assertThat(config.maxRowLimit()).isZero();
        assertThat(config.parameterStyle()).isEqualTo(ParameterStyle.POSITIONAL);
        assertThat(config.coordinateConversions()).isSameAs(CoordinateConversionRegistry.defaults());
    }

    @Test
    @DisplayName("Properties override the defaults")
    void testFromProperties() {
        CompilerConfig config = CompilerConfig.fromProperties(properties(
            CompilerConfig.PROP_MAX_NESTING_DEPTH, "50",
            CompilerConfig.PROP_Q3C_ENABLED, "false",
            CompilerConfig.PROP_MAX_ROW_LIMIT, " 2000 ",
            CompilerConfig.PROP_PARAMETER_STYLE, "numbered"));

        logData("Config", config);
        assertThat(config.maxNestingDepth()).isEqualTo(50);
        assertThat(config.q3cEnabled()).isFalse();
        assertThat(config.maxRowLimit()).isEqualTo(2000L);
        assertThat(config.parameterStyle()).isEqualTo(ParameterStyle.NUMBERED);
    }

    @Test
    @DisplayName("Malformed and out-of-range values keep the defaults")
    void testInvalidProperties() {
        CompilerConfig config = CompilerConfig.fromProperties(properties(
            CompilerConfig.PROP_MAX_NESTING_DEPTH, "deep",
            CompilerConfig.PROP_MAX_ROW_LIMIT, "-5",
            CompilerConfig.PROP_PARAMETER_STYLE, "named"));

        assertThat(config.maxNestingDepth()).isEqualTo(100);
        assertThat(config.maxRowLimit()).isZero();
        assertThat(config.parameterStyle()).isEqualTo(ParameterStyle.POSITIONAL);

        assertThat(CompilerConfig.fromProperties(properties(CompilerConfig.PROP_MAX_NESTING_DEPTH, "0"))
            .maxNestingDepth()).isEqualTo(100);
    }

    @Test
    @DisplayName("The builder rejects invalid limits")
    void testBuilderValidation() {
        assertThatThrownBy(() -> CompilerConfig.builder().maxNestingDepth(0))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> CompilerConfig.builder().maxRowLimit(-1))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> CompilerConfig.builder().parameterStyle(null))
            .isInstanceOf(NullPointerException.class);
    }

    @Test
    @DisplayName("toBuilder copies every setting")
    void testToBuilder() {
        CompilerConfig original = CompilerConfig.builder()
            .maxNestingDepth(20)
            .q3cEnabled(false)
            .maxRowLimit(10)
            .parameterStyle(ParameterStyle.NUMBERED)
            .build();

        CompilerConfig copy = original.toBuilder().build();

        assertThat(copy.toString()).isEqualTo(original.toString());
        assertThat(copy.toString()).contains("maxNestingDepth=20", "q3cEnabled=false", "maxRowLimit=10");
    }

    @Test
    @DisplayName("The nesting limit reaches the parser")
    void testNestingLimitApplied() {
        AdqlCompiler strict = new AdqlCompiler(CompilerConfig.builder().maxNestingDepth(5).build());

        assertThat(strict.config().maxNestingDepth()).isEqualTo(5);
        assertThatThrownBy(() -> strict.compile("SELECT ((((((((ra)))))))) AS x FROM gaia.dr3",
                TestCatalogs.standard()))
            .isInstanceOf(RecursionLimitException.class);
    }
}
