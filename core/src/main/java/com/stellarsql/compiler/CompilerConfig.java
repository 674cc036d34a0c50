package com.stellarsql.compiler;

import com.stellarsql.generator.ParameterStyle;
import com.stellarsql.morph.CoordinateConversionRegistry;
import com.stellarsql.parser.AdqlQueryParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Objects;
import java.util.Properties;

/**
 * Immutable settings for an {@link AdqlCompiler}.
 *
 * <p>Settings can be read from properties with the keys
 * <ul>
 *   <li>{@code stellarsql.maxNestingDepth} (default 100)</li>
 *   <li>{@code stellarsql.q3cEnabled} (default true)</li>
 *   <li>{@code stellarsql.maxRowLimit} (default 0, no cap)</li>
 *   <li>{@code stellarsql.parameterStyle}, {@code POSITIONAL} or {@code NUMBERED}</li>
 * </ul>
 * Missing or malformed values fall back to the defaults.
 */
public final class CompilerConfig {

    private static final Logger logger = LoggerFactory.getLogger(CompilerConfig.class);

    public static final String PROP_MAX_NESTING_DEPTH = "stellarsql.maxNestingDepth";
    public static final String PROP_Q3C_ENABLED = "stellarsql.q3cEnabled";
    public static final String PROP_MAX_ROW_LIMIT = "stellarsql.maxRowLimit";
    public static final String PROP_PARAMETER_STYLE = "stellarsql.parameterStyle";

    private static final CompilerConfig DEFAULTS = builder().build();

    private final int maxNestingDepth;
    private final boolean q3cEnabled;
    private final long maxRowLimit;
    private final ParameterStyle parameterStyle;
    private final CoordinateConversionRegistry coordinateConversions;

    private CompilerConfig(Builder builder) {
        this.maxNestingDepth = builder.maxNestingDepth;
        this.q3cEnabled = builder.q3cEnabled;
        this.maxRowLimit = builder.maxRowLimit;
        this.parameterStyle = builder.parameterStyle;
        this.coordinateConversions = builder.coordinateConversions;
    }

    public static CompilerConfig defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Reads settings from the JVM system properties.
     */
    public static CompilerConfig fromSystemProperties() {
        return fromProperties(System.getProperties());
    }

    /**
     * Reads settings from a property set.
     *
     * @param properties the properties; keys without a value keep their default
     * @return the config
     */
    public static CompilerConfig fromProperties(Properties properties) {
        Objects.requireNonNull(properties, "properties must not be null");
        Builder builder = builder();

        String depth = properties.getProperty(PROP_MAX_NESTING_DEPTH);
        if (depth != null) {
            try {
                int value = Integer.parseInt(depth.trim());
                if (value > 0) {
                    builder.maxNestingDepth(value);
                } else {
                    logger.warn("Ignoring non-positive {}={}", PROP_MAX_NESTING_DEPTH, depth);
                }
            } catch (NumberFormatException e) {
                logger.warn("Ignoring malformed {}={}", PROP_MAX_NESTING_DEPTH, depth);
            }
        }

        String q3c = properties.getProperty(PROP_Q3C_ENABLED);
        if (q3c != null) {
            builder.q3cEnabled(Boolean.parseBoolean(q3c.trim()));
        }

        String rowLimit = properties.getProperty(PROP_MAX_ROW_LIMIT);
        if (rowLimit != null) {
            try {
                long value = Long.parseLong(rowLimit.trim());
                if (value >= 0) {
                    builder.maxRowLimit(value);
                } else {
                    logger.warn("Ignoring negative {}={}", PROP_MAX_ROW_LIMIT, rowLimit);
                }
            } catch (NumberFormatException e) {
                logger.warn("Ignoring malformed {}={}", PROP_MAX_ROW_LIMIT, rowLimit);
            }
        }

        String style = properties.getProperty(PROP_PARAMETER_STYLE);
        if (style != null) {
            try {
                builder.parameterStyle(ParameterStyle.valueOf(style.trim().toUpperCase(Locale.ROOT)));
            } catch (IllegalArgumentException e) {
                logger.warn("Ignoring unknown {}={}", PROP_PARAMETER_STYLE, style);
            }
        }
        return builder.build();
    }

    public int maxNestingDepth() {
        return maxNestingDepth;
    }

    public boolean q3cEnabled() {
        return q3cEnabled;
    }

    /**
     * Returns the cap on the outermost row limit.
     *
     * @return the cap, 0 for none
     */
    public long maxRowLimit() {
        return maxRowLimit;
    }

    public ParameterStyle parameterStyle() {
        return parameterStyle;
    }

    public CoordinateConversionRegistry coordinateConversions() {
        return coordinateConversions;
    }

    public Builder toBuilder() {
        return builder()
            .maxNestingDepth(maxNestingDepth)
            .q3cEnabled(q3cEnabled)
            .maxRowLimit(maxRowLimit)
            .parameterStyle(parameterStyle)
            .coordinateConversions(coordinateConversions);
    }

    @Override
    public String toString() {
        return String.format("CompilerConfig[maxNestingDepth=%d, q3cEnabled=%b, maxRowLimit=%d, parameterStyle=%s]",
            maxNestingDepth, q3cEnabled, maxRowLimit, parameterStyle);
    }

    /**
     * Builder for {@link CompilerConfig}.
     */
    public static final class Builder {

        private int maxNestingDepth = AdqlQueryParser.DEFAULT_MAX_DEPTH;
        private boolean q3cEnabled = true;
        private long maxRowLimit;
        private ParameterStyle parameterStyle = ParameterStyle.POSITIONAL;
        private CoordinateConversionRegistry coordinateConversions = CoordinateConversionRegistry.defaults();

        private Builder() {
        }

        public Builder maxNestingDepth(int maxNestingDepth) {
            if (maxNestingDepth <= 0) {
                throw new IllegalArgumentException("maxNestingDepth must be positive: " + maxNestingDepth);
            }
            this.maxNestingDepth = maxNestingDepth;
            return this;
        }

        public Builder q3cEnabled(boolean q3cEnabled) {
            this.q3cEnabled = q3cEnabled;
            return this;
        }

        public Builder maxRowLimit(long maxRowLimit) {
            if (maxRowLimit < 0) {
                throw new IllegalArgumentException("maxRowLimit must not be negative: " + maxRowLimit);
            }
            this.maxRowLimit = maxRowLimit;
            return this;
        }

        public Builder parameterStyle(ParameterStyle parameterStyle) {
            this.parameterStyle = Objects.requireNonNull(parameterStyle, "parameterStyle must not be null");
            return this;
        }

        public Builder coordinateConversions(CoordinateConversionRegistry coordinateConversions) {
            this.coordinateConversions = Objects.requireNonNull(coordinateConversions,
                "coordinateConversions must not be null");
            return this;
        }

        public CompilerConfig build() {
            return new CompilerConfig(this);
        }
    }
}
