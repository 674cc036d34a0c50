package com.stellarsql.morph;

import com.stellarsql.exception.UnsupportedFeatureException;
import com.stellarsql.expression.Expression;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Ordered, immutable set of {@link CoordinateConversionProvider}s.
 *
 * <p>{@link #defaults()} holds the pgSphere rotation provider. Deployments
 * with other frames add their own providers in front of it:
 * <pre>
 *   CoordinateConversionRegistry conversions = CoordinateConversionRegistry.defaults()
 *       .withProvider(new EclipticConversion());
 * </pre>
 */
public final class CoordinateConversionRegistry {

    private static final CoordinateConversionRegistry DEFAULTS =
        new CoordinateConversionRegistry(List.of(new PgSphereFrameConversion()));

    private final List<CoordinateConversionProvider> providers;

    private CoordinateConversionRegistry(List<CoordinateConversionProvider> providers) {
        this.providers = List.copyOf(providers);
    }

    public static CoordinateConversionRegistry defaults() {
        return DEFAULTS;
    }

    public static CoordinateConversionRegistry of(List<CoordinateConversionProvider> providers) {
        return new CoordinateConversionRegistry(providers);
    }

    /**
     * Returns a registry that consults the given provider before the
     * existing ones.
     *
     * @param provider the provider to add
     * @return the extended registry
     */
    public CoordinateConversionRegistry withProvider(CoordinateConversionProvider provider) {
        List<CoordinateConversionProvider> extended = new ArrayList<>();
        extended.add(Objects.requireNonNull(provider, "provider"));
        extended.addAll(providers);
        return new CoordinateConversionRegistry(extended);
    }

    public List<CoordinateConversionProvider> providers() {
        return providers;
    }

    public boolean supports(String fromFrame, String toFrame) {
        return find(fromFrame, toFrame) != null;
    }

    /**
     * Converts a geometry between frames.
     *
     * @param geometry the morphed geometry
     * @param fromFrame the normalized source frame
     * @param toFrame the normalized target frame
     * @return the converted geometry; the input itself if the frames are equal
     * @throws UnsupportedFeatureException if no provider handles the pair
     */
    public Expression convert(Expression geometry, String fromFrame, String toFrame) {
        if (fromFrame.equals(toFrame)) {
            return geometry;
        }
        CoordinateConversionProvider provider = find(fromFrame, toFrame);
        if (provider == null) {
            throw new UnsupportedFeatureException(
                "Cannot convert coordinates from " + fromFrame + " to " + toFrame,
                geometry.position(), fromFrame + " -> " + toFrame);
        }
        return provider.convert(geometry, fromFrame, toFrame);
    }

    private CoordinateConversionProvider find(String fromFrame, String toFrame) {
        for (CoordinateConversionProvider provider : providers) {
            if (provider.supports(fromFrame, toFrame)) {
                return provider;
            }
        }
        return null;
    }
}
