package com.stellarsql.morph;

import com.stellarsql.expression.Expression;

/**
 * Converts backend geometry expressions between coordinate frames.
 *
 * <p>Providers are consulted by {@link CoordinateConversionRegistry} in
 * registration order; the first one that {@link #supports} a frame pair
 * performs the conversion.
 */
public interface CoordinateConversionProvider {

    /**
     * Tests whether this provider can convert between two frames.
     *
     * @param fromFrame the normalized source frame
     * @param toFrame the normalized target frame
     * @return true if {@link #convert} handles the pair
     */
    boolean supports(String fromFrame, String toFrame);

    /**
     * Wraps a morphed geometry expression so that it yields the same
     * geometry expressed in another frame.
     *
     * @param geometry the geometry, already in backend form
     * @param fromFrame the normalized source frame
     * @param toFrame the normalized target frame
     * @return the converted expression
     */
    Expression convert(Expression geometry, String fromFrame, String toFrame);
}
