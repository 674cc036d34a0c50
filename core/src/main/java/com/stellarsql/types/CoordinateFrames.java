package com.stellarsql.types;

import java.util.Locale;

/**
 * Normalization of ADQL coordinate-system tags to frame names.
 *
 * <p>A tag such as {@code 'ICRS GEOCENTER'} or {@code 'galactic'} is reduced
 * to its upper-cased first word. {@code J2000} is taken as FK5 and
 * {@code B1950} as FK4. An empty or {@code UNKNOWNFRAME} tag means no frame.
 */
public final class CoordinateFrames {

    public static final String ICRS = "ICRS";
    public static final String FK4 = "FK4";
    public static final String FK5 = "FK5";
    public static final String GALACTIC = "GALACTIC";

    private CoordinateFrames() {
        // Utility class - prevent instantiation
    }

    /**
     * Normalizes a coordinate-system tag.
     *
     * @param coordSys the tag as written, may be null
     * @return the frame name, or null if the tag names no frame
     */
    public static String normalize(String coordSys) {
        if (coordSys == null) {
            return null;
        }
        String trimmed = coordSys.trim();
        if (trimmed.isEmpty()) {
            return null;
        }
        String frame = trimmed.split("\\s+")[0].toUpperCase(Locale.ROOT);
        switch (frame) {
            case "J2000":
                return FK5;
            case "B1950":
                return FK4;
            case "GALACTIC_II":
                return GALACTIC;
            case "UNKNOWNFRAME":
            case "UNKNOWN":
                return null;
            default:
                return frame;
        }
    }
}
