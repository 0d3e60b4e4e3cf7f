package org.Aayush.geoshape.context;

import org.Aayush.geoshape.distance.DistanceUtils;
import org.Aayush.geoshape.exception.InvalidShapeException;
import org.Aayush.geoshape.exception.InvalidSpatialArgumentException;

import java.util.Objects;

/**
 * Wraps, clamps, rounds and verifies raw coordinates for one coordinate system.
 *
 * <p>Geo mode wraps X into [-180, 180] and clamps Y into [-90, 90]; Y never wraps.
 * Precision rounding is applied last so the rounded value still satisfies the range.</p>
 */
public final class CoordinateNormalizer {
    /** Latitude overshoot treated as floating-point noise and clamped rather than rejected. */
    static final double LATITUDE_CLAMP_TOLERANCE = 1e-6d;

    private final boolean geo;
    private final boolean wrapLongitude;
    private final Double precisionScale;
    private final SpatialContextConfig.WorldBounds bounds;

    /**
     * Creates a normalizer.
     *
     * @param geo geodetic mode.
     * @param wrapLongitude wrap X in geo mode.
     * @param precisionScale optional fixed precision scale ({@code null} disables rounding).
     * @param bounds world extent used by the verify methods.
     */
    public CoordinateNormalizer(
            boolean geo,
            boolean wrapLongitude,
            Double precisionScale,
            SpatialContextConfig.WorldBounds bounds
    ) {
        if (precisionScale != null && (!(precisionScale > 0.0d) || Double.isInfinite(precisionScale))) {
            throw new InvalidSpatialArgumentException(
                    InvalidSpatialArgumentException.REASON_BAD_CONFIG_VALUE,
                    "precisionScale must be finite and > 0: " + precisionScale
            );
        }
        this.geo = geo;
        this.wrapLongitude = wrapLongitude;
        this.precisionScale = precisionScale;
        this.bounds = Objects.requireNonNull(bounds, "bounds");
    }

    /**
     * Normalizes an X coordinate.
     *
     * @throws InvalidShapeException when wrapping is disabled and a geo longitude is out of range.
     */
    public double normX(double x) {
        if (geo) {
            if (wrapLongitude) {
                x = DistanceUtils.normLonDEG(x);
            } else {
                verifyX(x);
            }
        }
        return round(x);
    }

    /**
     * Normalizes a Y coordinate.
     *
     * @throws InvalidSpatialArgumentException when a geo latitude lies beyond the poles.
     */
    public double normY(double y) {
        if (geo && !Double.isNaN(y)) {
            if (y > 90.0d) {
                y = clampLatitude(y, 90.0d);
            } else if (y < -90.0d) {
                y = clampLatitude(y, -90.0d);
            }
        }
        return round(y);
    }

    /**
     * Applies the fixed precision model, if any.
     */
    public double round(double value) {
        if (precisionScale == null || Double.isNaN(value) || Double.isInfinite(value)) {
            return value;
        }
        double scale = precisionScale;
        return Math.round(value * scale) / scale;
    }

    /**
     * Verifies an un-normalized X lies within the world bounds.
     */
    public void verifyX(double x) {
        if (x < bounds.minX() || x > bounds.maxX()) {
            throw new InvalidShapeException(
                    InvalidShapeException.REASON_X_OUT_OF_BOUNDS,
                    "Bad X value " + x + " is not in boundary [" + bounds.minX() + ", " + bounds.maxX() + "]"
            );
        }
    }

    /**
     * Verifies an un-normalized Y lies within the world bounds.
     */
    public void verifyY(double y) {
        if (y < bounds.minY() || y > bounds.maxY()) {
            throw new InvalidShapeException(
                    InvalidShapeException.REASON_Y_OUT_OF_BOUNDS,
                    "Bad Y value " + y + " is not in boundary [" + bounds.minY() + ", " + bounds.maxY() + "]"
            );
        }
    }

    public boolean isGeo() {
        return geo;
    }

    public Double precisionScale() {
        return precisionScale;
    }

    private static double clampLatitude(double y, double pole) {
        if (Math.abs(y - pole) > LATITUDE_CLAMP_TOLERANCE) {
            throw new InvalidSpatialArgumentException(
                    InvalidSpatialArgumentException.REASON_LATITUDE_OUT_OF_RANGE,
                    "latitude " + y + " is outside [-90, 90]"
            );
        }
        return pole;
    }
}
