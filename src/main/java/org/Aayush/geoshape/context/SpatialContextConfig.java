package org.Aayush.geoshape.context;

import lombok.Builder;
import lombok.Value;
import org.Aayush.geoshape.distance.DistanceCalculator;
import org.Aayush.geoshape.exception.InvalidSpatialArgumentException;

/**
 * Startup configuration for a {@link SpatialContext}.
 *
 * <p>Bound once when the context is built; shapes made by the context inherit it for their
 * whole lifetime.</p>
 */
@Value
@Builder(toBuilder = true)
public class SpatialContextConfig {

    /**
     * Geodetic (longitude/latitude in degrees) when true, flat cartesian plane otherwise.
     */
    @Builder.Default
    boolean geo = true;

    /**
     * Distance strategy; null selects haversine for geo and plain cartesian otherwise.
     */
    DistanceCalculator distanceCalculator;

    /**
     * World extent; null selects the geo world or the maximal cartesian plane.
     */
    WorldBounds worldBounds;

    /**
     * Whether X values outside [-180, 180] are wrapped in geo mode.
     */
    @Builder.Default
    boolean normWrapLongitude = true;

    /**
     * Fixed precision scale (values are rounded to multiples of {@code 1 / scale}); null keeps full precision.
     */
    Double precisionScale;

    /**
     * Whether members of shape collections may overlap each other.
     */
    @Builder.Default
    boolean allowMultiOverlap = false;

    /**
     * Returns the default geodetic configuration.
     */
    public static SpatialContextConfig geoDefaults() {
        return SpatialContextConfig.builder().build();
    }

    /**
     * Returns the default unbounded cartesian configuration.
     */
    public static SpatialContextConfig cartesianDefaults() {
        return SpatialContextConfig.builder().geo(false).build();
    }

    /**
     * Non-crossing world extent.
     */
    public record WorldBounds(double minX, double maxX, double minY, double maxY) {
        public static final WorldBounds GEO = new WorldBounds(-180.0d, 180.0d, -90.0d, 90.0d);
        public static final WorldBounds MAX = new WorldBounds(
                -Double.MAX_VALUE, Double.MAX_VALUE, -Double.MAX_VALUE, Double.MAX_VALUE
        );

        public WorldBounds {
            if (Double.isNaN(minX) || Double.isNaN(maxX) || Double.isNaN(minY) || Double.isNaN(maxY)) {
                throw new InvalidSpatialArgumentException(
                        InvalidSpatialArgumentException.REASON_BAD_CONFIG_VALUE,
                        "worldBounds must not contain NaN"
                );
            }
            if (minX > maxX) {
                throw new InvalidSpatialArgumentException(
                        InvalidSpatialArgumentException.REASON_BAD_CONFIG_VALUE,
                        "worldBounds shouldn't cross the dateline: minX=" + minX + " maxX=" + maxX
                );
            }
            if (minY > maxY) {
                throw new InvalidSpatialArgumentException(
                        InvalidSpatialArgumentException.REASON_BAD_CONFIG_VALUE,
                        "worldBounds minY must be <= maxY: " + minY + " to " + maxY
                );
            }
        }
    }
}
