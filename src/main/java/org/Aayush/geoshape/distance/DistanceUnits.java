package org.Aayush.geoshape.distance;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.experimental.Accessors;
import org.Aayush.geoshape.exception.InvalidSpatialArgumentException;

import java.util.Locale;

/**
 * Surface distance units and their earth radius, used to convert to and from degrees of arc.
 */
@Getter
@Accessors(fluent = true)
@RequiredArgsConstructor
public enum DistanceUnits {
    KILOMETERS("km", DistanceUtils.EARTH_MEAN_RADIUS_KM),
    MILES("mi", DistanceUtils.EARTH_MEAN_RADIUS_MI);

    private final String symbol;
    private final double earthRadius;

    /**
     * Converts a surface distance in this unit to degrees of arc.
     */
    public double toDegrees(double distance) {
        return DistanceUtils.dist2Degrees(distance, earthRadius);
    }

    /**
     * Converts degrees of arc to a surface distance in this unit.
     */
    public double fromDegrees(double degrees) {
        return DistanceUtils.degrees2Dist(degrees, earthRadius);
    }

    /**
     * Converts a distance expressed in {@code from} units to this unit.
     */
    public double convert(double distance, DistanceUnits from) {
        if (from == this) {
            return distance;
        }
        return distance * earthRadius / from.earthRadius;
    }

    /**
     * Resolves a unit by symbol or name, case-insensitively.
     */
    public static DistanceUnits fromSymbol(String symbol) {
        String normalized = symbol == null ? "" : symbol.trim().toLowerCase(Locale.ROOT);
        switch (normalized) {
            case "km":
            case "kilometers":
                return KILOMETERS;
            case "mi":
            case "miles":
                return MILES;
            default:
                throw new InvalidSpatialArgumentException(
                        InvalidSpatialArgumentException.REASON_BAD_CONFIG_VALUE,
                        "unknown distance unit: " + symbol
                );
        }
    }
}
