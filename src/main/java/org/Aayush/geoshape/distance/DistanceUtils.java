package org.Aayush.geoshape.distance;

import lombok.experimental.UtilityClass;
import org.Aayush.geoshape.context.SpatialContext;
import org.Aayush.geoshape.shape.Rectangle;

/**
 * Spherical trigonometry and unit conversion helpers.
 *
 * <p>Methods suffixed {@code RAD} take and return radians; methods suffixed {@code DEG}
 * take and return degrees. Latitude-first argument order follows the geodesic literature.</p>
 */
@UtilityClass
public final class DistanceUtils {
    public static final double DEGREES_90_AS_RADIANS = Math.PI / 2.0d;
    public static final double DEGREES_180_AS_RADIANS = Math.PI;

    public static final double DEGREES_TO_RADIANS = Math.PI / 180.0d;
    public static final double RADIANS_TO_DEGREES = 1.0d / DEGREES_TO_RADIANS;

    public static final double KM_TO_MILES = 0.621371192d;
    public static final double MILES_TO_KM = 1.0d / KM_TO_MILES;

    public static final double EARTH_MEAN_RADIUS_KM = 6371.0087714d;
    public static final double EARTH_EQUATORIAL_RADIUS_KM = 6378.1370d;
    public static final double EARTH_MEAN_RADIUS_MI = EARTH_MEAN_RADIUS_KM * KM_TO_MILES;
    public static final double EARTH_EQUATORIAL_RADIUS_MI = EARTH_EQUATORIAL_RADIUS_KM * KM_TO_MILES;

    public static final double DEG_TO_KM = DEGREES_TO_RADIANS * EARTH_MEAN_RADIUS_KM;
    public static final double KM_TO_DEG = 1.0d / DEG_TO_KM;

    /**
     * Computes the destination reached from a start point on a great circle.
     *
     * @return {@code {lonRAD, latRAD}} with longitude in [-PI, PI] and latitude in [-PI/2, PI/2].
     */
    public static double[] pointOnBearingRAD(double startLat, double startLon, double distanceRAD, double bearingRAD) {
        double cosAngDist = Math.cos(distanceRAD);
        double cosStartLat = Math.cos(startLat);
        double sinAngDist = Math.sin(distanceRAD);
        double sinStartLat = Math.sin(startLat);
        double sinLat2 = sinStartLat * cosAngDist + cosStartLat * sinAngDist * Math.cos(bearingRAD);
        double lat2 = Math.asin(sinLat2);
        double lon2 = startLon + Math.atan2(
                Math.sin(bearingRAD) * sinAngDist * cosStartLat,
                cosAngDist - sinStartLat * sinLat2
        );

        if (lon2 > DEGREES_180_AS_RADIANS) {
            lon2 = -1.0d * (DEGREES_180_AS_RADIANS - (lon2 - DEGREES_180_AS_RADIANS));
        } else if (lon2 < -DEGREES_180_AS_RADIANS) {
            lon2 = (lon2 + DEGREES_180_AS_RADIANS) + DEGREES_180_AS_RADIANS;
        }

        // crossing a pole flips the meridian
        if (lat2 > DEGREES_90_AS_RADIANS) {
            lat2 = DEGREES_90_AS_RADIANS - (lat2 - DEGREES_90_AS_RADIANS);
            lon2 = lon2 < 0 ? lon2 + DEGREES_180_AS_RADIANS : lon2 - DEGREES_180_AS_RADIANS;
        } else if (lat2 < -DEGREES_90_AS_RADIANS) {
            lat2 = -DEGREES_90_AS_RADIANS - (lat2 + DEGREES_90_AS_RADIANS);
            lon2 = lon2 < 0 ? lon2 + DEGREES_180_AS_RADIANS : lon2 - DEGREES_180_AS_RADIANS;
        }
        return new double[]{lon2, lat2};
    }

    /**
     * Wraps a longitude into [-180, 180]; values already in range are returned untouched.
     */
    public static double normLonDEG(double lonDeg) {
        if (lonDeg >= -180.0d && lonDeg <= 180.0d) {
            return lonDeg;
        }
        double off = (lonDeg + 180.0d) % 360.0d;
        if (off < 0) {
            return 180.0d + off;
        } else if (off == 0 && lonDeg > 0) {
            return 180.0d;
        }
        return -180.0d + off;
    }

    /**
     * Reflects a latitude over the poles into [-90, 90].
     */
    public static double normLatDEG(double latDeg) {
        if (latDeg >= -90.0d && latDeg <= 90.0d) {
            return latDeg;
        }
        double off = Math.abs((latDeg + 90.0d) % 360.0d);
        return (off <= 180.0d ? off : 360.0d - off) - 90.0d;
    }

    /**
     * Computes the bounding box of a spherical cap around a point.
     *
     * <p>Caps touching a pole span all longitudes, or half of them when the pole is only touched.</p>
     */
    public static Rectangle calcBoxByDistFromPtDEG(double lat, double lon, double distDEG, SpatialContext ctx) {
        double minX;
        double maxX;
        double minY;
        double maxY;
        if (distDEG == 0) {
            minX = lon;
            maxX = lon;
            minY = lat;
            maxY = lat;
        } else if (distDEG >= 180.0d) {
            minX = -180.0d;
            maxX = 180.0d;
            minY = -90.0d;
            maxY = 90.0d;
        } else {
            maxY = lat + distDEG;
            minY = lat - distDEG;
            if (maxY >= 90.0d || minY <= -90.0d) {
                minX = -180.0d;
                maxX = 180.0d;
                if (maxY <= 90.0d && minY >= -90.0d) {
                    minX = normLonDEG(lon - 90.0d);
                    maxX = normLonDEG(lon + 90.0d);
                }
                maxY = Math.min(maxY, 90.0d);
                minY = Math.max(minY, -90.0d);
            } else {
                double lonDeltaDeg = calcBoxByDistFromPtDeltaLonDEG(lat, lon, distDEG);
                minX = normLonDEG(lon - lonDeltaDeg);
                maxX = normLonDEG(lon + lonDeltaDeg);
            }
        }
        return ctx.makeRectangle(minX, maxX, minY, maxY);
    }

    /**
     * Longitude half-width of the cap's bounding box (tangent meridian offset).
     */
    public static double calcBoxByDistFromPtDeltaLonDEG(double lat, double lon, double distDEG) {
        if (distDEG == 0) {
            return 0;
        }
        double latRad = toRadians(lat);
        double distRad = toRadians(distDEG);
        double resultRad = Math.asin(Math.sin(distRad) / Math.cos(latRad));
        if (!Double.isNaN(resultRad)) {
            return toDegrees(resultRad);
        }
        return 90.0d;
    }

    /**
     * Latitude at which the cap reaches its widest longitude extent.
     */
    public static double calcBoxByDistFromPtLatHorizAxisDEG(double lat, double lon, double distDEG) {
        if (distDEG == 0) {
            return lat;
        } else if (lat + distDEG >= 90.0d) {
            return 90.0d;
        } else if (lat - distDEG <= -90.0d) {
            return -90.0d;
        }
        double latRad = toRadians(lat);
        double distRad = toRadians(distDEG);
        double resultRad = Math.asin(Math.sin(latRad) / Math.cos(distRad));
        if (!Double.isNaN(resultRad)) {
            return toDegrees(resultRad);
        }
        if (lat > 0) {
            return 90.0d;
        }
        if (lat < 0) {
            return -90.0d;
        }
        return lat;
    }

    /**
     * Longitude degrees spanned by travelling {@code dist} degrees due east from latitude {@code lat}.
     */
    public static double calcLonDegreesAtLat(double lat, double dist) {
        double distanceRad = toRadians(dist);
        double startLat = toRadians(lat);

        double cosAngDist = Math.cos(distanceRad);
        double cosStartLat = Math.cos(startLat);
        double sinAngDist = Math.sin(distanceRad);
        double sinStartLat = Math.sin(startLat);

        double lonDelta = Math.atan2(sinAngDist * cosStartLat, cosAngDist * (1 - sinStartLat * sinStartLat));
        return toDegrees(lonDelta);
    }

    /**
     * Great-circle angle via the haversine formula.
     */
    public static double distHaversineRAD(double lat1, double lon1, double lat2, double lon2) {
        if (lat1 == lat2 && lon1 == lon2) {
            return 0.0d;
        }
        double hsinX = Math.sin((lon1 - lon2) * 0.5d);
        double hsinY = Math.sin((lat1 - lat2) * 0.5d);
        double h = hsinY * hsinY + (Math.cos(lat1) * Math.cos(lat2) * hsinX * hsinX);
        if (h > 1.0d) {
            h = 1.0d;
        }
        return 2.0d * Math.atan2(Math.sqrt(h), Math.sqrt(1.0d - h));
    }

    /**
     * Great-circle angle via the spherical law of cosines.
     */
    public static double distLawOfCosinesRAD(double lat1, double lon1, double lat2, double lon2) {
        if (lat1 == lat2 && lon1 == lon2) {
            return 0.0d;
        }
        // cos(x) == cos(-x), so the dateline needs no care here
        double dLon = lon2 - lon1;
        double a = DEGREES_90_AS_RADIANS - lat1;
        double c = DEGREES_90_AS_RADIANS - lat2;
        double cosB = (Math.cos(a) * Math.cos(c)) + (Math.sin(a) * Math.sin(c) * Math.cos(dLon));
        if (cosB < -1.0d) {
            return Math.PI;
        } else if (cosB >= 1.0d) {
            return 0;
        }
        return Math.acos(cosB);
    }

    /**
     * Great-circle angle via the Vincenty formula specialised to a sphere.
     */
    public static double distVincentyRAD(double lat1, double lon1, double lat2, double lon2) {
        if (lat1 == lat2 && lon1 == lon2) {
            return 0.0d;
        }
        double cosLat1 = Math.cos(lat1);
        double cosLat2 = Math.cos(lat2);
        double sinLat1 = Math.sin(lat1);
        double sinLat2 = Math.sin(lat2);
        double dLon = lon2 - lon1;
        double cosDLon = Math.cos(dLon);
        double sinDLon = Math.sin(dLon);

        double a = cosLat2 * sinDLon;
        double b = cosLat1 * sinLat2 - sinLat1 * cosLat2 * cosDLon;
        double c = sinLat1 * sinLat2 + cosLat1 * cosLat2 * cosDLon;
        return Math.atan2(Math.sqrt(a * a + b * b), c);
    }

    /**
     * Converts a surface distance to degrees of arc on a sphere of the given radius.
     */
    public static double dist2Degrees(double dist, double radius) {
        return toDegrees(dist2Radians(dist, radius));
    }

    /**
     * Converts degrees of arc to a surface distance on a sphere of the given radius.
     */
    public static double degrees2Dist(double degrees, double radius) {
        return radians2Dist(toRadians(degrees), radius);
    }

    public static double dist2Radians(double dist, double radius) {
        return dist / radius;
    }

    public static double radians2Dist(double radians, double radius) {
        return radians * radius;
    }

    public static double toRadians(double degrees) {
        return degrees * DEGREES_TO_RADIANS;
    }

    public static double toDegrees(double radians) {
        return radians * RADIANS_TO_DEGREES;
    }
}
