package org.Aayush.geoshape.distance;

import org.Aayush.geoshape.context.SpatialContext;
import org.Aayush.geoshape.shape.Circle;
import org.Aayush.geoshape.shape.Point;
import org.Aayush.geoshape.shape.Rectangle;

/**
 * Great-circle distance on a unit sphere; inputs and outputs are in degrees.
 *
 * <p>Concrete subclasses differ only in the angular formula used.</p>
 */
public abstract class GeodesicSphereDistanceCalculator implements DistanceCalculator {
    private static final double RADIUS_DEG = DistanceUtils.toDegrees(1.0d);

    @Override
    public double distance(Point from, double toX, double toY) {
        return DistanceUtils.toDegrees(distanceLatLonRAD(
                DistanceUtils.toRadians(from.y()),
                DistanceUtils.toRadians(from.x()),
                DistanceUtils.toRadians(toY),
                DistanceUtils.toRadians(toX)
        ));
    }

    /**
     * Angular distance in radians between two lat/lon pairs given in radians.
     */
    protected abstract double distanceLatLonRAD(double lat1, double lon1, double lat2, double lon2);

    @Override
    public Point pointOnBearing(Point from, double distance, double bearingDEG, SpatialContext ctx) {
        if (distance == 0) {
            return from;
        }
        double[] lonLatRad = DistanceUtils.pointOnBearingRAD(
                DistanceUtils.toRadians(from.y()),
                DistanceUtils.toRadians(from.x()),
                DistanceUtils.toRadians(distance),
                DistanceUtils.toRadians(bearingDEG)
        );
        return ctx.makePoint(DistanceUtils.toDegrees(lonLatRad[0]), DistanceUtils.toDegrees(lonLatRad[1]));
    }

    @Override
    public Rectangle calcBoxByDistFromPt(Point from, double distance, SpatialContext ctx) {
        return DistanceUtils.calcBoxByDistFromPtDEG(from.y(), from.x(), distance, ctx);
    }

    @Override
    public double calcBoxByDistFromPtHorizAxisY(Point from, double distance, SpatialContext ctx) {
        return DistanceUtils.calcBoxByDistFromPtLatHorizAxisDEG(from.y(), from.x(), distance);
    }

    @Override
    public double area(Rectangle rect) {
        double lat1 = DistanceUtils.toRadians(rect.minY());
        double lat2 = DistanceUtils.toRadians(rect.maxY());
        return Math.PI / 180.0d * RADIUS_DEG * RADIUS_DEG
                * Math.abs(Math.sin(lat1) - Math.sin(lat2))
                * rect.width();
    }

    @Override
    public double area(Circle circle) {
        // spherical cap; a special case of the rectangle band formula
        double lat = DistanceUtils.toRadians(90.0d - circle.radius());
        return 2.0d * Math.PI * RADIUS_DEG * RADIUS_DEG * (1.0d - Math.sin(lat));
    }

    @Override
    public boolean equals(Object o) {
        return o != null && getClass() == o.getClass();
    }

    @Override
    public int hashCode() {
        return getClass().hashCode();
    }

    @Override
    public String toString() {
        return getClass().getSimpleName();
    }

    /**
     * Haversine formula; well conditioned for small distances.
     */
    public static final class Haversine extends GeodesicSphereDistanceCalculator {
        public static final String ID = "haversine";

        @Override
        public String id() {
            return ID;
        }

        @Override
        protected double distanceLatLonRAD(double lat1, double lon1, double lat2, double lon2) {
            return DistanceUtils.distHaversineRAD(lat1, lon1, lat2, lon2);
        }
    }

    /**
     * Spherical law of cosines.
     */
    public static final class LawOfCosines extends GeodesicSphereDistanceCalculator {
        public static final String ID = "lawOfCosines";

        @Override
        public String id() {
            return ID;
        }

        @Override
        protected double distanceLatLonRAD(double lat1, double lon1, double lat2, double lon2) {
            return DistanceUtils.distLawOfCosinesRAD(lat1, lon1, lat2, lon2);
        }
    }

    /**
     * Vincenty formula on a sphere; accurate for antipodal points.
     */
    public static final class Vincenty extends GeodesicSphereDistanceCalculator {
        public static final String ID = "vincentySphere";

        @Override
        public String id() {
            return ID;
        }

        @Override
        protected double distanceLatLonRAD(double lat1, double lon1, double lat2, double lon2) {
            return DistanceUtils.distVincentyRAD(lat1, lon1, lat2, lon2);
        }
    }
}
