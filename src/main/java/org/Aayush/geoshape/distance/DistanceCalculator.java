package org.Aayush.geoshape.distance;

import org.Aayush.geoshape.context.SpatialContext;
import org.Aayush.geoshape.shape.Circle;
import org.Aayush.geoshape.shape.Point;
import org.Aayush.geoshape.shape.Rectangle;

/**
 * Pluggable distance strategy.
 *
 * <p>Distances are in the coordinate system's native unit: degrees of arc for geodesic
 * calculators, plain coordinate units for cartesian ones.</p>
 */
public interface DistanceCalculator {

    /**
     * Returns stable calculator identifier used by configuration.
     */
    String id();

    /**
     * Distance between two points.
     */
    default double distance(Point from, Point to) {
        return distance(from, to.x(), to.y());
    }

    /**
     * Distance from a point to a raw coordinate pair.
     */
    double distance(Point from, double toX, double toY);

    /**
     * Point reached travelling {@code distance} along {@code bearingDEG} (0 = north, clockwise).
     */
    Point pointOnBearing(Point from, double distance, double bearingDEG, SpatialContext ctx);

    /**
     * Bounding box of all points within {@code distance} of {@code from}.
     */
    Rectangle calcBoxByDistFromPt(Point from, double distance, SpatialContext ctx);

    /**
     * Y coordinate at which a circle of the given radius is widest.
     */
    double calcBoxByDistFromPtHorizAxisY(Point from, double distance, SpatialContext ctx);

    /**
     * Area of a rectangle in square native units.
     */
    double area(Rectangle rect);

    /**
     * Area of a circle in square native units.
     */
    double area(Circle circle);
}
