package org.Aayush.geoshape.distance;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.experimental.Accessors;
import org.Aayush.geoshape.context.SpatialContext;
import org.Aayush.geoshape.shape.Circle;
import org.Aayush.geoshape.shape.Point;
import org.Aayush.geoshape.shape.Rectangle;

/**
 * Euclidean distance on a flat plane, optionally squared.
 */
@Getter
@Accessors(fluent = true)
@EqualsAndHashCode
public final class CartesianDistanceCalculator implements DistanceCalculator {
    public static final String ID = "cartesian";
    public static final String ID_SQUARED = "cartesian^2";

    private final boolean squared;

    /**
     * Creates a plain (non-squared) cartesian calculator.
     */
    public CartesianDistanceCalculator() {
        this(false);
    }

    /**
     * Creates a cartesian calculator.
     *
     * @param squared when true, distances are returned squared (cheaper, order-preserving).
     */
    public CartesianDistanceCalculator(boolean squared) {
        this.squared = squared;
    }

    @Override
    public String id() {
        return squared ? ID_SQUARED : ID;
    }

    @Override
    public double distance(Point from, double toX, double toY) {
        double dx = from.x() - toX;
        double dy = from.y() - toY;
        double result = dx * dx + dy * dy;
        return squared ? result : Math.sqrt(result);
    }

    @Override
    public Point pointOnBearing(Point from, double distance, double bearingDEG, SpatialContext ctx) {
        if (distance == 0) {
            return from;
        }
        double bearingRad = DistanceUtils.toRadians(bearingDEG);
        double x = from.x() + Math.sin(bearingRad) * distance;
        double y = from.y() + Math.cos(bearingRad) * distance;
        return ctx.makePoint(x, y);
    }

    @Override
    public Rectangle calcBoxByDistFromPt(Point from, double distance, SpatialContext ctx) {
        return ctx.makeRectangle(
                from.x() - distance,
                from.x() + distance,
                from.y() - distance,
                from.y() + distance
        );
    }

    @Override
    public double calcBoxByDistFromPtHorizAxisY(Point from, double distance, SpatialContext ctx) {
        return from.y();
    }

    @Override
    public double area(Rectangle rect) {
        return rect.area(null);
    }

    @Override
    public double area(Circle circle) {
        return circle.area(null);
    }

    @Override
    public String toString() {
        return "CartesianDistanceCalculator{" + id() + "}";
    }
}
