package org.Aayush.geoshape.shape;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.experimental.Accessors;
import org.Aayush.geoshape.context.SpatialContext;
import org.Aayush.geoshape.distance.DistanceUtils;

import java.util.Locale;
import java.util.Objects;

/**
 * Circle: all points within {@code radius} of {@code center} as measured by the context's
 * distance calculator.
 *
 * <p>In geo contexts the radius is in degrees of arc and the enclosing box may cross the
 * dateline or wrap a pole. A geo circle covering more than half the globe is related through
 * its complement, the smaller "back" circle around the antipode.</p>
 */
@Getter
@Accessors(fluent = true)
public final class Circle implements Shape {
    private final Point center;
    private final double radius;
    private final SpatialContext ctx;

    @Getter(AccessLevel.NONE)
    private final Rectangle enclosingBox;
    /** Complement circle used when a geo radius exceeds 90 degrees; null otherwise. */
    @Getter(AccessLevel.NONE)
    private final Circle inverseCircle;
    /** Y at which the circle is widest; differs from the center's Y on a sphere. */
    @Getter(AccessLevel.NONE)
    private final double horizAxisY;

    /**
     * Stores the arguments as given. Prefer {@link SpatialContext#makeCircle(Point, double)},
     * which validates and caps the radius.
     */
    public Circle(Point center, double radius, SpatialContext ctx) {
        this.center = Objects.requireNonNull(center, "center");
        this.radius = radius;
        this.ctx = Objects.requireNonNull(ctx, "ctx");
        if (center.isEmpty()) {
            this.enclosingBox = Rectangle.empty(ctx);
            this.inverseCircle = null;
            this.horizAxisY = Double.NaN;
            return;
        }
        this.enclosingBox = ctx.distanceCalculator().calcBoxByDistFromPt(center, radius, ctx);
        if (!ctx.isGeo()) {
            this.inverseCircle = null;
            this.horizAxisY = center.y();
        } else if (radius > 90.0d) {
            this.inverseCircle = makeInverseCircle(center, radius, ctx);
            this.horizAxisY = center.y();
        } else {
            this.inverseCircle = null;
            double axisY = ctx.distanceCalculator().calcBoxByDistFromPtHorizAxisY(center, radius, ctx);
            // numeric conditioning can land just outside the box
            if (axisY > enclosingBox.maxY()) {
                axisY = enclosingBox.maxY();
            } else if (axisY < enclosingBox.minY()) {
                axisY = enclosingBox.minY();
            }
            this.horizAxisY = axisY;
        }
    }

    private static Circle makeInverseCircle(Point center, double radius, SpatialContext ctx) {
        double backRadius = 180.0d - radius;
        if (backRadius <= 0) {
            return null;
        }
        double backX = DistanceUtils.normLonDEG(center.x() + 180.0d);
        double backY = DistanceUtils.normLatDEG(center.y() + 180.0d);
        // shrink a hair so the complement never shares the boundary
        backRadius -= Math.max(Math.ulp(Math.abs(backY) + backRadius), Math.ulp(Math.abs(backX) + backRadius));
        return new Circle(ctx.makePoint(backX, backY), backRadius, ctx);
    }

    @Override
    public ShapeKind kind() {
        return ShapeKind.CIRCLE;
    }

    @Override
    public boolean isEmpty() {
        return center.isEmpty();
    }

    @Override
    public boolean hasArea() {
        return radius > 0;
    }

    @Override
    public Rectangle boundingBox() {
        return enclosingBox;
    }

    @Override
    public double area(SpatialContext areaCtx) {
        if (areaCtx == null) {
            return Math.PI * radius * radius;
        }
        return areaCtx.distanceCalculator().area(this);
    }

    @Override
    public Shape buffered(double distance, SpatialContext bufferCtx) {
        if (isEmpty()) {
            return this;
        }
        double newRadius = radius + distance;
        if (newRadius < 0) {
            return Point.EMPTY;
        }
        return bufferCtx.makeCircle(center, newRadius);
    }

    /**
     * Whether the coordinate lies within the radius.
     */
    public boolean contains(double x, double y) {
        return ctx.distanceCalculator().distance(center, x, y) <= radius;
    }

    SpatialRelation relatePoint(Point point) {
        return contains(point.x(), point.y()) ? SpatialRelation.CONTAINS : SpatialRelation.DISJOINT;
    }

    SpatialRelation relateRectangle(Rectangle r) {
        // the enclosing box is cheaper than the distance calculator
        SpatialRelation bboxSect = enclosingBox.relateRectangle(r);
        if (bboxSect == SpatialRelation.DISJOINT || bboxSect == SpatialRelation.WITHIN) {
            return bboxSect;
        }
        if (bboxSect == SpatialRelation.CONTAINS && enclosingBox.equals(r)) {
            return SpatialRelation.WITHIN;
        }
        // from here the answer is DISJOINT, CONTAINS or INTERSECTS, never WITHIN
        if (ctx.isGeo()) {
            return relateRectangleGeo(r, bboxSect);
        }
        return relateRectanglePlanar(r, bboxSect);
    }

    SpatialRelation relateCircle(Circle other) {
        double crossDist = ctx.distanceCalculator().distance(center, other.center);
        double aDist = radius;
        double bDist = other.radius;
        if (crossDist > aDist + bDist) {
            return SpatialRelation.DISJOINT;
        }
        if (crossDist < aDist && crossDist + bDist <= aDist) {
            return SpatialRelation.CONTAINS;
        }
        if (crossDist < bDist && crossDist + aDist <= bDist) {
            return SpatialRelation.WITHIN;
        }
        return SpatialRelation.INTERSECTS;
    }

    /**
     * Closest-point test for disjointness, farthest-corner test for containment.
     * Not valid for rectangles or boxes crossing the dateline.
     */
    private SpatialRelation relateRectanglePlanar(Rectangle r, SpatialRelation bboxSect) {
        double ctrX = center.x();
        double ctrY = horizAxisY;

        double closestX;
        if (ctrX < r.minX()) {
            closestX = r.minX();
        } else if (ctrX > r.maxX()) {
            closestX = r.maxX();
        } else {
            closestX = ctrX;
        }

        double closestY;
        if (ctrY < r.minY()) {
            closestY = r.minY();
        } else if (ctrY > r.maxY()) {
            closestY = r.maxY();
        } else {
            closestY = ctrY;
        }

        if (ctrX == closestX) {
            double deltaY = Math.abs(ctrY - closestY);
            double distYCirc = ctrY < closestY ? enclosingBox.maxY() - ctrY : ctrY - enclosingBox.minY();
            if (deltaY > distYCirc) {
                return SpatialRelation.DISJOINT;
            }
        } else if (ctrY == closestY) {
            double deltaX = Math.abs(ctrX - closestX);
            double distXCirc = ctrX < closestX ? enclosingBox.maxX() - ctrX : ctrX - enclosingBox.minX();
            if (deltaX > distXCirc) {
                return SpatialRelation.DISJOINT;
            }
        } else if (!contains(closestX, closestY)) {
            return SpatialRelation.DISJOINT;
        }

        // containing r requires the box to contain it first
        if (bboxSect != SpatialRelation.CONTAINS) {
            return SpatialRelation.INTERSECTS;
        }
        double farthestX = r.maxX() - ctrX > ctrX - r.minX() ? r.maxX() : r.minX();
        double farthestY = r.maxY() - ctrY > ctrY - r.minY() ? r.maxY() : r.minY();
        if (contains(farthestX, farthestY)) {
            return SpatialRelation.CONTAINS;
        }
        return SpatialRelation.INTERSECTS;
    }

    private SpatialRelation relateRectangleGeo(Rectangle r, SpatialRelation bboxSect) {
        if (inverseCircle != null) {
            return inverseCircle.relateRectangle(r).inverse();
        }
        if (enclosingBox.width() == 360.0d) {
            return relateRectangleCircleWrapsPole(r);
        }
        if (!enclosingBox.crossesDateLine() && !r.crossesDateLine()) {
            return relateRectanglePlanar(r, bboxSect);
        }
        // a full longitude band has no corners to test
        if (r.width() == 360.0d) {
            return SpatialRelation.INTERSECTS;
        }

        int cornersIntersect = numCornersIntersect(r);
        if (cornersIntersect == 4) {
            // r might sneak around the globe and touch the far side
            SpatialRelation xIntersect = r.relateXRange(enclosingBox.minX(), enclosingBox.maxX());
            if (xIntersect == SpatialRelation.WITHIN) {
                return SpatialRelation.CONTAINS;
            }
            return SpatialRelation.INTERSECTS;
        }
        if (cornersIntersect > 0) {
            return SpatialRelation.INTERSECTS;
        }

        // no corner inside: intersecting one of the circle's axes still means overlap
        if (r.relateYRange(horizAxisY, horizAxisY).intersects()
                && r.relateXRange(enclosingBox.minX(), enclosingBox.maxX()).intersects()) {
            return SpatialRelation.INTERSECTS;
        }
        if (r.relateXRange(center.x(), center.x()).intersects()) {
            double yTop = center.y() + radius;
            double yBot = center.y() - radius;
            if (r.relateYRange(yBot, yTop).intersects()) {
                return SpatialRelation.INTERSECTS;
            }
        }
        return SpatialRelation.DISJOINT;
    }

    /**
     * Handles a circle wrapping exactly one pole; the both-poles case goes through the inverse circle.
     */
    private SpatialRelation relateRectangleCircleWrapsPole(Rectangle r) {
        if (radius == 180.0d) {
            return SpatialRelation.CONTAINS;
        }
        double yTop = center.y() + radius;
        if (yTop > 90.0d) {
            double yTopOverlap = yTop - 90.0d;
            if (r.minY() >= 90.0d - yTopOverlap) {
                return SpatialRelation.CONTAINS;
            }
        } else {
            double yBot = center.y() - radius;
            if (yBot < -90.0d) {
                double yBotOverlap = -90.0d - yBot;
                if (r.maxY() <= -90.0d + yBotOverlap) {
                    return SpatialRelation.CONTAINS;
                }
            }
        }

        if (r.width() == 360.0d) {
            return SpatialRelation.INTERSECTS;
        }

        int cornersIntersect = numCornersIntersect(r);
        double frontX = center.x();
        if (cornersIntersect == 4) {
            double backX = frontX <= 0 ? frontX + 180.0d : frontX - 180.0d;
            if (r.relateXRange(backX, backX).intersects()) {
                return SpatialRelation.INTERSECTS;
            }
            return SpatialRelation.CONTAINS;
        }
        if (cornersIntersect == 0) {
            if (r.relateXRange(frontX, frontX).intersects()) {
                return SpatialRelation.INTERSECTS;
            }
            return SpatialRelation.DISJOINT;
        }
        return SpatialRelation.INTERSECTS;
    }

    /**
     * Returns 0 when no corner of {@code r} is inside, 4 when all are, 1 for a partial hit.
     */
    private int numCornersIntersect(Rectangle r) {
        boolean first = contains(r.minX(), r.minY());
        if (contains(r.minX(), r.maxY()) != first) {
            return 1;
        }
        if (contains(r.maxX(), r.minY()) != first) {
            return 1;
        }
        if (contains(r.maxX(), r.maxY()) != first) {
            return 1;
        }
        return first ? 4 : 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Circle)) {
            return false;
        }
        Circle other = (Circle) o;
        return center.equals(other.center) && Double.compare(radius, other.radius) == 0;
    }

    @Override
    public int hashCode() {
        return 31 * center.hashCode() + Double.hashCode(radius);
    }

    @Override
    public String toString() {
        if (ctx.isGeo()) {
            double distKm = DistanceUtils.degrees2Dist(radius, DistanceUtils.EARTH_MEAN_RADIUS_KM);
            return String.format(Locale.ROOT, "Circle(%s, d=%.1f° %.2fkm)", center, radius, distKm);
        }
        return String.format(Locale.ROOT, "Circle(%s, d=%.1f)", center, radius);
    }
}
