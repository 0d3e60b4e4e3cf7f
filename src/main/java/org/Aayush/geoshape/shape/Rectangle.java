package org.Aayush.geoshape.shape;

import lombok.Getter;
import lombok.experimental.Accessors;
import org.Aayush.geoshape.context.SpatialContext;
import org.Aayush.geoshape.distance.DistanceUtils;

import java.util.Objects;

/**
 * Axis-aligned rectangle.
 *
 * <p>In geo contexts {@code minX > maxX} encodes a rectangle crossing the dateline; the
 * X-range then runs east from {@code minX} through 180 to {@code maxX}. Empty iff
 * {@code minX} is NaN.</p>
 */
@Getter
@Accessors(fluent = true)
public final class Rectangle implements Shape {
    private final double minX;
    private final double maxX;
    private final double minY;
    private final double maxY;
    private final SpatialContext ctx;

    /**
     * Stores the bounds as given. Prefer {@link SpatialContext#makeRectangle(double, double, double, double)},
     * which normalizes and validates.
     */
    public Rectangle(double minX, double maxX, double minY, double maxY, SpatialContext ctx) {
        this.minX = minX;
        this.maxX = maxX;
        this.minY = minY;
        this.maxY = maxY;
        this.ctx = Objects.requireNonNull(ctx, "ctx");
    }

    /**
     * Empty rectangle (all bounds NaN) bound to {@code ctx}.
     */
    public static Rectangle empty(SpatialContext ctx) {
        return new Rectangle(Double.NaN, Double.NaN, Double.NaN, Double.NaN, ctx);
    }

    @Override
    public ShapeKind kind() {
        return ShapeKind.RECTANGLE;
    }

    @Override
    public boolean isEmpty() {
        return Double.isNaN(minX);
    }

    @Override
    public boolean hasArea() {
        return maxX != minX && maxY != minY;
    }

    public boolean crossesDateLine() {
        return minX > maxX;
    }

    /**
     * X extent; a dateline-crossing rectangle measures through 180.
     */
    public double width() {
        double w = maxX - minX;
        if (w < 0) {
            w += 360.0d;
        }
        return w;
    }

    public double height() {
        return maxY - minY;
    }

    @Override
    public Rectangle boundingBox() {
        return this;
    }

    @Override
    public Point center() {
        if (isEmpty()) {
            return Point.EMPTY;
        }
        double y = height() / 2.0d + minY;
        double x = width() / 2.0d + minX;
        if (minX > maxX) {
            x = DistanceUtils.normLonDEG(x);
        }
        return new Point(x, y, ctx);
    }

    @Override
    public double area(SpatialContext areaCtx) {
        if (areaCtx == null) {
            return width() * height();
        }
        return areaCtx.distanceCalculator().area(this);
    }

    @Override
    public Shape buffered(double distance, SpatialContext bufferCtx) {
        if (isEmpty()) {
            return this;
        }
        if (distance < 0) {
            return shrunk(-distance, bufferCtx);
        }
        if (bufferCtx.isGeo()) {
            // touching a pole wraps the whole world longitudinally
            if (maxY + distance >= 90.0d) {
                return bufferCtx.makeRectangle(-180.0d, 180.0d, Math.max(-90.0d, minY - distance), 90.0d);
            }
            if (minY - distance <= -90.0d) {
                return bufferCtx.makeRectangle(-180.0d, 180.0d, -90.0d, Math.min(90.0d, maxY + distance));
            }
            double closestToPoleY = Math.abs(maxY) > Math.abs(minY) ? maxY : minY;
            double lonDistance = DistanceUtils.calcBoxByDistFromPtDeltaLonDEG(closestToPoleY, minX, distance);
            if (lonDistance * 2.0d + width() >= 360.0d) {
                return bufferCtx.makeRectangle(-180.0d, 180.0d, minY - distance, maxY + distance);
            }
            return bufferCtx.makeRectangle(
                    DistanceUtils.normLonDEG(minX - lonDistance),
                    DistanceUtils.normLonDEG(maxX + lonDistance),
                    minY - distance,
                    maxY + distance
            );
        }
        Rectangle world = bufferCtx.worldBounds();
        return bufferCtx.makeRectangle(
                Math.max(world.minX(), minX - distance),
                Math.min(world.maxX(), maxX + distance),
                Math.max(world.minY(), minY - distance),
                Math.min(world.maxY(), maxY + distance)
        );
    }

    private Shape shrunk(double inset, SpatialContext bufferCtx) {
        if (height() < inset * 2.0d) {
            return empty(bufferCtx);
        }
        double newMinY = minY + inset;
        double newMaxY = maxY - inset;
        if (bufferCtx.isGeo() && width() == 360.0d) {
            // a full band has no east or west edge to move
            return bufferCtx.makeRectangle(-180.0d, 180.0d, newMinY, newMaxY);
        }
        double lonInset = inset;
        if (bufferCtx.isGeo()) {
            double closestToPoleY = Math.abs(newMaxY) > Math.abs(newMinY) ? newMaxY : newMinY;
            lonInset = DistanceUtils.calcBoxByDistFromPtDeltaLonDEG(closestToPoleY, minX, inset);
        }
        if (width() < lonInset * 2.0d) {
            return empty(bufferCtx);
        }
        return bufferCtx.makeRectangle(minX + lonInset, maxX - lonInset, newMinY, newMaxY);
    }

    /**
     * Relation of this rectangle to a point.
     */
    SpatialRelation relatePoint(Point point) {
        if (point.y() > maxY || point.y() < minY) {
            return SpatialRelation.DISJOINT;
        }
        double localMinX = this.minX;
        double localMaxX = this.maxX;
        double pX = point.x();
        if (ctx.isGeo()) {
            // unwrap the dateline, then shift the point onto the same page
            double rawWidth = localMaxX - localMinX;
            if (rawWidth < 0) {
                localMaxX = localMinX + (rawWidth + 360.0d);
            }
            if (pX < localMinX) {
                pX += 360.0d;
            } else if (pX > localMaxX) {
                pX -= 360.0d;
            } else {
                return SpatialRelation.CONTAINS;
            }
        }
        if (pX < localMinX || pX > localMaxX) {
            return SpatialRelation.DISJOINT;
        }
        return SpatialRelation.CONTAINS;
    }

    /**
     * Relation of this rectangle to another, axis by axis.
     *
     * <p>Agreeing axes decide; when one axis is identical on both rectangles the other axis
     * decides; otherwise INTERSECTS.</p>
     */
    SpatialRelation relateRectangle(Rectangle rect) {
        SpatialRelation yIntersect = relateYRange(rect.minY(), rect.maxY());
        if (yIntersect == SpatialRelation.DISJOINT) {
            return SpatialRelation.DISJOINT;
        }
        SpatialRelation xIntersect = relateXRange(rect.minX(), rect.maxX());
        if (xIntersect == SpatialRelation.DISJOINT) {
            return SpatialRelation.DISJOINT;
        }
        if (xIntersect == yIntersect) {
            return xIntersect;
        }
        if (minX == rect.minX() && maxX == rect.maxX()) {
            return yIntersect;
        }
        if (minY == rect.minY() && maxY == rect.maxY()) {
            return xIntersect;
        }
        return SpatialRelation.INTERSECTS;
    }

    /**
     * Closed-interval relation of this rectangle's Y-range to {@code [extMinY, extMaxY]}.
     */
    public SpatialRelation relateYRange(double extMinY, double extMaxY) {
        return relateRange(minY, maxY, extMinY, extMaxY);
    }

    /**
     * Closed-interval relation of this rectangle's X-range to {@code [extMinX, extMaxX]}.
     *
     * <p>In geo contexts both ranges are unwrapped across the dateline and shifted by 360
     * so they can overlap; a full 360 width contains (or is within) anything.</p>
     */
    public SpatialRelation relateXRange(double extMinX, double extMaxX) {
        double localMinX = this.minX;
        double localMaxX = this.maxX;
        if (ctx.isGeo()) {
            double rawWidth = localMaxX - localMinX;
            if (rawWidth == 360.0d) {
                return SpatialRelation.CONTAINS;
            }
            if (rawWidth < 0) {
                localMaxX = localMinX + (rawWidth + 360.0d);
            }

            double extRawWidth = extMaxX - extMinX;
            if (extRawWidth == 360.0d) {
                return SpatialRelation.WITHIN;
            }
            if (extRawWidth < 0) {
                extMaxX = extMinX + (extRawWidth + 360.0d);
            }

            if (localMaxX < extMinX) {
                localMinX += 360.0d;
                localMaxX += 360.0d;
            } else if (extMaxX < localMinX) {
                extMinX += 360.0d;
                extMaxX += 360.0d;
            }
        }
        return relateRange(localMinX, localMaxX, extMinX, extMaxX);
    }

    private static SpatialRelation relateRange(double intMin, double intMax, double extMin, double extMax) {
        if (extMin > intMax || extMax < intMin) {
            return SpatialRelation.DISJOINT;
        }
        if (extMin >= intMin && extMax <= intMax) {
            return SpatialRelation.CONTAINS;
        }
        if (extMin <= intMin && extMax >= intMax) {
            return SpatialRelation.WITHIN;
        }
        return SpatialRelation.INTERSECTS;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Rectangle)) {
            return false;
        }
        Rectangle other = (Rectangle) o;
        return Double.compare(minX, other.minX) == 0
                && Double.compare(maxX, other.maxX) == 0
                && Double.compare(minY, other.minY) == 0
                && Double.compare(maxY, other.maxY) == 0;
    }

    @Override
    public int hashCode() {
        int result = Double.hashCode(minX);
        result = 31 * result + Double.hashCode(maxX);
        result = 31 * result + Double.hashCode(minY);
        return 31 * result + Double.hashCode(maxY);
    }

    @Override
    public String toString() {
        return "Rect(minX=" + Point.format(minX) + ",maxX=" + Point.format(maxX)
                + ",minY=" + Point.format(minY) + ",maxY=" + Point.format(maxY) + ")";
    }
}
