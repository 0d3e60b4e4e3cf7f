package org.Aayush.geoshape.shape;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.experimental.Accessors;
import org.Aayush.geoshape.context.SpatialContext;
import org.Aayush.geoshape.distance.DistanceUtils;

import java.util.Objects;

/**
 * Line segment from {@code a} to {@code b} with a buffer extending {@code buf} in every
 * direction, including past both end points (square caps).
 *
 * <p>Computed in Euclidean space; the dateline is not considered. In geo contexts widen the
 * buffer with {@link #expandBufForLongitudeSkew(Point, Point, double)} to cover the intended
 * area at higher latitudes.</p>
 */
@Getter
@Accessors(fluent = true)
public final class BufferedLine implements Shape {
    private final Point a;
    private final Point b;
    private final double buf;

    @Getter(AccessLevel.NONE)
    private final SpatialContext ctx;
    @Getter(AccessLevel.NONE)
    private final Rectangle bbox;
    /** Passes through a and b. */
    @Getter(AccessLevel.PACKAGE)
    private final InfiniteBufferedLine linePrimary;
    /** Perpendicular to the primary line, through the segment midpoint. */
    @Getter(AccessLevel.PACKAGE)
    private final InfiniteBufferedLine linePerp;

    /**
     * Builds the line. Prefer {@link SpatialContext#makeBufferedLine(Point, Point, double)},
     * which rejects negative buffers.
     */
    public BufferedLine(Point a, Point b, double buf, SpatialContext ctx) {
        this.a = Objects.requireNonNull(a, "a");
        this.b = Objects.requireNonNull(b, "b");
        this.buf = buf;
        this.ctx = Objects.requireNonNull(ctx, "ctx");

        if (a.isEmpty() || b.isEmpty()) {
            this.linePrimary = new InfiniteBufferedLine(0.0d, Double.NaN, Double.NaN, buf);
            this.linePerp = new InfiniteBufferedLine(Double.POSITIVE_INFINITY, Double.NaN, Double.NaN, buf);
            this.bbox = Rectangle.empty(ctx);
            return;
        }

        double deltaY = b.y() - a.y();
        double deltaX = b.x() - a.x();
        double centerX = a.x() + deltaX / 2.0d;
        double centerY = a.y() + deltaY / 2.0d;

        if (deltaX == 0 && deltaY == 0) {
            this.linePrimary = new InfiniteBufferedLine(0.0d, centerX, centerY, buf);
            this.linePerp = new InfiniteBufferedLine(Double.POSITIVE_INFINITY, centerX, centerY, buf);
        } else {
            this.linePrimary = new InfiniteBufferedLine(deltaY / deltaX, centerX, centerY, buf);
            double length = Math.sqrt(deltaX * deltaX + deltaY * deltaY);
            this.linePerp = new InfiniteBufferedLine(-deltaX / deltaY, centerX, centerY, length / 2.0d + buf);
        }

        double minX;
        double maxX;
        double minY;
        double maxY;
        if (deltaX == 0) {
            minY = Math.min(a.y(), b.y()) - buf;
            maxY = Math.max(a.y(), b.y()) + buf;
            minX = a.x() - buf;
            maxX = a.x() + buf;
        } else {
            // offset along each axis of a square cap of side 2 * buf rotated to the line
            double bboxBuf = buf * (1.0d + Math.abs(linePrimary.slope())) * linePrimary.distDenomInv();
            minX = Math.min(a.x(), b.x()) - bboxBuf;
            maxX = Math.max(a.x(), b.x()) + bboxBuf;
            minY = Math.min(a.y(), b.y()) - bboxBuf;
            maxY = Math.max(a.y(), b.y()) + bboxBuf;
        }
        Rectangle world = ctx.worldBounds();
        this.bbox = ctx.makeRectangle(
                Math.max(world.minX(), minX),
                Math.min(world.maxX(), maxX),
                Math.max(world.minY(), minY),
                Math.min(world.maxY(), maxY)
        );
    }

    /**
     * Widens {@code buf} to the longitude degrees it spans at whichever end point is closer to a pole.
     */
    public static double expandBufForLongitudeSkew(Point a, Point b, double buf) {
        double maxLat = Math.max(Math.abs(a.y()), Math.abs(b.y()));
        return DistanceUtils.calcLonDegreesAtLat(maxLat, buf);
    }

    @Override
    public ShapeKind kind() {
        return ShapeKind.BUFFERED_LINE;
    }

    @Override
    public boolean isEmpty() {
        return a.isEmpty();
    }

    @Override
    public boolean hasArea() {
        return buf > 0;
    }

    @Override
    public Rectangle boundingBox() {
        return bbox;
    }

    @Override
    public Point center() {
        return bbox.center();
    }

    @Override
    public double area(SpatialContext areaCtx) {
        return linePrimary.buf() * linePerp.buf() * 4.0d;
    }

    @Override
    public Shape buffered(double distance, SpatialContext bufferCtx) {
        if (isEmpty()) {
            return this;
        }
        double newBuf = buf + distance;
        if (newBuf < 0) {
            return Point.EMPTY;
        }
        return bufferCtx.makeBufferedLine(a, b, newBuf);
    }

    /**
     * Whether the point lies within the buffered segment.
     */
    public boolean contains(Point p) {
        return linePrimary.contains(p.x(), p.y()) && linePerp.contains(p.x(), p.y());
    }

    SpatialRelation relatePoint(Point p) {
        return contains(p) ? SpatialRelation.CONTAINS : SpatialRelation.DISJOINT;
    }

    SpatialRelation relateRectangle(Rectangle r) {
        SpatialRelation bboxR = bbox.relateRectangle(r);
        if (bboxR == SpatialRelation.DISJOINT || bboxR == SpatialRelation.WITHIN) {
            return bboxR;
        }
        Point rCenter = r.center();
        SpatialRelation result = linePrimary.relate(r, rCenter.x(), rCenter.y());
        if (result == SpatialRelation.DISJOINT) {
            return SpatialRelation.DISJOINT;
        }
        SpatialRelation resultOpp = linePerp.relate(r, rCenter.x(), rCenter.y());
        if (resultOpp == SpatialRelation.DISJOINT) {
            return SpatialRelation.DISJOINT;
        }
        if (result == resultOpp) {
            return result;
        }
        return SpatialRelation.INTERSECTS;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof BufferedLine)) {
            return false;
        }
        BufferedLine that = (BufferedLine) o;
        return Double.compare(buf, that.buf) == 0 && a.equals(that.a) && b.equals(that.b);
    }

    @Override
    public int hashCode() {
        int result = a.hashCode();
        result = 31 * result + b.hashCode();
        return 31 * result + Double.hashCode(buf);
    }

    @Override
    public String toString() {
        return "BufferedLine(" + a + ", " + b + " b=" + Point.format(buf) + ")";
    }
}
