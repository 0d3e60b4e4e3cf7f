package org.Aayush.geoshape.shape;

import org.Aayush.geoshape.context.SpatialContext;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Polyline buffered by a fixed distance, held as one {@link BufferedLine} per consecutive
 * point pair.
 *
 * <p>A single point yields one degenerate segment; no points yields an empty shape.
 * Segments are Euclidean and unaware of the dateline.</p>
 */
public final class BufferedLineString implements Shape {
    private final List<Point> points;
    private final double buf;
    private final boolean expandBufForLongitudeSkew;
    private final ShapeCollection segments;

    /**
     * Builds the segments.
     *
     * @param points ordered control points.
     * @param buf buffer distance, {@code >= 0}.
     * @param expandBufForLongitudeSkew widen each segment's buffer per
     *                                  {@link BufferedLine#expandBufForLongitudeSkew(Point, Point, double)}.
     * @param ctx owning context.
     */
    public BufferedLineString(List<Point> points, double buf, boolean expandBufForLongitudeSkew, SpatialContext ctx) {
        Objects.requireNonNull(ctx, "ctx");
        this.points = List.copyOf(Objects.requireNonNull(points, "points"));
        this.buf = buf;
        this.expandBufForLongitudeSkew = expandBufForLongitudeSkew;

        List<BufferedLine> lines = new ArrayList<>(Math.max(1, this.points.size() - 1));
        Point prev = null;
        for (Point point : this.points) {
            if (prev != null) {
                double segBuf = expandBufForLongitudeSkew
                        ? BufferedLine.expandBufForLongitudeSkew(prev, point, buf)
                        : buf;
                lines.add(new BufferedLine(prev, point, segBuf, ctx));
            }
            prev = point;
        }
        if (lines.isEmpty() && prev != null) {
            lines.add(new BufferedLine(prev, prev, buf, ctx));
        }
        this.segments = new ShapeCollection(lines, ctx);
    }

    public List<Point> points() {
        return points;
    }

    public double buf() {
        return buf;
    }

    public ShapeCollection segments() {
        return segments;
    }

    @Override
    public ShapeKind kind() {
        return ShapeKind.BUFFERED_LINE_STRING;
    }

    @Override
    public boolean isEmpty() {
        return segments.isEmpty();
    }

    @Override
    public boolean hasArea() {
        return segments.hasArea();
    }

    @Override
    public Rectangle boundingBox() {
        return segments.boundingBox();
    }

    @Override
    public Point center() {
        return segments.center();
    }

    @Override
    public double area(SpatialContext areaCtx) {
        return segments.area(areaCtx);
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
        return bufferCtx.makeBufferedLineString(points, newBuf, expandBufForLongitudeSkew);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof BufferedLineString)) {
            return false;
        }
        BufferedLineString that = (BufferedLineString) o;
        return Double.compare(buf, that.buf) == 0 && points.equals(that.points);
    }

    @Override
    public int hashCode() {
        return 31 * points.hashCode() + Double.hashCode(buf);
    }

    @Override
    public String toString() {
        StringBuilder out = new StringBuilder(100);
        out.append("BufferedLineString(buf=").append(Point.format(buf)).append(" pts=");
        boolean first = true;
        for (Point point : points) {
            if (!first) {
                out.append(", ");
            }
            first = false;
            out.append(Point.format(point.x())).append(' ').append(Point.format(point.y()));
        }
        return out.append(')').toString();
    }
}
