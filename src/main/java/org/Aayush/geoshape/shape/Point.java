package org.Aayush.geoshape.shape;

import lombok.Getter;
import lombok.experimental.Accessors;
import org.Aayush.geoshape.context.SpatialContext;

import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.util.Locale;
import java.util.Objects;

/**
 * Immutable X/Y (longitude/latitude in geo contexts) location.
 *
 * <p>Construct through {@link SpatialContext#makePoint(double, double)} so coordinates are
 * normalized; the constructor stores values as given. A point whose coordinates are both
 * NaN is empty. The owning context is carried for derived shapes but takes no part in equality.</p>
 */
@Getter
@Accessors(fluent = true)
public final class Point implements Shape {
    public static final Point EMPTY = new Point(Double.NaN, Double.NaN, SpatialContext.GEO);

    private static final String COORDINATE_PATTERN = "0.0############";

    private final double x;
    private final double y;
    private final SpatialContext ctx;

    public Point(double x, double y, SpatialContext ctx) {
        this.x = x;
        this.y = y;
        this.ctx = Objects.requireNonNull(ctx, "ctx");
    }

    /**
     * Returns a point at new coordinates in the same context, leaving this one untouched.
     */
    public Point withCoordinates(double newX, double newY) {
        return new Point(newX, newY, ctx);
    }

    @Override
    public ShapeKind kind() {
        return ShapeKind.POINT;
    }

    @Override
    public boolean isEmpty() {
        return Double.isNaN(x);
    }

    @Override
    public boolean hasArea() {
        return false;
    }

    @Override
    public Rectangle boundingBox() {
        if (isEmpty()) {
            return Rectangle.empty(ctx);
        }
        return new Rectangle(x, x, y, y, ctx);
    }

    @Override
    public Point center() {
        return this;
    }

    @Override
    public double area(SpatialContext ctx) {
        return 0.0d;
    }

    @Override
    public Shape buffered(double distance, SpatialContext ctx) {
        if (isEmpty() || distance < 0) {
            return EMPTY;
        }
        return ctx.makeCircle(this, distance);
    }

    /**
     * Equality by exact coordinate value; NaN coordinates never compare equal except by identity.
     */
    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Point)) {
            return false;
        }
        Point other = (Point) o;
        return x == other.x && y == other.y;
    }

    @Override
    public int hashCode() {
        // -0.0 == 0.0 under equals, so both must hash alike
        long temp = x != 0.0d ? Double.doubleToLongBits(x) : 0L;
        int result = (int) (temp ^ (temp >>> 32));
        temp = y != 0.0d ? Double.doubleToLongBits(y) : 0L;
        return 31 * result + (int) (temp ^ (temp >>> 32));
    }

    @Override
    public String toString() {
        return "Pt(x=" + format(x) + ",y=" + format(y) + ")";
    }

    static String format(double value) {
        if (Double.isNaN(value)) {
            return "NaN";
        }
        if (Double.isInfinite(value)) {
            return value > 0 ? "Infinity" : "-Infinity";
        }
        DecimalFormat format = new DecimalFormat(COORDINATE_PATTERN, DecimalFormatSymbols.getInstance(Locale.ROOT));
        return format.format(value);
    }
}
