package org.Aayush.geoshape.context;

import org.Aayush.geoshape.distance.CartesianDistanceCalculator;
import org.Aayush.geoshape.distance.DistanceCalculator;
import org.Aayush.geoshape.distance.GeodesicSphereDistanceCalculator;
import org.Aayush.geoshape.exception.InvalidShapeException;
import org.Aayush.geoshape.exception.InvalidSpatialArgumentException;
import org.Aayush.geoshape.shape.BufferedLine;
import org.Aayush.geoshape.shape.BufferedLineString;
import org.Aayush.geoshape.shape.Circle;
import org.Aayush.geoshape.shape.Point;
import org.Aayush.geoshape.shape.Rectangle;
import org.Aayush.geoshape.shape.Shape;
import org.Aayush.geoshape.shape.ShapeCollection;

import java.util.List;
import java.util.Objects;

/**
 * Owning factory for shapes of one coordinate system.
 *
 * <p>Immutable after construction. Holds the geo/cartesian mode, distance calculator,
 * world bounds, coordinate normalizer and collection overlap policy.</p>
 */
public final class SpatialContext {

    /**
     * Default geodetic context: haversine distance, -180..180 / -90..90 world, no precision rounding.
     */
    public static final SpatialContext GEO = new SpatialContext(SpatialContextConfig.geoDefaults());

    private final SpatialContextConfig config;
    private final boolean geo;
    private final DistanceCalculator distanceCalculator;
    private final CoordinateNormalizer normalizer;
    private final Rectangle worldBounds;
    private final boolean allowMultiOverlap;

    /**
     * Creates a context from a startup configuration.
     *
     * @param config startup configuration.
     */
    public SpatialContext(SpatialContextConfig config) {
        this.config = Objects.requireNonNull(config, "config");
        this.geo = config.isGeo();

        DistanceCalculator calculator = config.getDistanceCalculator();
        if (calculator == null) {
            calculator = geo
                    ? new GeodesicSphereDistanceCalculator.Haversine()
                    : new CartesianDistanceCalculator();
        }
        this.distanceCalculator = calculator;

        SpatialContextConfig.WorldBounds bounds = config.getWorldBounds();
        if (bounds == null) {
            bounds = geo ? SpatialContextConfig.WorldBounds.GEO : SpatialContextConfig.WorldBounds.MAX;
        } else if (geo && !SpatialContextConfig.WorldBounds.GEO.equals(bounds)) {
            throw new InvalidSpatialArgumentException(
                    InvalidSpatialArgumentException.REASON_BAD_CONFIG_VALUE,
                    "geo contexts only support the standard world bounds, got " + bounds
            );
        }
        this.normalizer = new CoordinateNormalizer(
                geo,
                config.isNormWrapLongitude(),
                config.getPrecisionScale(),
                bounds
        );
        this.worldBounds = new Rectangle(bounds.minX(), bounds.maxX(), bounds.minY(), bounds.maxY(), this);
        this.allowMultiOverlap = config.isAllowMultiOverlap();
    }

    public SpatialContextConfig config() {
        return config;
    }

    public boolean isGeo() {
        return geo;
    }

    public DistanceCalculator distanceCalculator() {
        return distanceCalculator;
    }

    public CoordinateNormalizer normalizer() {
        return normalizer;
    }

    public Rectangle worldBounds() {
        return worldBounds;
    }

    /**
     * Whether members of collections built here may overlap; disables relation short-circuits when true.
     */
    public boolean allowMultiOverlap() {
        return allowMultiOverlap;
    }

    public double normX(double x) {
        return normalizer.normX(x);
    }

    public double normY(double y) {
        return normalizer.normY(y);
    }

    public void verifyX(double x) {
        normalizer.verifyX(x);
    }

    public void verifyY(double y) {
        normalizer.verifyY(y);
    }

    /**
     * Makes a point, normalizing both coordinates.
     *
     * <p>Both coordinates NaN yields the empty point; a single NaN is rejected. In geo contexts a
     * point on the antimeridian always carries longitude 180.</p>
     */
    public Point makePoint(double x, double y) {
        if (requireMatchingNaN(x, y)) {
            return Point.EMPTY;
        }
        double normX = normX(x);
        if (isGeo() && normX == -180.0d) {
            normX = 180.0d;
        }
        return new Point(normX, normY(y), this);
    }

    /**
     * Makes a point without normalization; coordinates are verified against the world bounds instead.
     */
    public Point makeRawPoint(double x, double y) {
        if (requireMatchingNaN(x, y)) {
            return Point.EMPTY;
        }
        verifyX(x);
        verifyY(y);
        return new Point(x, y, this);
    }

    /**
     * Makes a rectangle from its lower-left and upper-right corners.
     */
    public Rectangle makeRectangle(Point lowerLeft, Point upperRight) {
        return makeRectangle(lowerLeft.x(), upperRight.x(), lowerLeft.y(), upperRight.y());
    }

    /**
     * Makes a rectangle.
     *
     * <p>In geo mode {@code minX > maxX} denotes a dateline-crossing rectangle, a width of 360
     * or more becomes the full -180..180 band, and an edge lying on the dateline is moved so
     * the rectangle does not needlessly cross it.</p>
     *
     * @throws InvalidShapeException when {@code minY > maxY}, Y leaves the world, NaN is mixed
     *                               with numbers, or a cartesian rectangle has {@code minX > maxX}.
     */
    public Rectangle makeRectangle(double minX, double maxX, double minY, double maxY) {
        int nanCount = (Double.isNaN(minX) ? 1 : 0) + (Double.isNaN(maxX) ? 1 : 0)
                + (Double.isNaN(minY) ? 1 : 0) + (Double.isNaN(maxY) ? 1 : 0);
        if (nanCount == 4) {
            return Rectangle.empty(this);
        }
        if (nanCount != 0) {
            throw new InvalidShapeException(
                    InvalidShapeException.REASON_MIXED_NAN,
                    "rectangle mixes NaN with numbers: " + minX + ", " + maxX + ", " + minY + ", " + maxY
            );
        }
        if (minY > maxY) {
            throw new InvalidShapeException(
                    InvalidShapeException.REASON_INVALID_Y_RANGE,
                    "maxY must be >= minY: " + minY + " to " + maxY
            );
        }
        if (geo) {
            double delta = calcWidth(minX, maxX);
            if (delta >= 360.0d) {
                // full wrap is only representable with the western edge on -180
                minX = -180.0d;
                maxX = 180.0d;
            } else {
                minX = normX(minX);
                maxX = normX(maxX);
                if (delta > 0) {
                    if (minX == 180.0d) {
                        minX = -180.0d;
                        maxX = -180.0d + delta;
                    } else if (maxX == -180.0d) {
                        maxX = 180.0d;
                        minX = 180.0d - delta;
                    }
                }
            }
            if (minY < -90.0d || minY > 90.0d || maxY < -90.0d || maxY > 90.0d) {
                throw new InvalidShapeException(
                        InvalidShapeException.REASON_Y_OUT_OF_BOUNDS,
                        "minY or maxY is outside of -90 to 90 bounds: " + minY + " to " + maxY
                );
            }
            return new Rectangle(minX, maxX, normalizer.round(minY), normalizer.round(maxY), this);
        }
        if (minX > maxX) {
            throw new InvalidShapeException(
                    InvalidShapeException.REASON_CARTESIAN_X_INVERTED,
                    "maxX must be >= minX in a cartesian context: " + minX + " to " + maxX
            );
        }
        return new Rectangle(normX(minX), normX(maxX), normY(minY), normY(maxY), this);
    }

    /**
     * Makes a circle around a normalized point.
     */
    public Circle makeCircle(double x, double y, double distance) {
        return makeCircle(makePoint(x, y), distance);
    }

    /**
     * Makes a circle; geo radii are capped at 180 degrees.
     *
     * @throws InvalidShapeException when {@code distance < 0}.
     */
    public Circle makeCircle(Point center, double distance) {
        Objects.requireNonNull(center, "center");
        if (distance < 0) {
            throw new InvalidShapeException(
                    InvalidShapeException.REASON_NEGATIVE_RADIUS,
                    "distance must be >= 0; got " + distance
            );
        }
        return new Circle(center, geo ? Math.min(distance, 180.0d) : distance, this);
    }

    /**
     * Makes a line segment from {@code a} to {@code b} buffered by {@code buf} on every side.
     */
    public BufferedLine makeBufferedLine(Point a, Point b, double buf) {
        requireNonNegativeBuffer(buf);
        return new BufferedLine(Objects.requireNonNull(a, "a"), Objects.requireNonNull(b, "b"), buf, this);
    }

    /**
     * Makes a buffered line string.
     */
    public BufferedLineString makeBufferedLineString(List<Point> points, double buf) {
        return makeBufferedLineString(points, buf, false);
    }

    /**
     * Makes a buffered line string, optionally widening each segment's buffer for longitude skew.
     */
    public BufferedLineString makeBufferedLineString(List<Point> points, double buf, boolean expandBufForLongitudeSkew) {
        requireNonNegativeBuffer(buf);
        return new BufferedLineString(Objects.requireNonNull(points, "points"), buf, expandBufForLongitudeSkew, this);
    }

    /**
     * Makes a shape collection; the member list is copied.
     */
    public ShapeCollection makeCollection(List<? extends Shape> shapes) {
        return new ShapeCollection(Objects.requireNonNull(shapes, "shapes"), this);
    }

    @Override
    public String toString() {
        if (this == GEO) {
            return "SpatialContext.GEO";
        }
        return "SpatialContext{"
                + "geo=" + geo
                + ", calculator=" + distanceCalculator
                + ", worldBounds=" + worldBounds
                + ", allowMultiOverlap=" + allowMultiOverlap
                + '}';
    }

    private static double calcWidth(double minX, double maxX) {
        double w = maxX - minX;
        if (w < 0) {
            w += 360.0d;
        }
        return w;
    }

    private static boolean requireMatchingNaN(double x, double y) {
        boolean xNaN = Double.isNaN(x);
        boolean yNaN = Double.isNaN(y);
        if (xNaN != yNaN) {
            throw new InvalidShapeException(
                    InvalidShapeException.REASON_MIXED_NAN,
                    "point must have both or neither coordinates NaN: x=" + x + " y=" + y
            );
        }
        return xNaN;
    }

    private static void requireNonNegativeBuffer(double buf) {
        if (!(buf >= 0)) {
            throw new InvalidShapeException(
                    InvalidShapeException.REASON_NEGATIVE_BUFFER,
                    "buffer must be >= 0; got " + buf
            );
        }
    }
}
