package org.Aayush.geoshape.jts;

import org.Aayush.geoshape.context.SpatialContext;
import org.Aayush.geoshape.exception.InvalidShapeException;
import org.Aayush.geoshape.shape.BufferedLine;
import org.Aayush.geoshape.shape.BufferedLineString;
import org.Aayush.geoshape.shape.Circle;
import org.Aayush.geoshape.shape.GeometryShape;
import org.Aayush.geoshape.shape.Point;
import org.Aayush.geoshape.shape.Rectangle;
import org.Aayush.geoshape.shape.Shape;
import org.Aayush.geoshape.shape.ShapeCollection;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryCollection;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.Polygon;
import org.locationtech.jts.geom.PrecisionModel;
import org.locationtech.jts.io.WKTReader;
import org.locationtech.jts.io.WKTWriter;
import org.locationtech.jts.operation.buffer.BufferOp;
import org.locationtech.jts.operation.buffer.BufferParameters;
import org.locationtech.jts.operation.union.UnaryUnionOp;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Converts shapes to and from JTS geometries for one {@link SpatialContext}.
 *
 * <p>The geometry factory's precision model follows the context: fixed when the context has a
 * precision scale, floating otherwise.</p>
 */
public final class JtsGeometryAdapter {
    private static final Logger LOG = LoggerFactory.getLogger(JtsGeometryAdapter.class);

    /** Vertices of the polygon approximating a geodesic circle. */
    public static final int CIRCLE_VERTICES = 100;

    private static final BufferParameters SQUARE_CAP = new BufferParameters(
            BufferParameters.DEFAULT_QUADRANT_SEGMENTS,
            BufferParameters.CAP_SQUARE
    );

    private final SpatialContext ctx;
    private final GeometryFactory factory;

    public JtsGeometryAdapter(SpatialContext ctx) {
        this(ctx, new GeometryFactory(precisionModelFor(ctx)));
    }

    public JtsGeometryAdapter(SpatialContext ctx, GeometryFactory factory) {
        this.ctx = Objects.requireNonNull(ctx, "ctx");
        this.factory = Objects.requireNonNull(factory, "factory");
    }

    private static PrecisionModel precisionModelFor(SpatialContext ctx) {
        Double scale = ctx.normalizer().precisionScale();
        return scale == null ? new PrecisionModel() : new PrecisionModel(scale);
    }

    public SpatialContext ctx() {
        return ctx;
    }

    public GeometryFactory factory() {
        return factory;
    }

    /**
     * Converts a shape into an equivalent (or, for circles, approximating) JTS geometry.
     *
     * @throws InvalidShapeException when a geodesic circle crosses the dateline or wraps a pole.
     */
    public Geometry toGeometry(Shape shape) {
        Objects.requireNonNull(shape, "shape");
        switch (shape.kind()) {
            case POINT:
                return toGeometry((Point) shape);
            case RECTANGLE:
                return toGeometry((Rectangle) shape);
            case CIRCLE:
                return toGeometry((Circle) shape);
            case BUFFERED_LINE:
                return toGeometry((BufferedLine) shape);
            case BUFFERED_LINE_STRING:
                return toGeometry((BufferedLineString) shape);
            case COLLECTION:
                return toGeometry((ShapeCollection) shape);
            case GEOMETRY:
                return toGeometry((GeometryShape) shape);
            default:
                throw new IllegalStateException("unhandled shape kind " + shape.kind());
        }
    }

    private Geometry toGeometry(Point point) {
        if (point.isEmpty()) {
            return factory.createPoint();
        }
        return factory.createPoint(new Coordinate(point.x(), point.y()));
    }

    private Geometry toGeometry(Rectangle rect) {
        if (rect.isEmpty()) {
            return factory.createPolygon();
        }
        if (rect.crossesDateLine()) {
            LOG.debug("Splitting dateline-crossing rectangle {} into two polygons", rect);
            Polygon west = (Polygon) factory.toGeometry(new Envelope(rect.minX(), 180.0d, rect.minY(), rect.maxY()));
            Polygon east = (Polygon) factory.toGeometry(new Envelope(-180.0d, rect.maxX(), rect.minY(), rect.maxY()));
            return factory.createMultiPolygon(new Polygon[]{west, east});
        }
        return factory.toGeometry(new Envelope(rect.minX(), rect.maxX(), rect.minY(), rect.maxY()));
    }

    private Geometry toGeometry(Circle circle) {
        if (circle.isEmpty()) {
            return factory.createPolygon();
        }
        Point center = circle.center();
        Geometry centerGeom = toGeometry(center);
        if (circle.radius() == 0.0d) {
            return centerGeom;
        }
        if (!ctx.isGeo()) {
            return centerGeom.buffer(circle.radius(), CIRCLE_VERTICES / 4);
        }
        Rectangle bbox = circle.boundingBox();
        if (bbox.crossesDateLine() || bbox.width() >= 360.0d) {
            throw new InvalidShapeException(
                    InvalidShapeException.REASON_UNSUPPORTED_DATELINE,
                    "cannot convert a geodesic circle crossing the dateline or wrapping a pole: " + circle
            );
        }
        Coordinate[] ring = new Coordinate[CIRCLE_VERTICES + 1];
        for (int i = 0; i < CIRCLE_VERTICES; i++) {
            double bearing = i * (360.0d / CIRCLE_VERTICES);
            Point vertex = ctx.distanceCalculator().pointOnBearing(center, circle.radius(), bearing, ctx);
            ring[i] = new Coordinate(vertex.x(), vertex.y());
        }
        ring[CIRCLE_VERTICES] = new Coordinate(ring[0]);
        return factory.createPolygon(ring);
    }

    private Geometry toGeometry(BufferedLine line) {
        if (line.isEmpty()) {
            return factory.createPolygon();
        }
        Geometry axis;
        if (line.a().equals(line.b())) {
            axis = toGeometry(line.a());
        } else {
            axis = factory.createLineString(new Coordinate[]{
                    new Coordinate(line.a().x(), line.a().y()),
                    new Coordinate(line.b().x(), line.b().y())
            });
        }
        if (line.buf() == 0.0d) {
            return axis;
        }
        return BufferOp.bufferOp(axis, line.buf(), SQUARE_CAP);
    }

    private Geometry toGeometry(BufferedLineString lineString) {
        if (lineString.isEmpty()) {
            return factory.createPolygon();
        }
        List<Point> points = lineString.points();
        if (lineString.buf() == 0.0d && points.size() > 1) {
            Coordinate[] coords = new Coordinate[points.size()];
            for (int i = 0; i < coords.length; i++) {
                coords[i] = new Coordinate(points.get(i).x(), points.get(i).y());
            }
            return factory.createLineString(coords);
        }
        List<Geometry> parts = new ArrayList<>(lineString.segments().size());
        for (Shape segment : lineString.segments().shapes()) {
            parts.add(toGeometry(segment));
        }
        return UnaryUnionOp.union(parts, factory);
    }

    private Geometry toGeometry(ShapeCollection collection) {
        Geometry[] members = new Geometry[collection.size()];
        for (int i = 0; i < members.length; i++) {
            members[i] = toGeometry(collection.get(i));
        }
        return factory.createGeometryCollection(members);
    }

    private Geometry toGeometry(GeometryShape shape) {
        if (shape.backend() instanceof JtsGeometry) {
            return ((JtsGeometry) shape.backend()).geometry();
        }
        return parseWkt(shape.toWkt());
    }

    /**
     * Wraps a JTS geometry, unwrapping dateline crossings in geo contexts.
     */
    public Shape fromGeometry(Geometry geom) {
        return fromGeometry(geom, true);
    }

    /**
     * Wraps a JTS geometry. Points become {@link Point}s and plain geometry collections become
     * {@link ShapeCollection}s of wrapped members; everything else is a {@link GeometryShape}.
     *
     * @throws InvalidShapeException when the geometry is invalid.
     */
    public Shape fromGeometry(Geometry geom, boolean unwrapDateline) {
        Objects.requireNonNull(geom, "geom");
        if (geom.getClass() == GeometryCollection.class) {
            List<Shape> members = new ArrayList<>(geom.getNumGeometries());
            for (int i = 0; i < geom.getNumGeometries(); i++) {
                members.add(fromGeometry(geom.getGeometryN(i), unwrapDateline));
            }
            return ctx.makeCollection(members);
        }
        if (geom instanceof org.locationtech.jts.geom.Point) {
            if (geom.isEmpty()) {
                return Point.EMPTY;
            }
            org.locationtech.jts.geom.Point point = (org.locationtech.jts.geom.Point) geom;
            return ctx.makePoint(point.getX(), point.getY());
        }
        return new GeometryShape(new JtsGeometry(geom, this, unwrapDateline));
    }

    /**
     * Reads WKT into a shape.
     *
     * @throws IllegalArgumentException when the text is not valid WKT.
     */
    public Shape fromWkt(String wkt) {
        return fromGeometry(parseWkt(wkt));
    }

    /**
     * Writes a shape as WKT through its JTS form.
     */
    public String toWkt(Shape shape) {
        return toWkt(toGeometry(shape));
    }

    /**
     * Reads WKT with this adapter's geometry factory.
     *
     * @throws IllegalArgumentException when the text is not valid WKT.
     */
    public Geometry parseWkt(String wkt) {
        Objects.requireNonNull(wkt, "wkt");
        WKTReader reader = new WKTReader(factory);
        try {
            return reader.read(wkt);
        } catch (Exception e) {
            throw new IllegalArgumentException("Failed to parse WKT", e);
        }
    }

    public static String toWkt(Geometry geom) {
        WKTWriter wktWriter = new WKTWriter(getOutputDimension(geom));
        return wktWriter.write(geom);
    }

    static int getOutputDimension(Geometry geom) {
        int dimension = 2;
        Coordinate coordinate = geom.getCoordinate();
        if (coordinate == null) {
            return dimension;
        }
        if (!Double.isNaN(coordinate.getZ())) {
            dimension = 3;
        }
        if (!Double.isNaN(coordinate.getM())) {
            dimension = 4;
        }
        return dimension;
    }
}
