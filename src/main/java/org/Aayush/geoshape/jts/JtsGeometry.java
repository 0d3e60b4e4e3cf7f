package org.Aayush.geoshape.jts;

import org.Aayush.geoshape.context.SpatialContext;
import org.Aayush.geoshape.distance.DistanceUtils;
import org.Aayush.geoshape.exception.InvalidShapeException;
import org.Aayush.geoshape.shape.Circle;
import org.Aayush.geoshape.shape.GeometryBackend;
import org.Aayush.geoshape.shape.GeometryShape;
import org.Aayush.geoshape.shape.Point;
import org.Aayush.geoshape.shape.Rectangle;
import org.Aayush.geoshape.shape.Shape;
import org.Aayush.geoshape.shape.SpatialRelation;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.CoordinateSequence;
import org.locationtech.jts.geom.CoordinateSequenceFilter;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryCollection;
import org.locationtech.jts.geom.GeometryFilter;
import org.locationtech.jts.geom.IntersectionMatrix;
import org.locationtech.jts.geom.LineString;
import org.locationtech.jts.geom.Lineal;
import org.locationtech.jts.geom.Polygon;
import org.locationtech.jts.geom.Puntal;
import org.locationtech.jts.operation.union.UnaryUnionOp;
import org.locationtech.jts.operation.valid.IsValidOp;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * {@link GeometryBackend} over a JTS geometry.
 *
 * <p>In geo contexts the geometry is unwrapped across the dateline, unioned when it is a
 * multi-geometry, and cut back into the -180..180 page; the bounding box is taken from the
 * unwrapped envelope so it may cross the dateline. The stored geometry is a private copy.</p>
 */
public final class JtsGeometry implements GeometryBackend {
    private static final Logger LOG = LoggerFactory.getLogger(JtsGeometry.class);

    private final Geometry geom;
    private final JtsGeometryAdapter adapter;
    private final SpatialContext ctx;
    private final boolean hasArea;
    private final Rectangle bbox;

    /**
     * Wraps and validates a geometry.
     *
     * @param geom geometry; must not be a plain {@link GeometryCollection}.
     * @param adapter adapter bound to the owning context.
     * @param unwrapDateline in geo contexts, treat longitude jumps over 180 degrees as dateline crossings.
     * @throws InvalidShapeException when the geometry is a plain collection or is invalid.
     */
    public JtsGeometry(Geometry geom, JtsGeometryAdapter adapter, boolean unwrapDateline) {
        Objects.requireNonNull(geom, "geom");
        this.adapter = Objects.requireNonNull(adapter, "adapter");
        this.ctx = adapter.ctx();
        if (geom.getClass() == GeometryCollection.class) {
            throw new InvalidShapeException(
                    InvalidShapeException.REASON_INVALID_GEOMETRY,
                    "a plain GeometryCollection cannot be related; wrap its members individually"
            );
        }
        Geometry working = geom.copy();
        if (working.isEmpty()) {
            this.bbox = Rectangle.empty(ctx);
        } else if (ctx.isGeo()) {
            if (unwrapDateline) {
                int crossings = unwrapDateline(working);
                if (crossings > 0) {
                    LOG.debug("Unwrapped {} across {} dateline crossing(s)", working.getGeometryType(), crossings);
                }
            }
            if (working instanceof GeometryCollection) {
                working = working.union();
            }
            Envelope unwrappedEnv = working.getEnvelopeInternal();
            working = cutUnwrappedGeomInto360(working);
            double envWidth = unwrappedEnv.getWidth();
            double minX;
            double maxX;
            if (envWidth >= 360.0d) {
                minX = -180.0d;
                maxX = 180.0d;
            } else {
                minX = unwrappedEnv.getMinX();
                maxX = DistanceUtils.normLonDEG(unwrappedEnv.getMinX() + envWidth);
            }
            this.bbox = new Rectangle(minX, maxX, unwrappedEnv.getMinY(), unwrappedEnv.getMaxY(), ctx);
        } else {
            Envelope env = working.getEnvelopeInternal();
            this.bbox = new Rectangle(env.getMinX(), env.getMaxX(), env.getMinY(), env.getMaxY(), ctx);
        }

        IsValidOp isValidOp = new IsValidOp(working);
        if (!isValidOp.isValid()) {
            throw new InvalidShapeException(
                    InvalidShapeException.REASON_INVALID_GEOMETRY,
                    isValidOp.getValidationError().toString()
            );
        }
        this.geom = working;
        this.hasArea = !(working instanceof Lineal || working instanceof Puntal);
    }

    /**
     * The wrapped geometry; callers must not mutate it.
     */
    public Geometry geometry() {
        return geom;
    }

    @Override
    public boolean isEmpty() {
        return geom.isEmpty();
    }

    @Override
    public boolean hasArea() {
        return hasArea;
    }

    @Override
    public Rectangle boundingBox() {
        return bbox;
    }

    @Override
    public Point center() {
        if (isEmpty()) {
            return Point.EMPTY;
        }
        Coordinate centroid = geom.getCentroid().getCoordinate();
        return ctx.makePoint(centroid.x, centroid.y);
    }

    /**
     * Planar area, or the bounding box's context area scaled by how much of the box the geometry fills.
     */
    @Override
    public double area(SpatialContext areaCtx) {
        double geomArea = geom.getArea();
        if (areaCtx == null || geomArea == 0.0d) {
            return geomArea;
        }
        double bboxArea = bbox.area(null);
        if (bboxArea == 0.0d) {
            return geomArea;
        }
        return bbox.area(areaCtx) * (geomArea / bboxArea);
    }

    @Override
    public Shape buffered(double distance, SpatialContext bufferCtx) {
        return new GeometryShape(new JtsGeometry(geom.buffer(distance), adapter, true));
    }

    @Override
    public SpatialRelation relate(Shape other) {
        switch (other.kind()) {
            case POINT:
                return relatePoint((Point) other);
            case CIRCLE:
                return relateCircle((Circle) other);
            case RECTANGLE:
            case BUFFERED_LINE:
                return relateByBoundingBoxThenGeometry(other);
            case GEOMETRY:
                return relateGeometry((GeometryShape) other);
            default:
                throw new IllegalStateException("geometry cannot own a relation to " + other.kind());
        }
    }

    private SpatialRelation relatePoint(Point point) {
        Geometry jtsPoint = adapter.toGeometry(point);
        return geom.disjoint(jtsPoint) ? SpatialRelation.DISJOINT : SpatialRelation.CONTAINS;
    }

    private SpatialRelation relateByBoundingBoxThenGeometry(Shape other) {
        SpatialRelation bboxR = bbox.relate(other);
        if (bboxR == SpatialRelation.WITHIN || bboxR == SpatialRelation.DISJOINT) {
            return bboxR;
        }
        return toSpatialRelation(geom.relate(adapter.toGeometry(other)));
    }

    /**
     * Vertex test against the circle: all inside means within, a mix means intersecting.
     * With every vertex outside, planar contexts measure the distance from the circle's center
     * to the geometry; geo contexts relate against the circle's polygon.
     */
    private SpatialRelation relateCircle(Circle circle) {
        SpatialRelation bboxR = bbox.relate(circle);
        if (bboxR == SpatialRelation.WITHIN || bboxR == SpatialRelation.DISJOINT) {
            return bboxR;
        }
        Coordinate[] coords = geom.getCoordinates();
        int outside = 0;
        int seen = 0;
        for (Coordinate coord : coords) {
            seen++;
            if (!circle.contains(coord.x, coord.y)) {
                outside++;
            }
            if (seen != outside && outside != 0) {
                return SpatialRelation.INTERSECTS;
            }
        }
        if (seen != outside) {
            return SpatialRelation.WITHIN;
        }
        if (ctx.isGeo()) {
            return relateGeoCircleOutsideVertices(circle);
        }
        Geometry center = adapter.toGeometry(circle.center());
        boolean centerInside = !geom.disjoint(center);
        if (!centerInside) {
            return geom.distance(center) <= circle.radius() ? SpatialRelation.INTERSECTS : SpatialRelation.DISJOINT;
        }
        if (!hasArea) {
            return SpatialRelation.INTERSECTS;
        }
        return geom.getBoundary().distance(center) < circle.radius()
                ? SpatialRelation.INTERSECTS
                : SpatialRelation.CONTAINS;
    }

    /**
     * Geo circle with every geometry vertex outside it: relates against the circle's polygon.
     * A circle that has no polygon form falls back to where its center falls.
     */
    private SpatialRelation relateGeoCircleOutsideVertices(Circle circle) {
        Geometry circleGeom;
        try {
            circleGeom = adapter.toGeometry(circle);
        } catch (InvalidShapeException e) {
            if (!InvalidShapeException.REASON_UNSUPPORTED_DATELINE.equals(e.reasonCode())) {
                throw e;
            }
            LOG.debug("Relating {} by its center: {}", circle, e.getMessage());
            return geom.disjoint(adapter.toGeometry(circle.center()))
                    ? SpatialRelation.DISJOINT
                    : SpatialRelation.CONTAINS;
        }
        SpatialRelation r = toSpatialRelation(geom.relate(circleGeom));
        // a vertex outside the circle rules out WITHIN
        return r == SpatialRelation.WITHIN ? SpatialRelation.INTERSECTS : r;
    }

    private SpatialRelation relateGeometry(GeometryShape other) {
        if (!(other.backend() instanceof JtsGeometry)) {
            throw new IllegalArgumentException("cannot relate to a geometry of another engine: " + other.backend().getClass());
        }
        return toSpatialRelation(geom.relate(((JtsGeometry) other.backend()).geom));
    }

    /**
     * Maps a DE-9IM matrix onto a relation, preferring CONTAINS, then WITHIN, then INTERSECTS.
     */
    static SpatialRelation toSpatialRelation(IntersectionMatrix matrix) {
        if (matrix.isContains()) {
            return SpatialRelation.CONTAINS;
        }
        if (matrix.isWithin()) {
            return SpatialRelation.WITHIN;
        }
        if (matrix.isDisjoint()) {
            return SpatialRelation.DISJOINT;
        }
        return SpatialRelation.INTERSECTS;
    }

    @Override
    public String toWkt() {
        return JtsGeometryAdapter.toWkt(geom);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof JtsGeometry)) {
            return false;
        }
        return geom.equalsExact(((JtsGeometry) o).geom);
    }

    @Override
    public int hashCode() {
        return geom.getEnvelopeInternal().hashCode();
    }

    @Override
    public String toString() {
        return toWkt();
    }

    /**
     * Shifts the parts of line strings and polygons that jump over the dateline by multiples
     * of 360 so the geometry becomes continuous, possibly extending past +180.
     *
     * @return the number of times the geometry spans the dateline.
     */
    static int unwrapDateline(Geometry geometry) {
        if (geometry.getEnvelopeInternal().getWidth() < 180.0d) {
            return 0;
        }
        DatelineFilter filter = new DatelineFilter();
        geometry.apply(filter);
        if (filter.crossings > 0) {
            geometry.geometryChanged();
        }
        return filter.crossings;
    }

    private static int unwrapDateline(Polygon poly) {
        LineString exteriorRing = poly.getExteriorRing();
        int cross = unwrapDateline(exteriorRing);
        if (cross > 0) {
            Polygon shell = poly.getFactory().createPolygon(exteriorRing.getCoordinateSequence().copy());
            for (int i = 0; i < poly.getNumInteriorRing(); i++) {
                LineString inner = poly.getInteriorRingN(i);
                unwrapDateline(inner);
                for (int shiftCount = 0; !shell.covers(inner); shiftCount++) {
                    if (shiftCount > cross) {
                        throw new InvalidShapeException(
                                InvalidShapeException.REASON_INVALID_GEOMETRY,
                                "interior ring is not within the exterior ring: " + inner
                        );
                    }
                    shiftGeomByX(inner, 360);
                }
            }
            poly.geometryChanged();
        }
        return cross;
    }

    private static int unwrapDateline(LineString lineString) {
        CoordinateSequence cseq = lineString.getCoordinateSequence();
        int size = cseq.size();
        if (size <= 1) {
            return 0;
        }
        int shiftX = 0;
        int shiftXPage = 0;
        int shiftXPageMin = 0;
        int shiftXPageMax = 0;
        double prevX = cseq.getX(0);
        for (int i = 1; i < size; i++) {
            double thisX = cseq.getX(i) + shiftX;
            if (prevX - thisX > 180.0d) {
                // eastward over the dateline
                thisX += 360.0d;
                shiftX += 360;
                shiftXPage += 1;
                shiftXPageMax = Math.max(shiftXPageMax, shiftXPage);
            } else if (thisX - prevX > 180.0d) {
                // westward over the dateline
                thisX -= 360.0d;
                shiftX -= 360;
                shiftXPage -= 1;
                shiftXPageMin = Math.min(shiftXPageMin, shiftXPage);
            }
            if (shiftXPage != 0) {
                cseq.setOrdinate(i, CoordinateSequence.X, thisX);
            }
            prevX = thisX;
        }
        shiftGeomByX(lineString, shiftXPageMin * -360);
        int crossings = shiftXPageMax - shiftXPageMin;
        if (crossings > 0) {
            lineString.geometryChanged();
        }
        return crossings;
    }

    private static void shiftGeomByX(Geometry geometry, int xShift) {
        if (xShift == 0) {
            return;
        }
        geometry.apply(new ShiftXFilter(xShift));
    }

    /**
     * Intersects the geometry with each 360-wide page it spans and shifts every piece back
     * into -180..180.
     */
    private static Geometry cutUnwrappedGeomInto360(Geometry geometry) {
        Envelope geomEnv = geometry.getEnvelopeInternal();
        if (geomEnv.getMinX() >= -180.0d && geomEnv.getMaxX() <= 180.0d) {
            return geometry;
        }
        List<Geometry> pieces = new ArrayList<>();
        for (int page = 0; ; page++) {
            double minX = -180.0d + page * 360.0d;
            if (geomEnv.getMaxX() <= minX) {
                break;
            }
            Geometry rect = geometry.getFactory().toGeometry(new Envelope(minX, minX + 360.0d, -90.0d, 90.0d));
            Geometry pageGeom = rect.intersection(geometry);
            shiftGeomByX(pageGeom, page * -360);
            pieces.add(pageGeom);
        }
        LOG.debug("Cut unwrapped geometry into {} page(s)", pieces.size());
        return UnaryUnionOp.union(pieces);
    }

    private static final class DatelineFilter implements GeometryFilter {
        private int crossings;

        @Override
        public void filter(Geometry geometry) {
            if (geometry.getEnvelopeInternal().getWidth() < 180.0d) {
                return;
            }
            int cross;
            if (geometry instanceof LineString) {
                cross = unwrapDateline((LineString) geometry);
            } else if (geometry instanceof Polygon) {
                cross = unwrapDateline((Polygon) geometry);
            } else {
                return;
            }
            crossings = Math.max(crossings, cross);
        }
    }

    private static final class ShiftXFilter implements CoordinateSequenceFilter {
        private final int xShift;

        private ShiftXFilter(int xShift) {
            this.xShift = xShift;
        }

        @Override
        public void filter(CoordinateSequence seq, int i) {
            seq.setOrdinate(i, CoordinateSequence.X, seq.getX(i) + xShift);
        }

        @Override
        public boolean isDone() {
            return false;
        }

        @Override
        public boolean isGeometryChanged() {
            return true;
        }
    }
}
