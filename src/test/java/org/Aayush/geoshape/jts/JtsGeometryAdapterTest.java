package org.Aayush.geoshape.jts;

import org.Aayush.geoshape.context.SpatialContext;
import org.Aayush.geoshape.context.SpatialContextConfig;
import org.Aayush.geoshape.exception.InvalidShapeException;
import org.Aayush.geoshape.shape.GeometryShape;
import org.Aayush.geoshape.shape.Point;
import org.Aayush.geoshape.shape.Rectangle;
import org.Aayush.geoshape.shape.Shape;
import org.Aayush.geoshape.shape.ShapeCollection;
import org.Aayush.geoshape.shape.SpatialRelation;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryCollection;
import org.locationtech.jts.geom.LineString;
import org.locationtech.jts.geom.MultiPolygon;
import org.locationtech.jts.geom.Polygon;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("JtsGeometryAdapter Tests")
class JtsGeometryAdapterTest {

    private static final SpatialContext GEO = SpatialContext.GEO;
    private static final SpatialContext FLAT = new SpatialContext(SpatialContextConfig.cartesianDefaults());
    private static final JtsGeometryAdapter GEO_ADAPTER = new JtsGeometryAdapter(GEO);
    private static final JtsGeometryAdapter FLAT_ADAPTER = new JtsGeometryAdapter(FLAT);

    private static final String SQUARE = "POLYGON ((0 0, 10 0, 10 10, 0 10, 0 0))";
    private static final String DATELINE_BOX = "POLYGON ((170 0, -170 0, -170 10, 170 10, 170 0))";

    @Nested
    @DisplayName("Shapes to geometries")
    class ToGeometry {

        @Test
        @DisplayName("A dateline-crossing rectangle splits into two polygons")
        void testCrossingRectangle() {
            Geometry geom = GEO_ADAPTER.toGeometry(GEO.makeRectangle(170, -170, -10, 10));
            assertInstanceOf(MultiPolygon.class, geom);
            assertEquals(2, geom.getNumGeometries());
            assertEquals(400.0d, geom.getArea(), 1e-9);
        }

        @Test
        @DisplayName("A plain rectangle becomes one polygon")
        void testRectangle() {
            Geometry geom = FLAT_ADAPTER.toGeometry(FLAT.makeRectangle(0, 4, 0, 5));
            assertInstanceOf(Polygon.class, geom);
            assertEquals(20.0d, geom.getArea(), 1e-12);
        }

        @Test
        @DisplayName("A geodesic circle becomes a closed ring of fixed vertex count")
        void testGeoCircle() {
            Geometry geom = GEO_ADAPTER.toGeometry(GEO.makeCircle(10, 20, 5));
            assertInstanceOf(Polygon.class, geom);
            assertEquals(JtsGeometryAdapter.CIRCLE_VERTICES + 1, geom.getNumPoints());
            assertTrue(geom.isValid());
        }

        @Test
        @DisplayName("A geodesic circle over the dateline is not converted")
        void testGeoCircleOverDateline() {
            InvalidShapeException ex = assertThrows(
                    InvalidShapeException.class,
                    () -> GEO_ADAPTER.toGeometry(GEO.makeCircle(178, 0, 5))
            );
            assertEquals(InvalidShapeException.REASON_UNSUPPORTED_DATELINE, ex.reasonCode());
        }

        @Test
        @DisplayName("A cartesian circle is buffered from its center")
        void testCartesianCircle() {
            Geometry geom = FLAT_ADAPTER.toGeometry(FLAT.makeCircle(0, 0, 2));
            assertEquals(Math.PI * 4.0d, geom.getArea(), 0.05d);
            assertEquals("POINT (3 4)", JtsGeometryAdapter.toWkt(FLAT_ADAPTER.toGeometry(FLAT.makeCircle(3, 4, 0))));
        }

        @Test
        @DisplayName("A buffered line has square caps")
        void testBufferedLine() {
            Geometry geom = FLAT_ADAPTER.toGeometry(FLAT.makeBufferedLine(FLAT.makePoint(0, 0), FLAT.makePoint(10, 0), 1));
            assertEquals(24.0d, geom.getArea(), 1e-9);
        }

        @Test
        @DisplayName("An unbuffered line string stays a line string")
        void testLineString() {
            List<Point> points = List.of(FLAT.makePoint(0, 0), FLAT.makePoint(10, 0), FLAT.makePoint(10, 10));
            assertInstanceOf(LineString.class, FLAT_ADAPTER.toGeometry(FLAT.makeBufferedLineString(points, 0)));
            Geometry buffered = FLAT_ADAPTER.toGeometry(FLAT.makeBufferedLineString(points, 1));
            assertTrue(buffered.getArea() > 40.0d);
        }

        @Test
        @DisplayName("Collections and empty shapes")
        void testCollectionAndEmpty() {
            ShapeCollection collection = FLAT.makeCollection(List.of(FLAT.makePoint(1, 1), FLAT.makeRectangle(0, 1, 0, 1)));
            Geometry geom = FLAT_ADAPTER.toGeometry(collection);
            assertInstanceOf(GeometryCollection.class, geom);
            assertEquals(2, geom.getNumGeometries());
            assertTrue(FLAT_ADAPTER.toGeometry(Point.EMPTY).isEmpty());
        }

        @Test
        @DisplayName("Fixed precision contexts get a fixed precision model")
        void testPrecisionModel() {
            SpatialContext fixed = new SpatialContext(SpatialContextConfig.builder().precisionScale(10.0d).build());
            JtsGeometryAdapter adapter = new JtsGeometryAdapter(fixed);
            assertFalse(adapter.factory().getPrecisionModel().isFloating());
            assertEquals(10.0d, adapter.factory().getPrecisionModel().getScale());
            assertTrue(GEO_ADAPTER.factory().getPrecisionModel().isFloating());
        }
    }

    @Nested
    @DisplayName("Geometries to shapes")
    class FromGeometry {

        @Test
        @DisplayName("Points come back as points")
        void testPoint() {
            Shape shape = FLAT_ADAPTER.fromWkt("POINT (1 2)");
            assertInstanceOf(Point.class, shape);
            assertEquals(FLAT.makePoint(1, 2), shape);
            assertSame(Point.EMPTY, FLAT_ADAPTER.fromWkt("POINT EMPTY"));
        }

        @Test
        @DisplayName("Polygons are wrapped with their box, area and center")
        void testPolygon() {
            Shape square = FLAT_ADAPTER.fromWkt(SQUARE);
            assertInstanceOf(GeometryShape.class, square);
            assertEquals(FLAT.makeRectangle(0, 10, 0, 10), square.boundingBox());
            assertTrue(square.hasArea());
            assertEquals(100.0d, square.area(null), 1e-12);
            assertEquals(100.0d, square.area(FLAT), 1e-12);
            assertEquals(FLAT.makePoint(5, 5), square.center());
        }

        @Test
        @DisplayName("Line strings have no area")
        void testLineStringHasNoArea() {
            Shape line = FLAT_ADAPTER.fromWkt("LINESTRING (0 0, 10 10)");
            assertFalse(line.hasArea());
            assertEquals(SpatialRelation.CONTAINS, line.relate(FLAT.makePoint(5, 5)));
        }

        @Test
        @DisplayName("Plain geometry collections become shape collections")
        void testGeometryCollection() {
            Shape shape = FLAT_ADAPTER.fromWkt("GEOMETRYCOLLECTION (POINT (1 1), POLYGON ((0 0, 5 0, 5 5, 0 5, 0 0)))");
            assertInstanceOf(ShapeCollection.class, shape);
            ShapeCollection collection = (ShapeCollection) shape;
            assertEquals(2, collection.size());
            assertInstanceOf(Point.class, collection.get(0));
            assertInstanceOf(GeometryShape.class, collection.get(1));
        }

        @Test
        @DisplayName("Wrapping a plain geometry collection directly is rejected")
        void testDirectCollectionRejected() {
            Geometry geom = FLAT_ADAPTER.parseWkt("GEOMETRYCOLLECTION (POINT (1 1))");
            InvalidShapeException ex = assertThrows(
                    InvalidShapeException.class,
                    () -> new JtsGeometry(geom, FLAT_ADAPTER, true)
            );
            assertEquals(InvalidShapeException.REASON_INVALID_GEOMETRY, ex.reasonCode());
        }

        @Test
        @DisplayName("Self-intersecting polygons are rejected")
        void testInvalidPolygon() {
            InvalidShapeException ex = assertThrows(
                    InvalidShapeException.class,
                    () -> FLAT_ADAPTER.fromWkt("POLYGON ((0 0, 10 10, 10 0, 0 10, 0 0))")
            );
            assertEquals(InvalidShapeException.REASON_INVALID_GEOMETRY, ex.reasonCode());
        }

        @Test
        @DisplayName("Malformed text keeps the parser failure as cause")
        void testMalformedWkt() {
            IllegalArgumentException ex = assertThrows(
                    IllegalArgumentException.class,
                    () -> FLAT_ADAPTER.fromWkt("POLYGON ((0 0")
            );
            assertEquals("Failed to parse WKT", ex.getMessage());
            assertTrue(ex.getCause() != null);
        }

        @Test
        @DisplayName("WKT written for a shape reads back as the same shape")
        void testWktRoundTrip() {
            Shape square = FLAT_ADAPTER.fromWkt(SQUARE);
            assertEquals(square, FLAT_ADAPTER.fromWkt(FLAT_ADAPTER.toWkt(square)));
            assertEquals(square.hashCode(), FLAT_ADAPTER.fromWkt(FLAT_ADAPTER.toWkt(square)).hashCode());
        }

        @Test
        @DisplayName("Output dimension follows the first coordinate")
        void testOutputDimension() {
            assertEquals(2, JtsGeometryAdapter.getOutputDimension(FLAT_ADAPTER.parseWkt("POINT (1 2)")));
            assertEquals(3, JtsGeometryAdapter.getOutputDimension(FLAT_ADAPTER.parseWkt("POINT Z (1 2 3)")));
            assertEquals(2, JtsGeometryAdapter.getOutputDimension(FLAT_ADAPTER.parseWkt("POINT EMPTY")));
        }
    }

    @Nested
    @DisplayName("Relations")
    class Relations {

        @ParameterizedTest
        @CsvSource({
                "5, 5, CONTAINS",
                "0, 5, CONTAINS",
                "20, 20, DISJOINT"
        })
        @DisplayName("Polygon against points")
        void testPoints(double x, double y, SpatialRelation expected) {
            Shape square = FLAT_ADAPTER.fromWkt(SQUARE);
            assertEquals(expected, square.relate(FLAT.makePoint(x, y)));
            assertEquals(expected.transpose(), FLAT.makePoint(x, y).relate(square));
        }

        @ParameterizedTest
        @CsvSource({
                "2, 3, 2, 3, CONTAINS",
                "-5, 20, -5, 20, WITHIN",
                "5, 15, 5, 15, INTERSECTS",
                "20, 30, 20, 30, DISJOINT",
                "11, 12, 0, 10, DISJOINT"
        })
        @DisplayName("Polygon against rectangles, both directions")
        void testRectangles(double minX, double maxX, double minY, double maxY, SpatialRelation expected) {
            Shape square = FLAT_ADAPTER.fromWkt(SQUARE);
            Rectangle r = FLAT.makeRectangle(minX, maxX, minY, maxY);
            assertEquals(expected, square.relate(r));
            assertEquals(expected.transpose(), r.relate(square));
        }

        @Test
        @DisplayName("Polygon against circles")
        void testCircles() {
            Shape square = FLAT_ADAPTER.fromWkt(SQUARE);
            assertEquals(SpatialRelation.CONTAINS, square.relate(FLAT.makeCircle(5, 5, 1)));
            assertEquals(SpatialRelation.WITHIN, square.relate(FLAT.makeCircle(5, 5, 100)));
            assertEquals(SpatialRelation.INTERSECTS, square.relate(FLAT.makeCircle(10, 5, 2)));
            assertEquals(SpatialRelation.INTERSECTS, square.relate(FLAT.makeCircle(12, 5, 3)));
            assertEquals(SpatialRelation.INTERSECTS, square.relate(FLAT.makeCircle(5, 5, 6)));
            assertEquals(SpatialRelation.DISJOINT, square.relate(FLAT.makeCircle(12, 12, 2.5)));
            assertEquals(SpatialRelation.DISJOINT, square.relate(FLAT.makeCircle(30, 30, 2)));
            assertEquals(SpatialRelation.WITHIN, FLAT.makeCircle(5, 5, 1).relate(square));
        }

        @Test
        @DisplayName("Polygon against polygon")
        void testPolygons() {
            Shape big = FLAT_ADAPTER.fromWkt(SQUARE);
            Shape small = FLAT_ADAPTER.fromWkt("POLYGON ((2 2, 3 2, 3 3, 2 3, 2 2))");
            Shape apart = FLAT_ADAPTER.fromWkt("POLYGON ((20 20, 30 20, 30 30, 20 30, 20 20))");
            assertEquals(SpatialRelation.CONTAINS, big.relate(small));
            assertEquals(SpatialRelation.WITHIN, small.relate(big));
            assertEquals(SpatialRelation.DISJOINT, big.relate(apart));
        }

        @Test
        @DisplayName("Polygon against a buffered line")
        void testBufferedLine() {
            Shape square = FLAT_ADAPTER.fromWkt(SQUARE);
            Shape inside = FLAT.makeBufferedLine(FLAT.makePoint(2, 5), FLAT.makePoint(8, 5), 1);
            Shape across = FLAT.makeBufferedLine(FLAT.makePoint(5, 5), FLAT.makePoint(15, 5), 1);
            assertEquals(SpatialRelation.CONTAINS, square.relate(inside));
            assertEquals(SpatialRelation.INTERSECTS, square.relate(across));
        }

        @Test
        @DisplayName("Buffering a polygon grows it")
        void testBuffered() {
            Shape square = FLAT_ADAPTER.fromWkt(SQUARE);
            Shape grown = square.buffered(1, FLAT);
            assertInstanceOf(GeometryShape.class, grown);
            assertTrue(grown.area(null) > 140.0d);
            assertEquals(SpatialRelation.CONTAINS, grown.relate(FLAT.makePoint(10.5, 5)));
        }
    }

    @Nested
    @DisplayName("Dateline handling")
    class Dateline {

        @Test
        @DisplayName("A polygon spanning the dateline is unwrapped and cut")
        void testDatelinePolygon() {
            Shape shape = GEO_ADAPTER.fromWkt(DATELINE_BOX);
            Rectangle bbox = shape.boundingBox();
            assertEquals(170.0d, bbox.minX(), 1e-9);
            assertEquals(-170.0d, bbox.maxX(), 1e-9);
            assertTrue(bbox.crossesDateLine());
            assertEquals(200.0d, shape.area(null), 1e-9);
        }

        @ParameterizedTest
        @CsvSource({
                "175, 5, CONTAINS",
                "-175, 5, CONTAINS",
                "0, 5, DISJOINT",
                "175, 15, DISJOINT"
        })
        @DisplayName("Dateline polygon against points")
        void testDatelinePoints(double x, double y, SpatialRelation expected) {
            Shape shape = GEO_ADAPTER.fromWkt(DATELINE_BOX);
            assertEquals(expected, shape.relate(GEO.makePoint(x, y)));
        }

        @Test
        @DisplayName("Dateline polygon against a dateline rectangle")
        void testDatelineRectangle() {
            Shape shape = GEO_ADAPTER.fromWkt(DATELINE_BOX);
            assertEquals(SpatialRelation.CONTAINS, shape.relate(GEO.makeRectangle(172, -172, 2, 8)));
            assertEquals(SpatialRelation.DISJOINT, shape.relate(GEO.makeRectangle(-160, -150, 2, 8)));
        }

        @Test
        @DisplayName("Unwrapping can be turned off")
        void testNoUnwrap() {
            Geometry geom = GEO_ADAPTER.parseWkt(DATELINE_BOX);
            Shape shape = GEO_ADAPTER.fromGeometry(geom, false);
            assertEquals(-170.0d, shape.boundingBox().minX(), 1e-9);
            assertEquals(170.0d, shape.boundingBox().maxX(), 1e-9);
            assertEquals(SpatialRelation.CONTAINS, shape.relate(GEO.makePoint(0, 5)));
        }
    }

    @Nested
    @DisplayName("Geodesic circles against polygons")
    class GeoCircles {

        @Test
        @DisplayName("A circle crossing an edge between two outside vertices intersects")
        void testEdgeCrossedBetweenVertices() {
            Shape polygon = GEO_ADAPTER.fromWkt("POLYGON ((121 55, 129 55, 129 78, 121 78, 121 55))");
            Shape circle = GEO.makeCircle(120, 60, 1);
            assertEquals(SpatialRelation.INTERSECTS, polygon.relate(circle));
            assertEquals(SpatialRelation.INTERSECTS, circle.relate(polygon));
            assertEquals(GEO.makeRectangle(121, 129, 55, 78).relate(circle), polygon.relate(circle));
        }

        @Test
        @DisplayName("A circle near a slanted edge stays disjoint")
        void testNearSlantedEdge() {
            Shape triangle = GEO_ADAPTER.fromWkt("POLYGON ((121 55, 129 55, 129 78, 121 55))");
            assertEquals(SpatialRelation.DISJOINT, triangle.relate(GEO.makeCircle(120, 60, 1)));
        }

        @Test
        @DisplayName("A polygon around the circle contains it")
        void testPolygonAroundCircle() {
            Shape polygon = GEO_ADAPTER.fromWkt("POLYGON ((100 40, 140 40, 140 80, 100 80, 100 40))");
            assertEquals(SpatialRelation.CONTAINS, polygon.relate(GEO.makeCircle(120, 60, 1)));
            assertEquals(SpatialRelation.WITHIN, GEO.makeCircle(120, 60, 1).relate(polygon));
        }

        @Test
        @DisplayName("A dateline circle without a polygon form is related by its center")
        void testDatelineCircleFallsBackToCenter() {
            Shape shape = GEO_ADAPTER.fromWkt(DATELINE_BOX);
            assertEquals(SpatialRelation.CONTAINS, shape.relate(GEO.makeCircle(178, 5, 4)));
        }
    }
}
