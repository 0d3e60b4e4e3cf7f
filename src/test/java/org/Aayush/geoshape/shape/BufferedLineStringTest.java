package org.Aayush.geoshape.shape;

import org.Aayush.geoshape.context.SpatialContext;
import org.Aayush.geoshape.context.SpatialContextConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("BufferedLineString Tests")
class BufferedLineStringTest {

    private static final SpatialContext FLAT = new SpatialContext(SpatialContextConfig.cartesianDefaults());

    private static BufferedLineString elbow() {
        return FLAT.makeBufferedLineString(
                List.of(FLAT.makePoint(0, 0), FLAT.makePoint(10, 0), FLAT.makePoint(10, 10)),
                1
        );
    }

    @Test
    @DisplayName("One segment per consecutive point pair")
    void testSegments() {
        BufferedLineString line = elbow();
        assertEquals(2, line.segments().size());
        assertInstanceOf(BufferedLine.class, line.segments().get(1));
        assertEquals(FLAT.makeRectangle(-1, 11, -1, 11), line.boundingBox());
        assertEquals(ShapeKind.BUFFERED_LINE_STRING, line.kind());
    }

    @Test
    @DisplayName("Relations go through the segments")
    void testRelations() {
        BufferedLineString line = elbow();
        assertEquals(SpatialRelation.CONTAINS, line.relate(FLAT.makePoint(10, 5)));
        assertEquals(SpatialRelation.CONTAINS, line.relate(FLAT.makePoint(3, -0.5)));
        assertEquals(SpatialRelation.DISJOINT, line.relate(FLAT.makePoint(5, 5)));
        assertEquals(SpatialRelation.WITHIN, FLAT.makePoint(10, 5).relate(line));
        assertEquals(SpatialRelation.WITHIN, line.relate(FLAT.makeRectangle(-5, 15, -5, 15)));
        assertEquals(SpatialRelation.DISJOINT, line.relate(FLAT.makeRectangle(20, 30, 20, 30)));
    }

    @Test
    @DisplayName("A single point is a degenerate segment; no points is empty")
    void testDegenerate() {
        BufferedLineString single = FLAT.makeBufferedLineString(List.of(FLAT.makePoint(3, 3)), 1);
        assertFalse(single.isEmpty());
        assertEquals(1, single.segments().size());
        assertEquals(FLAT.makeRectangle(2, 4, 2, 4), single.boundingBox());

        BufferedLineString none = FLAT.makeBufferedLineString(List.of(), 1);
        assertTrue(none.isEmpty());
        assertTrue(none.boundingBox().isEmpty());
        assertEquals(SpatialRelation.DISJOINT, none.relate(FLAT.makePoint(3, 3)));
    }

    @Test
    @DisplayName("Buffering rebuilds the line; over-shrinking empties")
    void testBuffered() {
        BufferedLineString line = elbow();
        Shape wider = line.buffered(1, FLAT);
        assertInstanceOf(BufferedLineString.class, wider);
        assertEquals(2.0d, ((BufferedLineString) wider).buf());
        assertEquals(line.points(), ((BufferedLineString) wider).points());
        assertSame(Point.EMPTY, line.buffered(-2, FLAT));
    }

    @Test
    @DisplayName("Text form lists the points")
    void testToString() {
        assertEquals("BufferedLineString(buf=1.0 pts=0.0 0.0, 10.0 0.0, 10.0 10.0)", elbow().toString());
    }

    @Test
    @DisplayName("Equality compares points and buffer")
    void testEquality() {
        assertEquals(elbow(), elbow());
        assertEquals(elbow().hashCode(), elbow().hashCode());
        assertNotEquals(elbow(), elbow().buffered(1, FLAT));
    }

    @Test
    @DisplayName("Longitude skew widens geo segments")
    void testLongitudeSkew() {
        SpatialContext geo = SpatialContext.GEO;
        List<Point> points = List.of(geo.makePoint(0, 60), geo.makePoint(10, 60));
        BufferedLineString plain = geo.makeBufferedLineString(points, 1);
        BufferedLineString skewed = geo.makeBufferedLineString(points, 1, true);
        assertTrue(skewed.boundingBox().width() > plain.boundingBox().width());
        assertEquals(1.0d, skewed.buf());
    }
}
