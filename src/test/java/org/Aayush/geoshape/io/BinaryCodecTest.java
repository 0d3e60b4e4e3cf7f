package org.Aayush.geoshape.io;

import org.Aayush.geoshape.context.SpatialContext;
import org.Aayush.geoshape.context.SpatialContextConfig;
import org.Aayush.geoshape.exception.InvalidSpatialArgumentException;
import org.Aayush.geoshape.shape.Point;
import org.Aayush.geoshape.shape.Rectangle;
import org.Aayush.geoshape.shape.Shape;
import org.Aayush.geoshape.shape.ShapeCollection;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

@DisplayName("BinaryCodec Tests")
class BinaryCodecTest {

    private static final SpatialContext GEO = SpatialContext.GEO;
    private static final SpatialContext FLAT = new SpatialContext(SpatialContextConfig.cartesianDefaults());
    private static final BinaryCodec GEO_CODEC = new BinaryCodec(GEO);

    private static byte[] write(BinaryCodec codec, Shape shape) throws IOException {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        codec.writeShape(new DataOutputStream(bytes), shape);
        return bytes.toByteArray();
    }

    private static Shape read(BinaryCodec codec, byte[] bytes) throws IOException {
        return codec.readShape(new DataInputStream(new ByteArrayInputStream(bytes)));
    }

    private static Shape roundTrip(BinaryCodec codec, Shape shape) throws IOException {
        return read(codec, write(codec, shape));
    }

    @Test
    @DisplayName("Points round-trip as a type byte and two doubles")
    void testPoint() throws IOException {
        Point point = GEO.makePoint(-10, 80.3);
        byte[] bytes = write(GEO_CODEC, point);
        assertEquals(17, bytes.length);
        assertEquals(BinaryCodec.ShapeType.POINT.code(), bytes[0]);
        assertEquals(point, read(GEO_CODEC, bytes));
    }

    @Test
    @DisplayName("Rectangles round-trip, including dateline crossings")
    void testRectangle() throws IOException {
        Rectangle rect = GEO.makeRectangle(-10, 180, 0, 42.3);
        assertEquals(rect, roundTrip(GEO_CODEC, rect));
        Rectangle crossing = GEO.makeRectangle(170, -170, -10, 10);
        Rectangle read = (Rectangle) roundTrip(GEO_CODEC, crossing);
        assertEquals(crossing, read);
        assertEquals(20.0d, read.width());
    }

    @Test
    @DisplayName("Circles round-trip with center and radius")
    void testCircle() throws IOException {
        Shape circle = GEO.makeCircle(-10, 30, 5.2);
        byte[] bytes = write(GEO_CODEC, circle);
        assertEquals(25, bytes.length);
        assertEquals(circle, read(GEO_CODEC, bytes));
        Shape planar = FLAT.makeCircle(1000, -2000, 12.5);
        assertEquals(planar, roundTrip(new BinaryCodec(FLAT), planar));
    }

    @Test
    @DisplayName("Collections round-trip member by member, nested ones too")
    void testCollection() throws IOException {
        ShapeCollection inner = GEO.makeCollection(List.of(GEO.makePoint(1, 2), GEO.makeCircle(3, 4, 1)));
        ShapeCollection outer = GEO.makeCollection(List.of(
                GEO.makePoint(-10, 80.3),
                GEO.makeRectangle(-10, 180, 0, 42.3),
                GEO.makeCircle(-10, 30, 5.2),
                inner
        ));
        assertEquals(outer, roundTrip(GEO_CODEC, outer));
        assertEquals(GEO.makeCollection(List.of()), roundTrip(GEO_CODEC, GEO.makeCollection(List.of())));
    }

    @Test
    @DisplayName("Empty shapes survive the round trip")
    void testEmptyShapes() throws IOException {
        assertSame(Point.EMPTY, roundTrip(GEO_CODEC, Point.EMPTY));
        assertEquals(Rectangle.empty(GEO), roundTrip(GEO_CODEC, Rectangle.empty(GEO)));
    }

    @Test
    @DisplayName("Read coordinates are normalized by the reading context")
    void testReadNormalizes() throws IOException {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        DataOutputStream out = new DataOutputStream(bytes);
        out.writeByte(BinaryCodec.ShapeType.POINT.code());
        out.writeDouble(190.0d);
        out.writeDouble(10.0d);
        assertEquals(GEO.makePoint(-170, 10), read(GEO_CODEC, bytes.toByteArray()));
    }

    @Test
    @DisplayName("A collection may declare one member type for all members")
    void testFixedMemberType() throws IOException {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        DataOutputStream out = new DataOutputStream(bytes);
        out.writeByte(BinaryCodec.ShapeType.COLLECTION.code());
        out.writeByte(BinaryCodec.ShapeType.POINT.code());
        out.writeInt(2);
        out.writeDouble(1.0d);
        out.writeDouble(2.0d);
        out.writeDouble(3.0d);
        out.writeDouble(4.0d);
        ShapeCollection read = (ShapeCollection) read(GEO_CODEC, bytes.toByteArray());
        assertEquals(List.of(GEO.makePoint(1, 2), GEO.makePoint(3, 4)), read.shapes());
    }

    @Test
    @DisplayName("Unknown type bytes are rejected")
    void testUnknownTypeByte() {
        InvalidSpatialArgumentException ex = assertThrows(
                InvalidSpatialArgumentException.class,
                () -> read(GEO_CODEC, new byte[]{9})
        );
        assertEquals(InvalidSpatialArgumentException.REASON_UNSUPPORTED_SHAPE_TYPE, ex.reasonCode());
    }

    @Test
    @DisplayName("Kinds without a compact form are rejected by the plain codec")
    void testUnsupportedShapes() {
        Shape line = FLAT.makeBufferedLine(FLAT.makePoint(0, 0), FLAT.makePoint(10, 0), 1);
        InvalidSpatialArgumentException ex = assertThrows(
                InvalidSpatialArgumentException.class,
                () -> write(new BinaryCodec(FLAT), line)
        );
        assertEquals(InvalidSpatialArgumentException.REASON_UNSUPPORTED_SHAPE_TYPE, ex.reasonCode());
        assertThrows(
                InvalidSpatialArgumentException.class,
                () -> read(GEO_CODEC, new byte[]{BinaryCodec.ShapeType.GEOMETRY.code()})
        );
    }

    @Test
    @DisplayName("Truncated input fails with an EOF")
    void testTruncatedInput() throws IOException {
        byte[] bytes = write(GEO_CODEC, GEO.makeRectangle(0, 10, 0, 10));
        byte[] truncated = new byte[bytes.length - 3];
        System.arraycopy(bytes, 0, truncated, 0, truncated.length);
        assertThrows(EOFException.class, () -> read(GEO_CODEC, truncated));
    }
}
