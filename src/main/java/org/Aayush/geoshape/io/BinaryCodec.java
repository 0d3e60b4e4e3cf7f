package org.Aayush.geoshape.io;

import lombok.Getter;
import lombok.experimental.Accessors;
import org.Aayush.geoshape.context.SpatialContext;
import org.Aayush.geoshape.exception.InvalidSpatialArgumentException;
import org.Aayush.geoshape.shape.Circle;
import org.Aayush.geoshape.shape.Point;
import org.Aayush.geoshape.shape.Rectangle;
import org.Aayush.geoshape.shape.Shape;
import org.Aayush.geoshape.shape.ShapeCollection;

import java.io.DataInput;
import java.io.DataOutput;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Compact binary form of shapes over {@link DataInput} / {@link DataOutput}.
 *
 * <p>Every shape starts with a one-byte type code followed by its coordinates as doubles:
 * point {@code x y}; rectangle {@code minX maxX minY maxY}; circle {@code x y radius};
 * collection {@code memberType:byte size:int} then the members, each with its own type byte
 * when {@code memberType} is 0. Read shapes are rebuilt through the context's factory methods,
 * so they are normalized like freshly made ones.</p>
 *
 * <p>This codec handles points, rectangles, circles and collections of them; subclasses add
 * other kinds through {@link #typeFor(Shape)}, {@link #readShapeOfType} and {@link #writeShapeOfType}.
 * Instances are stateless and thread-safe.</p>
 */
@Getter
@Accessors(fluent = true)
public class BinaryCodec {

    /** Type codes written ahead of each shape. */
    public enum ShapeType {
        POINT(1),
        RECTANGLE(2),
        CIRCLE(3),
        COLLECTION(4),
        GEOMETRY(5);

        private final byte code;

        ShapeType(int code) {
            this.code = (byte) code;
        }

        public byte code() {
            return code;
        }

        /**
         * Resolves a type code.
         *
         * @throws InvalidSpatialArgumentException for an unknown code.
         */
        public static ShapeType fromCode(byte code) {
            for (ShapeType type : values()) {
                if (type.code == code) {
                    return type;
                }
            }
            throw new InvalidSpatialArgumentException(
                    InvalidSpatialArgumentException.REASON_UNSUPPORTED_SHAPE_TYPE,
                    "unsupported shape type byte " + code
            );
        }
    }

    /** Member type byte announcing that each collection member carries its own type. */
    private static final byte MIXED_MEMBERS = 0;

    private final SpatialContext ctx;

    public BinaryCodec(SpatialContext ctx) {
        this.ctx = Objects.requireNonNull(ctx, "ctx");
    }

    /**
     * Reads one shape with its leading type byte.
     *
     * @throws InvalidSpatialArgumentException when the type byte is not supported by this codec.
     */
    public Shape readShape(DataInput in) throws IOException {
        Objects.requireNonNull(in, "in");
        return readShapeOfType(in, ShapeType.fromCode(in.readByte()));
    }

    /**
     * Writes one shape with its leading type byte.
     *
     * @throws InvalidSpatialArgumentException when this codec cannot represent the shape.
     */
    public void writeShape(DataOutput out, Shape shape) throws IOException {
        Objects.requireNonNull(out, "out");
        Objects.requireNonNull(shape, "shape");
        ShapeType type = typeFor(shape);
        out.writeByte(type.code());
        writeShapeOfType(out, shape, type);
    }

    /**
     * The type code a shape is written under.
     */
    protected ShapeType typeFor(Shape shape) {
        switch (shape.kind()) {
            case POINT:
                return ShapeType.POINT;
            case RECTANGLE:
                return ShapeType.RECTANGLE;
            case CIRCLE:
                return ShapeType.CIRCLE;
            case COLLECTION:
                return ShapeType.COLLECTION;
            default:
                throw unsupported(shape);
        }
    }

    /**
     * Reads the body of a shape whose type byte has been consumed.
     */
    protected Shape readShapeOfType(DataInput in, ShapeType type) throws IOException {
        switch (type) {
            case POINT:
                return readPoint(in);
            case RECTANGLE:
                return readRectangle(in);
            case CIRCLE:
                return readCircle(in);
            case COLLECTION:
                return readCollection(in);
            default:
                throw new InvalidSpatialArgumentException(
                        InvalidSpatialArgumentException.REASON_UNSUPPORTED_SHAPE_TYPE,
                        "this codec cannot read shape type " + type
                );
        }
    }

    /**
     * Writes the body of a shape; the type byte has already been written.
     */
    protected void writeShapeOfType(DataOutput out, Shape shape, ShapeType type) throws IOException {
        switch (type) {
            case POINT:
                writePoint(out, (Point) shape);
                break;
            case RECTANGLE:
                writeRectangle(out, (Rectangle) shape);
                break;
            case CIRCLE:
                writeCircle(out, (Circle) shape);
                break;
            case COLLECTION:
                writeCollection(out, (ShapeCollection) shape);
                break;
            default:
                throw unsupported(shape);
        }
    }

    public Point readPoint(DataInput in) throws IOException {
        double x = in.readDouble();
        double y = in.readDouble();
        return ctx.makePoint(x, y);
    }

    public void writePoint(DataOutput out, Point point) throws IOException {
        out.writeDouble(point.x());
        out.writeDouble(point.y());
    }

    public Rectangle readRectangle(DataInput in) throws IOException {
        double minX = in.readDouble();
        double maxX = in.readDouble();
        double minY = in.readDouble();
        double maxY = in.readDouble();
        return ctx.makeRectangle(minX, maxX, minY, maxY);
    }

    public void writeRectangle(DataOutput out, Rectangle rect) throws IOException {
        out.writeDouble(rect.minX());
        out.writeDouble(rect.maxX());
        out.writeDouble(rect.minY());
        out.writeDouble(rect.maxY());
    }

    public Circle readCircle(DataInput in) throws IOException {
        Point center = readPoint(in);
        return ctx.makeCircle(center, in.readDouble());
    }

    public void writeCircle(DataOutput out, Circle circle) throws IOException {
        writePoint(out, circle.center());
        out.writeDouble(circle.radius());
    }

    /**
     * Reads a collection; a non-zero member type means every member is of that type and
     * carries no type byte of its own.
     */
    public ShapeCollection readCollection(DataInput in) throws IOException {
        byte memberType = in.readByte();
        int size = in.readInt();
        if (size < 0) {
            throw new IOException("negative collection size " + size);
        }
        ShapeType fixedType = memberType == MIXED_MEMBERS ? null : ShapeType.fromCode(memberType);
        List<Shape> shapes = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            shapes.add(fixedType == null ? readShape(in) : readShapeOfType(in, fixedType));
        }
        return ctx.makeCollection(shapes);
    }

    /**
     * Writes a collection with a type byte per member.
     */
    public void writeCollection(DataOutput out, ShapeCollection collection) throws IOException {
        out.writeByte(MIXED_MEMBERS);
        out.writeInt(collection.size());
        for (Shape member : collection.shapes()) {
            writeShape(out, member);
        }
    }

    private static InvalidSpatialArgumentException unsupported(Shape shape) {
        return new InvalidSpatialArgumentException(
                InvalidSpatialArgumentException.REASON_UNSUPPORTED_SHAPE_TYPE,
                "this codec cannot write a " + shape.kind() + " shape"
        );
    }
}
