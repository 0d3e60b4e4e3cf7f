package org.Aayush.geoshape.jts;

import org.Aayush.geoshape.exception.InvalidShapeException;
import org.Aayush.geoshape.io.BinaryCodec;
import org.Aayush.geoshape.shape.Shape;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.io.ParseException;
import org.locationtech.jts.io.WKBReader;
import org.locationtech.jts.io.WKBWriter;

import java.io.DataInput;
import java.io.DataOutput;
import java.io.IOException;
import java.util.Objects;

/**
 * {@link BinaryCodec} that also writes every other shape kind as a JTS geometry.
 *
 * <p>Geometries are stored under {@link ShapeType#GEOMETRY} as a length-prefixed WKB blob and
 * read back as shapes through the adapter, so a buffered line comes back as its polygon.</p>
 */
public class JtsBinaryCodec extends BinaryCodec {
    private final JtsGeometryAdapter adapter;

    public JtsBinaryCodec(JtsGeometryAdapter adapter) {
        super(Objects.requireNonNull(adapter, "adapter").ctx());
        this.adapter = adapter;
    }

    public JtsGeometryAdapter adapter() {
        return adapter;
    }

    @Override
    protected ShapeType typeFor(Shape shape) {
        switch (shape.kind()) {
            case POINT:
            case RECTANGLE:
            case CIRCLE:
            case COLLECTION:
                return super.typeFor(shape);
            default:
                return ShapeType.GEOMETRY;
        }
    }

    @Override
    protected Shape readShapeOfType(DataInput in, ShapeType type) throws IOException {
        if (type != ShapeType.GEOMETRY) {
            return super.readShapeOfType(in, type);
        }
        return readGeometry(in);
    }

    @Override
    protected void writeShapeOfType(DataOutput out, Shape shape, ShapeType type) throws IOException {
        if (type != ShapeType.GEOMETRY) {
            super.writeShapeOfType(out, shape, type);
            return;
        }
        writeGeometry(out, adapter.toGeometry(shape));
    }

    /**
     * Reads a length-prefixed WKB geometry and wraps it as a shape.
     *
     * @throws InvalidShapeException when the bytes are not valid WKB or the geometry is invalid.
     */
    public Shape readGeometry(DataInput in) throws IOException {
        int length = in.readInt();
        if (length < 0) {
            throw new IOException("negative WKB length " + length);
        }
        byte[] wkb = new byte[length];
        in.readFully(wkb);
        Geometry geom;
        try {
            geom = new WKBReader(adapter.factory()).read(wkb);
        } catch (ParseException e) {
            throw new InvalidShapeException(InvalidShapeException.REASON_INVALID_GEOMETRY, "error reading WKB", e);
        }
        return adapter.fromGeometry(geom);
    }

    public void writeGeometry(DataOutput out, Geometry geom) throws IOException {
        byte[] wkb = new WKBWriter(JtsGeometryAdapter.getOutputDimension(geom), false).write(geom);
        out.writeInt(wkb.length);
        out.write(wkb);
    }
}
