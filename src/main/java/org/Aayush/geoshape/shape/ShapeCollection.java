package org.Aayush.geoshape.shape;

import org.Aayush.geoshape.context.SpatialContext;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Ordered collection of shapes, treated as their union for relations.
 *
 * <p>Relations may short-circuit on the first decisive member unless the owning context
 * allows members to overlap; see {@link SpatialContext#allowMultiOverlap()}. The collection
 * is empty when every member is (or there are none).</p>
 */
public final class ShapeCollection implements Shape {
    private static final int TO_STRING_LIMIT = 150;

    private final List<Shape> shapes;
    private final SpatialContext ctx;
    private final Rectangle bbox;

    /**
     * Builds a collection over a copy of {@code shapes}; members must be non-null.
     */
    public ShapeCollection(List<? extends Shape> shapes, SpatialContext ctx) {
        this.shapes = List.copyOf(Objects.requireNonNull(shapes, "shapes"));
        this.ctx = Objects.requireNonNull(ctx, "ctx");
        this.bbox = computeBoundingBox(this.shapes, ctx);
    }

    private static Rectangle computeBoundingBox(List<Shape> shapes, SpatialContext ctx) {
        Range xRange = null;
        double minY = Double.POSITIVE_INFINITY;
        double maxY = Double.NEGATIVE_INFINITY;
        for (Shape shape : shapes) {
            if (shape.isEmpty()) {
                continue;
            }
            Rectangle r = shape.boundingBox();
            Range next = Range.xRange(r, ctx.isGeo());
            xRange = xRange == null ? next : xRange.expandTo(next);
            minY = Math.min(minY, r.minY());
            maxY = Math.max(maxY, r.maxY());
        }
        if (xRange == null) {
            return Rectangle.empty(ctx);
        }
        return ctx.makeRectangle(xRange.min(), xRange.max(), minY, maxY);
    }

    /**
     * Whether no two members intersect. Quadratic in the member count.
     */
    public static boolean computeMutualDisjoint(List<? extends Shape> shapes) {
        for (int i = 1; i < shapes.size(); i++) {
            Shape shapeI = shapes.get(i);
            for (int j = 0; j < i; j++) {
                if (shapes.get(j).relate(shapeI).intersects()) {
                    return false;
                }
            }
        }
        return true;
    }

    /**
     * Unmodifiable member list in insertion order.
     */
    public List<Shape> shapes() {
        return shapes;
    }

    public int size() {
        return shapes.size();
    }

    public Shape get(int index) {
        return shapes.get(index);
    }

    public SpatialContext ctx() {
        return ctx;
    }

    @Override
    public ShapeKind kind() {
        return ShapeKind.COLLECTION;
    }

    @Override
    public boolean isEmpty() {
        for (Shape shape : shapes) {
            if (!shape.isEmpty()) {
                return false;
            }
        }
        return true;
    }

    @Override
    public boolean hasArea() {
        for (Shape shape : shapes) {
            if (shape.hasArea()) {
                return true;
            }
        }
        return false;
    }

    @Override
    public Rectangle boundingBox() {
        return bbox;
    }

    @Override
    public Point center() {
        return bbox.center();
    }

    /**
     * Sum of member areas, capped at the bounding box area since members may overlap.
     */
    @Override
    public double area(SpatialContext areaCtx) {
        if (isEmpty()) {
            return 0.0d;
        }
        double maxArea = bbox.area(areaCtx);
        double sum = 0.0d;
        for (Shape shape : shapes) {
            sum += shape.area(areaCtx);
            if (sum >= maxArea) {
                return maxArea;
            }
        }
        return sum;
    }

    @Override
    public Shape buffered(double distance, SpatialContext bufferCtx) {
        List<Shape> buffered = new ArrayList<>(shapes.size());
        for (Shape shape : shapes) {
            buffered.add(shape.buffered(distance, bufferCtx));
        }
        return bufferCtx.makeCollection(buffered);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ShapeCollection)) {
            return false;
        }
        return shapes.equals(((ShapeCollection) o).shapes);
    }

    @Override
    public int hashCode() {
        return shapes.hashCode();
    }

    @Override
    public String toString() {
        StringBuilder out = new StringBuilder(100);
        out.append("ShapeCollection(");
        int i = 0;
        for (Shape shape : shapes) {
            if (i++ > 0) {
                out.append(", ");
            }
            out.append(shape);
            if (out.length() > TO_STRING_LIMIT) {
                out.append(" ...").append(shapes.size());
                break;
            }
        }
        return out.append(')').toString();
    }
}
