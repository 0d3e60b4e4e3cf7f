package org.Aayush.geoshape.shape;

import lombok.experimental.UtilityClass;

import java.util.Objects;

/**
 * Pairwise relation table over {@link ShapeKind}.
 *
 * <p>Of two shapes, the one whose kind is declared later owns the rule; the reverse order
 * receives the transposed result, so {@code relate(a, b) == relate(b, a).transpose()} holds
 * for every pair of distinct shapes. Composite kinds related to their own kind are evaluated
 * from both sides and fall back to INTERSECTS when the two answers disagree.</p>
 */
@UtilityClass
public final class SpatialRelations {

    /**
     * Relation of {@code a} to {@code b}; DISJOINT when either is empty.
     */
    public static SpatialRelation relate(Shape a, Shape b) {
        Objects.requireNonNull(a, "a");
        Objects.requireNonNull(b, "b");
        if (a.isEmpty() || b.isEmpty()) {
            return SpatialRelation.DISJOINT;
        }
        int order = a.kind().compareTo(b.kind());
        if (order < 0) {
            return relateOwned(b, a).transpose();
        }
        if (order == 0 && isComposite(a.kind())) {
            SpatialRelation forward = relateOwned(a, b);
            SpatialRelation backward = relateOwned(b, a).transpose();
            return forward == backward ? forward : SpatialRelation.INTERSECTS;
        }
        return relateOwned(a, b);
    }

    private static boolean isComposite(ShapeKind kind) {
        return kind == ShapeKind.GEOMETRY
                || kind == ShapeKind.BUFFERED_LINE_STRING
                || kind == ShapeKind.COLLECTION;
    }

    /**
     * {@code other} is non-empty and of the same or an earlier kind than {@code owner}.
     */
    private static SpatialRelation relateOwned(Shape owner, Shape other) {
        return switch (owner.kind()) {
            case POINT -> relatePoint((Point) owner, other);
            case RECTANGLE -> relateRectangle((Rectangle) owner, other);
            case CIRCLE -> relateCircle((Circle) owner, other);
            case BUFFERED_LINE -> relateBufferedLine((BufferedLine) owner, other);
            case GEOMETRY -> ((GeometryShape) owner).backend().relate(other);
            case BUFFERED_LINE_STRING -> relate(((BufferedLineString) owner).segments(), other);
            case COLLECTION -> relateCollection((ShapeCollection) owner, other);
        };
    }

    private static SpatialRelation relatePoint(Point point, Shape other) {
        if (other.kind() != ShapeKind.POINT) {
            throw unreachable(point, other);
        }
        // equal points touch; neither contains the other
        return point.equals(other) ? SpatialRelation.INTERSECTS : SpatialRelation.DISJOINT;
    }

    private static SpatialRelation relateRectangle(Rectangle rect, Shape other) {
        switch (other.kind()) {
            case POINT:
                return rect.relatePoint((Point) other);
            case RECTANGLE:
                return rect.relateRectangle((Rectangle) other);
            default:
                throw unreachable(rect, other);
        }
    }

    private static SpatialRelation relateCircle(Circle circle, Shape other) {
        switch (other.kind()) {
            case POINT:
                return circle.relatePoint((Point) other);
            case RECTANGLE:
                return circle.relateRectangle((Rectangle) other);
            case CIRCLE:
                return circle.relateCircle((Circle) other);
            default:
                throw unreachable(circle, other);
        }
    }

    private static SpatialRelation relateBufferedLine(BufferedLine line, Shape other) {
        switch (other.kind()) {
            case POINT:
                return line.relatePoint((Point) other);
            case RECTANGLE:
                return line.relateRectangle((Rectangle) other);
            case CIRCLE:
                return relateBufferedLineCircle(line, (Circle) other);
            case BUFFERED_LINE:
                // bounding-box approximation
                return line.boundingBox().relateRectangle(other.boundingBox()) == SpatialRelation.DISJOINT
                        ? SpatialRelation.DISJOINT
                        : SpatialRelation.INTERSECTS;
            default:
                throw unreachable(line, other);
        }
    }

    /**
     * Bounding-box approximation: the line contains the circle when it contains the circle's
     * box, lies within it when the circle holds every corner of the line's box.
     */
    private static SpatialRelation relateBufferedLineCircle(BufferedLine line, Circle circle) {
        Rectangle lineBox = line.boundingBox();
        Rectangle circleBox = circle.boundingBox();
        if (lineBox.relateRectangle(circleBox) == SpatialRelation.DISJOINT) {
            return SpatialRelation.DISJOINT;
        }
        if (line.relateRectangle(circleBox) == SpatialRelation.CONTAINS) {
            return SpatialRelation.CONTAINS;
        }
        if (circle.contains(lineBox.minX(), lineBox.minY())
                && circle.contains(lineBox.minX(), lineBox.maxY())
                && circle.contains(lineBox.maxX(), lineBox.minY())
                && circle.contains(lineBox.maxX(), lineBox.maxY())) {
            return SpatialRelation.WITHIN;
        }
        return SpatialRelation.INTERSECTS;
    }

    private static SpatialRelation relateCollection(ShapeCollection collection, Shape other) {
        SpatialRelation bboxSect = relate(collection.boundingBox(), other);
        if (bboxSect == SpatialRelation.DISJOINT || bboxSect == SpatialRelation.WITHIN) {
            return bboxSect;
        }
        // overlapping members may each intersect a shape another member contains
        boolean shortCircuit = !collection.ctx().allowMultiOverlap() || other.kind() == ShapeKind.POINT;
        SpatialRelation sect = null;
        boolean anyContains = false;
        for (Shape member : collection.shapes()) {
            if (member.isEmpty()) {
                continue;
            }
            SpatialRelation next = relate(member, other);
            if (next == SpatialRelation.CONTAINS) {
                if (shortCircuit) {
                    return SpatialRelation.CONTAINS;
                }
                anyContains = true;
            }
            sect = sect == null ? next : sect.combine(next);
            if (sect == SpatialRelation.INTERSECTS && shortCircuit) {
                return SpatialRelation.INTERSECTS;
            }
        }
        if (anyContains) {
            return SpatialRelation.CONTAINS;
        }
        return sect == null ? SpatialRelation.DISJOINT : sect;
    }

    private static IllegalStateException unreachable(Shape owner, Shape other) {
        return new IllegalStateException("no relation rule for " + owner.kind() + " owning " + other.kind());
    }
}
