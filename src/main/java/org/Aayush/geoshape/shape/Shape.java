package org.Aayush.geoshape.shape;

import org.Aayush.geoshape.context.SpatialContext;

/**
 * Closed union of the supported shape variants.
 *
 * <p>All shapes are immutable. Relations between shapes are decided pairwise by
 * {@link SpatialRelations}; {@code a.relate(b)} always equals {@code b.relate(a).transpose()}.</p>
 */
public sealed interface Shape
        permits Point, Rectangle, Circle, BufferedLine, BufferedLineString, ShapeCollection, GeometryShape {

    /**
     * Variant tag used for pairwise relation dispatch.
     */
    ShapeKind kind();

    /**
     * Whether this shape holds no location; empty shapes are DISJOINT from everything.
     */
    boolean isEmpty();

    /**
     * Whether this shape encloses a non-zero area.
     */
    boolean hasArea();

    /**
     * Minimal enclosing rectangle; may cross the dateline in geo contexts.
     */
    Rectangle boundingBox();

    /**
     * Representative center; the bounding-box center unless the shape has a natural one.
     */
    Point center();

    /**
     * Area in square degrees for geo contexts, square units otherwise.
     *
     * @param ctx context whose distance calculator measures the area; null for plain planar area.
     */
    double area(SpatialContext ctx);

    /**
     * Shape grown (or, for negative distances, shrunk) by {@code distance} on every side.
     *
     * <p>A negative distance that consumes the whole shape yields an empty shape.</p>
     */
    Shape buffered(double distance, SpatialContext ctx);

    /**
     * Relation of this shape to {@code other}.
     */
    default SpatialRelation relate(Shape other) {
        return SpatialRelations.relate(this, other);
    }
}
