package org.Aayush.geoshape.shape;

import org.Aayush.geoshape.context.SpatialContext;

/**
 * Capability boundary to an external polygon engine for shapes this library does not model natively.
 *
 * <p>Implementations must be immutable and must relate symmetrically: relating a wrapped
 * geometry to another wrapped geometry has to agree with the transposed reverse call.</p>
 */
public interface GeometryBackend {

    boolean isEmpty();

    boolean hasArea();

    Rectangle boundingBox();

    Point center();

    double area(SpatialContext ctx);

    Shape buffered(double distance, SpatialContext ctx);

    /**
     * Relation of the wrapped geometry to a non-empty shape of kind GEOMETRY or any earlier kind.
     */
    SpatialRelation relate(Shape other);

    /**
     * Well-known text of the wrapped geometry.
     */
    String toWkt();
}
