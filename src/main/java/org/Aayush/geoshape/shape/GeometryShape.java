package org.Aayush.geoshape.shape;

import org.Aayush.geoshape.context.SpatialContext;

import java.util.Objects;

/**
 * Shape backed by an external geometry engine, such as an arbitrary polygon.
 */
public final class GeometryShape implements Shape {
    private final GeometryBackend backend;

    public GeometryShape(GeometryBackend backend) {
        this.backend = Objects.requireNonNull(backend, "backend");
    }

    public GeometryBackend backend() {
        return backend;
    }

    @Override
    public ShapeKind kind() {
        return ShapeKind.GEOMETRY;
    }

    @Override
    public boolean isEmpty() {
        return backend.isEmpty();
    }

    @Override
    public boolean hasArea() {
        return backend.hasArea();
    }

    @Override
    public Rectangle boundingBox() {
        return backend.boundingBox();
    }

    @Override
    public Point center() {
        return backend.center();
    }

    @Override
    public double area(SpatialContext ctx) {
        return backend.area(ctx);
    }

    @Override
    public Shape buffered(double distance, SpatialContext ctx) {
        return backend.buffered(distance, ctx);
    }

    public String toWkt() {
        return backend.toWkt();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof GeometryShape)) {
            return false;
        }
        return backend.equals(((GeometryShape) o).backend);
    }

    @Override
    public int hashCode() {
        return backend.hashCode();
    }

    @Override
    public String toString() {
        return backend.toWkt();
    }
}
