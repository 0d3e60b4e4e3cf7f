package org.Aayush.geoshape.query;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.experimental.Accessors;
import org.Aayush.geoshape.exception.InvalidSpatialArgumentException;
import org.Aayush.geoshape.shape.Shape;
import org.Aayush.geoshape.shape.SpatialRelation;

import java.util.Locale;
import java.util.Objects;

/**
 * Predicate a spatial query applies between an indexed shape and the query shape.
 */
@Getter
@Accessors(fluent = true)
@RequiredArgsConstructor
public enum SpatialOperation {
    BBOX_INTERSECTS("BBoxIntersects", true, false, false),
    BBOX_WITHIN("BBoxWithin", true, false, false),
    CONTAINS("Contains", true, true, false),
    INTERSECTS("Intersects", true, false, false),
    IS_EQUAL_TO("IsEqualTo", false, false, false),
    IS_DISJOINT_TO("IsDisjointTo", false, false, false),
    IS_WITHIN("IsWithin", true, false, true),
    OVERLAPS("Overlaps", true, false, true);

    private final String operationName;
    private final boolean scoreIsMeaningful;
    /** The indexed shape must have area. */
    private final boolean sourceNeedsArea;
    /** The query shape must have area. */
    private final boolean targetNeedsArea;

    /**
     * Whether this operation tests bounding boxes rather than exact shapes.
     */
    public boolean isBoundingBoxOperation() {
        return this == BBOX_INTERSECTS || this == BBOX_WITHIN;
    }

    /**
     * Applies the predicate with {@code indexedShape} on the left.
     */
    public boolean evaluate(Shape indexedShape, Shape queryShape) {
        Objects.requireNonNull(indexedShape, "indexedShape");
        Objects.requireNonNull(queryShape, "queryShape");
        switch (this) {
            case BBOX_INTERSECTS:
                return indexedShape.boundingBox().relate(queryShape).intersects();
            case BBOX_WITHIN:
                return indexedShape.boundingBox().relate(queryShape) == SpatialRelation.WITHIN
                        || indexedShape.boundingBox().equals(queryShape);
            case CONTAINS:
                return indexedShape.relate(queryShape) == SpatialRelation.CONTAINS
                        || indexedShape.equals(queryShape);
            case INTERSECTS:
                return indexedShape.relate(queryShape).intersects();
            case IS_EQUAL_TO:
                return indexedShape.equals(queryShape);
            case IS_DISJOINT_TO:
                return !indexedShape.relate(queryShape).intersects();
            case IS_WITHIN:
                return indexedShape.relate(queryShape) == SpatialRelation.WITHIN
                        || indexedShape.equals(queryShape);
            case OVERLAPS:
                return indexedShape.relate(queryShape) == SpatialRelation.INTERSECTS;
            default:
                throw new IllegalStateException("unhandled operation " + this);
        }
    }

    /**
     * Resolves an operation by its name, case-insensitively.
     */
    public static SpatialOperation fromName(String name) {
        if (name != null) {
            String trimmed = name.trim();
            for (SpatialOperation operation : values()) {
                if (operation.operationName.equalsIgnoreCase(trimmed)
                        || operation.name().equals(trimmed.toUpperCase(Locale.ROOT))) {
                    return operation;
                }
            }
        }
        throw new InvalidSpatialArgumentException(
                InvalidSpatialArgumentException.REASON_UNKNOWN_OPERATION,
                "unknown spatial operation: " + name
        );
    }

    @Override
    public String toString() {
        return operationName;
    }
}
