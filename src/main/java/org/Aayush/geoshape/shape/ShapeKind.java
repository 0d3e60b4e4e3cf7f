package org.Aayush.geoshape.shape;

/**
 * Closed set of shape variants.
 *
 * <p>Declaration order ranks the variants for relation dispatch: of two shapes, the one of
 * the later kind owns the pairwise rule and the earlier one receives the transposed result.</p>
 */
public enum ShapeKind {
    POINT,
    RECTANGLE,
    CIRCLE,
    BUFFERED_LINE,
    GEOMETRY,
    BUFFERED_LINE_STRING,
    COLLECTION
}
