package org.Aayush.geoshape.query;

import lombok.Builder;
import lombok.Value;
import org.Aayush.geoshape.context.SpatialContext;
import org.Aayush.geoshape.exception.InvalidSpatialArgumentException;
import org.Aayush.geoshape.shape.Point;
import org.Aayush.geoshape.shape.Rectangle;
import org.Aayush.geoshape.shape.Shape;
import org.Aayush.geoshape.shape.ShapeKind;

import java.util.Locale;
import java.util.Objects;

/**
 * Arguments of a spatial query: the operation, the query shape and distance tolerances.
 */
@Value
@Builder(toBuilder = true)
public class SpatialArgs {
    public static final double DEFAULT_DIST_PRECISION = 0.025d;

    SpatialOperation operation;

    Shape shape;

    /** Optional lower distance bound. */
    Double min;

    /** Optional upper distance bound. */
    Double max;

    /**
     * Acceptable error as a fraction of the distance from the shape's center to its bounding box corner.
     */
    @Builder.Default
    double distPrecision = DEFAULT_DIST_PRECISION;

    /**
     * Shorthand for an operation and shape with default tolerances.
     */
    public static SpatialArgs of(SpatialOperation operation, Shape shape) {
        return SpatialArgs.builder().operation(operation).shape(shape).build();
    }

    /**
     * Checks the arguments make sense together.
     *
     * @throws InvalidSpatialArgumentException when the shape is missing or the operation needs an area the shape lacks.
     */
    public void validate() {
        Objects.requireNonNull(operation, "operation");
        if (shape == null) {
            throw new InvalidSpatialArgumentException(
                    InvalidSpatialArgumentException.REASON_MISSING_SHAPE,
                    operation + " requires a query shape"
            );
        }
        if (operation.targetNeedsArea() && !shape.hasArea()) {
            throw new InvalidSpatialArgumentException(
                    InvalidSpatialArgumentException.REASON_TARGET_NEEDS_AREA,
                    operation + " only supports geometry with area"
            );
        }
    }

    /**
     * Query shape as the operation sees it: the bounding box for bounding-box operations.
     */
    public Shape resolvedShape() {
        if (shape != null && operation != null && operation.isBoundingBoxOperation()) {
            return shape.boundingBox();
        }
        return shape;
    }

    /**
     * Absolute distance tolerance for {@link #getDistPrecision()} on this query's shape.
     */
    public double resolveDistErr(SpatialContext ctx) {
        return calcDistanceFromErrPct(shape, distPrecision, ctx);
    }

    /**
     * Converts a fractional error into a distance: {@code distErrPct} of the distance from the
     * bounding box center to its corner on the poleward side.
     *
     * @throws InvalidSpatialArgumentException when {@code distErrPct} is outside [0, 0.5].
     */
    public static double calcDistanceFromErrPct(Shape shape, double distErrPct, SpatialContext ctx) {
        if (!(distErrPct >= 0.0d && distErrPct <= 0.5d)) {
            throw new InvalidSpatialArgumentException(
                    InvalidSpatialArgumentException.REASON_DIST_ERR_PCT_RANGE,
                    "distErrPct " + distErrPct + " must be between [0 to 0.5]"
            );
        }
        Objects.requireNonNull(shape, "shape");
        Objects.requireNonNull(ctx, "ctx");
        if (distErrPct == 0.0d || shape.kind() == ShapeKind.POINT || shape.isEmpty()) {
            return 0.0d;
        }
        Rectangle bbox = shape.boundingBox();
        Point ctr = bbox.center();
        double y = ctr.y() >= 0 ? bbox.maxY() : bbox.minY();
        double diagonalDist = ctx.distanceCalculator().distance(ctr, bbox.maxX(), y);
        return diagonalDist * distErrPct;
    }

    @Override
    public String toString() {
        StringBuilder str = new StringBuilder();
        str.append(operation).append('(').append(shape);
        if (min != null) {
            str.append(" min=").append(min);
        }
        if (max != null) {
            str.append(" max=").append(max);
        }
        str.append(" distPrec=").append(String.format(Locale.ROOT, "%.2f%%", distPrecision * 100.0d));
        return str.append(')').toString();
    }
}
