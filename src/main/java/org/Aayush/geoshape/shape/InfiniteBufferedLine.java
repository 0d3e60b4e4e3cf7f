package org.Aayush.geoshape.shape;

/**
 * Line of infinite length with a buffer on both sides: {@code y = slope * x + intercept}.
 *
 * <p>A vertical line has infinite slope; its intercept is then the X intercept.</p>
 */
final class InfiniteBufferedLine {
    /** Corner opposite to each quadrant; quadrants 1-4 are NE, NW, SW, SE. */
    private static final int[] OPPOSITE_QUADRANT = {-1, 3, 4, 1, 2};

    private final double slope;
    private final double intercept;
    private final double buf;
    /** {@code 1 / sqrt(slope^2 + 1)}. */
    private final double distDenomInv;

    InfiniteBufferedLine(double slope, double pointX, double pointY, double buf) {
        this.slope = slope;
        if (Double.isInfinite(slope)) {
            this.intercept = pointX;
            this.distDenomInv = Double.NaN;
        } else {
            this.intercept = pointY - slope * pointX;
            this.distDenomInv = 1.0d / Math.sqrt(slope * slope + 1.0d);
        }
        this.buf = buf;
    }

    /**
     * Relation of the buffered band to a rectangle: tests the corner nearest to the line,
     * then the farthest one.
     */
    SpatialRelation relate(Rectangle r, double centerX, double centerY) {
        int cQuad = quadrant(centerX, centerY);
        int nearQuad = OPPOSITE_QUADRANT[cQuad];
        double nearX = cornerX(r, nearQuad);
        double nearY = cornerY(r, nearQuad);
        if (contains(nearX, nearY)) {
            if (contains(cornerX(r, cQuad), cornerY(r, cQuad))) {
                return SpatialRelation.CONTAINS;
            }
            return SpatialRelation.INTERSECTS;
        }
        if (quadrant(nearX, nearY) == cQuad) {
            // outside the buffer on the same side as the center
            return SpatialRelation.DISJOINT;
        }
        return SpatialRelation.INTERSECTS;
    }

    boolean contains(double x, double y) {
        return distanceUnbuffered(x, y) <= buf;
    }

    /**
     * Perpendicular distance from the coordinate to the line, ignoring the buffer.
     */
    double distanceUnbuffered(double x, double y) {
        if (Double.isInfinite(slope)) {
            return Math.abs(x - intercept);
        }
        return Math.abs(y - slope * x - intercept) * distDenomInv;
    }

    /**
     * Side of the line the coordinate lies on, as a quadrant number 1-4.
     */
    int quadrant(double x, double y) {
        if (Double.isInfinite(slope)) {
            return x > intercept ? 1 : 2;
        }
        boolean above = y >= slope * x + intercept;
        if (slope > 0) {
            return above ? 2 : 4;
        }
        return above ? 1 : 3;
    }

    private static double cornerX(Rectangle r, int quad) {
        return (quad == 1 || quad == 4) ? r.maxX() : r.minX();
    }

    private static double cornerY(Rectangle r, int quad) {
        return (quad == 1 || quad == 2) ? r.maxY() : r.minY();
    }

    double slope() {
        return slope;
    }

    double intercept() {
        return intercept;
    }

    double buf() {
        return buf;
    }

    double distDenomInv() {
        return distDenomInv;
    }

    @Override
    public String toString() {
        return "InfiniteBufferedLine{buf=" + buf + ", intercept=" + intercept + ", slope=" + slope + '}';
    }
}
