package org.Aayush.geoshape.shape;

/**
 * Closed numeric interval used to grow bounding boxes one axis at a time.
 */
class Range {
    protected final double min;
    protected final double max;

    Range(double min, double max) {
        this.min = min;
        this.max = max;
    }

    static Range xRange(Rectangle rect, boolean geo) {
        if (geo) {
            return new LongitudeRange(rect.minX(), rect.maxX());
        }
        return new Range(rect.minX(), rect.maxX());
    }

    static Range yRange(Rectangle rect) {
        return new Range(rect.minY(), rect.maxY());
    }

    double min() {
        return min;
    }

    double max() {
        return max;
    }

    double width() {
        return max - min;
    }

    boolean contains(double v) {
        return v >= min && v <= max;
    }

    double center() {
        return min + width() / 2.0d;
    }

    Range expandTo(Range other) {
        return new Range(Math.min(min, other.min), Math.max(max, other.max));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Range range = (Range) o;
        return Double.compare(range.min, min) == 0 && Double.compare(range.max, max) == 0;
    }

    @Override
    public int hashCode() {
        return 31 * Double.hashCode(min) + Double.hashCode(max);
    }

    @Override
    public String toString() {
        return "Range{" + min + " TO " + max + '}';
    }

    /**
     * Longitude interval; {@code min > max} crosses the dateline.
     */
    static final class LongitudeRange extends Range {
        static final LongitudeRange WORLD_180E180W = new LongitudeRange(-180.0d, 180.0d);

        LongitudeRange(double min, double max) {
            super(min, max);
        }

        @Override
        double width() {
            double w = super.width();
            if (w < 0) {
                w += 360.0d;
            }
            return w;
        }

        @Override
        boolean contains(double v) {
            if (!crossesDateLine()) {
                return super.contains(v);
            }
            return v >= min || v <= max;
        }

        boolean crossesDateLine() {
            return min > max;
        }

        @Override
        double center() {
            double ctr = super.center();
            if (ctr > 180.0d) {
                ctr -= 360.0d;
            }
            return ctr;
        }

        /**
         * Signed shortest angular difference between the centers; negative when this lies west of {@code b}.
         */
        double compareTo(LongitudeRange b) {
            double diff = center() - b.center();
            if (diff <= 180.0d) {
                return diff >= -180.0d ? diff : diff + 360.0d;
            }
            return diff - 360.0d;
        }

        /**
         * Smallest longitude range covering both, wrapping the dateline when that is shorter.
         */
        @Override
        Range expandTo(Range other) {
            LongitudeRange that = (LongitudeRange) other;
            LongitudeRange a;
            LongitudeRange b;
            // a lies west of b
            if (compareTo(that) <= 0) {
                a = this;
                b = that;
            } else {
                a = that;
                b = this;
            }
            LongitudeRange newMin = b.contains(a.min) ? b : a;
            LongitudeRange newMax = a.contains(b.max) ? a : b;
            if (newMin == newMax) {
                return newMin;
            }
            if (newMin == b && newMax == a) {
                return WORLD_180E180W;
            }
            return new LongitudeRange(newMin.min, newMax.max);
        }
    }
}
