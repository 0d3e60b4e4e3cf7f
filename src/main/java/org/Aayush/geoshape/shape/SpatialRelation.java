package org.Aayush.geoshape.shape;

/**
 * Relation of one shape to another, read as "this RELATION other".
 */
public enum SpatialRelation {
    /** The shapes share some points but neither contains the other. */
    INTERSECTS,
    /** This shape lies entirely inside the other. */
    WITHIN,
    /** This shape entirely encloses the other. */
    CONTAINS,
    /** The shapes share no points. */
    DISJOINT;

    /**
     * Relation seen from the other shape: CONTAINS and WITHIN swap, the rest are fixed.
     */
    public SpatialRelation transpose() {
        switch (this) {
            case CONTAINS:
                return WITHIN;
            case WITHIN:
                return CONTAINS;
            default:
                return this;
        }
    }

    /**
     * Folds the relations of two shapes against a common third shape into the relation of their union.
     *
     * <p>Equal relations are kept; DISJOINT and CONTAINS fold to CONTAINS; anything else is INTERSECTS.</p>
     */
    public SpatialRelation combine(SpatialRelation other) {
        if (this == other) {
            return this;
        }
        if ((this == DISJOINT && other == CONTAINS) || (this == CONTAINS && other == DISJOINT)) {
            return CONTAINS;
        }
        return INTERSECTS;
    }

    /**
     * True unless DISJOINT.
     */
    public boolean intersects() {
        return this != DISJOINT;
    }

    /**
     * Relation against the complement of the other shape.
     *
     * <p>DISJOINT becomes CONTAINS, CONTAINS becomes DISJOINT, everything else INTERSECTS.</p>
     */
    public SpatialRelation inverse() {
        switch (this) {
            case DISJOINT:
                return CONTAINS;
            case CONTAINS:
                return DISJOINT;
            default:
                return INTERSECTS;
        }
    }
}
