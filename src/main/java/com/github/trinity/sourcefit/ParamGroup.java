package com.github.trinity.sourcefit;

/**
 * Semantic groups of one source's variational parameter vector, in layout order.
 * <p>
 * The constrained and unconstrained layouts share this order and these sizes;
 * they differ only in the {@link Constraint} applied to each group when moving
 * between the two spaces.
 * </p>
 *
 * @author Sean Phillips
 */
public enum ParamGroup {
    INDICATOR(2, Constraint.SIMPLEX, ParamLayout.SOURCE_TYPES),
    POSITION(2, Constraint.UNBOUNDED),
    POSITION_VARIANCE(1, Constraint.POSITIVE),
    BRIGHTNESS_MEAN(ParamLayout.SOURCE_TYPES, Constraint.UNBOUNDED),
    BRIGHTNESS_VARIANCE(ParamLayout.SOURCE_TYPES, Constraint.POSITIVE),
    COLOR_MEAN(ParamLayout.COLORS * ParamLayout.SOURCE_TYPES, Constraint.UNBOUNDED),
    COLOR_VARIANCE(ParamLayout.COLORS * ParamLayout.SOURCE_TYPES, Constraint.POSITIVE),
    COLOR_WEIGHT(ParamLayout.COLOR_COMPONENTS * ParamLayout.SOURCE_TYPES, Constraint.SIMPLEX,
        ParamLayout.COLOR_COMPONENTS),
    SHAPE_DEV_FRACTION(1, Constraint.UNIT_INTERVAL),
    SHAPE_AXIS(1, Constraint.UNIT_INTERVAL),
    SHAPE_ANGLE(1, Constraint.UNBOUNDED),
    SHAPE_SCALE(1, Constraint.POSITIVE);

    /**
     * How a group's constrained values relate to their unconstrained counterparts.
     */
    public enum Constraint {
        /** Identity map. */
        UNBOUNDED,
        /** Strictly positive; log map. */
        POSITIVE,
        /** Open unit interval; logit map. */
        UNIT_INTERVAL,
        /** Blocks of probabilities summing to one; centred log-odds map. */
        SIMPLEX
    }

    private final int size;
    private final Constraint constraint;
    private final int blockWidth;
    private int offset;

    ParamGroup(int size, Constraint constraint) {
        this(size, constraint, 1);
    }

    ParamGroup(int size, Constraint constraint, int blockWidth) {
        this.size = size;
        this.constraint = constraint;
        this.blockWidth = blockWidth;
    }

    static {
        int next = 0;
        for (ParamGroup group : values()) {
            group.offset = next;
            next += group.size;
        }
    }

    public int size() {
        return size;
    }

    public int offset() {
        return offset;
    }

    public Constraint constraint() {
        return constraint;
    }

    /**
     * Width of each simplex block inside the group; 1 for non-simplex groups.
     */
    public int blockWidth() {
        return blockWidth;
    }

    /**
     * @return the flat indices owned by this group, in order
     */
    public int[] ids() {
        int[] ids = new int[size];
        for (int i = 0; i < size; i++) {
            ids[i] = offset + i;
        }
        return ids;
    }

    public boolean contains(int id) {
        return id >= offset && id < offset + size;
    }
}
