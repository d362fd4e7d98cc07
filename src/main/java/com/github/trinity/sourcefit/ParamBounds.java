package com.github.trinity.sourcefit;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.apache.commons.math3.exception.DimensionMismatchException;

/**
 * Per-source box on the constrained parameters.
 * <p>
 * Infinite entries leave a side open. For simplex groups only the lower bound
 * is used: it is the minimum probability of every entry in the block, and
 * all entries of one block must share it.
 * </p>
 *
 * @author Sean Phillips
 */
public class ParamBounds {

    /** Minimum type probability; a source is never more than 99% certain of its type. */
    public static final double MIN_INDICATOR = 0.01;
    public static final double MIN_COLOR_WEIGHT = 1e-3;
    public static final double MIN_VARIANCE = 1e-8;
    public static final double MAX_VARIANCE = 10.0;
    public static final double MIN_POSITION_VARIANCE = 1e-6;
    public static final double MAX_POSITION_VARIANCE = 10.0;
    public static final double MIN_SHAPE_FRACTION = 1e-3;
    public static final double MIN_AXIS_RATIO = 1e-2;
    public static final double MIN_SCALE = 0.2;
    public static final double MAX_SCALE = 15.0;

    private final double[] lower;
    private final double[] upper;

    public ParamBounds(double[] lower, double[] upper) {
        if (lower.length != ParamLayout.SIZE) {
            throw new DimensionMismatchException(lower.length, ParamLayout.SIZE);
        }
        if (upper.length != ParamLayout.SIZE) {
            throw new DimensionMismatchException(upper.length, ParamLayout.SIZE);
        }
        for (int id = 0; id < ParamLayout.SIZE; id++) {
            if (!(lower[id] < upper[id])) {
                throw new IllegalArgumentException("Empty bound at index " + id + ": [" + lower[id]
                    + ", " + upper[id] + "]");
            }
        }
        for (ParamGroup group : ParamGroup.values()) {
            if (group.constraint() != ParamGroup.Constraint.SIMPLEX) {
                continue;
            }
            for (int start = group.offset(); start < group.offset() + group.size(); start += group.blockWidth()) {
                double min = lower[start];
                if (!(min > 0 && min * group.blockWidth() < 1)) {
                    throw new IllegalArgumentException("Simplex minimum probability at index " + start
                        + " must lie in (0, 1 / " + group.blockWidth() + ")");
                }
                for (int j = 1; j < group.blockWidth(); j++) {
                    if (lower[start + j] != min) {
                        throw new IllegalArgumentException("Simplex block at index " + start
                            + " mixes minimum probabilities");
                    }
                }
            }
        }
        this.lower = lower.clone();
        this.upper = upper.clone();
    }

    /**
     * Default box around a starting vector: the position may move
     * {@code positionRadius} world units in each direction, everything else
     * gets fixed physical limits.
     */
    public static ParamBounds around(double[] vp, double positionRadius) {
        double[] lower = new double[ParamLayout.SIZE];
        double[] upper = new double[ParamLayout.SIZE];
        Arrays.fill(lower, Double.NEGATIVE_INFINITY);
        Arrays.fill(upper, Double.POSITIVE_INFINITY);

        set(lower, upper, ParamGroup.INDICATOR, MIN_INDICATOR, 1.0 - MIN_INDICATOR);
        for (int axis = 0; axis < 2; axis++) {
            int id = ParamLayout.position(axis);
            lower[id] = vp[id] - positionRadius;
            upper[id] = vp[id] + positionRadius;
        }
        set(lower, upper, ParamGroup.POSITION_VARIANCE, MIN_POSITION_VARIANCE, MAX_POSITION_VARIANCE);
        set(lower, upper, ParamGroup.BRIGHTNESS_VARIANCE, MIN_VARIANCE, MAX_VARIANCE);
        set(lower, upper, ParamGroup.COLOR_VARIANCE, MIN_VARIANCE, MAX_VARIANCE);
        set(lower, upper, ParamGroup.COLOR_WEIGHT, MIN_COLOR_WEIGHT, 1.0 - MIN_COLOR_WEIGHT);
        set(lower, upper, ParamGroup.SHAPE_DEV_FRACTION, MIN_SHAPE_FRACTION, 1.0 - MIN_SHAPE_FRACTION);
        set(lower, upper, ParamGroup.SHAPE_AXIS, MIN_AXIS_RATIO, 1.0 - MIN_SHAPE_FRACTION);
        set(lower, upper, ParamGroup.SHAPE_SCALE, MIN_SCALE, MAX_SCALE);
        return new ParamBounds(lower, upper);
    }

    public static List<ParamBounds> around(ModelParams mp, double positionRadius) {
        List<ParamBounds> bounds = new ArrayList<>(mp.numSources());
        for (double[] vp : mp.vp()) {
            bounds.add(around(vp, positionRadius));
        }
        return bounds;
    }

    private static void set(double[] lower, double[] upper, ParamGroup group, double lo, double hi) {
        for (int id : group.ids()) {
            lower[id] = lo;
            upper[id] = hi;
        }
    }

    public double lower(int id) {
        return lower[id];
    }

    public double upper(int id) {
        return upper[id];
    }
}
