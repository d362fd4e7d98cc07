package com.github.trinity.sourcefit;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Set;
import java.util.stream.IntStream;

/**
 * Fixed-order layout of one source's variational parameters.
 * <p>
 * Index groups are defined by {@link ParamGroup}; this class adds the model
 * dimensions, the per-entry index helpers used throughout the ELBO code, and
 * id sets used to choose which parameters an optimization run may move.
 * </p>
 *
 * @author Sean Phillips
 */
public final class ParamLayout {

    public static final int BANDS = 5;
    public static final int REFERENCE_BAND = 2;
    public static final int COLORS = BANDS - 1;
    public static final int SOURCE_TYPES = 2;
    public static final int STAR = 0;
    public static final int GALAXY = 1;
    public static final int COLOR_COMPONENTS = 2;

    /** Number of entries in one source's parameter vector. */
    public static final int SIZE = computeSize();

    private static final ParamGroup[] GROUP_BY_ID = buildGroupIndex();

    private ParamLayout() {
    }

    private static int computeSize() {
        int size = 0;
        for (ParamGroup group : ParamGroup.values()) {
            size += group.size();
        }
        return size;
    }

    private static ParamGroup[] buildGroupIndex() {
        ParamGroup[] index = new ParamGroup[SIZE];
        for (ParamGroup group : ParamGroup.values()) {
            for (int id : group.ids()) {
                if (index[id] != null) {
                    throw new IllegalStateException("Parameter groups overlap at index " + id);
                }
                index[id] = group;
            }
        }
        for (int id = 0; id < SIZE; id++) {
            if (index[id] == null) {
                throw new IllegalStateException("Parameter groups leave index " + id + " unassigned");
            }
        }
        return index;
    }

    public static ParamGroup groupOf(int id) {
        return GROUP_BY_ID[id];
    }

    // ----- Entry indices -----

    public static int indicator(int type) {
        return ParamGroup.INDICATOR.offset() + type;
    }

    public static int position(int axis) {
        return ParamGroup.POSITION.offset() + axis;
    }

    public static int positionVariance() {
        return ParamGroup.POSITION_VARIANCE.offset();
    }

    public static int brightnessMean(int type) {
        return ParamGroup.BRIGHTNESS_MEAN.offset() + type;
    }

    public static int brightnessVariance(int type) {
        return ParamGroup.BRIGHTNESS_VARIANCE.offset() + type;
    }

    public static int colorMean(int color, int type) {
        return ParamGroup.COLOR_MEAN.offset() + type * COLORS + color;
    }

    public static int colorVariance(int color, int type) {
        return ParamGroup.COLOR_VARIANCE.offset() + type * COLORS + color;
    }

    public static int colorWeight(int component, int type) {
        return ParamGroup.COLOR_WEIGHT.offset() + type * COLOR_COMPONENTS + component;
    }

    public static int devFraction() {
        return ParamGroup.SHAPE_DEV_FRACTION.offset();
    }

    public static int axisRatio() {
        return ParamGroup.SHAPE_AXIS.offset();
    }

    public static int angle() {
        return ParamGroup.SHAPE_ANGLE.offset();
    }

    public static int scale() {
        return ParamGroup.SHAPE_SCALE.offset();
    }

    /**
     * Sign with which color {@code color} enters the log brightness of {@code band}
     * relative to the reference band. Color {@code d} is {@code log(f[d + 1] / f[d])}.
     *
     * @return +1 for colors between the reference band and a redder band, -1 for
     * colors between a bluer band and the reference band, otherwise 0
     */
    public static int colorSign(int band, int color) {
        if (band > REFERENCE_BAND && color >= REFERENCE_BAND && color < band) {
            return 1;
        }
        if (band < REFERENCE_BAND && color >= band && color < REFERENCE_BAND) {
            return -1;
        }
        return 0;
    }

    // ----- Id sets -----

    public static int[] all() {
        return IntStream.range(0, SIZE).toArray();
    }

    public static int[] of(ParamGroup... groups) {
        Set<ParamGroup> chosen = groups.length == 0
            ? EnumSet.noneOf(ParamGroup.class) : EnumSet.copyOf(Arrays.asList(groups));
        return IntStream.range(0, SIZE).filter(id -> chosen.contains(GROUP_BY_ID[id])).toArray();
    }

    public static int[] except(ParamGroup... groups) {
        Set<ParamGroup> omitted = groups.length == 0
            ? EnumSet.noneOf(ParamGroup.class) : EnumSet.copyOf(Arrays.asList(groups));
        return IntStream.range(0, SIZE).filter(id -> !omitted.contains(GROUP_BY_ID[id])).toArray();
    }
}
