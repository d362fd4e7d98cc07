package com.github.trinity.sourcefit;

import static com.github.trinity.sourcefit.ParamLayout.SIZE;

import java.util.ArrayList;
import java.util.List;

import org.apache.commons.math3.exception.DimensionMismatchException;
import org.apache.commons.math3.util.FastMath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps variational parameters between their constrained form and an
 * unconstrained form suitable for a box-constrained optimizer, and rescales
 * gradients accordingly.
 *
 * <p>Two policies are supported:</p>
 * <ul>
 *   <li><b>RECTANGULAR:</b> log for positive groups, logit for unit-interval
 *       groups, centred log-odds for simplex blocks, identity otherwise. Boxes
 *       are enforced by the optimizer through {@link #unconstrainedBounds}.</li>
 *   <li><b>BOUNDED:</b> every coordinate with finite bounds is squeezed into
 *       its per-source {@link ParamBounds} with a logistic, one-sided bounds use
 *       a shifted exponential, and simplex entries keep their minimum
 *       probability. The optimizer only sees a generous symmetric box.</li>
 * </ul>
 *
 * <p>The Jacobian is block diagonal: diagonal everywhere except inside a
 * simplex block, so groups never couple.</p>
 *
 * @author Sean Phillips
 */
public class ParameterTransform {

    private static final Logger LOG = LoggerFactory.getLogger(ParameterTransform.class);

    public enum Type {
        RECTANGULAR, BOUNDED
    }

    /** Half-width of the unconstrained box of logistic coordinates under BOUNDED. */
    public static final double BOX = 20.0;

    /** Relative tolerance of the round-trip check. */
    public static final double ROUND_TRIP_TOLERANCE = 1e-8;

    private final Type type;
    private final List<ParamBounds> bounds;

    private ParameterTransform(Type type, List<ParamBounds> bounds) {
        this.type = type;
        this.bounds = bounds;
    }

    public static ParameterTransform rectangular() {
        return new ParameterTransform(Type.RECTANGULAR, null);
    }

    /**
     * @param bounds one box per source, in source order
     */
    public static ParameterTransform bounded(List<ParamBounds> bounds) {
        return new ParameterTransform(Type.BOUNDED, new ArrayList<>(bounds));
    }

    public Type getType() {
        return type;
    }

    // ----- Constrained -> unconstrained -----

    /**
     * Unconstrained image of source {@code s}'s vector.
     */
    public double[] toUnconstrained(double[] vp, int s) {
        checkLength(vp);
        double[] x = new double[SIZE];
        for (ParamGroup group : ParamGroup.values()) {
            if (group.constraint() == ParamGroup.Constraint.SIMPLEX) {
                for (int start = group.offset(); start < group.offset() + group.size(); start += group.blockWidth()) {
                    simplexToUnconstrained(vp, x, start, group.blockWidth(), simplexMinimum(s, start));
                }
            } else {
                for (int id : group.ids()) {
                    x[id] = coordinateToUnconstrained(vp[id], id, s);
                }
            }
        }
        return x;
    }

    public List<double[]> toUnconstrained(ModelParams mp) {
        List<double[]> xs = new ArrayList<>(mp.numSources());
        for (int s = 0; s < mp.numSources(); s++) {
            xs.add(toUnconstrained(mp.source(s), s));
        }
        return xs;
    }

    private double coordinateToUnconstrained(double p, int id, int s) {
        ParamGroup.Constraint constraint = ParamLayout.groupOf(id).constraint();
        switch (type) {
            case RECTANGULAR -> {
                return switch (constraint) {
                    case POSITIVE -> FastMath.log(p);
                    case UNIT_INTERVAL -> SourceFitHelper.logit(p);
                    default -> p;
                };
            }
            case BOUNDED -> {
                double lb = bounds.get(s).lower(id);
                double ub = bounds.get(s).upper(id);
                boolean hasLower = !Double.isInfinite(lb);
                boolean hasUpper = !Double.isInfinite(ub);
                if (hasLower && hasUpper) {
                    double t = SourceFitHelper.clamp((p - lb) / (ub - lb), 0.0, 1.0);
                    return SourceFitHelper.clamp(SourceFitHelper.logit(t), -BOX, BOX);
                } else if (hasLower) {
                    return Math.max(SourceFitHelper.safeLog(p - lb), -BOX);
                } else if (hasUpper) {
                    return Math.min(-SourceFitHelper.safeLog(ub - p), BOX);
                }
                return p;
            }
            default -> throw new IllegalStateException("Unsupported transform type: " + type);
        }
    }

    private static void simplexToUnconstrained(double[] vp, double[] x, int start, int width, double min) {
        double meanLog = 0.0;
        for (int j = start; j < start + width; j++) {
            x[j] = SourceFitHelper.safeLog(vp[j] - min);
            meanLog += x[j];
        }
        meanLog /= width;
        for (int j = start; j < start + width; j++) {
            x[j] -= meanLog;
        }
    }

    // ----- Unconstrained -> constrained -----

    /**
     * Constrained image of source {@code s}'s unconstrained vector.
     */
    public double[] toConstrained(double[] x, int s) {
        checkLength(x);
        double[] vp = new double[SIZE];
        for (ParamGroup group : ParamGroup.values()) {
            if (group.constraint() == ParamGroup.Constraint.SIMPLEX) {
                for (int start = group.offset(); start < group.offset() + group.size(); start += group.blockWidth()) {
                    double min = simplexMinimum(s, start);
                    int width = group.blockWidth();
                    SourceFitHelper.softmax(x, vp, start, width);
                    for (int j = start; j < start + width; j++) {
                        vp[j] = min + (1.0 - width * min) * vp[j];
                    }
                }
            } else {
                for (int id : group.ids()) {
                    vp[id] = coordinateToConstrained(x[id], id, s);
                }
            }
        }
        return vp;
    }

    /**
     * Writes the constrained image of every unconstrained vector into {@code mp}.
     */
    public void toConstrained(List<double[]> xs, ModelParams mp) {
        if (xs.size() != mp.numSources()) {
            throw new DimensionMismatchException(xs.size(), mp.numSources());
        }
        for (int s = 0; s < xs.size(); s++) {
            mp.setSource(s, toConstrained(xs.get(s), s));
        }
    }

    private double coordinateToConstrained(double y, int id, int s) {
        ParamGroup.Constraint constraint = ParamLayout.groupOf(id).constraint();
        switch (type) {
            case RECTANGULAR -> {
                return switch (constraint) {
                    case POSITIVE -> FastMath.exp(y);
                    case UNIT_INTERVAL -> SourceFitHelper.sigmoid(y);
                    default -> y;
                };
            }
            case BOUNDED -> {
                double lb = bounds.get(s).lower(id);
                double ub = bounds.get(s).upper(id);
                boolean hasLower = !Double.isInfinite(lb);
                boolean hasUpper = !Double.isInfinite(ub);
                if (hasLower && hasUpper) {
                    return lb + (ub - lb) * SourceFitHelper.sigmoid(y);
                } else if (hasLower) {
                    return lb + FastMath.exp(y);
                } else if (hasUpper) {
                    return ub - FastMath.exp(-y);
                }
                return y;
            }
            default -> throw new IllegalStateException("Unsupported transform type: " + type);
        }
    }

    // ----- Gradients -----

    /**
     * Rescales a gradient over constrained parameters, evaluated at {@code mp},
     * into a gradient over the unconstrained parameters. The value is unchanged.
     */
    public SensitiveFloat transformSensitiveFloat(SensitiveFloat sf, ModelParams mp) {
        if (sf.numSources() != mp.numSources()) {
            throw new DimensionMismatchException(sf.numSources(), mp.numSources());
        }
        SensitiveFloat result = SensitiveFloat.zero(sf.numSources());
        result.addValue(sf.value());
        for (int s = 0; s < mp.numSources(); s++) {
            double[] vp = mp.source(s);
            double[] g = sf.gradient(s);
            for (ParamGroup group : ParamGroup.values()) {
                if (group.constraint() == ParamGroup.Constraint.SIMPLEX) {
                    for (int start = group.offset(); start < group.offset() + group.size();
                         start += group.blockWidth()) {
                        simplexGradient(vp, g, start, group.blockWidth(), simplexMinimum(s, start), result, s);
                    }
                } else {
                    for (int id : group.ids()) {
                        result.addDerivative(s, id, g[id] * coordinateDerivative(vp[id], id, s));
                    }
                }
            }
        }
        return result;
    }

    /**
     * d(constrained) / d(unconstrained) for a non-simplex coordinate, written in
     * terms of the constrained value.
     */
    private double coordinateDerivative(double p, int id, int s) {
        ParamGroup.Constraint constraint = ParamLayout.groupOf(id).constraint();
        switch (type) {
            case RECTANGULAR -> {
                return switch (constraint) {
                    case POSITIVE -> p;
                    case UNIT_INTERVAL -> p * (1.0 - p);
                    default -> 1.0;
                };
            }
            case BOUNDED -> {
                double lb = bounds.get(s).lower(id);
                double ub = bounds.get(s).upper(id);
                boolean hasLower = !Double.isInfinite(lb);
                boolean hasUpper = !Double.isInfinite(ub);
                if (hasLower && hasUpper) {
                    return (p - lb) * (ub - p) / (ub - lb);
                } else if (hasLower) {
                    return p - lb;
                } else if (hasUpper) {
                    return ub - p;
                }
                return 1.0;
            }
            default -> throw new IllegalStateException("Unsupported transform type: " + type);
        }
    }

    /**
     * Softmax chain rule: {@code g'_j = (p_j - min) (g_j - sum_i q_i g_i)} with
     * {@code q} the softmax output before the minimum is added back.
     */
    private static void simplexGradient(double[] vp, double[] g, int start, int width, double min,
                                        SensitiveFloat result, int s) {
        double scale = 1.0 - width * min;
        double weighted = 0.0;
        for (int j = start; j < start + width; j++) {
            weighted += (vp[j] - min) / scale * g[j];
        }
        for (int j = start; j < start + width; j++) {
            result.addDerivative(s, j, (vp[j] - min) * (g[j] - weighted));
        }
    }

    // ----- Optimizer boxes -----

    /**
     * Unconstrained box matching a constrained box, as {@code {lower, upper}}.
     * <p>
     * Under RECTANGULAR, the map is monotone per coordinate; a width-two simplex
     * block with minimum probability {@code m} gets {@code [-L, L]} per entry
     * with {@code L = log((1 - m) / m) / 2}, since the block's probability is
     * the logistic of the difference of its two entries. Under BOUNDED, the
     * bounds are already part of the map and the box is {@code [-BOX, BOX]}
     * where a side is bounded.
     * </p>
     */
    public double[][] unconstrainedBounds(ParamBounds box, int s) {
        double[] lower = new double[SIZE];
        double[] upper = new double[SIZE];
        for (int id = 0; id < SIZE; id++) {
            ParamGroup group = ParamLayout.groupOf(id);
            if (type == Type.BOUNDED) {
                ParamBounds own = bounds.get(s);
                boolean simplex = group.constraint() == ParamGroup.Constraint.SIMPLEX;
                lower[id] = simplex || !Double.isInfinite(own.lower(id)) ? -BOX : Double.NEGATIVE_INFINITY;
                upper[id] = simplex || !Double.isInfinite(own.upper(id)) ? BOX : Double.POSITIVE_INFINITY;
                continue;
            }
            double lo = box.lower(id);
            double hi = box.upper(id);
            switch (group.constraint()) {
                case SIMPLEX -> {
                    if (group.blockWidth() != 2) {
                        throw new IllegalStateException("Simplex boxes need blocks of width two, got "
                            + group.blockWidth());
                    }
                    double half = 0.5 * FastMath.log((1.0 - lo) / lo);
                    lower[id] = -half;
                    upper[id] = half;
                }
                case POSITIVE -> {
                    lower[id] = lo > 0 ? FastMath.log(lo) : Double.NEGATIVE_INFINITY;
                    upper[id] = FastMath.log(hi);
                }
                case UNIT_INTERVAL -> {
                    lower[id] = lo > 0 ? SourceFitHelper.logit(lo) : Double.NEGATIVE_INFINITY;
                    upper[id] = hi < 1 ? SourceFitHelper.logit(hi) : Double.POSITIVE_INFINITY;
                }
                default -> {
                    lower[id] = lo;
                    upper[id] = hi;
                }
            }
        }
        return new double[][]{lower, upper};
    }

    // ----- Invariant -----

    /**
     * Whether mapping every source to unconstrained space and back reproduces
     * it to {@link #ROUND_TRIP_TOLERANCE} relative.
     */
    public boolean roundTripHolds(ModelParams mp) {
        for (int s = 0; s < mp.numSources(); s++) {
            double[] vp = mp.source(s);
            double[] back = toConstrained(toUnconstrained(vp, s), s);
            for (int id = 0; id < SIZE; id++) {
                double tol = ROUND_TRIP_TOLERANCE * Math.max(Math.abs(vp[id]), Math.abs(back[id])) + 1e-14;
                if (!(Math.abs(vp[id] - back[id]) <= tol)) {
                    LOG.warn("Round trip mismatch for source {} index {} ({}): {} -> {}",
                        s, id, ParamLayout.groupOf(id), vp[id], back[id]);
                    return false;
                }
            }
        }
        return true;
    }

    private double simplexMinimum(int s, int start) {
        return type == Type.BOUNDED ? bounds.get(s).lower(start) : 0.0;
    }

    private static void checkLength(double[] v) {
        if (v.length != SIZE) {
            throw new DimensionMismatchException(v.length, SIZE);
        }
    }
}
