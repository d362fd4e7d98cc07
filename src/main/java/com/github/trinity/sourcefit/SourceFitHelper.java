package com.github.trinity.sourcefit;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.apache.commons.math3.util.FastMath;

/**
 * Static numeric helpers shared by the transform, the ELBO and the initializers.
 *
 * @author Sean Phillips
 */
public class SourceFitHelper {

    /** Smallest probability fed to a logarithm. */
    public static final double MIN_PROBABILITY = 1e-300;

    public static double logit(double p) {
        return FastMath.log(p) - FastMath.log1p(-p);
    }

    public static double sigmoid(double x) {
        if (x >= 0) {
            return 1.0 / (1.0 + FastMath.exp(-x));
        }
        double e = FastMath.exp(x);
        return e / (1.0 + e);
    }

    /**
     * Stable {@code log(sum(exp(x[from .. from + len))))}.
     */
    public static double logSumExp(double[] x, int from, int len) {
        double max = Double.NEGATIVE_INFINITY;
        for (int i = from; i < from + len; i++) {
            max = Math.max(max, x[i]);
        }
        if (Double.isInfinite(max)) {
            return max;
        }
        double sum = 0.0;
        for (int i = from; i < from + len; i++) {
            sum += FastMath.exp(x[i] - max);
        }
        return max + FastMath.log(sum);
    }

    /**
     * Writes {@code softmax(x[from .. from + len))} into {@code out} at the same offsets.
     */
    public static void softmax(double[] x, double[] out, int from, int len) {
        double lse = logSumExp(x, from, len);
        for (int i = from; i < from + len; i++) {
            out[i] = FastMath.exp(x[i] - lse);
        }
    }

    /**
     * {@code p log(p / q)} with the convention {@code 0 log 0 = 0}.
     */
    public static double xLogXOverY(double p, double q) {
        if (p <= 0.0) {
            return 0.0;
        }
        return p * (FastMath.log(p) - FastMath.log(Math.max(q, MIN_PROBABILITY)));
    }

    public static double safeLog(double p) {
        return FastMath.log(Math.max(p, MIN_PROBABILITY));
    }

    public static List<double[]> deepCopy(List<double[]> vectors) {
        List<double[]> copy = new ArrayList<>(vectors.size());
        for (double[] v : vectors) {
            copy.add(Arrays.copyOf(v, v.length));
        }
        return copy;
    }

    public static double clamp(double x, double lo, double hi) {
        return Math.max(lo, Math.min(hi, x));
    }

    /**
     * Wraps an angle into {@code [0, pi)}.
     */
    public static double wrapAngle(double angle) {
        return angle - FastMath.floor(angle / FastMath.PI) * FastMath.PI;
    }
}
