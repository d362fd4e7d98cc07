package com.github.trinity.sourcefit;

import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;
import java.util.Iterator;

import org.apache.commons.math3.optim.ConvergenceChecker;
import org.apache.commons.math3.optim.PointValuePair;
import org.apache.commons.math3.optim.nonlinear.scalar.GoalType;
import org.apache.commons.math3.optim.nonlinear.scalar.GradientMultivariateOptimizer;
import org.apache.commons.math3.util.FastMath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Projected limited-memory BFGS for box-constrained problems.
 * <p>
 * Each iteration builds a quasi-Newton direction over the coordinates that
 * are not held at a bound by the gradient, then backtracks along the
 * projection of that direction onto the box until the Armijo condition holds.
 * Trial points with a non-finite objective or gradient are rejected like any
 * other failed trial. When backtracking fails the correction history is
 * dropped and steepest descent is tried once before giving up.
 * </p>
 * <p>
 * Usable through the standard commons-math {@code optimize} call with
 * {@code ObjectiveFunction}, {@code ObjectiveFunctionGradient},
 * {@code GoalType}, {@code InitialGuess}, {@code SimpleBounds},
 * {@code MaxEval} and {@code MaxIter}. The best point seen is returned even
 * when the run stops early; {@link #getStatus()} tells why it stopped.
 * </p>
 *
 * @author Sean Phillips
 */
public class BoundedLbfgsOptimizer extends GradientMultivariateOptimizer {

    private static final Logger LOG = LoggerFactory.getLogger(BoundedLbfgsOptimizer.class);

    public enum Status {
        /** Convergence checker or projected gradient test satisfied. */
        CONVERGED,
        /** Iteration cap reached. */
        MAX_ITERATIONS,
        /** No acceptable step along either the quasi-Newton or steepest-descent direction. */
        LINE_SEARCH_FAILED
    }

    private final int memory;
    private final double gradientTolerance;
    private final double sufficientDecrease;
    private final int maxLineSearchSteps;

    private Status status;

    public BoundedLbfgsOptimizer(int memory, double gradientTolerance, double sufficientDecrease,
                                 int maxLineSearchSteps, ConvergenceChecker<PointValuePair> checker) {
        super(checker);
        if (memory < 1) {
            throw new IllegalArgumentException("L-BFGS memory must be at least 1, got " + memory);
        }
        this.memory = memory;
        this.gradientTolerance = gradientTolerance;
        this.sufficientDecrease = sufficientDecrease;
        this.maxLineSearchSteps = maxLineSearchSteps;
    }

    public BoundedLbfgsOptimizer(OptimizerConfig config) {
        this(config.memory, config.gradientTolerance, config.sufficientDecrease, config.maxLineSearchSteps,
            CombinedConvergenceChecker.from(config));
    }

    /**
     * Why the last run stopped, or {@code null} before the first run.
     */
    public Status getStatus() {
        return status;
    }

    @Override
    protected PointValuePair doOptimize() {
        // Internally always minimize sign * f.
        double sign = getGoalType() == GoalType.MINIMIZE ? 1.0 : -1.0;
        double[] start = getStartPoint();
        int n = start.length;
        double[] lower = bound(getLowerBound(), n, Double.NEGATIVE_INFINITY);
        double[] upper = bound(getUpperBound(), n, Double.POSITIVE_INFINITY);
        ConvergenceChecker<PointValuePair> checker = getConvergenceChecker();

        double[] x = project(start, lower, upper);
        double f = sign * computeObjectiveValue(x);
        double[] g = scaled(computeObjectiveGradient(x), sign);
        if (!isFinite(f) || !isFinite(g)) {
            throw new IllegalStateException("Objective is not finite at the start point: " + f);
        }
        double[] bestPoint = x.clone();
        double bestValue = f;

        Deque<double[][]> history = new ArrayDeque<>(memory);
        boolean steepestRetry = false;
        status = null;

        while (status == null) {
            if (getIterations() >= getMaxIterations()) {
                status = Status.MAX_ITERATIONS;
                break;
            }
            incrementIterationCount();

            if (projectedGradientNorm(x, g, lower, upper) <= gradientTolerance) {
                status = Status.CONVERGED;
                break;
            }
            boolean[] free = freeCoordinates(x, g, lower, upper);
            double[] d = direction(g, free, history);
            if (dot(g, d) >= 0) {
                history.clear();
                d = direction(g, free, history);
            }

            double t = history.isEmpty() ? Math.min(1.0, 1.0 / norm1(g)) : 1.0;
            double[] xt = null;
            double ft = Double.NaN;
            double[] gt = null;
            for (int ls = 0; ls < maxLineSearchSteps; ls++, t *= 0.5) {
                double[] trial = project(axpy(x, t, d), lower, upper);
                double slope = 0.0;
                for (int i = 0; i < n; i++) {
                    slope += g[i] * (trial[i] - x[i]);
                }
                if (slope >= 0) {
                    continue;
                }
                double value = sign * computeObjectiveValue(trial);
                if (!isFinite(value) || value > f + sufficientDecrease * slope) {
                    continue;
                }
                double[] grad = scaled(computeObjectiveGradient(trial), sign);
                if (!isFinite(grad)) {
                    continue;
                }
                xt = trial;
                ft = value;
                gt = grad;
                break;
            }

            if (xt == null) {
                if (!history.isEmpty() && !steepestRetry) {
                    LOG.debug("Line search failed at iteration {}; retrying along steepest descent", getIterations());
                    history.clear();
                    steepestRetry = true;
                    continue;
                }
                status = Status.LINE_SEARCH_FAILED;
                break;
            }
            steepestRetry = false;

            double[] s = new double[n];
            double[] y = new double[n];
            for (int i = 0; i < n; i++) {
                s[i] = xt[i] - x[i];
                y[i] = gt[i] - g[i];
            }
            // Curvature condition; skip the update otherwise to keep H positive definite.
            if (dot(s, y) > 1e-10 * dot(y, y)) {
                if (history.size() == memory) {
                    history.removeFirst();
                }
                history.addLast(new double[][]{s, y});
            }

            PointValuePair previous = new PointValuePair(x, sign * f);
            PointValuePair current = new PointValuePair(xt, sign * ft);
            x = xt;
            f = ft;
            g = gt;
            if (f < bestValue) {
                bestValue = f;
                bestPoint = x.clone();
            }
            if (checker != null && checker.converged(getIterations(), previous, current)) {
                status = Status.CONVERGED;
            }
        }

        LOG.debug("L-BFGS stopped with {} after {} iterations and {} evaluations, value {}",
            status, getIterations(), getEvaluations(), sign * bestValue);
        return new PointValuePair(bestPoint, sign * bestValue);
    }

    /**
     * Two-loop recursion restricted to the free coordinates; held coordinates get
     * a zero direction.
     */
    private static double[] direction(double[] g, boolean[] free, Deque<double[][]> history) {
        int n = g.length;
        double[] q = new double[n];
        for (int i = 0; i < n; i++) {
            q[i] = free[i] ? -g[i] : 0.0;
        }
        if (history.isEmpty()) {
            return q;
        }
        double[] alpha = new double[history.size()];
        double[] rho = new double[history.size()];
        int k = history.size() - 1;
        for (Iterator<double[][]> it = history.descendingIterator(); it.hasNext(); k--) {
            double[][] pair = it.next();
            double sy = maskedDot(pair[0], pair[1], free);
            rho[k] = sy > 0 ? 1.0 / sy : 0.0;
            alpha[k] = rho[k] * maskedDot(pair[0], q, free);
            for (int i = 0; i < n; i++) {
                if (free[i]) {
                    q[i] -= alpha[k] * pair[1][i];
                }
            }
        }
        double[][] newest = history.peekLast();
        double yy = maskedDot(newest[1], newest[1], free);
        double gamma = yy > 0 ? maskedDot(newest[0], newest[1], free) / yy : 1.0;
        if (!(gamma > 0)) {
            gamma = 1.0;
        }
        for (int i = 0; i < n; i++) {
            q[i] *= gamma;
        }
        k = 0;
        for (double[][] pair : history) {
            double beta = rho[k] * maskedDot(pair[1], q, free);
            for (int i = 0; i < n; i++) {
                if (free[i]) {
                    q[i] += (alpha[k] - beta) * pair[0][i];
                }
            }
            k++;
        }
        return q;
    }

    private static boolean[] freeCoordinates(double[] x, double[] g, double[] lower, double[] upper) {
        boolean[] free = new boolean[x.length];
        for (int i = 0; i < x.length; i++) {
            boolean heldLow = x[i] <= lower[i] && g[i] > 0;
            boolean heldHigh = x[i] >= upper[i] && g[i] < 0;
            free[i] = !heldLow && !heldHigh;
        }
        return free;
    }

    private static double projectedGradientNorm(double[] x, double[] g, double[] lower, double[] upper) {
        double max = 0.0;
        for (int i = 0; i < x.length; i++) {
            double moved = SourceFitHelper.clamp(x[i] - g[i], lower[i], upper[i]) - x[i];
            max = Math.max(max, Math.abs(moved));
        }
        return max;
    }

    private static double[] project(double[] x, double[] lower, double[] upper) {
        double[] p = new double[x.length];
        for (int i = 0; i < x.length; i++) {
            p[i] = SourceFitHelper.clamp(x[i], lower[i], upper[i]);
        }
        return p;
    }

    private static double[] bound(double[] b, int n, double fill) {
        if (b != null) {
            return b;
        }
        double[] filled = new double[n];
        Arrays.fill(filled, fill);
        return filled;
    }

    private static double[] axpy(double[] x, double t, double[] d) {
        double[] r = new double[x.length];
        for (int i = 0; i < x.length; i++) {
            r[i] = x[i] + t * d[i];
        }
        return r;
    }

    private static double[] scaled(double[] v, double factor) {
        double[] r = new double[v.length];
        for (int i = 0; i < v.length; i++) {
            r[i] = factor * v[i];
        }
        return r;
    }

    private static double dot(double[] a, double[] b) {
        double sum = 0.0;
        for (int i = 0; i < a.length; i++) {
            sum += a[i] * b[i];
        }
        return sum;
    }

    private static double maskedDot(double[] a, double[] b, boolean[] mask) {
        double sum = 0.0;
        for (int i = 0; i < a.length; i++) {
            if (mask[i]) {
                sum += a[i] * b[i];
            }
        }
        return sum;
    }

    private static double norm1(double[] v) {
        double sum = 0.0;
        for (double e : v) {
            sum += FastMath.abs(e);
        }
        return sum > 0 ? sum : 1.0;
    }

    private static boolean isFinite(double v) {
        return !Double.isNaN(v) && !Double.isInfinite(v);
    }

    private static boolean isFinite(double[] v) {
        for (double e : v) {
            if (!isFinite(e)) {
                return false;
            }
        }
        return true;
    }
}
