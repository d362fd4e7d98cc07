package com.github.trinity.sourcefit;

import java.util.Arrays;
import java.util.List;

import org.apache.commons.math3.exception.DimensionMismatchException;
import org.apache.commons.math3.optim.InitialGuess;
import org.apache.commons.math3.optim.MaxEval;
import org.apache.commons.math3.optim.MaxIter;
import org.apache.commons.math3.optim.PointValuePair;
import org.apache.commons.math3.optim.SimpleBounds;
import org.apache.commons.math3.optim.nonlinear.scalar.GoalType;
import org.apache.commons.math3.optim.nonlinear.scalar.ObjectiveFunction;
import org.apache.commons.math3.optim.nonlinear.scalar.ObjectiveFunctionGradient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * ElboMaximizer drives a chosen subset of variational parameters to a local
 * maximum of an objective.
 *
 * <p>
 * Parameters are moved to unconstrained space with a {@link ParameterTransform},
 * the ids that are not free are pinned at their starting values, and the free
 * coordinates of every source are packed into one vector for
 * {@link BoundedLbfgsOptimizer}. Each evaluation maps the point back to
 * constrained space, evaluates the objective there and rescales its gradient.
 * The best point found is written back into the caller's {@link ModelParams},
 * whether or not the run converged.
 * </p>
 *
 * @author Sean Phillips
 */
public class ElboMaximizer {

    private static final Logger LOG = LoggerFactory.getLogger(ElboMaximizer.class);

    private ElboMaximizer() {
    }

    /**
     * Fits position, brightness, color means, type and shape against the
     * expected log-likelihood, with the variance and color-mixture groups pinned.
     */
    public static OptimizationResult maximizeLikelihood(List<ImageStamp> stamps, ModelParams mp,
                                                        OptimizerConfig config) {
        int[] freeIds = ParamLayout.except(ParamGroup.POSITION_VARIANCE, ParamGroup.BRIGHTNESS_VARIANCE,
            ParamGroup.COLOR_VARIANCE, ParamGroup.COLOR_WEIGHT);
        return maximizeDefault(SourceObjective.likelihood(stamps, mp), mp, freeIds, config);
    }

    public static OptimizationResult maximizeLikelihood(List<ImageStamp> stamps, ModelParams mp) {
        return maximizeLikelihood(stamps, mp, new OptimizerConfig());
    }

    /**
     * Fits every parameter against the full ELBO.
     */
    public static OptimizationResult maximizeElbo(List<ImageStamp> stamps, ModelParams mp, OptimizerConfig config) {
        return maximizeDefault(SourceObjective.elbo(stamps, mp), mp, ParamLayout.all(), config);
    }

    public static OptimizationResult maximizeElbo(List<ImageStamp> stamps, ModelParams mp) {
        return maximizeElbo(stamps, mp, new OptimizerConfig());
    }

    private static OptimizationResult maximizeDefault(SourceObjective objective, ModelParams mp, int[] freeIds,
                                                      OptimizerConfig config) {
        List<ParamBounds> bounds = ParamBounds.around(mp, config.positionRadius);
        ParameterTransform transform = config.transform == ParameterTransform.Type.BOUNDED
            ? ParameterTransform.bounded(bounds) : ParameterTransform.rectangular();
        return maximizeF(objective, mp, transform, freeIds, bounds, config);
    }

    /**
     * Maximizes {@code objective} over the {@code freeIds} of every source.
     *
     * @param objective function of the constrained parameters
     * @param mp        starting point; overwritten with the best point found
     * @param transform constrained / unconstrained map
     * @param freeIds   layout indices allowed to move, applied to every source
     * @param bounds    constrained box of each source
     * @param config    tolerances and iteration cap
     * @return how the run ended and the objective value at the written-back point
     */
    public static OptimizationResult maximizeF(SourceObjective objective, ModelParams mp,
                                               ParameterTransform transform, int[] freeIds,
                                               List<ParamBounds> bounds, OptimizerConfig config) {
        mp.validate();
        if (bounds.size() != mp.numSources()) {
            throw new DimensionMismatchException(bounds.size(), mp.numSources());
        }
        int[] free = checkFreeIds(freeIds);
        assert transform.roundTripHolds(mp) : "Parameter transform does not round-trip the starting point";

        int n = mp.numSources();
        int dim = n * free.length;
        List<double[]> xs = transform.toUnconstrained(mp);
        double[] start = new double[dim];
        double[] lower = new double[dim];
        double[] upper = new double[dim];
        for (int s = 0; s < n; s++) {
            double[][] box = transform.unconstrainedBounds(bounds.get(s), s);
            for (int k = 0; k < free.length; k++) {
                int i = s * free.length + k;
                int id = free[k];
                lower[i] = box[0][id];
                upper[i] = box[1][id];
                start[i] = SourceFitHelper.clamp(xs.get(s)[id], lower[i], upper[i]);
            }
        }

        LOG.info("Maximizing {} free parameters across {} sources ({} transform)",
            dim, n, transform.getType());
        ObjectiveCache cache = new ObjectiveCache(objective, mp, transform, xs, free);
        BoundedLbfgsOptimizer optimizer = new BoundedLbfgsOptimizer(config);
        PointValuePair optimum = optimizer.optimize(
            MaxEval.unlimited(),
            new MaxIter(config.maxIterations),
            new ObjectiveFunction(cache::value),
            new ObjectiveFunctionGradient(cache::gradient),
            GoalType.MAXIMIZE,
            new InitialGuess(start),
            new SimpleBounds(lower, upper));

        transform.toConstrained(cache.unpack(optimum.getPoint()), mp);
        OptimizationResult result = new OptimizationResult(optimizer.getStatus(), optimizer.getIterations(),
            optimizer.getEvaluations(), optimum.getValue());
        if (result.isConverged()) {
            LOG.info("Optimization converged: {}", result);
        } else {
            LOG.warn("Optimization did not converge, keeping best iterate: {}", result);
        }
        return result;
    }

    private static int[] checkFreeIds(int[] freeIds) {
        if (freeIds.length == 0) {
            throw new IllegalArgumentException("At least one parameter must be free");
        }
        int[] sorted = freeIds.clone();
        Arrays.sort(sorted);
        for (int k = 0; k < sorted.length; k++) {
            if (sorted[k] < 0 || sorted[k] >= ParamLayout.SIZE) {
                throw new IllegalArgumentException("Free id out of range: " + sorted[k]);
            }
            if (k > 0 && sorted[k] == sorted[k - 1]) {
                throw new IllegalArgumentException("Duplicate free id: " + sorted[k]);
            }
        }
        return sorted;
    }

    /**
     * Evaluates the objective at packed free coordinates, remembering the last
     * point so the value and gradient calls for one point share an evaluation.
     */
    private static final class ObjectiveCache {

        private final SourceObjective objective;
        private final ModelParams work;
        private final ParameterTransform transform;
        private final List<double[]> pinned;
        private final int[] free;

        private double[] lastPoint;
        private SensitiveFloat lastValue;

        ObjectiveCache(SourceObjective objective, ModelParams start, ParameterTransform transform,
                       List<double[]> pinned, int[] free) {
            this.objective = objective;
            this.work = start.copy();
            this.transform = transform;
            this.pinned = pinned;
            this.free = free;
        }

        double value(double[] z) {
            return evaluate(z).value();
        }

        double[] gradient(double[] z) {
            SensitiveFloat sf = evaluate(z);
            double[] g = new double[z.length];
            for (int s = 0; s < work.numSources(); s++) {
                for (int k = 0; k < free.length; k++) {
                    g[s * free.length + k] = sf.derivative(s, free[k]);
                }
            }
            return g;
        }

        List<double[]> unpack(double[] z) {
            List<double[]> xs = SourceFitHelper.deepCopy(pinned);
            for (int s = 0; s < xs.size(); s++) {
                for (int k = 0; k < free.length; k++) {
                    xs.get(s)[free[k]] = z[s * free.length + k];
                }
            }
            return xs;
        }

        private SensitiveFloat evaluate(double[] z) {
            if (lastPoint != null && Arrays.equals(lastPoint, z)) {
                return lastValue;
            }
            transform.toConstrained(unpack(z), work);
            SensitiveFloat sf = objective.evaluate(work);
            lastValue = transform.transformSensitiveFloat(sf, work);
            lastPoint = z.clone();
            return lastValue;
        }
    }
}
