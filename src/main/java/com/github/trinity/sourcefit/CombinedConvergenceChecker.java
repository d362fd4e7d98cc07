package com.github.trinity.sourcefit;

import org.apache.commons.math3.optim.ConvergenceChecker;
import org.apache.commons.math3.optim.PointValuePair;

/**
 * A convergence checker that stops as soon as either:
 * 1. The relative/absolute change in objective value, or
 * 2. The relative/absolute change in every parameter
 * falls below its tolerance. A tolerance of zero disables that half of a test.
 *
 * @author Sean Phillips
 */
public class CombinedConvergenceChecker implements ConvergenceChecker<PointValuePair> {

    private final double relTolValue;
    private final double absTolValue;
    private final double relTolParam;
    private final double absTolParam;

    /**
     * @param relTolValue Relative tolerance for function value change
     * @param absTolValue Absolute tolerance for function value change
     * @param relTolParam Relative tolerance for parameter vector change
     * @param absTolParam Absolute tolerance for parameter vector change
     */
    public CombinedConvergenceChecker(double relTolValue, double absTolValue,
                                      double relTolParam, double absTolParam) {
        this.relTolValue = relTolValue;
        this.absTolValue = absTolValue;
        this.relTolParam = relTolParam;
        this.absTolParam = absTolParam;
    }

    /**
     * Checker for an {@link OptimizerConfig}.
     */
    public static CombinedConvergenceChecker from(OptimizerConfig config) {
        return new CombinedConvergenceChecker(config.relativeValueTolerance, config.absoluteValueTolerance,
            config.relativeStepTolerance, config.absoluteStepTolerance);
    }

    @Override
    public boolean converged(int iteration, PointValuePair previous, PointValuePair current) {
        return valueConverged(previous.getValue(), current.getValue())
            || paramConverged(previous.getPoint(), current.getPoint());
    }

    boolean valueConverged(double prevValue, double currValue) {
        double diffValue = Math.abs(prevValue - currValue);
        double maxValue = Math.max(Math.abs(prevValue), Math.abs(currValue));
        return diffValue <= Math.max(relTolValue * maxValue, absTolValue);
    }

    boolean paramConverged(double[] prevPoint, double[] currPoint) {
        for (int i = 0; i < prevPoint.length; i++) {
            double diff = Math.abs(prevPoint[i] - currPoint[i]);
            double maxAbs = Math.max(Math.abs(prevPoint[i]), Math.abs(currPoint[i]));
            double tol = Math.max(relTolParam * maxAbs, absTolParam);
            if (diff > tol) {
                return false;  // early exit if any component moved
            }
        }
        return true;
    }
}
