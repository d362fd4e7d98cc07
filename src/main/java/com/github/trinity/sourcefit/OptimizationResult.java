package com.github.trinity.sourcefit;

/**
 * Outcome of one maximization run. The optimized parameters are written back
 * into the {@link ModelParams} that was passed in; this carries the rest.
 *
 * @author Sean Phillips
 */
public class OptimizationResult {

    private final BoundedLbfgsOptimizer.Status status;
    private final int iterations;
    private final int evaluations;
    private final double value;

    public OptimizationResult(BoundedLbfgsOptimizer.Status status, int iterations, int evaluations, double value) {
        this.status = status;
        this.iterations = iterations;
        this.evaluations = evaluations;
        this.value = value;
    }

    public boolean isConverged() {
        return status == BoundedLbfgsOptimizer.Status.CONVERGED;
    }

    public BoundedLbfgsOptimizer.Status getStatus() {
        return status;
    }

    public int getIterations() {
        return iterations;
    }

    public int getEvaluations() {
        return evaluations;
    }

    /**
     * Objective value at the returned parameters.
     */
    public double getValue() {
        return value;
    }

    @Override
    public String toString() {
        return "OptimizationResult{status=" + status + ", iterations=" + iterations
            + ", evaluations=" + evaluations + ", value=" + value + "}";
    }
}
