package com.github.trinity.sourcefit;

/**
 * Configuration class for controlling the behavior of an ELBO maximization run.
 *
 * <ul>
 *   <li><b>maxIterations</b>: The maximum number of quasi-Newton iterations.</li>
 *   <li><b>absoluteValueTolerance / relativeValueTolerance</b>: Stop when one
 *       iteration changes the objective by less than this.</li>
 *   <li><b>relativeStepTolerance / absoluteStepTolerance</b>: Stop when one
 *       iteration moves every unconstrained coordinate by less than this.</li>
 *   <li><b>gradientTolerance</b>: Stop when the largest projected gradient
 *       entry falls below this.</li>
 *   <li><b>memory</b>: Number of correction pairs kept by the L-BFGS update.</li>
 *   <li><b>positionRadius</b>: How far, in world units, the default box lets a
 *       source move from where it started.</li>
 * </ul>
 *
 * @author Sean Phillips
 */
public class OptimizerConfig {

    public int maxIterations = 1000;

    public double absoluteValueTolerance = 1e-6;

    public double relativeValueTolerance = 0.0;

    public double relativeStepTolerance = 1e-7;

    public double absoluteStepTolerance = 0.0;

    public double gradientTolerance = 1e-8;

    public int memory = 10;

    /**
     * Armijo sufficient-decrease constant of the backtracking line search.
     */
    public double sufficientDecrease = 1e-4;

    public int maxLineSearchSteps = 40;

    public double positionRadius = 1.0;

    public ParameterTransform.Type transform = ParameterTransform.Type.RECTANGULAR;

    // Constructor with defaults
    public OptimizerConfig() {
    }

    // Constructor for convenience
    public OptimizerConfig(int maxIterations, double absoluteValueTolerance, double relativeStepTolerance) {
        this.maxIterations = maxIterations;
        this.absoluteValueTolerance = absoluteValueTolerance;
        this.relativeStepTolerance = relativeStepTolerance;
    }
}
