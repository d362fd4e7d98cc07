package com.github.trinity.sourcefit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.apache.commons.math3.analysis.MultivariateFunction;
import org.apache.commons.math3.analysis.MultivariateVectorFunction;
import org.apache.commons.math3.optim.InitialGuess;
import org.apache.commons.math3.optim.MaxEval;
import org.apache.commons.math3.optim.MaxIter;
import org.apache.commons.math3.optim.PointValuePair;
import org.apache.commons.math3.optim.SimpleBounds;
import org.apache.commons.math3.optim.nonlinear.scalar.GoalType;
import org.apache.commons.math3.optim.nonlinear.scalar.ObjectiveFunction;
import org.apache.commons.math3.optim.nonlinear.scalar.ObjectiveFunctionGradient;
import org.junit.jupiter.api.Test;

class BoundedLbfgsOptimizerTest {

    private static final MultivariateFunction ROSENBROCK = p ->
        100 * Math.pow(p[1] - p[0] * p[0], 2) + Math.pow(1 - p[0], 2);

    private static final MultivariateVectorFunction ROSENBROCK_GRADIENT = p -> new double[]{
        -400 * p[0] * (p[1] - p[0] * p[0]) - 2 * (1 - p[0]),
        200 * (p[1] - p[0] * p[0])
    };

    private static BoundedLbfgsOptimizer optimizer() {
        return new BoundedLbfgsOptimizer(10, 1e-8, 1e-4, 40, null);
    }

    @Test
    void minimizesRosenbrock() {
        BoundedLbfgsOptimizer optimizer = optimizer();
        PointValuePair result = optimizer.optimize(
            new MaxEval(100000), new MaxIter(1000),
            new ObjectiveFunction(ROSENBROCK), new ObjectiveFunctionGradient(ROSENBROCK_GRADIENT),
            GoalType.MINIMIZE, new InitialGuess(new double[]{-1.2, 1.0}));

        assertEquals(1.0, result.getPoint()[0], 1e-4);
        assertEquals(1.0, result.getPoint()[1], 1e-4);
        assertEquals(0.0, result.getValue(), 1e-8);
        assertTrue(optimizer.getStatus() != BoundedLbfgsOptimizer.Status.MAX_ITERATIONS);
    }

    @Test
    void stopsOnActiveBounds() {
        BoundedLbfgsOptimizer optimizer = optimizer();
        PointValuePair result = optimizer.optimize(
            MaxEval.unlimited(), new MaxIter(200),
            new ObjectiveFunction(p -> Math.pow(p[0] - 3, 2) + Math.pow(p[1] + 1, 2)),
            new ObjectiveFunctionGradient(p -> new double[]{2 * (p[0] - 3), 2 * (p[1] + 1)}),
            GoalType.MINIMIZE, new InitialGuess(new double[]{0.0, 0.0}),
            new SimpleBounds(new double[]{Double.NEGATIVE_INFINITY, -0.5}, new double[]{1.0, 2.0}));

        assertEquals(1.0, result.getPoint()[0], 1e-10);
        assertEquals(-0.5, result.getPoint()[1], 1e-10);
        assertEquals(4.25, result.getValue(), 1e-10);
        assertEquals(BoundedLbfgsOptimizer.Status.CONVERGED, optimizer.getStatus());
    }

    @Test
    void maximizesWhenAsked() {
        BoundedLbfgsOptimizer optimizer = optimizer();
        PointValuePair result = optimizer.optimize(
            MaxEval.unlimited(), new MaxIter(200),
            new ObjectiveFunction(p -> 5 - Math.pow(p[0] - 2, 2) - 3 * Math.pow(p[1] - 1, 2)),
            new ObjectiveFunctionGradient(p -> new double[]{-2 * (p[0] - 2), -6 * (p[1] - 1)}),
            GoalType.MAXIMIZE, new InitialGuess(new double[]{-4.0, 7.0}));

        assertEquals(2.0, result.getPoint()[0], 1e-8);
        assertEquals(1.0, result.getPoint()[1], 1e-8);
        assertEquals(5.0, result.getValue(), 1e-12);
    }

    @Test
    void rejectsNonFiniteTrialPoints() {
        BoundedLbfgsOptimizer optimizer = optimizer();
        // Undefined past 1.5, so the best reachable point sits on that edge.
        PointValuePair result = optimizer.optimize(
            MaxEval.unlimited(), new MaxIter(500),
            new ObjectiveFunction(p -> p[0] <= 1.5 ? Math.pow(p[0] - 2, 2) : Double.NaN),
            new ObjectiveFunctionGradient(p -> new double[]{2 * (p[0] - 2)}),
            GoalType.MINIMIZE, new InitialGuess(new double[]{0.0}));

        assertTrue(result.getPoint()[0] <= 1.5);
        assertTrue(result.getPoint()[0] > 1.49);
        assertTrue(Double.isFinite(result.getValue()));
        assertNotNull(optimizer.getStatus());
    }

    @Test
    void returnsBestPointWhenIterationsRunOut() {
        BoundedLbfgsOptimizer optimizer = optimizer();
        double[] start = {-1.2, 1.0};
        PointValuePair result = optimizer.optimize(
            MaxEval.unlimited(), new MaxIter(3),
            new ObjectiveFunction(ROSENBROCK), new ObjectiveFunctionGradient(ROSENBROCK_GRADIENT),
            GoalType.MINIMIZE, new InitialGuess(start));

        assertEquals(BoundedLbfgsOptimizer.Status.MAX_ITERATIONS, optimizer.getStatus());
        assertEquals(3, optimizer.getIterations());
        assertTrue(result.getValue() < ROSENBROCK.value(start));
        assertEquals(ROSENBROCK.value(result.getPoint()), result.getValue(), 1e-12);
    }

    @Test
    void convergenceCheckerStopsEarly() {
        OptimizerConfig config = new OptimizerConfig(1000, 1e-2, 0.0);
        BoundedLbfgsOptimizer optimizer = new BoundedLbfgsOptimizer(config);
        optimizer.optimize(
            MaxEval.unlimited(), new MaxIter(config.maxIterations),
            new ObjectiveFunction(ROSENBROCK), new ObjectiveFunctionGradient(ROSENBROCK_GRADIENT),
            GoalType.MINIMIZE, new InitialGuess(new double[]{-1.2, 1.0}));

        assertEquals(BoundedLbfgsOptimizer.Status.CONVERGED, optimizer.getStatus());
        assertTrue(optimizer.getIterations() < 1000);
    }

    @Test
    void nonFiniteStartIsAnError() {
        BoundedLbfgsOptimizer optimizer = optimizer();
        assertThrows(IllegalStateException.class, () -> optimizer.optimize(
            MaxEval.unlimited(), new MaxIter(10),
            new ObjectiveFunction(p -> Math.log(p[0])),
            new ObjectiveFunctionGradient(p -> new double[]{1 / p[0]}),
            GoalType.MINIMIZE, new InitialGuess(new double[]{-1.0})));
        assertThrows(IllegalArgumentException.class, () -> new BoundedLbfgsOptimizer(0, 1e-8, 1e-4, 40, null));
    }

    @Test
    void checkerAcceptsEitherValueOrStepCriterion() {
        CombinedConvergenceChecker checker = new CombinedConvergenceChecker(0.0, 1e-3, 1e-6, 0.0);
        assertTrue(checker.valueConverged(10.0, 10.0005));
        assertFalse(checker.valueConverged(10.0, 10.01));
        assertTrue(checker.paramConverged(new double[]{1.0, 2.0}, new double[]{1.0 + 1e-7, 2.0}));
        assertFalse(checker.paramConverged(new double[]{1.0, 2.0}, new double[]{1.0, 2.1}));

        // Large value change, tiny step: still converged.
        assertTrue(checker.converged(1,
            new PointValuePair(new double[]{1.0}, 0.0), new PointValuePair(new double[]{1.0}, 5.0)));
        assertFalse(checker.converged(1,
            new PointValuePair(new double[]{1.0}, 0.0), new PointValuePair(new double[]{2.0}, 5.0)));
    }
}
