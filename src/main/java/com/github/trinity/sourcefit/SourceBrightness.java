package com.github.trinity.sourcefit;

import static com.github.trinity.sourcefit.ParamLayout.COLORS;
import static com.github.trinity.sourcefit.ParamLayout.SOURCE_TYPES;

import org.apache.commons.math3.util.FastMath;

/**
 * First and second moments of a source's brightness in one band, per type.
 * <p>
 * The band brightness is log-normal with log-mean
 * {@code m = r1 + sum(s_d c1_d)} and log-variance {@code v = r2 + sum(|s_d| c2_d)},
 * so {@code E[B] = exp(m + v / 2)} and {@code E[B^2] = exp(2m + 2v)}.
 * </p>
 *
 * @author Sean Phillips
 */
final class SourceBrightness {

    private final int band;
    private final double[] expected = new double[SOURCE_TYPES];
    private final double[] expectedSquare = new double[SOURCE_TYPES];

    SourceBrightness(double[] vp, int band) {
        this.band = band;
        for (int i = 0; i < SOURCE_TYPES; i++) {
            double m = vp[ParamLayout.brightnessMean(i)];
            double v = vp[ParamLayout.brightnessVariance(i)];
            for (int d = 0; d < COLORS; d++) {
                int sign = ParamLayout.colorSign(band, d);
                if (sign != 0) {
                    m += sign * vp[ParamLayout.colorMean(d, i)];
                    v += vp[ParamLayout.colorVariance(d, i)];
                }
            }
            expected[i] = FastMath.exp(m + 0.5 * v);
            expectedSquare[i] = FastMath.exp(2.0 * m + 2.0 * v);
        }
    }

    double expected(int type) {
        return expected[type];
    }

    double expectedSquare(int type) {
        return expectedSquare[type];
    }

    /**
     * Adds {@code factor * dE[B]/dtheta} into the single-source scalar {@code target}.
     */
    void addExpectedGradient(int type, SensitiveFloat target, double factor) {
        double e = factor * expected[type];
        addLogMomentGradient(type, target, e, 0.5 * e);
    }

    /**
     * Adds {@code factor * dE[B^2]/dtheta} into the single-source scalar {@code target}.
     */
    void addExpectedSquareGradient(int type, SensitiveFloat target, double factor) {
        double e2 = 2.0 * factor * expectedSquare[type];
        addLogMomentGradient(type, target, e2, e2);
    }

    private void addLogMomentGradient(int type, SensitiveFloat target, double dMean, double dVariance) {
        target.addDerivative(0, ParamLayout.brightnessMean(type), dMean);
        target.addDerivative(0, ParamLayout.brightnessVariance(type), dVariance);
        for (int d = 0; d < COLORS; d++) {
            int sign = ParamLayout.colorSign(band, d);
            if (sign != 0) {
                target.addDerivative(0, ParamLayout.colorMean(d, type), sign * dMean);
                target.addDerivative(0, ParamLayout.colorVariance(d, type), dVariance);
            }
        }
    }
}
