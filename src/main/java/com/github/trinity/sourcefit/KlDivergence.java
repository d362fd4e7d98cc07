package com.github.trinity.sourcefit;

import static com.github.trinity.sourcefit.ParamLayout.COLORS;
import static com.github.trinity.sourcefit.ParamLayout.COLOR_COMPONENTS;
import static com.github.trinity.sourcefit.ParamLayout.SOURCE_TYPES;

import org.apache.commons.math3.util.FastMath;

/**
 * Closed-form KL divergences between each source's variational factors and the
 * priors. Every method subtracts its term, with gradient, from an accumulator
 * indexed by source.
 *
 * @author Sean Phillips
 */
public final class KlDivergence {

    private KlDivergence() {
    }

    /**
     * Subtracts every KL term of every source.
     */
    public static void subtractKl(ModelParams mp, SensitiveFloat accum) {
        for (int s = 0; s < mp.numSources(); s++) {
            subtractKlIndicator(s, mp, accum);
            for (int i = 0; i < SOURCE_TYPES; i++) {
                subtractKlBrightness(i, s, mp, accum);
                subtractKlColorWeights(i, s, mp, accum);
                for (int d = 0; d < COLOR_COMPONENTS; d++) {
                    subtractKlColor(d, i, s, mp, accum);
                }
            }
        }
    }

    /**
     * Categorical KL of the type indicator: {@code sum_i a_i log(a_i / pi_i)}.
     */
    public static void subtractKlIndicator(int s, ModelParams mp, SensitiveFloat accum) {
        double[] vp = mp.source(s);
        PriorParams priors = mp.priors();
        for (int i = 0; i < SOURCE_TYPES; i++) {
            double a = vp[ParamLayout.indicator(i)];
            double logRatio = SourceFitHelper.safeLog(a) - FastMath.log(priors.indicator(i));
            accum.addValue(-SourceFitHelper.xLogXOverY(a, priors.indicator(i)));
            accum.addDerivative(s, ParamLayout.indicator(i), -(logRatio + 1.0));
        }
    }

    /**
     * Categorical KL of the color-mixture responsibilities of type {@code i},
     * weighted by the type probability.
     */
    public static void subtractKlColorWeights(int i, int s, ModelParams mp, SensitiveFloat accum) {
        double[] vp = mp.source(s);
        PriorParams priors = mp.priors();
        double a = vp[ParamLayout.indicator(i)];
        double kl = 0.0;
        for (int d = 0; d < COLOR_COMPONENTS; d++) {
            double k = vp[ParamLayout.colorWeight(d, i)];
            double kappa = priors.colorWeight(d, i);
            kl += SourceFitHelper.xLogXOverY(k, kappa);
            double logRatio = SourceFitHelper.safeLog(k) - FastMath.log(kappa);
            accum.addDerivative(s, ParamLayout.colorWeight(d, i), -a * (logRatio + 1.0));
        }
        accum.addValue(-a * kl);
        accum.addDerivative(s, ParamLayout.indicator(i), -kl);
    }

    /**
     * KL between the diagonal Gaussian over colors of type {@code i} and
     * component {@code d} of the color prior, weighted by {@code a_i k_{d,i}}.
     */
    public static void subtractKlColor(int d, int i, int s, ModelParams mp, SensitiveFloat accum) {
        double[] vp = mp.source(s);
        PriorParams priors = mp.priors();
        double[][] precision = priors.colorPrecision(d, i);
        double a = vp[ParamLayout.indicator(i)];
        double k = vp[ParamLayout.colorWeight(d, i)];
        double weight = a * k;

        double[] diff = new double[COLORS];
        for (int c = 0; c < COLORS; c++) {
            diff[c] = vp[ParamLayout.colorMean(c, i)] - priors.colorMeanEntry(c, d, i);
        }
        double trace = 0.0;
        double mahalanobis = 0.0;
        double logVariances = 0.0;
        for (int c = 0; c < COLORS; c++) {
            double variance = vp[ParamLayout.colorVariance(c, i)];
            trace += variance * precision[c][c];
            logVariances += FastMath.log(variance);
            double pd = 0.0;
            for (int e = 0; e < COLORS; e++) {
                pd += precision[c][e] * diff[e];
            }
            mahalanobis += diff[c] * pd;
            accum.addDerivative(s, ParamLayout.colorMean(c, i), -weight * pd);
            accum.addDerivative(s, ParamLayout.colorVariance(c, i),
                -weight * 0.5 * (precision[c][c] - 1.0 / variance));
        }
        double kl = 0.5 * (trace + mahalanobis - COLORS + priors.colorLogDet(d, i) - logVariances);

        accum.addValue(-weight * kl);
        accum.addDerivative(s, ParamLayout.indicator(i), -k * kl);
        accum.addDerivative(s, ParamLayout.colorWeight(d, i), -a * kl);
    }

    /**
     * KL between the normal over log reference brightness of type {@code i} and
     * its prior, weighted by the type probability.
     */
    public static void subtractKlBrightness(int i, int s, ModelParams mp, SensitiveFloat accum) {
        double[] vp = mp.source(s);
        PriorParams priors = mp.priors();
        double a = vp[ParamLayout.indicator(i)];
        double mean = vp[ParamLayout.brightnessMean(i)];
        double variance = vp[ParamLayout.brightnessVariance(i)];
        double priorMean = priors.brightnessMean(i);
        double priorVariance = priors.brightnessVariance(i);

        double diff = mean - priorMean;
        double kl = 0.5 * ((variance + diff * diff) / priorVariance - 1.0
            + FastMath.log(priorVariance) - FastMath.log(variance));

        accum.addValue(-a * kl);
        accum.addDerivative(s, ParamLayout.indicator(i), -kl);
        accum.addDerivative(s, ParamLayout.brightnessMean(i), -a * diff / priorVariance);
        accum.addDerivative(s, ParamLayout.brightnessVariance(i), -a * 0.5 * (1.0 / priorVariance - 1.0 / variance));
    }
}
