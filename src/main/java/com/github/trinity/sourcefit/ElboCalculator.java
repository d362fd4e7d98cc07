package com.github.trinity.sourcefit;

import static com.github.trinity.sourcefit.ParamLayout.SOURCE_TYPES;

import java.util.List;

import org.apache.commons.math3.exception.DimensionMismatchException;
import org.apache.commons.math3.util.FastMath;

/**
 * Evidence lower bound of a set of image stamps under the variational
 * distribution, with its exact gradient over every source's constrained
 * parameters.
 * <p>
 * The expected log-likelihood treats each observed pixel as Gaussian with the
 * stamp's per-pixel variance. Its expectation uses the first two moments of
 * the rendered flux, the second taken over brightness, type and position
 * jointly; sources add in expected-flux space and their variances add. Pixels are visited stamp by stamp, row-major, and sources in list order
 * so sums are reproducible.
 * </p>
 *
 * @author Sean Phillips
 */
public final class ElboCalculator {

    private static final double LOG_TWO_PI = FastMath.log(2.0 * FastMath.PI);

    private ElboCalculator() {
    }

    public static SensitiveFloat elbo(List<ImageStamp> stamps, ModelParams mp) {
        return elbo(stamps, mp, SourcePatch.forModel(mp, stamps));
    }

    /**
     * Expected log-likelihood minus the KL divergence of every source from the priors.
     */
    public static SensitiveFloat elbo(List<ImageStamp> stamps, ModelParams mp, List<SourcePatch> patches) {
        SensitiveFloat accum = elboLikelihood(stamps, mp, patches);
        KlDivergence.subtractKl(mp, accum);
        return accum;
    }

    public static SensitiveFloat elboLikelihood(List<ImageStamp> stamps, ModelParams mp) {
        return elboLikelihood(stamps, mp, SourcePatch.forModel(mp, stamps));
    }

    /**
     * Expected log-likelihood alone.
     *
     * @throws DimensionMismatchException if a parameter vector has the wrong
     *                                    length or the patch count differs from the source count
     * @throws IllegalArgumentException   if there are no stamps or a source
     *                                    touches no pixel of any stamp
     */
    public static SensitiveFloat elboLikelihood(List<ImageStamp> stamps, ModelParams mp,
                                                List<SourcePatch> patches) {
        mp.validate();
        if (stamps.isEmpty()) {
            throw new IllegalArgumentException("At least one image stamp is required");
        }
        if (patches.size() != mp.numSources()) {
            throw new DimensionMismatchException(patches.size(), mp.numSources());
        }
        int n = mp.numSources();
        int[][][] ranges = new int[stamps.size()][n][];
        for (int s = 0; s < n; s++) {
            boolean touches = false;
            for (int b = 0; b < stamps.size(); b++) {
                ranges[b][s] = patches.get(s).pixelRange(stamps.get(b));
                touches |= ranges[b][s] != null;
            }
            if (!touches) {
                throw new IllegalArgumentException("Source " + s + " does not overlap any image stamp");
            }
        }

        SensitiveFloat accum = SensitiveFloat.zero(n);
        for (int b = 0; b < stamps.size(); b++) {
            accumulateStamp(stamps.get(b), mp, ranges[b], accum);
        }
        return accum;
    }

    private static void accumulateStamp(ImageStamp stamp, ModelParams mp, int[][] ranges, SensitiveFloat accum) {
        int n = mp.numSources();
        SourceRenderer[] renderers = new SourceRenderer[n];
        SourceBrightness[] brightness = new SourceBrightness[n];
        SensitiveFloat[] mean = new SensitiveFloat[n];
        SensitiveFloat[] second = new SensitiveFloat[n];
        for (int s = 0; s < n; s++) {
            if (ranges[s] != null) {
                renderers[s] = SourceRenderer.forSource(mp.source(s), stamp);
                brightness[s] = new SourceBrightness(mp.source(s), stamp.band());
                mean[s] = SensitiveFloat.zero();
                second[s] = SensitiveFloat.zero();
            }
        }
        SourceRenderer.ProfileValue star = new SourceRenderer.ProfileValue();
        SourceRenderer.ProfileValue galaxy = new SourceRenderer.ProfileValue();
        SourceRenderer.ProfileValue starSquare = new SourceRenderer.ProfileValue();
        SourceRenderer.ProfileValue galaxySquare = new SourceRenderer.ProfileValue();
        boolean[] active = new boolean[n];

        for (int h = 0; h < stamp.height(); h++) {
            for (int w = 0; w < stamp.width(); w++) {
                if (!stamp.isObserved(h, w)) {
                    continue;
                }
                double expected = stamp.sky();
                double variance = 0.0;
                for (int s = 0; s < n; s++) {
                    int[] r = ranges[s];
                    active[s] = r != null && h >= r[0] && h <= r[1] && w >= r[2] && w <= r[3];
                    if (!active[s]) {
                        continue;
                    }
                    renderers[s].render(h, w, star, galaxy);
                    renderers[s].renderSquare(h, w, starSquare, galaxySquare);
                    sourceMoments(mp.source(s), renderers[s], brightness[s], star, galaxy, starSquare,
                        galaxySquare, mean[s], second[s]);
                    expected += mean[s].value();
                    variance += second[s].value() - mean[s].value() * mean[s].value();
                }

                double sigma2 = stamp.variance(h, w);
                double residual = stamp.pixel(h, w) - expected;
                accum.addValue(-0.5 * (LOG_TWO_PI + FastMath.log(sigma2))
                    - 0.5 * (residual * residual + variance) / sigma2);
                for (int s = 0; s < n; s++) {
                    if (active[s]) {
                        accum.addGradient(mean[s], s, (residual + mean[s].value()) / sigma2);
                        accum.addGradient(second[s], s, -0.5 / sigma2);
                    }
                }
            }
        }
    }

    /**
     * Fills {@code mean} with {@code E[F_s]} and {@code second} with {@code E[F_s^2]}
     * at one pixel. {@code star} and {@code galaxy} hold the profiles averaged
     * over the position uncertainty, {@code starSquare} and {@code galaxySquare}
     * the averages of their squares.
     */
    private static void sourceMoments(double[] vp, SourceRenderer renderer, SourceBrightness brightness,
                                      SourceRenderer.ProfileValue star, SourceRenderer.ProfileValue galaxy,
                                      SourceRenderer.ProfileValue starSquare,
                                      SourceRenderer.ProfileValue galaxySquare,
                                      SensitiveFloat mean, SensitiveFloat second) {
        mean.clear();
        second.clear();
        for (int i = 0; i < SOURCE_TYPES; i++) {
            SourceRenderer.ProfileValue profile = i == ParamLayout.STAR ? star : galaxy;
            SourceRenderer.ProfileValue square = i == ParamLayout.STAR ? starSquare : galaxySquare;
            double g = profile.value;
            double g2 = square.value;
            double a = vp[ParamLayout.indicator(i)];
            double eb = brightness.expected(i);
            double eb2 = brightness.expectedSquare(i);

            mean.addValue(a * eb * g);
            mean.addDerivative(0, ParamLayout.indicator(i), eb * g);
            brightness.addExpectedGradient(i, mean, a * g);
            renderer.addGeometryGradient(profile, mean, a * eb);

            second.addValue(a * eb2 * g2);
            second.addDerivative(0, ParamLayout.indicator(i), eb2 * g2);
            brightness.addExpectedSquareGradient(i, second, a * g2);
            renderer.addGeometryGradient(square, second, a * eb2);
        }
    }
}
