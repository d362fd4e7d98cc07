package com.github.trinity.sourcefit;

import org.apache.commons.math3.util.FastMath;

/**
 * A weighted bivariate normal in pixel space, with the bookkeeping needed to
 * differentiate its density with respect to the source geometry.
 * <p>
 * The mean is the source centre plus an offset, and the covariance is a
 * shape-dependent part plus the isotropic position variance. {@code dCov},
 * {@code dMean} and {@code dWeight} hold the derivatives of the covariance,
 * the offset and the weight with respect to axis ratio, angle and scale.
 * </p>
 *
 * @author Sean Phillips
 */
final class BvnComponent {

    static final int D_AXIS = 0;
    static final int D_ANGLE = 1;
    static final int D_SCALE = 2;

    /** Densities below {@code exp(-CUTOFF / 2)} of the peak are treated as zero. */
    private static final double CUTOFF = 100.0;

    final double weight;
    final double dWeightDevFraction;
    final double meanX;
    final double meanY;
    final double precision11;
    final double precision12;
    final double precision22;
    final double normalizer;
    // [param][c11, c12, c22]
    final double[][] dCov;
    // [param][x, y]
    final double[][] dMean;
    final double[] dWeight;

    BvnComponent(double weight, double dWeightDevFraction, double meanX, double meanY,
                 double c11, double c12, double c22, double[][] dCov) {
        this(weight, dWeightDevFraction, meanX, meanY, c11, c12, c22, dCov, new double[3][2], new double[3]);
    }

    BvnComponent(double weight, double dWeightDevFraction, double meanX, double meanY,
                 double c11, double c12, double c22, double[][] dCov, double[][] dMean, double[] dWeight) {
        double det = c11 * c22 - c12 * c12;
        if (!(det > 0)) {
            throw new IllegalStateException("Component covariance is not positive definite: det = " + det);
        }
        this.weight = weight;
        this.dWeightDevFraction = dWeightDevFraction;
        this.meanX = meanX;
        this.meanY = meanY;
        this.precision11 = c22 / det;
        this.precision12 = -c12 / det;
        this.precision22 = c11 / det;
        this.normalizer = 1.0 / (2.0 * FastMath.PI * FastMath.sqrt(det));
        this.dCov = dCov;
        this.dMean = dMean;
        this.dWeight = dWeight;
    }

    /**
     * Adds this component's weighted density at {@code (x, y)} and its
     * derivatives into {@code out}.
     *
     * @param withShape whether to fill the dev-fraction and shape derivatives
     */
    void accumulate(double x, double y, SourceRenderer.ProfileValue out, boolean withShape) {
        double zx = x - meanX;
        double zy = y - meanY;
        double pzx = precision11 * zx + precision12 * zy;
        double pzy = precision12 * zx + precision22 * zy;
        double q = zx * pzx + zy * pzy;
        if (q > CUTOFF) {
            return;
        }
        double density = normalizer * FastMath.exp(-0.5 * q);
        double wd = weight * density;

        out.value += wd;
        out.dCenter[0] += wd * pzx;
        out.dCenter[1] += wd * pzy;

        // d log N / d c11, d c12 (both off-diagonal slots), d c22
        double g11 = 0.5 * (pzx * pzx - precision11);
        double g12 = pzx * pzy - precision12;
        double g22 = 0.5 * (pzy * pzy - precision22);
        out.dPositionVariance += wd * (g11 + g22);

        if (withShape) {
            out.dDevFraction += dWeightDevFraction * density;
            for (int p = 0; p < 3; p++) {
                double[] dc = dCov[p];
                double[] dm = dMean[p];
                out.dShape[p] += wd * (g11 * dc[0] + g12 * dc[1] + g22 * dc[2] + pzx * dm[0] + pzy * dm[1])
                    + dWeight[p] * density;
            }
        }
    }
}
