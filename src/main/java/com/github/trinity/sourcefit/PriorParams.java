package com.github.trinity.sourcefit;

import static com.github.trinity.sourcefit.ParamLayout.COLORS;
import static com.github.trinity.sourcefit.ParamLayout.COLOR_COMPONENTS;
import static com.github.trinity.sourcefit.ParamLayout.SOURCE_TYPES;

import org.apache.commons.math3.exception.DimensionMismatchException;
import org.apache.commons.math3.linear.CholeskyDecomposition;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.util.FastMath;

/**
 * Prior distributions shared by every source of a field. Never optimized and
 * never mutated; the {@code with*} methods return modified copies.
 * <ul>
 *   <li><b>indicator</b>: prior probability of each source type.</li>
 *   <li><b>brightness</b>: per-type normal prior on the log reference-band brightness.</li>
 *   <li><b>colorWeights</b>: per-type prior weights of the color mixture components.</li>
 *   <li><b>colorMeans / colorCovariances</b>: per-type, per-component normal prior on the four colors.</li>
 * </ul>
 *
 * @author Sean Phillips
 */
public final class PriorParams {

    private final double[] indicator;
    private final double[] brightnessMean;
    private final double[] brightnessVariance;
    private final double[][] colorWeights;
    private final double[][][] colorMeans;
    private final RealMatrix[][] colorCovariances;

    // Derived from the covariances once.
    private final double[][][][] colorPrecisions;
    private final double[][] colorLogDets;

    public PriorParams(double[] indicator, double[] brightnessMean, double[] brightnessVariance,
                       double[][] colorWeights, double[][][] colorMeans, RealMatrix[][] colorCovariances) {
        checkLength(indicator.length, SOURCE_TYPES);
        checkLength(brightnessMean.length, SOURCE_TYPES);
        checkLength(brightnessVariance.length, SOURCE_TYPES);
        checkLength(colorWeights.length, SOURCE_TYPES);
        checkLength(colorMeans.length, SOURCE_TYPES);
        checkLength(colorCovariances.length, SOURCE_TYPES);
        checkDistribution(indicator, "indicator");

        this.indicator = indicator.clone();
        this.brightnessMean = brightnessMean.clone();
        this.brightnessVariance = brightnessVariance.clone();
        this.colorWeights = new double[SOURCE_TYPES][];
        this.colorMeans = new double[SOURCE_TYPES][COLOR_COMPONENTS][];
        this.colorCovariances = new RealMatrix[SOURCE_TYPES][COLOR_COMPONENTS];
        this.colorPrecisions = new double[SOURCE_TYPES][COLOR_COMPONENTS][][];
        this.colorLogDets = new double[SOURCE_TYPES][COLOR_COMPONENTS];

        for (int i = 0; i < SOURCE_TYPES; i++) {
            if (brightnessVariance[i] <= 0) {
                throw new IllegalArgumentException("Brightness prior variance must be positive");
            }
            checkLength(colorWeights[i].length, COLOR_COMPONENTS);
            checkDistribution(colorWeights[i], "color weights");
            this.colorWeights[i] = colorWeights[i].clone();
            for (int d = 0; d < COLOR_COMPONENTS; d++) {
                checkLength(colorMeans[i][d].length, COLORS);
                RealMatrix cov = colorCovariances[i][d];
                if (cov.getRowDimension() != COLORS || cov.getColumnDimension() != COLORS) {
                    throw new DimensionMismatchException(cov.getRowDimension(), COLORS);
                }
                this.colorMeans[i][d] = colorMeans[i][d].clone();
                this.colorCovariances[i][d] = cov.copy();
                // Throws NonPositiveDefiniteMatrixException for an invalid covariance.
                CholeskyDecomposition chol = new CholeskyDecomposition(cov);
                this.colorPrecisions[i][d] = chol.getSolver().getInverse().getData();
                this.colorLogDets[i][d] = FastMath.log(chol.getDeterminant());
            }
        }
    }

    /**
     * Broad default priors in electron units.
     */
    public static PriorParams defaults() {
        double[][][] means = new double[][][]{
            {{2.43, 1.14, 0.48, 0.28}, {1.0, 0.5, 0.2, 0.1}},
            {{1.5, 1.0, 0.5, 0.3}, {0.9, 0.6, 0.3, 0.2}}
        };
        RealMatrix[][] covs = new RealMatrix[SOURCE_TYPES][COLOR_COMPONENTS];
        for (int i = 0; i < SOURCE_TYPES; i++) {
            for (int d = 0; d < COLOR_COMPONENTS; d++) {
                RealMatrix cov = MatrixUtils.createRealMatrix(COLORS, COLORS);
                for (int r = 0; r < COLORS; r++) {
                    for (int c = 0; c < COLORS; c++) {
                        cov.setEntry(r, c, r == c ? 0.25 : 0.05);
                    }
                }
                covs[i][d] = cov;
            }
        }
        return new PriorParams(
            new double[]{0.72, 0.28},
            new double[]{9.0, 9.0},
            new double[]{9.0, 9.0},
            new double[][]{{0.5, 0.5}, {0.5, 0.5}},
            means,
            covs);
    }

    public PriorParams withIndicator(double[] newIndicator) {
        return new PriorParams(newIndicator, brightnessMean, brightnessVariance, colorWeights, colorMeans,
            colorCovariances);
    }

    public PriorParams withColorWeights(int type, double[] weights) {
        double[][] w = copy(colorWeights);
        w[type] = weights.clone();
        return new PriorParams(indicator, brightnessMean, brightnessVariance, w, colorMeans, colorCovariances);
    }

    public PriorParams withColorCovariance(int type, int component, RealMatrix covariance) {
        RealMatrix[][] c = new RealMatrix[SOURCE_TYPES][];
        for (int i = 0; i < SOURCE_TYPES; i++) {
            c[i] = colorCovariances[i].clone();
        }
        c[type][component] = covariance;
        return new PriorParams(indicator, brightnessMean, brightnessVariance, colorWeights, colorMeans, c);
    }

    // ----- Accessors -----

    public double indicator(int type) {
        return indicator[type];
    }

    public double brightnessMean(int type) {
        return brightnessMean[type];
    }

    public double brightnessVariance(int type) {
        return brightnessVariance[type];
    }

    public double colorWeight(int component, int type) {
        return colorWeights[type][component];
    }

    public double[] colorMean(int component, int type) {
        return colorMeans[type][component].clone();
    }

    public RealMatrix colorCovariance(int component, int type) {
        return colorCovariances[type][component].copy();
    }

    double[][] colorPrecision(int component, int type) {
        return colorPrecisions[type][component];
    }

    double colorLogDet(int component, int type) {
        return colorLogDets[type][component];
    }

    double colorMeanEntry(int color, int component, int type) {
        return colorMeans[type][component][color];
    }

    private static void checkLength(int actual, int expected) {
        if (actual != expected) {
            throw new DimensionMismatchException(actual, expected);
        }
    }

    private static void checkDistribution(double[] p, String what) {
        double total = 0.0;
        for (double v : p) {
            if (!(v > 0.0)) {
                throw new IllegalArgumentException("Prior " + what + " must be strictly positive");
            }
            total += v;
        }
        if (Math.abs(total - 1.0) > 1e-8) {
            throw new IllegalArgumentException("Prior " + what + " must sum to one, got " + total);
        }
    }

    private static double[][] copy(double[][] a) {
        double[][] c = new double[a.length][];
        for (int i = 0; i < a.length; i++) {
            c[i] = a[i].clone();
        }
        return c;
    }
}
