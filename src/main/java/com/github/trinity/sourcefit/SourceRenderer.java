package com.github.trinity.sourcefit;

import java.util.ArrayList;
import java.util.List;

import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.util.FastMath;

/**
 * Renders the star and galaxy light profiles of one source on one stamp.
 * <p>
 * Both profiles are Gaussian mixtures in pixel space: the PSF convolved with
 * the position uncertainty, and for galaxies additionally with the de
 * Vaucouleurs and exponential mixtures scaled by the shape matrix
 * {@code W = s^2 R diag(1, rho^2) R^T}. The components are built once per
 * (source, stamp); evaluating a pixel yields each profile's density and its
 * derivatives with respect to the source geometry. {@link #renderSquare}
 * does the same for the profile's second moment over the position uncertainty.
 * </p>
 *
 * @author Sean Phillips
 */
final class SourceRenderer {

    /**
     * Density of one profile at one pixel plus its geometry derivatives.
     */
    static final class ProfileValue {
        double value;
        /** d value / d pixel-space centre. */
        final double[] dCenter = new double[2];
        double dPositionVariance;
        double dDevFraction;
        /** d value / d (axis ratio, angle, scale). */
        final double[] dShape = new double[3];

        void clear() {
            value = 0.0;
            dCenter[0] = 0.0;
            dCenter[1] = 0.0;
            dPositionVariance = 0.0;
            dDevFraction = 0.0;
            dShape[0] = 0.0;
            dShape[1] = 0.0;
            dShape[2] = 0.0;
        }
    }

    /**
     * One mixture term before the position uncertainty is added: weight, pixel
     * offset from the centre, covariance and its shape derivatives.
     */
    private static final class Term {
        final double weight;
        final double dWeightDevFraction;
        final RealVector offset;
        final RealMatrix cov;
        final RealMatrix[] dCov;

        Term(double weight, double dWeightDevFraction, RealVector offset, RealMatrix cov, RealMatrix[] dCov) {
            this.weight = weight;
            this.dWeightDevFraction = dWeightDevFraction;
            this.offset = offset;
            this.cov = cov;
            this.dCov = dCov;
        }
    }

    private final WorldCoordinates wcs;
    private final double[] center;
    private final double positionVariance;
    private final List<Term> starTerms;
    private final List<Term> galaxyTerms;
    private final List<BvnComponent> starComponents;
    private final List<BvnComponent> galaxyComponents;
    private List<BvnComponent> starSquareComponents;
    private List<BvnComponent> galaxySquareComponents;

    SourceRenderer(double[] worldPosition, double positionVariance, double devFraction, double axisRatio,
                   double angle, double scale, ImageStamp stamp) {
        this.wcs = stamp.wcs();
        this.center = wcs.worldToPixel(worldPosition);
        this.positionVariance = positionVariance;
        List<PsfComponent> psf = stamp.psf().componentsAt(center[0], center[1]);

        // Shape matrix and its derivatives.
        double sin = FastMath.sin(angle);
        double cos = FastMath.cos(angle);
        double s2 = scale * scale;
        double rho2 = axisRatio * axisRatio;
        RealMatrix unitShape = symmetric(
            cos * cos + rho2 * sin * sin,
            (1.0 - rho2) * sin * cos,
            sin * sin + rho2 * cos * cos);
        RealMatrix shape = unitShape.scalarMultiply(s2);
        RealMatrix[] dShape = new RealMatrix[3];
        dShape[BvnComponent.D_AXIS] = symmetric(
            2.0 * axisRatio * s2 * sin * sin,
            -2.0 * axisRatio * s2 * sin * cos,
            2.0 * axisRatio * s2 * cos * cos);
        double sin2 = FastMath.sin(2.0 * angle);
        double cos2 = FastMath.cos(2.0 * angle);
        double spread = s2 * (1.0 - rho2);
        dShape[BvnComponent.D_ANGLE] = symmetric(-spread * sin2, spread * cos2, spread * sin2);
        dShape[BvnComponent.D_SCALE] = unitShape.scalarMultiply(2.0 * scale);

        RealMatrix zero = MatrixUtils.createRealMatrix(2, 2);
        RealMatrix[] noShape = {zero, zero, zero};
        this.starTerms = new ArrayList<>(psf.size());
        this.galaxyTerms = new ArrayList<>();
        for (PsfComponent k : psf) {
            RealVector offset = new ArrayRealVector(new double[]{k.offset(0), k.offset(1)});
            RealMatrix psfCov = symmetric(k.sigma11(), k.sigma12(), k.sigma22());
            starTerms.add(new Term(k.weight(), 0.0, offset, psfCov, noShape));

            for (GalaxyProfile profile : GalaxyProfile.values()) {
                double profileWeight = profile == GalaxyProfile.DEV ? devFraction : 1.0 - devFraction;
                double profileSign = profile == GalaxyProfile.DEV ? 1.0 : -1.0;
                for (int j = 0; j < profile.size(); j++) {
                    double nu = profile.variance(j);
                    double base = k.weight() * profile.amplitude(j);
                    RealMatrix[] dCov = new RealMatrix[3];
                    for (int p = 0; p < 3; p++) {
                        dCov[p] = dShape[p].scalarMultiply(nu);
                    }
                    galaxyTerms.add(new Term(base * profileWeight, base * profileSign, offset,
                        psfCov.add(shape.scalarMultiply(nu)), dCov));
                }
            }
        }
        this.starComponents = firstMoment(starTerms);
        this.galaxyComponents = firstMoment(galaxyTerms);
    }

    /**
     * Renderer for a variational parameter vector.
     */
    static SourceRenderer forSource(double[] vp, ImageStamp stamp) {
        return new SourceRenderer(
            new double[]{vp[ParamLayout.position(0)], vp[ParamLayout.position(1)]},
            vp[ParamLayout.positionVariance()],
            vp[ParamLayout.devFraction()],
            vp[ParamLayout.axisRatio()],
            vp[ParamLayout.angle()],
            vp[ParamLayout.scale()],
            stamp);
    }

    /**
     * Renderer for a catalog entry with no position uncertainty.
     */
    static SourceRenderer forEntry(CatalogEntry entry, ImageStamp stamp) {
        return new SourceRenderer(entry.position(), 0.0, entry.devFraction(), entry.axisRatio(),
            entry.angle(), entry.scale(), stamp);
    }

    /**
     * Evaluates both profiles at pixel {@code (h, w)}, overwriting {@code star}
     * and {@code galaxy}.
     */
    void render(int h, int w, ProfileValue star, ProfileValue galaxy) {
        star.clear();
        galaxy.clear();
        for (BvnComponent c : starComponents) {
            c.accumulate(h, w, star, false);
        }
        for (BvnComponent c : galaxyComponents) {
            c.accumulate(h, w, galaxy, true);
        }
    }

    /**
     * Evaluates the expected squares of both profiles over the position
     * uncertainty at pixel {@code (h, w)}, overwriting {@code star} and
     * {@code galaxy}. With zero position variance this is the square of
     * {@link #render}.
     */
    void renderSquare(int h, int w, ProfileValue star, ProfileValue galaxy) {
        if (starSquareComponents == null) {
            starSquareComponents = secondMoment(starTerms);
            galaxySquareComponents = secondMoment(galaxyTerms);
        }
        star.clear();
        galaxy.clear();
        for (BvnComponent c : starSquareComponents) {
            c.accumulate(h, w, star, false);
        }
        for (BvnComponent c : galaxySquareComponents) {
            c.accumulate(h, w, galaxy, true);
        }
    }

    /**
     * Adds {@code factor} times the geometry gradient of {@code profile} into
     * the single-source scalar {@code target}. The pixel-space centre
     * derivative is pulled back to world coordinates.
     */
    void addGeometryGradient(ProfileValue profile, SensitiveFloat target, double factor) {
        for (int j = 0; j < 2; j++) {
            double d = profile.dCenter[0] * wcs.jacobian(0, j) + profile.dCenter[1] * wcs.jacobian(1, j);
            target.addDerivative(0, ParamLayout.position(j), factor * d);
        }
        target.addDerivative(0, ParamLayout.positionVariance(), factor * profile.dPositionVariance);
        target.addDerivative(0, ParamLayout.devFraction(), factor * profile.dDevFraction);
        target.addDerivative(0, ParamLayout.axisRatio(), factor * profile.dShape[BvnComponent.D_AXIS]);
        target.addDerivative(0, ParamLayout.angle(), factor * profile.dShape[BvnComponent.D_ANGLE]);
        target.addDerivative(0, ParamLayout.scale(), factor * profile.dShape[BvnComponent.D_SCALE]);
    }

    private List<BvnComponent> firstMoment(List<Term> terms) {
        List<BvnComponent> components = new ArrayList<>(terms.size());
        for (Term t : terms) {
            double[][] dCov = new double[3][];
            for (int p = 0; p < 3; p++) {
                dCov[p] = entries(t.dCov[p]);
            }
            components.add(component(t.weight, t.dWeightDevFraction, t.offset, t.cov, dCov,
                new double[3][2], new double[3]));
        }
        return components;
    }

    /**
     * The square of a mixture is the mixture of its pairwise products, and
     * the product of two Gaussians in the pixel is a scaled Gaussian whose
     * mean moves with the source centre. Averaging over the centre adds the
     * position variance to each product's covariance.
     */
    private List<BvnComponent> secondMoment(List<Term> terms) {
        List<BvnComponent> components = new ArrayList<>(terms.size() * (terms.size() + 1) / 2);
        for (int j = 0; j < terms.size(); j++) {
            for (int k = j; k < terms.size(); k++) {
                components.add(product(terms.get(j), terms.get(k), j == k ? 1.0 : 2.0));
            }
        }
        return components;
    }

    private BvnComponent product(Term a, Term b, double multiplicity) {
        RealMatrix aInv = MatrixUtils.inverse(a.cov);
        RealMatrix bInv = MatrixUtils.inverse(b.cov);
        RealMatrix sum = a.cov.add(b.cov);
        RealMatrix sumInv = MatrixUtils.inverse(sum);
        RealMatrix cov = MatrixUtils.inverse(aInv.add(bInv));
        RealVector rhs = aInv.operate(a.offset).add(bInv.operate(b.offset));
        RealVector mean = cov.operate(rhs);

        // Overlap N(o_a - o_b; 0, S_a + S_b) of the two factors.
        RealVector delta = a.offset.subtract(b.offset);
        RealVector sd = sumInv.operate(delta);
        double det = sum.getEntry(0, 0) * sum.getEntry(1, 1) - sum.getEntry(0, 1) * sum.getEntry(1, 0);
        double overlap = FastMath.exp(-0.5 * delta.dotProduct(sd)) / (2.0 * FastMath.PI * FastMath.sqrt(det));
        double g11 = 0.5 * (sd.getEntry(0) * sd.getEntry(0) - sumInv.getEntry(0, 0));
        double g12 = sd.getEntry(0) * sd.getEntry(1) - sumInv.getEntry(0, 1);
        double g22 = 0.5 * (sd.getEntry(1) * sd.getEntry(1) - sumInv.getEntry(1, 1));

        double weights = a.weight * b.weight;
        double dWeightDevFraction = multiplicity * overlap
            * (a.dWeightDevFraction * b.weight + a.weight * b.dWeightDevFraction);
        double[][] dCov = new double[3][];
        double[][] dMean = new double[3][];
        double[] dWeight = new double[3];
        for (int p = 0; p < 3; p++) {
            RealMatrix dSum = a.dCov[p].add(b.dCov[p]);
            double dOverlap = overlap * (g11 * dSum.getEntry(0, 0) + g12 * dSum.getEntry(0, 1)
                + g22 * dSum.getEntry(1, 1));
            dWeight[p] = multiplicity * weights * dOverlap;

            RealMatrix aTerm = aInv.multiply(a.dCov[p]).multiply(aInv);
            RealMatrix bTerm = bInv.multiply(b.dCov[p]).multiply(bInv);
            RealMatrix dProductCov = cov.multiply(aTerm.add(bTerm)).multiply(cov);
            RealVector dRhs = aTerm.operate(a.offset).add(bTerm.operate(b.offset));
            RealVector dProductMean = dProductCov.operate(rhs).subtract(cov.operate(dRhs));
            dCov[p] = entries(dProductCov);
            dMean[p] = dProductMean.toArray();
        }
        return component(multiplicity * overlap * weights, dWeightDevFraction, mean, cov, dCov, dMean, dWeight);
    }

    private BvnComponent component(double weight, double dWeightDevFraction, RealVector offset, RealMatrix cov,
                                   double[][] dCov, double[][] dMean, double[] dWeight) {
        return new BvnComponent(weight, dWeightDevFraction,
            center[0] + offset.getEntry(0), center[1] + offset.getEntry(1),
            cov.getEntry(0, 0) + positionVariance, cov.getEntry(0, 1), cov.getEntry(1, 1) + positionVariance,
            dCov, dMean, dWeight);
    }

    private static RealMatrix symmetric(double c11, double c12, double c22) {
        return MatrixUtils.createRealMatrix(new double[][]{{c11, c12}, {c12, c22}});
    }

    // [c11, c12, c22]
    private static double[] entries(RealMatrix m) {
        return new double[]{m.getEntry(0, 0), m.getEntry(0, 1), m.getEntry(1, 1)};
    }
}
