package com.github.trinity.sourcefit;

/**
 * One weighted bivariate Gaussian of a point-spread function, in pixel units.
 * Covariance is stored as its three distinct entries.
 *
 * @author Sean Phillips
 */
public class PsfComponent {

    private final double weight;
    private final double[] offset;
    private final double sigma11;
    private final double sigma12;
    private final double sigma22;

    public PsfComponent(double weight, double[] offset, double sigma11, double sigma12, double sigma22) {
        if (sigma11 <= 0 || sigma22 <= 0 || sigma11 * sigma22 - sigma12 * sigma12 <= 0) {
            throw new IllegalArgumentException("PSF component covariance must be positive definite");
        }
        this.weight = weight;
        this.offset = offset.clone();
        this.sigma11 = sigma11;
        this.sigma12 = sigma12;
        this.sigma22 = sigma22;
    }

    public double weight() {
        return weight;
    }

    public double offset(int axis) {
        return offset[axis];
    }

    public double sigma11() {
        return sigma11;
    }

    public double sigma12() {
        return sigma12;
    }

    public double sigma22() {
        return sigma22;
    }

    /**
     * Largest eigenvalue of the covariance.
     */
    public double maxVariance() {
        double mean = 0.5 * (sigma11 + sigma22);
        double diff = 0.5 * (sigma11 - sigma22);
        return mean + Math.sqrt(diff * diff + sigma12 * sigma12);
    }
}
