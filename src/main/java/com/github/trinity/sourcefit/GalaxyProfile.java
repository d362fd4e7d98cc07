package com.github.trinity.sourcefit;

/**
 * Gaussian-mixture approximations of the two standard galaxy light profiles
 * (Hogg &amp; Lang 2013). Variances are in units of the squared half-light scale;
 * amplitudes are normalized to sum to one.
 *
 * @author Sean Phillips
 */
public enum GalaxyProfile {
    DEV(
        new double[]{4.26347652e-02, 2.40127183e-01, 6.85907632e-01, 1.51937350e+00,
            2.83627243e+00, 4.46467501e+00, 5.72440830e+00, 5.60989349e+00},
        new double[]{2.23759216e-04, 1.00220099e-03, 4.18731126e-03, 1.69432589e-02,
            6.84850479e-02, 2.87207080e-01, 1.33320254e+00, 8.40215071e+00}),
    EXP(
        new double[]{2.34853813e-03, 3.07995260e-02, 2.23364214e-01, 1.17949102e+00,
            4.33873750e+00, 5.99820770e+00},
        new double[]{1.20078965e-03, 8.84526493e-03, 3.91463084e-02, 1.39976817e-01,
            4.60962500e-01, 1.50159566e+00});

    private final double[] amplitudes;
    private final double[] variances;

    GalaxyProfile(double[] rawAmplitudes, double[] variances) {
        double total = 0.0;
        for (double a : rawAmplitudes) {
            total += a;
        }
        this.amplitudes = new double[rawAmplitudes.length];
        for (int j = 0; j < rawAmplitudes.length; j++) {
            amplitudes[j] = rawAmplitudes[j] / total;
        }
        this.variances = variances;
    }

    public int size() {
        return amplitudes.length;
    }

    public double amplitude(int j) {
        return amplitudes[j];
    }

    public double variance(int j) {
        return variances[j];
    }

    public double maxVariance() {
        double max = 0.0;
        for (double v : variances) {
            max = Math.max(max, v);
        }
        return max;
    }
}
