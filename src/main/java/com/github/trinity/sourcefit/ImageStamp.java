package com.github.trinity.sourcefit;

import org.apache.commons.math3.exception.DimensionMismatchException;

/**
 * One band's observed data: electron counts, per-pixel noise variance, a
 * constant sky level, world coordinates and the PSF.
 * <p>
 * Pixel {@code (h, w)} is centred at pixel coordinate {@code (h, w)}. Masked
 * pixels carry {@code NaN} and are ignored by the likelihood. The pixel and
 * variance arrays are copied on construction, so a stamp never changes.
 * </p>
 *
 * @author Sean Phillips
 */
public class ImageStamp {

    private final int band;
    private final double[][] pixels;
    private final double[][] variance;
    private final double sky;
    private final WorldCoordinates wcs;
    private final PointSpreadFunction psf;

    public ImageStamp(int band, double[][] pixels, double[][] variance, double sky,
                      WorldCoordinates wcs, PointSpreadFunction psf) {
        if (band < 0 || band >= ParamLayout.BANDS) {
            throw new IllegalArgumentException("Band must be in [0, " + ParamLayout.BANDS + "), got " + band);
        }
        if (pixels.length == 0 || pixels[0].length == 0) {
            throw new IllegalArgumentException("Image stamp must have at least one pixel");
        }
        if (variance.length != pixels.length) {
            throw new DimensionMismatchException(variance.length, pixels.length);
        }
        for (int h = 0; h < pixels.length; h++) {
            if (pixels[h].length != pixels[0].length) {
                throw new DimensionMismatchException(pixels[h].length, pixels[0].length);
            }
            if (variance[h].length != pixels[h].length) {
                throw new DimensionMismatchException(variance[h].length, pixels[h].length);
            }
        }
        this.band = band;
        this.pixels = copyRows(pixels);
        this.variance = copyRows(variance);
        this.sky = sky;
        this.wcs = wcs;
        this.psf = psf;
    }

    /**
     * A stamp of constant sky with Poisson variance, used as a baseline for
     * synthetic images.
     */
    public static ImageStamp blank(int band, int height, int width, double sky,
                                   WorldCoordinates wcs, PointSpreadFunction psf) {
        double[][] pixels = new double[height][width];
        double[][] variance = new double[height][width];
        for (int h = 0; h < height; h++) {
            for (int w = 0; w < width; w++) {
                pixels[h][w] = sky;
                variance[h][w] = sky;
            }
        }
        return new ImageStamp(band, pixels, variance, sky, wcs, psf);
    }

    /**
     * Same band, sky, coordinates and PSF with new pixel data.
     */
    public ImageStamp withData(double[][] newPixels, double[][] newVariance) {
        return new ImageStamp(band, newPixels, newVariance, sky, wcs, psf);
    }

    public int band() {
        return band;
    }

    public int height() {
        return pixels.length;
    }

    public int width() {
        return pixels[0].length;
    }

    public double pixel(int h, int w) {
        return pixels[h][w];
    }

    public double variance(int h, int w) {
        return variance[h][w];
    }

    /**
     * @return whether the pixel takes part in the likelihood
     */
    public boolean isObserved(int h, int w) {
        double v = variance[h][w];
        return !Double.isNaN(pixels[h][w]) && v > 0 && !Double.isInfinite(v);
    }

    public double sky() {
        return sky;
    }

    public WorldCoordinates wcs() {
        return wcs;
    }

    public PointSpreadFunction psf() {
        return psf;
    }

    private static double[][] copyRows(double[][] a) {
        double[][] copy = new double[a.length][];
        for (int h = 0; h < a.length; h++) {
            copy[h] = a[h].clone();
        }
        return copy;
    }
}
