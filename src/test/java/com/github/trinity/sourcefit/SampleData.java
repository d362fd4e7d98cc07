package com.github.trinity.sourcefit;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.apache.commons.math3.util.FastMath;

/**
 * Shared fixtures: a two-component PSF, blank multi-band stamps, bright
 * sample sources and the perturbation applied before recovery runs.
 */
final class SampleData {

    static final double SKY = 20.0;

    static final double[] STAR_FLUXES = {1.2e4, 3.5e4, 5.0e4, 6.0e4, 7.0e4};
    static final double[] GALAXY_FLUXES = {8.0e3, 2.4e4, 4.0e4, 5.2e4, 6.0e4};

    private SampleData() {
    }

    static GaussianMixturePsf psf() {
        return new GaussianMixturePsf(List.of(
            new PsfComponent(0.7, new double[]{0.0, 0.0}, 1.2, 0.1, 1.0),
            new PsfComponent(0.3, new double[]{0.1, -0.1}, 3.0, -0.2, 2.5)));
    }

    static List<ImageStamp> blankStamps(int height, int width, WorldCoordinates wcs) {
        List<ImageStamp> stamps = new ArrayList<>();
        for (int b = 0; b < ParamLayout.BANDS; b++) {
            stamps.add(ImageStamp.blank(b, height, width, SKY, wcs, psf()));
        }
        return stamps;
    }

    static List<ImageStamp> blankStamps(int height, int width) {
        return blankStamps(height, width, WorldCoordinates.identity());
    }

    /**
     * A slightly sheared and rotated world grid, to exercise the coordinate pull-back.
     */
    static WorldCoordinates skewedWcs() {
        return new WorldCoordinates(new double[]{5.0, 5.0}, new double[]{6.0, 7.0},
            new double[][]{{1.1, 0.1}, {-0.05, 0.9}});
    }

    static CatalogEntry starEntry(double[] position) {
        return new CatalogEntry(position, true, STAR_FLUXES, STAR_FLUXES, 0.1, 0.7, 0.5, 1.5);
    }

    static CatalogEntry galaxyEntry(double[] position, double devFraction, double axisRatio, double angle,
                                    double scale) {
        return new CatalogEntry(position, false, GALAXY_FLUXES, GALAXY_FLUXES, devFraction, axisRatio, angle,
            scale);
    }

    /**
     * Moves every source away from its starting point: type leaning the other
     * way, position off by most of a pixel, brightness ten times too low and
     * a distorted shape.
     */
    static void perturb(ModelParams mp) {
        for (double[] vp : mp.vp()) {
            boolean star = vp[ParamLayout.indicator(ParamLayout.STAR)] > 0.5;
            vp[ParamLayout.indicator(ParamLayout.STAR)] = star ? 0.4 : 0.6;
            vp[ParamLayout.indicator(ParamLayout.GALAXY)] = star ? 0.6 : 0.4;
            vp[ParamLayout.position(0)] += 0.8;
            vp[ParamLayout.position(1)] -= 0.7;
            for (int i = 0; i < ParamLayout.SOURCE_TYPES; i++) {
                vp[ParamLayout.brightnessMean(i)] -= FastMath.log(10.0);
            }
            vp[ParamLayout.devFraction()] += 0.05;
            vp[ParamLayout.axisRatio()] += 0.05;
            vp[ParamLayout.angle()] += FastMath.PI / 10.0;
            vp[ParamLayout.scale()] *= 1.2;
        }
    }

    /**
     * A generic interior vector with every group away from its bounds.
     */
    static double[] interiorVector() {
        double[] vp = new double[ParamLayout.SIZE];
        vp[ParamLayout.indicator(ParamLayout.STAR)] = 0.6;
        vp[ParamLayout.indicator(ParamLayout.GALAXY)] = 0.4;
        vp[ParamLayout.position(0)] = 7.3;
        vp[ParamLayout.position(1)] = 8.1;
        vp[ParamLayout.positionVariance()] = 0.05;
        for (int i = 0; i < ParamLayout.SOURCE_TYPES; i++) {
            vp[ParamLayout.brightnessMean(i)] = 7.5 + 0.2 * i;
            vp[ParamLayout.brightnessVariance(i)] = 0.02 + 0.01 * i;
            for (int d = 0; d < ParamLayout.COLORS; d++) {
                vp[ParamLayout.colorMean(d, i)] = 0.3 + 0.1 * d - 0.05 * i;
                vp[ParamLayout.colorVariance(d, i)] = 0.03 + 0.01 * d;
            }
            vp[ParamLayout.colorWeight(0, i)] = 0.3 + 0.3 * i;
            vp[ParamLayout.colorWeight(1, i)] = 0.7 - 0.3 * i;
        }
        vp[ParamLayout.devFraction()] = 0.3;
        vp[ParamLayout.axisRatio()] = 0.6;
        vp[ParamLayout.angle()] = 0.7;
        vp[ParamLayout.scale()] = 1.4;
        return vp;
    }

    static OptimizerConfig tightConfig() {
        OptimizerConfig config = new OptimizerConfig();
        config.absoluteValueTolerance = 0.0;
        config.relativeStepTolerance = 0.0;
        config.gradientTolerance = 1e-10;
        config.maxIterations = 500;
        return config;
    }

    /**
     * Expected brightness of type {@code type} in {@code band}.
     */
    static double expectedBrightness(double[] vp, int type, int band) {
        return new SourceBrightness(vp, band).expected(type);
    }

    /**
     * Distance between two angles of period pi.
     */
    static double angleDistance(double a, double b) {
        double d = SourceFitHelper.wrapAngle(a - b);
        return Math.min(d, FastMath.PI - d);
    }

    static String describe(double[] vp) {
        return Arrays.toString(vp);
    }
}
