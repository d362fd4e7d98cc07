package com.github.trinity.sourcefit;

import static com.github.trinity.sourcefit.ParamLayout.BANDS;
import static com.github.trinity.sourcefit.ParamLayout.COLORS;
import static com.github.trinity.sourcefit.ParamLayout.COLOR_COMPONENTS;
import static com.github.trinity.sourcefit.ParamLayout.REFERENCE_BAND;
import static com.github.trinity.sourcefit.ParamLayout.SOURCE_TYPES;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import org.apache.commons.math3.util.FastMath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds starting variational parameters, either from catalog entries or from
 * peaks in the reference band.
 *
 * @author Sean Phillips
 */
public class ModelInitializer {

    private static final Logger LOG = LoggerFactory.getLogger(ModelInitializer.class);

    /** Type probability given to the catalog's classification. */
    public static final double CATALOG_TYPE_PROBABILITY = 0.8;
    public static final double INITIAL_POSITION_VARIANCE = 1e-3;
    public static final double INITIAL_BRIGHTNESS_VARIANCE = 1e-3;
    public static final double INITIAL_COLOR_VARIANCE = 1e-2;
    /** Fluxes are floored here so their logarithms stay finite. */
    public static final double MIN_FLUX = 1.0;

    private ModelInitializer() {
    }

    public static ModelParams fromCatalog(List<CatalogEntry> entries, PriorParams priors) {
        List<double[]> vp = new ArrayList<>(entries.size());
        for (CatalogEntry entry : entries) {
            double starProbability = entry.isStar() ? CATALOG_TYPE_PROBABILITY : 1.0 - CATALOG_TYPE_PROBABILITY;
            vp.add(initialVector(entry, starProbability));
        }
        return new ModelParams(vp, priors);
    }

    /**
     * One source per local maximum of the reference band's signal to noise,
     * brightest first, with per-band aperture fluxes and an even type split.
     *
     * @throws IllegalArgumentException if no stamp is in the reference band
     */
    public static ModelParams fromPeaks(List<ImageStamp> stamps, PriorParams priors, PeakDetectionConfig config) {
        ImageStamp reference = stamps.stream()
            .filter(stamp -> stamp.band() == REFERENCE_BAND)
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("No stamp in the reference band " + REFERENCE_BAND));

        List<double[]> peaks = findPeaks(reference, config);
        List<double[]> vp = new ArrayList<>(peaks.size());
        for (double[] peak : peaks) {
            double[] world = reference.wcs().pixelToWorld(new double[]{peak[0], peak[1]});
            double referenceFlux = apertureFlux(reference, world, config.apertureRadius);
            double[] fluxes = new double[BANDS];
            for (int b = 0; b < BANDS; b++) {
                fluxes[b] = referenceFlux;
            }
            for (ImageStamp stamp : stamps) {
                fluxes[stamp.band()] = apertureFlux(stamp, world, config.apertureRadius);
            }
            CatalogEntry entry = new CatalogEntry(world, true, fluxes, fluxes, 0.5, 0.8, 0.0, config.initialScale);
            vp.add(initialVector(entry, 0.5));
        }
        LOG.info("Initialized {} sources from peaks above signal to noise {}", vp.size(), config.minSignalToNoise);
        return new ModelParams(vp, priors);
    }

    /**
     * Local maxima of {@code (pixel - sky) / sigma} above the threshold after
     * non-maximum suppression, as {@code {h, w, snr}}, brightest first.
     */
    static List<double[]> findPeaks(ImageStamp stamp, PeakDetectionConfig config) {
        List<double[]> candidates = new ArrayList<>();
        for (int h = 0; h < stamp.height(); h++) {
            for (int w = 0; w < stamp.width(); w++) {
                double snr = signalToNoise(stamp, h, w);
                if (!(snr >= config.minSignalToNoise)) {
                    continue;
                }
                boolean isMax = true;
                for (int dh = -1; dh <= 1 && isMax; dh++) {
                    for (int dw = -1; dw <= 1; dw++) {
                        int nh = h + dh;
                        int nw = w + dw;
                        if ((dh == 0 && dw == 0) || nh < 0 || nw < 0 || nh >= stamp.height() || nw >= stamp.width()) {
                            continue;
                        }
                        if (signalToNoise(stamp, nh, nw) > snr) {
                            isMax = false;
                            break;
                        }
                    }
                }
                if (isMax) {
                    candidates.add(new double[]{h, w, snr});
                }
            }
        }
        candidates.sort(Comparator.comparingDouble((double[] c) -> c[2]).reversed());

        double minDistance2 = config.minSeparation * config.minSeparation;
        List<double[]> kept = new ArrayList<>();
        for (double[] candidate : candidates) {
            if (kept.size() >= config.maxSources) {
                break;
            }
            boolean separated = true;
            for (double[] peak : kept) {
                double dh = peak[0] - candidate[0];
                double dw = peak[1] - candidate[1];
                if (dh * dh + dw * dw < minDistance2) {
                    separated = false;
                    break;
                }
            }
            if (separated) {
                kept.add(candidate);
            }
        }
        return kept;
    }

    private static double signalToNoise(ImageStamp stamp, int h, int w) {
        if (!stamp.isObserved(h, w)) {
            return Double.NaN;
        }
        return (stamp.pixel(h, w) - stamp.sky()) / FastMath.sqrt(stamp.variance(h, w));
    }

    /**
     * Sky-subtracted sum of observed pixels within {@code radius} pixels of a world position.
     */
    static double apertureFlux(ImageStamp stamp, double[] world, double radius) {
        double[] center = stamp.wcs().worldToPixel(world);
        double radius2 = radius * radius;
        double sum = 0.0;
        int hMin = Math.max(0, (int) FastMath.ceil(center[0] - radius));
        int hMax = Math.min(stamp.height() - 1, (int) FastMath.floor(center[0] + radius));
        int wMin = Math.max(0, (int) FastMath.ceil(center[1] - radius));
        int wMax = Math.min(stamp.width() - 1, (int) FastMath.floor(center[1] + radius));
        for (int h = hMin; h <= hMax; h++) {
            for (int w = wMin; w <= wMax; w++) {
                double dh = h - center[0];
                double dw = w - center[1];
                if (dh * dh + dw * dw <= radius2 && stamp.isObserved(h, w)) {
                    sum += stamp.pixel(h, w) - stamp.sky();
                }
            }
        }
        return Math.max(sum, MIN_FLUX);
    }

    /**
     * Parameter vector whose expected brightness in every band matches the
     * entry's fluxes, with a small uncertainty everywhere.
     */
    static double[] initialVector(CatalogEntry entry, double starProbability) {
        double[] vp = new double[ParamLayout.SIZE];
        vp[ParamLayout.indicator(ParamLayout.STAR)] = starProbability;
        vp[ParamLayout.indicator(ParamLayout.GALAXY)] = 1.0 - starProbability;
        double[] position = entry.position();
        vp[ParamLayout.position(0)] = position[0];
        vp[ParamLayout.position(1)] = position[1];
        vp[ParamLayout.positionVariance()] = INITIAL_POSITION_VARIANCE;

        for (int i = 0; i < SOURCE_TYPES; i++) {
            double[] logFlux = new double[BANDS];
            for (int b = 0; b < BANDS; b++) {
                logFlux[b] = FastMath.log(Math.max(entry.flux(i, b), MIN_FLUX));
            }
            vp[ParamLayout.brightnessVariance(i)] = INITIAL_BRIGHTNESS_VARIANCE;
            vp[ParamLayout.brightnessMean(i)] = logFlux[REFERENCE_BAND] - 0.5 * INITIAL_BRIGHTNESS_VARIANCE;
            for (int d = 0; d < COLORS; d++) {
                // Offset by half the variance so E[B] of every band, not just its median, matches.
                double side = d >= REFERENCE_BAND ? 1.0 : -1.0;
                vp[ParamLayout.colorMean(d, i)] = logFlux[d + 1] - logFlux[d] - side * 0.5 * INITIAL_COLOR_VARIANCE;
                vp[ParamLayout.colorVariance(d, i)] = INITIAL_COLOR_VARIANCE;
            }
            for (int c = 0; c < COLOR_COMPONENTS; c++) {
                vp[ParamLayout.colorWeight(c, i)] = 1.0 / COLOR_COMPONENTS;
            }
        }

        vp[ParamLayout.devFraction()] = SourceFitHelper.clamp(entry.devFraction(), 0.01, 0.99);
        vp[ParamLayout.axisRatio()] = SourceFitHelper.clamp(entry.axisRatio(), 0.05, 0.99);
        vp[ParamLayout.angle()] = SourceFitHelper.wrapAngle(entry.angle());
        vp[ParamLayout.scale()] = SourceFitHelper.clamp(entry.scale(), 2 * ParamBounds.MIN_SCALE,
            0.8 * ParamBounds.MAX_SCALE);
        return vp;
    }
}
