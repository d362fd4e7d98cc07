package com.github.trinity.sourcefit;

import java.util.ArrayList;
import java.util.List;

import org.apache.commons.math3.distribution.PoissonDistribution;
import org.apache.commons.math3.random.RandomGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Renders catalog entries onto copies of baseline stamps with the same light
 * profiles the likelihood uses, optionally with Poisson noise.
 *
 * @author Sean Phillips
 */
public class SyntheticImageGenerator {

    private static final Logger LOG = LoggerFactory.getLogger(SyntheticImageGenerator.class);

    private SyntheticImageGenerator() {
    }

    /**
     * Noise-free images: every pixel equals its expected count.
     */
    public static List<ImageStamp> generate(List<ImageStamp> baseline, List<CatalogEntry> entries) {
        return generate(baseline, entries, null);
    }

    /**
     * @param baseline stamps supplying band, size, sky, coordinates and PSF
     * @param entries  sources to render; each uses the profile of its catalog type
     * @param rng      source of Poisson noise, or {@code null} for noise-free images
     * @return one stamp per baseline stamp, with the variance set to the expected counts
     */
    public static List<ImageStamp> generate(List<ImageStamp> baseline, List<CatalogEntry> entries,
                                            RandomGenerator rng) {
        List<ImageStamp> images = new ArrayList<>(baseline.size());
        for (ImageStamp stamp : baseline) {
            double[][] expected = expectedCounts(stamp, entries);
            double[][] pixels = new double[stamp.height()][stamp.width()];
            for (int h = 0; h < stamp.height(); h++) {
                for (int w = 0; w < stamp.width(); w++) {
                    pixels[h][w] = rng == null ? expected[h][w] : sample(rng, expected[h][w]);
                }
            }
            images.add(stamp.withData(pixels, expected));
        }
        LOG.debug("Rendered {} sources into {} stamps (noise: {})", entries.size(), baseline.size(), rng != null);
        return images;
    }

    /**
     * Sky plus the expected electrons of every entry at each pixel.
     */
    static double[][] expectedCounts(ImageStamp stamp, List<CatalogEntry> entries) {
        double[][] expected = new double[stamp.height()][stamp.width()];
        for (int h = 0; h < stamp.height(); h++) {
            for (int w = 0; w < stamp.width(); w++) {
                expected[h][w] = stamp.sky();
            }
        }
        SourceRenderer.ProfileValue star = new SourceRenderer.ProfileValue();
        SourceRenderer.ProfileValue galaxy = new SourceRenderer.ProfileValue();
        for (CatalogEntry entry : entries) {
            SourceRenderer renderer = SourceRenderer.forEntry(entry, stamp);
            int type = entry.isStar() ? ParamLayout.STAR : ParamLayout.GALAXY;
            double flux = entry.flux(type, stamp.band());
            for (int h = 0; h < stamp.height(); h++) {
                for (int w = 0; w < stamp.width(); w++) {
                    renderer.render(h, w, star, galaxy);
                    expected[h][w] += flux * (entry.isStar() ? star.value : galaxy.value);
                }
            }
        }
        return expected;
    }

    private static double sample(RandomGenerator rng, double mean) {
        return new PoissonDistribution(rng, mean, PoissonDistribution.DEFAULT_EPSILON,
            PoissonDistribution.DEFAULT_MAX_ITERATIONS).sample();
    }
}
