package com.github.trinity.sourcefit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.apache.commons.math3.random.MersenneTwister;
import org.apache.commons.math3.stat.descriptive.SummaryStatistics;
import org.junit.jupiter.api.Test;

class SyntheticImageGeneratorTest {

    @Test
    void noiseFreeImagesHoldTheCatalogFlux() {
        CatalogEntry star = SampleData.starEntry(new double[]{20.3, 19.6});
        List<ImageStamp> images = SyntheticImageGenerator.generate(SampleData.blankStamps(41, 41), List.of(star));

        assertEquals(ParamLayout.BANDS, images.size());
        for (ImageStamp image : images) {
            double total = 0.0;
            for (int h = 0; h < image.height(); h++) {
                for (int w = 0; w < image.width(); w++) {
                    total += image.pixel(h, w) - image.sky();
                    assertEquals(image.pixel(h, w), image.variance(h, w), 0.0);
                }
            }
            assertEquals(1.0, total / star.starFlux(image.band()), 1e-3, "band " + image.band());
        }
    }

    @Test
    void galaxiesAreWiderThanStars() {
        CatalogEntry star = SampleData.starEntry(new double[]{15.0, 15.0});
        CatalogEntry galaxy = new CatalogEntry(new double[]{15.0, 15.0}, false, SampleData.STAR_FLUXES,
            SampleData.STAR_FLUXES, 0.5, 0.9, 0.0, 2.0);
        ImageStamp baseline = SampleData.blankStamps(31, 31).get(ParamLayout.REFERENCE_BAND);

        double[][] starCounts = SyntheticImageGenerator.expectedCounts(baseline, List.of(star));
        double[][] galaxyCounts = SyntheticImageGenerator.expectedCounts(baseline, List.of(galaxy));

        // Same flux, so the more extended profile has the lower peak.
        assertTrue(galaxyCounts[15][15] < starCounts[15][15]);
        assertTrue(galaxyCounts[15][21] > starCounts[15][21]);
    }

    @Test
    void poissonNoiseMatchesTheSkyLevel() {
        List<ImageStamp> images = SyntheticImageGenerator.generate(SampleData.blankStamps(60, 60), List.of(),
            new MersenneTwister(7));

        SummaryStatistics stats = new SummaryStatistics();
        ImageStamp image = images.get(0);
        for (int h = 0; h < image.height(); h++) {
            for (int w = 0; w < image.width(); w++) {
                double count = image.pixel(h, w);
                assertEquals(Math.rint(count), count, 0.0);
                assertEquals(SampleData.SKY, image.variance(h, w), 0.0);
                stats.addValue(count);
            }
        }
        assertEquals(SampleData.SKY, stats.getMean(), 0.4);
        assertEquals(SampleData.SKY, stats.getVariance(), 3.0);
    }
}
