package com.github.trinity.sourcefit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.apache.commons.math3.util.FastMath;
import org.junit.jupiter.api.Test;

class ModelInitializerTest {

    @Test
    void catalogStartReproducesEveryBandFlux() {
        CatalogEntry galaxy = SampleData.galaxyEntry(new double[]{3.0, 4.0}, 0.3, 0.6, 1.0, 2.5);
        List<CatalogEntry> entries = List.of(SampleData.starEntry(new double[]{1.0, 2.0}), galaxy);
        ModelParams mp = ModelInitializer.fromCatalog(entries, PriorParams.defaults());

        assertEquals(2, mp.numSources());
        for (int s = 0; s < mp.numSources(); s++) {
            double[] vp = mp.source(s);
            for (int i = 0; i < ParamLayout.SOURCE_TYPES; i++) {
                for (int b = 0; b < ParamLayout.BANDS; b++) {
                    double expected = entries.get(s).flux(i, b);
                    assertEquals(1.0, SampleData.expectedBrightness(vp, i, b) / expected, 1e-10,
                        "source " + s + " type " + i + " band " + b);
                }
            }
        }
        assertEquals(ModelInitializer.CATALOG_TYPE_PROBABILITY, mp.source(0)[ParamLayout.indicator(ParamLayout.STAR)],
            1e-15);
        assertEquals(ModelInitializer.CATALOG_TYPE_PROBABILITY,
            mp.source(1)[ParamLayout.indicator(ParamLayout.GALAXY)], 1e-15);
        assertEquals(3.0, mp.source(1)[ParamLayout.position(0)], 0.0);
        assertEquals(2.5, mp.source(1)[ParamLayout.scale()], 0.0);
    }

    @Test
    void catalogShapesAreMovedInsideTheirDomain() {
        CatalogEntry odd = SampleData.galaxyEntry(new double[]{0.0, 0.0}, 0.0, 1.0, 4.0, 100.0);
        double[] vp = ModelInitializer.initialVector(odd, 0.5);

        assertEquals(0.01, vp[ParamLayout.devFraction()], 0.0);
        assertEquals(0.99, vp[ParamLayout.axisRatio()], 0.0);
        assertEquals(4.0 - FastMath.PI, vp[ParamLayout.angle()], 1e-12);
        assertTrue(vp[ParamLayout.scale()] < ParamBounds.MAX_SCALE);
        assertTrue(ParameterTransform.rectangular().roundTripHolds(
            new ModelParams(List.of(vp), PriorParams.defaults())));
    }

    @Test
    void peaksSeedOneSourcePerStarBrightestFirst() {
        double[] faintFluxes = new double[ParamLayout.BANDS];
        for (int b = 0; b < ParamLayout.BANDS; b++) {
            faintFluxes[b] = SampleData.STAR_FLUXES[b] / 4;
        }
        CatalogEntry bright = SampleData.starEntry(new double[]{8.2, 9.1});
        CatalogEntry faint = new CatalogEntry(new double[]{20.0, 24.0}, true, faintFluxes, faintFluxes,
            0.1, 0.7, 0.5, 1.5);
        List<ImageStamp> images = SyntheticImageGenerator.generate(SampleData.blankStamps(30, 34),
            List.of(faint, bright));

        ModelParams mp = ModelInitializer.fromPeaks(images, PriorParams.defaults(), new PeakDetectionConfig());

        assertEquals(2, mp.numSources());
        double[] first = mp.source(0);
        assertEquals(8.0, first[ParamLayout.position(0)], 0.0);
        assertEquals(9.0, first[ParamLayout.position(1)], 0.0);
        assertEquals(0.5, first[ParamLayout.indicator(ParamLayout.STAR)], 0.0);
        double estimate = SampleData.expectedBrightness(first, ParamLayout.STAR, ParamLayout.REFERENCE_BAND);
        assertEquals(1.0, estimate / SampleData.STAR_FLUXES[ParamLayout.REFERENCE_BAND], 0.15);
        double[] second = mp.source(1);
        assertEquals(20.0, second[ParamLayout.position(0)], 0.0);
        assertEquals(24.0, second[ParamLayout.position(1)], 0.0);

        PeakDetectionConfig single = new PeakDetectionConfig();
        single.maxSources = 1;
        assertEquals(1, ModelInitializer.fromPeaks(images, PriorParams.defaults(), single).numSources());
    }

    @Test
    void blankImagesHaveNoPeaksAndFlooredApertureFlux() {
        List<ImageStamp> blank = SampleData.blankStamps(12, 12);
        assertEquals(0, ModelInitializer.fromPeaks(blank, PriorParams.defaults(), new PeakDetectionConfig())
            .numSources());
        assertEquals(ModelInitializer.MIN_FLUX,
            ModelInitializer.apertureFlux(blank.get(0), new double[]{6.0, 6.0}, 3.0), 0.0);
    }

    @Test
    void peakSearchNeedsTheReferenceBand() {
        List<ImageStamp> images = SampleData.blankStamps(12, 12).subList(0, ParamLayout.REFERENCE_BAND);
        assertThrows(IllegalArgumentException.class,
            () -> ModelInitializer.fromPeaks(images, PriorParams.defaults(), new PeakDetectionConfig()));
    }
}
