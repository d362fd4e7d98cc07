package com.github.trinity.sourcefit;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.Test;

class GeometryTest {

    @Test
    void worldCoordinatesInvertEachOther() {
        WorldCoordinates wcs = SampleData.skewedWcs();
        double[] world = {3.7, -1.2};
        double[] pixel = wcs.worldToPixel(world);
        assertArrayEquals(world, wcs.pixelToWorld(pixel), 1e-12);
        assertArrayEquals(new double[]{6.0, 7.0}, wcs.worldToPixel(new double[]{5.0, 5.0}), 0.0);
        assertEquals(0.1, wcs.jacobian(0, 1), 0.0);

        assertThrows(IllegalArgumentException.class, () -> new WorldCoordinates(new double[]{0, 0},
            new double[]{0, 0}, new double[][]{{1, 2}, {2, 4}}));
    }

    @Test
    void stampKeepsItsOwnCopyOfTheData() {
        double[][] pixels = {{1.0, 2.0}, {3.0, 4.0}};
        double[][] variance = {{1.0, 1.0}, {1.0, 1.0}};
        ImageStamp stamp = new ImageStamp(0, pixels, variance, 0.5, WorldCoordinates.identity(),
            GaussianMixturePsf.isotropic(1.0));
        ImageStamp replaced = stamp.withData(pixels, variance);

        pixels[1][0] = Double.NaN;
        variance[0][1] = 0.0;

        for (ImageStamp s : List.of(stamp, replaced)) {
            assertEquals(3.0, s.pixel(1, 0), 0.0);
            assertEquals(1.0, s.variance(0, 1), 0.0);
            assertTrue(s.isObserved(1, 0));
            assertTrue(s.isObserved(0, 1));
        }
    }

    @Test
    void psfComponentsMustFormAMixture() {
        GaussianMixturePsf psf = GaussianMixturePsf.isotropic(1.5);
        PsfComponent only = psf.componentsAt(3.0, 4.0).get(0);
        assertEquals(1.0, only.weight(), 0.0);
        assertEquals(2.25, only.maxVariance(), 1e-12);

        assertThrows(IllegalArgumentException.class, () -> new GaussianMixturePsf(List.of(
            new PsfComponent(0.5, new double[]{0, 0}, 1.0, 0.0, 1.0))));
        assertThrows(IllegalArgumentException.class,
            () -> new PsfComponent(1.0, new double[]{0, 0}, 1.0, 2.0, 1.0));
    }

    @Test
    void patchCoversTheWidestProfile() {
        double[] vp = SampleData.interiorVector();
        List<ImageStamp> stamps = SampleData.blankStamps(40, 40);
        SourcePatch patch = SourcePatch.forSource(vp, stamps);

        assertArrayEquals(new double[]{7.3, 8.1}, patch.center(), 0.0);
        double galaxy = GalaxyProfile.DEV.maxVariance() * 1.4 * 1.4;
        assertTrue(patch.radius() > SourcePatch.RADIUS_SIGMAS * Math.sqrt(galaxy));

        int[] range = new SourcePatch(new double[]{10.2, 30.7}, 3.0).pixelRange(stamps.get(0));
        assertArrayEquals(new int[]{8, 13, 28, 33}, range);
        int[] clipped = new SourcePatch(new double[]{1.0, 38.5}, 3.0).pixelRange(stamps.get(0));
        assertArrayEquals(new int[]{0, 4, 36, 39}, clipped);
        assertNull(new SourcePatch(new double[]{-10.0, 5.0}, 3.0).pixelRange(stamps.get(0)));
        assertThrows(IllegalArgumentException.class, () -> new SourcePatch(new double[]{0, 0}, 0.0));
    }

    @Test
    void renderedProfilesIntegrateToOne() {
        ImageStamp stamp = SampleData.blankStamps(41, 41).get(0);
        double[] vp = SampleData.interiorVector();
        vp[ParamLayout.position(0)] = 20.2;
        vp[ParamLayout.position(1)] = 19.7;
        SourceRenderer renderer = SourceRenderer.forSource(vp, stamp);
        SourceRenderer.ProfileValue star = new SourceRenderer.ProfileValue();
        SourceRenderer.ProfileValue galaxy = new SourceRenderer.ProfileValue();
        double starTotal = 0.0;
        double galaxyTotal = 0.0;
        for (int h = 0; h < stamp.height(); h++) {
            for (int w = 0; w < stamp.width(); w++) {
                renderer.render(h, w, star, galaxy);
                starTotal += star.value;
                galaxyTotal += galaxy.value;
            }
        }
        assertEquals(1.0, starTotal, 1e-6);
        // The widest de Vaucouleurs component leaks a little past the stamp edge.
        assertEquals(1.0, galaxyTotal, 1e-2);
    }
}
