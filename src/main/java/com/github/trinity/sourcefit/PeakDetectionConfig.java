package com.github.trinity.sourcefit;

/**
 * Configuration for seeding sources from local maxima of the reference band.
 *
 * <ul>
 *   <li><b>minSignalToNoise</b>: A pixel must exceed the sky by this many noise
 *       standard deviations to count as a peak.</li>
 *   <li><b>minSeparation</b>: Peaks closer than this many pixels to a brighter
 *       peak are dropped.</li>
 *   <li><b>apertureRadius</b>: Radius in pixels of the circular aperture used
 *       to estimate each band's flux.</li>
 *   <li><b>maxSources</b>: At most this many of the brightest peaks are kept.</li>
 * </ul>
 *
 * @author Sean Phillips
 */
public class PeakDetectionConfig {

    public double minSignalToNoise = 5.0;

    public double minSeparation = 3.0;

    public double apertureRadius = 4.0;

    public int maxSources = 100;

    /**
     * Starting half-light scale in pixels for the galaxy hypothesis.
     */
    public double initialScale = 1.5;

    public PeakDetectionConfig() {
    }
}
