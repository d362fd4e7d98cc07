package com.github.trinity.sourcefit;

import java.util.ArrayList;
import java.util.List;

import org.apache.commons.math3.util.FastMath;

/**
 * The region of pixels a source is allowed to influence: a world-space centre
 * and a pixel radius.
 * <p>
 * Patches are computed from the parameters an objective starts from and kept
 * fixed while it is optimized, so the set of contributing pixels never
 * changes underneath the optimizer.
 * </p>
 *
 * @author Sean Phillips
 */
public final class SourcePatch {

    /** Patch radius in standard deviations of the widest rendered component. */
    public static final double RADIUS_SIGMAS = 5.0;

    private final double[] center;
    private final double radius;

    public SourcePatch(double[] center, double radius) {
        if (!(radius > 0)) {
            throw new IllegalArgumentException("Patch radius must be positive, got " + radius);
        }
        this.center = center.clone();
        this.radius = radius;
    }

    /**
     * Patch wide enough to hold both profiles of {@code vp} in every stamp.
     */
    public static SourcePatch forSource(double[] vp, List<ImageStamp> stamps) {
        double[] world = {vp[ParamLayout.position(0)], vp[ParamLayout.position(1)]};
        double scale = vp[ParamLayout.scale()];
        double galaxyVariance = Math.max(GalaxyProfile.DEV.maxVariance(), GalaxyProfile.EXP.maxVariance())
            * scale * scale;
        double widest = 0.0;
        for (ImageStamp stamp : stamps) {
            double[] pixel = stamp.wcs().worldToPixel(world);
            for (PsfComponent k : stamp.psf().componentsAt(pixel[0], pixel[1])) {
                widest = Math.max(widest, k.maxVariance());
            }
        }
        widest += vp[ParamLayout.positionVariance()] + galaxyVariance;
        return new SourcePatch(world, RADIUS_SIGMAS * FastMath.sqrt(widest));
    }

    public static List<SourcePatch> forModel(ModelParams mp, List<ImageStamp> stamps) {
        List<SourcePatch> patches = new ArrayList<>(mp.numSources());
        for (double[] vp : mp.vp()) {
            patches.add(forSource(vp, stamps));
        }
        return patches;
    }

    public double[] center() {
        return center.clone();
    }

    public double radius() {
        return radius;
    }

    /**
     * Bounding pixel rows and columns of this patch in {@code stamp}, clipped to
     * the stamp, as {@code {hMin, hMax, wMin, wMax}} (inclusive).
     *
     * @return the range, or {@code null} if the patch misses the stamp
     */
    public int[] pixelRange(ImageStamp stamp) {
        double[] pixel = stamp.wcs().worldToPixel(center);
        int hMin = Math.max(0, (int) FastMath.ceil(pixel[0] - radius));
        int hMax = Math.min(stamp.height() - 1, (int) FastMath.floor(pixel[0] + radius));
        int wMin = Math.max(0, (int) FastMath.ceil(pixel[1] - radius));
        int wMax = Math.min(stamp.width() - 1, (int) FastMath.floor(pixel[1] + radius));
        if (hMin > hMax || wMin > wMax) {
            return null;
        }
        return new int[]{hMin, hMax, wMin, wMax};
    }
}
