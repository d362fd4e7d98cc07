package com.github.trinity.sourcefit;

import java.util.Arrays;

/**
 * A catalogued source used to seed variational parameters or to render
 * synthetic images.
 *
 * @author Sean Phillips
 */
public class CatalogEntry {

    private final double[] position;
    private final boolean star;
    private final double[] starFluxes;
    private final double[] galaxyFluxes;
    private final double devFraction;
    private final double axisRatio;
    private final double angle;
    private final double scale;

    /**
     * @param position     world coordinates
     * @param star         whether the catalog classifies the source as a star
     * @param starFluxes   per-band flux under the star hypothesis (electrons)
     * @param galaxyFluxes per-band flux under the galaxy hypothesis (electrons)
     * @param devFraction  de Vaucouleurs share of the galaxy light, in [0, 1]
     * @param axisRatio    minor / major axis ratio, in (0, 1]
     * @param angle        major axis angle in radians
     * @param scale        half-light scale in pixels
     */
    public CatalogEntry(double[] position, boolean star, double[] starFluxes, double[] galaxyFluxes,
                        double devFraction, double axisRatio, double angle, double scale) {
        if (position.length != 2) {
            throw new IllegalArgumentException("Position must have two coordinates");
        }
        if (starFluxes.length != ParamLayout.BANDS || galaxyFluxes.length != ParamLayout.BANDS) {
            throw new IllegalArgumentException("Fluxes must be given for " + ParamLayout.BANDS + " bands");
        }
        this.position = position.clone();
        this.star = star;
        this.starFluxes = starFluxes.clone();
        this.galaxyFluxes = galaxyFluxes.clone();
        this.devFraction = devFraction;
        this.axisRatio = axisRatio;
        this.angle = angle;
        this.scale = scale;
    }

    public double[] position() {
        return position.clone();
    }

    public boolean isStar() {
        return star;
    }

    public double starFlux(int band) {
        return starFluxes[band];
    }

    public double galaxyFlux(int band) {
        return galaxyFluxes[band];
    }

    public double flux(int type, int band) {
        return type == ParamLayout.STAR ? starFluxes[band] : galaxyFluxes[band];
    }

    public double devFraction() {
        return devFraction;
    }

    public double axisRatio() {
        return axisRatio;
    }

    public double angle() {
        return angle;
    }

    public double scale() {
        return scale;
    }

    @Override
    public String toString() {
        return "CatalogEntry{position=" + Arrays.toString(position) + ", star=" + star
            + ", scale=" + scale + ", axisRatio=" + axisRatio + "}";
    }
}
