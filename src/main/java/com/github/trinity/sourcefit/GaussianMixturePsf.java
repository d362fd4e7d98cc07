package com.github.trinity.sourcefit;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A point-spread function that is the same Gaussian mixture everywhere in the stamp.
 *
 * @author Sean Phillips
 */
public class GaussianMixturePsf implements PointSpreadFunction {

    private final List<PsfComponent> components;

    public GaussianMixturePsf(List<PsfComponent> components) {
        if (components.isEmpty()) {
            throw new IllegalArgumentException("A PSF needs at least one component");
        }
        double total = 0.0;
        for (PsfComponent c : components) {
            total += c.weight();
        }
        if (Math.abs(total - 1.0) > 1e-6) {
            throw new IllegalArgumentException("PSF component weights must sum to one, got " + total);
        }
        this.components = Collections.unmodifiableList(new ArrayList<>(components));
    }

    /**
     * Single isotropic Gaussian with the given standard deviation in pixels.
     */
    public static GaussianMixturePsf isotropic(double sigma) {
        double var = sigma * sigma;
        return new GaussianMixturePsf(List.of(new PsfComponent(1.0, new double[]{0, 0}, var, 0.0, var)));
    }

    @Override
    public List<PsfComponent> componentsAt(double x, double y) {
        return components;
    }
}
