package com.github.trinity.sourcefit;

import java.util.List;

/**
 * The optical blurring kernel of one band, expressed as a Gaussian mixture that
 * may vary with location in the image.
 *
 * @author Sean Phillips
 */
public interface PointSpreadFunction {

    /**
     * @param x pixel row coordinate
     * @param y pixel column coordinate
     * @return the mixture components valid at {@code (x, y)}; weights sum to one
     */
    List<PsfComponent> componentsAt(double x, double y);
}
