package com.github.trinity.sourcefit;

/**
 * Affine map between world (sky) coordinates and pixel coordinates:
 * {@code pixel = pixelRef + J (world - worldRef)}.
 * <p>
 * Over a stamp of a few dozen pixels the full tangent-plane projection is
 * linear to well below a pixel, so the affine form is what the likelihood uses.
 * </p>
 *
 * @author Sean Phillips
 */
public class WorldCoordinates {

    private final double[] worldRef;
    private final double[] pixelRef;
    private final double[][] jacobian;
    private final double[][] inverse;

    /**
     * @param worldRef world coordinates of the reference point
     * @param pixelRef pixel coordinates of the reference point
     * @param jacobian 2 × 2 matrix of d(pixel) / d(world)
     */
    public WorldCoordinates(double[] worldRef, double[] pixelRef, double[][] jacobian) {
        double det = jacobian[0][0] * jacobian[1][1] - jacobian[0][1] * jacobian[1][0];
        if (det == 0.0 || Double.isNaN(det)) {
            throw new IllegalArgumentException("World coordinate jacobian is singular");
        }
        this.worldRef = worldRef.clone();
        this.pixelRef = pixelRef.clone();
        this.jacobian = new double[][]{jacobian[0].clone(), jacobian[1].clone()};
        this.inverse = new double[][]{
            {jacobian[1][1] / det, -jacobian[0][1] / det},
            {-jacobian[1][0] / det, jacobian[0][0] / det}
        };
    }

    public static WorldCoordinates identity() {
        return new WorldCoordinates(new double[]{0, 0}, new double[]{0, 0}, new double[][]{{1, 0}, {0, 1}});
    }

    public double[] worldToPixel(double[] world) {
        double dx = world[0] - worldRef[0];
        double dy = world[1] - worldRef[1];
        return new double[]{
            pixelRef[0] + jacobian[0][0] * dx + jacobian[0][1] * dy,
            pixelRef[1] + jacobian[1][0] * dx + jacobian[1][1] * dy
        };
    }

    public double[] pixelToWorld(double[] pixel) {
        double dx = pixel[0] - pixelRef[0];
        double dy = pixel[1] - pixelRef[1];
        return new double[]{
            worldRef[0] + inverse[0][0] * dx + inverse[0][1] * dy,
            worldRef[1] + inverse[1][0] * dx + inverse[1][1] * dy
        };
    }

    /**
     * d(pixel[row]) / d(world[col]).
     */
    public double jacobian(int row, int col) {
        return jacobian[row][col];
    }
}
