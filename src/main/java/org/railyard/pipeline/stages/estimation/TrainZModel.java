package org.railyard.pipeline.stages.estimation;

import java.io.Serializable;
import java.util.Arrays;

/**
 * The redshift distribution of a training set, gridded.
 */
public final class TrainZModel implements Serializable {

    private static final long serialVersionUID = 1L;

    private final double[] grid;
    private final double[] density;
    private final double zmode;

    public TrainZModel(double[] grid, double[] density, double zmode) {
        if (grid.length != density.length) {
            throw new IllegalArgumentException("Grid and density differ in length");
        }
        this.grid = grid.clone();
        this.density = density.clone();
        this.zmode = zmode;
    }

    public double[] getGrid() {
        return grid.clone();
    }

    public double[] getDensity() {
        return density.clone();
    }

    public double getZmode() {
        return zmode;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof TrainZModel other
                && Arrays.equals(grid, other.grid)
                && Arrays.equals(density, other.density)
                && Double.compare(zmode, other.zmode) == 0;
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(grid) + Arrays.hashCode(density);
    }
}
