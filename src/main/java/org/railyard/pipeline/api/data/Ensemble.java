package org.railyard.pipeline.api.data;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * A collection of gridded probability distributions sharing one grid.
 * <p>
 * Row {@code i} of {@link #getDensities()} holds the density of distribution {@code i}
 * evaluated at every grid point. An optional ancillary {@link Table} carries one row of
 * per-distribution values (point estimates, object ids).
 */
public final class Ensemble {

    private final double[] grid;
    private final double[][] densities;
    private final Table ancil;

    /**
     * @param grid      strictly increasing grid points
     * @param densities one row per distribution, each as long as {@code grid}
     * @param ancil     optional per-distribution table, {@code null} if absent
     * @throws IllegalArgumentException if the shapes do not agree
     */
    public Ensemble(double[] grid, double[][] densities, Table ancil) {
        Objects.requireNonNull(grid, "grid");
        Objects.requireNonNull(densities, "densities");
        for (int i = 1; i < grid.length; i++) {
            if (grid[i] <= grid[i - 1]) {
                throw new IllegalArgumentException("Grid must be strictly increasing at index " + i);
            }
        }
        double[][] copy = new double[densities.length][];
        for (int i = 0; i < densities.length; i++) {
            if (densities[i].length != grid.length) {
                throw new IllegalArgumentException(String.format(
                        "Distribution %d has %d values, grid has %d", i, densities[i].length, grid.length));
            }
            copy[i] = densities[i].clone();
        }
        if (ancil != null && ancil.numColumns() > 0 && ancil.numRows() != densities.length) {
            throw new IllegalArgumentException(String.format(
                    "Ancillary table has %d rows, ensemble has %d distributions", ancil.numRows(), densities.length));
        }
        this.grid = grid.clone();
        this.densities = copy;
        this.ancil = ancil;
    }

    public Ensemble(double[] grid, double[][] densities) {
        this(grid, densities, null);
    }

    /**
     * Creates an ensemble with the given grid and ancillary columns and no distributions.
     */
    public static Ensemble empty(double[] grid, List<String> ancilColumns) {
        return new Ensemble(grid, new double[0][], ancilColumns.isEmpty() ? null : Table.empty(ancilColumns));
    }

    public int size() {
        return densities.length;
    }

    public double[] getGrid() {
        return grid.clone();
    }

    public int gridSize() {
        return grid.length;
    }

    public double[][] getDensities() {
        double[][] copy = new double[densities.length][];
        for (int i = 0; i < densities.length; i++) {
            copy[i] = densities[i].clone();
        }
        return copy;
    }

    public double[] density(int index) {
        return densities[index].clone();
    }

    public Table getAncil() {
        return ancil;
    }

    public boolean hasAncil() {
        return ancil != null && ancil.numColumns() > 0;
    }

    public List<String> ancilColumns() {
        return hasAncil() ? ancil.columnNames() : List.of();
    }

    public Ensemble withAncil(Table newAncil) {
        return new Ensemble(grid, densities, newAncil);
    }

    /**
     * Returns distributions {@code [start, end)}.
     */
    public Ensemble slice(int start, int end) {
        if (start < 0 || end > densities.length || start > end) {
            throw new IndexOutOfBoundsException("Slice [" + start + ", " + end + ") outside ensemble of " + densities.length);
        }
        return new Ensemble(grid, Arrays.copyOfRange(densities, start, end), hasAncil() ? ancil.slice(start, end) : ancil);
    }

    /**
     * Concatenates ensembles that share the same grid and ancillary columns.
     */
    public static Ensemble concat(List<Ensemble> parts) {
        if (parts.isEmpty()) {
            throw new IllegalArgumentException("Cannot concatenate an empty list of ensembles");
        }
        Ensemble first = parts.get(0);
        List<double[]> rows = new ArrayList<>();
        List<Table> ancils = new ArrayList<>();
        for (Ensemble part : parts) {
            if (!Arrays.equals(part.grid, first.grid)) {
                throw new IllegalArgumentException("Cannot concatenate ensembles defined on different grids");
            }
            if (!part.ancilColumns().equals(first.ancilColumns())) {
                throw new IllegalArgumentException("Cannot concatenate ensembles with ancillary columns "
                        + first.ancilColumns() + " and " + part.ancilColumns());
            }
            rows.addAll(Arrays.asList(part.densities));
            if (part.hasAncil()) {
                ancils.add(part.ancil);
            }
        }
        Table ancil = ancils.isEmpty() ? null : Table.concat(ancils);
        return new Ensemble(first.grid, rows.toArray(new double[0][]), ancil);
    }

    /**
     * @return the mean of every distribution, using trapezoidal integration
     */
    public double[] mean() {
        double[] result = new double[densities.length];
        for (int i = 0; i < densities.length; i++) {
            double norm = trapezoid(densities[i], null);
            result[i] = norm > 0 ? trapezoid(densities[i], grid) / norm : Double.NaN;
        }
        return result;
    }

    /**
     * @return the grid point of maximum density of every distribution (first on ties)
     */
    public double[] mode() {
        double[] result = new double[densities.length];
        for (int i = 0; i < densities.length; i++) {
            int best = 0;
            for (int j = 1; j < grid.length; j++) {
                if (densities[i][j] > densities[i][best]) {
                    best = j;
                }
            }
            result[i] = grid.length == 0 ? Double.NaN : grid[best];
        }
        return result;
    }

    /**
     * @return the median of every distribution, linearly interpolated in the cumulative distribution
     */
    public double[] median() {
        double[] result = new double[densities.length];
        for (int i = 0; i < densities.length; i++) {
            result[i] = quantile(densities[i], 0.5);
        }
        return result;
    }

    private double quantile(double[] pdf, double q) {
        if (grid.length < 2) {
            return grid.length == 1 ? grid[0] : Double.NaN;
        }
        double[] cdf = new double[grid.length];
        for (int j = 1; j < grid.length; j++) {
            cdf[j] = cdf[j - 1] + 0.5 * (pdf[j] + pdf[j - 1]) * (grid[j] - grid[j - 1]);
        }
        double total = cdf[grid.length - 1];
        if (total <= 0) {
            return Double.NaN;
        }
        double target = q * total;
        for (int j = 1; j < grid.length; j++) {
            if (cdf[j] >= target) {
                double span = cdf[j] - cdf[j - 1];
                double frac = span > 0 ? (target - cdf[j - 1]) / span : 0.0;
                return grid[j - 1] + frac * (grid[j] - grid[j - 1]);
            }
        }
        return grid[grid.length - 1];
    }

    private double trapezoid(double[] pdf, double[] weights) {
        double sum = 0.0;
        for (int j = 1; j < grid.length; j++) {
            double a = weights == null ? pdf[j - 1] : pdf[j - 1] * weights[j - 1];
            double b = weights == null ? pdf[j] : pdf[j] * weights[j];
            sum += 0.5 * (a + b) * (grid[j] - grid[j - 1]);
        }
        return sum;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Ensemble other)) {
            return false;
        }
        return Arrays.equals(grid, other.grid)
                && Arrays.deepEquals(densities, other.densities)
                && Objects.equals(hasAncil() ? ancil : null, other.hasAncil() ? other.ancil : null);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(grid) + Arrays.deepHashCode(densities);
    }

    @Override
    public String toString() {
        return "Ensemble[size=" + densities.length + ", gridSize=" + grid.length + ", ancil=" + ancilColumns() + "]";
    }
}
