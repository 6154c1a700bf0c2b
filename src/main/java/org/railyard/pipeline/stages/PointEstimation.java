package org.railyard.pipeline.stages;

import java.util.List;
import java.util.Locale;

import org.railyard.pipeline.api.data.Ensemble;
import org.railyard.pipeline.api.data.Table;
import org.railyard.pipeline.api.stages.ConfigurationException;

/**
 * Adds point estimates to the ancillary table of an ensemble.
 * <p>
 * Supported estimates are {@code mean}, {@code mode} and {@code median}; each is stored in
 * a column named {@code z<estimate>} ({@code zmean}, {@code zmode}, {@code zmedian}).
 * Estimates that are already present are left untouched.
 */
public final class PointEstimation {

    private static final List<String> SUPPORTED = List.of("mean", "mode", "median");

    private final List<String> estimates;

    /**
     * @param estimates names of the estimates to compute
     * @throws ConfigurationException for unsupported names
     */
    public PointEstimation(List<String> estimates) {
        for (String estimate : estimates) {
            if (!SUPPORTED.contains(estimate.toLowerCase(Locale.ROOT))) {
                throw new ConfigurationException("Unsupported point estimate '" + estimate + "'. Supported: " + SUPPORTED);
            }
        }
        this.estimates = estimates.stream().map(e -> e.toLowerCase(Locale.ROOT)).toList();
    }

    public List<String> getEstimates() {
        return estimates;
    }

    public static String columnName(String estimate) {
        return "z" + estimate;
    }

    /**
     * @return the ancillary column names this capability adds
     */
    public List<String> columnNames() {
        return estimates.stream().map(PointEstimation::columnName).toList();
    }

    /**
     * Returns the ensemble with the requested estimates added to its ancillary table.
     */
    public Ensemble apply(Ensemble ensemble) {
        if (estimates.isEmpty()) {
            return ensemble;
        }
        Table ancil = ensemble.hasAncil() ? ensemble.getAncil() : null;
        for (String estimate : estimates) {
            String column = columnName(estimate);
            if (ancil != null && ancil.hasColumn(column)) {
                continue;
            }
            double[] values = compute(ensemble, estimate);
            ancil = ancil == null ? Table.of(column, values) : ancil.withColumn(column, values);
        }
        return ensemble.withAncil(ancil);
    }

    private static double[] compute(Ensemble ensemble, String estimate) {
        return switch (estimate) {
            case "mean" -> ensemble.mean();
            case "mode" -> ensemble.mode();
            case "median" -> ensemble.median();
            default -> throw new IllegalStateException("Unexpected estimate " + estimate);
        };
    }
}
