package org.railyard.pipeline.stages;

import java.util.List;

import org.railyard.pipeline.api.stages.StageParameter;

/**
 * Parameters used by many stages under the same name and meaning.
 * <p>
 * Stages include the ones they need in their declaration, optionally with a different
 * default via {@link StageParameter#withDefault(Object)}.
 */
public final class SharedParameters {

    public static final StageParameter<Long> CHUNK_SIZE =
            StageParameter.optional("chunkSize", Long.class, 10_000L, "Number of rows processed per chunk");

    public static final StageParameter<Double> Z_MIN =
            StageParameter.optional("zMin", Double.class, 0.0, "Lower edge of the redshift grid");

    public static final StageParameter<Double> Z_MAX =
            StageParameter.optional("zMax", Double.class, 3.0, "Upper edge of the redshift grid");

    public static final StageParameter<Long> NZ_BINS =
            StageParameter.optional("nzBins", Long.class, 301L, "Number of points of the redshift grid");

    public static final StageParameter<String> REDSHIFT_COL =
            StageParameter.optional("redshiftCol", String.class, "redshift", "Name of the true redshift column");

    public static final StageParameter<String> ID_COL =
            StageParameter.optional("idCol", String.class, "", "Name of the object id column, empty if none");

    public static final StageParameter<List<?>> CALCULATED_POINT_ESTIMATES =
            StageParameter.list("calculatedPointEstimates", List.of(),
                    "Point estimates (mean, mode, median) added to every output ensemble");

    private SharedParameters() {
    }

    /**
     * Builds the regular redshift grid described by {@code zMin}, {@code zMax} and {@code nzBins}.
     */
    public static double[] grid(double zMin, double zMax, int nzBins) {
        if (nzBins < 2 || zMax <= zMin) {
            throw new IllegalArgumentException(String.format("Invalid grid [%s, %s] with %d points", zMin, zMax, nzBins));
        }
        double[] grid = new double[nzBins];
        double step = (zMax - zMin) / (nzBins - 1);
        for (int i = 0; i < nzBins; i++) {
            grid[i] = zMin + i * step;
        }
        return grid;
    }
}
