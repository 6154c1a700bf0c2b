package org.railyard.pipeline.stages.evaluation.metrics;

/**
 * Paired point estimates and true values of the same objects.
 *
 * @param estimates estimated values, one per object
 * @param truths    true values, aligned with {@code estimates}
 */
public record PointData(double[] estimates, double[] truths) {

    public PointData {
        if (estimates.length != truths.length) {
            throw new IllegalArgumentException(String.format(
                    "%d estimates but %d true values", estimates.length, truths.length));
        }
    }

    public int size() {
        return estimates.length;
    }
}
