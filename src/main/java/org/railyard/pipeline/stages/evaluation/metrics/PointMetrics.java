package org.railyard.pipeline.stages.evaluation.metrics;

import java.io.Serializable;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import org.railyard.pipeline.api.evaluation.IMetric;
import org.railyard.pipeline.api.stages.ConfigurationException;

/**
 * Helpers shared by the point-estimate metrics.
 */
public final class PointMetrics {

    private PointMetrics() {
    }

    /**
     * Sufficient statistics for mean and variance.
     */
    public record Moments(long count, double sum, double sumOfSquares) implements Serializable {

        public static Moments of(double[] values) {
            double sum = 0.0;
            double sumSq = 0.0;
            for (double v : values) {
                sum += v;
                sumSq += v * v;
            }
            return new Moments(values.length, sum, sumSq);
        }

        public static Moments merge(List<Moments> parts) {
            long count = 0;
            double sum = 0.0;
            double sumSq = 0.0;
            for (Moments m : parts) {
                count += m.count;
                sum += m.sum;
                sumSq += m.sumOfSquares;
            }
            return new Moments(count, sum, sumSq);
        }

        public double mean() {
            return count == 0 ? Double.NaN : sum / count;
        }

        /**
         * @return population standard deviation
         */
        public double standardDeviation() {
            if (count == 0) {
                return Double.NaN;
            }
            double mean = mean();
            return Math.sqrt(Math.max(0.0, sumOfSquares / count - mean * mean));
        }
    }

    /**
     * @return {@code (estimate - truth) / (1 + truth)} per object
     */
    public static double[] deltaZ(PointData data) {
        double[] dz = new double[data.size()];
        for (int i = 0; i < dz.length; i++) {
            double truth = data.truths()[i];
            dz[i] = (data.estimates()[i] - truth) / (1.0 + truth);
        }
        return dz;
    }

    public static double median(double[] values) {
        if (values.length == 0) {
            return Double.NaN;
        }
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        int mid = sorted.length / 2;
        return sorted.length % 2 == 1 ? sorted[mid] : 0.5 * (sorted[mid - 1] + sorted[mid]);
    }

    static double getDouble(Map<String, Object> options, String key, double defaultValue, IMetric<?> metric) {
        Object value = options.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (!(value instanceof Number number)) {
            throw new ConfigurationException(String.format("Metric '%s': option '%s' must be a number, got %s",
                    metric.getName(), key, value));
        }
        return number.doubleValue();
    }

    static int getInt(Map<String, Object> options, String key, int defaultValue, IMetric<?> metric) {
        Object value = options.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (!(value instanceof Number number) || number.doubleValue() != Math.rint(number.doubleValue())) {
            throw new ConfigurationException(String.format("Metric '%s': option '%s' must be an integer, got %s",
                    metric.getName(), key, value));
        }
        return number.intValue();
    }
}
