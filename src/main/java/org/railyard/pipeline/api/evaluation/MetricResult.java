package org.railyard.pipeline.api.evaluation;

import java.util.Objects;

import org.railyard.pipeline.api.data.Table;

/**
 * Result of evaluating one metric, shaped according to its {@link MetricOutputType}.
 */
public final class MetricResult {

    private final MetricOutputType type;
    private final double[] perObject;
    private final double value;
    private final Table distribution;

    private MetricResult(MetricOutputType type, double[] perObject, double value, Table distribution) {
        this.type = type;
        this.perObject = perObject;
        this.value = value;
        this.distribution = distribution;
    }

    public static MetricResult perObject(double[] values) {
        return new MetricResult(MetricOutputType.ONE_VALUE_PER_DISTRIBUTION, Objects.requireNonNull(values).clone(), Double.NaN, null);
    }

    public static MetricResult value(double value) {
        return new MetricResult(MetricOutputType.SINGLE_VALUE, null, value, null);
    }

    public static MetricResult distribution(Table distribution) {
        return new MetricResult(MetricOutputType.SINGLE_DISTRIBUTION, null, Double.NaN, Objects.requireNonNull(distribution));
    }

    public MetricOutputType getType() {
        return type;
    }

    public double[] getPerObject() {
        requireType(MetricOutputType.ONE_VALUE_PER_DISTRIBUTION);
        return perObject.clone();
    }

    public double getValue() {
        requireType(MetricOutputType.SINGLE_VALUE);
        return value;
    }

    public Table getDistribution() {
        requireType(MetricOutputType.SINGLE_DISTRIBUTION);
        return distribution;
    }

    private void requireType(MetricOutputType expected) {
        if (type != expected) {
            throw new IllegalStateException("Result is " + type + ", not " + expected);
        }
    }

    @Override
    public String toString() {
        return switch (type) {
            case ONE_VALUE_PER_DISTRIBUTION -> "MetricResult[" + perObject.length + " values]";
            case SINGLE_VALUE -> "MetricResult[" + value + "]";
            case SINGLE_DISTRIBUTION -> "MetricResult[" + distribution + "]";
        };
    }
}
