package com.qqsuccubus.core.model;

/**
 * One value read from the monitoring backend: either a plain number or a distribution
 * summarizing many observations in the same bucket.
 */
public sealed interface Sample permits Sample.Scalar, Sample.Distribution {

    static Sample scalar(double value) {
        return new Scalar(value);
    }

    static Sample distribution(long count, double mean, double min, double max) {
        return new Distribution(count, mean, min, max);
    }

    /**
     * Single numeric reading (counter delta, gauge value, utilization fraction).
     */
    record Scalar(double value) implements Sample {
    }

    /**
     * Distribution summary of one bucket. Only {@code mean} survives normalization.
     */
    record Distribution(long count, double mean, double min, double max) implements Sample {
    }
}
