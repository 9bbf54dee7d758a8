package com.qqsuccubus.core.normalize;

/**
 * Numeric function collapsing several samples that share a minute bucket and a label.
 * <ul>
 *   <li>{@link #SUM}: additive counters, e.g. total requests across container replicas</li>
 *   <li>{@link #MAX}: gauges and saturation metrics, e.g. peak CPU rather than total CPU</li>
 * </ul>
 */
public enum Reducer {
    SUM {
        @Override
        public double combine(double accumulated, double next) {
            return accumulated + next;
        }
    },
    MAX {
        @Override
        public double combine(double accumulated, double next) {
            return Math.max(accumulated, next);
        }
    };

    public abstract double combine(double accumulated, double next);
}
