package com.cadence.features;

/**
 * Numerically stable running mean and variance (Welford).
 *
 * Supports removal of a previously added value so it can back a rolling window
 * with oldest-first eviction.
 */
public final class RunningStats {

    private long count;
    private double mean;
    private double m2;

    public RunningStats() {
    }

    public RunningStats(long count, double mean, double variance) {
        this.count = count;
        this.mean = mean;
        this.m2 = count > 1 ? variance * (count - 1) : 0.0;
    }

    public void add(double value) {
        count++;
        double delta = value - mean;
        mean += delta / count;
        m2 += delta * (value - mean);
    }

    /**
     * Removes a value that was added earlier.
     */
    public void remove(double value) {
        if (count == 0) {
            throw new IllegalStateException("Cannot remove from empty statistics");
        }
        if (count == 1) {
            reset();
            return;
        }
        double delta = value - mean;
        count--;
        mean -= delta / count;
        m2 -= delta * (value - mean);
        if (m2 < 0) {
            m2 = 0;
        }
    }

    public void reset() {
        count = 0;
        mean = 0.0;
        m2 = 0.0;
    }

    public long count() {
        return count;
    }

    public double mean() {
        return count == 0 ? Double.NaN : mean;
    }

    /**
     * Sample variance, zero for fewer than two values
     */
    public double variance() {
        return count > 1 ? m2 / (count - 1) : 0.0;
    }

    public double stdDev() {
        return Math.sqrt(variance());
    }

    @Override
    public String toString() {
        return "RunningStats{count=" + count + ", mean=" + mean() + ", stdDev=" + stdDev() + "}";
    }
}
