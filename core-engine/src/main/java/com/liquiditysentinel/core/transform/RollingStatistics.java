package com.liquiditysentinel.core.transform;

import com.liquiditysentinel.core.model.TimeSeries;

import java.util.Objects;

/**
 * Rolling summary statistics of one series, all on the input's index.
 *
 * @since 1.0.0
 */
public final class RollingStatistics {

    private final TimeSeries mean;
    private final TimeSeries std;
    private final TimeSeries min;
    private final TimeSeries max;
    private final TimeSeries median;
    private final TimeSeries skew;
    private final TimeSeries kurtosis;

    RollingStatistics(TimeSeries mean, TimeSeries std, TimeSeries min, TimeSeries max,
                      TimeSeries median, TimeSeries skew, TimeSeries kurtosis) {
        this.mean = Objects.requireNonNull(mean);
        this.std = Objects.requireNonNull(std);
        this.min = Objects.requireNonNull(min);
        this.max = Objects.requireNonNull(max);
        this.median = Objects.requireNonNull(median);
        this.skew = Objects.requireNonNull(skew);
        this.kurtosis = Objects.requireNonNull(kurtosis);
    }

    public TimeSeries getMean() {
        return mean;
    }

    /** Sample standard deviation. */
    public TimeSeries getStd() {
        return std;
    }

    public TimeSeries getMin() {
        return min;
    }

    public TimeSeries getMax() {
        return max;
    }

    public TimeSeries getMedian() {
        return median;
    }

    /** Adjusted Fisher-Pearson skewness. */
    public TimeSeries getSkew() {
        return skew;
    }

    /** Unbiased excess kurtosis. */
    public TimeSeries getKurtosis() {
        return kurtosis;
    }
}
