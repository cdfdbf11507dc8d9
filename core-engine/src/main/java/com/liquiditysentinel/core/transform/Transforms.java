package com.liquiditysentinel.core.transform;

import com.liquiditysentinel.core.model.MetricSnapshot;
import com.liquiditysentinel.core.model.TimeSeries;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Pure transforms turning one {@link TimeSeries} into a derived series.
 *
 * <p>
 * Every transform keeps the input's date index and never mutates its input.
 * Points without enough history come out as {@code NaN}, as do points whose
 * computation would divide by zero.
 * </p>
 *
 * <h3>Rolling windows</h3>
 * <p>
 * Windows are trailing and measured in observations. A windowed value is
 * produced once the window holds at least {@code minPeriods} non-missing
 * observations; by default {@code minPeriods} is half the window.
 * </p>
 *
 * @since 1.0.0
 */
public final class Transforms {

    /** Trading days in a year. */
    public static final int DAILY_PERIODS_PER_YEAR = 252;

    /** Weeks in a year. */
    public static final int WEEKLY_PERIODS_PER_YEAR = 52;

    /** Trading days in one month. */
    public static final int DAILY_PERIODS_1M = 21;

    /** Trading days in three months. */
    public static final int DAILY_PERIODS_3M = 63;

    private Transforms() {
        // utility class
    }

    // ---------------------------------------------------------------
    // Changes
    // ---------------------------------------------------------------

    /**
     * Fractional change over {@code periods} observations,
     * {@code x[t] / x[t - periods] - 1}.
     *
     * @param series  input series
     * @param periods lag in observations, must be positive
     * @return change series; {@code NaN} where the base is missing or zero
     */
    public static TimeSeries pctChange(TimeSeries series, int periods) {
        requirePositive(periods, "periods");
        double[] x = values(series);
        double[] out = nanArray(x.length);
        for (int i = periods; i < x.length; i++) {
            double base = x[i - periods];
            if (base != 0.0) {
                out[i] = x[i] / base - 1.0;
            }
        }
        return series.withValues(series.getName() + "_pct_change", out);
    }

    /**
     * Difference over {@code periods} observations.
     *
     * @param series  input series
     * @param periods lag in observations, must be positive
     * @return {@code x[t] - x[t - periods]}
     */
    public static TimeSeries diff(TimeSeries series, int periods) {
        requirePositive(periods, "periods");
        double[] x = values(series);
        double[] out = nanArray(x.length);
        for (int i = periods; i < x.length; i++) {
            out[i] = x[i] - x[i - periods];
        }
        return series.withValues(series.getName() + "_diff", out);
    }

    /**
     * Year-over-year change in percent.
     *
     * @param series  input series
     * @param periods observations per year (252 daily, 52 weekly, 12 monthly)
     * @return YoY change, percent
     */
    public static TimeSeries yoy(TimeSeries series, int periods) {
        return scale(pctChange(series, periods), 100.0, series.getName() + "_yoy");
    }

    public static TimeSeries yoy(TimeSeries series) {
        return yoy(series, DAILY_PERIODS_PER_YEAR);
    }

    /**
     * One-month change in percent.
     *
     * @param series    input series
     * @param periods1m observations in one month
     * @return 1M change, percent
     */
    public static TimeSeries oneMonthChange(TimeSeries series, int periods1m) {
        return scale(pctChange(series, periods1m), 100.0, series.getName() + "_1m_change");
    }

    public static TimeSeries oneMonthChange(TimeSeries series) {
        return oneMonthChange(series, DAILY_PERIODS_1M);
    }

    /**
     * Three-month change compounded to an annual rate,
     * {@code ((1 + r) ^ 4 - 1) * 100}.
     *
     * @param series    input series
     * @param periods3m observations in three months
     * @return annualized change, percent
     */
    public static TimeSeries threeMonthAnnualized(TimeSeries series, int periods3m) {
        double[] r = pctChange(series, periods3m).values();
        double[] out = new double[r.length];
        for (int i = 0; i < r.length; i++) {
            out[i] = (Math.pow(1.0 + r[i], 4) - 1.0) * 100.0;
        }
        return series.withValues(series.getName() + "_3m_ann", out);
    }

    public static TimeSeries threeMonthAnnualized(TimeSeries series) {
        return threeMonthAnnualized(series, DAILY_PERIODS_3M);
    }

    // ---------------------------------------------------------------
    // Z-scores
    // ---------------------------------------------------------------

    /**
     * Rolling z-score: {@code (x - rolling mean) / rolling std}.
     *
     * @param series         input series
     * @param windowYears    window length in years
     * @param periodsPerYear observations per year
     * @param minPeriods     minimum valid observations, {@code null} for half
     *                       the window
     * @return z-score series; {@code NaN} where the rolling std is zero
     */
    public static TimeSeries zscore(TimeSeries series, int windowYears, int periodsPerYear, Integer minPeriods) {
        int window = window(windowYears, periodsPerYear);
        int required = minPeriods(window, minPeriods);
        double[] x = values(series);
        double[] out = nanArray(x.length);
        for (int i = 0; i < x.length; i++) {
            if (Double.isNaN(x[i])) {
                continue;
            }
            double[] w = validWindow(x, i, window);
            if (w.length < required) {
                continue;
            }
            double mean = mean(w);
            double std = sampleStd(w, mean);
            if (!Double.isNaN(std) && std != 0.0) {
                out[i] = (x[i] - mean) / std;
            }
        }
        return series.withValues(series.getName() + "_zscore", out);
    }

    public static TimeSeries zscore(TimeSeries series, int windowYears, int periodsPerYear) {
        return zscore(series, windowYears, periodsPerYear, null);
    }

    public static TimeSeries zscore(TimeSeries series) {
        return zscore(series, 3, DAILY_PERIODS_PER_YEAR, null);
    }

    /**
     * Change of the rolling z-score over {@code changePeriods} observations.
     *
     * @param series         input series
     * @param windowYears    z-score window in years
     * @param changePeriods  lag of the difference
     * @param periodsPerYear observations per year
     * @return z-score change series
     */
    public static TimeSeries zscoreChange(TimeSeries series, int windowYears, int changePeriods, int periodsPerYear) {
        TimeSeries z = zscore(series, windowYears, periodsPerYear, null);
        return series.withValues(series.getName() + "_zscore_change", diff(z, changePeriods).values());
    }

    public static TimeSeries zscoreChange(TimeSeries series) {
        return zscoreChange(series, 3, DAILY_PERIODS_1M, DAILY_PERIODS_PER_YEAR);
    }

    // ---------------------------------------------------------------
    // Shape
    // ---------------------------------------------------------------

    /**
     * Second difference: the change of the change.
     *
     * @param series            input series
     * @param firstDiffPeriods  lag of the first difference
     * @param secondDiffPeriods lag of the second difference
     * @return acceleration series
     */
    public static TimeSeries acceleration(TimeSeries series, int firstDiffPeriods, int secondDiffPeriods) {
        TimeSeries velocity = diff(series, firstDiffPeriods);
        return series.withValues(series.getName() + "_acceleration",
                diff(velocity, secondDiffPeriods).values());
    }

    public static TimeSeries acceleration(TimeSeries series) {
        return acceleration(series, DAILY_PERIODS_1M, DAILY_PERIODS_1M);
    }

    /**
     * Mark local peaks ({@code +1}) and troughs ({@code -1}).
     *
     * <p>
     * A point is a peak when it equals the maximum of the centered window of
     * {@code lookback} observations and both neighbours are strictly lower.
     * Troughs are symmetric. Points whose centered window runs off either end
     * of the series, or contains a missing value, are never marked. With a
     * positive {@code sensitivity} the absolute percent move over
     * {@code lookback} observations must also reach it.
     * </p>
     *
     * @param series      input series
     * @param lookback    centered window length, must be positive
     * @param sensitivity minimum absolute percent move; 0 disables the filter
     * @return series of -1, 0 and +1
     */
    public static TimeSeries detectInflection(TimeSeries series, int lookback, double sensitivity) {
        requirePositive(lookback, "lookback");
        double[] x = values(series);
        int n = x.length;
        int offset = (lookback - 1) / 2;
        double[] out = new double[n];

        for (int i = 0; i < n; i++) {
            int end = i + offset;
            int start = end - lookback + 1;
            if (start < 0 || end >= n || i == 0 || i == n - 1) {
                continue;
            }
            double max = Double.NEGATIVE_INFINITY;
            double min = Double.POSITIVE_INFINITY;
            boolean complete = true;
            for (int k = start; k <= end; k++) {
                if (Double.isNaN(x[k])) {
                    complete = false;
                    break;
                }
                max = Math.max(max, x[k]);
                min = Math.min(min, x[k]);
            }
            if (!complete) {
                continue;
            }

            boolean peak = x[i] == max && x[i - 1] < x[i] && x[i + 1] < x[i];
            boolean trough = x[i] == min && x[i - 1] > x[i] && x[i + 1] > x[i];

            if (sensitivity > 0 && (peak || trough)) {
                double move = i >= lookback && x[i - lookback] != 0.0
                        ? Math.abs(x[i] / x[i - lookback] - 1.0) * 100.0
                        : Double.NaN;
                if (!(move >= sensitivity)) {
                    continue;
                }
            }
            if (peak) {
                out[i] = 1.0;
            } else if (trough) {
                out[i] = -1.0;
            }
        }
        return series.withValues(series.getName() + "_inflection", out);
    }

    public static TimeSeries detectInflection(TimeSeries series) {
        return detectInflection(series, DAILY_PERIODS_1M, 0.0);
    }

    // ---------------------------------------------------------------
    // Percentile
    // ---------------------------------------------------------------

    /**
     * Rolling percentile rank of each value within its trailing window.
     *
     * @param series         input series
     * @param windowYears    window length in years
     * @param periodsPerYear observations per year
     * @param minPeriods     minimum valid observations, {@code null} for half
     *                       the window
     * @param kind           tie handling
     * @return percentile series in [0, 100]
     */
    public static TimeSeries percentile(TimeSeries series, int windowYears, int periodsPerYear,
                                        Integer minPeriods, PercentileKind kind) {
        return rollingPercentile(series, window(windowYears, periodsPerYear), minPeriods, kind);
    }

    public static TimeSeries percentile(TimeSeries series, int windowYears, int periodsPerYear) {
        return percentile(series, windowYears, periodsPerYear, null, PercentileKind.RANK);
    }

    public static TimeSeries percentile(TimeSeries series) {
        return percentile(series, 3, DAILY_PERIODS_PER_YEAR);
    }

    /**
     * Rolling percentile rank over a window given in observations.
     *
     * @param series     input series
     * @param window     window length in observations
     * @param minPeriods minimum valid observations, {@code null} for half the
     *                   window
     * @param kind       tie handling
     * @return percentile series in [0, 100]
     */
    public static TimeSeries rollingPercentile(TimeSeries series, int window, Integer minPeriods,
                                               PercentileKind kind) {
        requirePositive(window, "window");
        Objects.requireNonNull(kind, "kind must not be null");
        int required = minPeriods(window, minPeriods);
        double[] x = values(series);
        double[] out = nanArray(x.length);
        for (int i = 0; i < x.length; i++) {
            if (Double.isNaN(x[i])) {
                continue;
            }
            double[] w = validWindow(x, i, window);
            if (w.length < required) {
                continue;
            }
            out[i] = rank(w, x[i], kind);
        }
        return series.withValues(series.getName() + "_percentile", out);
    }

    // ---------------------------------------------------------------
    // Rolling statistics
    // ---------------------------------------------------------------

    /**
     * Rolling mean, std, min, max, median, skew and kurtosis.
     *
     * @param series     input series
     * @param window     window length in observations
     * @param minPeriods minimum valid observations, {@code null} for half the
     *                   window
     * @return the statistics bundle
     */
    public static RollingStatistics rollingStats(TimeSeries series, int window, Integer minPeriods) {
        requirePositive(window, "window");
        int required = minPeriods(window, minPeriods);
        double[] x = values(series);
        int n = x.length;
        double[] mean = nanArray(n);
        double[] std = nanArray(n);
        double[] min = nanArray(n);
        double[] max = nanArray(n);
        double[] median = nanArray(n);
        double[] skew = nanArray(n);
        double[] kurt = nanArray(n);

        for (int i = 0; i < n; i++) {
            double[] w = validWindow(x, i, window);
            if (w.length < required) {
                continue;
            }
            double m = mean(w);
            mean[i] = m;
            std[i] = sampleStd(w, m);
            double[] sorted = w.clone();
            Arrays.sort(sorted);
            min[i] = sorted[0];
            max[i] = sorted[sorted.length - 1];
            median[i] = median(sorted);
            skew[i] = skewness(w, m);
            kurt[i] = kurtosis(w, m);
        }

        String name = series.getName();
        return new RollingStatistics(
                series.withValues(name + "_mean", mean),
                series.withValues(name + "_std", std),
                series.withValues(name + "_min", min),
                series.withValues(name + "_max", max),
                series.withValues(name + "_median", median),
                series.withValues(name + "_skew", skew),
                series.withValues(name + "_kurt", kurt));
    }

    public static RollingStatistics rollingStats(TimeSeries series) {
        return rollingStats(series, DAILY_PERIODS_PER_YEAR, null);
    }

    // ---------------------------------------------------------------
    // Summaries and resampling
    // ---------------------------------------------------------------

    /**
     * Latest value together with its common transformations.
     *
     * <p>
     * Changes, z-scores and the percentile are only computed when the series
     * holds more than a year of daily observations.
     * </p>
     *
     * @param series         input series
     * @param includeChanges whether to compute the transformations
     * @return snapshot dated at the latest observation
     */
    public static MetricSnapshot latestValues(TimeSeries series, boolean includeChanges) {
        Objects.requireNonNull(series, "series must not be null");
        MetricSnapshot.Builder snapshot = MetricSnapshot.builder()
                .asOf(series.latestDate())
                .put("latest", series.latestValue());

        if (includeChanges && series.size() > DAILY_PERIODS_PER_YEAR) {
            snapshot.put("yoy", yoy(series).latestValue())
                    .put("3m_ann", threeMonthAnnualized(series).latestValue())
                    .put("1m_change", oneMonthChange(series).latestValue())
                    .put("zscore_3y", zscore(series, 3, DAILY_PERIODS_PER_YEAR).latestValue())
                    .put("zscore_5y", zscore(series, 5, DAILY_PERIODS_PER_YEAR).latestValue())
                    .put("percentile_3y", percentile(series, 3, DAILY_PERIODS_PER_YEAR).latestValue());
        }
        return snapshot.build();
    }

    /**
     * Resample to a calendar frequency.
     *
     * <p>
     * Observations are bucketed by period; each bucket is labelled with its
     * period-end date. Buckets without any valid observation are dropped.
     * </p>
     *
     * @param series      input series
     * @param frequency   target frequency
     * @param aggregation reduction applied to each bucket
     * @return resampled series
     */
    public static TimeSeries resample(TimeSeries series, Frequency frequency, Aggregation aggregation) {
        Objects.requireNonNull(frequency, "frequency must not be null");
        Objects.requireNonNull(aggregation, "aggregation must not be null");
        List<LocalDate> labels = new ArrayList<>();
        List<Double> reduced = new ArrayList<>();

        int i = 0;
        int n = series.size();
        while (i < n) {
            LocalDate periodEnd = frequency.periodEnd(series.dateAt(i));
            double first = Double.NaN;
            double last = Double.NaN;
            double sum = 0.0;
            int count = 0;
            while (i < n && frequency.periodEnd(series.dateAt(i)).equals(periodEnd)) {
                double v = series.valueAt(i);
                if (!Double.isNaN(v)) {
                    if (count == 0) {
                        first = v;
                    }
                    last = v;
                    sum += v;
                    count++;
                }
                i++;
            }
            if (count > 0) {
                labels.add(periodEnd);
                reduced.add(switch (aggregation) {
                    case LAST -> last;
                    case FIRST -> first;
                    case MEAN -> sum / count;
                });
            }
        }

        double[] out = new double[reduced.size()];
        for (int k = 0; k < out.length; k++) {
            out[k] = reduced.get(k);
        }
        return new TimeSeries(series.getName(), labels, out);
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static double[] values(TimeSeries series) {
        return Objects.requireNonNull(series, "series must not be null").values();
    }

    private static TimeSeries scale(TimeSeries series, double factor, String name) {
        double[] x = series.values();
        for (int i = 0; i < x.length; i++) {
            x[i] *= factor;
        }
        return series.withValues(name, x);
    }

    private static int window(int windowYears, int periodsPerYear) {
        requirePositive(windowYears, "windowYears");
        requirePositive(periodsPerYear, "periodsPerYear");
        return windowYears * periodsPerYear;
    }

    private static int minPeriods(int window, Integer minPeriods) {
        int required = minPeriods != null ? minPeriods : window / 2;
        return Math.max(1, required);
    }

    private static void requirePositive(int value, String name) {
        if (value <= 0) {
            throw new IllegalArgumentException(name + " must be > 0, got: " + value);
        }
    }

    private static double[] nanArray(int n) {
        double[] out = new double[n];
        Arrays.fill(out, Double.NaN);
        return out;
    }

    /** Non-missing values of the trailing window ending at {@code end}. */
    private static double[] validWindow(double[] x, int end, int window) {
        int start = Math.max(0, end - window + 1);
        double[] buf = new double[end - start + 1];
        int count = 0;
        for (int k = start; k <= end; k++) {
            if (!Double.isNaN(x[k])) {
                buf[count++] = x[k];
            }
        }
        return count == buf.length ? buf : Arrays.copyOf(buf, count);
    }

    private static double mean(double[] w) {
        double sum = 0.0;
        for (double v : w) {
            sum += v;
        }
        return sum / w.length;
    }

    private static double sampleStd(double[] w, double mean) {
        if (w.length < 2) {
            return Double.NaN;
        }
        double ss = 0.0;
        for (double v : w) {
            double d = v - mean;
            ss += d * d;
        }
        return Math.sqrt(ss / (w.length - 1));
    }

    private static double median(double[] sorted) {
        int n = sorted.length;
        return n % 2 == 1 ? sorted[n / 2] : (sorted[n / 2 - 1] + sorted[n / 2]) / 2.0;
    }

    private static double skewness(double[] w, double mean) {
        int n = w.length;
        if (n < 3) {
            return Double.NaN;
        }
        double m2 = 0.0;
        double m3 = 0.0;
        for (double v : w) {
            double d = v - mean;
            m2 += d * d;
            m3 += d * d * d;
        }
        m2 /= n;
        m3 /= n;
        if (m2 == 0.0) {
            return Double.NaN;
        }
        return Math.sqrt((double) n * (n - 1)) / (n - 2) * m3 / Math.pow(m2, 1.5);
    }

    private static double kurtosis(double[] w, double mean) {
        int n = w.length;
        if (n < 4) {
            return Double.NaN;
        }
        double m2 = 0.0;
        double m4 = 0.0;
        for (double v : w) {
            double d2 = (v - mean) * (v - mean);
            m2 += d2;
            m4 += d2 * d2;
        }
        m2 /= n;
        m4 /= n;
        if (m2 == 0.0) {
            return Double.NaN;
        }
        double g2 = m4 / (m2 * m2) - 3.0;
        return ((n + 1) * g2 + 6.0) * (n - 1) / ((double) (n - 2) * (n - 3));
    }

    private static double rank(double[] w, double score, PercentileKind kind) {
        int left = 0;
        int right = 0;
        for (double v : w) {
            if (v < score) {
                left++;
            }
            if (v <= score) {
                right++;
            }
        }
        int n = w.length;
        return switch (kind) {
            case RANK -> (left + right + (right > left ? 1 : 0)) * 50.0 / n;
            case WEAK -> right * 100.0 / n;
        };
    }
}
