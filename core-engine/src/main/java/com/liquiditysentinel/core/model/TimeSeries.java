package com.liquiditysentinel.core.model;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Immutable, date-indexed series of {@code double} observations for a single
 * indicator.
 *
 * <p>
 * Dates are strictly increasing and unique. Missing observations are stored
 * as {@link Double#NaN}. The index is never re-sorted or deduplicated here:
 * collaborators that load data are responsible for delivering clean input,
 * and a violation is rejected at construction time.
 * </p>
 *
 * <h3>Frequency</h3>
 * <p>
 * A series carries no frequency information. Transforms that need one take
 * a periods-per-year (or lag) parameter instead of inferring it from dates.
 * </p>
 *
 * @since 1.0.0
 */
public final class TimeSeries {

    private final String name;
    private final LocalDate[] dates;
    private final double[] values;

    /**
     * @param name   indicator name; must not be {@code null}
     * @param dates  strictly increasing dates; must not be {@code null}
     * @param values observations aligned with {@code dates}
     * @throws NullPointerException     if any argument or date is {@code null}
     * @throws IllegalArgumentException if lengths differ or dates are not
     *                                  strictly increasing
     */
    public TimeSeries(String name, List<LocalDate> dates, double[] values) {
        this(name, Objects.requireNonNull(dates, "dates must not be null").toArray(new LocalDate[0]),
                Objects.requireNonNull(values, "values must not be null").clone(), true);
    }

    private TimeSeries(String name, LocalDate[] dates, double[] values, boolean validate) {
        this.name = Objects.requireNonNull(name, "Series name must not be null");
        this.dates = dates;
        this.values = values;
        if (validate) {
            validateIndex();
        }
    }

    /**
     * Create an empty series.
     *
     * @param name indicator name
     * @return series with no observations
     */
    public static TimeSeries empty(String name) {
        return new TimeSeries(name, new LocalDate[0], new double[0], false);
    }

    /**
     * Create a series from consecutive dates spaced {@code stepDays} apart.
     *
     * <p>
     * Convenient for regularly sampled data (daily: 1, weekly: 7).
     * </p>
     *
     * @param name     indicator name
     * @param start    date of the first observation
     * @param stepDays spacing between observations, must be positive
     * @param values   observations
     * @return a new series
     */
    public static TimeSeries regular(String name, LocalDate start, int stepDays, double... values) {
        Objects.requireNonNull(start, "start must not be null");
        if (stepDays <= 0) {
            throw new IllegalArgumentException("stepDays must be > 0, got: " + stepDays);
        }
        LocalDate[] index = new LocalDate[values.length];
        for (int i = 0; i < values.length; i++) {
            index[i] = start.plusDays((long) i * stepDays);
        }
        return new TimeSeries(name, index, values.clone(), false);
    }

    // ---------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------

    public String getName() {
        return name;
    }

    public int size() {
        return values.length;
    }

    public boolean isEmpty() {
        return values.length == 0;
    }

    public LocalDate dateAt(int i) {
        return dates[i];
    }

    public double valueAt(int i) {
        return values[i];
    }

    /**
     * @return copy of the observations
     */
    public double[] values() {
        return values.clone();
    }

    /**
     * @return unmodifiable view of the date index
     */
    public List<LocalDate> dates() {
        return Collections.unmodifiableList(Arrays.asList(dates));
    }

    /**
     * @return the last observation, or {@code NaN} when the series is empty
     */
    public double latestValue() {
        return values.length == 0 ? Double.NaN : values[values.length - 1];
    }

    /**
     * @return the last date, or {@code null} when the series is empty
     */
    public LocalDate latestDate() {
        return dates.length == 0 ? null : dates[dates.length - 1];
    }

    // ---------------------------------------------------------------
    // Derivation
    // ---------------------------------------------------------------

    /**
     * Return a new series on the same index with different values.
     *
     * @param newName   name of the derived series
     * @param newValues values aligned with this index
     * @return derived series
     * @throws IllegalArgumentException if the lengths differ
     */
    public TimeSeries withValues(String newName, double[] newValues) {
        if (newValues.length != values.length) {
            throw new IllegalArgumentException("Expected " + values.length
                    + " values for '" + newName + "', got: " + newValues.length);
        }
        return new TimeSeries(newName, dates, newValues.clone(), false);
    }

    /**
     * Restrict the series to observations dated on or before {@code asOf}.
     *
     * @param asOf cut-off date; {@code null} returns this series unchanged
     * @return truncated series
     */
    public TimeSeries truncateTo(LocalDate asOf) {
        if (asOf == null) {
            return this;
        }
        int end = 0;
        while (end < dates.length && !dates[end].isAfter(asOf)) {
            end++;
        }
        if (end == dates.length) {
            return this;
        }
        return new TimeSeries(name, Arrays.copyOf(dates, end), Arrays.copyOf(values, end), false);
    }

    /**
     * Value of the last observation dated on or before {@code asOf}.
     *
     * @param asOf cut-off date, {@code null} for the latest observation
     * @return the observation, or {@code NaN} when none exists
     */
    public double valueAsOf(LocalDate asOf) {
        return truncateTo(asOf).latestValue();
    }

    /**
     * Subtract another series, matching observations by date.
     *
     * <p>
     * Only dates present in both series are kept.
     * </p>
     *
     * @param other   series to subtract
     * @param newName name of the result
     * @return difference series
     */
    public TimeSeries minus(TimeSeries other, String newName) {
        Objects.requireNonNull(other, "other must not be null");
        List<LocalDate> joined = new ArrayList<>();
        List<Double> diffs = new ArrayList<>();
        int i = 0;
        int j = 0;
        while (i < dates.length && j < other.dates.length) {
            int cmp = dates[i].compareTo(other.dates[j]);
            if (cmp == 0) {
                joined.add(dates[i]);
                diffs.add(values[i] - other.values[j]);
                i++;
                j++;
            } else if (cmp < 0) {
                i++;
            } else {
                j++;
            }
        }
        double[] out = new double[diffs.size()];
        for (int k = 0; k < out.length; k++) {
            out[k] = diffs.get(k);
        }
        return new TimeSeries(newName, joined.toArray(new LocalDate[0]), out, false);
    }

    /**
     * @param other another series
     * @return {@code true} when both series share exactly the same date index
     */
    public boolean isAlignedWith(TimeSeries other) {
        return other != null && Arrays.equals(dates, other.dates);
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private void validateIndex() {
        if (dates.length != values.length) {
            throw new IllegalArgumentException("Series '" + name + "' has " + dates.length
                    + " dates but " + values.length + " values");
        }
        for (int i = 0; i < dates.length; i++) {
            Objects.requireNonNull(dates[i], "Date at index " + i + " of '" + name + "' is null");
            if (i > 0 && !dates[i].isAfter(dates[i - 1])) {
                throw new IllegalArgumentException("Series '" + name
                        + "' dates must be strictly increasing, violated at index " + i
                        + " (" + dates[i - 1] + " -> " + dates[i] + ")");
            }
        }
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof TimeSeries that))
            return false;
        return name.equals(that.name)
                && Arrays.equals(dates, that.dates)
                && Arrays.equals(values, that.values);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hash(name) + 17 * Arrays.hashCode(dates) + Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return "TimeSeries{" +
                "name='" + name + '\'' +
                ", size=" + values.length +
                ", first=" + (dates.length == 0 ? null : dates[0]) +
                ", last=" + latestDate() +
                '}';
    }
}
