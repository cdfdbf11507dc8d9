package com.liquiditysentinel.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link TimeSeries}.
 */
class TimeSeriesTest {

    private static final LocalDate START = LocalDate.of(2024, 1, 1);

    @Test
    @DisplayName("Should reject dates that are not strictly increasing")
    void shouldRejectUnsortedDates() {
        List<LocalDate> dates = List.of(START, START.plusDays(2), START.plusDays(1));

        assertThatThrownBy(() -> new TimeSeries("x", dates, new double[]{1, 2, 3}))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("strictly increasing");
    }

    @Test
    @DisplayName("Should reject duplicate dates")
    void shouldRejectDuplicateDates() {
        List<LocalDate> dates = List.of(START, START);

        assertThatThrownBy(() -> new TimeSeries("x", dates, new double[]{1, 2}))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should reject mismatched lengths")
    void shouldRejectLengthMismatch() {
        assertThatThrownBy(() -> new TimeSeries("x", List.of(START), new double[]{1, 2}))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("1 dates but 2 values");
    }

    @Test
    @DisplayName("Should not expose internal values array")
    void shouldCopyValues() {
        double[] raw = {1, 2, 3};
        TimeSeries series = new TimeSeries("x", List.of(START, START.plusDays(1), START.plusDays(2)), raw);
        raw[0] = 99;
        series.values()[1] = 99;

        assertThat(series.values()).containsExactly(1, 2, 3);
    }

    @Test
    @DisplayName("Should return NaN and null latest on an empty series")
    void shouldHandleEmptySeries() {
        TimeSeries empty = TimeSeries.empty("x");

        assertThat(empty.isEmpty()).isTrue();
        assertThat(empty.latestValue()).isNaN();
        assertThat(empty.latestDate()).isNull();
    }

    @Test
    @DisplayName("Should look up the last value on or before a date")
    void shouldResolveValueAsOf() {
        TimeSeries weekly = TimeSeries.regular("x", START, 7, 10, 20, 30);

        assertThat(weekly.valueAsOf(START.plusDays(10))).isEqualTo(20);
        assertThat(weekly.valueAsOf(START.plusDays(14))).isEqualTo(30);
        assertThat(weekly.valueAsOf(START.minusDays(1))).isNaN();
        assertThat(weekly.valueAsOf(null)).isEqualTo(30);
    }

    @Test
    @DisplayName("Should truncate to observations on or before a date")
    void shouldTruncate() {
        TimeSeries daily = TimeSeries.regular("x", START, 1, 1, 2, 3, 4);

        TimeSeries truncated = daily.truncateTo(START.plusDays(1));

        assertThat(truncated.size()).isEqualTo(2);
        assertThat(truncated.latestDate()).isEqualTo(START.plusDays(1));
    }

    @Test
    @DisplayName("Should subtract on the intersection of both indexes")
    void shouldSubtractOnCommonDates() {
        TimeSeries a = TimeSeries.regular("a", START, 1, 5, 6, 7, 8);
        TimeSeries b = TimeSeries.regular("b", START.plusDays(2), 1, 1, 1, 1);

        TimeSeries gap = a.minus(b, "gap");

        assertThat(gap.getName()).isEqualTo("gap");
        assertThat(gap.dates()).containsExactly(START.plusDays(2), START.plusDays(3));
        assertThat(gap.values()).containsExactly(6, 7);
    }

    @Test
    @DisplayName("Should detect alignment by exact date index")
    void shouldDetectAlignment() {
        TimeSeries a = TimeSeries.regular("a", START, 1, 1, 2);
        TimeSeries b = TimeSeries.regular("b", START, 1, 3, 4);
        TimeSeries c = TimeSeries.regular("c", START.plusDays(1), 1, 3, 4);

        assertThat(a.isAlignedWith(b)).isTrue();
        assertThat(a.isAlignedWith(c)).isFalse();
        assertThat(a.isAlignedWith(null)).isFalse();
    }

    @Test
    @DisplayName("Should keep the index when deriving values")
    void shouldDeriveOnSameIndex() {
        TimeSeries a = TimeSeries.regular("a", START, 7, 1, 2);

        TimeSeries derived = a.withValues("b", new double[]{0.5, 0.25});

        assertThat(derived.dates()).isEqualTo(a.dates());
        assertThat(derived.valueAt(1)).isCloseTo(0.25, within(1e-12));
        assertThatThrownBy(() -> a.withValues("c", new double[]{1}))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
