package com.liquiditysentinel.core.input;

import com.liquiditysentinel.core.model.TimeSeries;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link IndicatorSet}.
 */
class IndicatorSetTest {

    private static final LocalDate START = LocalDate.of(2024, 1, 1);

    @Test
    @DisplayName("Should resolve a role from any of its aliases")
    void shouldResolveAlias() {
        TimeSeries hy = series("hy_spread");

        IndicatorSet set = IndicatorSet.resolve(Map.of("hy_spread", hy));

        assertThat(set.get(IndicatorRole.SPREAD)).containsSame(hy);
        assertThat(set.has(IndicatorRole.VIX)).isFalse();
    }

    @Test
    @DisplayName("Should prefer the first alias when several are supplied")
    void shouldPreferFirstAlias() {
        TimeSeries canonical = series("credit_growth");
        TimeSeries fallback = series("bank_credit");
        Map<String, TimeSeries> data = new LinkedHashMap<>();
        data.put("bank_credit", fallback);
        data.put("credit_growth", canonical);

        IndicatorSet set = IndicatorSet.resolve(data);

        assertThat(set.get(IndicatorRole.CREDIT)).containsSame(canonical);
    }

    @Test
    @DisplayName("Should skip null entries and fall back to the next alias")
    void shouldSkipNullEntries() {
        TimeSeries sp500 = series("sp500");
        Map<String, TimeSeries> data = new HashMap<>();
        data.put("equity", null);
        data.put("sp500", sp500);

        IndicatorSet set = IndicatorSet.resolve(data);

        assertThat(set.get(IndicatorRole.EQUITY)).containsSame(sp500);
        assertThat(set.supplied()).containsOnlyKeys("sp500");
    }

    @Test
    @DisplayName("Should keep unrecognised names in the supplied map only")
    void shouldKeepUnknownNames() {
        IndicatorSet set = IndicatorSet.resolve(Map.of("m2", series("m2")));

        assertThat(set.supplied()).containsKey("m2");
        for (IndicatorRole role : IndicatorRole.values()) {
            assertThat(set.has(role)).isFalse();
        }
    }

    @Test
    @DisplayName("Should report no data for an empty series")
    void shouldReportEmptySeries() {
        IndicatorSet set = IndicatorSet.resolve(Map.of("vix", TimeSeries.empty("vix")));

        assertThat(set.has(IndicatorRole.VIX)).isTrue();
        assertThat(set.hasData(IndicatorRole.VIX)).isFalse();
    }

    @Test
    @DisplayName("Should treat a null map as empty")
    void shouldAcceptNullMap() {
        IndicatorSet set = IndicatorSet.resolve(null);

        assertThat(set.supplied()).isEmpty();
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static TimeSeries series(String name) {
        return TimeSeries.regular(name, START, 1, 1, 2, 3);
    }
}
