package com.liquiditysentinel.core.regime;

import com.liquiditysentinel.core.input.IndicatorSet;
import com.liquiditysentinel.core.model.MetricSnapshot;
import com.liquiditysentinel.core.model.Regime;
import com.liquiditysentinel.core.model.RegimeResult;
import com.liquiditysentinel.core.model.RegimeScore;
import com.liquiditysentinel.core.model.TimeSeries;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Map;

import static com.liquiditysentinel.core.regime.RegimeClassifier.CREDIT_GROWTH_3M;
import static com.liquiditysentinel.core.regime.RegimeClassifier.EQUITY_1M_RETURN;
import static com.liquiditysentinel.core.regime.RegimeClassifier.SPREAD_ZSCORE;
import static com.liquiditysentinel.core.regime.RegimeClassifier.VAL_EARN_GAP;
import static com.liquiditysentinel.core.regime.RegimeClassifier.VIX_PERCENTILE;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link RegimeClassifier}.
 */
class RegimeClassifierTest {

    private static final LocalDate TODAY = LocalDate.of(2024, 6, 30);
    private static final Clock CLOCK = Clock.fixed(TODAY.atStartOfDay().toInstant(ZoneOffset.UTC), ZoneOffset.UTC);

    private RegimeClassifier classifier;

    @BeforeEach
    void setUp() {
        classifier = new RegimeClassifier(new RegimeThresholds(), new RegimeWeights(), CLOCK);
    }

    @Nested
    @DisplayName("Scoring")
    class Scoring {

        @Test
        @DisplayName("Should make Stress primary with strong credit, wide spreads and extreme volatility")
        void shouldScoreStressScenario() {
            RegimeScore scores = classifier.calculateScores(metrics(12.0, 1.5, 95.0, null, null));

            assertThat(scores.primary()).isEqualTo(Regime.STRESS);
            assertThat(scores.getStress()).isCloseTo(70.0, within(1e-9));
            assertThat(scores.getExpansion()).isCloseTo(30.0 / 55.0 * 70.0, within(1e-9));
            assertThat(scores.getContraction()).isCloseTo(20.0 / 55.0 * 70.0, within(1e-9));
            assertThat(scores.getLateCycle()).isZero();
        }

        @Test
        @DisplayName("Should make Late Cycle primary when valuations run ahead of earnings")
        void shouldScoreLateCycleScenario() {
            RegimeScore scores = classifier.calculateScores(metrics(1.5, 0.0, 50.0, null, 1.0));

            assertThat(scores.primary()).isEqualTo(Regime.LATE_CYCLE);
            assertThat(scores.getLateCycle()).isCloseTo(70.0, within(1e-9));
            assertThat(scores.getExpansion()).isCloseTo(5.0, within(1e-9));
        }

        @Test
        @DisplayName("Should make Contraction primary with shrinking credit and high volatility")
        void shouldScoreContractionScenario() {
            RegimeScore scores = classifier.calculateScores(metrics(-2.0, 0.5, 80.0, -2.0, null));

            assertThat(scores.primary()).isEqualTo(Regime.CONTRACTION);
            assertThat(scores.getContraction()).isCloseTo(70.0, within(1e-9));
        }

        @Test
        @DisplayName("Should add stress points for an equity drawdown")
        void shouldScoreEquityDrawdown() {
            RegimeScore calm = classifier.calculateScores(metrics(1.5, 0.0, 50.0, 1.0, null));
            RegimeScore drawdown = classifier.calculateScores(metrics(1.5, 0.0, 50.0, -8.0, null));

            assertThat(calm.getStress()).isZero();
            assertThat(drawdown.getStress()).isGreaterThan(0);
        }

        @Test
        @DisplayName("Should score zero everywhere without metrics and pick the first regime")
        void shouldHandleNoMetrics() {
            RegimeScore scores = classifier.calculateScores(MetricSnapshot.empty());

            assertThat(scores.toMap().values()).containsOnly(0.0);
            assertThat(scores.primary()).isEqualTo(Regime.EXPANSION);
        }

        @Test
        @DisplayName("Should clamp a negative total to zero")
        void shouldClampPenaltyToZero() {
            RegimeScore scores = classifier.calculateScores(metrics(null, null, null, null, 2.0));

            assertThat(scores.getExpansion()).isZero();
            assertThat(scores.getLateCycle()).isCloseTo(70.0, within(1e-9));
        }

        @Test
        @DisplayName("Should never lower the Expansion score as credit growth rises")
        void shouldBeMonotonicInCredit() {
            double previous = -1;
            for (double credit = -6; credit <= 12; credit += 0.5) {
                double expansion = classifier.calculateScores(metrics(credit, 0.0, 50.0, null, null)).getExpansion();
                assertThat(expansion).as("expansion at credit %s", credit).isGreaterThanOrEqualTo(previous);
                previous = expansion;
            }
        }

        @Test
        @DisplayName("Should keep every score within [0, 100] for custom weights")
        void shouldRespectNormalizationFactor() {
            RegimeWeights weights = new RegimeWeights();
            weights.setNormalizationFactor(1.0);
            RegimeClassifier full = new RegimeClassifier(new RegimeThresholds(), weights, CLOCK);

            RegimeScore scores = full.calculateScores(metrics(12.0, 1.5, 95.0, -10.0, 3.0));

            assertThat(scores.getStress()).isCloseTo(100.0, within(1e-9));
            assertThat(scores.toMap().values()).allSatisfy(v -> assertThat(v).isBetween(0.0, 100.0));
        }

        @Test
        @DisplayName("Should ignore changes made to thresholds and weights after construction")
        void shouldNotFollowConfigChanges() {
            RegimeThresholds thresholds = new RegimeThresholds();
            RegimeWeights weights = new RegimeWeights();
            RegimeClassifier copied = new RegimeClassifier(thresholds, weights, CLOCK);

            thresholds.setVixStress(99);
            weights.setVolStressStress(0);

            RegimeScore scores = copied.calculateScores(metrics(12.0, 1.5, 95.0, null, null));
            assertThat(scores.getStress()).isCloseTo(70.0, within(1e-9));
        }

        @Test
        @DisplayName("Should reject invalid thresholds or weights at construction")
        void shouldRejectInvalidConfig() {
            RegimeThresholds thresholds = new RegimeThresholds();
            thresholds.setCreditGrowthContraction(5.0);
            RegimeWeights weights = new RegimeWeights();
            weights.setNormalizationFactor(1.5);

            assertThatThrownBy(() -> new RegimeClassifier(thresholds, new RegimeWeights(), CLOCK))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("creditGrowthContraction");
            assertThatThrownBy(() -> new RegimeClassifier(new RegimeThresholds(), weights, CLOCK))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("normalizationFactor");
        }

        @Test
        @DisplayName("Should measure confidence as the gap between the top two scores")
        void shouldComputeConfidence() {
            assertThat(RegimeClassifier.confidence(new RegimeScore(40, 10, 25, 5))).isCloseTo(0.15, within(1e-12));
            assertThat(RegimeClassifier.confidence(new RegimeScore(0, 0, 0, 0))).isZero();
        }
    }

    @Nested
    @DisplayName("Explanations")
    class Explanations {

        @Test
        @DisplayName("Should always give three explanation lines")
        void shouldAlwaysGiveThreeLines() {
            for (Regime regime : Regime.values()) {
                assertThat(classifier.explain(MetricSnapshot.empty(), regime)).hasSize(3);
                assertThat(classifier.explain(metrics(2.0, 0.3, 60.0, 1.0, 0.8), regime)).hasSize(3);
            }
        }

        @Test
        @DisplayName("Should describe the stress signal with volatility and spread figures")
        void shouldDescribeStress() {
            assertThat(classifier.explain(metrics(12.0, 1.5, 95.0, null, null), Regime.STRESS))
                    .containsExactly(
                            "Credit growth 12.0% (3M annualized)",
                            "Volatility at 95th percentile, spread z=1.5 - collateral stress signal",
                            "Vulnerability: leveraged position liquidation, liquidity squeeze risk");
        }

        @Test
        @DisplayName("Should warn about belief overheating in a late cycle")
        void shouldWarnAboutOverheating() {
            assertThat(classifier.explain(metrics(1.5, 0.0, 50.0, null, 1.2), Regime.LATE_CYCLE).get(2))
                    .isEqualTo("Valuations exceed earnings by 1.2σ - belief overheating warning");
        }
    }

    @Nested
    @DisplayName("Classification from series")
    class Classification {

        @Test
        @DisplayName("Should classify empty input without throwing")
        void shouldHandleEmptyInput() {
            RegimeResult result = classifier.classify(Map.of(), null);

            assertThat(result.getPrimaryRegime()).isEqualTo(Regime.EXPANSION);
            assertThat(result.getConfidence()).isZero();
            assertThat(result.getExplanations()).hasSize(3);
            assertThat(result.getMetrics().size()).isZero();
            assertThat(result.getDataQualityWarning())
                    .contains("Missing core indicators: 3 of 3 unavailable (credit_growth, spread, vix)");
        }

        @Test
        @DisplayName("Should classify steadily growing credit as Expansion")
        void shouldClassifyExpansion() {
            RegimeResult result = classifier.classify(Map.of("credit", growingWeekly(TODAY, 80)), null);

            double expected = (Math.pow(1.005, 52) - 1.0) * 100.0;
            assertThat(result.getMetrics().getValue(CREDIT_GROWTH_3M).orElseThrow()).isCloseTo(expected, within(1e-6));
            assertThat(result.getPrimaryRegime()).isEqualTo(Regime.EXPANSION);
            assertThat(result.getConfidence()).isCloseTo(0.7, within(1e-9));
            assertThat(result.getExplanations().get(0)).startsWith("Credit growth persisting");
        }

        @Test
        @DisplayName("Should resolve indicator aliases")
        void shouldResolveAliases() {
            RegimeResult result = classifier.classify(Map.of("bank_credit", growingWeekly(TODAY, 80)), null);

            assertThat(result.getMetrics().has(CREDIT_GROWTH_3M)).isTrue();
        }

        @Test
        @DisplayName("Should leave out a metric without enough history")
        void shouldSkipShortHistory() {
            RegimeResult result = classifier.classify(
                    Map.of("credit", growingWeekly(TODAY, RegimeClassifier.CREDIT_MIN_HISTORY)), null);

            assertThat(result.getMetrics().has(CREDIT_GROWTH_3M)).isFalse();
        }

        @Test
        @DisplayName("Should compute the valuation gap on shared dates only")
        void shouldJoinValuationAndEarnings() {
            TimeSeries valuation = TimeSeries.regular("valuation_zscore", LocalDate.of(2024, 6, 3), 7, 1.0, 1.5, 2.0);
            TimeSeries earnings = TimeSeries.regular("earnings_zscore", LocalDate.of(2024, 6, 3), 7, 0.5, 0.5);

            RegimeResult result = classifier.classify(
                    Map.of("valuation_zscore", valuation, "earnings_zscore", earnings), null);

            assertThat(result.getMetrics().getValue(VAL_EARN_GAP)).contains(1.0);
        }

        @Test
        @DisplayName("Should report stale series and missing core indicators together")
        void shouldWarnAboutStaleData() {
            LocalDate lastObservation = TODAY.minusDays(29);

            RegimeResult result = classifier.classify(Map.of("credit", growingWeekly(lastObservation, 80)), null);

            assertThat(result.getDataQualityWarning()).contains(
                    "Missing core indicators: 2 of 3 unavailable (spread, vix); credit data is 29 days old");
        }

        @Test
        @DisplayName("Should give no warning for fresh core data")
        void shouldNotWarnForFreshData() {
            TimeSeries spread = TimeSeries.regular("spread", TODAY.minusDays(3), 1, 4.0);
            TimeSeries vix = TimeSeries.regular("vix", TODAY.minusDays(1), 1, 15.0);

            RegimeResult result = classifier.classify(
                    Map.of("credit", growingWeekly(TODAY, 10), "spread", spread, "vix", vix), null);

            assertThat(result.getDataQualityWarning()).isEmpty();
        }

        @Test
        @DisplayName("Should reject a null indicator set")
        void shouldRejectNullIndicators() {
            assertThatThrownBy(() -> classifier.classify((IndicatorSet) null, null))
                    .isInstanceOf(NullPointerException.class);
        }
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static MetricSnapshot metrics(Double credit, Double spreadZ, Double vixPct,
                                          Double equity1m, Double valEarnGap) {
        return MetricSnapshot.builder()
                .put(CREDIT_GROWTH_3M, credit)
                .put(SPREAD_ZSCORE, spreadZ)
                .put(VIX_PERCENTILE, vixPct)
                .put(EQUITY_1M_RETURN, equity1m)
                .put(VAL_EARN_GAP, valEarnGap)
                .build();
    }

    /** Weekly series growing 0.5% per week and ending on {@code end}. */
    private static TimeSeries growingWeekly(LocalDate end, int size) {
        double[] values = new double[size];
        for (int i = 0; i < size; i++) {
            values[i] = 1000.0 * Math.pow(1.005, i);
        }
        return TimeSeries.regular("credit", end.minusWeeks(size - 1), 7, values);
    }
}
