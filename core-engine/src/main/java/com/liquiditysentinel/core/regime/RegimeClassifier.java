package com.liquiditysentinel.core.regime;

import com.liquiditysentinel.core.input.IndicatorRole;
import com.liquiditysentinel.core.input.IndicatorSet;
import com.liquiditysentinel.core.model.MetricSnapshot;
import com.liquiditysentinel.core.model.Regime;
import com.liquiditysentinel.core.model.RegimeResult;
import com.liquiditysentinel.core.model.RegimeScore;
import com.liquiditysentinel.core.model.TimeSeries;
import com.liquiditysentinel.core.transform.Transforms;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Classifies the market into one of four {@link Regime}s at a point in time.
 *
 * <p>
 * Each call is independent: the latest value of up to five metrics is
 * extracted from the supplied series, each metric adds weighted points to the
 * regime totals, and the totals are normalized to a 0-100 score.
 * </p>
 *
 * <h3>Metrics</h3>
 * <ul>
 * <li>{@value #CREDIT_GROWTH_3M}: 3M annualized credit growth, weekly data</li>
 * <li>{@value #SPREAD_ZSCORE}: 3-year z-score of the credit spread, weekly
 * data</li>
 * <li>{@value #VIX_PERCENTILE}: 3-year percentile of the VIX, daily data</li>
 * <li>{@value #EQUITY_1M_RETURN}: 1M equity return, daily data</li>
 * <li>{@value #VAL_EARN_GAP}: valuation z-score minus earnings z-score</li>
 * </ul>
 * <p>
 * A metric without enough history is left out and simply contributes no
 * points. Missing inputs never raise.
 * </p>
 *
 * @since 1.0.0
 */
public class RegimeClassifier {

    private static final Logger LOG = LoggerFactory.getLogger(RegimeClassifier.class);

    public static final String CREDIT_GROWTH_3M = "credit_growth_3m";
    public static final String SPREAD_ZSCORE = "spread_zscore";
    public static final String SPREAD_LEVEL = "spread_level";
    public static final String VIX_PERCENTILE = "vix_percentile";
    public static final String VIX_LEVEL = "vix_level";
    public static final String EQUITY_1M_RETURN = "equity_1m_return";
    public static final String VAL_EARN_GAP = "val_earn_gap";

    /** Weekly observations in three months. */
    static final int CREDIT_PERIODS_3M = 13;
    static final int CREDIT_MIN_HISTORY = 63;
    static final int SPREAD_MIN_HISTORY = 3 * Transforms.WEEKLY_PERIODS_PER_YEAR;
    static final int VIX_MIN_HISTORY = 3 * Transforms.DAILY_PERIODS_PER_YEAR;
    static final int EQUITY_MIN_HISTORY = Transforms.DAILY_PERIODS_1M;

    /** Days after which a supplied series counts as stale. */
    static final int STALE_AFTER_DAYS = 7;

    private final RegimeThresholds thresholds;
    private final RegimeWeights weights;
    private final Clock clock;

    /**
     * @param thresholds metric cutoffs, validated and copied; must not be
     *                   {@code null}
     * @param weights    regime points, validated and copied; must not be
     *                   {@code null}
     * @param clock      clock used for staleness checks; must not be
     *                   {@code null}
     * @throws IllegalStateException if the thresholds or weights are invalid
     */
    public RegimeClassifier(RegimeThresholds thresholds, RegimeWeights weights, Clock clock) {
        Objects.requireNonNull(thresholds, "RegimeThresholds must not be null");
        Objects.requireNonNull(weights, "RegimeWeights must not be null");
        thresholds.validate();
        weights.validate();
        this.thresholds = new RegimeThresholds(thresholds);
        this.weights = new RegimeWeights(weights);
        this.clock = Objects.requireNonNull(clock, "Clock must not be null");
    }

    /**
     * @return a classifier with default thresholds and weights on the system
     *         clock
     */
    public static RegimeClassifier defaults() {
        return new RegimeClassifier(new RegimeThresholds(), new RegimeWeights(), Clock.systemDefaultZone());
    }

    // ---------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------

    /**
     * Classify the regime from named indicator series.
     *
     * @param data   indicator name or alias to series
     * @param asOf   classification date, {@code null} for the latest
     *               observations
     * @return the classification
     */
    public RegimeResult classify(Map<String, TimeSeries> data, LocalDate asOf) {
        return classify(IndicatorSet.resolve(data), asOf);
    }

    /**
     * Classify the regime from resolved indicators.
     *
     * @param indicators resolved indicator set; must not be {@code null}
     * @param asOf       classification date, {@code null} for the latest
     *                   observations
     * @return the classification
     */
    public RegimeResult classify(IndicatorSet indicators, LocalDate asOf) {
        Objects.requireNonNull(indicators, "IndicatorSet must not be null");

        MetricSnapshot metrics = extractMetrics(indicators, asOf);
        RegimeScore scores = calculateScores(metrics);
        Regime primary = scores.primary();
        List<String> explanations = explain(metrics, primary);
        double confidence = confidence(scores);
        String warning = checkDataQuality(indicators);

        LOG.debug("Classified regime {} (confidence={}) from {} metric(s)",
                primary.getLabel(), confidence, metrics.size());
        return new RegimeResult(primary, scores, explanations, confidence, warning, metrics);
    }

    /**
     * Extract the scalar metrics the scores are built from.
     *
     * @param indicators resolved indicator set
     * @param asOf       cut-off date, {@code null} for the latest observations
     * @return metrics; unavailable ones are absent
     */
    public MetricSnapshot extractMetrics(IndicatorSet indicators, LocalDate asOf) {
        MetricSnapshot.Builder metrics = MetricSnapshot.builder().asOf(asOf);

        Optional<TimeSeries> credit = indicators.get(IndicatorRole.CREDIT);
        if (credit.isPresent() && credit.get().size() > CREDIT_MIN_HISTORY) {
            metrics.put(CREDIT_GROWTH_3M,
                    Transforms.threeMonthAnnualized(credit.get(), CREDIT_PERIODS_3M).valueAsOf(asOf));
        }

        Optional<TimeSeries> spread = indicators.get(IndicatorRole.SPREAD);
        if (spread.isPresent() && spread.get().size() > SPREAD_MIN_HISTORY) {
            metrics.put(SPREAD_ZSCORE,
                    Transforms.zscore(spread.get(), 3, Transforms.WEEKLY_PERIODS_PER_YEAR).valueAsOf(asOf));
            metrics.put(SPREAD_LEVEL, spread.get().valueAsOf(asOf));
        }

        Optional<TimeSeries> vix = indicators.get(IndicatorRole.VIX);
        if (vix.isPresent() && vix.get().size() > VIX_MIN_HISTORY) {
            metrics.put(VIX_PERCENTILE,
                    Transforms.percentile(vix.get(), 3, Transforms.DAILY_PERIODS_PER_YEAR).valueAsOf(asOf));
            metrics.put(VIX_LEVEL, vix.get().valueAsOf(asOf));
        }

        Optional<TimeSeries> equity = indicators.get(IndicatorRole.EQUITY);
        if (equity.isPresent() && equity.get().size() > EQUITY_MIN_HISTORY) {
            metrics.put(EQUITY_1M_RETURN, Transforms.oneMonthChange(equity.get()).valueAsOf(asOf));
        }

        Optional<TimeSeries> valuationZ = indicators.get(IndicatorRole.VALUATION_ZSCORE);
        Optional<TimeSeries> earningsZ = indicators.get(IndicatorRole.EARNINGS_ZSCORE);
        if (valuationZ.isPresent() && earningsZ.isPresent()) {
            metrics.put(VAL_EARN_GAP, valuationZ.get().minus(earningsZ.get(), VAL_EARN_GAP).valueAsOf(asOf));
        }

        return metrics.build();
    }

    /**
     * Turn metrics into normalized regime scores.
     *
     * @param metrics extracted metrics; absent ones add no points
     * @return scores in [0, 100]
     */
    public RegimeScore calculateScores(MetricSnapshot metrics) {
        Objects.requireNonNull(metrics, "MetricSnapshot must not be null");
        double expansion = 0;
        double lateCycle = 0;
        double contraction = 0;
        double stress = 0;

        Optional<Double> credit = metrics.getValue(CREDIT_GROWTH_3M);
        if (credit.isPresent()) {
            if (credit.get() > thresholds.getCreditGrowthExpansion()) {
                expansion += weights.getCreditExpansion();
            } else if (credit.get() < thresholds.getCreditGrowthContraction()) {
                contraction += weights.getCreditContraction();
            } else {
                expansion += weights.getCreditNeutralExpansion();
                lateCycle += weights.getCreditNeutralLateCycle();
            }
        }

        Optional<Double> spreadZ = metrics.getValue(SPREAD_ZSCORE);
        if (spreadZ.isPresent()) {
            if (spreadZ.get() < thresholds.getSpreadZscoreTight()) {
                expansion += weights.getSpreadTightExpansion();
            } else if (spreadZ.get() > thresholds.getSpreadZscoreWide()) {
                contraction += weights.getSpreadWideContraction();
                stress += weights.getSpreadWideStress();
            } else {
                lateCycle += weights.getSpreadNeutralLateCycle();
            }
        }

        Optional<Double> vixPct = metrics.getValue(VIX_PERCENTILE);
        if (vixPct.isPresent()) {
            if (vixPct.get() < thresholds.getVixPercentileLow()) {
                expansion += weights.getVolLowExpansion();
            } else if (vixPct.get() > thresholds.getVixStress()) {
                stress += weights.getVolStressStress();
            } else if (vixPct.get() > thresholds.getVixPercentileHigh()) {
                contraction += weights.getVolHighContraction();
                stress += weights.getVolHighStress();
            } else {
                lateCycle += weights.getVolNeutralLateCycle();
            }
        }

        Optional<Double> equity = metrics.getValue(EQUITY_1M_RETURN);
        if (equity.isPresent() && equity.get() < thresholds.getEquityDrawdown()) {
            stress += weights.getEquityDrawdownStress();
            contraction += weights.getEquityDrawdownContraction();
        }

        Optional<Double> gap = metrics.getValue(VAL_EARN_GAP);
        if (gap.isPresent() && gap.get() > thresholds.getValuationVsEarningsGap()) {
            lateCycle += weights.getValuationGapLateCycle();
            expansion -= weights.getValuationGapExpansionPenalty();
        }

        double max = Math.max(Math.max(Math.max(expansion, lateCycle), Math.max(contraction, stress)), 1.0);
        double scale = 100.0 / max * weights.getNormalizationFactor();
        return new RegimeScore(expansion * scale, lateCycle * scale, contraction * scale, stress * scale);
    }

    /**
     * Three explanation lines for a classification: the credit driver, the
     * risk indicators, and the vulnerability to watch. An unavailable metric
     * yields a neutral sentence in its slot.
     *
     * @param metrics extracted metrics
     * @param primary the winning regime
     * @return exactly three sentences
     */
    public List<String> explain(MetricSnapshot metrics, Regime primary) {
        List<String> lines = new ArrayList<>(3);

        Optional<Double> credit = metrics.getValue(CREDIT_GROWTH_3M);
        if (credit.isEmpty()) {
            lines.add("Credit growth data unavailable - balance-sheet direction not assessed");
        } else if (primary == Regime.EXPANSION) {
            lines.add(format("Credit growth persisting (%.1f%% 3M annualized) - balance sheets expanding",
                    credit.get()));
        } else if (primary == Regime.CONTRACTION) {
            lines.add(format("Credit growth slowing (%.1f%% 3M annualized) - balance-sheet contraction pressure",
                    credit.get()));
        } else {
            lines.add(format("Credit growth %.1f%% (3M annualized)", credit.get()));
        }

        Optional<Double> vixPct = metrics.getValue(VIX_PERCENTILE);
        Optional<Double> spreadZ = metrics.getValue(SPREAD_ZSCORE);
        if (vixPct.isEmpty() || spreadZ.isEmpty()) {
            lines.add("Volatility or spread data unavailable - risk indicators not assessed");
        } else if (primary == Regime.STRESS) {
            lines.add(format("Volatility at %.0fth percentile, spread z=%.1f - collateral stress signal",
                    vixPct.get(), spreadZ.get()));
        } else if (primary == Regime.EXPANSION) {
            lines.add(format("Volatility in bottom %.0f%%, spreads tight - risk-on environment",
                    100 - vixPct.get()));
        } else {
            lines.add(format("Volatility %.0fth percentile, spread z-score %.1f", vixPct.get(), spreadZ.get()));
        }

        Optional<Double> gap = metrics.getValue(VAL_EARN_GAP);
        if (primary == Regime.LATE_CYCLE && gap.isPresent()) {
            lines.add(format("Valuations exceed earnings by %.1fσ - belief overheating warning", gap.get()));
        } else {
            lines.add(switch (primary) {
                case EXPANSION -> "Vulnerability: monitor for excessive credit expansion";
                case CONTRACTION -> "Vulnerability: watch the spread widening → collateral impairment"
                        + " → forced selling path";
                case STRESS -> "Vulnerability: leveraged position liquidation, liquidity squeeze risk";
                case LATE_CYCLE -> "Assessing sustainability of the current regime";
            });
        }
        return lines;
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    /** Gap between the two highest scores, as a fraction of 100. */
    static double confidence(RegimeScore scores) {
        double[] sorted = {scores.getExpansion(), scores.getLateCycle(), scores.getContraction(), scores.getStress()};
        Arrays.sort(sorted);
        return (sorted[3] - sorted[2]) / 100.0;
    }

    private String checkDataQuality(IndicatorSet indicators) {
        List<String> warnings = new ArrayList<>();

        List<String> missing = new ArrayList<>();
        for (IndicatorRole role : IndicatorRole.CORE_ROLES) {
            if (!indicators.hasData(role)) {
                missing.add(role.canonicalName());
            }
        }
        if (!missing.isEmpty()) {
            warnings.add("Missing core indicators: " + missing.size() + " of "
                    + IndicatorRole.CORE_ROLES.size() + " unavailable (" + String.join(", ", missing) + ")");
        }

        LocalDate today = LocalDate.now(clock);
        indicators.supplied().forEach((name, series) -> {
            LocalDate latest = series.latestDate();
            if (latest != null) {
                long daysOld = ChronoUnit.DAYS.between(latest, today);
                if (daysOld > STALE_AFTER_DAYS) {
                    warnings.add(name + " data is " + daysOld + " days old");
                }
            }
        });

        if (warnings.isEmpty()) {
            return null;
        }
        LOG.debug("Data quality warning(s): {}", warnings);
        return String.join("; ", warnings);
    }

    private static String format(String template, Object... args) {
        return String.format(Locale.ROOT, template, args);
    }
}
