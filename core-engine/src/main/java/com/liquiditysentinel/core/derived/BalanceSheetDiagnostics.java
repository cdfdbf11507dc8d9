package com.liquiditysentinel.core.derived;

import com.liquiditysentinel.core.model.TimeSeries;
import com.liquiditysentinel.core.transform.PercentileKind;
import com.liquiditysentinel.core.transform.Transforms;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Federal Reserve balance-sheet diagnostics.
 *
 * <p>
 * All inputs are levels in billions of USD. Each diagnostic returns a
 * {@link DiagnosticBundle} carrying a band label and a continuous 0-100 score
 * per observation, scored by a {@link PiecewiseScorer}.
 * </p>
 *
 * <h3>Two-series inputs</h3>
 * <p>
 * Diagnostics combining two series require both to share the same date index.
 * Missing, empty or misaligned inputs produce an empty bundle rather than an
 * exception.
 * </p>
 *
 * @since 1.0.0
 */
public final class BalanceSheetDiagnostics {

    private static final Logger LOG = LoggerFactory.getLogger(BalanceSheetDiagnostics.class);

    public static final String QT_PACE = "qt_pace";
    public static final String RESERVE_REGIME = "reserve_regime";
    public static final String MONEY_MARKET_STRESS = "money_market_stress";
    public static final String FED_LENDING_STRESS = "fed_lending_stress";
    public static final String TGA_RESERVE_DRAG = "tga_reserve_drag";
    public static final String RESERVE_DEMAND_PROXY = "reserve_demand_proxy";

    /** Share of reverse-repo balances deducted from reserves as unavailable liquidity. */
    public static final double RRP_RESERVE_DAMPENING = 0.1;

    /** Reverse-repo share of overnight liquidity above which conditions are flagged as crisis. */
    public static final double CRISIS_DEMAND_RATIO = 0.5;

    public static final double DEFAULT_IDENTITY_TOLERANCE = 50.0;

    private static final PiecewiseScorer QT_PACE_SCORER = new PiecewiseScorer(List.of(
            new ScoreBand(-5.0, "Rapid QT", 0, 25),
            new ScoreBand(-1.0, "Gradual QT", 25, 50),
            new ScoreBand(-0.1, "Neutral", 50, 75),
            new ScoreBand(0.1, "QE", 75, 100)), 5.0);

    private static final PiecewiseScorer MONEY_MARKET_SCORER = new PiecewiseScorer(List.of(
            new ScoreBand(0, "Normal", 0, 50),
            new ScoreBand(500, "Elevated", 50, 90),
            new ScoreBand(1500, "Stress", 90, 100)), 2200);

    private static final PiecewiseScorer FED_LENDING_SCORER = new PiecewiseScorer(List.of(
            new ScoreBand(0, "Normal", 0, 50),
            new ScoreBand(100, "Elevated", 50, 90),
            new ScoreBand(300, "Stress", 90, 100)), 1000);

    private static final PiecewiseScorer TGA_DRAG_SCORER = new PiecewiseScorer(List.of(
            new ScoreBand(0, "Minimal", 0, 50),
            new ScoreBand(0.05, "Normal", 50, 75),
            new ScoreBand(0.15, "Elevated", 75, 90),
            new ScoreBand(0.25, "Stress", 90, 100)), 1.0);

    private static final PiecewiseScorer DEMAND_PROXY_SCORER = new PiecewiseScorer(List.of(
            new ScoreBand(0, "Normal", 0, 50),
            new ScoreBand(0.3, "Elevated", 50, 90),
            new ScoreBand(0.5, "Stress", 90, 100)), 1.0);

    private BalanceSheetDiagnostics() {
        // utility class
    }

    // ---------------------------------------------------------------
    // Single-series diagnostics
    // ---------------------------------------------------------------

    /**
     * Monthly pace of change in total Fed assets. Negative values mean
     * quantitative tightening.
     *
     * @param fedAssets total assets
     * @param periods1m observations in one month
     * @return bundle labelled Rapid QT / Gradual QT / Neutral / QE, aux
     *         {@code qt_pace} in percent
     */
    public static DiagnosticBundle qtPace(TimeSeries fedAssets, int periods1m) {
        if (fedAssets == null || fedAssets.size() < 2) {
            return DiagnosticBundle.empty(QT_PACE);
        }
        TimeSeries change = Transforms.oneMonthChange(fedAssets, periods1m);
        TimeSeries pace = change.withValues("qt_pace", change.values());
        return score(QT_PACE, QT_PACE_SCORER, pace)
                .aux("qt_pace", pace)
                .build();
    }

    public static DiagnosticBundle qtPace(TimeSeries fedAssets) {
        return qtPace(fedAssets, Transforms.DAILY_PERIODS_1M);
    }

    /**
     * Classify the reserve regime from effective reserves.
     *
     * <p>
     * When a reverse-repo series aligned with {@code reserves} is supplied,
     * effective reserves are reduced by {@value #RRP_RESERVE_DAMPENING} times
     * its balance; otherwise it is ignored.
     * </p>
     *
     * @param reserves           reserve balances
     * @param reverseRepo        overnight reverse repo, may be {@code null}
     * @param abundantThreshold  lower bound of Abundant
     * @param ampleThreshold     lower bound of Ample
     * @param tightThreshold     lower bound of Tight
     * @return bundle labelled Scarce / Tight / Ample / Abundant, aux
     *         {@code effective_reserves}
     * @throws IllegalArgumentException if the thresholds are not positive and
     *                                  strictly increasing from tight to abundant
     */
    public static DiagnosticBundle reserveRegime(TimeSeries reserves, TimeSeries reverseRepo,
                                                 double abundantThreshold, double ampleThreshold,
                                                 double tightThreshold) {
        if (reserves == null || reserves.isEmpty()) {
            return DiagnosticBundle.empty(RESERVE_REGIME);
        }
        double[] effective = reserves.values();
        if (reverseRepo != null && reverseRepo.isAlignedWith(reserves)) {
            for (int i = 0; i < effective.length; i++) {
                effective[i] -= RRP_RESERVE_DAMPENING * reverseRepo.valueAt(i);
            }
        } else if (reverseRepo != null) {
            LOG.debug("Reverse repo series '{}' not aligned with reserves - using raw reserves",
                    reverseRepo.getName());
        }
        TimeSeries effectiveReserves = reserves.withValues("effective_reserves", effective);

        PiecewiseScorer scorer = new PiecewiseScorer(List.of(
                new ScoreBand(0, "Scarce", 0, 25),
                new ScoreBand(tightThreshold, "Tight", 25, 50),
                new ScoreBand(ampleThreshold, "Ample", 50, 75),
                new ScoreBand(abundantThreshold, "Abundant", 75, 100)), 2 * abundantThreshold);
        return score(RESERVE_REGIME, scorer, effectiveReserves)
                .aux("effective_reserves", effectiveReserves)
                .build();
    }

    public static DiagnosticBundle reserveRegime(TimeSeries reserves, TimeSeries reverseRepo) {
        return reserveRegime(reserves, reverseRepo, 2500, 1500, 500);
    }

    /**
     * Money-market stress from demand for the reverse repo facility.
     *
     * @param reverseRepo overnight reverse repo
     * @return bundle labelled Normal / Elevated / Stress, aux {@code rrp_level},
     *         {@code rrp_change_1m} (percent) and {@code rrp_acceleration}
     */
    public static DiagnosticBundle moneyMarketStress(TimeSeries reverseRepo) {
        if (reverseRepo == null || reverseRepo.isEmpty()) {
            return DiagnosticBundle.empty(MONEY_MARKET_STRESS);
        }
        TimeSeries level = reverseRepo.withValues("rrp_level", reverseRepo.values());
        TimeSeries change = Transforms.oneMonthChange(reverseRepo);
        TimeSeries acceleration = Transforms.acceleration(reverseRepo);
        return score(MONEY_MARKET_STRESS, MONEY_MARKET_SCORER, reverseRepo)
                .aux("rrp_level", level)
                .aux("rrp_change_1m", change.withValues("rrp_change_1m", change.values()))
                .aux("rrp_acceleration", acceleration.withValues("rrp_acceleration", acceleration.values()))
                .build();
    }

    /**
     * Stress in the banking system from usage of Fed lending facilities.
     *
     * @param fedLending total Fed lending
     * @return bundle labelled Normal / Elevated / Stress, aux
     *         {@code lending_level}, {@code lending_yoy} and
     *         {@code lending_percentile_3y}
     */
    public static DiagnosticBundle fedLendingStress(TimeSeries fedLending) {
        if (fedLending == null || fedLending.isEmpty()) {
            return DiagnosticBundle.empty(FED_LENDING_STRESS);
        }
        TimeSeries yoy = Transforms.yoy(fedLending);
        TimeSeries percentile = Transforms.rollingPercentile(fedLending,
                3 * Transforms.DAILY_PERIODS_PER_YEAR, null, PercentileKind.WEAK);
        return score(FED_LENDING_STRESS, FED_LENDING_SCORER, fedLending)
                .aux("lending_level", fedLending.withValues("lending_level", fedLending.values()))
                .aux("lending_yoy", yoy.withValues("lending_yoy", yoy.values()))
                .aux("lending_percentile_3y", percentile.withValues("lending_percentile_3y", percentile.values()))
                .build();
    }

    // ---------------------------------------------------------------
    // Two-series diagnostics
    // ---------------------------------------------------------------

    /**
     * Liquidity drained by the Treasury General Account, measured as
     * {@code tga / (tga + reserves)}.
     *
     * @param tga      Treasury General Account balance
     * @param reserves reserve balances
     * @return bundle labelled Minimal / Normal / Elevated / Stress, aux
     *         {@code tga_ratio}, {@code tga_level} and
     *         {@code effective_reserves}
     */
    public static DiagnosticBundle tgaReserveDrag(TimeSeries tga, TimeSeries reserves) {
        if (!aligned(tga, reserves)) {
            return DiagnosticBundle.empty(TGA_RESERVE_DRAG);
        }
        TimeSeries ratio = share(tga, reserves, "tga_ratio");
        double[] effective = new double[reserves.size()];
        for (int i = 0; i < effective.length; i++) {
            effective[i] = reserves.valueAt(i) * (1.0 - ratio.valueAt(i));
        }
        return score(TGA_RESERVE_DRAG, TGA_DRAG_SCORER, ratio)
                .aux("tga_ratio", ratio)
                .aux("tga_level", tga.withValues("tga_level", tga.values()))
                .aux("effective_reserves", reserves.withValues("effective_reserves", effective))
                .build();
    }

    /**
     * Demand for the reverse repo facility relative to reserves, measured as
     * {@code rrp / (rrp + reserves)}.
     *
     * @param reverseRepo overnight reverse repo
     * @param reserves    reserve balances
     * @return bundle labelled Normal / Elevated / Stress, aux
     *         {@code demand_proxy_ratio} and {@code total_overnight_liquidity},
     *         flag {@code crisis}
     */
    public static DiagnosticBundle reserveDemandProxy(TimeSeries reverseRepo, TimeSeries reserves) {
        if (!aligned(reverseRepo, reserves)) {
            return DiagnosticBundle.empty(RESERVE_DEMAND_PROXY);
        }
        TimeSeries ratio = share(reverseRepo, reserves, "demand_proxy_ratio");
        double[] total = new double[reserves.size()];
        List<Boolean> crisis = new ArrayList<>(total.length);
        for (int i = 0; i < total.length; i++) {
            double sum = reverseRepo.valueAt(i) + reserves.valueAt(i);
            total[i] = sum == 0.0 ? Double.NaN : sum;
            crisis.add(ratio.valueAt(i) > CRISIS_DEMAND_RATIO);
        }
        return score(RESERVE_DEMAND_PROXY, DEMAND_PROXY_SCORER, ratio)
                .aux("demand_proxy_ratio", ratio)
                .aux("total_overnight_liquidity", reserves.withValues("total_overnight_liquidity", total))
                .flag("crisis", crisis)
                .build();
    }

    // ---------------------------------------------------------------
    // Identity
    // ---------------------------------------------------------------

    /**
     * Check {@code Δreserves = Δsecurities + Δlending - Δreverse repo - Δtga}
     * period by period.
     *
     * @param reserves        reserve balances
     * @param securities      securities held outright
     * @param lending         Fed lending
     * @param reverseRepo     overnight reverse repo
     * @param treasuryAccount Treasury General Account
     * @param tolerance       largest absolute residual counted as balanced
     * @return the check; empty when any input is missing, empty or misaligned
     */
    public static IdentityCheck verifyBalanceSheetIdentity(TimeSeries reserves, TimeSeries securities,
                                                           TimeSeries lending, TimeSeries reverseRepo,
                                                           TimeSeries treasuryAccount, double tolerance) {
        List<TimeSeries> inputs = new ArrayList<>();
        inputs.add(reserves);
        inputs.add(securities);
        inputs.add(lending);
        inputs.add(reverseRepo);
        inputs.add(treasuryAccount);
        for (TimeSeries input : inputs) {
            if (input == null || input.isEmpty() || !input.isAlignedWith(reserves)) {
                LOG.debug("Balance-sheet identity skipped: missing or misaligned input {}",
                        input == null ? null : input.getName());
                return IdentityCheck.empty(tolerance);
            }
        }

        double[] dReserves = Transforms.diff(reserves, 1).values();
        double[] dSecurities = Transforms.diff(securities, 1).values();
        double[] dLending = Transforms.diff(lending, 1).values();
        double[] dRrp = Transforms.diff(reverseRepo, 1).values();
        double[] dTga = Transforms.diff(treasuryAccount, 1).values();

        int n = reserves.size();
        double[] rhs = new double[n];
        double[] residual = new double[n];
        double[] imbalance = new double[n];
        List<Boolean> balanced = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            rhs[i] = dSecurities[i] + dLending[i] - dRrp[i] - dTga[i];
            residual[i] = dReserves[i] - rhs[i];
            imbalance[i] = Math.abs(residual[i]);
            balanced.add(Double.isNaN(residual[i]) ? null : imbalance[i] <= tolerance);
        }
        return new IdentityCheck(
                reserves.withValues("reserves_change", dReserves),
                reserves.withValues("implied_change", rhs),
                reserves.withValues("residual", residual),
                reserves.withValues("imbalance", imbalance),
                balanced,
                tolerance);
    }

    public static IdentityCheck verifyBalanceSheetIdentity(TimeSeries reserves, TimeSeries securities,
                                                           TimeSeries lending, TimeSeries reverseRepo,
                                                           TimeSeries treasuryAccount) {
        return verifyBalanceSheetIdentity(reserves, securities, lending, reverseRepo, treasuryAccount,
                DEFAULT_IDENTITY_TOLERANCE);
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static DiagnosticBundle.Builder score(String name, PiecewiseScorer scorer, TimeSeries values) {
        return DiagnosticBundle.builder(name)
                .score(scorer.scores(values, name + "_score"))
                .labels(scorer.labels(values));
    }

    private static boolean aligned(TimeSeries a, TimeSeries b) {
        if (a == null || b == null || a.isEmpty() || !a.isAlignedWith(b)) {
            LOG.debug("Two-series diagnostic skipped: inputs missing or misaligned");
            return false;
        }
        return true;
    }

    /** {@code part / (part + rest)}, {@code NaN} where the denominator is zero. */
    private static TimeSeries share(TimeSeries part, TimeSeries rest, String name) {
        double[] out = new double[part.size()];
        for (int i = 0; i < out.length; i++) {
            double total = part.valueAt(i) + rest.valueAt(i);
            out[i] = total == 0.0 ? Double.NaN : part.valueAt(i) / total;
        }
        return part.withValues(name, out);
    }
}
