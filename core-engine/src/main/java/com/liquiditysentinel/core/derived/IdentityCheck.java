package com.liquiditysentinel.core.derived;

import com.liquiditysentinel.core.model.TimeSeries;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Period-by-period check of the reserve accounting identity
 * {@code Δreserves = Δsecurities + Δlending - Δreverse repo - Δtreasury account}.
 *
 * <p>
 * {@code lhs} is the change in reserves, {@code rhs} the change implied by the
 * other balance-sheet items, {@code residual = lhs - rhs}. {@code balanced} is
 * {@code null} wherever the residual is undefined.
 * </p>
 *
 * @since 1.0.0
 */
public final class IdentityCheck {

    private final TimeSeries lhs;
    private final TimeSeries rhs;
    private final TimeSeries residual;
    private final TimeSeries imbalance;
    private final List<Boolean> balanced;
    private final double tolerance;

    IdentityCheck(TimeSeries lhs, TimeSeries rhs, TimeSeries residual, TimeSeries imbalance,
                  List<Boolean> balanced, double tolerance) {
        this.lhs = Objects.requireNonNull(lhs);
        this.rhs = Objects.requireNonNull(rhs);
        this.residual = Objects.requireNonNull(residual);
        this.imbalance = Objects.requireNonNull(imbalance);
        this.balanced = Collections.unmodifiableList(new ArrayList<>(balanced));
        this.tolerance = tolerance;
    }

    /**
     * @param tolerance the tolerance the check would have used
     * @return a check with no periods
     */
    public static IdentityCheck empty(double tolerance) {
        return new IdentityCheck(TimeSeries.empty("reserves_change"), TimeSeries.empty("implied_change"),
                TimeSeries.empty("residual"), TimeSeries.empty("imbalance"), List.of(), tolerance);
    }

    public TimeSeries getLhs() {
        return lhs;
    }

    public TimeSeries getRhs() {
        return rhs;
    }

    public TimeSeries getResidual() {
        return residual;
    }

    /** Absolute residual. */
    public TimeSeries getImbalance() {
        return imbalance;
    }

    public List<Boolean> getBalanced() {
        return balanced;
    }

    public double getTolerance() {
        return tolerance;
    }

    public boolean isEmpty() {
        return residual.isEmpty();
    }

    /**
     * @return share of defined periods that balance, {@code NaN} when no period
     *         is defined
     */
    public double balancedShare() {
        int defined = 0;
        int ok = 0;
        for (Boolean b : balanced) {
            if (b != null) {
                defined++;
                if (b) {
                    ok++;
                }
            }
        }
        return defined == 0 ? Double.NaN : (double) ok / defined;
    }

    @Override
    public String toString() {
        return "IdentityCheck{periods=" + balanced.size() + ", tolerance=" + tolerance
                + ", balancedShare=" + balancedShare() + '}';
    }
}
