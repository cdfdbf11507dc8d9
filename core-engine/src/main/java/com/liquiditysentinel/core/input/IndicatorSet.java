package com.liquiditysentinel.core.input;

import com.liquiditysentinel.core.model.TimeSeries;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Indicator inputs resolved to their {@link IndicatorRole}s.
 *
 * <p>
 * Callers supply series under any accepted alias. Resolution happens once here,
 * so downstream rules ask for a role and never walk alias chains themselves.
 * The original named map is kept for checks that report on every supplied
 * series.
 * </p>
 *
 * @since 1.0.0
 */
public final class IndicatorSet {

    private final Map<IndicatorRole, TimeSeries> byRole;
    private final Map<String, TimeSeries> supplied;

    private IndicatorSet(Map<IndicatorRole, TimeSeries> byRole, Map<String, TimeSeries> supplied) {
        this.byRole = byRole;
        this.supplied = supplied;
    }

    /**
     * Resolve a name-to-series map.
     *
     * <p>
     * For each role the first alias mapped to a non-null series wins. Names
     * that match no alias are kept in {@link #supplied()} but bound to no role.
     * </p>
     *
     * @param data indicator name to series; {@code null} is treated as empty
     * @return resolved set
     */
    public static IndicatorSet resolve(Map<String, TimeSeries> data) {
        Map<String, TimeSeries> copy = new LinkedHashMap<>();
        if (data != null) {
            data.forEach((name, series) -> {
                if (name != null && series != null) {
                    copy.put(name, series);
                }
            });
        }

        EnumMap<IndicatorRole, TimeSeries> roles = new EnumMap<>(IndicatorRole.class);
        for (IndicatorRole role : IndicatorRole.values()) {
            for (String alias : role.getAliases()) {
                TimeSeries series = copy.get(alias);
                if (series != null) {
                    roles.put(role, series);
                    break;
                }
            }
        }
        return new IndicatorSet(Collections.unmodifiableMap(roles), Collections.unmodifiableMap(copy));
    }

    /**
     * Convenience for building a set directly from roles.
     *
     * @param data role to series
     * @return resolved set, with each series supplied under its canonical name
     */
    public static IndicatorSet ofRoles(Map<IndicatorRole, TimeSeries> data) {
        Objects.requireNonNull(data, "data must not be null");
        Map<String, TimeSeries> named = new LinkedHashMap<>();
        data.forEach((role, series) -> named.put(role.canonicalName(), series));
        return resolve(named);
    }

    public Optional<TimeSeries> get(IndicatorRole role) {
        return Optional.ofNullable(byRole.get(role));
    }

    public boolean has(IndicatorRole role) {
        return byRole.containsKey(role);
    }

    /**
     * @param role the role
     * @return {@code true} when the role is bound to a series with observations
     */
    public boolean hasData(IndicatorRole role) {
        TimeSeries series = byRole.get(role);
        return series != null && !series.isEmpty();
    }

    /**
     * @return unmodifiable view of every non-null series supplied by the caller
     */
    public Map<String, TimeSeries> supplied() {
        return supplied;
    }

    @Override
    public String toString() {
        return "IndicatorSet{roles=" + byRole.keySet() + ", supplied=" + supplied.keySet() + '}';
    }
}
