package com.liquiditysentinel.core.transform;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.temporal.TemporalAdjusters;

/**
 * Calendar frequency used when resampling a series. Each bucket is labelled
 * with the date its period ends on.
 *
 * @since 1.0.0
 */
public enum Frequency {

    DAILY {
        @Override
        public LocalDate periodEnd(LocalDate date) {
            return date;
        }
    },

    /** Weeks ending on Sunday. */
    WEEKLY {
        @Override
        public LocalDate periodEnd(LocalDate date) {
            return date.with(TemporalAdjusters.nextOrSame(DayOfWeek.SUNDAY));
        }
    },

    MONTHLY {
        @Override
        public LocalDate periodEnd(LocalDate date) {
            return date.with(TemporalAdjusters.lastDayOfMonth());
        }
    };

    /**
     * @param date an observation date
     * @return last date of the period containing {@code date}
     */
    public abstract LocalDate periodEnd(LocalDate date);
}
