package com.nei10u.panchanga.calc;

import com.nei10u.panchanga.model.CalendarTables;
import com.nei10u.panchanga.model.VaraName;

/**
 * 星期：floor(JD + 1.5) mod 7，0 为周日。
 *
 * 1.5 的偏移使 JD 2451545.0（2000-01-01 12:00 UT，周六）落在 6，且每天在 JD 的 .5（即午夜）处换日。
 */
public final class VaraCalculator {

    static final double EPOCH_OFFSET = 1.5;
    private static final int DAYS_PER_WEEK = 7;

    private VaraCalculator() {
    }

    public static VaraName calculate(double julianDay) {
        return CalendarTables.VARAS.byIndex(weekdayIndex(julianDay));
    }

    public static int weekdayIndex(double julianDay) {
        long day = (long) Math.floor(julianDay + EPOCH_OFFSET);
        return (int) Math.floorMod(day, (long) DAYS_PER_WEEK);
    }
}
