package com.nei10u.panchanga.ephemeris;

import com.nei10u.panchanga.exception.InvalidTimezoneException;
import com.nlf.calendar.Solar;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;

/**
 * 时区由 java.time 处理，儒略日换算交给 lunar-java 的 {@link Solar}。
 */
public class LunarTimeProvider implements TimeProvider {

    private static final int MAX_OFFSET_SECONDS = 18 * 3600;
    private static final double SECONDS_PER_DAY = 86400.0;

    @Override
    public ZoneId resolveZone(String timezone) {
        if (timezone == null || timezone.isBlank()) {
            throw new InvalidTimezoneException(timezone);
        }
        String trimmed = timezone.trim();
        try {
            return ZoneId.of(trimmed);
        } catch (DateTimeException e) {
            // 兼容以小时表示的偏移，如 "5.5"、"-3"
            Double hours = parseHours(trimmed);
            if (hours == null) {
                throw new InvalidTimezoneException(timezone, e);
            }
            long totalSeconds = Math.round(hours * 3600.0);
            if (Math.abs(totalSeconds) > MAX_OFFSET_SECONDS) {
                throw new InvalidTimezoneException(timezone, e);
            }
            return ZoneOffset.ofTotalSeconds((int) totalSeconds);
        }
    }

    @Override
    public LocalDateTime toUtc(LocalDateTime localDateTime, ZoneId zone) {
        return ZonedDateTime.of(localDateTime, zone)
                .withZoneSameInstant(ZoneOffset.UTC)
                .toLocalDateTime();
    }

    @Override
    public double toJulianDay(LocalDateTime dateTime) {
        return Solar.fromYmdHms(
                dateTime.getYear(),
                dateTime.getMonthValue(),
                dateTime.getDayOfMonth(),
                dateTime.getHour(),
                dateTime.getMinute(),
                dateTime.getSecond()
        ).getJulianDay();
    }

    @Override
    public LocalDateTime fromJulianDay(double julianDay) {
        // 日期取自当日 0 时的儒略日；时分秒由小数部分四舍五入到秒后累加，进位跨日交给 java.time
        double midnight = Math.floor(julianDay + 0.5) - 0.5;
        Solar day = Solar.fromJulianDay(midnight);
        long seconds = Math.round((julianDay - midnight) * SECONDS_PER_DAY);
        return LocalDate.of(day.getYear(), day.getMonth(), day.getDay())
                .atStartOfDay()
                .plusSeconds(seconds);
    }

    @Override
    public LocalTime toLocalTime(double julianDay, ZoneId zone) {
        return fromJulianDay(julianDay)
                .atZone(ZoneOffset.UTC)
                .withZoneSameInstant(zone)
                .toLocalTime();
    }

    @Override
    public double localMidnightJulianDay(LocalDate date, ZoneId zone) {
        LocalDateTime utc = date.atStartOfDay(zone)
                .withZoneSameInstant(ZoneOffset.UTC)
                .toLocalDateTime();
        return toJulianDay(utc);
    }

    private static Double parseHours(String value) {
        try {
            double hours = Double.parseDouble(value);
            return Double.isFinite(hours) ? hours : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
