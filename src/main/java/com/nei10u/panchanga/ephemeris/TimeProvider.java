package com.nei10u.panchanga.ephemeris;

import com.nei10u.panchanga.exception.InvalidTimezoneException;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneId;

/**
 * 民用时间、UTC 与儒略日之间的换算。
 */
public interface TimeProvider {

    /**
     * @throws InvalidTimezoneException 无法识别的时区
     */
    ZoneId resolveZone(String timezone);

    LocalDateTime toUtc(LocalDateTime localDateTime, ZoneId zone);

    /**
     * 把一个（不带时区的）日期时间按字面值换算成儒略日。
     */
    double toJulianDay(LocalDateTime dateTime);

    LocalDateTime fromJulianDay(double julianDay);

    /**
     * 儒略日（UT）对应的当地钟面时间。
     */
    LocalTime toLocalTime(double julianDay, ZoneId zone);

    /**
     * 当地日期 00:00 对应的儒略日（UT）。
     */
    double localMidnightJulianDay(LocalDate date, ZoneId zone);
}
