package com.nei10u.panchanga.service;

import com.nei10u.panchanga.calc.KaranaCalculator;
import com.nei10u.panchanga.calc.MoonPhaseCalculator;
import com.nei10u.panchanga.calc.NakshatraCalculator;
import com.nei10u.panchanga.calc.TithiCalculator;
import com.nei10u.panchanga.calc.VaraCalculator;
import com.nei10u.panchanga.calc.YogaCalculator;
import com.nei10u.panchanga.ephemeris.Body;
import com.nei10u.panchanga.ephemeris.EphemerisProvider;
import com.nei10u.panchanga.ephemeris.RiseSetEvent;
import com.nei10u.panchanga.ephemeris.TimeProvider;
import com.nei10u.panchanga.exception.ClosedResourceException;
import com.nei10u.panchanga.model.Paksha;
import com.nei10u.panchanga.model.PanchangaResult;
import com.nei10u.panchanga.model.TithiData;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.Objects;
import java.util.OptionalDouble;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 排盘引擎：取星历数据，调用各历法计算器，组装 {@link PanchangaResult}。
 * 日出日落缺失时按当地午夜偏移兜底，月出月落缺失时留空。
 *
 * 引擎独占一个 {@link EphemerisProvider}，并在 {@link #close()} 时释放它。
 * 星历资源不保证线程安全，因此 compute 与 close 在同一把锁上串行执行：
 * close 会等正在进行的 compute 结束，之后的 compute 一律抛出 {@link ClosedResourceException}。
 */
public class PanchangaEngine implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(PanchangaEngine.class);

    // 无日出/日落事件时的兜底：当地午夜 + 6h / + 18h
    static final double SUNRISE_FALLBACK_OFFSET = 0.25;
    static final double SUNSET_FALLBACK_OFFSET = 0.75;

    private final EphemerisProvider ephemeris;
    private final TimeProvider timeProvider;
    private final ReentrantLock lock = new ReentrantLock();
    private volatile boolean closed;

    public PanchangaEngine(EphemerisProvider ephemeris, TimeProvider timeProvider) {
        this.ephemeris = Objects.requireNonNull(ephemeris, "ephemeris");
        this.timeProvider = Objects.requireNonNull(timeProvider, "timeProvider");
    }

    public PanchangaResult compute(LocalDateTime dateTime, double latitude, double longitude, String timezone) {
        // 已关闭时优先报关闭，不再校验参数
        ensureOpen();
        Objects.requireNonNull(dateTime, "dateTime");
        if (!(latitude >= -90.0 && latitude <= 90.0)) {
            throw new IllegalArgumentException("Latitude must be between -90 and 90 degrees, got " + latitude);
        }
        if (!(longitude >= -180.0 && longitude <= 180.0)) {
            throw new IllegalArgumentException("Longitude must be between -180 and 180 degrees, got " + longitude);
        }

        lock.lock();
        try {
            ensureOpen();
            ZoneId zone = timeProvider.resolveZone(timezone);
            LocalDateTime utc = timeProvider.toUtc(dateTime, zone);
            double julianDay = timeProvider.toJulianDay(utc);

            double sunSidereal = ephemeris.longitude(Body.SUN, julianDay, true);
            double moonSidereal = ephemeris.longitude(Body.MOON, julianDay, true);
            double sunTropical = ephemeris.longitude(Body.SUN, julianDay, false);
            double moonTropical = ephemeris.longitude(Body.MOON, julianDay, false);
            double ayanamsa = ephemeris.ayanamsa(julianDay);

            TithiData tithi = TithiCalculator.calculate(sunSidereal, moonSidereal);
            Paksha paksha = Paksha.fromTithiNumber(tithi.getNumber());

            // 星期按当地日期换日，故用当地钟面时间的儒略日
            double civilJulianDay = timeProvider.toJulianDay(dateTime);

            double midnight = timeProvider.localMidnightJulianDay(dateTime.toLocalDate(), zone);
            OptionalDouble rise = ephemeris.riseSet(Body.SUN, midnight, latitude, longitude, RiseSetEvent.RISE);
            OptionalDouble set = ephemeris.riseSet(Body.SUN, midnight, latitude, longitude, RiseSetEvent.SET);
            double sunriseJd = rise.orElse(midnight + SUNRISE_FALLBACK_OFFSET);
            double sunsetJd = set.orElse(midnight + SUNSET_FALLBACK_OFFSET);
            if (rise.isEmpty() || set.isEmpty()) {
                log.info("no sunrise/sunset event on {} at lat={} lon={}, using fallback offsets",
                        dateTime.toLocalDate(), latitude, longitude);
            }
            LocalTime sunriseTime = timeProvider.toLocalTime(sunriseJd, zone);
            LocalTime sunsetTime = timeProvider.toLocalTime(sunsetJd, zone);

            OptionalDouble moonrise = ephemeris.riseSet(Body.MOON, midnight, latitude, longitude, RiseSetEvent.RISE);
            OptionalDouble moonset = ephemeris.riseSet(Body.MOON, midnight, latitude, longitude, RiseSetEvent.SET);
            LocalTime moonriseTime = localTimeOf(moonrise, zone);
            LocalTime moonsetTime = localTimeOf(moonset, zone);

            PanchangaResult result = PanchangaResult.builder()
                    .julianDay(julianDay)
                    .siderealMode(ephemeris.siderealMode().name())
                    .tithi(tithi)
                    .nakshatra(NakshatraCalculator.calculate(moonSidereal))
                    .yoga(YogaCalculator.calculate(sunSidereal, moonSidereal))
                    .karana(KaranaCalculator.calculate(sunSidereal, moonSidereal))
                    .vara(VaraCalculator.calculate(civilJulianDay))
                    .paksha(paksha)
                    .sunriseJulianDay(sunriseJd)
                    .sunsetJulianDay(sunsetJd)
                    .sunriseTime(sunriseTime)
                    .sunsetTime(sunsetTime)
                    .sunrise(ClockFormatter.format12Hour(sunriseTime))
                    .sunset(ClockFormatter.format12Hour(sunsetTime))
                    .sunriseFallback(rise.isEmpty())
                    .sunsetFallback(set.isEmpty())
                    .moonriseJulianDay(boxed(moonrise))
                    .moonsetJulianDay(boxed(moonset))
                    .moonriseTime(moonriseTime)
                    .moonsetTime(moonsetTime)
                    .moonrise(moonriseTime == null ? null : ClockFormatter.format12Hour(moonriseTime))
                    .moonset(moonsetTime == null ? null : ClockFormatter.format12Hour(moonsetTime))
                    .moonIllumination(MoonPhaseCalculator.illumination(tithi.getElongation()))
                    .sunLongitude(sunSidereal)
                    .moonLongitude(moonSidereal)
                    .sunTropicalLongitude(sunTropical)
                    .moonTropicalLongitude(moonTropical)
                    .ayanamsa(ayanamsa)
                    .build();
            log.debug("computed panchanga jd={} tithi={} nakshatra={}", julianDay,
                    tithi.getNumber(), result.getNakshatra().getNumber());
            return result;
        } finally {
            lock.unlock();
        }
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * 释放星历资源。幂等；会等待正在进行的 compute 完成。
     */
    @Override
    public void close() {
        lock.lock();
        try {
            if (closed) {
                return;
            }
            closed = true;
            ephemeris.close();
            log.info("panchanga engine closed");
        } finally {
            lock.unlock();
        }
    }

    private LocalTime localTimeOf(OptionalDouble julianDay, ZoneId zone) {
        return julianDay.isPresent() ? timeProvider.toLocalTime(julianDay.getAsDouble(), zone) : null;
    }

    private static Double boxed(OptionalDouble value) {
        return value.isPresent() ? value.getAsDouble() : null;
    }

    private void ensureOpen() {
        if (closed) {
            throw new ClosedResourceException("PanchangaEngine");
        }
    }
}
