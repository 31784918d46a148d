package com.nei10u.panchanga.ephemeris;

import com.nei10u.panchanga.calc.AngularSegmenter;
import com.nei10u.panchanga.exception.ClosedResourceException;
import com.nei10u.panchanga.exception.ComputationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.OptionalDouble;

/**
 * 解析法低精度星历：以 2010.0 历元的平根数加主要摄动项推算日、月黄经，
 * 出没时刻在一天的时间窗内按地平高度扫描求根，不依赖任何星历数据文件。
 *
 * 太阳黄经误差在几个角分以内，月亮在零点几度以内，日出日落在几分钟以内，月出月落在十几分钟以内。
 */
public class AnalyticEphemerisProvider implements EphemerisProvider {

    private static final Logger log = LoggerFactory.getLogger(AnalyticEphemerisProvider.class);

    private static final double EPOCH_2010 = 2455196.5; // 2010 January 0.0 UT
    private static final double TROPICAL_YEAR_DAYS = 365.242191;

    // 太阳（地球轨道）根数
    private static final double SUN_LONGITUDE_AT_EPOCH = 279.557208;
    private static final double SUN_PERIGEE_LONGITUDE = 283.112438;
    private static final double ORBIT_ECCENTRICITY = 0.016705;

    // 月亮根数
    private static final double MOON_MEAN_LONGITUDE_AT_EPOCH = 91.929336;
    private static final double MOON_PERIGEE_AT_EPOCH = 130.143076;
    private static final double MOON_NODE_AT_EPOCH = 291.682547;
    private static final double MOON_ORBIT_INCLINATION = 5.145396;

    // 视出没时天体中心的地平高度：太阳只计大气折射；月亮计入视差 0.95°、半径与折射
    private static final double SUN_HORIZON_ALTITUDE = -0.5667;
    private static final double MOON_HORIZON_ALTITUDE = 0.125;

    private static final double SCAN_STEP_DAYS = 10.0 / 1440.0;
    private static final int SCAN_STEPS_PER_DAY = 144;
    private static final int BISECTION_ITERATIONS = 30;

    private final SiderealMode siderealMode;
    private volatile boolean closed;

    public AnalyticEphemerisProvider(SiderealMode siderealMode) {
        if (siderealMode == null) {
            throw new IllegalArgumentException("siderealMode must not be null");
        }
        this.siderealMode = siderealMode;
        log.info("analytic ephemeris ready, sidereal mode={}", siderealMode);
    }

    @Override
    public double longitude(Body body, double julianDay, boolean sidereal) {
        ensureOpen();
        requireFinite(julianDay, body + " longitude");
        double tropical = switch (body) {
            case SUN -> sunLongitude(julianDay);
            case MOON -> moonLongitude(julianDay);
        };
        double value = sidereal ? tropical - siderealMode.ayanamsaAt(julianDay) : tropical;
        if (!Double.isFinite(value)) {
            throw new ComputationException("Longitude computation failed for " + body + " jd=" + julianDay);
        }
        return AngularSegmenter.normalize(value);
    }

    @Override
    public OptionalDouble riseSet(Body body, double julianDay, double latitude, double longitude, RiseSetEvent event) {
        ensureOpen();
        requireFinite(julianDay, body + " " + event);
        double target = horizonAltitude(body);

        // 以 10 分钟步长扫描 [julianDay, julianDay + 1)，找到穿越地平线的区间后二分
        double previousTime = julianDay;
        double previous = altitude(body, julianDay, latitude, longitude) - target;
        for (int step = 1; step <= SCAN_STEPS_PER_DAY; step++) {
            double time = julianDay + step * SCAN_STEP_DAYS;
            double current = altitude(body, time, latitude, longitude) - target;
            boolean crossed = event == RiseSetEvent.RISE
                    ? previous < 0.0 && current >= 0.0
                    : previous >= 0.0 && current < 0.0;
            if (crossed) {
                return OptionalDouble.of(bisect(body, previousTime, time, latitude, longitude, target, event));
            }
            previousTime = time;
            previous = current;
        }
        log.debug("{} {} not found after jd={} at lat={} lon={}", body, event, julianDay, latitude, longitude);
        return OptionalDouble.empty();
    }

    @Override
    public double ayanamsa(double julianDay) {
        ensureOpen();
        requireFinite(julianDay, "ayanamsa");
        return siderealMode.ayanamsaAt(julianDay);
    }

    @Override
    public SiderealMode siderealMode() {
        return siderealMode;
    }

    @Override
    public void close() {
        if (!closed) {
            closed = true;
            log.info("analytic ephemeris closed");
        }
    }

    public boolean isClosed() {
        return closed;
    }

    // ---------------------------------------------------------------- 太阳

    static double sunMeanAnomaly(double julianDay) {
        double n = meanMotion(julianDay);
        return modulo(n + SUN_LONGITUDE_AT_EPOCH - SUN_PERIGEE_LONGITUDE, 360.0);
    }

    static double sunLongitude(double julianDay) {
        double n = meanMotion(julianDay);
        double m = modulo(n + SUN_LONGITUDE_AT_EPOCH - SUN_PERIGEE_LONGITUDE, 360.0);
        double centre = (360.0 / Math.PI) * ORBIT_ECCENTRICITY * Math.sin(Math.toRadians(m));
        return modulo(n + centre + SUN_LONGITUDE_AT_EPOCH, 360.0);
    }

    private static double meanMotion(double julianDay) {
        double d = julianDay - EPOCH_2010;
        return modulo((360.0 / TROPICAL_YEAR_DAYS) * d, 360.0);
    }

    // ---------------------------------------------------------------- 月亮

    static double moonLongitude(double julianDay) {
        return moonPosition(julianDay).longitude();
    }

    static EclipticPosition moonPosition(double julianDay) {
        double d = julianDay - EPOCH_2010;
        double sunLon = sunLongitude(julianDay);
        double sunAnomalySine = Math.sin(Math.toRadians(sunMeanAnomaly(julianDay)));

        double l = modulo(13.1763966 * d + MOON_MEAN_LONGITUDE_AT_EPOCH, 360.0);
        double mm = modulo(l - 0.1114041 * d - MOON_PERIGEE_AT_EPOCH, 360.0);
        double node = modulo(MOON_NODE_AT_EPOCH - 0.0529539 * d, 360.0);

        double evection = 1.2739 * Math.sin(Math.toRadians(2.0 * (l - sunLon) - mm));
        double annual = 0.1858 * sunAnomalySine;
        double third = 0.37 * sunAnomalySine;
        double correctedAnomaly = Math.toRadians(mm + evection - annual - third);
        double centre = 6.2886 * Math.sin(correctedAnomaly);
        double fourth = 0.214 * Math.sin(2.0 * correctedAnomaly);
        double corrected = l + evection + centre - annual + fourth;
        double variation = 0.6583 * Math.sin(Math.toRadians(2.0 * (corrected - sunLon)));
        double trueLongitude = corrected + variation;

        // 轨道面黄经归算到黄道
        double correctedNode = node - 0.16 * sunAnomalySine;
        double u = Math.toRadians(trueLongitude - correctedNode);
        double y = Math.sin(u) * Math.cos(Math.toRadians(MOON_ORBIT_INCLINATION));
        double x = Math.cos(u);
        double longitude = modulo(Math.toDegrees(Math.atan2(y, x)) + correctedNode, 360.0);
        double latitude = Math.toDegrees(Math.asin(Math.sin(u) * Math.sin(Math.toRadians(MOON_ORBIT_INCLINATION))));
        return new EclipticPosition(longitude, latitude);
    }

    // ---------------------------------------------------------------- 出没

    private static double horizonAltitude(Body body) {
        return switch (body) {
            case SUN -> SUN_HORIZON_ALTITUDE;
            case MOON -> MOON_HORIZON_ALTITUDE;
        };
    }

    private static double bisect(Body body, double before, double after, double latitude, double longitude,
                                 double target, RiseSetEvent event) {
        double low = before;
        double high = after;
        for (int i = 0; i < BISECTION_ITERATIONS; i++) {
            double mid = (low + high) / 2.0;
            boolean above = altitude(body, mid, latitude, longitude) - target >= 0.0;
            // 升起时 high 端在地平线上，落下时 high 端在地平线下
            if (above == (event == RiseSetEvent.RISE)) {
                high = mid;
            } else {
                low = mid;
            }
        }
        return (low + high) / 2.0;
    }

    /**
     * 天体中心的地平高度（度），未做周日视差与折射修正，这两项计入 {@link #horizonAltitude}。
     */
    static double altitude(Body body, double julianDay, double latitude, double longitude) {
        EclipticPosition ecliptic = switch (body) {
            case SUN -> new EclipticPosition(sunLongitude(julianDay), 0.0);
            case MOON -> moonPosition(julianDay);
        };
        EquatorialPosition equatorial = ecliptic.toEquatorial(julianDay);
        double hourAngle = Math.toRadians(greenwichSiderealDegrees(julianDay) + longitude - equatorial.rightAscension());
        double phi = Math.toRadians(latitude);
        double delta = Math.toRadians(equatorial.declination());
        return Math.toDegrees(Math.asin(Math.sin(phi) * Math.sin(delta)
                + Math.cos(phi) * Math.cos(delta) * Math.cos(hourAngle)));
    }

    static double greenwichSiderealDegrees(double julianDay) {
        double d = julianDay - SiderealMode.J2000;
        double t = d / 36525.0;
        return modulo(280.46061837 + 360.98564736629 * d + 0.000387933 * t * t - t * t * t / 38710000.0, 360.0);
    }

    // ----------------------------------------------------------------

    private void ensureOpen() {
        if (closed) {
            throw new ClosedResourceException("AnalyticEphemerisProvider");
        }
    }

    private static void requireFinite(double julianDay, String what) {
        if (!Double.isFinite(julianDay)) {
            throw new ComputationException("Cannot compute " + what + " for non-finite julian day: " + julianDay);
        }
    }

    static double modulo(double dividend, double divisor) {
        return dividend - divisor * Math.floor(dividend / divisor);
    }
}
