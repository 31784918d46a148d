package com.nei10u.panchanga.ephemeris;

import java.util.Locale;

/**
 * 岁差（ayanamsa）体系。取 J2000.0 时刻的值，按一般岁差 50.2788″/年线性外推。
 */
public enum SiderealMode {
    LAHIRI(23.857092),
    RAMAN(22.410791),
    KRISHNAMURTI(23.760240),
    FAGAN_BRADLEY(24.740300);

    static final double J2000 = 2451545.0;
    private static final double DAYS_PER_JULIAN_YEAR = 365.25;
    private static final double PRECESSION_ARCSEC_PER_YEAR = 50.2788;

    private final double ayanamsaAtJ2000;

    SiderealMode(double ayanamsaAtJ2000) {
        this.ayanamsaAtJ2000 = ayanamsaAtJ2000;
    }

    public double ayanamsaAt(double julianDay) {
        double years = (julianDay - J2000) / DAYS_PER_JULIAN_YEAR;
        return ayanamsaAtJ2000 + years * PRECESSION_ARCSEC_PER_YEAR / 3600.0;
    }

    public double getAyanamsaAtJ2000() {
        return ayanamsaAtJ2000;
    }

    /**
     * 配置里的名字，大小写和连字符不敏感，如 "lahiri"、"fagan-bradley"。
     */
    public static SiderealMode fromName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("sidereal mode must not be blank");
        }
        String key = name.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        try {
            return valueOf(key);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown sidereal mode: " + name, e);
        }
    }
}
