package com.nei10u.panchanga.ephemeris;

/**
 * 黄道坐标（度），只在星历内部使用。
 */
record EclipticPosition(double longitude, double latitude) {

    /**
     * 按 {@code julianDay} 时刻的平黄赤交角换算为赤道坐标。
     */
    EquatorialPosition toEquatorial(double julianDay) {
        double t = (julianDay - SiderealMode.J2000) / 36525.0;
        double obliquity = Math.toRadians(23.439292 - (46.815 * t - 0.0006 * t * t + 0.00181 * t * t * t) / 3600.0);
        double lon = Math.toRadians(longitude);
        double lat = Math.toRadians(latitude);

        double declination = Math.asin(Math.sin(lat) * Math.cos(obliquity)
                + Math.cos(lat) * Math.sin(obliquity) * Math.sin(lon));
        // atan2 直接给出正确象限
        double rightAscension = Math.atan2(
                Math.sin(lon) * Math.cos(obliquity) - Math.tan(lat) * Math.sin(obliquity),
                Math.cos(lon));
        return new EquatorialPosition(
                AnalyticEphemerisProvider.modulo(Math.toDegrees(rightAscension), 360.0),
                Math.toDegrees(declination));
    }
}
