package com.nei10u.panchanga.ephemeris;

/**
 * 赤道坐标：赤经、赤纬均以度表示。
 */
record EquatorialPosition(double rightAscension, double declination) {
}
