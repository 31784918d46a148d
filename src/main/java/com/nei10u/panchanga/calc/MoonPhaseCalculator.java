package com.nei10u.panchanga.calc;

/**
 * 月面照亮比例的余弦近似：(1 - cos(角距)) / 2。
 * 不是完整的相位角光度模型，误差可达数个百分点。
 */
public final class MoonPhaseCalculator {

    private MoonPhaseCalculator() {
    }

    public static double illumination(double elongation) {
        double radians = Math.toRadians(AngularSegmenter.normalize(elongation));
        double percent = (1.0 - Math.cos(radians)) / 2.0 * 100.0;
        return Math.max(0.0, Math.min(100.0, percent));
    }
}
