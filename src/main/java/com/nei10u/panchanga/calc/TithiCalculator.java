package com.nei10u.panchanga.calc;

import com.nei10u.panchanga.calc.AngularSegmenter.Segment;
import com.nei10u.panchanga.model.CalendarTables;
import com.nei10u.panchanga.model.Paksha;
import com.nei10u.panchanga.model.Planet;
import com.nei10u.panchanga.model.TithiData;

/**
 * Tithi：月亮领先太阳的角距每 12° 为一个太阴日，一个朔望月共 30 个。
 */
public final class TithiCalculator {

    public static final double TITHI_SPAN = 12.0;
    public static final int TOTAL_TITHIS = 30;
    private static final int TITHIS_PER_PAKSHA = 15;

    private TithiCalculator() {
    }

    /**
     * 月日角距（恒星黄经之差），[0, 360)。Karana 和月相也用同一个值。
     */
    public static double elongation(double sunLongitude, double moonLongitude) {
        return AngularSegmenter.normalize(moonLongitude - sunLongitude);
    }

    public static TithiData calculate(double sunLongitude, double moonLongitude) {
        double elongation = elongation(sunLongitude, moonLongitude);
        Segment segment = AngularSegmenter.segment(elongation, TITHI_SPAN, TOTAL_TITHIS);
        int number = segment.index() + 1;

        return TithiData.builder()
                .tithi(CalendarTables.TITHIS.byNumber(number))
                .number(number)
                .numberInPaksha(numberInPaksha(number))
                .paksha(Paksha.fromTithiNumber(number))
                .progress(segment.progressFraction() * 100.0)
                .lord(lordOf(number))
                .elongation(elongation)
                .remainingDegrees(segment.remainingDegrees())
                .build();
    }

    public static Planet lordOf(int tithiNumber) {
        return CalendarTables.TITHI_LORDS.byNumber(numberInPaksha(tithiNumber));
    }

    static int numberInPaksha(int tithiNumber) {
        return ((tithiNumber - 1) % TITHIS_PER_PAKSHA) + 1;
    }
}
