package com.nei10u.panchanga.calc;

import com.nei10u.panchanga.calc.AngularSegmenter.Segment;
import com.nei10u.panchanga.model.CalendarTables;
import com.nei10u.panchanga.model.KaranaData;
import com.nei10u.panchanga.model.KaranaName;

/**
 * Karana：半个 Tithi（6°），一个朔望月 60 个。
 *
 * 编号分布是不对称的：1 号固定为 Kimstughna；2..57 号由七个移动 Karana 从 Bava 起循环八遍；
 * 58、59、60 号依次是 Shakuni、Chatushpada、Naga。
 */
public final class KaranaCalculator {

    public static final double KARANA_SPAN = 6.0;
    public static final int TOTAL_KARANAS = 60;

    private static final int FIRST_MOVABLE = 2;
    private static final int LAST_MOVABLE = 57;

    private KaranaCalculator() {
    }

    public static KaranaData calculate(double sunLongitude, double moonLongitude) {
        double elongation = TithiCalculator.elongation(sunLongitude, moonLongitude);
        Segment segment = AngularSegmenter.segment(elongation, KARANA_SPAN, TOTAL_KARANAS);
        int number = segment.index() + 1;

        return KaranaData.builder()
                .karana(nameOf(number))
                .number(number)
                .progress(segment.progressFraction() * 100.0)
                .remainingDegrees(segment.remainingDegrees())
                .build();
    }

    public static KaranaName nameOf(int karanaNumber) {
        if (karanaNumber < 1 || karanaNumber > TOTAL_KARANAS) {
            throw new IllegalArgumentException("karana number out of range [1, 60]: " + karanaNumber);
        }
        if (karanaNumber < FIRST_MOVABLE) {
            return CalendarTables.KIMSTUGHNA;
        }
        if (karanaNumber > LAST_MOVABLE) {
            return CalendarTables.TRAILING_FIXED_KARANAS.byNumber(karanaNumber - LAST_MOVABLE);
        }
        int movable = (karanaNumber - FIRST_MOVABLE) % CalendarTables.MOVABLE_KARANAS.size();
        return CalendarTables.MOVABLE_KARANAS.byIndex(movable);
    }
}
