package com.nei10u.panchanga.calc;

import com.nei10u.panchanga.calc.AngularSegmenter.Segment;
import com.nei10u.panchanga.model.CalendarTables;
import com.nei10u.panchanga.model.YogaData;

public final class YogaCalculator {

    public static final int TOTAL_YOGAS = 27;
    public static final double YOGA_SPAN = AngularSegmenter.FULL_CIRCLE / TOTAL_YOGAS;

    private YogaCalculator() {
    }

    public static YogaData calculate(double sunLongitude, double moonLongitude) {
        double combined = AngularSegmenter.normalize(sunLongitude + moonLongitude);
        Segment segment = AngularSegmenter.segment(combined, YOGA_SPAN, TOTAL_YOGAS);
        int number = segment.index() + 1;

        return YogaData.builder()
                .yoga(CalendarTables.YOGAS.byNumber(number))
                .number(number)
                .progress(segment.progressFraction() * 100.0)
                .combinedLongitude(combined)
                .remainingDegrees(segment.remainingDegrees())
                .build();
    }
}
