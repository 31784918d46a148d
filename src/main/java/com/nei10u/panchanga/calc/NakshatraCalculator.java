package com.nei10u.panchanga.calc;

import com.nei10u.panchanga.calc.AngularSegmenter.Segment;
import com.nei10u.panchanga.model.CalendarTables;
import com.nei10u.panchanga.model.NakshatraData;
import com.nei10u.panchanga.model.NakshatraName;

/**
 * Nakshatra（月宿）：月亮恒星黄经按 360/27° 切分，每宿再四等分为 pada。
 */
public final class NakshatraCalculator {

    public static final int TOTAL_NAKSHATRAS = 27;
    public static final double NAKSHATRA_SPAN = AngularSegmenter.FULL_CIRCLE / TOTAL_NAKSHATRAS;
    public static final double PADA_SPAN = NAKSHATRA_SPAN / 4.0;

    private NakshatraCalculator() {
    }

    public static NakshatraData calculate(double moonLongitude) {
        Segment segment = AngularSegmenter.segment(moonLongitude, NAKSHATRA_SPAN, TOTAL_NAKSHATRAS);
        int number = segment.index() + 1;
        double degreeInNakshatra = NAKSHATRA_SPAN - segment.remainingDegrees();
        NakshatraName nakshatra = CalendarTables.NAKSHATRAS.byNumber(number);

        return NakshatraData.builder()
                .nakshatra(nakshatra)
                .number(number)
                .pada(padaOf(degreeInNakshatra))
                .progress(segment.progressFraction() * 100.0)
                .lord(nakshatra.ruler())
                .degreeInNakshatra(degreeInNakshatra)
                .remainingDegrees(segment.remainingDegrees())
                .build();
    }

    static int padaOf(double degreeInNakshatra) {
        return (int) Math.floor(degreeInNakshatra / PADA_SPAN) % 4 + 1;
    }
}
