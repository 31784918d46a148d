package com.nei10u.panchanga.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class YogaData {
    YogaName yoga;
    int number;                 // 1..27
    double progress;
    double combinedLongitude;   // 日月恒星黄经之和，[0, 360)
    double remainingDegrees;

    public boolean isAuspicious() {
        return yoga.nature() == YogaNature.AUSPICIOUS;
    }
}
