package com.nei10u.panchanga.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class TithiData {
    TithiName tithi;
    int number;               // 1..30
    int numberInPaksha;       // 1..15
    Paksha paksha;
    double progress;          // [0, 100)
    Planet lord;
    double elongation;        // 月日角距，[0, 360)
    double remainingDegrees;

    public TithiGroup getGroup() {
        return tithi.group();
    }
}
