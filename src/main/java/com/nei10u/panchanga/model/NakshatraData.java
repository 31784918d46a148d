package com.nei10u.panchanga.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class NakshatraData {
    NakshatraName nakshatra;
    int number;                 // 1..27
    int pada;                   // 1..4
    double progress;            // [0, 100)
    Planet lord;
    double degreeInNakshatra;
    double remainingDegrees;
}
