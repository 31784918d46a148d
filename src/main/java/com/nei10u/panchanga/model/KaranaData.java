package com.nei10u.panchanga.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class KaranaData {
    KaranaName karana;
    int number;                 // 全局编号 1..60
    double progress;
    double remainingDegrees;

    /**
     * Vishti（又称 Bhadra）是唯一被视为不吉的移动 Karana。
     */
    public boolean isVishti() {
        return "Vishti".equals(karana.name());
    }

    public KaranaType getType() {
        return karana.type();
    }
}
