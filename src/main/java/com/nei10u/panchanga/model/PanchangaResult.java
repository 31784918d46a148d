package com.nei10u.panchanga.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalTime;

/**
 * 一次排盘的完整结果。所有数值字段保持原始精度，展示用的 12 小时制字符串单独存放。
 */
@Value
@Builder
public class PanchangaResult {
    double julianDay;           // 查询时刻（UT）的儒略日
    String siderealMode;

    TithiData tithi;
    NakshatraData nakshatra;
    YogaData yoga;
    KaranaData karana;
    VaraName vara;
    Paksha paksha;

    double sunriseJulianDay;
    double sunsetJulianDay;
    LocalTime sunriseTime;
    LocalTime sunsetTime;
    String sunrise;             // 如 "6:42:10 AM"
    String sunset;
    boolean sunriseFallback;    // 无日出事件时为 true（极昼/极夜），此时取当地午夜 + 0.25 日
    boolean sunsetFallback;

    // 月出月落当天可能不存在，不做兜底，缺失时为 null
    Double moonriseJulianDay;
    Double moonsetJulianDay;
    LocalTime moonriseTime;
    LocalTime moonsetTime;
    String moonrise;
    String moonset;

    double moonIllumination;    // 百分比 [0, 100]
    double sunLongitude;        // 恒星黄经
    double moonLongitude;
    double sunTropicalLongitude;
    double moonTropicalLongitude;
    double ayanamsa;
}
