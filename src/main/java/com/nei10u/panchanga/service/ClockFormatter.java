package com.nei10u.panchanga.service;

import java.time.LocalTime;
import java.util.Locale;

/**
 * 展示用的 12 小时制时间，如 "6:05:09 AM"；0 点显示为 12。
 */
public final class ClockFormatter {

    private ClockFormatter() {
    }

    public static String format12Hour(LocalTime time) {
        int hour = time.getHour();
        int displayHour;
        if (hour == 0) {
            displayHour = 12;
        } else if (hour > 12) {
            displayHour = hour - 12;
        } else {
            displayHour = hour;
        }
        String amPm = hour < 12 ? "AM" : "PM";
        return String.format(Locale.US, "%d:%02d:%02d %s", displayHour, time.getMinute(), time.getSecond(), amPm);
    }
}
