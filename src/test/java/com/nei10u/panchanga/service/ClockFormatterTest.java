package com.nei10u.panchanga.service;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.LocalTime;

import static org.junit.jupiter.api.Assertions.assertEquals;

class ClockFormatterTest {

    @ParameterizedTest
    @CsvSource({
            "00:05:09, 12:05:09 AM",
            "06:00:00, 6:00:00 AM",
            "11:59:59, 11:59:59 AM",
            "12:00:00, 12:00:00 PM",
            "13:07:00, 1:07:00 PM",
            "23:45:30, 11:45:30 PM"
    })
    void formatsTwelveHourClock(String time, String expected) {
        assertEquals(expected, ClockFormatter.format12Hour(LocalTime.parse(time)));
    }
}
