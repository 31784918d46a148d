package com.nei10u.panchanga.calc;

import com.nei10u.panchanga.model.YogaData;
import com.nei10u.panchanga.model.YogaNature;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class YogaCalculatorTest {

    @Test
    void combinedLongitudeWrapsPastFullCircle() {
        YogaData yoga = YogaCalculator.calculate(200.0, 170.0);
        assertEquals(10.0, yoga.getCombinedLongitude(), 1e-9);
        assertEquals(1, yoga.getNumber());
        assertEquals("Vishkumbha", yoga.getYoga().name());
        assertFalse(yoga.isAuspicious());
    }

    @Test
    void progressAndRemainder() {
        YogaData yoga = YogaCalculator.calculate(300.0, 95.0);
        assertEquals(35.0, yoga.getCombinedLongitude(), 1e-9);
        assertEquals(3, yoga.getNumber());
        assertEquals("Ayushman", yoga.getYoga().name());
        assertTrue(yoga.isAuspicious());
        assertEquals(62.5, yoga.getProgress(), 1e-9);
        assertEquals(5.0, yoga.getRemainingDegrees(), 1e-9);
    }

    @Test
    void vajraIsMixed() {
        // 第 15 个 Yoga 从 14 * 360/27 ≈ 186.67° 开始
        YogaData yoga = YogaCalculator.calculate(90.0, 100.0);
        assertEquals(15, yoga.getNumber());
        assertEquals(YogaNature.MIXED, yoga.getYoga().nature());
        assertFalse(yoga.isAuspicious());
    }

    @Test
    void numberAlwaysInRange() {
        for (double s = 0.0; s < 360.0; s += 7.3) {
            for (double m = 0.0; m < 360.0; m += 11.9) {
                int number = YogaCalculator.calculate(s, m).getNumber();
                assertTrue(number >= 1 && number <= 27);
            }
        }
    }
}
