package com.nei10u.panchanga.ephemeris;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

class SiderealModeTest {

    @ParameterizedTest
    @CsvSource({
            "lahiri, LAHIRI",
            "' Raman ', RAMAN",
            "fagan-bradley, FAGAN_BRADLEY",
            "KRISHNAMURTI, KRISHNAMURTI"
    })
    void parsesConfiguredNames(String name, SiderealMode expected) {
        assertEquals(expected, SiderealMode.fromName(name));
    }

    @Test
    void rejectsUnknownNames() {
        assertThrows(IllegalArgumentException.class, () -> SiderealMode.fromName("tropical"));
        assertThrows(IllegalArgumentException.class, () -> SiderealMode.fromName(" "));
    }

    @Test
    void ayanamsaGrowsAboutFiftyArcSecondsPerYear() {
        double perYear = SiderealMode.LAHIRI.ayanamsaAt(SiderealMode.J2000 + 365.25)
                - SiderealMode.LAHIRI.ayanamsaAt(SiderealMode.J2000);
        assertEquals(50.2788 / 3600.0, perYear, 1e-12);
        assertEquals(23.857092, SiderealMode.LAHIRI.ayanamsaAt(SiderealMode.J2000), 1e-12);
    }
}
