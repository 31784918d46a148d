package com.nei10u.panchanga.ephemeris;

import com.nei10u.panchanga.exception.ClosedResourceException;
import com.nei10u.panchanga.exception.ComputationException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.temporal.ChronoUnit;
import java.util.OptionalDouble;

import static org.junit.jupiter.api.Assertions.*;

class AnalyticEphemerisProviderTest {

    private static final double J2000 = 2451545.0;
    private static final double FULL_MOON_2023_02_05 = 2459981.269444444;  // 18:28 UT
    private static final double NEW_MOON_2024_04_08 = 2460409.2645833334;  // 18:21 UT

    private final AnalyticEphemerisProvider provider = new AnalyticEphemerisProvider(SiderealMode.LAHIRI);
    private final TimeProvider time = new LunarTimeProvider();

    @AfterEach
    void tearDown() {
        provider.close();
    }

    private static double circularDistance(double a, double b) {
        double d = Math.abs(a - b) % 360.0;
        return Math.min(d, 360.0 - d);
    }

    @Nested
    @DisplayName("Longitudes")
    class Longitudes {

        @Test
        @DisplayName("tropical sun at J2000.0 is about 280.37°")
        void sunAtJ2000() {
            assertEquals(280.37, provider.longitude(Body.SUN, J2000, false), 0.1);
        }

        @Test
        void moonOppositeSunAtFullMoon() {
            double sun = provider.longitude(Body.SUN, FULL_MOON_2023_02_05, false);
            double moon = provider.longitude(Body.MOON, FULL_MOON_2023_02_05, false);
            assertTrue(circularDistance(moon - sun, 180.0) < 1.5, "elongation " + (moon - sun));
        }

        @Test
        void moonConjunctSunAtNewMoon() {
            double sun = provider.longitude(Body.SUN, NEW_MOON_2024_04_08, false);
            double moon = provider.longitude(Body.MOON, NEW_MOON_2024_04_08, false);
            assertTrue(circularDistance(moon, sun) < 1.5, "elongation " + (moon - sun));
        }

        @Test
        @DisplayName("sidereal longitude is tropical minus ayanamsa")
        void siderealOffset() {
            double jd = 2460324.7083333335;
            for (Body body : Body.values()) {
                double tropical = provider.longitude(body, jd, false);
                double sidereal = provider.longitude(body, jd, true);
                assertEquals(0.0, circularDistance(tropical - provider.ayanamsa(jd), sidereal), 1e-9);
                assertTrue(sidereal >= 0.0 && sidereal < 360.0);
            }
        }

        @Test
        void lahiriAyanamsaIn2024() {
            assertEquals(24.19, provider.ayanamsa(2460310.5), 0.02);
        }

        @Test
        void nonFiniteJulianDayIsAComputationError() {
            assertThrows(ComputationException.class, () -> provider.longitude(Body.MOON, Double.NaN, true));
            assertThrows(ComputationException.class, () -> provider.ayanamsa(Double.POSITIVE_INFINITY));
        }
    }

    @Nested
    @DisplayName("Sunrise and sunset")
    class RiseSet {

        @Test
        @DisplayName("New Delhi, 15 January 2024: about 07:15 and 17:47 IST")
        void newDelhi() {
            ZoneId ist = ZoneId.of("Asia/Kolkata");
            double midnight = time.localMidnightJulianDay(LocalDate.of(2024, 1, 15), ist);

            OptionalDouble rise = provider.riseSet(Body.SUN, midnight, 28.6139, 77.2090, RiseSetEvent.RISE);
            OptionalDouble set = provider.riseSet(Body.SUN, midnight, 28.6139, 77.2090, RiseSetEvent.SET);
            assertTrue(rise.isPresent());
            assertTrue(set.isPresent());
            assertTrue(rise.getAsDouble() > midnight && rise.getAsDouble() < set.getAsDouble());
            assertTrue(set.getAsDouble() < midnight + 1.0);

            assertWithinMinutes(LocalTime.of(7, 15), time.toLocalTime(rise.getAsDouble(), ist), 10);
            assertWithinMinutes(LocalTime.of(17, 47), time.toLocalTime(set.getAsDouble(), ist), 10);
        }

        @Test
        @DisplayName("New York sunset falls on the same local evening")
        void newYork() {
            ZoneId zone = ZoneId.of("America/New_York");
            double midnight = time.localMidnightJulianDay(LocalDate.of(2024, 6, 21), zone);
            OptionalDouble set = provider.riseSet(Body.SUN, midnight, 40.7128, -74.0060, RiseSetEvent.SET);
            assertTrue(set.isPresent());
            assertWithinMinutes(LocalTime.of(20, 31), time.toLocalTime(set.getAsDouble(), zone), 10);
        }

        @Test
        @DisplayName("Dhaka, 25 March 2024: sunrise and sunset both fall inside the local day")
        void dhakaSameDay() {
            ZoneId dhaka = ZoneId.of("Asia/Dhaka");
            double midnight = time.localMidnightJulianDay(LocalDate.of(2024, 3, 25), dhaka);

            double rise = provider.riseSet(Body.SUN, midnight, 23.8103, 90.4125, RiseSetEvent.RISE).orElseThrow();
            double set = provider.riseSet(Body.SUN, midnight, 23.8103, 90.4125, RiseSetEvent.SET).orElseThrow();
            assertTrue(midnight <= rise && rise < set && set < midnight + 1.0,
                    "midnight=" + midnight + " rise=" + rise + " set=" + set);
            assertWithinMinutes(LocalTime.of(5, 58), time.toLocalTime(rise, dhaka), 10);
        }

        @Test
        @DisplayName("every day of 2024 in Dhaka keeps sunrise before sunset within the day")
        void dhakaWholeYear() {
            ZoneId dhaka = ZoneId.of("Asia/Dhaka");
            for (LocalDate date = LocalDate.of(2024, 1, 1); date.getYear() == 2024; date = date.plusDays(1)) {
                double midnight = time.localMidnightJulianDay(date, dhaka);
                OptionalDouble rise = provider.riseSet(Body.SUN, midnight, 23.8103, 90.4125, RiseSetEvent.RISE);
                OptionalDouble set = provider.riseSet(Body.SUN, midnight, 23.8103, 90.4125, RiseSetEvent.SET);
                assertTrue(rise.isPresent() && set.isPresent(), date.toString());
                assertTrue(midnight <= rise.getAsDouble() && rise.getAsDouble() < set.getAsDouble()
                        && set.getAsDouble() < midnight + 1.0, date.toString());
            }
        }

        @Test
        @DisplayName("events stay inside the search window for every longitude")
        void longitudeSweep() {
            double start = time.localMidnightJulianDay(LocalDate.of(2024, 3, 25), ZoneId.of("Asia/Tokyo"));
            for (double lon = -180.0; lon <= 180.0; lon += 0.75) {
                double rise = provider.riseSet(Body.SUN, start, 35.0, lon, RiseSetEvent.RISE).orElseThrow();
                assertTrue(rise >= start && rise < start + 1.0, "lon=" + lon + " rise=" + rise);
            }
        }

        @Test
        @DisplayName("New Delhi moonrise and moonset on 15 January 2024")
        void newDelhiMoon() {
            ZoneId ist = ZoneId.of("Asia/Kolkata");
            double midnight = time.localMidnightJulianDay(LocalDate.of(2024, 1, 15), ist);

            double rise = provider.riseSet(Body.MOON, midnight, 28.6139, 77.2090, RiseSetEvent.RISE).orElseThrow();
            double set = provider.riseSet(Body.MOON, midnight, 28.6139, 77.2090, RiseSetEvent.SET).orElseThrow();
            assertWithinMinutes(LocalTime.of(10, 14), time.toLocalTime(rise, ist), 15);
            assertWithinMinutes(LocalTime.of(22, 7), time.toLocalTime(set, ist), 15);
        }

        @Test
        @DisplayName("a day without moonset reports none")
        void dayWithoutMoonset() {
            ZoneId ist = ZoneId.of("Asia/Kolkata");
            double midnight = time.localMidnightJulianDay(LocalDate.of(2024, 1, 17), ist);

            assertTrue(provider.riseSet(Body.MOON, midnight, 28.6139, 77.2090, RiseSetEvent.SET).isEmpty());
            assertTrue(provider.riseSet(Body.MOON, midnight, 28.6139, 77.2090, RiseSetEvent.RISE).isPresent());
        }

        @Test
        @DisplayName("polar night and midnight sun report no event")
        void polarLatitudes() {
            ZoneId oslo = ZoneId.of("Europe/Oslo");
            double winter = time.localMidnightJulianDay(LocalDate.of(2024, 12, 21), oslo);
            double summer = time.localMidnightJulianDay(LocalDate.of(2024, 6, 21), oslo);

            assertTrue(provider.riseSet(Body.SUN, winter, 69.65, 18.96, RiseSetEvent.RISE).isEmpty());
            assertTrue(provider.riseSet(Body.SUN, summer, 69.65, 18.96, RiseSetEvent.SET).isEmpty());
        }
    }

    @Nested
    @DisplayName("Lifecycle")
    class Lifecycle {

        @Test
        void closeIsIdempotentAndRejectsLaterCalls() {
            AnalyticEphemerisProvider local = new AnalyticEphemerisProvider(SiderealMode.RAMAN);
            local.close();
            local.close();
            assertTrue(local.isClosed());
            assertThrows(ClosedResourceException.class, () -> local.longitude(Body.SUN, J2000, true));
            assertThrows(ClosedResourceException.class, () -> local.ayanamsa(J2000));
            assertThrows(ClosedResourceException.class,
                    () -> local.riseSet(Body.SUN, J2000, 0.0, 0.0, RiseSetEvent.RISE));
        }

        @Test
        @DisplayName("two providers with different modes coexist")
        void independentConfiguration() {
            try (AnalyticEphemerisProvider fagan = new AnalyticEphemerisProvider(SiderealMode.FAGAN_BRADLEY)) {
                double diff = fagan.ayanamsa(J2000) - provider.ayanamsa(J2000);
                assertEquals(24.7403 - 23.857092, diff, 1e-6);
                assertEquals(SiderealMode.LAHIRI, provider.siderealMode());
            }
        }
    }

    private static void assertWithinMinutes(LocalTime expected, LocalTime actual, long minutes) {
        long diff = Math.abs(ChronoUnit.MINUTES.between(expected, actual));
        assertTrue(diff <= minutes, "expected ~" + expected + " but was " + actual);
    }
}
