package com.nei10u.panchanga.tools;

import com.nei10u.panchanga.ephemeris.AnalyticEphemerisProvider;
import com.nei10u.panchanga.ephemeris.LunarTimeProvider;
import com.nei10u.panchanga.ephemeris.SiderealMode;
import com.nei10u.panchanga.exception.InvalidTimezoneException;
import com.nei10u.panchanga.model.PanchangaResult;
import com.nei10u.panchanga.service.PanchangaEngine;

import java.io.PrintStream;
import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import java.util.Locale;

/**
 * 本地命令行排盘工具（不启动 Web 服务）。
 *
 * 用法：
 * mvn -q -DskipTests package
 * java -cp target/classes:... com.nei10u.panchanga.tools.PanchangaCliTool
 * 2024-01-15T10:30 28.6139 77.2090 Asia/Kolkata [LAHIRI]
 */
public class PanchangaCliTool {

    public static void main(String[] args) {
        if (args == null || args.length < 4) {
            System.err.println("用法: PanchangaCliTool <yyyy-MM-ddTHH:mm[:ss]> <latitude> <longitude> <timezone> [siderealMode]");
            System.exit(2);
        }
        try {
            LocalDateTime dateTime = LocalDateTime.parse(args[0]);
            double latitude = Double.parseDouble(args[1]);
            double longitude = Double.parseDouble(args[2]);
            SiderealMode mode = args.length > 4 ? SiderealMode.fromName(args[4]) : SiderealMode.LAHIRI;

            try (PanchangaEngine engine = new PanchangaEngine(new AnalyticEphemerisProvider(mode), new LunarTimeProvider())) {
                print(engine.compute(dateTime, latitude, longitude, args[3]), System.out);
            }
        } catch (DateTimeParseException | IllegalArgumentException | InvalidTimezoneException e) {
            System.err.println("参数错误: " + e.getMessage());
            System.exit(2);
        }
    }

    static void print(PanchangaResult r, PrintStream out) {
        out.printf(Locale.US, "Tithi     : %s (%d, %s) %.1f%% lord=%s%n",
                r.getTithi().getTithi().name(), r.getTithi().getNumber(), r.getPaksha(),
                r.getTithi().getProgress(), r.getTithi().getLord());
        out.printf(Locale.US, "Nakshatra : %s (%d) pada %d, lord=%s%n",
                r.getNakshatra().getNakshatra().name(), r.getNakshatra().getNumber(),
                r.getNakshatra().getPada(), r.getNakshatra().getLord());
        out.printf(Locale.US, "Yoga      : %s (%d) %s%n",
                r.getYoga().getYoga().name(), r.getYoga().getNumber(), r.getYoga().getYoga().nature());
        out.printf(Locale.US, "Karana    : %s (%d) %s%n",
                r.getKarana().getKarana().name(), r.getKarana().getNumber(), r.getKarana().getType());
        out.printf(Locale.US, "Vara      : %s, lord=%s%n", r.getVara().name(), r.getVara().lord());
        out.printf(Locale.US, "Sunrise   : %s%s%n", r.getSunrise(), r.isSunriseFallback() ? " (fallback)" : "");
        out.printf(Locale.US, "Sunset    : %s%s%n", r.getSunset(), r.isSunsetFallback() ? " (fallback)" : "");
        out.printf(Locale.US, "Moonrise  : %s%n", r.getMoonrise() == null ? "none" : r.getMoonrise());
        out.printf(Locale.US, "Moonset   : %s%n", r.getMoonset() == null ? "none" : r.getMoonset());
        out.printf(Locale.US, "Moon      : %.1f%% illuminated%n", r.getMoonIllumination());
        out.printf(Locale.US, "Ayanamsa  : %.4f (%s)%n", r.getAyanamsa(), r.getSiderealMode());
    }
}
