package com.nei10u.panchanga.service;

import com.nei10u.panchanga.model.PanchangaRequest;
import com.nei10u.panchanga.model.PanchangaResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.time.DateTimeException;
import java.time.LocalDateTime;

@Service
public class PanchangaService {

    private static final Logger log = LoggerFactory.getLogger(PanchangaService.class);

    private final PanchangaEngine engine;
    private final String defaultTimezone;

    public PanchangaService(PanchangaEngine engine,
                            @Value("${panchanga.default-timezone:Asia/Kolkata}") String defaultTimezone) {
        this.engine = engine;
        this.defaultTimezone = defaultTimezone;
    }

    public PanchangaResult calculate(PanchangaRequest req) {
        if (req.getLatitude() == null || req.getLongitude() == null) {
            throw new IllegalArgumentException("latitude and longitude are required");
        }
        LocalDateTime dateTime;
        try {
            dateTime = LocalDateTime.of(req.getYear(), req.getMonth(), req.getDay(),
                    req.getHour(), req.getMinute(), req.getSecond());
        } catch (DateTimeException e) {
            throw new IllegalArgumentException("Invalid date/time: " + e.getMessage(), e);
        }
        // 未指定时区时使用配置的默认时区
        String timezone = StringUtils.hasText(req.getTimezone()) ? req.getTimezone() : defaultTimezone;

        String rid = req.getRequestId();
        log.info("[{}] panchanga start {} tz={} lat={} lon={}", rid, dateTime, timezone,
                req.getLatitude(), req.getLongitude());
        PanchangaResult result = engine.compute(dateTime, req.getLatitude(), req.getLongitude(), timezone);
        log.info("[{}] panchanga done tithi={} nakshatra={} yoga={} karana={} vara={}", rid,
                result.getTithi().getTithi().name(),
                result.getNakshatra().getNakshatra().name(),
                result.getYoga().getYoga().name(),
                result.getKarana().getKarana().name(),
                result.getVara().name());
        return result;
    }
}
