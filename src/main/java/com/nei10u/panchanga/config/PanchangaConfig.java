package com.nei10u.panchanga.config;

import com.nei10u.panchanga.ephemeris.AnalyticEphemerisProvider;
import com.nei10u.panchanga.ephemeris.LunarTimeProvider;
import com.nei10u.panchanga.ephemeris.SiderealMode;
import com.nei10u.panchanga.ephemeris.TimeProvider;
import com.nei10u.panchanga.service.PanchangaEngine;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 星历与排盘引擎的装配。岁差体系作为构造参数传入，不做任何进程级全局设置。
 */
@Configuration
public class PanchangaConfig {

    @Value("${panchanga.sidereal-mode:LAHIRI}")
    private String siderealMode;

    @Bean
    public TimeProvider timeProvider() {
        return new LunarTimeProvider();
    }

    @Bean(destroyMethod = "close")
    public PanchangaEngine panchangaEngine(TimeProvider timeProvider) {
        SiderealMode mode = SiderealMode.fromName(siderealMode);
        return new PanchangaEngine(new AnalyticEphemerisProvider(mode), timeProvider);
    }
}
