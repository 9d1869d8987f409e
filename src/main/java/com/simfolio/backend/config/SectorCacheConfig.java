package com.simfolio.backend.config;

import com.simfolio.backend.service.marketdata.SectorCache;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class SectorCacheConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public SectorCache sectorCache(AnalyticsProperties analyticsProperties, Clock clock) {
        return new SectorCache(analyticsProperties.getSectorCacheTtl(), clock);
    }
}
