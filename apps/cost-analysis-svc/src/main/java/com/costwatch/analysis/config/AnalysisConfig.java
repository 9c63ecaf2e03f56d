package com.costwatch.analysis.config;

import com.costwatch.analysis.cache.FingerprintCache;
import com.costwatch.analysis.forecast.ForecastReport;
import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class AnalysisConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public FingerprintCache<ForecastReport> forecastCache(CostwatchProperties properties, Clock clock) {
        CostwatchProperties.Cache cache = properties.cache();
        return new FingerprintCache<>(cache.ttl(), cache.maxEntries(), clock);
    }
}
