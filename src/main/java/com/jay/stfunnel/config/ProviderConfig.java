package com.jay.stfunnel.config;

import com.jay.stfunnel.layer1_data.RateLimiter;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ProviderConfig {

    /** Shared by every market-data call in this process. */
    @Bean
    public RateLimiter marketDataRateLimiter(FunnelConfig config) {
        return new RateLimiter(config.tier1().getConcurrency(), config.tier1().getMinRequestSpacingMs());
    }
}
