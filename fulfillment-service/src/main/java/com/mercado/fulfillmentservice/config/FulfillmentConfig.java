package com.mercado.fulfillmentservice.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.retry.annotation.EnableRetry;

import java.time.Clock;

@Configuration
@EnableRetry
@EnableConfigurationProperties(FulfillmentProperties.class)
public class FulfillmentConfig {

    // all "now" values (expiry, backoff, audit timestamps) come from here
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
