package com.mercado.fulfillmentservice.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

// integration tests switch this off and drive the sweeps by hand
@Configuration
@EnableScheduling
@ConditionalOnProperty(prefix = "fulfillment.scheduling", name = "enabled", havingValue = "true", matchIfMissing = true)
public class SchedulingConfig {
}
