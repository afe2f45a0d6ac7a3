package com.mercado.fulfillmentservice;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

// com.mercado.common contributes the shared JacksonConfig
@SpringBootApplication(scanBasePackages = {"com.mercado.fulfillmentservice", "com.mercado.common"})
public class FulfillmentServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(FulfillmentServiceApplication.class, args);
    }
}
