package com.flagship.fraud_decisions;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class FraudDecisionIngestionApplication {

    public static void main(String[] args) {
        SpringApplication.run(FraudDecisionIngestionApplication.class, args);
    }
}
