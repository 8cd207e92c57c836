package com.callexchange.fraud;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Entry point for the call exchange fraud engine. Enables:
 * <ul>
 *   <li>Fraud checks for calls, bids and accounts with a max-of-signals risk score</li>
 *   <li>Smoothed per-entity risk profiles (PostgreSQL) behind a short-lived score cache</li>
 *   <li>Velocity counters (in memory or Redis), an optional ML classifier behind a circuit breaker</li>
 *   <li>REST API and OpenAPI docs at /swagger-ui/index.html</li>
 * </ul>
 */
@SpringBootApplication
public class FraudEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(FraudEngineApplication.class, args);
    }
}
