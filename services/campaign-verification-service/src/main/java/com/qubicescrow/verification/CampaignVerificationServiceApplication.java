package com.qubicescrow.verification;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main Spring Boot Application class for the Campaign Verification Service
 * Scores influencer campaign posts for fraud before escrowed payments are released
 */
@SpringBootApplication
public class CampaignVerificationServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(CampaignVerificationServiceApplication.class, args);
    }
}
