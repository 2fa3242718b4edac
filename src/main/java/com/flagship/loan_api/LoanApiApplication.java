package com.flagship.loan_api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Entry point for the loan API.
 *
 * Serves loans and loan payments from an in-memory store over GraphQL
 * (/graphql) and REST (/loan-payments).
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class LoanApiApplication {

    public static void main(String[] args) {
        SpringApplication.run(LoanApiApplication.class, args);
    }
}
