package com.flagship.loan_api.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Cross-origin settings for browser clients ({@code loan-api.cors.*}).
 */
@Data
@ConfigurationProperties(prefix = "loan-api.cors")
public class CorsProperties {

    /**
     * Origins allowed to call the API. Empty disables CORS.
     */
    private List<String> allowedOrigins = new ArrayList<>();
}
