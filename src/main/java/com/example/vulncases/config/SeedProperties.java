package com.example.vulncases.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for loading sample test cases at startup (testcases.seed.*).
 * To seed an empty table, set testcases.seed.enabled=true in application.yml.
 */
@Component
@ConfigurationProperties(prefix = "testcases.seed")
@Data
public class SeedProperties {

    private boolean enabled = false;
    private String location = "classpath:sample/test_cases.json";
}
