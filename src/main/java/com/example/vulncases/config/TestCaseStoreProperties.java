package com.example.vulncases.config;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the test case table.
 * These values are bound from application.yml (testcases.store.*).
 * The defaults below serve as fallbacks if properties are missing from YAML.
 */
@Component
@ConfigurationProperties(prefix = "testcases.store")
@Validated
@Data
public class TestCaseStoreProperties {

    @NotBlank
    private String tableName = "test_cases";
    private boolean createTableOnStartup = true;
}
