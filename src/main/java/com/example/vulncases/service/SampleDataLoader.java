package com.example.vulncases.service;

import com.example.vulncases.access.DuplicateVulnIdException;
import com.example.vulncases.access.TestCaseAccess;
import com.example.vulncases.config.SeedProperties;
import com.example.vulncases.requests.WriteTestCasesRequest;
import com.example.vulncases.validation.TestCaseValidator;
import com.example.vulncases.validation.ValidationResult;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.annotation.Order;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

/**
 * Seeds the table from a {@code {"test_cases": [...]}} document once the table exists.
 * Unlike the API, seeding is best effort: invalid or already present entries are skipped and
 * the rest are still written.
 */
@Component
@Order(1)
@Slf4j
public class SampleDataLoader implements ApplicationRunner {

    private final SeedProperties properties;
    private final ResourceLoader resourceLoader;
    private final TestCaseValidator validator;
    private final TestCaseAccess testCaseAccess;
    private final ObjectMapper objectMapper;

    public SampleDataLoader(SeedProperties properties,
                            ResourceLoader resourceLoader,
                            TestCaseValidator validator,
                            TestCaseAccess testCaseAccess,
                            ObjectMapper objectMapper) {
        this.properties = properties;
        this.resourceLoader = resourceLoader;
        this.validator = validator;
        this.testCaseAccess = testCaseAccess;
        this.objectMapper = objectMapper;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.isEnabled()) {
            return;
        }
        load(properties.getLocation());
    }

    public SeedResult load(String location) {
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            log.warn("Sample file not found: {}", location);
            return new SeedResult(0, 0, 0);
        }

        JsonNode root;
        try (InputStream in = resource.getInputStream()) {
            root = objectMapper.readTree(in);
        } catch (IOException ex) {
            throw new UncheckedIOException("Unable to read sample file " + location, ex);
        }

        JsonNode entries = root.path(WriteTestCasesRequest.TEST_CASES);
        int inserted = 0;
        int invalid = 0;
        int duplicates = 0;
        for (JsonNode entry : entries) {
            if (!entry.isObject() || !entry.hasNonNull(TestCaseValidator.VULN_ID)) {
                invalid++;
                continue;
            }
            Map<String, Object> raw = objectMapper.convertValue(entry, new TypeReference<Map<String, Object>>() {
            });
            ValidationResult result = validator.validate(raw);
            if (!result.isValid()) {
                log.warn("Skipping sample test case {}: {}", raw.get(TestCaseValidator.VULN_ID), result.errorsByField());
                invalid++;
                continue;
            }
            try {
                testCaseAccess.insertAll(List.of(result.testCase()));
                inserted++;
            } catch (DuplicateVulnIdException ex) {
                log.warn("Sample test case {} already present", ex.getVulnId());
                duplicates++;
            }
        }

        log.info("Sample load from {} complete: inserted={}, invalid={}, duplicates={}",
                location, inserted, invalid, duplicates);
        return new SeedResult(inserted, invalid, duplicates);
    }

    public record SeedResult(int inserted, int invalid, int duplicates) { }
}
