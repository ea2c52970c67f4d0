package com.example.vulncases.service;

import com.example.vulncases.access.DuplicateVulnIdException;
import com.example.vulncases.access.TestCaseAccess;
import com.example.vulncases.models.Platform;
import com.example.vulncases.models.TestCase;
import com.example.vulncases.requests.DeleteTestCasesRequest;
import com.example.vulncases.requests.WriteTestCasesRequest;
import com.example.vulncases.validation.TestCaseValidator;
import com.example.vulncases.validation.ValidationResult;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import software.amazon.awssdk.core.exception.SdkException;

/**
 * Orchestrates validation and persistence of test cases. Every element of a write is validated
 * before anything is sent to the store, so a single bad element fails the whole request without
 * side effects.
 */
@Service
@Slf4j
public class TestCaseService {

    private final TestCaseAccess testCaseAccess;
    private final TestCaseValidator validator;

    public TestCaseService(TestCaseAccess testCaseAccess, TestCaseValidator validator) {
        this.testCaseAccess = testCaseAccess;
        this.validator = validator;
    }

    /**
     * @param platform optional filter, matched case-insensitively; null or blank returns all
     */
    public List<TestCase> find(String platform) {
        try {
            if (platform == null || platform.isBlank()) {
                return testCaseAccess.findAll();
            }
            Platform filter = Platform.fromInput(platform)
                    .orElseThrow(() -> TestCaseException.invalidPlatform(platform));
            return testCaseAccess.findByPlatform(filter);
        } catch (SdkException ex) {
            throw TestCaseException.storageUnavailable("read", ex);
        }
    }

    public InsertResult insert(WriteTestCasesRequest request) {
        Objects.requireNonNull(request, "request");
        if (request.items().isEmpty()) {
            throw TestCaseException.invalidPayload("No test cases provided");
        }

        List<TestCase> testCases = validateAll(request, false);
        rejectRepeatedKeys(testCases);

        int inserted;
        try {
            inserted = testCaseAccess.insertAll(testCases);
        } catch (DuplicateVulnIdException ex) {
            log.warn("Rejected insert of {} test cases: vuln_id {} already exists", testCases.size(), ex.getVulnId());
            throw TestCaseException.duplicateVulnId(ex.getVulnId());
        } catch (SdkException ex) {
            throw TestCaseException.storageUnavailable("write", ex);
        }

        log.info("Inserted {} test cases", inserted);
        String vulnId = testCases.size() == 1 ? testCases.get(0).getVulnId() : null;
        return new InsertResult(inserted, vulnId);
    }

    /**
     * Applies each patch independently. Patches carrying nothing but {@code vuln_id} are
     * skipped and counted neither as updated nor as not found.
     */
    public UpdateResult update(WriteTestCasesRequest request) {
        Objects.requireNonNull(request, "request");
        List<TestCase> patches = validateAll(request, true);

        int updated = 0;
        List<String> notFound = new ArrayList<>();
        for (TestCase patch : patches) {
            if (patch.isKeyOnly()) {
                log.debug("Skipping empty patch for {}", patch.getVulnId());
                continue;
            }
            boolean matched;
            try {
                matched = testCaseAccess.update(patch);
            } catch (SdkException ex) {
                throw TestCaseException.storageUnavailable("update", ex);
            }
            if (matched) {
                updated++;
            } else {
                notFound.add(patch.getVulnId());
            }
        }

        log.info("Updated {} test cases, {} not found", updated, notFound.size());
        return new UpdateResult(updated, notFound);
    }

    public int delete(DeleteTestCasesRequest request) {
        Objects.requireNonNull(request, "request");
        int deleted;
        try {
            deleted = testCaseAccess.deleteAll(request.vulnIds());
        } catch (SdkException ex) {
            throw TestCaseException.storageUnavailable("delete", ex);
        }
        log.info("Deleted {} of {} requested test cases", deleted, request.vulnIds().size());
        return deleted;
    }

    private List<TestCase> validateAll(WriteTestCasesRequest request, boolean patch) {
        List<TestCase> valid = new ArrayList<>(request.items().size());
        Map<String, Map<String, List<String>>> errorsByIndex = new LinkedHashMap<>();

        for (int i = 0; i < request.items().size(); i++) {
            ValidationResult result = validator.validateElement(request.items().get(i), patch);
            if (result.isValid()) {
                valid.add(result.testCase());
            } else {
                errorsByIndex.put(String.valueOf(i), result.errorsByField());
            }
        }

        if (!errorsByIndex.isEmpty()) {
            log.info("Rejected {} of {} test cases during validation", errorsByIndex.size(), request.items().size());
            Object details = request.batch() ? errorsByIndex : errorsByIndex.values().iterator().next();
            throw TestCaseException.validationFailed(details);
        }
        return valid;
    }

    // Two puts on the same key cannot share a transaction, so catch this before the store does.
    private static void rejectRepeatedKeys(List<TestCase> testCases) {
        Set<String> seen = new HashSet<>();
        for (TestCase testCase : testCases) {
            if (!seen.add(testCase.getVulnId())) {
                throw TestCaseException.duplicateVulnId(testCase.getVulnId());
            }
        }
    }

    public record InsertResult(int inserted, String vulnId) { }

    public record UpdateResult(int updated, List<String> notFound) {
        public UpdateResult {
            notFound = List.copyOf(notFound);
        }
    }
}
