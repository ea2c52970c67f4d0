package com.example.vulncases.service;

import lombok.Getter;

public class TestCaseException extends RuntimeException {

    public enum Code {
        VALIDATION_FAILED,
        INVALID_PAYLOAD,
        INVALID_PLATFORM,
        DUPLICATE_VULN_ID,
        STORAGE_UNAVAILABLE,
        UNKNOWN
    }

    @Getter
    private final Code code;

    /**
     * Structured detail for the client, e.g. field errors keyed by field or by batch index.
     */
    @Getter
    private final transient Object details;

    private TestCaseException(Code code, String message, Object details, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.details = details;
    }

    public static TestCaseException validationFailed(Object fieldErrors) {
        return new TestCaseException(Code.VALIDATION_FAILED, "Validation failed", fieldErrors, null);
    }

    public static TestCaseException invalidPayload(String message) {
        return new TestCaseException(Code.INVALID_PAYLOAD, message, null, null);
    }

    public static TestCaseException invalidPlatform(String platform) {
        return new TestCaseException(Code.INVALID_PLATFORM,
                "Invalid platform value", "Platform " + platform + " is not one of the supported platforms", null);
    }

    public static TestCaseException duplicateVulnId(String vulnId) {
        return new TestCaseException(Code.DUPLICATE_VULN_ID,
                "Duplicate vuln_id detected", "Test case " + vulnId + " already exists", null);
    }

    public static TestCaseException storageUnavailable(String operation, Throwable cause) {
        return new TestCaseException(Code.STORAGE_UNAVAILABLE,
                "Database " + operation + " error", null, cause);
    }
}
