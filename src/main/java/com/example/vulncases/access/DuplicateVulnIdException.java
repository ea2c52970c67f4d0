package com.example.vulncases.access;

import lombok.Getter;

/**
 * Raised by {@link TestCaseAccess} when the store rejects a write because the key is taken.
 */
public class DuplicateVulnIdException extends RuntimeException {

    @Getter
    private final String vulnId;

    public DuplicateVulnIdException(String vulnId, Throwable cause) {
        super("vuln_id " + vulnId + " already exists", cause);
        this.vulnId = vulnId;
    }
}
